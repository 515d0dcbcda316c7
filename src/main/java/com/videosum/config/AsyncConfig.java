package com.videosum.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableScheduling
public class AsyncConfig {

    @Bean(name = "queueLoopExecutor")
    public Executor queueLoopExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);  // one job at a time, ever
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1); // a restarted loop waits for the old one to finish
        executor.setThreadNamePrefix("queue-loop-");
        executor.initialize();
        return executor;
    }
}
