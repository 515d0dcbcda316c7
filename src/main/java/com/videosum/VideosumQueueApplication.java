package com.videosum;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideosumQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(VideosumQueueApplication.class, args);
    }
}
