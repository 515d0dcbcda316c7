package com.videosum.controller;

import com.videosum.model.JobStatus;
import com.videosum.model.QueueJob;
import com.videosum.queue.ProcessingLoop;
import com.videosum.service.QueueEventStreamService;
import com.videosum.service.QueueService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Liveness check for the desktop shell, which polls it until the queue service is up.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final ProcessingLoop processingLoop;
    private final QueueService queueService;
    private final QueueEventStreamService eventStreamService;

    public HealthController(ProcessingLoop processingLoop,
                            QueueService queueService,
                            QueueEventStreamService eventStreamService) {
        this.processingLoop = processingLoop;
        this.queueService = queueService;
        this.eventStreamService = eventStreamService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        List<QueueJob> items = queueService.getState().getItems();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("timestamp", Instant.now().toString());
        body.put("loopRunning", processingLoop.isRunning());
        body.put("currentJobId", processingLoop.getCurrentJobId().orElse(null));
        body.put("pending", items.stream().filter(job -> job.getStatus() == JobStatus.PENDING).count());
        body.put("observers", eventStreamService.getConnectionCount());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok("pong");
    }
}
