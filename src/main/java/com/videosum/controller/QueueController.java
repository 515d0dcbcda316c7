package com.videosum.controller;

import com.videosum.model.QueueJob;
import com.videosum.model.QueueState;
import com.videosum.service.QueueEventStreamService;
import com.videosum.service.QueueService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/queue")
@Slf4j
public class QueueController {

    private final QueueService queueService;
    private final QueueEventStreamService eventStreamService;

    public QueueController(QueueService queueService, QueueEventStreamService eventStreamService) {
        this.queueService = queueService;
        this.eventStreamService = eventStreamService;
    }

    /**
     * Current queue state
     */
    @GetMapping
    public ResponseEntity<QueueState> getQueue() {
        return ResponseEntity.ok(queueService.getState());
    }

    /**
     * Submit one or more videos (multipart field "files"), optionally into a folder
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> submit(@RequestParam(value = "files", required = false) List<MultipartFile> files,
                                                      @RequestParam(value = "folder", required = false) String folder) {
        log.info("Received {} file(s) for processing, folder: {}", files == null ? 0 : files.size(), folder);

        List<QueueJob> added = queueService.submit(files, folder);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "added", added.size(),
                "items", added
        ));
    }

    /**
     * Remove all completed jobs
     */
    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clearCompleted() {
        int cleared = queueService.clearCompleted();
        return ResponseEntity.ok(Map.of("success", true, "cleared", cleared));
    }

    @GetMapping("/{id}")
    public ResponseEntity<QueueJob> getJob(@PathVariable String id) {
        return ResponseEntity.ok(queueService.getJob(id));
    }

    /**
     * Cancel the job if it is running, otherwise remove it
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> cancelOrRemove(@PathVariable String id) {
        String action = queueService.cancelOrRemove(id);
        log.info("Job {} {}", id, action);
        return ResponseEntity.ok(Map.of("success", true, "action", action));
    }

    /**
     * Retry a failed or cancelled job
     */
    @PatchMapping("/{id}")
    public ResponseEntity<Map<String, Object>> retry(@PathVariable String id) {
        queueService.retry(id);
        return ResponseEntity.ok(Map.of("success", true, "action", "retried"));
    }

    /**
     * Regenerate the notes of an existing folder from its transcript
     */
    @PostMapping("/reprocess/{folderId}")
    public ResponseEntity<Map<String, Object>> reprocess(@PathVariable String folderId) {
        QueueJob job = queueService.reprocess(folderId);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "item", Map.of("id", job.getId(), "status", job.getStatus())
        ));
    }

    /**
     * Live queue updates as Server-Sent Events
     */
    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        SseEmitter emitter = eventStreamService.connect();
        queueService.startIfPending();
        return emitter;
    }
}
