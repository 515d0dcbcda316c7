package com.videosum.service;

import com.videosum.exception.InvalidJobStateException;
import com.videosum.exception.ResourceNotFoundException;
import com.videosum.model.JobStatus;
import com.videosum.model.QueueJob;
import com.videosum.model.QueueJobInput;
import com.videosum.model.QueueState;
import com.videosum.queue.ProcessingLoop;
import com.videosum.queue.QueueEventBus;
import com.videosum.queue.QueueStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * User-facing queue actions: submit, reprocess, cancel or remove, retry, sweep.
 */
@Service
@Slf4j
public class QueueService {

    static final String TRANSCRIPT_FILE = "transcript.txt";

    private final QueueStore queueStore;
    private final ProcessingLoop processingLoop;
    private final QueueEventBus eventBus;
    private final UploadStorageService uploadStorageService;
    private final ValidationService validationService;
    private final SettingsService settingsService;
    private final boolean autoStart;

    public QueueService(QueueStore queueStore,
                        ProcessingLoop processingLoop,
                        QueueEventBus eventBus,
                        UploadStorageService uploadStorageService,
                        ValidationService validationService,
                        SettingsService settingsService,
                        @Value("${videosum.queue.auto-start:true}") boolean autoStart) {
        this.queueStore = queueStore;
        this.processingLoop = processingLoop;
        this.eventBus = eventBus;
        this.uploadStorageService = uploadStorageService;
        this.validationService = validationService;
        this.settingsService = settingsService;
        this.autoStart = autoStart;
    }

    /**
     * Resumes jobs recovered from a previous run without waiting for a client to connect.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (autoStart) {
            startIfPending();
        }
    }

    public QueueState getState() {
        return queueStore.load();
    }

    public QueueJob getJob(String id) {
        return queueStore.get(id).orElseThrow(() -> ResourceNotFoundException.job(id));
    }

    /**
     * Stores the uploaded videos, queues one job per file in upload order and starts the loop.
     */
    public List<QueueJob> submit(List<MultipartFile> files, String group) {
        validationService.validateUploads(files);
        validationService.validateGroup(group);

        List<QueueJobInput> inputs = new ArrayList<>();
        try {
            for (MultipartFile file : files) {
                inputs.add(uploadStorageService.store(file, group));
            }
        } catch (RuntimeException e) {
            inputs.forEach(input -> FileUtils.deleteQuietly(new File(input.getSourcePath())));
            throw e;
        }

        List<QueueJob> added = queueStore.add(inputs);
        processingLoop.start();
        return added;
    }

    /**
     * Queues regeneration of an existing notes folder from its transcript.
     */
    public QueueJob reprocess(String folderId) {
        validationService.validateFolderId(folderId);

        Path folder = settingsService.getNotesDirectory().resolve(folderId);
        if (!Files.isDirectory(folder)) {
            throw ResourceNotFoundException.notesFolder(folderId);
        }
        if (!Files.isRegularFile(folder.resolve(TRANSCRIPT_FILE))) {
            throw new IllegalArgumentException("Transcript not found - cannot reprocess " + folderId);
        }

        QueueJob job = queueStore.addReprocess(folderId, folder.toAbsolutePath().toString());
        processingLoop.start();
        return job;
    }

    /**
     * Cancels the job if it is the one being processed, otherwise removes it from the queue.
     *
     * @return "cancelled" or "removed"
     */
    public String cancelOrRemove(String id) {
        QueueJob job = getJob(id);

        if (job.getStatus() == JobStatus.PROCESSING
                && processingLoop.getCurrentJobId().filter(id::equals).isPresent()
                && processingLoop.cancelCurrent()) {
            return "cancelled";
        }

        if (!queueStore.remove(id)) {
            throw ResourceNotFoundException.job(id);
        }
        log.info("Removed job {} ({}) from the queue", id, job.getOriginalName());
        eventBus.broadcastState();
        return "removed";
    }

    /**
     * Puts a failed or cancelled job back to pending.
     */
    public QueueJob retry(String id) {
        QueueJob job = getJob(id);
        if (!job.getStatus().isRetryable()) {
            throw new InvalidJobStateException("Only failed or cancelled jobs can be retried");
        }

        QueueJob retried = queueStore.update(id, item -> {
            item.setStatus(JobStatus.PENDING);
            item.setStartedAt(null);
            item.setCompletedAt(null);
            item.setError(null);
            item.setProgress(null);
        }).orElseThrow(() -> ResourceNotFoundException.job(id));

        log.info("Retrying job {} ({})", id, job.getOriginalName());
        processingLoop.start();
        eventBus.broadcastState();
        return retried;
    }

    public int clearCompleted() {
        int cleared = queueStore.clearCompleted();
        eventBus.broadcastState();
        return cleared;
    }

    public void startIfPending() {
        if (queueStore.nextPending().isPresent()) {
            processingLoop.start();
        }
    }
}
