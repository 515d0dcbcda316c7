package com.videosum.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.videosum.exception.QueueStoreException;
import com.videosum.model.JobStatus;
import com.videosum.model.QueueJob;
import com.videosum.model.QueueJobInput;
import com.videosum.model.QueueState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Durable queue backed by a single JSON document.
 *
 * Every operation re-reads the file, applies its change and rewrites the whole document.
 * Calls are serialized inside this JVM; two processes sharing the same file are not
 * coordinated and the last write wins.
 */
@Component
@Slf4j
public class QueueStore {

    private final ObjectMapper objectMapper;
    private final Path queueFile;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Job claimed by the processing loop of this JVM and not yet released.
     * Any other job found in PROCESSING on load was left behind by a dead process.
     */
    private volatile String claimedJobId;

    public QueueStore(ObjectMapper objectMapper,
                      @Value("${videosum.queue.file}") String queueFile) {
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.queueFile = Paths.get(queueFile);
        log.info("Queue document: {}", this.queueFile.toAbsolutePath());
    }

    /**
     * Reads the queue document. Never throws: a missing or unreadable document is an empty queue.
     */
    public QueueState load() {
        lock.lock();
        try {
            return read();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically replaces the queue document with the given state.
     */
    public void save(QueueState state) {
        lock.lock();
        try {
            write(state);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends one pending job per input, in the order given.
     */
    public List<QueueJob> add(List<QueueJobInput> inputs) {
        lock.lock();
        try {
            QueueState state = read();
            List<QueueJob> created = new ArrayList<>();
            for (QueueJobInput input : inputs) {
                QueueJob job = newPendingJob(input.getSourcePath(), input.getOriginalName());
                job.setSizeBytes(input.getSizeBytes());
                job.setGroup(input.getGroup());
                created.add(job);
            }
            state.getItems().addAll(created);
            write(state);
            log.info("Added {} job(s) to the queue", created.size());
            return created;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues a job that regenerates the notes of an already processed video.
     * The worker reuses the folder's transcript, so nothing is uploaded.
     */
    public QueueJob addReprocess(String folderId, String folderPath) {
        lock.lock();
        try {
            QueueState state = read();
            QueueJob job = newPendingJob(folderPath, folderId);
            job.setReprocess(true);
            state.getItems().add(job);
            write(state);
            log.info("Added reprocess job {} for folder {}", job.getId(), folderId);
            return job;
        } finally {
            lock.unlock();
        }
    }

    public Optional<QueueJob> update(String id, Consumer<QueueJob> patch) {
        lock.lock();
        try {
            QueueState state = read();
            Optional<QueueJob> job = find(state, id);
            if (job.isEmpty()) {
                return Optional.empty();
            }
            patch.accept(job.get());
            enforceProgressInvariant(job.get());
            write(state);
            return job;
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(String id) {
        lock.lock();
        try {
            QueueState state = read();
            boolean removed = state.getItems().removeIf(job -> id.equals(job.getId()));
            if (!removed) {
                return false;
            }
            write(state);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<QueueJob> nextPending() {
        return load().getItems().stream()
                .filter(job -> job.getStatus() == JobStatus.PENDING)
                .findFirst();
    }

    public Optional<QueueJob> get(String id) {
        return find(load(), id);
    }

    /**
     * Removes every completed job and keeps the others in their order.
     *
     * @return number of jobs removed
     */
    public int clearCompleted() {
        lock.lock();
        try {
            QueueState state = read();
            int before = state.getItems().size();
            state.getItems().removeIf(job -> job.getStatus() == JobStatus.COMPLETED);
            write(state);
            int cleared = before - state.getItems().size();
            log.info("Cleared {} completed job(s)", cleared);
            return cleared;
        } finally {
            lock.unlock();
        }
    }

    public void setProcessingFlag(boolean processing, String jobId) {
        lock.lock();
        try {
            QueueState state = read();
            state.setProcessing(processing);
            state.setCurrentJobId(processing ? jobId : null);
            claimedJobId = processing ? jobId : null;
            write(state);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a pending job to PROCESSING and records it as the current job in one write.
     *
     * @return the claimed job, or empty if it was removed or is no longer pending
     */
    public Optional<QueueJob> claim(String id) {
        lock.lock();
        try {
            QueueState state = read();
            Optional<QueueJob> job = find(state, id)
                    .filter(candidate -> candidate.getStatus() == JobStatus.PENDING);
            if (job.isEmpty()) {
                return Optional.empty();
            }
            QueueJob claimed = job.get();
            claimed.setStatus(JobStatus.PROCESSING);
            claimed.setStartedAt(Instant.now());
            claimed.setProgress(null);
            state.setProcessing(true);
            state.setCurrentJobId(id);
            claimedJobId = id;
            write(state);
            return job;
        } finally {
            lock.unlock();
        }
    }

    Path getQueueFile() {
        return queueFile;
    }

    private QueueJob newPendingJob(String sourcePath, String originalName) {
        QueueJob job = new QueueJob();
        job.setId(UUID.randomUUID().toString());
        job.setSourcePath(sourcePath);
        job.setOriginalName(originalName);
        job.setStatus(JobStatus.PENDING);
        job.setCreatedAt(Instant.now());
        return job;
    }

    private Optional<QueueJob> find(QueueState state, String id) {
        return state.getItems().stream()
                .filter(job -> id.equals(job.getId()))
                .findFirst();
    }

    private QueueState read() {
        if (!Files.exists(queueFile)) {
            return QueueState.empty();
        }
        QueueState state;
        try {
            state = objectMapper.readValue(queueFile.toFile(), QueueState.class);
        } catch (IOException | RuntimeException e) {
            log.warn("Queue document {} is unreadable, starting with an empty queue: {}",
                    queueFile, e.getMessage());
            return QueueState.empty();
        }
        if (state == null) {
            return QueueState.empty();
        }
        if (state.getItems() == null) {
            state.setItems(new ArrayList<>());
        }
        state.getItems().removeIf(job -> job == null || job.getId() == null);
        if (recover(state)) {
            try {
                write(state);
            } catch (QueueStoreException e) {
                log.warn("Could not persist recovered queue state: {}", e.getMessage());
            }
        }
        state.setLastUpdated(Instant.now());
        return state;
    }

    /**
     * Requeues jobs stuck in PROCESSING whose owner is gone.
     *
     * @return true if any job was requeued
     */
    private boolean recover(QueueState state) {
        String owner = claimedJobId;
        boolean ownerStillProcessing = false;
        boolean requeued = false;
        for (QueueJob job : state.getItems()) {
            if (job.getStatus() != JobStatus.PROCESSING) {
                continue;
            }
            if (owner != null && owner.equals(job.getId())) {
                ownerStillProcessing = true;
                continue;
            }
            log.info("Requeueing job {} ({}) left in processing by a previous run",
                    job.getId(), job.getOriginalName());
            job.setStatus(JobStatus.PENDING);
            job.setStartedAt(null);
            job.setProgress(null);
            requeued = true;
        }
        if (ownerStillProcessing) {
            state.setProcessing(true);
            state.setCurrentJobId(owner);
        } else {
            state.setProcessing(false);
            state.setCurrentJobId(null);
        }
        return requeued;
    }

    private void enforceProgressInvariant(QueueJob job) {
        if (job.getStatus() != JobStatus.PROCESSING) {
            job.setProgress(null);
        }
    }

    private void write(QueueState state) {
        state.setLastUpdated(Instant.now());
        Path tempFile = null;
        try {
            Path dir = queueFile.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tempFile = Files.createTempFile(dir, queueFile.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tempFile.toFile(), state);
            try {
                Files.move(tempFile, queueFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, queueFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (tempFile != null) {
                try {
                    Files.deleteIfExists(tempFile);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new QueueStoreException("Failed to write queue document " + queueFile, e);
        }
    }
}
