package com.videosum.queue;

import com.videosum.model.JobProgress;
import com.videosum.model.JobStatus;
import com.videosum.model.QueueEvent;
import com.videosum.model.QueueJob;
import com.videosum.service.WorkerProcessRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the queue one job at a time.
 *
 * There is exactly one loop per application (a Spring singleton running on a single-thread
 * executor). While idle it re-checks the queue every poll interval; while busy it waits for
 * the worker of the current job. A failing job is recorded and the loop moves on.
 */
@Component
@Slf4j
public class ProcessingLoop {

    private final QueueStore queueStore;
    private final QueueEventBus eventBus;
    private final WorkerProcessRunner workerRunner;
    private final Executor loopExecutor;
    private final long pollIntervalMs;
    private final long cancelGracePeriodMs;

    private final Object idleMonitor = new Object();
    private final Object cancelLock = new Object();

    // one flag per started loop, so a stop() followed by start() never revives the old loop
    private AtomicBoolean activeFlag;
    private CompletableFuture<Void> loopFuture;

    private volatile String currentJobId;
    private volatile Process currentProcess;
    private volatile String cancelledJobId;

    public ProcessingLoop(QueueStore queueStore,
                          QueueEventBus eventBus,
                          WorkerProcessRunner workerRunner,
                          @Qualifier("queueLoopExecutor") Executor loopExecutor,
                          @Value("${videosum.queue.poll-interval-ms:1000}") long pollIntervalMs,
                          @Value("${videosum.worker.cancel-grace-period-ms:10000}") long cancelGracePeriodMs) {
        this.queueStore = queueStore;
        this.eventBus = eventBus;
        this.workerRunner = workerRunner;
        this.loopExecutor = loopExecutor;
        this.pollIntervalMs = pollIntervalMs;
        this.cancelGracePeriodMs = cancelGracePeriodMs;
    }

    /**
     * Starts the loop in the background. Does nothing if it is already running.
     */
    public synchronized void start() {
        if (activeFlag != null && activeFlag.get()) {
            log.debug("Processing loop already running, skipping start");
            return;
        }
        log.info("Starting processing loop");
        AtomicBoolean flag = new AtomicBoolean(true);
        activeFlag = flag;
        loopFuture = CompletableFuture.runAsync(() -> processLoop(flag), loopExecutor);
    }

    /**
     * Asks the loop to end and waits until its current iteration is over.
     * A job that is running is allowed to finish first.
     */
    public void stop() {
        CompletableFuture<Void> future;
        synchronized (this) {
            if (activeFlag != null) {
                activeFlag.set(false);
            }
            future = loopFuture;
            loopFuture = null;
        }
        synchronized (idleMonitor) {
            idleMonitor.notifyAll();
        }
        if (future != null) {
            future.join();
        }
    }

    /**
     * Terminates the worker of the current job and marks the job cancelled.
     * The loop then continues with the next pending job.
     *
     * @return true if a job was cancelled
     */
    public boolean cancelCurrent() {
        QueueJob cancelled;
        synchronized (cancelLock) {
            String jobId = currentJobId;
            if (jobId == null) {
                return false;
            }
            cancelledJobId = jobId;
            Process process = currentProcess;
            if (process != null) {
                terminate(jobId, process);
            }
            cancelled = queueStore.update(jobId, job -> {
                if (job.getStatus() == JobStatus.PROCESSING) {
                    job.setStatus(JobStatus.CANCELLED);
                    job.setCompletedAt(Instant.now());
                }
            }).filter(job -> job.getStatus() == JobStatus.CANCELLED).orElse(null);
        }

        log.info("Cancelled job {}", cancelled != null ? cancelled.getId() : cancelledJobId);
        if (cancelled != null) {
            eventBus.emit(QueueEvent.jobCancelled(cancelled));
        }
        eventBus.broadcastState();
        return true;
    }

    public Optional<String> getCurrentJobId() {
        return Optional.ofNullable(currentJobId);
    }

    public synchronized boolean isRunning() {
        return activeFlag != null && activeFlag.get();
    }

    public boolean isCurrentlyProcessing() {
        return isRunning() && currentJobId != null;
    }

    private void processLoop(AtomicBoolean active) {
        log.info("Processing loop started");
        try {
            while (active.get()) {
                try {
                    Optional<QueueJob> next = queueStore.nextPending();
                    if (next.isEmpty()) {
                        waitIdle(active);
                        continue;
                    }
                    log.info("Processing job {} ({})", next.get().getId(), next.get().getOriginalName());
                    processJob(next.get());
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    log.error("Processing loop iteration failed: {}", e.getMessage(), e);
                    waitIdle(active);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            active.set(false);
            log.warn("Processing loop interrupted, leaving the current job for recovery on next start");
            return;
        }

        log.info("Processing loop ended");
        try {
            queueStore.setProcessingFlag(false, null);
            eventBus.broadcastState();
        } catch (RuntimeException e) {
            log.error("Could not clear the processing flag: {}", e.getMessage(), e);
        }
    }

    private void waitIdle(AtomicBoolean active) throws InterruptedException {
        synchronized (idleMonitor) {
            if (active.get()) {
                idleMonitor.wait(pollIntervalMs);
            }
        }
    }

    private void processJob(QueueJob pending) throws InterruptedException {
        Optional<QueueJob> claim = queueStore.claim(pending.getId());
        if (claim.isEmpty()) {
            log.info("Job {} was changed before it could be claimed, skipping", pending.getId());
            return;
        }
        QueueJob job = claim.get();
        currentJobId = job.getId();
        eventBus.broadcastState();

        boolean interrupted = false;
        try {
            String resultRef = workerRunner.run(job, this::attachProcess, progress -> recordProgress(job, progress));
            if (wasCancelled(job)) {
                log.info("Job {} finished after it was cancelled, keeping it cancelled", job.getId());
            } else {
                complete(job, resultRef);
            }
        } catch (InterruptedException e) {
            interrupted = true;
            throw e;
        } catch (Exception e) {
            if (wasCancelled(job)) {
                log.info("Worker for cancelled job {} ended: {}", job.getId(), e.getMessage());
            } else {
                fail(job, e);
            }
        } finally {
            synchronized (cancelLock) {
                currentJobId = null;
                currentProcess = null;
                cancelledJobId = null;
            }
            if (!interrupted) {
                queueStore.setProcessingFlag(false, null);
                eventBus.broadcastState();
            }
        }
    }

    private void attachProcess(Process process) {
        synchronized (cancelLock) {
            currentProcess = process;
            // cancelled between claim and spawn
            if (currentJobId != null && currentJobId.equals(cancelledJobId)) {
                terminate(currentJobId, process);
            }
        }
    }

    private boolean wasCancelled(QueueJob job) {
        return job.getId().equals(cancelledJobId);
    }

    private void recordProgress(QueueJob job, JobProgress progress) {
        if (wasCancelled(job)) {
            return;
        }
        Optional<QueueJob> updated = queueStore.update(job.getId(), item -> item.setProgress(progress));
        updated.ifPresent(item -> eventBus.emit(QueueEvent.progress(item, progress)));
    }

    private void complete(QueueJob job, String resultRef) {
        // a cancel may land after the worker returned; the store decides which terminal state wins
        Optional<QueueJob> completed = queueStore.update(job.getId(), item -> {
            if (item.getStatus() == JobStatus.PROCESSING) {
                item.setStatus(JobStatus.COMPLETED);
                item.setCompletedAt(Instant.now());
                item.setResultRef(resultRef);
                item.setError(null);
            }
        }).filter(item -> item.getStatus() == JobStatus.COMPLETED);

        if (completed.isEmpty()) {
            log.info("Job {} left processing before its result was recorded, keeping its status", job.getId());
            return;
        }
        log.info("Completed job {} ({}), result: {}", job.getId(), job.getOriginalName(), resultRef);
        eventBus.emit(QueueEvent.jobComplete(completed.get(), resultRef));
    }

    private void fail(QueueJob job, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : "Unknown error";
        log.error("Job {} ({}) failed: {}", job.getId(), job.getOriginalName(), message);
        Optional<QueueJob> failed = queueStore.update(job.getId(), item -> {
            if (item.getStatus() == JobStatus.PROCESSING) {
                item.setStatus(JobStatus.FAILED);
                item.setCompletedAt(Instant.now());
                item.setError(message);
            }
        }).filter(item -> item.getStatus() == JobStatus.FAILED);
        failed.ifPresent(item -> eventBus.emit(QueueEvent.jobFailed(item, message)));
    }

    /**
     * Sends SIGTERM to the worker and its children; kills them if they are still alive after the grace period.
     */
    private void terminate(String jobId, Process process) {
        log.info("Terminating worker of job {} (pid {})", jobId, process.pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        process.onExit()
                .completeOnTimeout(null, cancelGracePeriodMs, TimeUnit.MILLISECONDS)
                .thenAccept(exited -> {
                    if (process.isAlive()) {
                        log.warn("Worker of job {} ignored termination for {} ms, killing it", jobId, cancelGracePeriodMs);
                        process.descendants().forEach(ProcessHandle::destroyForcibly);
                        process.destroyForcibly();
                    }
                });
    }
}
