package com.videosum.queue;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.videosum.exception.WorkerProcessException;
import com.videosum.model.JobProgress;
import com.videosum.model.JobStatus;
import com.videosum.model.QueueEvent;
import com.videosum.model.QueueEventType;
import com.videosum.model.QueueJob;
import com.videosum.model.QueueJobInput;
import com.videosum.service.WorkerProcessRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProcessingLoopTest {

    @TempDir
    Path tempDir;

    private QueueStore store;
    private QueueEventBus bus;
    private WorkerProcessRunner workerRunner;
    private ExecutorService executor;
    private ProcessingLoop loop;
    private final List<QueueEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        store = new QueueStore(JsonMapper.builder().findAndAddModules().build(),
                tempDir.resolve("queue.json").toString());
        bus = new QueueEventBus(store);
        bus.subscribe(events::add);
        workerRunner = mock(WorkerProcessRunner.class);
        executor = Executors.newSingleThreadExecutor();
        loop = new ProcessingLoop(store, bus, workerRunner, executor, 20, 500);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
        executor.shutdownNow();
    }

    private QueueJob enqueue(String name) {
        return store.add(List.of(new QueueJobInput("/tmp/" + name, name, 100, null))).get(0);
    }

    private JobStatus statusOf(QueueJob job) {
        return store.get(job.getId()).map(QueueJob::getStatus).orElse(null);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 10 seconds");
            }
            Thread.sleep(20);
        }
    }

    private List<QueueEventType> eventTypes() {
        return events.stream().map(QueueEvent::getType).toList();
    }

    @Test
    void completesPendingJob() throws Exception {
        when(workerRunner.run(any(), any(), any())).thenReturn("2024-01-01 - Lecture");
        QueueJob job = enqueue("lecture.mp4");

        loop.start();
        await(() -> statusOf(job) == JobStatus.COMPLETED);

        QueueJob completed = store.get(job.getId()).orElseThrow();
        assertThat(completed.getResultRef()).isEqualTo("2024-01-01 - Lecture");
        assertThat(completed.getStartedAt()).isNotNull();
        assertThat(completed.getCompletedAt()).isNotNull();
        assertThat(completed.getError()).isNull();
        await(() -> loop.getCurrentJobId().isEmpty());
        assertThat(events).filteredOn(event -> event.getType() == QueueEventType.JOB_COMPLETE)
                .singleElement()
                .satisfies(event -> assertThat(event.getResultRef()).isEqualTo("2024-01-01 - Lecture"));
    }

    @Test
    void forwardsWorkerProgress() throws Exception {
        JobProgress reported = new JobProgress("transcribing", "Transcribing audio");
        when(workerRunner.run(any(), any(), any())).thenAnswer(invocation -> {
            Consumer<JobProgress> onProgress = invocation.getArgument(2);
            onProgress.accept(reported);
            return "ref";
        });
        QueueJob job = enqueue("lecture.mp4");

        loop.start();
        await(() -> statusOf(job) == JobStatus.COMPLETED);

        assertThat(events).filteredOn(event -> event.getType() == QueueEventType.PROGRESS)
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getProgress()).isEqualTo(reported);
                    assertThat(event.getJob().getId()).isEqualTo(job.getId());
                });
        assertThat(store.get(job.getId()).orElseThrow().getProgress()).isNull();
    }

    @Test
    void failedJobDoesNotStopTheLoop() throws Exception {
        when(workerRunner.run(any(), any(), any()))
                .thenThrow(new WorkerProcessException("bad codec"))
                .thenReturn("ref");
        QueueJob first = enqueue("broken.mp4");
        QueueJob second = enqueue("fine.mp4");

        loop.start();
        await(() -> eventTypes().contains(QueueEventType.JOB_COMPLETE));

        QueueJob failed = store.get(first.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getError()).isEqualTo("bad codec");
        assertThat(failed.getCompletedAt()).isNotNull();
        assertThat(eventTypes()).containsSubsequence(QueueEventType.JOB_FAILED, QueueEventType.JOB_COMPLETE);
    }

    @Test
    void startingTwiceRunsEachJobOnce() throws Exception {
        when(workerRunner.run(any(), any(), any())).thenReturn("ref");
        QueueJob first = enqueue("a.mp4");
        QueueJob second = enqueue("b.mp4");

        loop.start();
        loop.start();
        await(() -> statusOf(first) == JobStatus.COMPLETED && statusOf(second) == JobStatus.COMPLETED);

        verify(workerRunner, times(2)).run(any(), any(), any());
        assertThat(loop.isRunning()).isTrue();
    }

    @Test
    void picksUpJobsAddedWhileIdle() throws Exception {
        when(workerRunner.run(any(), any(), any())).thenReturn("ref");
        loop.start();
        Thread.sleep(100);

        QueueJob job = enqueue("late.mp4");

        await(() -> statusOf(job) == JobStatus.COMPLETED);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void cancellingTerminatesWorkerAndMovesOn() throws Exception {
        QueueJob slow = enqueue("slow.mp4");
        QueueJob next = enqueue("next.mp4");
        when(workerRunner.run(any(), any(), any())).thenAnswer(invocation -> {
            QueueJob job = invocation.getArgument(0);
            if (!job.getId().equals(slow.getId())) {
                return "ref";
            }
            Consumer<Process> onStart = invocation.getArgument(1);
            Process process = new ProcessBuilder("sleep", "30").start();
            onStart.accept(process);
            int exitCode = process.waitFor();
            throw new WorkerProcessException("Worker process exited with code " + exitCode);
        });

        loop.start();
        await(() -> loop.getCurrentJobId().filter(slow.getId()::equals).isPresent());

        assertThat(loop.cancelCurrent()).isTrue();
        await(() -> eventTypes().contains(QueueEventType.JOB_COMPLETE));

        assertThat(statusOf(next)).isEqualTo(JobStatus.COMPLETED);
        QueueJob cancelled = store.get(slow.getId()).orElseThrow();
        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(cancelled.getError()).isNull();
        assertThat(cancelled.getCompletedAt()).isNotNull();
        assertThat(eventTypes()).contains(QueueEventType.JOB_CANCELLED).doesNotContain(QueueEventType.JOB_FAILED);
        await(() -> loop.getCurrentJobId().isEmpty());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void workerIgnoringTerminationIsKilledAfterGracePeriod() throws Exception {
        QueueJob stubborn = enqueue("stubborn.mp4");
        AtomicInteger exitCode = new AtomicInteger(-1);
        AtomicLong cancelledAt = new AtomicLong();
        AtomicLong exitedAt = new AtomicLong();
        when(workerRunner.run(any(), any(), any())).thenAnswer(invocation -> {
            Consumer<Process> onStart = invocation.getArgument(1);
            Process process = new ProcessBuilder("sh", "-c", "trap '' TERM; sleep 30").start();
            onStart.accept(process);
            exitCode.set(process.waitFor());
            exitedAt.set(System.nanoTime());
            throw new WorkerProcessException("Worker process exited with code " + exitCode.get());
        });

        loop.start();
        await(() -> loop.getCurrentJobId().filter(stubborn.getId()::equals).isPresent());
        // let the shell install its trap before the signal arrives
        Thread.sleep(300);
        cancelledAt.set(System.nanoTime());
        assertThat(loop.cancelCurrent()).isTrue();
        await(() -> exitedAt.get() != 0 && loop.getCurrentJobId().isEmpty());

        // 128 + SIGKILL
        assertThat(exitCode.get()).isEqualTo(137);
        assertThat(TimeUnit.NANOSECONDS.toMillis(exitedAt.get() - cancelledAt.get())).isGreaterThanOrEqualTo(400);
        assertThat(statusOf(stubborn)).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void cancelArrivingAfterWorkerReturnedKeepsJobCancelled() throws Exception {
        QueueStore racingStore = spy(new QueueStore(JsonMapper.builder().findAndAddModules().build(),
                tempDir.resolve("racing-queue.json").toString()));
        QueueEventBus racingBus = new QueueEventBus(racingStore);
        List<QueueEvent> racingEvents = new CopyOnWriteArrayList<>();
        racingBus.subscribe(racingEvents::add);
        ProcessingLoop racingLoop = new ProcessingLoop(racingStore, racingBus, workerRunner, executor, 20, 500);

        AtomicBoolean workerReturned = new AtomicBoolean();
        AtomicBoolean cancelled = new AtomicBoolean();
        when(workerRunner.run(any(), any(), any())).thenAnswer(invocation -> {
            workerReturned.set(true);
            return "2024-01-01 - Lecture";
        });
        // the first store write after the worker returned is the completion; cancel just before it
        doAnswer(invocation -> {
            if (workerReturned.get() && cancelled.compareAndSet(false, true)) {
                assertThat(racingLoop.cancelCurrent()).isTrue();
            }
            return invocation.callRealMethod();
        }).when(racingStore).update(anyString(), any());
        QueueJob job = racingStore.add(List.of(new QueueJobInput("/tmp/a.mp4", "a.mp4", 100, null))).get(0);

        racingLoop.start();
        try {
            await(() -> cancelled.get() && racingLoop.getCurrentJobId().isEmpty());
        } finally {
            racingLoop.stop();
        }

        QueueJob result = racingStore.get(job.getId()).orElseThrow();
        assertThat(result.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(result.getResultRef()).isNull();
        List<QueueEventType> types = racingEvents.stream().map(QueueEvent::getType).toList();
        assertThat(types).contains(QueueEventType.JOB_CANCELLED)
                .doesNotContain(QueueEventType.JOB_COMPLETE, QueueEventType.JOB_FAILED);
    }

    @Test
    void cancelArrivingAfterWorkerFailedKeepsJobCancelled() throws Exception {
        QueueStore racingStore = spy(new QueueStore(JsonMapper.builder().findAndAddModules().build(),
                tempDir.resolve("racing-queue.json").toString()));
        QueueEventBus racingBus = new QueueEventBus(racingStore);
        List<QueueEvent> racingEvents = new CopyOnWriteArrayList<>();
        racingBus.subscribe(racingEvents::add);
        ProcessingLoop racingLoop = new ProcessingLoop(racingStore, racingBus, workerRunner, executor, 20, 500);

        AtomicBoolean workerReturned = new AtomicBoolean();
        AtomicBoolean cancelled = new AtomicBoolean();
        when(workerRunner.run(any(), any(), any())).thenAnswer(invocation -> {
            workerReturned.set(true);
            throw new WorkerProcessException("bad codec");
        });
        doAnswer(invocation -> {
            if (workerReturned.get() && cancelled.compareAndSet(false, true)) {
                racingLoop.cancelCurrent();
            }
            return invocation.callRealMethod();
        }).when(racingStore).update(anyString(), any());
        QueueJob job = racingStore.add(List.of(new QueueJobInput("/tmp/a.mp4", "a.mp4", 100, null))).get(0);

        racingLoop.start();
        try {
            await(() -> cancelled.get() && racingLoop.getCurrentJobId().isEmpty());
        } finally {
            racingLoop.stop();
        }

        QueueJob result = racingStore.get(job.getId()).orElseThrow();
        assertThat(result.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(result.getError()).isNull();
        assertThat(racingEvents).extracting(QueueEvent::getType).doesNotContain(QueueEventType.JOB_FAILED);
    }

    @Test
    void cancelWithoutRunningJobReturnsFalse() {
        assertThat(loop.cancelCurrent()).isFalse();
    }

    @Test
    void stopClearsProcessingFlag() throws Exception {
        when(workerRunner.run(any(), any(), any())).thenReturn("ref");
        QueueJob job = enqueue("a.mp4");
        loop.start();
        await(() -> statusOf(job) == JobStatus.COMPLETED);

        loop.stop();

        assertThat(loop.isRunning()).isFalse();
        assertThat(store.load().isProcessing()).isFalse();
        assertThat(store.load().getCurrentJobId()).isNull();
    }

    @Test
    void canBeRestartedAfterStop() throws Exception {
        when(workerRunner.run(any(), any(), any())).thenReturn("ref");
        loop.start();
        loop.stop();

        QueueJob job = enqueue("a.mp4");
        loop.start();

        await(() -> statusOf(job) == JobStatus.COMPLETED);
        assertThat(loop.isRunning()).isTrue();
    }
}
