package com.videosum.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.videosum.exception.WorkerProcessException;
import com.videosum.model.JobProgress;
import com.videosum.model.QueueJob;
import com.videosum.model.WorkerResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.function.Consumer;

/**
 * Runs the external summarization worker for one job.
 *
 * The worker is called as {@code <executable> <arguments...> <sourcePath> <notesDir> [--group <name>]},
 * or {@code <executable> <arguments...> <sourcePath> --reprocess} for a reprocess job.
 * It reports progress on stderr and prints exactly one JSON result object on stdout.
 */
@Service
@Slf4j
public class WorkerProcessRunner {

    static final String REPROCESS_FLAG = "--reprocess";
    static final String GROUP_FLAG = "--group";

    private final ProgressLineParser progressLineParser;
    private final SettingsService settingsService;
    private final ObjectReader resultReader;
    private final String executable;
    private final List<String> arguments;
    private final Path workingDir;
    private final List<String> credentialEnv;

    public WorkerProcessRunner(ProgressLineParser progressLineParser,
                               SettingsService settingsService,
                               ObjectMapper objectMapper,
                               @Value("${videosum.worker.executable}") String executable,
                               @Value("${videosum.worker.arguments:}") String[] arguments,
                               @Value("${videosum.worker.working-dir:.}") String workingDir,
                               @Value("${videosum.worker.credential-env}") String[] credentialEnv) {
        this.progressLineParser = progressLineParser;
        this.settingsService = settingsService;
        this.resultReader = objectMapper.readerFor(WorkerResult.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.executable = executable;
        this.arguments = List.of(arguments);
        this.workingDir = Paths.get(workingDir).toAbsolutePath().normalize();
        this.credentialEnv = List.of(credentialEnv);
    }

    /**
     * Runs the worker for a claimed job and waits for it to exit.
     *
     * @param job        the job being processed
     * @param onStart    receives the live process so it can be cancelled
     * @param onProgress receives every progress record the worker reports
     * @return the worker's result reference
     * @throws WorkerProcessException if the worker cannot be started, fails or prints an invalid result
     * @throws InterruptedException   if the calling thread is interrupted; the worker is killed
     */
    public String run(QueueJob job, Consumer<Process> onStart, Consumer<JobProgress> onProgress)
            throws InterruptedException {
        // a missing worker environment fails here and keeps the upload for a retry
        List<String> command = buildCommand(job);
        log.info("Starting worker for job {} ({}): {}", job.getId(), job.getOriginalName(), String.join(" ", command));

        try {
            Process process = start(command);
            onStart.accept(process);
            return awaitResult(job, process, onProgress);
        } finally {
            cleanupSource(job);
        }
    }

    List<String> buildCommand(QueueJob job) {
        List<String> command = new ArrayList<>();
        command.add(resolveExecutable());
        command.addAll(arguments);
        command.add(job.getSourcePath());

        if (job.isReprocess()) {
            command.add(REPROCESS_FLAG);
        } else {
            command.add(settingsService.getNotesDirectory().toString());
            if (StringUtils.hasText(job.getGroup())) {
                command.add(GROUP_FLAG);
                command.add(job.getGroup());
            }
        }
        return command;
    }

    /**
     * A bare command name is looked up on the PATH; anything with a directory part must exist.
     */
    private String resolveExecutable() {
        Path path = Paths.get(executable);
        if (path.getNameCount() <= 1 && !path.isAbsolute()) {
            return executable;
        }
        Path resolved = workingDir.resolve(path).normalize();
        if (!Files.isExecutable(resolved)) {
            throw new WorkerProcessException("Worker executable not found or not executable: " + resolved
                    + ". Check videosum.worker.executable or set up the worker environment.");
        }
        return resolved.toString();
    }

    private Process start(List<String> command) {
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.directory(workingDir.toFile());

        Map<String, String> environment = processBuilder.environment();
        for (String name : credentialEnv) {
            Optional.ofNullable(System.getenv(name))
                    .filter(StringUtils::hasText)
                    .or(() -> settingsService.getStoredCredential(name))
                    .ifPresent(value -> environment.put(name, value));
        }

        try {
            return processBuilder.start();
        } catch (IOException e) {
            log.error("Could not start worker process {}: {}", command.get(0), e.getMessage());
            throw new WorkerProcessException("Failed to start worker process: " + e.getMessage(), e);
        }
    }

    private String awaitResult(QueueJob job, Process process, Consumer<JobProgress> onProgress)
            throws InterruptedException {
        String threadSuffix = job.getId().substring(0, Math.min(8, job.getId().length()));

        FutureTask<String> stdoutCapture = new FutureTask<>(
                () -> IOUtils.toString(process.getInputStream(), StandardCharsets.UTF_8));
        Thread stdoutThread = new Thread(stdoutCapture, "worker-stdout-" + threadSuffix);
        stdoutThread.setDaemon(true);
        stdoutThread.start();

        Thread stderrThread = new Thread(() -> pumpDiagnostics(job, process.getErrorStream(), onProgress),
                "worker-stderr-" + threadSuffix);
        stderrThread.setDaemon(true);
        stderrThread.start();

        int exitCode;
        String stdout;
        try {
            exitCode = process.waitFor();
            stdout = stdoutCapture.get();
            stderrThread.join();
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for worker of job {}, killing it", job.getId());
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            throw e;
        } catch (ExecutionException e) {
            throw new WorkerProcessException("Failed to read worker output: " + e.getCause().getMessage(), e.getCause());
        }

        log.info("Worker for job {} exited with code {}", job.getId(), exitCode);
        log.debug("Worker stdout for job {}: {}", job.getId(), stdout);
        return resolveResult(exitCode, stdout);
    }

    private void pumpDiagnostics(QueueJob job, InputStream errorStream, Consumer<JobProgress> onProgress) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(errorStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                Optional<JobProgress> progress = progressLineParser.parse(line);
                if (progress.isPresent()) {
                    deliverProgress(job, progress.get(), onProgress);
                } else if (!line.isBlank()) {
                    log.info("[worker {}] {}", job.getId(), line);
                }
            }
        } catch (IOException e) {
            log.debug("Worker diagnostic stream for job {} closed: {}", job.getId(), e.getMessage());
        }
    }

    private void deliverProgress(QueueJob job, JobProgress progress, Consumer<JobProgress> onProgress) {
        try {
            onProgress.accept(progress);
        } catch (RuntimeException e) {
            log.warn("Could not record progress for job {}: {}", job.getId(), e.getMessage());
        }
    }

    String resolveResult(int exitCode, String stdout) {
        WorkerResult result = parseResult(stdout);

        if (exitCode == 0) {
            if (result == null) {
                throw new WorkerProcessException("Failed to parse worker result");
            }
            if (result.isSuccess() && StringUtils.hasText(result.getResultRef())) {
                return result.getResultRef();
            }
            if (result.isError()) {
                throw new WorkerProcessException(errorMessage(result));
            }
            throw new WorkerProcessException("Invalid worker result format");
        }

        if (result != null && result.isError()) {
            throw new WorkerProcessException(errorMessage(result));
        }
        throw new WorkerProcessException("Worker process exited with code " + exitCode);
    }

    private WorkerResult parseResult(String stdout) {
        if (!StringUtils.hasText(stdout)) {
            return null;
        }
        try {
            return resultReader.readValue(stdout.trim());
        } catch (JsonProcessingException e) {
            log.debug("Worker stdout is not a result object: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String errorMessage(WorkerResult result) {
        return StringUtils.hasText(result.getMessage()) ? result.getMessage() : "Processing failed";
    }

    /**
     * Uploaded sources are temp copies; a reprocess source is the user's notes folder and stays.
     */
    private void cleanupSource(QueueJob job) {
        if (job.isReprocess() || job.getSourcePath() == null) {
            return;
        }
        File source = new File(job.getSourcePath());
        if (FileUtils.deleteQuietly(source)) {
            log.debug("Deleted temporary upload {}", source.getAbsolutePath());
        }
    }
}
