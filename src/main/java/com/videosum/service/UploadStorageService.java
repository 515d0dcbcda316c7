package com.videosum.service;

import com.videosum.model.QueueJobInput;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Keeps uploaded videos in a temp directory until the worker has consumed them.
 */
@Service
@Slf4j
public class UploadStorageService {

    private final Path uploadDir;

    public UploadStorageService(@Value("${videosum.upload-dir}") String uploadDir) {
        this.uploadDir = Paths.get(uploadDir);
    }

    /**
     * Writes the upload to {@code <uploadDir>/<uuid>-<name>} and describes it as a queue input.
     */
    public QueueJobInput store(MultipartFile file, String group) {
        String originalName = FilenameUtils.getName(file.getOriginalFilename());
        if (originalName == null || originalName.isBlank()) {
            originalName = "video";
        }
        Path target = uploadDir.resolve(UUID.randomUUID() + "-" + originalName);

        try {
            Files.createDirectories(uploadDir);
            file.transferTo(target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store upload " + originalName, e);
        }

        log.info("Stored upload {} ({} bytes) at {}", originalName, file.getSize(), target);
        return new QueueJobInput(target.toAbsolutePath().toString(), originalName, file.getSize(),
                group == null || group.isBlank() ? null : group);
    }
}
