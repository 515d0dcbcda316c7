package com.videosum.service;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationServiceTest {

    private final ValidationService validationService = new ValidationService();

    private static MultipartFile file(String name, String contentType) {
        return new MockMultipartFile("files", name, contentType, new byte[]{1});
    }

    @Test
    void acceptsSupportedVideosByTypeOrExtension() {
        assertThatCode(() -> validationService.validateUploads(List.of(
                file("a.mp4", "video/mp4"),
                file("b.bin", "video/webm"),
                file("c.MOV", "application/octet-stream"),
                file("d.avi", null))))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsWholeUploadWhenOneFileIsNotAVideo() {
        assertThatThrownBy(() -> validationService.validateUploads(List.of(
                file("a.mp4", "video/mp4"),
                file("slides.pdf", "application/pdf"),
                file("audio.mp3", "audio/mpeg"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid file types: slides.pdf, audio.mp3. Please upload MP4, WebM, MOV, or AVI.");
    }

    @Test
    void rejectsEmptyUpload() {
        assertThatThrownBy(() -> validationService.validateUploads(List.of()))
                .hasMessage("No files provided");
        assertThatThrownBy(() -> validationService.validateUploads(null))
                .hasMessage("No files provided");
    }

    @Test
    void groupIsOptional() {
        assertThatCode(() -> validationService.validateGroup(null)).doesNotThrowAnyException();
        assertThatCode(() -> validationService.validateGroup("")).doesNotThrowAnyException();
        assertThatCode(() -> validationService.validateGroup("Biology 101, Fall (2024)")).doesNotThrowAnyException();
    }

    @Test
    void groupCannotLeaveNotesDirectory() {
        assertThatThrownBy(() -> validationService.validateGroup("../outside"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validationService.validateGroup("a/b"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validationService.validateGroup("a\\b"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validationService.validateGroup("what?"))
                .hasMessage("Folder contains invalid characters");
        assertThatThrownBy(() -> validationService.validateGroup("x".repeat(256)))
                .hasMessage("Folder exceeds maximum length");
    }

    @Test
    void folderIdIsRequired() {
        assertThatThrownBy(() -> validationService.validateFolderId(" "))
                .hasMessage("Folder id cannot be null or empty");
        assertThatCode(() -> validationService.validateFolderId("2024-01-01 - Lecture"))
                .doesNotThrowAnyException();
    }
}
