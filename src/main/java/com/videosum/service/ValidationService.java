package com.videosum.service;

import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Service
public class ValidationService {

    // Group names and folder ids are folder names inside the notes directory
    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");

    private static final Set<String> SUPPORTED_CONTENT_TYPES = new HashSet<>(Arrays.asList(
            "video/mp4", "video/webm", "video/quicktime", "video/x-msvideo"
    ));

    private static final Set<String> SUPPORTED_VIDEO_FORMATS = new HashSet<>(Arrays.asList(
            "mp4", "webm", "mov", "avi"
    ));

    /**
     * Rejects the whole upload if any file is not a supported video
     */
    public void validateUploads(List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("No files provided");
        }

        List<String> invalid = files.stream()
                .filter(file -> !isSupportedVideo(file))
                .map(file -> String.valueOf(file.getOriginalFilename()))
                .collect(Collectors.toList());

        if (!invalid.isEmpty()) {
            throw new IllegalArgumentException("Invalid file types: " + String.join(", ", invalid)
                    + ". Please upload MP4, WebM, MOV, or AVI.");
        }
    }

    /**
     * Validates a target group name to prevent path traversal out of the notes directory
     */
    public void validateGroup(String group) {
        if (group == null || group.isEmpty()) {
            return;
        }
        validateName(group, "Folder");
    }

    public void validateFolderId(String folderId) {
        if (folderId == null || folderId.isBlank()) {
            throw new IllegalArgumentException("Folder id cannot be null or empty");
        }
        validateName(folderId, "Folder id");
    }

    private void validateName(String value, String label) {
        if (value.contains("..") || value.contains("/") || value.contains("\\")) {
            throw new IllegalArgumentException(label + " cannot contain path separators or traversal sequences");
        }

        if (INVALID_NAME_CHARS.matcher(value).find()) {
            throw new IllegalArgumentException(label + " contains invalid characters");
        }

        if (value.length() > 255) {
            throw new IllegalArgumentException(label + " exceeds maximum length");
        }
    }

    private boolean isSupportedVideo(MultipartFile file) {
        if (file.getContentType() != null && SUPPORTED_CONTENT_TYPES.contains(file.getContentType())) {
            return true;
        }
        // browsers do not always send a content type, fall back to the extension
        String extension = FilenameUtils.getExtension(file.getOriginalFilename());
        return extension != null && SUPPORTED_VIDEO_FORMATS.contains(extension.toLowerCase());
    }
}
