package com.videosum.exception;

import java.io.Serial;

public class ResourceNotFoundException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 5405263881947019387L;

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException job(String jobId) {
        return new ResourceNotFoundException("Job not found: " + jobId);
    }

    public static ResourceNotFoundException notesFolder(String folderId) {
        return new ResourceNotFoundException("Notes folder not found: " + folderId);
    }
}
