package com.videosum.exception;

import java.io.Serial;

/**
 * A single job's worker run failed. The message ends up in the job's error field,
 * so it should read well to a user.
 */
public class WorkerProcessException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -6120853479216644730L;

    public WorkerProcessException(String message) {
        super(message);
    }

    public WorkerProcessException(String message, Throwable cause) {
        super(message, cause);
    }
}
