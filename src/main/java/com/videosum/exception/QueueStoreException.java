package com.videosum.exception;

import java.io.Serial;

/**
 * Thrown when the queue document cannot be written.
 */
public class QueueStoreException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2871356702948811254L;

    public QueueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
