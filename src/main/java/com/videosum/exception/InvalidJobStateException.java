package com.videosum.exception;

import java.io.Serial;

/**
 * The requested action is not allowed for the job's current status
 */
public class InvalidJobStateException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -1948563021785094402L;

    public InvalidJobStateException(String message) {
        super(message);
    }
}
