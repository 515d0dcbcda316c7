package com.videosum.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum JobStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("processing")
    PROCESSING,
    @JsonProperty("completed")
    COMPLETED,
    @JsonProperty("failed")
    FAILED,
    @JsonProperty("cancelled")
    CANCELLED;

    /**
     * Failed and cancelled jobs can be put back to pending by the user
     */
    public boolean isRetryable() {
        return this == FAILED || this == CANCELLED;
    }
}
