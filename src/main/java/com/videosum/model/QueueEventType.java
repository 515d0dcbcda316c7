package com.videosum.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum QueueEventType {
    @JsonProperty("state")
    STATE,
    @JsonProperty("progress")
    PROGRESS,
    @JsonProperty("jobComplete")
    JOB_COMPLETE,
    @JsonProperty("jobFailed")
    JOB_FAILED,
    @JsonProperty("jobCancelled")
    JOB_CANCELLED
}
