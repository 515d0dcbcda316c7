package com.videosum.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pushed to live observers. Which fields are set depends on the type.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueueEvent {
    private QueueEventType type;
    private QueueState state;
    private QueueJob job;
    private JobProgress progress;
    private String error;
    private String resultRef;

    public static QueueEvent state(QueueState state) {
        return new QueueEvent(QueueEventType.STATE, state, null, null, null, null);
    }

    public static QueueEvent progress(QueueJob job, JobProgress progress) {
        return new QueueEvent(QueueEventType.PROGRESS, null, job, progress, null, null);
    }

    public static QueueEvent jobComplete(QueueJob job, String resultRef) {
        return new QueueEvent(QueueEventType.JOB_COMPLETE, null, job, null, null, resultRef);
    }

    public static QueueEvent jobFailed(QueueJob job, String error) {
        return new QueueEvent(QueueEventType.JOB_FAILED, null, job, null, error, null);
    }

    public static QueueEvent jobCancelled(QueueJob job) {
        return new QueueEvent(QueueEventType.JOB_CANCELLED, null, job, null, null, null);
    }
}
