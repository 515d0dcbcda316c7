package com.videosum.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueueJob {
    private String id;
    private String sourcePath;    // uploaded temp file, or the notes folder for a reprocess
    private String originalName;
    private long sizeBytes;
    private String group;         // target folder inside the notes directory
    @JsonProperty("isReprocess")
    private boolean reprocess;
    private JobStatus status;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private JobProgress progress; // only while PROCESSING
    private String error;
    private String resultRef;     // identifier of the produced notes folder
}
