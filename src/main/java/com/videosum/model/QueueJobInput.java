package com.videosum.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a caller supplies when submitting a video to the queue
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueJobInput {
    private String sourcePath;
    private String originalName;
    private long sizeBytes;
    private String group;
}
