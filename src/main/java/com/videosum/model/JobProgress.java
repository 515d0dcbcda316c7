package com.videosum.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One sub-step reported by the worker on its diagnostic stream.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobProgress {
    private String step;
    private String message;
    private Integer progress; // optional, e.g. current chunk
    private Integer total;    // optional, e.g. number of chunks

    public JobProgress(String step, String message) {
        this(step, message, null, null);
    }
}
