package com.videosum.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The whole persisted queue document. List order is FIFO order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueueState {
    private List<QueueJob> items = new ArrayList<>();
    @JsonProperty("isProcessing")
    private boolean processing;
    private String currentJobId;
    private Instant lastUpdated;

    public static QueueState empty() {
        QueueState state = new QueueState();
        state.setLastUpdated(Instant.now());
        return state;
    }
}
