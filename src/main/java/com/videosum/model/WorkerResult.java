package com.videosum.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The single JSON object the worker prints on stdout before it exits.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkerResult {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private String status;
    @JsonAlias("folder_id")
    private String resultRef;
    private String message;

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }

    public boolean isError() {
        return STATUS_ERROR.equals(status);
    }
}
