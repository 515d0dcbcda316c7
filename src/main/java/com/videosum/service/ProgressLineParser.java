package com.videosum.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.videosum.model.JobProgress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Parses the worker's progress protocol.
 *
 * A progress line is the literal prefix {@code PROGRESS:} followed by a JSON object with
 * {@code step}, {@code message} and optionally {@code progress} and {@code total}.
 * Anything else is not a progress line.
 */
@Component
@Slf4j
public class ProgressLineParser {

    public static final String PREFIX = "PROGRESS:";

    private final ObjectReader progressReader;

    public ProgressLineParser(ObjectMapper objectMapper) {
        this.progressReader = objectMapper.readerFor(JobProgress.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @return the progress record, or empty if the line lacks the prefix or carries invalid JSON
     */
    public Optional<JobProgress> parse(String line) {
        if (line == null || !line.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String json = line.substring(PREFIX.length());
        try {
            return Optional.ofNullable(progressReader.readValue(json));
        } catch (JsonProcessingException e) {
            log.debug("Malformed progress line: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
