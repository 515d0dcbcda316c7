package com.videosum.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Read-only view of the user settings the queue depends on.
 *
 * The global config file ({@code ~/.videosum/config.json}) is written by the settings
 * screen of the desktop app. It may override the notes directory and may hold API keys.
 */
@Service
@Slf4j
public class SettingsService {

    private static final String NOTES_DIRECTORY_KEY = "notesDirectory";

    private final ObjectMapper objectMapper;
    private final Path globalConfigFile;
    private final String defaultNotesDirectory;

    public SettingsService(ObjectMapper objectMapper,
                           @Value("${videosum.global-config}") String globalConfigFile,
                           @Value("${videosum.notes-dir}") String defaultNotesDirectory) {
        this.objectMapper = objectMapper;
        this.globalConfigFile = Paths.get(globalConfigFile);
        this.defaultNotesDirectory = defaultNotesDirectory;
    }

    /**
     * Returns the directory the worker writes notes folders into, creating it if needed.
     */
    public Path getNotesDirectory() {
        String configured = readGlobalConfig()
                .map(config -> config.path(NOTES_DIRECTORY_KEY).asText(null))
                .filter(value -> !value.isBlank())
                .orElse(defaultNotesDirectory);

        Path notesDirectory = Paths.get(configured);
        try {
            Files.createDirectories(notesDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create notes directory " + notesDirectory, e);
        }
        return notesDirectory;
    }

    /**
     * Looks up a credential stored in the global config under the same name as its environment variable.
     */
    public Optional<String> getStoredCredential(String name) {
        return readGlobalConfig()
                .map(config -> config.path(name).asText(null))
                .filter(value -> !value.isBlank());
    }

    private Optional<JsonNode> readGlobalConfig() {
        if (!Files.isRegularFile(globalConfigFile)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readTree(globalConfigFile.toFile()));
        } catch (IOException e) {
            log.warn("Ignoring unreadable settings file {}: {}", globalConfigFile, e.getMessage());
            return Optional.empty();
        }
    }
}
