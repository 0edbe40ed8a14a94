package com.catdb.service;

import com.catdb.config.CatdbSettings;
import com.catdb.model.AppState;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Persists {@code app_state.json}: the last SQL text and the dark-mode flag.
 */
@Slf4j
@Component
public class AppStateStore {

    private final Path file;
    private final ObjectMapper objectMapper;

    public AppStateStore(CatdbSettings settings, ObjectMapper objectMapper) {
        this.file = settings.appStateFile();
        this.objectMapper = objectMapper;
    }

    /**
     * Load the state. Missing or unreadable files yield defaults.
     *
     * @return state
     */
    public synchronized AppState load() {
        if (!Files.exists(file)) {
            return new AppState();
        }
        try {
            AppState state = objectMapper.readValue(file.toFile(), AppState.class);
            if (state.getLastSql() == null) {
                state.setLastSql("");
            }
            return state;
        } catch (IOException e) {
            log.warn("App state is unreadable, using defaults (file={}, error={})", file, e.getMessage());
            return new AppState();
        }
    }

    /**
     * Write the state.
     *
     * @param state state
     * @throws UncheckedIOException when the file cannot be written
     */
    public synchronized void save(AppState state) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, "app_state", ".json.tmp");
            try {
                Files.write(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state));
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write app state " + file, e);
        }
    }
}
