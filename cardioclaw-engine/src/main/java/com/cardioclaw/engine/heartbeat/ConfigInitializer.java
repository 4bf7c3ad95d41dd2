package com.cardioclaw.engine.heartbeat;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a starter declarative file.
 */
@Slf4j
public class ConfigInitializer {

    /**
     * @return false when {@code target} already exists (it is left untouched)
     */
    public boolean init(Path target, String timezone) {
        if (Files.exists(target)) {
            return false;
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, scaffold(timezone));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        log.info("Created {}", target);
        return true;
    }

    static String scaffold(String timezone) {
        return """
                # CardioClaw Configuration

                defaults:
                  timezone: %s

                heartbeats: []
                  # Example:
                  # - name: Morning Briefing
                  #   schedule: "0 8 * * *"
                  #   prompt: "Run morning briefing"
                  #   delivery: telegram
                """.formatted(timezone);
    }
}
