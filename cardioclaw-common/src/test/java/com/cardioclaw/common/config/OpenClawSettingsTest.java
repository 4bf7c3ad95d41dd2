package com.cardioclaw.common.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OpenClawSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void timezone_topLevelKeyWins() throws IOException {
        Path config = tempDir.resolve("openclaw.json");
        Files.writeString(config, """
                { "timezone": "Europe/Berlin", "gateway": { "timezone": "Asia/Tokyo" } }
                """);

        assertEquals(Optional.of("Europe/Berlin"), new OpenClawSettings(config).timezone());
    }

    @Test
    void timezone_fallsBackToGatewaySection() throws IOException {
        Path config = tempDir.resolve("openclaw.json");
        Files.writeString(config, """
                { "gateway": { "port": 18789, "timezone": "Asia/Tokyo" } }
                """);

        assertEquals(Optional.of("Asia/Tokyo"), new OpenClawSettings(config).timezone());
    }

    @Test
    void timezone_missingFile_isEmpty() {
        assertTrue(new OpenClawSettings(tempDir.resolve("absent.json")).timezone().isEmpty());
    }

    @Test
    void timezone_corruptFile_isEmpty() throws IOException {
        Path config = tempDir.resolve("openclaw.json");
        Files.writeString(config, "{ not json");

        assertTrue(new OpenClawSettings(config).timezone().isEmpty());
    }
}
