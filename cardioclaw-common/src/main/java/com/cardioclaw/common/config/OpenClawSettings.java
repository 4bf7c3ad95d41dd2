package com.cardioclaw.common.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Read-only view of the OpenClaw system config ({@code openclaw.json}).
 * Only the timezone is of interest: {@code timezone} at the top level, else
 * {@code gateway.timezone}.
 */
public final class OpenClawSettings {

    private static final Logger log = LoggerFactory.getLogger(OpenClawSettings.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path configPath;

    public OpenClawSettings(Path configPath) {
        this.configPath = configPath;
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * The system-wide timezone configured for OpenClaw, if any. A missing or
     * unreadable config yields empty.
     */
    public Optional<String> timezone() {
        if (configPath == null || !Files.isRegularFile(configPath)) {
            return Optional.empty();
        }
        try {
            JsonNode root = MAPPER.readTree(Files.readString(configPath));
            if (root == null || !root.isObject()) {
                return Optional.empty();
            }
            String tz = textOrNull(root.get("timezone"));
            if (tz == null) {
                tz = textOrNull(root.path("gateway").get("timezone"));
            }
            return Optional.ofNullable(tz);
        } catch (IOException e) {
            log.debug("OpenClaw config unreadable at {}: {}", configPath, e.getMessage());
            return Optional.empty();
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || !node.isTextual())
            return null;
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
