package com.cardioclaw.engine.heartbeat;

import com.cardioclaw.common.errors.ConfigParseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Loading and saving of the declarative YAML file.
 */
@Slf4j
public class HeartbeatFileStore {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
            .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR));

    /**
     * Load a declarative file. A blank file yields an empty document.
     *
     * @throws ConfigParseException if the file is not valid YAML or its root
     *                              is not a mapping
     */
    public HeartbeatFile load(Path path) {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigParseException(path, "Failed to read " + path + ": " + e.getMessage(), e);
        }
        if (content.isBlank()) {
            return new HeartbeatFile(path, YAML.createObjectNode());
        }

        JsonNode root;
        try {
            root = YAML.readTree(content);
        } catch (IOException e) {
            throw new ConfigParseException(path, "Failed to parse YAML in " + path + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new HeartbeatFile(path, YAML.createObjectNode());
        }
        if (!root.isObject()) {
            throw new ConfigParseException(path, "Expected a mapping at the top of " + path);
        }
        return new HeartbeatFile(path, (ObjectNode) root);
    }

    public void save(HeartbeatFile file) {
        save(file, null);
    }

    /**
     * Write the document back to its path, optionally preceded by a comment
     * header (each line already prefixed with {@code #}).
     */
    public void save(HeartbeatFile file, String header) {
        Path path = file.getPath();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            String yaml = YAML.writeValueAsString(file.getRoot());
            String content = header == null ? yaml : header + "\n" + yaml;
            Files.writeString(path, content, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING);
            log.debug("Saved {} ({} active, {} completed)", path,
                    file.heartbeatNodes().size(), file.completedNodes().size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }
}
