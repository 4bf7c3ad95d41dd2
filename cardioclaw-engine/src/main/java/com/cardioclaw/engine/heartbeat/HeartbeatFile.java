package com.cardioclaw.engine.heartbeat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The declarative document: {@code defaults}, the active {@code heartbeats}
 * list and the {@code heartbeats_completed} ledger. The underlying tree is
 * kept as loaded so rewrites preserve keys this class does not know about.
 */
public class HeartbeatFile {

    public static final String DEFAULTS = "defaults";
    public static final String HEARTBEATS = "heartbeats";
    public static final String COMPLETED = "heartbeats_completed";

    private final Path path;
    private final ObjectNode root;

    public HeartbeatFile(Path path, ObjectNode root) {
        this.path = path;
        this.root = root;
    }

    public Path getPath() {
        return path;
    }

    public ObjectNode getRoot() {
        return root;
    }

    public HeartbeatDefaults defaults() {
        JsonNode tz = root.path(DEFAULTS).get("timezone");
        if (tz == null || !tz.isTextual() || tz.asText().isBlank())
            return HeartbeatDefaults.none();
        return new HeartbeatDefaults(tz.asText().trim());
    }

    public boolean hasHeartbeatList() {
        return root.get(HEARTBEATS) instanceof ArrayNode;
    }

    /**
     * Raw active entries in file order; empty when the list is absent.
     */
    public List<JsonNode> heartbeatNodes() {
        return nodes(HEARTBEATS);
    }

    public List<Heartbeat> heartbeats() {
        List<Heartbeat> result = new ArrayList<>();
        for (JsonNode node : heartbeatNodes()) {
            result.add(Heartbeat.fromNode(node));
        }
        return result;
    }

    public List<JsonNode> completedNodes() {
        return nodes(COMPLETED);
    }

    public List<CompletedHeartbeat> completed() {
        List<CompletedHeartbeat> result = new ArrayList<>();
        for (JsonNode node : completedNodes()) {
            result.add(CompletedHeartbeat.fromNode(node));
        }
        return result;
    }

    public void replaceHeartbeats(List<? extends JsonNode> entries) {
        replace(HEARTBEATS, entries);
    }

    public void replaceCompleted(List<? extends JsonNode> entries) {
        replace(COMPLETED, entries);
    }

    private List<JsonNode> nodes(String field) {
        JsonNode list = root.get(field);
        List<JsonNode> result = new ArrayList<>();
        if (list instanceof ArrayNode array) {
            array.forEach(result::add);
        }
        return result;
    }

    private void replace(String field, List<? extends JsonNode> entries) {
        ArrayNode array = root.arrayNode();
        entries.forEach(array::add);
        root.set(field, array);
    }
}
