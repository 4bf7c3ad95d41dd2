package com.cardioclaw.engine.heartbeat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;

/**
 * A declared job from the {@code heartbeats} list of the declarative file.
 * <p>
 * A schedule is either a cron expression or a one-shot marker
 * {@code "at YYYY-MM-DD HH:MM[ TZ]"}. Exactly one of {@code prompt} (isolated
 * agent turn) or {@code message} (main-session system event) is expected.
 */
@Value
@Builder(toBuilder = true)
public class Heartbeat {

    public static final String ONE_SHOT_PREFIX = "at ";
    public static final String SESSION_MAIN = "main";
    public static final String SESSION_ISOLATED = "isolated";
    public static final String DELIVERY_NONE = "none";

    String name;
    String schedule;
    String prompt;
    String message;
    String sessionTarget;
    String delivery;
    String tz;
    String model;
    Boolean deleteAfterRun;

    public boolean isOneShot() {
        return schedule != null && schedule.startsWith(ONE_SHOT_PREFIX);
    }

    /**
     * Declared session target, defaulting to {@code isolated} for prompts and
     * {@code main} for messages.
     */
    public String effectiveSessionTarget() {
        if (sessionTarget != null && !sessionTarget.isBlank())
            return sessionTarget.trim();
        return hasText(prompt) ? SESSION_ISOLATED : SESSION_MAIN;
    }

    public boolean shouldDeleteAfterRun() {
        return Boolean.TRUE.equals(deleteAfterRun) || isOneShot();
    }

    public static Heartbeat fromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Heartbeat.builder().build();
        }
        JsonNode deleteAfter = node.get("deleteAfterRun");
        return Heartbeat.builder()
                .name(text(node, "name"))
                .schedule(text(node, "schedule"))
                .prompt(text(node, "prompt"))
                .message(text(node, "message"))
                .sessionTarget(text(node, "sessionTarget"))
                .delivery(text(node, "delivery"))
                .tz(text(node, "tz"))
                .model(text(node, "model"))
                .deleteAfterRun(deleteAfter != null && deleteAfter.isBoolean() ? deleteAfter.booleanValue() : null)
                .build();
    }

    /**
     * Render as a YAML/JSON object with only the fields that are set.
     */
    public ObjectNode toNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        putIfSet(node, "name", name);
        putIfSet(node, "schedule", schedule);
        putIfSet(node, "prompt", prompt);
        putIfSet(node, "message", message);
        putIfSet(node, "sessionTarget", sessionTarget);
        putIfSet(node, "delivery", delivery);
        putIfSet(node, "tz", tz);
        putIfSet(node, "model", model);
        if (deleteAfterRun != null)
            node.put("deleteAfterRun", deleteAfterRun);
        return node;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode())
            return null;
        return value.asText();
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static void putIfSet(ObjectNode node, String field, String value) {
        if (value != null)
            node.put(field, value);
    }
}
