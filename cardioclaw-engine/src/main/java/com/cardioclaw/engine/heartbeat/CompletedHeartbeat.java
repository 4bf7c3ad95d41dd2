package com.cardioclaw.engine.heartbeat;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * An entry of the {@code heartbeats_completed} ledger: a fired one-shot with
 * its execution time and outcome.
 */
@Value
public class CompletedHeartbeat {

    public static final String EXECUTED_AT = "executed_at";
    public static final String STATUS = "status";
    public static final String ERROR = "error";

    Heartbeat heartbeat;
    /** ISO-8601 instant, or null when unknown. */
    String executedAt;
    /** "ok" or "error" */
    String status;
    String error;

    public String getName() {
        return heartbeat.getName();
    }

    public boolean isError() {
        return "error".equals(status);
    }

    public static CompletedHeartbeat fromNode(JsonNode node) {
        Heartbeat heartbeat = Heartbeat.fromNode(node);
        if (node == null || !node.isObject()) {
            return new CompletedHeartbeat(heartbeat, null, null, null);
        }
        return new CompletedHeartbeat(
                heartbeat,
                Heartbeat.text(node, EXECUTED_AT),
                Heartbeat.text(node, STATUS),
                Heartbeat.text(node, ERROR));
    }
}
