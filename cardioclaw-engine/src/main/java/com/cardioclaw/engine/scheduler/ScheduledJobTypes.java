package com.cardioclaw.engine.scheduler;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Job records as reported by {@code openclaw cron list --json}.
 * <p>
 * These are read-only mirrors of the scheduler's own state; CardioClaw only
 * creates and removes jobs, it never patches them.
 * </p>
 */
public final class ScheduledJobTypes {

    private ScheduledJobTypes() {
    }

    // =========================================================================
    // Schedule
    // =========================================================================

    public enum ScheduleKind {
        AT, EVERY, CRON;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static ScheduleKind fromKey(String key) {
            if (key == null)
                return null;
            for (ScheduleKind kind : values()) {
                if (kind.key().equalsIgnoreCase(key.trim()))
                    return kind;
            }
            return null;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobSchedule {
        private ScheduleKind kind;
        /** ISO-8601 instant for "at" schedules. */
        private String at;
        /** Interval in milliseconds for "every" schedules. */
        private Long everyMs;
        private Long anchorMs;
        /** Cron expression for "cron" schedules (e.g. "0 9 * * *"). */
        private String expr;
        /** IANA time zone for "cron" schedules. */
        private String tz;
    }

    // =========================================================================
    // Payload
    // =========================================================================

    public enum PayloadKind {
        SYSTEM_EVENT, AGENT_TURN;

        @JsonValue
        public String key() {
            return this == SYSTEM_EVENT ? "systemEvent" : "agentTurn";
        }

        @JsonCreator
        public static PayloadKind fromKey(String key) {
            if ("agentTurn".equalsIgnoreCase(key))
                return AGENT_TURN;
            if ("systemEvent".equalsIgnoreCase(key))
                return SYSTEM_EVENT;
            return null;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobPayload {
        private PayloadKind kind;
        /** Text for systemEvent payloads. */
        private String text;
        /** Prompt for agentTurn payloads. */
        private String message;
        private String model;
        private String agentId;
    }

    // =========================================================================
    // Delivery
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobDelivery {
        /** "none" or "announce". */
        private String mode;
        private String channel;
        private String to;
    }

    // =========================================================================
    // Job state
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobState {
        private Long nextRunAtMs;
        private Long runningAtMs;
        private Long lastRunAtMs;
        /** "ok", "error", "timeout" or "skipped" */
        @JsonAlias("lastRunStatus")
        private String lastStatus;
        @JsonAlias("lastRunError")
        private String lastError;
        private Long lastDurationMs;
        private String lastSessionId;
    }

    // =========================================================================
    // Job
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScheduledJob {
        private String id;
        private String agentId;
        private String name;
        private String description;
        /** Cleared by the scheduler once a one-shot has fired. */
        private boolean enabled;
        private Boolean deleteAfterRun;
        private Long createdAtMs;
        private Long updatedAtMs;
        private JobSchedule schedule;
        /** "main" or "isolated" */
        private String sessionTarget;
        private JobPayload payload;
        private JobDelivery delivery;
        private JobState state;

        /**
         * Agent identifier from the payload, falling back to the job itself.
         */
        public String resolveAgent() {
            if (payload != null && payload.getAgentId() != null)
                return payload.getAgentId();
            return agentId;
        }

        public boolean lastRunErrored() {
            return state != null && "error".equals(state.getLastStatus());
        }
    }
}
