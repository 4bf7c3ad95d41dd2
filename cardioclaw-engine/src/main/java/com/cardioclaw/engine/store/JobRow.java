package com.cardioclaw.engine.store;

import lombok.Builder;
import lombok.Value;

/**
 * Cached snapshot of an external job, keyed by its scheduler id.
 */
@Value
@Builder(toBuilder = true)
public class JobRow {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_FAILING = "failing";
    public static final String STATUS_DISABLED = "disabled";

    String id;
    String name;
    /** Schedule object as JSON text. */
    String schedule;
    String agent;
    String status;
    Long nextRunAt;
    Long lastRunAt;
    String lastStatus;
    String lastError;
    boolean managed;
    Long createdAt;
    Long updatedAt;
}
