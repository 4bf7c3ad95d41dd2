package com.cardioclaw.engine.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * One observed execution of a job. Rows are only ever inserted or pruned.
 */
@Value
@Builder
public class RunRow {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";
    public static final String STATUS_TIMEOUT = "timeout";

    Long id;
    String jobId;
    String jobName;
    long startedAt;
    Long endedAt;
    Long durationMs;
    String status;
    String error;
    String sessionId;

    @JsonIgnore
    public boolean isOk() {
        return STATUS_OK.equals(status);
    }
}
