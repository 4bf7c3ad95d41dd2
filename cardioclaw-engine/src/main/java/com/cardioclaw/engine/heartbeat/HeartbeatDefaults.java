package com.cardioclaw.engine.heartbeat;

/**
 * The {@code defaults} section of the declarative file.
 *
 * @param timezone file-level default IANA zone, or null
 */
public record HeartbeatDefaults(String timezone) {

    public static HeartbeatDefaults none() {
        return new HeartbeatDefaults(null);
    }
}
