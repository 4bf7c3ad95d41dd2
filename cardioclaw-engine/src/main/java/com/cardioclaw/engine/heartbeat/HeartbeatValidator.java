package com.cardioclaw.engine.heartbeat;

import com.cardioclaw.common.errors.HeartbeatValidationException;

import java.util.Set;

/**
 * Structural checks on a single declared heartbeat.
 */
public final class HeartbeatValidator {

    private HeartbeatValidator() {
    }

    /**
     * @throws HeartbeatValidationException describing the first violation
     */
    public static void validate(Heartbeat hb) {
        if (!Heartbeat.hasText(hb.getName())) {
            throw new HeartbeatValidationException("Missing required field: name");
        }
        if (!Heartbeat.hasText(hb.getSchedule())) {
            throw new HeartbeatValidationException("Missing required field: schedule");
        }
        boolean hasPrompt = Heartbeat.hasText(hb.getPrompt());
        boolean hasMessage = Heartbeat.hasText(hb.getMessage());
        if (!hasPrompt && !hasMessage) {
            throw new HeartbeatValidationException("Must provide either prompt or message");
        }
        if (hasPrompt && hasMessage) {
            throw new HeartbeatValidationException("Provide only one of prompt or message, not both");
        }
        String target = hb.getSessionTarget();
        if (target != null && !Heartbeat.SESSION_MAIN.equals(target.trim())
                && !Heartbeat.SESSION_ISOLATED.equals(target.trim())) {
            throw new HeartbeatValidationException("Invalid sessionTarget '" + target + "' (expected main or isolated)");
        }
    }

    /**
     * Records {@code hb}'s name in {@code seenNames}; names are unique within
     * a file.
     *
     * @throws HeartbeatValidationException if an earlier entry has the same name
     */
    public static void requireUniqueName(Heartbeat hb, Set<String> seenNames) {
        if (!seenNames.add(hb.getName())) {
            throw new HeartbeatValidationException("Duplicate heartbeat name '" + hb.getName()
                    + "'; only the first entry is synced");
        }
    }
}
