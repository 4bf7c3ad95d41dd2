package com.cardioclaw.engine.heartbeat;

import com.cardioclaw.common.errors.HeartbeatValidationException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatValidatorTest {

    private static Heartbeat.HeartbeatBuilder valid() {
        return Heartbeat.builder().name("Standup").schedule("0 9 * * *").prompt("standup");
    }

    @Test
    void validHeartbeatPasses() {
        assertDoesNotThrow(() -> HeartbeatValidator.validate(valid().build()));
        assertDoesNotThrow(() -> HeartbeatValidator.validate(valid().prompt(null).message("hi").build()));
    }

    @Test
    void missingName() {
        HeartbeatValidationException e = assertThrows(HeartbeatValidationException.class,
                () -> HeartbeatValidator.validate(valid().name(" ").build()));
        assertEquals("Missing required field: name", e.getMessage());
    }

    @Test
    void missingSchedule() {
        HeartbeatValidationException e = assertThrows(HeartbeatValidationException.class,
                () -> HeartbeatValidator.validate(valid().schedule(null).build()));
        assertEquals("Missing required field: schedule", e.getMessage());
    }

    @Test
    void needsExactlyOnePayload() {
        assertThrows(HeartbeatValidationException.class,
                () -> HeartbeatValidator.validate(valid().prompt(null).build()));
        assertThrows(HeartbeatValidationException.class,
                () -> HeartbeatValidator.validate(valid().message("also").build()));
    }

    @Test
    void unknownSessionTarget() {
        assertThrows(HeartbeatValidationException.class,
                () -> HeartbeatValidator.validate(valid().sessionTarget("background").build()));
    }

    @Test
    void repeatedNameRejected() {
        Set<String> seen = new HashSet<>();
        HeartbeatValidator.requireUniqueName(valid().build(), seen);
        HeartbeatValidator.requireUniqueName(valid().name("Digest").build(), seen);

        HeartbeatValidationException e = assertThrows(HeartbeatValidationException.class,
                () -> HeartbeatValidator.requireUniqueName(valid().schedule("0 10 * * *").build(), seen));
        assertTrue(e.getMessage().contains("Duplicate heartbeat name 'Standup'"));
    }
}
