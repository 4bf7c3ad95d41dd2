package com.cardioclaw.engine.heartbeat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigInitializerTest {

    @TempDir
    Path tmp;

    @Test
    void writesLoadableScaffold() {
        Path target = tmp.resolve(".cardioclaw/cardioclaw.yaml");

        assertTrue(new ConfigInitializer().init(target, "Europe/Lisbon"));

        HeartbeatFile file = new HeartbeatFileStore().load(target);
        assertEquals("Europe/Lisbon", file.defaults().timezone());
        assertTrue(file.hasHeartbeatList());
        assertTrue(file.heartbeats().isEmpty());
    }

    @Test
    void leavesExistingFileAlone() throws Exception {
        Path target = Files.writeString(tmp.resolve("cardioclaw.yaml"), "owner: me\n");

        assertFalse(new ConfigInitializer().init(target, "UTC"));
        assertEquals("owner: me\n", Files.readString(target));
    }
}
