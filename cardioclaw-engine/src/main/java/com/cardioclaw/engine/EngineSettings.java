package com.cardioclaw.engine;

import com.cardioclaw.common.config.CardioclawPaths;
import com.cardioclaw.common.infra.ProcessRunner;
import com.cardioclaw.engine.scheduler.OpenClawCliClient;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Everything the engine needs from its environment.
 *
 * @param openclawBinary scheduler CLI ({@code CARDIOCLAW_OPENCLAW_BIN})
 * @param execTimeout    per-invocation timeout ({@code CARDIOCLAW_EXEC_TIMEOUT_MS})
 */
@Slf4j
public record EngineSettings(CardioclawPaths paths, String openclawBinary, Duration execTimeout) {

    public static EngineSettings fromEnvironment() {
        return fromEnvironment(System.getenv(), System.getProperty("user.home"));
    }

    public static EngineSettings fromEnvironment(Map<String, String> env, String homedir) {
        CardioclawPaths paths = CardioclawPaths.resolve(env, homedir);

        String binary = env.get("CARDIOCLAW_OPENCLAW_BIN");
        if (binary == null || binary.isBlank())
            binary = OpenClawCliClient.DEFAULT_BINARY;

        Duration timeout = ProcessRunner.DEFAULT_TIMEOUT;
        String rawTimeout = env.get("CARDIOCLAW_EXEC_TIMEOUT_MS");
        if (rawTimeout != null && !rawTimeout.isBlank()) {
            try {
                long ms = Long.parseLong(rawTimeout.trim());
                if (ms > 0)
                    timeout = Duration.ofMillis(ms);
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid CARDIOCLAW_EXEC_TIMEOUT_MS '{}'", rawTimeout);
            }
        }
        return new EngineSettings(paths, binary.trim(), timeout);
    }

    public EngineSettings withDatabase(Path database) {
        return database == null ? this : new EngineSettings(paths.withDatabase(database), openclawBinary, execTimeout);
    }

    public EngineSettings withOpenclawBinary(String binary) {
        return new EngineSettings(paths, binary, execTimeout);
    }
}
