package com.cardioclaw.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Well-known locations: state directory, default declarative file, cache
 * database and the OpenClaw system config consulted for the timezone.
 *
 * @param stateDir       CardioClaw state directory (default {@code ~/.cardioclaw})
 * @param homeConfig     fallback declarative file inside the state directory
 * @param database       cache database file
 * @param openclawConfig OpenClaw system config file
 */
public record CardioclawPaths(
        Path stateDir,
        Path homeConfig,
        Path database,
        Path openclawConfig) {

    public static final String CONFIG_FILENAME = "cardioclaw.yaml";
    public static final String DATABASE_FILENAME = "state.db";

    private static final String STATE_DIRNAME = ".cardioclaw";
    private static final String OPENCLAW_STATE_DIRNAME = ".openclaw";
    private static final String OPENCLAW_CONFIG_FILENAME = "openclaw.json";

    /**
     * Resolve paths from the process environment and {@code user.home}.
     */
    public static CardioclawPaths resolve() {
        return resolve(System.getenv(), System.getProperty("user.home"));
    }

    /**
     * Resolve paths from an explicit environment.
     * <ul>
     * <li>{@code CARDIOCLAW_HOME} overrides the state directory</li>
     * <li>{@code CARDIOCLAW_DB} overrides the cache database file</li>
     * <li>{@code OPENCLAW_STATE_DIR} overrides the OpenClaw state directory</li>
     * </ul>
     */
    public static CardioclawPaths resolve(Map<String, String> env, String homedir) {
        String stateOverride = envTrimmed(env, "CARDIOCLAW_HOME");
        Path stateDir = stateOverride != null
                ? resolveUserPath(stateOverride, homedir)
                : Path.of(homedir, STATE_DIRNAME);

        String dbOverride = envTrimmed(env, "CARDIOCLAW_DB");
        Path database = dbOverride != null
                ? resolveUserPath(dbOverride, homedir)
                : stateDir.resolve(DATABASE_FILENAME);

        String openclawOverride = envTrimmed(env, "OPENCLAW_STATE_DIR");
        Path openclawDir = openclawOverride != null
                ? resolveUserPath(openclawOverride, homedir)
                : Path.of(homedir, OPENCLAW_STATE_DIRNAME);

        return new CardioclawPaths(
                stateDir,
                stateDir.resolve(CONFIG_FILENAME),
                database,
                openclawDir.resolve(OPENCLAW_CONFIG_FILENAME));
    }

    /**
     * Same paths with a different cache database.
     */
    public CardioclawPaths withDatabase(Path database) {
        return new CardioclawPaths(stateDir, homeConfig, database, openclawConfig);
    }

    /**
     * Expand a leading {@code ~} and normalize to an absolute path.
     */
    public static Path resolveUserPath(String input, String homedir) {
        if (input == null || input.trim().isEmpty())
            return Path.of("");
        String trimmed = input.trim();
        if (trimmed.startsWith("~")) {
            return Path.of(homedir + trimmed.substring(1)).toAbsolutePath().normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String val = env.get(key);
        return val != null && !val.trim().isEmpty() ? val.trim() : null;
    }
}
