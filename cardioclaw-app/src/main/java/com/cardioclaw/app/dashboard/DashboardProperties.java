package com.cardioclaw.app.dashboard;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Dashboard settings, bound from {@code cardioclaw.dashboard.*}. The CLI
 * fills these from its flags when it starts the server.
 */
@Data
@ConfigurationProperties(prefix = "cardioclaw.dashboard")
public class DashboardProperties {

    public static final int DEFAULT_PORT = 3333;
    public static final String LOCAL_HOST = "127.0.0.1";

    private int port = DEFAULT_PORT;
    private String host = LOCAL_HOST;
    /** Required on every request when set. */
    private String token;
    /** Minimum spacing between manual refreshes. */
    private Duration refreshInterval = Duration.ofSeconds(10);
    /** Declarative file used to mark jobs as managed; located as the CLI does when unset. */
    private String config;
    /** State database; the engine default when unset. */
    private String database;
    private boolean refreshOnStartup = true;

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
