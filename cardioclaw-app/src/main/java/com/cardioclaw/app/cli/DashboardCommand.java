package com.cardioclaw.app.cli;

import com.cardioclaw.app.CardioclawApplication;
import com.cardioclaw.app.dashboard.DashboardProperties;
import org.springframework.boot.builder.SpringApplicationBuilder;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.security.SecureRandom;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "dashboard", description = "Serve the dashboard JSON API")
class DashboardCommand implements Callable<Integer> {

    static final String ANY_HOST = "0.0.0.0";

    @ParentCommand
    CardioclawCommand parent;

    @Option(names = "--port", defaultValue = "" + DashboardProperties.DEFAULT_PORT,
            description = "Port (default: ${DEFAULT-VALUE})")
    int port;

    @Option(names = "--host", description = "Bind address (default: 127.0.0.1, or 0.0.0.0 with --remote)")
    String host;

    @Option(names = "--remote", description = "Listen on all interfaces and require a token")
    boolean remote;

    @Option(names = "--token", description = "Access token (generated with --remote when omitted)")
    String token;

    @Override
    public Integer call() {
        String bindHost = host != null ? host : remote ? ANY_HOST : DashboardProperties.LOCAL_HOST;
        String accessToken = token;
        if (remote && (accessToken == null || accessToken.isBlank())) {
            accessToken = generateToken();
        }

        new SpringApplicationBuilder(CardioclawApplication.class)
                .properties(properties(bindHost, accessToken))
                .run();
        parent.markServing();
        printBanner(parent.out(), accessToken);
        return 0;
    }

    Map<String, Object> properties(String bindHost, String accessToken) {
        Map<String, Object> props = new HashMap<>();
        props.put("cardioclaw.dashboard.port", port);
        props.put("cardioclaw.dashboard.host", bindHost);
        if (accessToken != null)
            props.put("cardioclaw.dashboard.token", accessToken);
        if (parent.configOption() != null)
            props.put("cardioclaw.dashboard.config", parent.configOption());
        if (parent.database != null)
            props.put("cardioclaw.dashboard.database", parent.database.toString());
        return props;
    }

    private void printBanner(PrintWriter out, String accessToken) {
        String query = accessToken != null ? "?token=" + accessToken : "";
        out.println();
        out.println("🫀 CardioClaw Dashboard");
        out.println("━".repeat(36));
        out.println();
        if (remote) {
            out.println("  Mode:         🌐 Remote (network access enabled)");
            out.println("  Token:        " + accessToken);
            out.println();
        }
        out.printf("  Local:        http://localhost:%d%s%n", port, query);
        if (accessToken != null) {
            out.println();
            out.println("  ⚠️  Keep this token secret; it grants full dashboard access");
        }
        out.println();
        out.println("Press Ctrl+C to stop");
        out.flush();
    }

    /**
     * 32 hex characters from a secure random source.
     */
    static String generateToken() {
        byte[] bytes = new byte[16];
        new SecureRandom().nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
