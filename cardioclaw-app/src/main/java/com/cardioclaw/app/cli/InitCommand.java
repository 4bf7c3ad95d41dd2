package com.cardioclaw.app.cli;

import com.cardioclaw.common.errors.UsageException;
import com.cardioclaw.engine.CardioclawEngine;
import com.cardioclaw.engine.heartbeat.HeartbeatDefaults;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.concurrent.Callable;

@Command(name = "init", description = "Write a starter cardioclaw.yaml")
class InitCommand implements Callable<Integer> {

    @ParentCommand
    CardioclawCommand parent;

    @Option(names = "--timezone", description = "IANA zone for defaults.timezone (default: detected)")
    String timezone;

    @Override
    public Integer call() {
        CardioclawEngine engine = parent.engine();
        Path target = parent.configOption() != null
                ? Path.of(parent.configOption())
                : engine.configLocator().getHomeConfig();
        PrintWriter out = parent.out();

        String zone = timezone != null ? validZone(timezone)
                : engine.timezoneResolver().resolve(null, HeartbeatDefaults.none()).zoneId();
        if (!engine.initializer().init(target, zone)) {
            out.println("Config already exists at " + target);
            return 0;
        }
        out.printf("✓ Created %s (timezone: %s)%n", target, zone);
        out.println("  Add heartbeats to it, then run `cardioclaw sync`");
        return 0;
    }

    private static String validZone(String zone) {
        try {
            return ZoneId.of(zone).getId();
        } catch (DateTimeException e) {
            throw new UsageException("Invalid timezone: " + zone);
        }
    }
}
