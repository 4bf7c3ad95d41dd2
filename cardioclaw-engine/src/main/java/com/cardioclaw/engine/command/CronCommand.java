package com.cardioclaw.engine.command;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Argument vector for {@code <bin> cron add ...}, without the binary itself.
 *
 * @param args     discrete arguments, never joined into a shell string
 * @param timezone the resolution used, or null when the schedule fixed its own
 *                 zone
 */
public record CronCommand(List<String> args, TimezoneResolution timezone) {

    private static final Pattern SAFE = Pattern.compile("^[A-Za-z0-9_@%+=:,./-]+$");

    public CronCommand {
        args = List.copyOf(args);
    }

    public String warning() {
        return timezone != null ? timezone.warning() : null;
    }

    /**
     * Shell-quoted rendering for display in dry runs.
     */
    public String render(String binary) {
        String rendered = args.stream().map(CronCommand::quote).collect(Collectors.joining(" "));
        return binary + " " + rendered;
    }

    static String quote(String arg) {
        if (!arg.isEmpty() && SAFE.matcher(arg).matches())
            return arg;
        return "'" + arg.replace("'", "'\\''") + "'";
    }
}
