package com.cardioclaw.common.infra;

/**
 * Human-readable renderings of durations and distances in time.
 */
public final class FormatAge {

    private FormatAge() {
    }

    /**
     * Format a run duration: "N/A" when unknown or zero, "Xs" below a minute,
     * "Xm Ys" above.
     */
    public static String formatRunDuration(Long ms) {
        if (ms == null || ms <= 0)
            return "N/A";
        long seconds = ms / 1000;
        long minutes = seconds / 60;
        if (minutes > 0)
            return minutes + "m " + (seconds % 60) + "s";
        return seconds + "s";
    }

    /**
     * Format the distance from now to a future instant.
     * Examples: "overdue", "45m", "3h 20m", "2d 4h".
     */
    public static String formatTimeUntil(long targetMs, long nowMs) {
        long diff = targetMs - nowMs;
        if (diff < 0)
            return "overdue";

        long minutes = diff / 60_000;
        long hours = minutes / 60;
        long days = hours / 24;
        if (days > 0)
            return days + "d " + (hours % 24) + "h";
        if (hours > 0)
            return hours + "h " + (minutes % 60) + "m";
        return minutes + "m";
    }

    /**
     * Format an age in milliseconds.
     * Examples: "just now", "5m ago", "3h ago", "2d ago".
     */
    public static String formatAge(long ms) {
        if (ms < 0)
            return "unknown";

        long minutes = Math.round(ms / 60_000.0);
        if (minutes < 1)
            return "just now";
        if (minutes < 60)
            return minutes + "m ago";

        long hours = Math.round(minutes / 60.0);
        if (hours < 48)
            return hours + "h ago";

        long days = Math.round(hours / 24.0);
        return days + "d ago";
    }

    /**
     * Truncate a message to {@code max} characters, appending "..." when cut.
     */
    public static String truncate(String text, int max) {
        if (text == null)
            return "";
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
