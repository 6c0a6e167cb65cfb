package com.phillippitts.callrelay.util;

/**
 * Human-readable call durations for notifications.
 *
 * <pre>
 * 42  -> "42 seconds"
 * 65  -> "1 minute 5 seconds"
 * 130 -> "2 minutes 10 seconds"
 * </pre>
 */
public final class DurationFormatter {

    private DurationFormatter() {}

    public static String format(long seconds) {
        long safe = Math.max(0, seconds);
        long mins = safe / 60;
        long secs = safe % 60;
        if (mins == 0) {
            return secs + " seconds";
        }
        if (mins == 1) {
            return "1 minute " + secs + " seconds";
        }
        return mins + " minutes " + secs + " seconds";
    }
}
