package com.thevig.backend.util;

/**
 * Formats a countdown as {@code h:mm:ss}, or {@code m:ss} under an hour.
 */
public final class DraftTimeFormatter {

    private DraftTimeFormatter() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String format(Long seconds) {
        if (seconds == null || seconds <= 0) {
            return "0:00";
        }
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return String.format("%d:%02d:%02d", hours, minutes, secs);
        }
        return String.format("%d:%02d", minutes, secs);
    }
}
