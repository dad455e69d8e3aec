package com.example.storyboard_matcher.util;

import com.example.storyboard_matcher.exception.TimestampFormatException;

import java.util.Locale;

/**
 * Converts between clip timestamps and seconds.
 * <p>
 * Accepted input is {@code MM:SS.mmm} (minutes unbounded) or {@code HH:MM:SS.mmm} (minutes below 60).
 * Seconds always carry exactly two integer digits and three fractional digits.
 */
public final class TimestampCodec {

    // any long fits in 18 decimal digits
    private static final int MAX_DIGITS = 18;

    private TimestampCodec() {
    }

    /**
     * Parses a timestamp to seconds.
     *
     * @param text timestamp text.
     * @return seconds, millisecond precision.
     * @throws TimestampFormatException when the structure, digit counts or ranges are violated.
     */
    public static double parse(String text) {
        if (text == null) {
            throw new TimestampFormatException("Timestamp is missing.");
        }
        String value = text.trim();
        String[] parts = value.split(":", -1);
        if (parts.length != 2 && parts.length != 3) {
            throw new TimestampFormatException("Invalid timestamp format: " + text);
        }

        long hours = 0;
        String minutesPart;
        String secondsPart;
        if (parts.length == 3) {
            hours = parseDigits(parts[0], text, "hours");
            minutesPart = parts[1];
            secondsPart = parts[2];
        } else {
            minutesPart = parts[0];
            secondsPart = parts[1];
        }
        long minutes = parseDigits(minutesPart, text, "minutes");
        if (parts.length == 3 && minutes >= 60) {
            throw new TimestampFormatException("Minutes must be < 60 in timestamp: " + text);
        }

        int dot = secondsPart.indexOf('.');
        if (dot != 2 || secondsPart.length() != 6) {
            throw new TimestampFormatException("Seconds must be SS.mmm in timestamp: " + text);
        }
        long wholeSeconds = parseDigits(secondsPart.substring(0, 2), text, "seconds");
        long millis = parseDigits(secondsPart.substring(3), text, "milliseconds");
        if (wholeSeconds >= 60) {
            throw new TimestampFormatException("Seconds must be < 60 in timestamp: " + text);
        }

        long totalMillis;
        try {
            long totalSeconds = Math.addExact(Math.addExact(Math.multiplyExact(hours, 3600L),
                    Math.multiplyExact(minutes, 60L)), wholeSeconds);
            totalMillis = Math.addExact(Math.multiplyExact(totalSeconds, 1000L), millis);
        } catch (ArithmeticException e) {
            throw new TimestampFormatException("Timestamp out of range: " + text);
        }
        return totalMillis / 1000.0;
    }

    /**
     * Formats seconds as {@code MM:SS.mmm}. Negative input is clamped to zero; minutes grow past 59.
     */
    public static String format(double seconds) {
        long totalMillis = toMillis(seconds);
        long minutes = totalMillis / 60_000;
        long secs = (totalMillis / 1000) % 60;
        long millis = totalMillis % 1000;
        return String.format(Locale.ROOT, "%02d:%02d.%03d", minutes, secs, millis);
    }

    /**
     * Formats seconds as {@code HH:MM:SS.mmm}.
     */
    public static String formatLong(double seconds) {
        long totalMillis = toMillis(seconds);
        long hours = totalMillis / 3_600_000;
        long minutes = (totalMillis / 60_000) % 60;
        long secs = (totalMillis / 1000) % 60;
        long millis = totalMillis % 1000;
        return String.format(Locale.ROOT, "%02d:%02d:%02d.%03d", hours, minutes, secs, millis);
    }

    private static long toMillis(double seconds) {
        if (Double.isNaN(seconds) || seconds <= 0) {
            return 0L;
        }
        return Math.round(seconds * 1000.0);
    }

    private static long parseDigits(String part, String original, String field) {
        if (part.isEmpty() || part.length() > MAX_DIGITS) {
            throw new TimestampFormatException("Invalid " + field + " in timestamp: " + original);
        }
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c < '0' || c > '9') {
                throw new TimestampFormatException("Invalid " + field + " in timestamp: " + original);
            }
        }
        return Long.parseLong(part);
    }
}
