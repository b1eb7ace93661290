package com.largomodo.nesinfo.util;

import java.util.Locale;

/**
 * Formats byte counts for display ("0 B", "512 B", "32 KB", "1.5 MB").
 * <p>
 * Values are divided by 1024 while they reach 1024 and a larger unit exists (up to GB).
 * Integral results print without decimals; anything else gets one decimal place,
 * rounded half-up with {@link Locale#ROOT} so output does not depend on the JVM locale.
 */
public class SizeFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    private SizeFormatter() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param bytes non-negative byte count
     * @return human-readable size
     * @throws IllegalArgumentException if bytes is negative
     */
    public static String format(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Byte count cannot be negative: " + bytes);
        }
        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        if (value == Math.rint(value)) {
            return (long) value + " " + UNITS[unit];
        }
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
    }
}
