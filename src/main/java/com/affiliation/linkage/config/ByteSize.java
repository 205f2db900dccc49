package com.affiliation.linkage.config;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-readable sizes such as {@code 512MB}, {@code 2 GB} or {@code 1048576}.
 * Units are binary (1KB = 1024 bytes).
 */
public final class ByteSize {

    private static final Pattern SIZE = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\s*([KMGT]?I?B?)?\\s*$");

    private ByteSize() {
        // Utility class
    }

    public static long parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Size must not be null");
        }
        Matcher matcher = SIZE.matcher(text.toUpperCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid size '" + text + "', expected e.g. 512MB");
        }
        double amount = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2) == null ? "" : matcher.group(2);
        long multiplier = switch (unit.isEmpty() ? ' ' : unit.charAt(0)) {
            case 'K' -> 1L << 10;
            case 'M' -> 1L << 20;
            case 'G' -> 1L << 30;
            case 'T' -> 1L << 40;
            default -> 1L;
        };
        return (long) (amount * multiplier);
    }
}
