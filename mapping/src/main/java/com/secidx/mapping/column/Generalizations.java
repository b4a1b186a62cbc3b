package com.secidx.mapping.column;

import com.secidx.common.Values;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Parsing and formatting of generalization strings: scalars ({@code 18}),
 * closed or half-open ranges ({@code [10-19]}, {@code [10-20)}, negative
 * extremes as in {@code [-5--1]}) and category sets ({@code {a,b}}).
 */
public final class Generalizations {

    private Generalizations() {}

    /** Numeric extremes of a scalar or range generalization. */
    public record Interval(double start, double end, boolean rightOpen) {
        public boolean isIntegral() {
            return start == Math.rint(start) && end == Math.rint(end)
                    && !Double.isInfinite(start) && !Double.isInfinite(end);
        }
    }

    public static boolean isRange(String generalization) {
        return generalization != null && generalization.trim().startsWith("[");
    }

    public static boolean isSet(String generalization) {
        if (generalization == null) return false;
        String g = generalization.trim();
        return g.length() >= 2 && g.startsWith("{") && g.endsWith("}");
    }

    /**
     * @throws IllegalArgumentException when the string is neither a number nor a range
     */
    public static Interval parseInterval(String generalization) {
        Objects.requireNonNull(generalization, "generalization");
        String g = generalization.trim();
        if (!g.startsWith("[")) {
            double v = parseNumber(g, generalization);
            return new Interval(v, v, false);
        }
        boolean rightOpen = g.endsWith(")");
        if (g.length() < 2 || !(rightOpen || g.endsWith("]"))) {
            throw new IllegalArgumentException("Malformed range: " + generalization);
        }
        String inner = g.substring(1, g.length() - 1).trim();
        int sep = separator(inner);
        if (sep < 0) {
            double v = parseNumber(inner, generalization);
            return new Interval(v, v, rightOpen);
        }
        double start = parseNumber(inner.substring(0, sep), generalization);
        double end = parseNumber(inner.substring(sep + 1), generalization);
        if (start > end) {
            throw new IllegalArgumentException("Range start exceeds end: " + generalization);
        }
        return new Interval(start, end, rightOpen);
    }

    // first '-' that is neither a leading sign nor part of an exponent
    private static int separator(String inner) {
        for (int i = 1; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c != '-') continue;
            char prev = inner.charAt(i - 1);
            if (prev == 'e' || prev == 'E') continue;
            return i;
        }
        return -1;
    }

    private static double parseNumber(String text, String generalization) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a numeric generalization: " + generalization, e);
        }
    }

    public static String formatInterval(double start, double end, boolean rightOpen, boolean integral) {
        if (start == end && !rightOpen) return Values.format(start, integral);
        return "[" + Values.format(start, integral) + "-" + Values.format(end, integral)
                + (rightOpen ? ")" : "]");
    }

    /** Categories listed by a generalization; a plain value lists itself. */
    public static List<String> items(String generalization) {
        Objects.requireNonNull(generalization, "generalization");
        if (!isSet(generalization)) return List.of(generalization);
        String g = generalization.trim();
        return new ArrayList<>(Arrays.asList(g.substring(1, g.length() - 1).split(",", -1)));
    }

    /** {@code {a,b}} for several items, the item itself for one. */
    public static String formatSet(Collection<String> items) {
        if (items.size() == 1) return items.iterator().next();
        return "{" + String.join(",", items) + "}";
    }

    public static String canonicalSet(String generalization) {
        List<String> items = items(generalization);
        return formatSet(items.stream().distinct().sorted().toList());
    }
}
