package com.secidx.common;

import java.math.BigDecimal;

/**
 * Conversions between user supplied predicate operands and the canonical forms
 * the mappings compare against.
 */
public final class Values {

    private Values() {}

    /**
     * Numeric view of an operand.
     *
     * @throws NumberFormatException when the operand is not numeric
     */
    public static double toDouble(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value == null) throw new NumberFormatException("null");
        return Double.parseDouble(value.toString().trim());
    }

    /**
     * Canonical textual form: integral numbers lose their fractional part
     * ({@code 18.0 -> "18"}), everything else is {@link String#valueOf}.
     */
    public static String canonical(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return format(((Number) value).doubleValue(), true);
        }
        if (value instanceof BigDecimal bd) {
            return format(bd.doubleValue(), true);
        }
        return String.valueOf(value);
    }

    /**
     * Formats a numeric extreme. With {@code integral} set, whole numbers are
     * printed without a fractional part.
     */
    public static String format(double value, boolean integral) {
        if (integral && value == Math.rint(value) && !Double.isInfinite(value)
                && Math.abs(value) < 9.007199254740992E15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
