package com.secidx.query.sql;

import java.util.Objects;

/**
 * A comparison recorded while parsing the WHERE clause.
 *
 * @param left     left operand
 * @param operator {@code = <> < <= > >= IN LIKE IS BETWEEN}
 * @param right    right operand; the lower bound for BETWEEN
 * @param upper    upper bound for BETWEEN, {@code null} otherwise
 * @param negated  inside a NOT or written as NOT IN / NOT BETWEEN / NOT LIKE
 * @param start    character offset of the first character
 * @param end      character offset just past the last character
 */
public record Comparison(Operand left, String operator, Operand right, Operand upper,
                         boolean negated, int start, int end) {

    public Comparison {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    public boolean isBetween() {
        return "BETWEEN".equals(operator);
    }

    Comparison negate() {
        return new Comparison(left, operator, right, upper, !negated, start, end);
    }

    @Override
    public String toString() {
        String body = isBetween()
                ? left + " BETWEEN " + right + " AND " + upper
                : left + " " + operator + " " + right;
        return negated ? "NOT (" + body + ")" : body;
    }
}
