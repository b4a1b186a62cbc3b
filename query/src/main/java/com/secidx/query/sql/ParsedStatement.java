package com.secidx.query.sql;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing one SELECT statement. Offsets index into {@link #sql()};
 * {@code -1} marks an absent clause.
 */
public record ParsedStatement(
        String sql,
        int projectionStart,
        int projectionEnd,
        String table,
        int tableStart,
        int tableEnd,
        int whereStart,
        int tailStart,
        List<Comparison> comparisons,
        boolean disjunctive,
        boolean negated
) {

    public ParsedStatement {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(table, "table");
        comparisons = List.copyOf(comparisons);
    }

    public boolean hasWhere() {
        return whereStart >= 0;
    }

    public boolean hasTail() {
        return tailStart >= 0;
    }

    /** GROUP BY / HAVING / ORDER BY text, verbatim, or empty. */
    public String tail() {
        return hasTail() ? sql.substring(tailStart) : "";
    }
}
