package com.secidx.query.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** One side of a comparison. */
public interface Operand {

    /** Marker literal for {@code IS NOT NULL}. */
    String NOT_NULL = "NOT NULL";

    /** Column reference, optionally qualified by a table name. */
    record Column(String table, String name) implements Operand {
        public Column {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return table == null ? '"' + name + '"' : table + ".\"" + name + '"';
        }
    }

    /**
     * Constant value: {@link Long} for integral numbers, {@link Double} for other
     * numbers, {@link String} for text, {@link Boolean}, or {@code null} for NULL.
     */
    record Literal(Object value) implements Operand {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /** Parenthesized literal list on the right of IN. */
    record ValueList(List<Object> values) implements Operand {
        public ValueList {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }
}
