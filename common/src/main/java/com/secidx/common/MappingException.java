package com.secidx.common;

import java.util.Objects;

/**
 * Failure to resolve a predicate against a mapping.
 *
 * <p>Callers branch on {@link #getKind()}; the message is for humans only.
 */
public class MappingException extends SecureIndexException {

    public enum Kind {
        /** The column is not part of the mapping. */
        UNKNOWN_COLUMN,
        /** The stored mapping type has no implementation. */
        UNKNOWN_MAPPING_TYPE,
        /** The operator is not defined for the column's mapping kind. */
        UNSUPPORTED_OPERATION,
        /** The operand cannot be interpreted by the mapping (e.g. non-numeric value on a range). */
        INVALID_INPUT,
        /** Both comparands are columns, or none is. */
        COLUMN_COMPARISON,
        /** Key-value planning met a disjunctive or negated WHERE clause. */
        NON_CONJUNCTIVE
    }

    private final Kind kind;
    private final String column;

    public MappingException(Kind kind, String column, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.column = column;
    }

    public MappingException(Kind kind, String column, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.column = column;
    }

    public static MappingException unknownColumn(String column) {
        return new MappingException(Kind.UNKNOWN_COLUMN, column,
                column + " does not exist in the mapping.");
    }

    public static MappingException unsupported(String column, MappingType type, String operation) {
        return new MappingException(Kind.UNSUPPORTED_OPERATION, column,
                "Unsupported operation '" + operation + "' for " + type.getName()
                        + " mapping on column " + column
                        + (type.isCategorical() ? " (categorical mapping has no ordering)" : ""));
    }

    public Kind getKind() {
        return kind;
    }

    /** Column the failure refers to, may be null. */
    public String getColumn() {
        return column;
    }
}
