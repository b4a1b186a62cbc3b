package com.secidx.common;

import java.io.Serializable;
import java.util.Objects;

/**
 * Opaque identifier of the encrypted blob(s) that may hold rows matching a
 * generalization.
 *
 * A token is either numeric (static, group-id and runtime-derived tokens) or
 * textual (plain generalization passthrough and keyed hashes). Within one
 * column all tokens share the same kind.
 */
public final class Token implements Comparable<Token>, Serializable {

    private static final long serialVersionUID = 1L;

    private final long number;
    private final String text;

    private Token(long number, String text) {
        this.number = number;
        this.text = text;
    }

    public static Token of(long number) {
        return new Token(number, null);
    }

    public static Token of(String text) {
        return new Token(0L, Objects.requireNonNull(text, "text"));
    }

    public boolean isNumeric() {
        return text == null;
    }

    public long asLong() {
        if (!isNumeric()) {
            throw new IllegalStateException("Token '" + text + "' is not numeric");
        }
        return number;
    }

    /** Literal usable inside a SQL {@code VALUES} list. */
    public String toSqlLiteral() {
        if (isNumeric()) return Long.toString(number);
        return "'" + text.replace("'", "''") + "'";
    }

    @Override
    public int compareTo(Token o) {
        if (isNumeric() != o.isNumeric()) {
            return isNumeric() ? -1 : 1;
        }
        return isNumeric() ? Long.compare(number, o.number) : text.compareTo(o.text);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Token that)) return false;
        return number == that.number && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return isNumeric() ? Long.hashCode(number) : text.hashCode();
    }

    @Override
    public String toString() {
        return isNumeric() ? Long.toString(number) : text;
    }
}
