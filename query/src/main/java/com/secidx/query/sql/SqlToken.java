package com.secidx.query.sql;

import java.util.List;
import java.util.Objects;

/**
 * One lexical token. {@link #text()} is the exact source text, so concatenating
 * every token of a statement reproduces it byte for byte.
 *
 * @param type     token class
 * @param text     source text
 * @param value    normalized value: upper-case keyword, unescaped string
 *                 content, operator with {@code !=} folded into {@code <>}
 * @param parts    unquoted name parts of an identifier, empty otherwise
 * @param position offset of the first character in the statement
 */
public record SqlToken(Type type, String text, String value, List<String> parts, int position) {

    public enum Type {
        KEYWORD, IDENTIFIER, STRING, NUMBER, OPERATOR,
        COMMA, LPAREN, RPAREN, SEMICOLON, STAR,
        WHITESPACE, COMMENT
    }

    public SqlToken {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(value, "value");
        parts = List.copyOf(parts);
    }

    static SqlToken of(Type type, String text, String value, int position) {
        return new SqlToken(type, text, value, List.of(), position);
    }

    public boolean isSignificant() {
        return type != Type.WHITESPACE && type != Type.COMMENT;
    }

    public boolean isKeyword(String keyword) {
        return type == Type.KEYWORD && value.equals(keyword);
    }

    public boolean isOperator(String operator) {
        return type == Type.OPERATOR && value.equals(operator);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
