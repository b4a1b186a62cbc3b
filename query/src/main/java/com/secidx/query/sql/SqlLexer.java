package com.secidx.query.sql;

import com.secidx.common.SqlParseException;
import com.secidx.query.sql.SqlToken.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits a statement into {@link SqlToken}s, whitespace and comments
 * included.
 *
 * <ul>
 *   <li>bare words are keywords when listed in {@link #KEYWORDS}, identifiers otherwise</li>
 *   <li>{@code "quoted"} identifiers use {@code ""} as escape; dotted names
 *       ({@code t."A"}) form a single identifier token</li>
 *   <li>{@code 'strings'} use {@code ''} as escape</li>
 *   <li>a {@code -} directly before a digit is a sign unless it follows an operand</li>
 *   <li>{@code -- line} and {@code /* block *}{@code /} comments</li>
 * </ul>
 */
public final class SqlLexer {

    static final Set<String> KEYWORDS = Set.of(
            "SELECT", "DISTINCT", "ALL", "FROM", "WHERE", "GROUP", "BY", "HAVING", "ORDER",
            "AND", "OR", "NOT", "IN", "LIKE", "IS", "BETWEEN", "NULL", "TRUE", "FALSE",
            "ANY", "SOME", "EXISTS", "INSERT", "UPDATE", "DELETE", "INTO", "SET", "VALUES",
            "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "NATURAL", "ON", "USING", "AS",
            "CASE", "WHEN", "THEN", "ELSE", "END", "LIMIT", "OFFSET", "UNION", "EXCEPT", "INTERSECT",
            "ASC", "DESC", "NULLS", "FIRST", "LAST", "WITH");

    private static final List<String> OPERATORS = List.of(
            "<>", "!=", "<=", ">=", "||", "=", "<", ">", "+", "-", "/", "%", "&", "|", "^");

    private final String sql;
    private final List<SqlToken> tokens = new ArrayList<>();
    private int pos;

    private SqlLexer(String sql) {
        this.sql = sql;
    }

    public static List<SqlToken> tokenize(String sql) {
        if (sql == null) throw new SqlParseException("Empty SQL statement provided");
        SqlLexer lexer = new SqlLexer(sql);
        lexer.run();
        return List.copyOf(lexer.tokens);
    }

    private void run() {
        while (pos < sql.length()) {
            char c = sql.charAt(pos);
            int start = pos;
            if (Character.isWhitespace(c)) {
                while (pos < sql.length() && Character.isWhitespace(sql.charAt(pos))) pos++;
                add(Type.WHITESPACE, start, sql.substring(start, pos));
            } else if (sql.startsWith("--", pos)) {
                int nl = sql.indexOf('\n', pos);
                pos = nl < 0 ? sql.length() : nl;
                add(Type.COMMENT, start, sql.substring(start, pos));
            } else if (sql.startsWith("/*", pos)) {
                int close = sql.indexOf("*/", pos + 2);
                if (close < 0) throw new SqlParseException("Unterminated comment", "/*", start);
                pos = close + 2;
                add(Type.COMMENT, start, sql.substring(start, pos));
            } else if (c == '\'') {
                String content = quoted('\'');
                add(Type.STRING, start, content);
            } else if (c == '"' || Character.isLetter(c) || c == '_') {
                name(start);
            } else if (Character.isDigit(c) || (c == '.' && nextIsDigit(pos + 1))
                    || (c == '-' && nextIsDigit(pos + 1) && !followsOperand())) {
                number(start);
            } else if (c == ',') {
                single(Type.COMMA);
            } else if (c == '(') {
                single(Type.LPAREN);
            } else if (c == ')') {
                single(Type.RPAREN);
            } else if (c == ';') {
                single(Type.SEMICOLON);
            } else if (c == '*') {
                single(Type.STAR);
            } else {
                operator(start);
            }
        }
    }

    private void add(Type type, int start, String value) {
        tokens.add(SqlToken.of(type, sql.substring(start, pos), value, start));
    }

    private void single(Type type) {
        int start = pos++;
        add(type, start, sql.substring(start, pos));
    }

    private boolean nextIsDigit(int i) {
        return i < sql.length() && Character.isDigit(sql.charAt(i));
    }

    private boolean followsOperand() {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            SqlToken t = tokens.get(i);
            if (!t.isSignificant()) continue;
            return switch (t.type()) {
                case IDENTIFIER, NUMBER, STRING, RPAREN -> true;
                case KEYWORD -> t.value().equals("NULL") || t.value().equals("TRUE") || t.value().equals("FALSE");
                default -> false;
            };
        }
        return false;
    }

    // reads a quoted run starting at pos, returns the unescaped content
    private String quoted(char quote) {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        pos++;
        while (true) {
            if (pos >= sql.length()) {
                throw new SqlParseException("Unterminated quoted text", sql.substring(start), start);
            }
            char c = sql.charAt(pos++);
            if (c == quote) {
                if (pos < sql.length() && sql.charAt(pos) == quote) {
                    sb.append(quote);
                    pos++;
                } else {
                    return sb.toString();
                }
            } else {
                sb.append(c);
            }
        }
    }

    private String bareWord() {
        int start = pos;
        while (pos < sql.length()) {
            char c = sql.charAt(pos);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '$')) break;
            pos++;
        }
        return sql.substring(start, pos);
    }

    private void name(int start) {
        List<String> parts = new ArrayList<>();
        boolean quotedPart = sql.charAt(pos) == '"';
        parts.add(quotedPart ? quoted('"') : bareWord());

        while (pos + 1 < sql.length() && sql.charAt(pos) == '.'
                && (sql.charAt(pos + 1) == '"' || Character.isLetter(sql.charAt(pos + 1))
                    || sql.charAt(pos + 1) == '_')) {
            pos++;
            quotedPart = sql.charAt(pos) == '"';
            parts.add(quotedPart ? quoted('"') : bareWord());
        }

        String text = sql.substring(start, pos);
        if (parts.size() == 1 && !text.startsWith("\"")) {
            String upper = text.toUpperCase(Locale.ROOT);
            if (KEYWORDS.contains(upper)) {
                tokens.add(SqlToken.of(Type.KEYWORD, text, upper, start));
                return;
            }
        }
        tokens.add(new SqlToken(Type.IDENTIFIER, text, String.join(".", parts), parts, start));
    }

    private void number(int start) {
        if (sql.charAt(pos) == '-') pos++;
        while (nextIsDigit(pos)) pos++;
        if (pos < sql.length() && sql.charAt(pos) == '.') {
            pos++;
            while (nextIsDigit(pos)) pos++;
        }
        if (pos < sql.length() && (sql.charAt(pos) == 'e' || sql.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < sql.length() && (sql.charAt(pos) == '+' || sql.charAt(pos) == '-')) pos++;
            if (nextIsDigit(pos)) {
                while (nextIsDigit(pos)) pos++;
            } else {
                pos = mark;
            }
        }
        if (pos < sql.length() && (Character.isLetter(sql.charAt(pos)) || sql.charAt(pos) == '_')) {
            throw new SqlParseException("Malformed number", sql.substring(start, pos + 1), start);
        }
        add(Type.NUMBER, start, sql.substring(start, pos));
    }

    private void operator(int start) {
        for (String op : OPERATORS) {
            if (sql.startsWith(op, pos)) {
                pos += op.length();
                add(Type.OPERATOR, start, op.equals("!=") ? "<>" : op);
                return;
            }
        }
        throw new SqlParseException("Unexpected character '" + sql.charAt(pos) + "'",
                String.valueOf(sql.charAt(pos)), pos);
    }
}
