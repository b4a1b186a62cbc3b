package com.secidx.query.sql;

import com.secidx.common.SqlParseException;
import com.secidx.query.sql.SqlToken.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for the supported SQL subset:
 *
 * <pre>
 *   SELECT [DISTINCT|ALL] projection FROM table
 *   [WHERE expr]
 *   [GROUP BY ... | HAVING ... | ORDER BY ... | LIMIT ... | OFFSET ...]
 * </pre>
 *
 * The WHERE expression is evaluated with an operand stack and an operator stack.
 * Every binary comparison, IN and BETWEEN reduces into a {@link Comparison}
 * holding its character span, so callers can splice replacements into the
 * original text. Whatever follows the WHERE expression is kept verbatim as tail.
 *
 * Instances are single use; {@link #parse(String)} is thread-safe.
 */
public final class SqlParser {

    private static final Logger log = LoggerFactory.getLogger(SqlParser.class);

    // =====================================================================
    // Precedence table
    // =====================================================================

    private static final Map<String, Integer> PRECEDENCE = Map.ofEntries(
            Map.entry("IN", 5),
            Map.entry("=", 4), Map.entry("<>", 4), Map.entry("<", 4),
            Map.entry("<=", 4), Map.entry(">", 4), Map.entry(">=", 4),
            Map.entry("BETWEEN", 3), Map.entry("LIKE", 3),
            Map.entry("NOT", 2),
            Map.entry("AND", 1),
            Map.entry("OR", 0),
            Map.entry("IS", -1));

    private static final int BETWEEN_PRECEDENCE = 3;

    private static final Set<String> COMPARISON_OPERATORS = Set.of("=", "<>", "<", "<=", ">", ">=");
    private static final Set<String> TAIL_KEYWORDS = Set.of("GROUP", "HAVING", "ORDER", "LIMIT", "OFFSET");
    private static final Set<String> JOIN_KEYWORDS = Set.of("JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS", "NATURAL");
    private static final Set<String> SUBQUERY_KEYWORDS = Set.of("EXISTS", "ANY", "SOME", "ALL", "SELECT");
    private static final Set<String> UNSUPPORTED_STATEMENTS = Set.of("INSERT", "UPDATE", "DELETE");

    private final String sql;
    private final List<SqlToken> tokens;
    private final List<Comparison> comparisons = new ArrayList<>();
    private int pos;
    private boolean disjunctive;
    private boolean negated;

    private SqlParser(String sql) {
        this.sql = sql;
        this.tokens = SqlLexer.tokenize(sql).stream().filter(SqlToken::isSignificant).toList();
    }

    public static ParsedStatement parse(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new SqlParseException("Empty SQL statement provided");
        }
        return new SqlParser(sql).statement();
    }

    // =====================================================================
    // Statement level
    // =====================================================================

    private ParsedStatement statement() {
        SqlToken first = peek();
        if (first == null || first.type() == Type.SEMICOLON) {
            throw new SqlParseException("Empty SQL statement provided");
        }
        if (first.type() == Type.KEYWORD && UNSUPPORTED_STATEMENTS.contains(first.value())) {
            throw new SqlParseException("'" + first.value() + "' is not supported yet.", first.text(), first.position());
        }
        if (!first.isKeyword("SELECT")) {
            throw error("Only SELECT statements are supported", first);
        }
        pos++;

        int projectionStart = end(first);
        SqlToken from = skipProjection(first);
        int projectionEnd = from.position();
        pos++;

        SqlToken table = peek();
        if (table == null) {
            throw new SqlParseException("Missing table name after FROM", from.text(), from.position());
        }
        if (table.type() == Type.LPAREN) {
            throw error("Subqueries are not supported yet.", table);
        }
        if (table.type() != Type.IDENTIFIER) {
            throw error("Expected a table name after FROM", table);
        }
        pos++;

        int whereStart = -1;
        int tailStart = -1;
        SqlToken next = peek();
        if (next != null) {
            if (next.type() == Type.IDENTIFIER || next.isKeyword("AS")) {
                throw error("Alias is not supported yet.", next);
            }
            if (next.type() == Type.KEYWORD && JOIN_KEYWORDS.contains(next.value())) {
                throw error("JOIN is not supported yet.", next);
            }
            if (next.type() == Type.COMMA) {
                throw error("invalid syntax: comma", next);
            }
            if (next.isKeyword("WHERE")) {
                pos++;
                whereStart = end(next);
                Node root = expression(false);
                if (root.kind != Kind.PREDICATE) {
                    throw new SqlParseException("invalid comparison clause: "
                            + sql.substring(root.start, root.end).trim(), null, root.start);
                }
            }
            tailStart = tail();
        }

        ParsedStatement parsed = new ParsedStatement(sql, projectionStart, projectionEnd,
                String.join(".", table.parts()), table.position(), end(table),
                whereStart, tailStart, comparisons, disjunctive, negated);
        if (log.isDebugEnabled()) {
            log.debug("Parsed table={} comparisons={} disjunctive={} negated={}",
                    parsed.table(), parsed.comparisons(), disjunctive, negated);
        }
        return parsed;
    }

    private SqlToken skipProjection(SqlToken select) {
        int depth = 0;
        boolean empty = true;
        while (true) {
            SqlToken t = peek();
            if (t == null || (depth == 0 && t.type() == Type.SEMICOLON)) {
                throw new SqlParseException("Missing FROM clause", select.text(), select.position());
            }
            if (depth == 0 && t.isKeyword("FROM")) {
                if (empty) throw error("Empty projection", t);
                return t;
            }
            if (t.type() == Type.LPAREN) depth++;
            if (t.type() == Type.RPAREN) depth--;
            if (!(t.isKeyword("DISTINCT") || t.isKeyword("ALL"))) empty = false;
            pos++;
        }
    }

    /** Returns the tail offset or -1; rejects anything else after the WHERE expression. */
    private int tail() {
        SqlToken t = peek();
        if (t == null) return -1;
        if (t.type() == Type.KEYWORD && TAIL_KEYWORDS.contains(t.value())) {
            if ((t.isKeyword("GROUP") || t.isKeyword("ORDER"))) {
                SqlToken by = peekAt(pos + 1);
                if (by == null || !by.isKeyword("BY")) {
                    throw error("Expected BY after " + t.value(), t);
                }
            }
            return t.position();
        }
        if (t.type() == Type.SEMICOLON) {
            SqlToken after = peekAt(pos + 1);
            if (after != null) throw error("Only one statement is supported", after);
            return -1;
        }
        if (t.type() == Type.KEYWORD) {
            throw error("Unexpected keyword '" + t.value() + "'", t);
        }
        throw error("Unexpected token '" + t.text() + "'", t);
    }

    // =====================================================================
    // WHERE expression: shift-reduce evaluation
    // =====================================================================

    private enum Kind { VALUE, PREDICATE }

    private static final class Node {
        final Kind kind;
        final Operand operand;
        final List<Integer> comparisonIndexes;
        final int start;
        final int end;

        Node(Kind kind, Operand operand, List<Integer> comparisonIndexes, int start, int end) {
            this.kind = kind;
            this.operand = operand;
            this.comparisonIndexes = comparisonIndexes;
            this.start = start;
            this.end = end;
        }

        static Node value(Operand operand, int start, int end) {
            return new Node(Kind.VALUE, operand, List.of(), start, end);
        }

        static Node predicate(List<Integer> comparisonIndexes, int start, int end) {
            return new Node(Kind.PREDICATE, null, comparisonIndexes, start, end);
        }

        Node span(int start, int end) {
            return new Node(kind, operand, comparisonIndexes, start, end);
        }
    }

    private static final class Op {
        final String name;
        final int precedence;
        final boolean unary;
        final boolean negated;
        final SqlToken token;
        boolean paired;

        Op(String name, boolean unary, boolean negated, SqlToken token) {
            this.name = name;
            this.precedence = PRECEDENCE.get(name);
            this.unary = unary;
            this.negated = negated;
            this.token = token;
        }
    }

    /**
     * Evaluates tokens up to the end of the expression: end of input, a
     * semicolon, a tail keyword, or the closing parenthesis when nested.
     */
    private Node expression(boolean nested) {
        Deque<Node> operands = new ArrayDeque<>();
        Deque<Op> operators = new ArrayDeque<>();
        boolean expectOperand = true;
        SqlToken last = null;

        loop:
        while (true) {
            SqlToken t = peek();
            if (t == null || t.type() == Type.SEMICOLON) break;
            last = t;

            switch (t.type()) {
                case IDENTIFIER -> {
                    SqlToken next = peekAt(pos + 1);
                    if (next != null && next.type() == Type.LPAREN) {
                        throw error("Functions are not supported.", t);
                    }
                    requireOperandPosition(expectOperand, t);
                    operands.push(Node.value(column(t), t.position(), end(t)));
                    pos++;
                    expectOperand = false;
                }
                case NUMBER, STRING -> {
                    requireOperandPosition(expectOperand, t);
                    operands.push(Node.value(new Operand.Literal(literal(t)), t.position(), end(t)));
                    pos++;
                    expectOperand = false;
                }
                case LPAREN -> {
                    requireOperandPosition(expectOperand, t);
                    SqlToken next = peekAt(pos + 1);
                    if (next != null && next.isKeyword("SELECT")) {
                        throw error("Subqueries are not supported yet.", next);
                    }
                    if (!operators.isEmpty() && operators.peek().name.equals("IN")) {
                        operands.push(valueList(t));
                    } else {
                        pos++;
                        Node inner = expression(true);
                        SqlToken close = peek();
                        if (close == null || close.type() != Type.RPAREN) {
                            throw new SqlParseException("Missing ')'", t.text(), t.position());
                        }
                        pos++;
                        operands.push(inner.span(t.position(), end(close)));
                    }
                    expectOperand = false;
                }
                case RPAREN -> {
                    if (nested) break loop;
                    throw error("Unbalanced ')'", t);
                }
                case OPERATOR -> {
                    if (!COMPARISON_OPERATORS.contains(t.value())) {
                        throw error("Operations are not supported.", t);
                    }
                    requireOperatorPosition(expectOperand, t);
                    shift(new Op(t.value(), false, false, t), operands, operators);
                    pos++;
                    expectOperand = true;
                }
                case STAR -> throw error("Operations are not supported.", t);
                case COMMA -> throw error("invalid syntax: comma", t);
                case KEYWORD -> {
                    String k = t.value();
                    if (!nested && TAIL_KEYWORDS.contains(k)) break loop;
                    switch (k) {
                        case "NULL", "TRUE", "FALSE" -> {
                            requireOperandPosition(expectOperand, t);
                            Object v = k.equals("NULL") ? null : Boolean.valueOf(k.equals("TRUE"));
                            operands.push(Node.value(new Operand.Literal(v), t.position(), end(t)));
                            pos++;
                            expectOperand = false;
                        }
                        case "NOT" -> {
                            pos++;
                            if (expectOperand) {
                                operators.push(new Op("NOT", true, false, t));
                            } else {
                                SqlToken op = peek();
                                if (op == null || !(op.isKeyword("IN") || op.isKeyword("BETWEEN") || op.isKeyword("LIKE"))) {
                                    throw error("Unexpected keyword 'NOT'", t);
                                }
                                shift(new Op(op.value(), false, true, op), operands, operators);
                                pos++;
                                expectOperand = true;
                            }
                        }
                        case "AND" -> {
                            requireOperatorPosition(expectOperand, t);
                            while (!operators.isEmpty() && operators.peek().precedence > BETWEEN_PRECEDENCE) {
                                reduce(operators.pop(), operands);
                            }
                            Op top = operators.peek();
                            if (top != null && top.name.equals("BETWEEN") && !top.paired) {
                                top.paired = true;
                            } else {
                                shift(new Op("AND", false, false, t), operands, operators);
                            }
                            pos++;
                            expectOperand = true;
                        }
                        case "OR", "IN", "LIKE", "BETWEEN" -> {
                            requireOperatorPosition(expectOperand, t);
                            if (k.equals("OR")) disjunctive = true;
                            shift(new Op(k, false, false, t), operands, operators);
                            pos++;
                            expectOperand = true;
                        }
                        case "IS" -> {
                            requireOperatorPosition(expectOperand, t);
                            shift(new Op("IS", false, false, t), operands, operators);
                            pos++;
                            SqlToken not = peek();
                            SqlToken nul = peekAt(pos + 1);
                            if (not != null && not.isKeyword("NOT") && nul != null && nul.isKeyword("NULL")) {
                                operands.push(Node.value(new Operand.Literal(Operand.NOT_NULL), not.position(), end(nul)));
                                pos += 2;
                                expectOperand = false;
                            } else {
                                expectOperand = true;
                            }
                        }
                        case "CASE" -> throw error("Case is not supported.", t);
                        default -> {
                            if (SUBQUERY_KEYWORDS.contains(k)) {
                                throw error("Subqueries are not supported yet.", t);
                            }
                            throw error("Unexpected keyword '" + k + "'", t);
                        }
                    }
                }
                default -> throw error("Unexpected token '" + t.text() + "'", t);
            }
        }

        if (expectOperand) {
            if (last == null) throw new SqlParseException("invalid comparison clause: empty expression", null, -1);
            throw error("invalid comparison clause", last);
        }
        while (!operators.isEmpty()) {
            reduce(operators.pop(), operands);
        }
        if (operands.size() != 1) {
            throw new SqlParseException("invalid comparison clause", null, operands.isEmpty() ? -1 : operands.peekLast().start);
        }
        return operands.pop();
    }

    private void shift(Op op, Deque<Node> operands, Deque<Op> operators) {
        while (!operators.isEmpty() && operators.peek().precedence >= op.precedence) {
            reduce(operators.pop(), operands);
        }
        operators.push(op);
    }

    private void reduce(Op op, Deque<Node> operands) {
        if (op.unary) {
            Node operand = pop(operands, op);
            if (operand.kind != Kind.PREDICATE) {
                throw error("NOT must apply to a comparison", op.token);
            }
            for (int i : operand.comparisonIndexes) {
                comparisons.set(i, comparisons.get(i).negate());
            }
            negated = true;
            operands.push(Node.predicate(operand.comparisonIndexes, op.token.position(), operand.end));
            return;
        }

        switch (op.name) {
            case "AND", "OR" -> {
                Node right = pop(operands, op);
                Node left = pop(operands, op);
                if (left.kind != Kind.PREDICATE || right.kind != Kind.PREDICATE) {
                    throw error("invalid comparison clause: " + op.name + " must join comparisons", op.token);
                }
                List<Integer> merged = new ArrayList<>(left.comparisonIndexes);
                merged.addAll(right.comparisonIndexes);
                operands.push(Node.predicate(merged, left.start, right.end));
            }
            case "BETWEEN" -> {
                if (!op.paired) {
                    throw error("BETWEEN requires AND", op.token);
                }
                Node upper = pop(operands, op);
                Node lower = pop(operands, op);
                Node left = pop(operands, op);
                scalar(left, op);
                scalar(lower, op);
                scalar(upper, op);
                record(new Comparison(left.operand, "BETWEEN", lower.operand, upper.operand,
                        op.negated, left.start, upper.end), operands);
            }
            default -> {
                Node right = pop(operands, op);
                Node left = pop(operands, op);
                scalar(left, op);
                if (op.name.equals("IN")) {
                    if (right.kind != Kind.VALUE || !(right.operand instanceof Operand.ValueList)) {
                        throw error("IN requires a parenthesized list of values", op.token);
                    }
                } else {
                    scalar(right, op);
                }
                record(new Comparison(left.operand, op.name, right.operand, null,
                        op.negated, left.start, right.end), operands);
            }
        }
    }

    private void record(Comparison comparison, Deque<Node> operands) {
        if (comparison.negated()) negated = true;
        comparisons.add(comparison);
        operands.push(Node.predicate(List.of(comparisons.size() - 1), comparison.start(), comparison.end()));
    }

    private void scalar(Node node, Op op) {
        if (node.kind != Kind.VALUE || node.operand instanceof Operand.ValueList) {
            throw error("Operands of " + op.name + " must be a column or a literal", op.token);
        }
    }

    private Node pop(Deque<Node> operands, Op op) {
        Node n = operands.poll();
        if (n == null) {
            throw error("invalid comparison clause: missing operand for " + op.name, op.token);
        }
        return n;
    }

    private Node valueList(SqlToken open) {
        pos++;
        List<Object> values = new ArrayList<>();
        while (true) {
            SqlToken t = peek();
            if (t == null) {
                throw new SqlParseException("Missing ')'", open.text(), open.position());
            }
            if (t.isKeyword("SELECT")) {
                throw error("Subqueries are not supported yet.", t);
            }
            if (t.type() == Type.NUMBER || t.type() == Type.STRING) {
                values.add(literal(t));
            } else if (t.isKeyword("NULL")) {
                values.add(null);
            } else {
                throw error("IN lists may contain literals only", t);
            }
            pos++;
            SqlToken sep = peek();
            if (sep == null) {
                throw new SqlParseException("Missing ')'", open.text(), open.position());
            }
            pos++;
            if (sep.type() == Type.RPAREN) {
                return Node.value(new Operand.ValueList(values), open.position(), end(sep));
            }
            if (sep.type() != Type.COMMA) {
                throw error("Expected ',' or ')' in IN list", sep);
            }
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static Operand.Column column(SqlToken t) {
        List<String> parts = t.parts();
        if (parts.size() > 2) {
            throw error("Column identifiers may contain only one dot separating table name and column name.", t);
        }
        return parts.size() == 2
                ? new Operand.Column(parts.get(0), parts.get(1))
                : new Operand.Column(null, parts.get(0));
    }

    private static Object literal(SqlToken t) {
        if (t.type() == Type.STRING) return t.value();
        String text = t.value();
        boolean integral = text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0;
        if (integral) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException overflow) {
                return Double.parseDouble(text);
            }
        }
        return Double.parseDouble(text);
    }

    private static void requireOperandPosition(boolean expectOperand, SqlToken t) {
        if (!expectOperand) throw error("invalid comparison clause: unexpected '" + t.text() + "'", t);
    }

    private static void requireOperatorPosition(boolean expectOperand, SqlToken t) {
        if (expectOperand) throw error("invalid comparison clause: missing operand before '" + t.text() + "'", t);
    }

    private static SqlParseException error(String message, SqlToken t) {
        return new SqlParseException(message, t.text(), t.position());
    }

    private static int end(SqlToken t) {
        return t.position() + t.text().length();
    }

    private SqlToken peek() {
        return peekAt(pos);
    }

    private SqlToken peekAt(int i) {
        return i < tokens.size() ? tokens.get(i) : null;
    }
}
