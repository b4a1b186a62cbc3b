package com.secidx.query;

import com.secidx.common.MappingException;
import com.secidx.common.Token;
import com.secidx.mapping.HeterogeneousMapping;
import com.secidx.query.sql.Comparison;
import com.secidx.query.sql.Operand;
import com.secidx.query.sql.ParsedStatement;
import com.secidx.query.sql.SqlParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Rewrites plaintext SELECT statements into statements over the encrypted
 * table.
 *
 * <ol>
 *   <li>the GROUP BY / HAVING / ORDER BY tail is set aside</li>
 *   <li>the projection becomes the encrypted blob column</li>
 *   <li>the table reference gains the joins the representation needs</li>
 *   <li>every WHERE comparison becomes {@code "col" IN (VALUES ...)} over the
 *       tokens the mapping resolves, or {@code FALSE} when none match</li>
 * </ol>
 *
 * In key-value mode no SQL is produced: the tokens are collected per column
 * and comparisons on the same column are intersected, so the WHERE clause must
 * be a plain conjunction.
 *
 * Stateless over an immutable mapping; safe to share between threads.
 */
public final class QueryRewriter {

    private static final Logger log = LoggerFactory.getLogger(QueryRewriter.class);

    public static final String GROUP_ID = "GroupId";

    private static final Map<String, String> ROTATE = Map.of(
            "=", "=", "<>", "<>", "<", ">", ">", "<", "<=", ">=", ">=", "<=");

    private final HeterogeneousMapping mapping;
    private final RewriteOptions options;

    public QueryRewriter(HeterogeneousMapping mapping) {
        this(mapping, RewriteOptions.defaults());
    }

    public QueryRewriter(HeterogeneousMapping mapping, RewriteOptions options) {
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        this.options = Objects.requireNonNull(options, "options");
    }

    public RewriteOptions getOptions() {
        return options;
    }

    public RewriteResult rewrite(String sql) {
        ParsedStatement parsed = SqlParser.parse(sql);
        List<Comparison> comparisons = new ArrayList<>(parsed.comparisons());
        comparisons.sort(Comparator.comparingInt(Comparison::start));

        if (options.isKeyValueMode()) {
            return keyValue(parsed, comparisons);
        }

        List<Replacement> replacements = new ArrayList<>();
        replacements.add(new Replacement(parsed.projectionStart(), parsed.projectionEnd(),
                " \"" + options.getBlobColumn() + "\" "));
        replacements.add(new Replacement(parsed.tableStart(), parsed.tableEnd(),
                tableReference(parsed, comparisons)));
        for (Comparison c : comparisons) {
            Resolved r = resolve(c);
            replacements.add(new Replacement(c.start(), c.end(), fragment(r, evaluate(r))));
        }

        String rewritten = splice(parsed, replacements);
        log.debug("Rewrote [{}] into [{}]", sql, rewritten);
        return RewriteResult.sql(rewritten, parsed.table());
    }

    // =====================================================================
    // Table reference
    // =====================================================================

    private String tableReference(ParsedStatement parsed, List<Comparison> comparisons) {
        String table = parsed.sql().substring(parsed.tableStart(), parsed.tableEnd());
        return switch (options.getRepresentation()) {
            case FLAT -> table;
            case MAPPING -> table + " JOIN mapping USING (\"" + GROUP_ID + "\")";
            case NORMALIZATION -> {
                Set<String> columns = new LinkedHashSet<>();
                for (Comparison c : comparisons) {
                    columns.add(columnOf(c).name());
                }
                StringBuilder sb = new StringBuilder(table)
                        .append(" JOIN \"GroupIdToColumns\" USING (\"").append(GROUP_ID).append("\")");
                for (String column : columns) {
                    sb.append(" JOIN \"").append(column).append("\" ON (\"")
                            .append(column).append("Id\" = \"").append(column).append("\".\"Id\")");
                }
                yield sb.toString();
            }
        };
    }

    // =====================================================================
    // Comparisons
    // =====================================================================

    /** A comparison normalized to {@code column operator value(s)}. */
    private record Resolved(Comparison source, String column, String operator, Object value, Object upper,
                            List<Object> values) {
    }

    private static Operand.Column columnOf(Comparison c) {
        boolean leftColumn = c.left() instanceof Operand.Column;
        boolean rightColumn = c.right() instanceof Operand.Column || c.upper() instanceof Operand.Column;
        if (leftColumn && rightColumn) {
            throw new MappingException(MappingException.Kind.COLUMN_COMPARISON, null,
                    "Comparisons among two columns are not supported: " + c);
        }
        if (leftColumn) return (Operand.Column) c.left();
        if (!c.isBetween() && !c.operator().equals("IN") && c.right() instanceof Operand.Column col) return col;
        throw new MappingException(MappingException.Kind.COLUMN_COMPARISON, null,
                "A comparison must involve exactly one column: " + c);
    }

    private Resolved resolve(Comparison c) {
        String op = c.operator();
        if (op.equals("LIKE") || op.equals("IS")) {
            throw new MappingException(MappingException.Kind.UNSUPPORTED_OPERATION, null,
                    op + " is not supported as a comparison operator.");
        }
        Operand.Column column = columnOf(c);
        if (c.negated()) {
            throw new MappingException(MappingException.Kind.UNSUPPORTED_OPERATION, column.name(),
                    "Negated comparisons are not supported: " + c);
        }
        if (!mapping.hasColumn(column.name())) {
            throw MappingException.unknownColumn(column.name());
        }

        if (op.equals("IN")) {
            List<Object> values = ((Operand.ValueList) c.right()).values();
            values.forEach(v -> requireValue(column.name(), v));
            return new Resolved(c, column.name(), op, null, null, values);
        }
        if (c.isBetween()) {
            Object low = requireValue(column.name(), literal(c.right()));
            Object high = requireValue(column.name(), literal(c.upper()));
            return new Resolved(c, column.name(), op, low, high, List.of());
        }
        if (c.left() instanceof Operand.Column) {
            return new Resolved(c, column.name(), op, requireValue(column.name(), literal(c.right())), null, List.of());
        }
        return new Resolved(c, column.name(), ROTATE.get(op),
                requireValue(column.name(), literal(c.left())), null, List.of());
    }

    private static Object literal(Operand operand) {
        return ((Operand.Literal) operand).value();
    }

    private static Object requireValue(String column, Object value) {
        if (value == null || value instanceof Boolean) {
            throw new MappingException(MappingException.Kind.INVALID_INPUT, column,
                    "'" + value + "' cannot be compared against column " + column);
        }
        return value;
    }

    private Set<Token> evaluate(Resolved r) {
        return switch (r.operator()) {
            case "=" -> mapping.eq(r.column(), r.value());
            case "<>" -> mapping.neq(r.column(), r.value());
            case "<" -> mapping.lt(r.column(), r.value());
            case "<=" -> mapping.le(r.column(), r.value());
            case ">" -> mapping.gt(r.column(), r.value());
            case ">=" -> mapping.ge(r.column(), r.value());
            case "IN" -> mapping.inValues(r.column(), r.values());
            case "BETWEEN" -> mapping.between(r.column(), r.value(), r.upper());
            default -> throw new MappingException(MappingException.Kind.UNSUPPORTED_OPERATION, r.column(),
                    r.operator() + " is not supported as a comparison operator.");
        };
    }

    private String target(String column) {
        return mapping.isGid(column) ? GROUP_ID : column;
    }

    private String fragment(Resolved r, Set<Token> tokens) {
        if (tokens.isEmpty()) {
            log.debug("{} matches no token", r.source());
            return "FALSE";
        }
        String values = new TreeSet<>(tokens).stream()
                .map(Token::toSqlLiteral)
                .collect(Collectors.joining("),(", "(", ")"));
        return '"' + target(r.column()) + "\" IN (VALUES " + values + ")";
    }

    // =====================================================================
    // Key-value mode
    // =====================================================================

    private RewriteResult keyValue(ParsedStatement parsed, List<Comparison> comparisons) {
        if (parsed.disjunctive() || parsed.negated()) {
            throw new MappingException(MappingException.Kind.NON_CONJUNCTIVE, null,
                    "Key-value lookups require a conjunction of comparisons; OR and NOT are not supported");
        }
        Map<String, SortedSet<Token>> labels = new LinkedHashMap<>();
        for (Comparison c : comparisons) {
            Resolved r = resolve(c);
            Set<Token> tokens = evaluate(r);
            String key = target(r.column());
            SortedSet<Token> current = labels.get(key);
            if (current == null) {
                labels.put(key, new TreeSet<>(tokens));
            } else {
                current.retainAll(tokens);
            }
        }
        if (parsed.hasTail()) {
            log.debug("Dropping '{}' in key-value mode", parsed.tail().trim());
        }
        log.debug("Key-value plan for {}: {}", parsed.table(), labels);
        return RewriteResult.keyValue(labels, parsed.table());
    }

    // =====================================================================
    // Text assembly
    // =====================================================================

    private record Replacement(int start, int end, String text) {
    }

    private String splice(ParsedStatement parsed, List<Replacement> replacements) {
        String sql = parsed.sql();
        int limit = parsed.hasTail() ? parsed.tailStart() : sql.length();
        replacements.sort(Comparator.comparingInt(Replacement::start));

        StringBuilder out = new StringBuilder(sql.length() + 64);
        int cursor = 0;
        for (Replacement r : replacements) {
            out.append(sql, cursor, r.start()).append(r.text());
            cursor = r.end();
        }
        out.append(sql, cursor, limit);

        if (parsed.hasTail() && options.isKeepTail()) {
            out.append(parsed.tail());
        } else if (parsed.hasTail()) {
            int end = out.length();
            while (end > 0 && Character.isWhitespace(out.charAt(end - 1))) end--;
            out.setLength(end);
        }
        return out.toString();
    }
}
