package com.secidx.query;

import com.secidx.common.Token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of one rewrite.
 *
 * @param sql    rewritten statement, {@code null} in key-value mode
 * @param labels key-value lookup plan: tokens to fetch per column (or
 *               {@code GroupId}), empty in SQL mode
 * @param table  physical table name, unquoted
 */
public record RewriteResult(String sql, Map<String, SortedSet<Token>> labels, String table) {

    public RewriteResult {
        Objects.requireNonNull(table, "table");
        Map<String, SortedSet<Token>> copy = new LinkedHashMap<>();
        labels.forEach((k, v) -> copy.put(k, Collections.unmodifiableSortedSet(new TreeSet<>(v))));
        labels = Collections.unmodifiableMap(copy);
    }

    static RewriteResult sql(String sql, String table) {
        return new RewriteResult(Objects.requireNonNull(sql, "sql"), Map.of(), table);
    }

    static RewriteResult keyValue(Map<String, SortedSet<Token>> labels, String table) {
        return new RewriteResult(null, labels, table);
    }

    public boolean isKeyValue() {
        return sql == null;
    }
}
