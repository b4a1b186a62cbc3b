package com.secidx.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only row source of an anonymized dataset.
 *
 * Every row belongs to exactly one group, identified by the value of the
 * group-id column; all rows of a group share the same generalization on every
 * quasi-identifier column. Values are kept as the raw generalization strings
 * ({@code 18}, {@code [10-19]}, {@code {a,b}}).
 */
public final class AnonymizedTable {

    private final List<String> columns;
    private final Map<String, Integer> positions;
    private final String groupIdColumn;
    private final List<String[]> rows;

    public AnonymizedTable(List<String> columns, String groupIdColumn, List<String[]> rows) {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(groupIdColumn, "groupIdColumn");
        Objects.requireNonNull(rows, "rows");

        this.columns = List.copyOf(columns);
        this.positions = new LinkedHashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            if (positions.put(this.columns.get(i), i) != null) {
                throw new ConfigurationException("Duplicate column: " + this.columns.get(i));
            }
        }
        if (!positions.containsKey(groupIdColumn)) {
            throw new ConfigurationException("Group id column " + groupIdColumn + " is missing");
        }
        this.groupIdColumn = groupIdColumn;

        List<String[]> copy = new ArrayList<>(rows.size());
        for (String[] row : rows) {
            if (row.length != this.columns.size()) {
                throw new IllegalArgumentException("Row has " + row.length
                        + " values, expected " + this.columns.size());
            }
            copy.add(row.clone());
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<String> getColumns() {
        return columns;
    }

    public String getGroupIdColumn() {
        return groupIdColumn;
    }

    public boolean hasColumn(String column) {
        return positions.containsKey(column);
    }

    public int size() {
        return rows.size();
    }

    public String value(int row, String column) {
        return rows.get(row)[position(column)];
    }

    public long groupId(int row) {
        String raw = rows.get(row)[positions.get(groupIdColumn)];
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Group id '" + raw + "' at row " + row + " is not an integer", e);
        }
    }

    /** Values of one column in row order. */
    public List<String> column(String column) {
        int p = position(column);
        List<String> out = new ArrayList<>(rows.size());
        for (String[] row : rows) out.add(row[p]);
        return out;
    }

    /** Keeps the first row of every group, in encounter order. */
    public AnonymizedTable distinctByGroup() {
        int p = positions.get(groupIdColumn);
        Set<String> seen = new HashSet<>();
        List<String[]> kept = new ArrayList<>();
        for (String[] row : rows) {
            if (seen.add(row[p].trim())) kept.add(row);
        }
        return kept.size() == rows.size() ? this : new AnonymizedTable(columns, groupIdColumn, kept);
    }

    private int position(String column) {
        Integer p = positions.get(column);
        if (p == null) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return p;
    }
}
