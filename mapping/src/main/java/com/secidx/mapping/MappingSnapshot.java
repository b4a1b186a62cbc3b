package com.secidx.mapping;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The serialized form of a {@link HeterogeneousMapping}: the table schema and
 * one {@link ColumnEntry} per indexed column. Never carries key material.
 */
public final class MappingSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ArrayList<String> schema;
    private final LinkedHashMap<String, ColumnEntry> columns;

    public MappingSnapshot(List<String> schema, Map<String, ColumnEntry> columns) {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(columns, "columns");
        this.schema = new ArrayList<>(schema);
        this.columns = new LinkedHashMap<>(columns);
        for (String column : this.columns.keySet()) {
            if (!this.schema.contains(column)) {
                throw new IllegalArgumentException("Column " + column + " is not part of the schema " + schema);
            }
        }
    }

    public List<String> getSchema() {
        return Collections.unmodifiableList(schema);
    }

    public Map<String, ColumnEntry> getColumns() {
        return Collections.unmodifiableMap(columns);
    }
}
