package com.secidx.mapping;

import com.secidx.common.MappingType;
import com.secidx.mapping.column.ColumnData;

import java.io.Serializable;
import java.util.Objects;

/**
 * Persisted description of one indexed column: its variant tag, the variant
 * data and whether its tokens are group ids.
 */
public final class ColumnEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final MappingType type;
    private final ColumnData data;
    private final boolean gid;

    public ColumnEntry(MappingType type, ColumnData data, boolean gid) {
        this.type = Objects.requireNonNull(type, "type");
        this.data = Objects.requireNonNull(data, "data");
        this.gid = gid;
    }

    public MappingType getType() {
        return type;
    }

    public ColumnData getData() {
        return data;
    }

    public boolean isGid() {
        return gid;
    }
}
