package com.secidx.mapping;

import com.secidx.common.LRUCache;
import com.secidx.common.MappingException;
import com.secidx.common.MappingType;
import com.secidx.common.Token;
import com.secidx.mapping.column.CategoricalData;
import com.secidx.mapping.column.CategoricalMapping;
import com.secidx.mapping.column.ColumnData;
import com.secidx.mapping.column.ColumnMapping;
import com.secidx.mapping.column.IntervalTreeData;
import com.secidx.mapping.column.IntervalTreeMapping;
import com.secidx.mapping.column.RangeData;
import com.secidx.mapping.column.RangeMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-column typed collection of column mappings. Every predicate call is
 * dispatched on the column's {@link MappingType}; views are built lazily and
 * kept in a small LRU cache.
 *
 * <p>Thread-safe: the snapshot is immutable and view construction is
 * idempotent.
 */
public final class HeterogeneousMapping {

    private static final Logger logger = LoggerFactory.getLogger(HeterogeneousMapping.class);

    public static final int DEFAULT_CACHE_SIZE = 64;

    private final MappingSnapshot snapshot;
    private final byte[] tokenKey;
    private final LRUCache<String, ColumnMapping> views;

    /**
     * @param tokenKey key for runtime token derivation, may be null when no
     *                 column holds runtime tokens
     */
    public HeterogeneousMapping(MappingSnapshot snapshot, SecretKey tokenKey, int cacheSize) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.tokenKey = tokenKey == null ? null : tokenKey.getEncoded();
        this.views = new LRUCache<>(Math.max(1, cacheSize));
    }

    public HeterogeneousMapping(MappingSnapshot snapshot, SecretKey tokenKey) {
        this(snapshot, tokenKey, DEFAULT_CACHE_SIZE);
    }

    public MappingSnapshot snapshot() {
        return snapshot;
    }

    public List<String> getSchema() {
        return snapshot.getSchema();
    }

    /** Indexed columns, in schema order. */
    public Set<String> getColumns() {
        return snapshot.getColumns().keySet();
    }

    public boolean hasColumn(String column) {
        return snapshot.getColumns().containsKey(column);
    }

    public boolean isGid(String column) {
        return entry(column).isGid();
    }

    public MappingType getType(String column) {
        return entry(column).getType();
    }

    /** Query view of one column. */
    public ColumnMapping column(String column) {
        ColumnEntry entry = entry(column);
        return views.getOrLoad(column, c -> view(c, entry));
    }

    // ===================== Predicates =====================

    public Set<Token> eq(String column, Object value) {
        return column(column).eq(value);
    }

    public Set<Token> neq(String column, Object value) {
        return column(column).neq(value);
    }

    public Set<Token> lt(String column, Object value) {
        return column(column).lt(value);
    }

    public Set<Token> le(String column, Object value) {
        return column(column).le(value);
    }

    public Set<Token> gt(String column, Object value) {
        return column(column).gt(value);
    }

    public Set<Token> ge(String column, Object value) {
        return column(column).ge(value);
    }

    public Set<Token> between(String column, Object low, Object high) {
        return column(column).between(low, high);
    }

    public Set<Token> inValues(String column, Collection<?> values) {
        Objects.requireNonNull(values, "values");
        return column(column).inValues(values);
    }

    // ===================== Introspection =====================

    public List<String> getGeneralizations(String column) {
        return column(column).getGeneralizations();
    }

    public List<List<Token>> getTokens(String column) {
        return column(column).getTokens();
    }

    public Map<String, List<Token>> getTokenDictionary(String column) {
        return column(column).getTokenDictionary();
    }

    private ColumnEntry entry(String column) {
        ColumnEntry entry = snapshot.getColumns().get(column);
        if (entry == null) throw MappingException.unknownColumn(column);
        return entry;
    }

    private ColumnMapping view(String column, ColumnEntry entry) {
        ColumnData data = entry.getData();
        MappingType type = entry.getType();
        logger.debug("Building {} view for column {}", type.getName(), column);
        ColumnMapping view = switch (type) {
            case RANGE -> data instanceof RangeData d ? new RangeMapping(column, d, tokenKey) : null;
            case INTERVAL_TREE -> data instanceof IntervalTreeData d ? new IntervalTreeMapping(column, d, tokenKey) : null;
            case BITMAP, ROARING, SET -> data instanceof CategoricalData d ? new CategoricalMapping(column, type, d, tokenKey) : null;
        };
        if (view == null) {
            throw new MappingException(MappingException.Kind.UNKNOWN_MAPPING_TYPE, column,
                    "Column " + column + " is tagged " + type.getName() + " but stores "
                            + data.getClass().getSimpleName());
        }
        return view;
    }

    @Override
    public String toString() {
        return "HeterogeneousMapping{schema=" + getSchema() + ", columns=" + getColumns() + "}";
    }
}
