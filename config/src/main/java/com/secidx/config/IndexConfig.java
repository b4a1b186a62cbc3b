package com.secidx.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.secidx.common.ConfigurationException;
import com.secidx.common.MappingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Configuration of mapping creation and query rewriting.
 *
 * - Loaded from JSON via {@link #load(String, boolean)}, cached per real path.
 * - Per-column mapping settings live under {@code columns}.
 * - Rewriting settings live under the nested {@code rewrite} block.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexConfig {

    private static final Logger logger = LoggerFactory.getLogger(IndexConfig.class);

    private static final int MAX_WORKERS = 1024;
    private static final int MIN_TOKEN_BITS = 8;
    private static final int MAX_TOKEN_BITS = 62;
    private static final int MAX_CACHE = 4096;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Per-path cache for loaded configs. */
    private static final ConcurrentMap<String, IndexConfig> configCache = new ConcurrentHashMap<>();

    /* ======================== Top-level fields ======================== */

    @JsonProperty("groupIdColumn")
    private String groupIdColumn = "GID";

    /** Columns never mapped even when no explicit column list is given. */
    @JsonProperty("ignoredColumns")
    private List<String> ignoredColumns = new ArrayList<>(List.of("INDEX"));

    /** Worker pool size for mapping creation; <= 0 means available processors. */
    @JsonProperty("workers")
    private int workers = 0;

    /** Width of the runtime-token keyspace the starting tokens are drawn from. */
    @JsonProperty("runtimeTokenBits")
    private int runtimeTokenBits = 32;

    /** Number of column-mapping views kept by a loaded mapping. */
    @JsonProperty("cacheSize")
    private int cacheSize = 64;

    @JsonProperty("columns")
    private LinkedHashMap<String, ColumnConfig> columns = new LinkedHashMap<>();

    @JsonProperty("rewrite")
    private RewriteConfig rewrite = new RewriteConfig();

    /* ======================== Static loading API ======================== */

    public static IndexConfig load(String path, boolean refresh) throws ConfigLoadException {
        Objects.requireNonNull(path, "Config path cannot be null");
        String key;
        try {
            Path p = Paths.get(path).toAbsolutePath().normalize();
            if (Files.exists(p)) {
                p = p.toRealPath();
            }
            key = p.toString();
        } catch (IOException | RuntimeException e) {
            throw new ConfigLoadException("Invalid config path: " + path, e);
        }

        if (!refresh) {
            IndexConfig cached = configCache.get(key);
            if (cached != null) return cached;
        }

        IndexConfig cfg;
        try {
            Path p = Paths.get(key);
            if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
                throw new IOException("Config file not found or not readable: " + key);
            }
            cfg = MAPPER.readValue(p.toFile(), IndexConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read/parse IndexConfig from " + key, e);
        }

        cfg.validate();
        configCache.put(key, cfg);
        logger.info("Loaded config {} ({} mapped columns)", key, cfg.columns.size());
        return cfg;
    }

    public static IndexConfig fromJson(String json) throws ConfigLoadException {
        Objects.requireNonNull(json, "json");
        try {
            IndexConfig cfg = MAPPER.readValue(json, IndexConfig.class);
            cfg.validate();
            return cfg;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse IndexConfig", e);
        }
    }

    /** Same mapping type and token mode for every listed column. */
    public static IndexConfig uniform(MappingType type, ColumnConfig.TokenMode mode, Collection<String> columns) {
        IndexConfig cfg = new IndexConfig();
        for (String c : columns) {
            cfg.withColumn(c, ColumnConfig.of(type, mode));
        }
        cfg.validate();
        return cfg;
    }

    public static void clearCache() {
        configCache.clear();
    }

    /* ======================== Validation ======================== */

    public void validate() {
        if (groupIdColumn == null || groupIdColumn.isBlank()) {
            throw new ConfigurationException("groupIdColumn must be set");
        }
        if (columns == null || columns.isEmpty()) {
            throw new ConfigurationException("At least one column must be configured");
        }
        for (Map.Entry<String, ColumnConfig> e : columns.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw new ConfigurationException("Column names cannot be blank");
            }
            if (e.getKey().equals(groupIdColumn)) {
                throw new ConfigurationException("The group id column " + groupIdColumn + " cannot be mapped");
            }
            if (e.getValue() == null) {
                throw new ConfigurationException("Missing configuration for column " + e.getKey());
            }
            e.getValue().validate(e.getKey());
        }
        if (rewrite == null) rewrite = new RewriteConfig();
        rewrite.validate();
    }

    /* ======================== Fluent setters ======================== */

    public IndexConfig withColumn(String column, ColumnConfig config) {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(config, "config");
        if (columns.putIfAbsent(column, config) != null) {
            throw new ConfigurationException("Duplicate configuration for column " + column);
        }
        return this;
    }

    public IndexConfig withGroupIdColumn(String column) {
        this.groupIdColumn = column;
        return this;
    }

    public IndexConfig withWorkers(int workers) {
        this.workers = workers;
        return this;
    }

    public IndexConfig withRuntimeTokenBits(int bits) {
        this.runtimeTokenBits = bits;
        return this;
    }

    /* ======================== Getters ======================== */

    public String getGroupIdColumn() {
        return groupIdColumn;
    }

    public List<String> getIgnoredColumns() {
        return ignoredColumns == null ? List.of() : Collections.unmodifiableList(ignoredColumns);
    }

    @JsonIgnore
    public int getEffectiveWorkers() {
        if (workers <= 0) return Runtime.getRuntime().availableProcessors();
        return clamp(workers, 1, MAX_WORKERS);
    }

    public int getRuntimeTokenBits() {
        return clamp(runtimeTokenBits, MIN_TOKEN_BITS, MAX_TOKEN_BITS);
    }

    public int getCacheSize() {
        return clamp(cacheSize, 1, MAX_CACHE);
    }

    public Map<String, ColumnConfig> getColumns() {
        return Collections.unmodifiableMap(columns);
    }

    public ColumnConfig getColumn(String column) {
        ColumnConfig c = columns.get(column);
        if (c == null) {
            throw new ConfigurationException("Missing configuration for column " + column);
        }
        return c;
    }

    @JsonIgnore
    public boolean needsKey() {
        return columns.values().stream().anyMatch(ColumnConfig::needsKey);
    }

    public RewriteConfig getRewrite() {
        return rewrite;
    }

    /* ======================== Nested config types ======================== */

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RewriteConfig {
        @JsonProperty("representation")
        public String representation = "flat";

        /** Plan key-value lookups instead of emitting SQL. */
        @JsonProperty("keyValueMode")
        public boolean keyValueMode = false;

        /** Column holding the encrypted blob on the server. */
        @JsonProperty("blobColumn")
        public String blobColumn = "EncTuples";

        /** Reattach GROUP BY / HAVING / ORDER BY verbatim in SQL mode. */
        @JsonProperty("keepTail")
        public boolean keepTail = true;

        @JsonIgnore
        public Representation getRepresentation() {
            return Representation.fromName(representation);
        }

        public boolean isKeyValueMode() {
            return keyValueMode;
        }

        public String getBlobColumn() {
            return blobColumn;
        }

        public boolean isKeepTail() {
            return keepTail;
        }

        void validate() {
            getRepresentation();
            if (blobColumn == null || blobColumn.isBlank()) {
                throw new ConfigurationException("rewrite.blobColumn cannot be blank");
            }
            if (blobColumn.indexOf('"') >= 0) {
                throw new ConfigurationException("rewrite.blobColumn cannot contain double quotes");
            }
        }
    }

    public static class ConfigLoadException extends Exception {
        public ConfigLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /* ======================== Helpers ======================== */

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
