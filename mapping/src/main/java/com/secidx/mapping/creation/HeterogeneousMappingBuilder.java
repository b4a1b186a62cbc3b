package com.secidx.mapping.creation;

import com.secidx.common.AnonymizedTable;
import com.secidx.common.ConfigurationException;
import com.secidx.common.Token;
import com.secidx.config.ColumnConfig;
import com.secidx.config.IndexConfig;
import com.secidx.crypto.TokenDerivation;
import com.secidx.mapping.ColumnEntry;
import com.secidx.mapping.HeterogeneousMapping;
import com.secidx.mapping.MappingSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Creates a {@link HeterogeneousMapping} from an anonymized table.
 *
 * <p>Rows are first reduced to one per group; every configured column is then
 * built on its own worker. Columns of the table that are neither configured,
 * ignored nor the group id stay in the schema without an index.
 */
public final class HeterogeneousMappingBuilder {

    private static final Logger logger = LoggerFactory.getLogger(HeterogeneousMappingBuilder.class);

    private final IndexConfig config;
    private final SecretKey key;
    private final Random random;

    /**
     * @param key master key; required when a column uses hash or runtime tokens
     */
    public HeterogeneousMappingBuilder(IndexConfig config, SecretKey key) {
        this(config, key, new SecureRandom());
    }

    public HeterogeneousMappingBuilder(IndexConfig config, SecretKey key, Random random) {
        this.config = Objects.requireNonNull(config, "config");
        this.key = key;
        this.random = Objects.requireNonNull(random, "random");
    }

    public HeterogeneousMapping build(AnonymizedTable table) {
        Objects.requireNonNull(table, "table");
        config.validate();
        if (config.needsKey() && key == null) {
            throw new ConfigurationException("The configuration uses hash or runtime tokens: a key is required");
        }
        if (!config.getGroupIdColumn().equals(table.getGroupIdColumn())) {
            throw new ConfigurationException("Table group id column " + table.getGroupIdColumn()
                    + " differs from the configured " + config.getGroupIdColumn());
        }

        long start = System.nanoTime();
        AnonymizedTable groups = table.distinctByGroup();
        List<String> schema = schema(table);
        for (String column : config.getColumns().keySet()) {
            if (!schema.contains(column)) {
                throw new ConfigurationException("Configured column " + column + " is not an indexable column of the table");
            }
        }
        for (String column : schema) {
            if (!config.getColumns().containsKey(column)) {
                logger.warn("Column {} has no mapping configuration and will not be searchable", column);
            }
        }

        List<Long> groupIds = new ArrayList<>(groups.size());
        for (int r = 0; r < groups.size(); r++) groupIds.add(groups.groupId(r));

        Map<String, ColumnEntry> entries = buildColumns(groups, groupIds, schema);
        HeterogeneousMapping mapping = new HeterogeneousMapping(
                new MappingSnapshot(schema, entries), key, config.getCacheSize());

        checkCollisions(mapping, groups.size());
        logger.info("Created mapping of {} columns over {} groups ({} rows) in {} ms",
                entries.size(), groups.size(), table.size(), (System.nanoTime() - start) / 1_000_000);
        return mapping;
    }

    private List<String> schema(AnonymizedTable table) {
        List<String> schema = new ArrayList<>();
        for (String column : table.getColumns()) {
            if (column.equals(table.getGroupIdColumn())) continue;
            if (config.getIgnoredColumns().contains(column)) continue;
            schema.add(column);
        }
        return schema;
    }

    private Map<String, ColumnEntry> buildColumns(AnonymizedTable groups, List<Long> groupIds, List<String> schema) {
        ColumnMappingFactory factory = new ColumnMappingFactory(
                new TokenAssigner(key, config.getRuntimeTokenBits(), random));
        List<String> columns = schema.stream().filter(config.getColumns()::containsKey).toList();

        int workers = Math.max(1, Math.min(config.getEffectiveWorkers(), columns.size()));
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<ColumnEntry>> futures = new ArrayList<>(columns.size());
            for (String column : columns) {
                ColumnConfig cc = config.getColumn(column);
                List<String> values = groups.column(column);
                futures.add(pool.submit(() -> factory.create(column, cc, values, groupIds)));
            }
            Map<String, ColumnEntry> entries = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                entries.put(columns.get(i), await(futures.get(i)));
            }
            return entries;
        } finally {
            pool.shutdownNow();
        }
    }

    private static ColumnEntry await(Future<ColumnEntry> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while creating the mapping", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Column mapping creation failed", e.getCause());
        }
    }

    private void checkCollisions(HeterogeneousMapping mapping, int groups) {
        for (String column : mapping.getColumns()) {
            if (mapping.isGid(column)) continue;
            List<List<Token>> tokens = mapping.getTokens(column);
            int collisions = TokenCollisions.count(tokens);
            if (collisions == 0) continue;
            int total = TokenCollisions.total(tokens);
            if (config.getColumn(column).isRuntime()) {
                logger.warn("Column {}: {} of {} runtime tokens collide (expected rate {})",
                        column, collisions, total,
                        String.format("%.3g", TokenDerivation.expectedCollisionRate(total, 63)));
            } else {
                logger.warn("Column {}: {} of {} tokens collide", column, collisions, total);
            }
        }
        logger.debug("Collision check done over {} groups", groups);
    }
}
