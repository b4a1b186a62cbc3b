package com.secidx.api;

import com.secidx.common.AnonymizedTable;
import com.secidx.common.MappingException;
import com.secidx.common.SecureIndexException;
import com.secidx.config.IndexConfig;
import com.secidx.loader.AnonymizedCsvLoader;
import com.secidx.loader.TableLoader;
import com.secidx.mapping.HeterogeneousMapping;
import com.secidx.mapping.MappingStore;
import com.secidx.mapping.creation.GroupTokenTable;
import com.secidx.mapping.creation.HeterogeneousMappingBuilder;
import com.secidx.query.QueryRewriter;
import com.secidx.query.RewriteOptions;
import com.secidx.query.RewriteResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point tying together dataset loading, mapping creation, mapping
 * persistence and query rewriting under one {@link IndexConfig}.
 *
 * Timers (Micrometer):
 * <ul>
 *   <li>{@code secidx.mapping.create}: mapping creation</li>
 *   <li>{@code secidx.query.rewrite}, tagged {@code outcome=ok|error}</li>
 * </ul>
 * Rewrite failures are also counted under {@code secidx.query.failures},
 * tagged with the error kind.
 */
public final class SecureIndexSystem {

    private static final Logger logger = LoggerFactory.getLogger(SecureIndexSystem.class);

    private final IndexConfig config;
    private final TableLoader loader;
    private final MappingStore store;
    private final MeterRegistry registry;
    private final Timer createTimer;

    public SecureIndexSystem(IndexConfig config, MeterRegistry registry) {
        this(config, new AnonymizedCsvLoader(), new MappingStore(registry), registry);
    }

    public SecureIndexSystem(IndexConfig config, TableLoader loader, MappingStore store, MeterRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        config.validate();
        this.createTimer = Timer.builder("secidx.mapping.create").register(registry);
        logger.info("SecureIndexSystem ready: {} configured columns, rewrite={}",
                config.getColumns().size(), RewriteOptions.from(config.getRewrite()));
    }

    public static SecureIndexSystem fromConfigFile(String path) throws IndexConfig.ConfigLoadException {
        return new SecureIndexSystem(IndexConfig.load(path, false), new SimpleMeterRegistry());
    }

    // ===================== Mapping creation =====================

    public AnonymizedTable loadTable(Path dataset) throws IOException {
        return loader.load(dataset, config.getGroupIdColumn());
    }

    /**
     * Builds the mapping of {@code table}.
     *
     * @param key master key; required when a column uses hash or runtime tokens
     */
    public HeterogeneousMapping createMapping(AnonymizedTable table, SecretKey key) {
        Objects.requireNonNull(table, "table");
        return createTimer.record(() -> new HeterogeneousMappingBuilder(config, key).build(table));
    }

    public HeterogeneousMapping createMapping(Path dataset, SecretKey key) throws IOException {
        return createMapping(loadTable(dataset), key);
    }

    /** Token chosen for every group and column; see {@link GroupTokenTable}. */
    public GroupTokenTable groupTokens(HeterogeneousMapping mapping, AnonymizedTable table) {
        return GroupTokenTable.build(mapping, table, config.getEffectiveWorkers());
    }

    // ===================== Persistence =====================

    /** Saves the mapping, encrypted when {@code encryptionKey} is not null. */
    public void saveMapping(HeterogeneousMapping mapping, Path path, SecretKey encryptionKey) throws IOException {
        store.save(mapping, path, encryptionKey);
    }

    public HeterogeneousMapping loadMapping(Path path, SecretKey encryptionKey, SecretKey tokenKey) throws IOException {
        return store.load(path, encryptionKey, tokenKey, config.getCacheSize());
    }

    // ===================== Rewriting =====================

    public QueryRewriter rewriter(HeterogeneousMapping mapping) {
        return new QueryRewriter(mapping, RewriteOptions.from(config.getRewrite()));
    }

    public RewriteResult rewrite(HeterogeneousMapping mapping, String sql) {
        Timer.Sample sample = Timer.start(registry);
        try {
            RewriteResult result = rewriter(mapping).rewrite(sql);
            sample.stop(registry.timer("secidx.query.rewrite", "outcome", "ok"));
            return result;
        } catch (SecureIndexException e) {
            sample.stop(registry.timer("secidx.query.rewrite", "outcome", "error"));
            registry.counter("secidx.query.failures", "kind", failureKind(e)).increment();
            logger.debug("Rewrite failed: {}", e.getMessage());
            throw e;
        }
    }

    private static String failureKind(SecureIndexException e) {
        if (e instanceof MappingException me) return me.getKind().name();
        return e.getClass().getSimpleName();
    }

    // ===================== Accessors =====================

    public IndexConfig getConfig() {
        return config;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
