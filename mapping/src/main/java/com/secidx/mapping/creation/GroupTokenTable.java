package com.secidx.mapping.creation;

import com.secidx.common.AnonymizedTable;
import com.secidx.common.MappingException;
import com.secidx.common.Token;
import com.secidx.mapping.HeterogeneousMapping;
import com.secidx.mapping.column.ColumnMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token each group is tagged with, per non group-id column. A generalization
 * holding several tokens hands them out round-robin, so every token of a
 * runtime generalization tags exactly one group.
 *
 * <p>The cursors live in the {@link #build} call; each column has its own
 * lock, so workers tagging different columns never contend.
 */
public final class GroupTokenTable {

    private static final Logger logger = LoggerFactory.getLogger(GroupTokenTable.class);

    public record Row(long groupId, Map<String, Token> tokens) {
        public Row {
            tokens = Collections.unmodifiableMap(new LinkedHashMap<>(tokens));
        }
    }

    private final List<String> columns;
    private final List<Row> rows;

    private GroupTokenTable(List<String> columns, List<Row> rows) {
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
    }

    public static GroupTokenTable build(HeterogeneousMapping mapping, AnonymizedTable table, int workers) {
        Objects.requireNonNull(mapping, "mapping");
        Objects.requireNonNull(table, "table");

        List<ColumnState> states = new ArrayList<>();
        for (String column : mapping.getColumns()) {
            if (!mapping.isGid(column)) states.add(new ColumnState(mapping.column(column)));
        }
        AnonymizedTable groups = table.distinctByGroup();
        Row[] rows = new Row[groups.size()];

        int threads = Math.max(1, Math.min(workers, groups.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            int chunk = (groups.size() + threads - 1) / threads;
            for (int from = 0; from < groups.size(); from += chunk) {
                int lo = from;
                int hi = Math.min(groups.size(), from + chunk);
                futures.add(pool.submit(() -> {
                    for (int r = lo; r < hi; r++) rows[r] = tag(groups, r, states);
                }));
            }
            for (Future<?> f : futures) await(f);
        } finally {
            pool.shutdownNow();
        }

        for (ColumnState state : states) state.verify();
        List<String> columns = states.stream().map(s -> s.view.getColumn()).toList();
        logger.info("Tagged {} groups over {} columns", rows.length, columns.size());
        return new GroupTokenTable(columns, List.of(rows));
    }

    private static Row tag(AnonymizedTable groups, int r, List<ColumnState> states) {
        Map<String, Token> tokens = new LinkedHashMap<>();
        for (ColumnState state : states) {
            String column = state.view.getColumn();
            tokens.put(column, state.next(groups.value(r, column)));
        }
        return new Row(groups.groupId(r), tokens);
    }

    private static void await(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while tagging groups", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Tagging groups failed", e.getCause());
        }
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /** CSV with a {@code GroupId} column followed by one token column per mapped column. */
    public void writeCsv(Writer out) throws IOException {
        out.write("GroupId");
        for (String c : columns) out.write("," + c);
        out.write("\n");
        for (Row row : rows) {
            out.write(Long.toString(row.groupId()));
            for (String c : columns) out.write("," + row.tokens().get(c));
            out.write("\n");
        }
        out.flush();
    }

    // ===================== Per-column cursor =====================

    private static final class ColumnState {
        private final ColumnMapping view;
        private final Map<String, Integer> positions = new HashMap<>();
        private final List<List<Token>> tokens;
        private final int[] cursors;
        private final ReentrantLock lock = new ReentrantLock();

        ColumnState(ColumnMapping view) {
            this.view = view;
            List<String> generalizations = view.getGeneralizations();
            for (int i = 0; i < generalizations.size(); i++) positions.put(generalizations.get(i), i);
            this.tokens = view.getTokens();
            this.cursors = new int[generalizations.size()];
        }

        Token next(String rawGeneralization) {
            String generalization;
            try {
                generalization = view.canonicalize(rawGeneralization);
            } catch (IllegalArgumentException e) {
                throw new MappingException(MappingException.Kind.INVALID_INPUT, view.getColumn(),
                        "'" + rawGeneralization + "' is not a valid generalization of " + view.getColumn(), e);
            }
            Integer p = positions.get(generalization);
            if (p == null) {
                throw new IllegalStateException("Generalization " + generalization + " of column "
                        + view.getColumn() + " is not in the mapping");
            }
            int cursor;
            lock.lock();
            try {
                cursor = cursors[p]++;
            } finally {
                lock.unlock();
            }
            List<Token> slot = tokens.get(p);
            return slot.get(cursor % slot.size());
        }

        void verify() {
            for (int p = 0; p < cursors.length; p++) {
                int size = tokens.get(p).size();
                if (cursors[p] % size != 0) {
                    throw new IllegalStateException("Column " + view.getColumn() + ": generalization "
                            + p + " handed out " + cursors[p] + " tokens, not a multiple of " + size);
                }
            }
        }
    }
}
