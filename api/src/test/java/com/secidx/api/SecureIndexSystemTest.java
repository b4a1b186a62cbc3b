package com.secidx.api;

import com.secidx.common.AnonymizedTable;
import com.secidx.common.MappingException;
import com.secidx.common.MappingType;
import com.secidx.config.ColumnConfig;
import com.secidx.config.IndexConfig;
import com.secidx.loader.TableLoader;
import com.secidx.mapping.HeterogeneousMapping;
import com.secidx.mapping.MappingStore;
import com.secidx.query.RewriteResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SecureIndexSystemTest {

    @Mock
    private TableLoader loader;

    @Mock
    private MappingStore store;

    private SimpleMeterRegistry registry;
    private SecureIndexSystem system;

    private static AnonymizedTable people() {
        return new AnonymizedTable(List.of("GID", "AGE"), "GID", List.of(
                new String[]{"1", "[0-9]"},
                new String[]{"2", "[10-19]"},
                new String[]{"3", "[10-19]"},
                new String[]{"4", "[75-79]"}
        ));
    }

    @BeforeEach
    void setUp() {
        IndexConfig config = new IndexConfig()
                .withColumn("AGE", ColumnConfig.of(MappingType.RANGE, ColumnConfig.TokenMode.GROUP_ID))
                .withWorkers(2);
        registry = new SimpleMeterRegistry();
        system = new SecureIndexSystem(config, loader, store, registry);
    }

    @Test
    void loadTable_usesTheConfiguredGroupIdColumn() throws Exception {
        Path csv = Paths.get("people.csv");
        when(loader.load(csv, "GID")).thenReturn(people());

        HeterogeneousMapping mapping = system.createMapping(csv, null);

        verify(loader).load(csv, "GID");
        assertTrue(mapping.isGid("AGE"));
        assertEquals(1L, registry.get("secidx.mapping.create").timer().count());
    }

    @Test
    void persistence_isDelegatedWithTheConfiguredCacheSize() throws Exception {
        HeterogeneousMapping mapping = system.createMapping(people(), null);
        Path target = Paths.get("mapping.bin");

        system.saveMapping(mapping, target, null);
        verify(store).save(same(mapping), eq(target), isNull());

        when(store.load(eq(target), isNull(), isNull(), anyInt())).thenReturn(mapping);
        assertSame(mapping, system.loadMapping(target, null, null));
        verify(store).load(target, null, null, system.getConfig().getCacheSize());
    }

    @Test
    void rewrite_recordsSuccessAndFailure() {
        HeterogeneousMapping mapping = system.createMapping(people(), null);

        RewriteResult ok = system.rewrite(mapping, "SELECT * FROM wrapped WHERE \"AGE\" <= 18");
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE \"GroupId\" IN (VALUES (1),(2),(3))", ok.sql());
        assertEquals(1L, registry.get("secidx.query.rewrite").tag("outcome", "ok").timer().count());

        MappingException e = assertThrows(MappingException.class,
                () -> system.rewrite(mapping, "SELECT * FROM wrapped WHERE \"ZIP\" = 3"));
        assertEquals(MappingException.Kind.UNKNOWN_COLUMN, e.getKind());
        assertEquals(1L, registry.get("secidx.query.rewrite").tag("outcome", "error").timer().count());
        assertEquals(1.0, registry.get("secidx.query.failures").tag("kind", "UNKNOWN_COLUMN").counter().count());
        verifyNoInteractions(store);
    }

    @Test
    void groupTokens_coverEveryGroup() throws Exception {
        AnonymizedTable table = people();
        HeterogeneousMapping mapping = system.createMapping(table, null);
        assertEquals(4, system.groupTokens(mapping, table).size());
        verify(loader, never()).load(any(), any());
    }
}
