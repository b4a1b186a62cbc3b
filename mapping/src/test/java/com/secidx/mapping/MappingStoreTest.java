package com.secidx.mapping;

import com.secidx.common.CryptoException;
import com.secidx.common.MappingType;
import com.secidx.config.ColumnConfig;
import com.secidx.config.ColumnConfig.TokenMode;
import com.secidx.config.IndexConfig;
import com.secidx.crypto.KeyUtils;
import com.secidx.mapping.creation.HeterogeneousMappingBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MappingStoreTest {

    @TempDir
    Path dir;

    private SecretKey key;
    private HeterogeneousMapping mapping;
    private SimpleMeterRegistry registry;
    private MappingStore store;

    @BeforeEach
    void setUp() {
        key = KeyUtils.generateKey();
        IndexConfig config = new IndexConfig()
                .withColumn("AGE", ColumnConfig.of(MappingType.INTERVAL_TREE, TokenMode.RUNTIME))
                .withColumn("CITY", ColumnConfig.of(MappingType.ROARING, TokenMode.STATIC));
        mapping = new HeterogeneousMappingBuilder(config, key, new Random(1)).build(SampleTables.people());
        registry = new SimpleMeterRegistry();
        store = new MappingStore(registry);
    }

    @Test
    void encryptedMapping_roundTrips() throws IOException {
        Path file = dir.resolve("mapping.enc");
        store.save(mapping, file, key);

        String text = Files.readString(file, StandardCharsets.US_ASCII);
        assertTrue(text.matches("[A-Za-z0-9+/=]+"), "encrypted mapping is stored as Base64 text");

        HeterogeneousMapping loaded = store.load(file, key, 8);
        assertEquals(mapping.getSchema(), loaded.getSchema());
        assertEquals(mapping.getTokenDictionary("AGE"), loaded.getTokenDictionary("AGE"));
        assertEquals(mapping.getTokenDictionary("CITY"), loaded.getTokenDictionary("CITY"));
        assertEquals(mapping.eq("AGE", 12), loaded.eq("AGE", 12));
        assertEquals(1L, registry.find("secidx.crypto.duration").tag("op", "open").timer().count());
    }

    @Test
    void wrongKey_failsAuthentication() throws IOException {
        Path file = dir.resolve("mapping.enc");
        store.save(mapping, file, key);
        assertThrows(CryptoException.class, () -> store.load(file, KeyUtils.generateKey(), 8));
    }

    @Test
    void plaintextMapping_roundTripsWithSeparateTokenKey() throws IOException {
        Path file = dir.resolve("mapping.bin");
        store.save(mapping, file, null);

        HeterogeneousMapping loaded = store.load(file, null, key, 8);
        assertEquals(mapping.getTokens("AGE"), loaded.getTokens("AGE"));
        assertEquals(mapping.getGeneralizations("CITY"), loaded.getGeneralizations("CITY"));
    }

    @Test
    void encryptedFileReadWithoutKey_isNotAMapping() throws IOException {
        Path file = dir.resolve("mapping.enc");
        store.save(mapping, file, key);
        assertThrows(IOException.class, () -> store.load(file, null, key, 8));
    }

    @Test
    void plaintextFileReadWithKey_isRejected() throws IOException {
        Path file = dir.resolve("mapping.bin");
        store.save(mapping, file, null);
        assertThrows(CryptoException.class, () -> store.load(file, key, 8));
    }
}
