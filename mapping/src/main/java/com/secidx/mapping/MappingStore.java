package com.secidx.mapping;

import com.secidx.common.CryptoException;
import com.secidx.common.PersistenceUtils;
import com.secidx.crypto.AesGcmBlobCipher;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Objects;

/**
 * Saves and loads mappings.
 *
 * <p>Without a key the file holds the Java-serialized {@link MappingSnapshot}.
 * With a key it holds the Base64 text of the AES-GCM sealed snapshot
 * ({@code IV || ciphertext || tag}). Key material is never written.
 */
public final class MappingStore {

    private static final Logger logger = LoggerFactory.getLogger(MappingStore.class);

    private final MeterRegistry metrics;

    /** @param metrics optional registry for cipher timings */
    public MappingStore(MeterRegistry metrics) {
        this.metrics = metrics;
    }

    public MappingStore() {
        this(null);
    }

    public void save(HeterogeneousMapping mapping, Path path, SecretKey key) throws IOException {
        Objects.requireNonNull(mapping, "mapping");
        Objects.requireNonNull(path, "path");

        byte[] content = PersistenceUtils.toBytes(mapping.snapshot());
        if (key != null) {
            byte[] sealed = new AesGcmBlobCipher(metrics, key).seal(content);
            content = Base64.getEncoder().encode(sealed);
        }
        PersistenceUtils.writeAtomically(path, content);
        logger.info("Saved {} mapping of {} columns to {}",
                key != null ? "encrypted" : "plaintext", mapping.getColumns().size(), path);
    }

    /**
     * Loads a mapping; {@code key} decrypts the file and also serves as the
     * runtime token key.
     */
    public HeterogeneousMapping load(Path path, SecretKey key, int cacheSize) throws IOException {
        return load(path, key, key, cacheSize);
    }

    /**
     * @param encryptionKey key the file was saved with, null for a plaintext file
     * @param tokenKey      key for runtime token derivation, may be null
     */
    public HeterogeneousMapping load(Path path, SecretKey encryptionKey, SecretKey tokenKey, int cacheSize)
            throws IOException {
        return new HeterogeneousMapping(readSnapshot(path, encryptionKey), tokenKey, cacheSize);
    }

    public MappingSnapshot readSnapshot(Path path, SecretKey encryptionKey) throws IOException {
        Objects.requireNonNull(path, "path");
        byte[] content = Files.readAllBytes(path);
        if (encryptionKey != null) {
            byte[] sealed;
            try {
                sealed = Base64.getDecoder().decode(new String(content, StandardCharsets.US_ASCII).trim());
            } catch (IllegalArgumentException e) {
                throw new CryptoException("File " + path + " is not an encrypted mapping", e);
            }
            content = new AesGcmBlobCipher(metrics, encryptionKey).open(sealed);
        }
        MappingSnapshot snapshot = PersistenceUtils.fromBytes(content, MappingSnapshot.class);
        logger.info("Loaded mapping of {} columns from {}", snapshot.getColumns().size(), path);
        return snapshot;
    }
}
