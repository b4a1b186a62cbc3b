package com.secidx.crypto;

import com.secidx.common.CryptoException;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Runtime token derivation.
 * =========================
 *
 * Expands a compact {@code (seed, count)} pair into {@code count} pseudo-random
 * 63-bit tokens:
 *
 * <pre>
 *   buffer = seed_be16 || seed_be16 || ...        (ceil(count / 2) blocks)
 *   ct     = AES-CBC(key, iv = salt, buffer)
 *   token_i = be64(ct[8i .. 8i+8]) >>> 1
 * </pre>
 *
 * Deterministic for identical inputs. Outputs may collide (birthday bound on
 * 63 bits); callers tolerate the resulting superset of groups.
 *
 * Stateless and thread-safe.
 */
public final class TokenDerivation {

    public static final int BLOCK_SIZE = 16;
    public static final int TOKEN_SIZE = 8;
    private static final int TOKENS_PER_BLOCK = BLOCK_SIZE / TOKEN_SIZE;
    private static final String TRANSFORMATION = "AES/CBC/NoPadding";

    private TokenDerivation() {}

    public static long[] derive(long seed, int count, byte[] key, byte[] salt) {
        validate(seed, count, key, salt);

        int blocks = (count + TOKENS_PER_BLOCK - 1) / TOKENS_PER_BLOCK;
        ByteBuffer memory = ByteBuffer.allocate(blocks * BLOCK_SIZE);
        for (int b = 0; b < blocks; b++) {
            memory.putLong(0L).putLong(seed);   // 16-byte big-endian encoding of the seed
        }

        byte[] enc;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(salt));
            enc = cipher.doFinal(memory.array());
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Runtime token derivation failed", e);
        }

        ByteBuffer out = ByteBuffer.wrap(enc);
        long[] tokens = new long[count];
        for (int i = 0; i < count; i++) {
            tokens[i] = out.getLong(i * TOKEN_SIZE) >>> 1;
        }
        return tokens;
    }

    /**
     * Derives every {@code (seeds[i], counts[i])} pair in parallel; the result
     * keeps the input order.
     */
    public static List<long[]> deriveAll(long[] seeds, int[] counts, byte[] key, byte[] salt) {
        Objects.requireNonNull(seeds, "seeds");
        Objects.requireNonNull(counts, "counts");
        if (seeds.length != counts.length) {
            throw new IllegalArgumentException("seeds and counts differ in length: "
                    + seeds.length + " vs " + counts.length);
        }
        return IntStream.range(0, seeds.length)
                .parallel()
                .mapToObj(i -> derive(seeds[i], counts[i], key, salt))
                .toList();
    }

    /**
     * Birthday estimate of the fraction of colliding tokens when drawing
     * {@code n} tokens of {@code bits} bits.
     */
    public static double expectedCollisionRate(long n, int bits) {
        return 1.0 - Math.exp(-(double) n / Math.pow(2.0, bits));
    }

    private static void validate(long seed, int count, byte[] key, byte[] salt) {
        if (seed < 0) throw new IllegalArgumentException("seed must be >= 0");
        if (count < 1) throw new IllegalArgumentException("count must be >= 1");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(salt, "salt");
        if (key.length != 16 && key.length != 32) {
            throw new CryptoException("Runtime token key must be 16 or 32 bytes, got " + key.length);
        }
        if (salt.length != BLOCK_SIZE) {
            throw new CryptoException("Runtime token salt must be " + BLOCK_SIZE + " bytes, got " + salt.length);
        }
    }
}
