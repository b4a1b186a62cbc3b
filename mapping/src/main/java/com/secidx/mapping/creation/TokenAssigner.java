package com.secidx.mapping.creation;

import com.secidx.common.ConfigurationException;
import com.secidx.common.Token;
import com.secidx.config.ColumnConfig.TokenMode;
import com.secidx.crypto.KeyedHasher;
import com.secidx.mapping.column.TokenSlot;

import javax.crypto.SecretKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Chooses the tokens of every generalization of a column.
 *
 * <ul>
 *   <li>static: a random permutation of {@code 0..n-1}, one token each</li>
 *   <li>plain: the generalization string itself</li>
 *   <li>hash: keyed HMAC of the generalization under the column salt</li>
 *   <li>group id: the ids of the groups carrying the generalization</li>
 *   <li>runtime: a seed whose low bits are a counter (so seeds never repeat)
 *       and whose high bits are random, expanded into as many tokens as there
 *       are groups</li>
 * </ul>
 */
final class TokenAssigner {

    private final SecretKey key;
    private final int tokenBits;
    private final Random random;

    TokenAssigner(SecretKey key, int tokenBits, Random random) {
        this.key = key;
        this.tokenBits = tokenBits;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @param order positions into {@code profile}, in the order the slots are returned
     */
    TokenSlot[] assign(String column, TokenMode mode, ColumnProfile profile, int[] order, byte[] salt) {
        int n = order.length;
        TokenSlot[] slots = new TokenSlot[n];
        switch (mode) {
            case PLAIN -> {
                for (int i = 0; i < n; i++) slots[i] = TokenSlot.of(Token.of(profile.generalization(order[i])));
            }
            case HASH -> {
                KeyedHasher hasher = new KeyedHasher(requireKey(column, mode), salt);
                for (int i = 0; i < n; i++) {
                    slots[i] = TokenSlot.of(Token.of(hasher.hash(profile.generalization(order[i]))));
                }
            }
            case GROUP_ID -> {
                for (int i = 0; i < n; i++) {
                    List<Token> tokens = new ArrayList<>();
                    for (long g : profile.groups(order[i])) tokens.add(Token.of(g));
                    slots[i] = TokenSlot.of(tokens);
                }
            }
            case STATIC -> {
                long[] permutation = shuffled(counterRange(n));
                for (int i = 0; i < n; i++) slots[i] = TokenSlot.of(Token.of(permutation[i]));
            }
            case RUNTIME -> {
                requireKey(column, mode);
                long[] seeds = shuffled(runtimeSeeds(column, n));
                for (int i = 0; i < n; i++) slots[i] = TokenSlot.runtime(seeds[i], profile.frequency(order[i]));
            }
        }
        return slots;
    }

    private long[] runtimeSeeds(String column, int n) {
        int counterBits = n <= 1 ? 0 : 64 - Long.numberOfLeadingZeros(n - 1L);
        if (counterBits >= tokenBits) {
            throw new ConfigurationException("Column " + column + " has " + n
                    + " generalizations, too many for " + tokenBits + "-bit runtime tokens");
        }
        long bound = 1L << (tokenBits - counterBits);
        long[] seeds = new long[n];
        for (int i = 0; i < n; i++) {
            seeds[i] = (random.nextLong(bound) << counterBits) + i;
        }
        return seeds;
    }

    private static long[] counterRange(int n) {
        long[] out = new long[n];
        for (int i = 0; i < n; i++) out[i] = i;
        return out;
    }

    // Fisher-Yates
    private long[] shuffled(long[] values) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            long tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
        return values;
    }

    private SecretKey requireKey(String column, TokenMode mode) {
        if (key == null) {
            throw new ConfigurationException("Column " + column + " uses " + mode.name().toLowerCase()
                    + " tokens: a key is required");
        }
        return key;
    }
}
