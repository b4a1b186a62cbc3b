package com.secidx.crypto;

import com.secidx.common.CryptoException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TokenDerivationTest {

    private static final byte[] KEY = new byte[32];
    private static final byte[] SALT = new byte[16];

    static {
        for (int i = 0; i < KEY.length; i++) KEY[i] = (byte) i;
        for (int i = 0; i < SALT.length; i++) SALT[i] = (byte) (100 + i);
    }

    @Test
    void derivationIsDeterministicAndSized() {
        long[] a = TokenDerivation.derive(12345L, 5, KEY, SALT);
        long[] b = TokenDerivation.derive(12345L, 5, KEY, SALT);

        assertEquals(5, a.length);
        assertArrayEquals(a, b);
        assertTrue(Arrays.stream(a).allMatch(t -> t >= 0), "tokens are 63-bit");
        assertFalse(Arrays.equals(a, TokenDerivation.derive(12346L, 5, KEY, SALT)));
    }

    @Test
    void shorterDerivationIsAPrefix() {
        long[] three = TokenDerivation.derive(7L, 3, KEY, SALT);
        long[] four = TokenDerivation.derive(7L, 4, KEY, SALT);
        assertArrayEquals(three, Arrays.copyOf(four, 3));
    }

    @Test
    void saltAndKeyChangeTheTokens() {
        byte[] otherSalt = SALT.clone();
        otherSalt[0] ^= 1;
        long[] base = TokenDerivation.derive(1L, 2, KEY, SALT);
        assertFalse(Arrays.equals(base, TokenDerivation.derive(1L, 2, KEY, otherSalt)));
        assertFalse(Arrays.equals(base, TokenDerivation.derive(1L, 2, new byte[16], SALT)));
    }

    @Test
    void deriveAllKeepsTheInputOrder() {
        long[] seeds = {5L, 1L, 9L, 3L};
        int[] counts = {1, 4, 2, 3};
        List<long[]> all = TokenDerivation.deriveAll(seeds, counts, KEY, SALT);

        assertEquals(4, all.size());
        for (int i = 0; i < seeds.length; i++) {
            assertArrayEquals(TokenDerivation.derive(seeds[i], counts[i], KEY, SALT), all.get(i));
        }
        assertTrue(TokenDerivation.deriveAll(new long[0], new int[0], KEY, SALT).isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> TokenDerivation.deriveAll(new long[1], new int[2], KEY, SALT));
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> TokenDerivation.derive(-1L, 1, KEY, SALT));
        assertThrows(IllegalArgumentException.class, () -> TokenDerivation.derive(1L, 0, KEY, SALT));
        assertThrows(CryptoException.class, () -> TokenDerivation.derive(1L, 1, new byte[24], SALT));
        assertThrows(CryptoException.class, () -> TokenDerivation.derive(1L, 1, KEY, new byte[12]));
    }

    @Test
    void truncatedTokensCollideRoughlyAsTheBirthdayEstimate() {
        int n = 8192;
        int bits = 16;
        long[] tokens = TokenDerivation.derive(42L, n, KEY, SALT);

        Map<Long, Integer> counts = new HashMap<>();
        for (long t : tokens) counts.merge(t & ((1L << bits) - 1), 1, Integer::sum);
        long involved = counts.values().stream().filter(c -> c > 1).mapToLong(Integer::longValue).sum();

        double observed = (double) involved / n;
        double expected = TokenDerivation.expectedCollisionRate(n, bits);
        assertTrue(observed > expected * 0.5 && observed < expected * 1.5,
                () -> "observed " + observed + " vs expected " + expected);
    }
}
