package com.secidx.crypto;

import com.secidx.common.CryptoException;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;

import static org.junit.jupiter.api.Assertions.*;

class KeyUtilsTest {

    @Test
    void passwordDerivationIsDeterministicAndWipesThePassword() {
        char[] password = "correct horse".toCharArray();
        SecretKey first = KeyUtils.deriveFromPassword(password);
        SecretKey second = KeyUtils.deriveFromPassword("correct horse".toCharArray());

        assertArrayEquals(first.getEncoded(), second.getEncoded());
        assertEquals(32, first.getEncoded().length);
        assertArrayEquals(new char[password.length], password);
        assertFalse(java.util.Arrays.equals(first.getEncoded(),
                KeyUtils.deriveFromPassword("battery staple".toCharArray()).getEncoded()));
    }

    @Test
    void invalidInputsAreRejected() {
        assertThrows(CryptoException.class, () -> KeyUtils.deriveFromPassword(new char[0]));
        assertThrows(CryptoException.class, () -> KeyUtils.deriveFromPassword(null));
        assertThrows(CryptoException.class, () -> KeyUtils.fromBytes(new byte[15]));
        assertEquals(24, KeyUtils.fromBytes(new byte[24]).getEncoded().length);
        assertEquals(KeyUtils.SALT_LENGTH, KeyUtils.randomSalt().length);
    }

    @Test
    void keyedHashIsStableBase64() {
        SecretKey key = KeyUtils.fromBytes(new byte[32]);
        byte[] salt = new byte[16];
        KeyedHasher hasher = new KeyedHasher(key, salt);

        String h = hasher.hash("[10-19]");
        assertEquals(44, h.length());
        assertEquals(h, new KeyedHasher(key, salt).hash("[10-19]"));
        assertNotEquals(h, hasher.hash("[0-9]"));

        byte[] otherSalt = new byte[16];
        otherSalt[0] = 1;
        assertNotEquals(h, new KeyedHasher(key, otherSalt).hash("[10-19]"));
    }
}
