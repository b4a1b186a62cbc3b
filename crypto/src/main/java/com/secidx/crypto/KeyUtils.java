package com.secidx.crypto;

import com.secidx.common.CryptoException;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Key helpers: raw-key wrapping, password-based derivation and salts.
 */
public final class KeyUtils {

    public static final int SALT_LENGTH = 16;

    private static final String KDF_ALGO = "PBKDF2WithHmacSHA256";
    private static final int KDF_ITERATIONS = 210_000;
    private static final int KEY_BITS = 256;

    /** Application-wide KDF salt shared by the mapping tools. */
    private static final byte[] PASSWORD_SALT = {
            (byte) 0xd0, (byte) 0xe1, 0x03, (byte) 0xc2, 0x5a, 0x3c, 0x52, (byte) 0xaf,
            0x5d, (byte) 0xfe, (byte) 0xd5, (byte) 0xbf, (byte) 0xf8, 0x75, 0x7c, (byte) 0x8f
    };

    private static final SecureRandom RANDOM = new SecureRandom();

    private KeyUtils() {}

    /** Builds an AES SecretKey from raw bytes (16, 24 or 32 bytes). */
    public static SecretKey fromBytes(byte[] rawKeyBytes) {
        requireAesLength(rawKeyBytes == null ? 0 : rawKeyBytes.length);
        return new SecretKeySpec(rawKeyBytes, "AES");
    }

    public static void requireAesLength(int length) {
        if (length != 16 && length != 24 && length != 32) {
            throw new CryptoException("Invalid AES key length: " + length);
        }
    }

    /** Fresh random 256-bit AES key. */
    public static SecretKey generateKey() {
        try {
            KeyGenerator kg = KeyGenerator.getInstance("AES");
            kg.init(KEY_BITS, RANDOM);
            return kg.generateKey();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("AES key generation unavailable", e);
        }
    }

    /**
     * Derives the 256-bit master key from a password. The password array is
     * wiped before returning.
     */
    public static SecretKey deriveFromPassword(char[] password) {
        if (password == null || password.length == 0) {
            throw new CryptoException("Password cannot be empty");
        }
        PBEKeySpec spec = new PBEKeySpec(password, PASSWORD_SALT, KDF_ITERATIONS, KEY_BITS);
        try {
            byte[] raw = SecretKeyFactory.getInstance(KDF_ALGO).generateSecret(spec).getEncoded();
            try {
                return new SecretKeySpec(raw, "AES");
            } finally {
                Arrays.fill(raw, (byte) 0);
            }
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(password, '\0');
        }
    }

    /** Fresh 16-byte salt, one per mapped column. */
    public static byte[] randomSalt() {
        byte[] salt = new byte[SALT_LENGTH];
        RANDOM.nextBytes(salt);
        return salt;
    }
}
