package com.secidx.crypto;

import com.secidx.common.CryptoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

/**
 * Low-level AES-GCM sealing of byte blobs.
 *
 * Sealed layout: {@code IV (12 bytes) || ciphertext || tag (16 bytes)}.
 */
public final class EncryptionUtils {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    public static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH_BITS = 128;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Logger logger = LoggerFactory.getLogger(EncryptionUtils.class);

    private EncryptionUtils() {}

    private static byte[] generateIV() {
        byte[] iv = new byte[GCM_IV_LENGTH];
        SECURE_RANDOM.nextBytes(iv);
        return iv;
    }

    /** Encrypts under a fresh IV and prepends the IV to the ciphertext. */
    public static byte[] seal(byte[] plaintext, SecretKey key, byte[] aad) {
        Objects.requireNonNull(plaintext, "plaintext cannot be null");
        Objects.requireNonNull(key, "SecretKey cannot be null");
        byte[] iv = generateIV();
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            if (aad != null && aad.length > 0) cipher.updateAAD(aad);
            byte[] ct = cipher.doFinal(plaintext);
            logger.debug("Sealed {} bytes", plaintext.length);
            return ByteBuffer.allocate(iv.length + ct.length).put(iv).put(ct).array();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Encryption failed", e);
        }
    }

    /**
     * Inverse of {@link #seal}.
     *
     * @throws CryptoException when the tag does not verify (wrong key or tampered data)
     */
    public static byte[] open(byte[] sealed, SecretKey key, byte[] aad) {
        Objects.requireNonNull(sealed, "sealed blob cannot be null");
        Objects.requireNonNull(key, "SecretKey cannot be null");
        if (sealed.length < GCM_IV_LENGTH + GCM_TAG_LENGTH_BITS / 8) {
            throw new CryptoException("decryption failed: ciphertext too short");
        }
        byte[] iv = Arrays.copyOfRange(sealed, 0, GCM_IV_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            if (aad != null && aad.length > 0) cipher.updateAAD(aad);
            return cipher.doFinal(sealed, GCM_IV_LENGTH, sealed.length - GCM_IV_LENGTH);
        } catch (AEADBadTagException e) {
            throw new CryptoException("decryption failed: wrong password or corrupted mapping", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("decryption failed", e);
        }
    }
}
