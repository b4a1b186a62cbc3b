package com.secidx.crypto;

import com.secidx.common.CryptoException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class EncryptionUtilsTest {

    private static final byte[] AAD = "aad".getBytes(StandardCharsets.UTF_8);

    @Test
    void sealOpenRoundTrip() {
        SecretKey key = KeyUtils.generateKey();
        byte[] plaintext = "mapping".getBytes(StandardCharsets.UTF_8);

        byte[] sealed = EncryptionUtils.seal(plaintext, key, AAD);
        assertEquals(EncryptionUtils.GCM_IV_LENGTH + plaintext.length + 16, sealed.length);
        assertArrayEquals(plaintext, EncryptionUtils.open(sealed, key, AAD));
        assertFalse(java.util.Arrays.equals(sealed, EncryptionUtils.seal(plaintext, key, AAD)), "IV must be fresh");
    }

    @Test
    void wrongKeyTamperingOrAad_failAuthentication() {
        SecretKey key = KeyUtils.generateKey();
        byte[] sealed = EncryptionUtils.seal(new byte[]{1, 2, 3}, key, AAD);

        CryptoException wrongKey = assertThrows(CryptoException.class,
                () -> EncryptionUtils.open(sealed, KeyUtils.generateKey(), AAD));
        assertEquals("decryption failed: wrong password or corrupted mapping", wrongKey.getMessage());

        byte[] tampered = sealed.clone();
        tampered[tampered.length - 1] ^= 1;
        assertThrows(CryptoException.class, () -> EncryptionUtils.open(tampered, key, AAD));
        assertThrows(CryptoException.class, () -> EncryptionUtils.open(sealed, key, new byte[]{9}));
        assertThrows(CryptoException.class, () -> EncryptionUtils.open(new byte[8], key, AAD));
    }

    @Test
    void blobCipherRecordsTimers() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AesGcmBlobCipher cipher = new AesGcmBlobCipher(registry, KeyUtils.generateKey());

        byte[] sealed = cipher.seal(new byte[10]);
        assertArrayEquals(new byte[10], cipher.open(sealed));

        assertEquals(1L, registry.get("secidx.crypto.duration").tag("op", "seal").timer().count());
        assertEquals(1L, registry.get("secidx.crypto.duration").tag("op", "open").timer().count());
        assertThrows(CryptoException.class, () -> new AesGcmBlobCipher(null, KeyUtils.fromBytes(new byte[16])).open(sealed));
    }
}
