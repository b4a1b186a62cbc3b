package com.secidx.crypto;

import com.secidx.common.CryptoException;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Objects;

/**
 * Content-derived tokens: HMAC-SHA256 over {@code salt || utf8(value)},
 * base64 encoded. Stable for a given key and salt.
 */
public final class KeyedHasher {

    private static final String MAC_ALGO = "HmacSHA256";

    private final SecretKeySpec macKey;
    private final byte[] salt;

    public KeyedHasher(SecretKey key, byte[] salt) {
        Objects.requireNonNull(key, "key");
        this.macKey = new SecretKeySpec(key.getEncoded(), MAC_ALGO);
        this.salt = Objects.requireNonNull(salt, "salt").clone();
    }

    public String hash(String value) {
        Objects.requireNonNull(value, "value");
        try {
            Mac mac = Mac.getInstance(MAC_ALGO);
            mac.init(macKey);
            mac.update(salt);
            return Base64.getEncoder().encodeToString(mac.doFinal(value.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Keyed hash failed", e);
        }
    }
}
