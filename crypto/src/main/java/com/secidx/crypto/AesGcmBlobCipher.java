package com.secidx.crypto;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * AES-GCM blob cipher bound to one key.
 *
 * AAD: "secidx-mapping|v1" so a blob sealed for another purpose under the same
 * key does not open here.
 */
public class AesGcmBlobCipher implements BlobCipher {

    private static final Logger log = LoggerFactory.getLogger(AesGcmBlobCipher.class);

    static final byte[] AAD = "secidx-mapping|v1".getBytes(StandardCharsets.UTF_8);

    private final SecretKey key;
    private final Timer sealTimer;
    private final Timer openTimer;

    /**
     * @param metrics optional registry; timers are only recorded when present
     */
    public AesGcmBlobCipher(MeterRegistry metrics, SecretKey key) {
        this.key = Objects.requireNonNull(key, "key");
        KeyUtils.requireAesLength(key.getEncoded().length);
        if (metrics != null) {
            this.sealTimer = Timer.builder("secidx.crypto.duration").tag("op", "seal").register(metrics);
            this.openTimer = Timer.builder("secidx.crypto.duration").tag("op", "open").register(metrics);
        } else {
            this.sealTimer = null;
            this.openTimer = null;
        }
        log.debug("AesGcmBlobCipher initialized ({}-bit key)", key.getEncoded().length * 8);
    }

    @Override
    public byte[] seal(byte[] plaintext) {
        long start = System.nanoTime();
        byte[] out = EncryptionUtils.seal(plaintext, key, AAD);
        record(sealTimer, "seal", plaintext.length, System.nanoTime() - start);
        return out;
    }

    @Override
    public byte[] open(byte[] sealed) {
        long start = System.nanoTime();
        byte[] out = EncryptionUtils.open(sealed, key, AAD);
        record(openTimer, "open", out.length, System.nanoTime() - start);
        return out;
    }

    private static void record(Timer timer, String op, int bytes, long nanos) {
        if (timer != null) timer.record(nanos, TimeUnit.NANOSECONDS);
        log.trace("{} of {} bytes took {} ns", op, bytes, nanos);
    }
}
