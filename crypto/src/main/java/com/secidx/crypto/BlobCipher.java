package com.secidx.crypto;

/**
 * Authenticated encryption of opaque blobs (the serialized mapping at rest).
 */
public interface BlobCipher {

    /** Encrypt and authenticate. */
    byte[] seal(byte[] plaintext);

    /**
     * Verify and decrypt.
     *
     * @throws com.secidx.common.CryptoException if authentication fails
     */
    byte[] open(byte[] sealed);
}
