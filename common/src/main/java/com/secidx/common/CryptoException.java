package com.secidx.common;

/**
 * Authentication failure on the mapping envelope (wrong password/key or
 * corrupted ciphertext) or an unusable cipher configuration. Fatal: no
 * partial data is ever returned alongside it.
 */
public class CryptoException extends SecureIndexException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
