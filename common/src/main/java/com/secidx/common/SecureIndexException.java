package com.secidx.common;

/**
 * Root of the secure-index error taxonomy.
 *
 * None of the subclasses represent transient conditions: they signal
 * configuration, data or programming errors and are never retried.
 */
public abstract class SecureIndexException extends RuntimeException {

    protected SecureIndexException(String message) {
        super(message);
    }

    protected SecureIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
