package com.secidx.common;

/**
 * Invalid mapping type, invalid flag combination, missing or duplicate
 * configuration. Raised before any work begins.
 */
public class ConfigurationException extends SecureIndexException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
