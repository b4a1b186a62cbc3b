package com.secidx.common;

/**
 * Malformed or unsupported SQL construct. Carries the offending token text and
 * its character offset in the statement (-1 when not attributable).
 */
public class SqlParseException extends SecureIndexException {

    private final String offendingToken;
    private final int position;

    public SqlParseException(String message) {
        this(message, null, -1);
    }

    public SqlParseException(String message, String offendingToken, int position) {
        super(position >= 0 ? message + " (at offset " + position + ")" : message);
        this.offendingToken = offendingToken;
        this.position = position;
    }

    public String getOffendingToken() {
        return offendingToken;
    }

    public int getPosition() {
        return position;
    }
}
