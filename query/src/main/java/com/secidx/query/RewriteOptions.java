package com.secidx.query;

import com.secidx.common.ConfigurationException;
import com.secidx.config.IndexConfig;
import com.secidx.config.Representation;

import java.util.Objects;

/** Immutable knobs of {@link QueryRewriter}. */
public final class RewriteOptions {

    public static final String DEFAULT_BLOB_COLUMN = "EncTuples";

    private final Representation representation;
    private final boolean keyValueMode;
    private final String blobColumn;
    private final boolean keepTail;

    private RewriteOptions(Representation representation, boolean keyValueMode, String blobColumn, boolean keepTail) {
        this.representation = Objects.requireNonNull(representation, "representation");
        this.keyValueMode = keyValueMode;
        this.blobColumn = Objects.requireNonNull(blobColumn, "blobColumn");
        if (blobColumn.isBlank() || blobColumn.indexOf('"') >= 0) {
            throw new ConfigurationException("Invalid blob column name: '" + blobColumn + "'");
        }
        this.keepTail = keepTail;
    }

    public static RewriteOptions defaults() {
        return new RewriteOptions(Representation.FLAT, false, DEFAULT_BLOB_COLUMN, true);
    }

    public static RewriteOptions from(IndexConfig.RewriteConfig config) {
        Objects.requireNonNull(config, "config");
        return new RewriteOptions(config.getRepresentation(), config.isKeyValueMode(),
                config.getBlobColumn(), config.isKeepTail());
    }

    public RewriteOptions withRepresentation(Representation representation) {
        return new RewriteOptions(representation, keyValueMode, blobColumn, keepTail);
    }

    public RewriteOptions withKeyValueMode(boolean keyValueMode) {
        return new RewriteOptions(representation, keyValueMode, blobColumn, keepTail);
    }

    public RewriteOptions withBlobColumn(String blobColumn) {
        return new RewriteOptions(representation, keyValueMode, blobColumn, keepTail);
    }

    public RewriteOptions withKeepTail(boolean keepTail) {
        return new RewriteOptions(representation, keyValueMode, blobColumn, keepTail);
    }

    public Representation getRepresentation() {
        return representation;
    }

    public boolean isKeyValueMode() {
        return keyValueMode;
    }

    public String getBlobColumn() {
        return blobColumn;
    }

    public boolean isKeepTail() {
        return keepTail;
    }

    @Override
    public String toString() {
        return "RewriteOptions{representation=" + representation
                + ", keyValueMode=" + keyValueMode
                + ", blobColumn=" + blobColumn
                + ", keepTail=" + keepTail + '}';
    }
}
