package com.secidx.config;

import com.secidx.common.ConfigurationException;

import java.util.Locale;

/**
 * Server-side representation of the wrapped dataset; decides how the rewriter
 * rewrites the table reference.
 */
public enum Representation {
    FLAT,          // tokens stored next to each blob, no join
    MAPPING,       // blobs keyed by group id, joined with the "mapping" table
    NORMALIZATION; // per-column normal-form tables keyed by surrogate ids

    public static Representation fromName(String name) {
        if (name == null || name.isBlank()) return FLAT;
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "flat":
            case "normal":
                return FLAT;
            case "mapping":
                return MAPPING;
            case "normalization":
            case "normalized":
                return NORMALIZATION;
            default:
                throw new ConfigurationException(name
                        + " is not a valid server-side representation of the dataset");
        }
    }
}
