package com.secidx.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.secidx.common.ConfigurationException;
import com.secidx.common.MappingType;

/**
 * Per-column mapping configuration.
 *
 * At most one of the token modifiers ({@code plain}, {@code hash}, {@code gid},
 * {@code runtime}) may be set; with none set, tokens are a random permutation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ColumnConfig {

    /** How tokens are assigned to generalizations. */
    public enum TokenMode { STATIC, PLAIN, HASH, GROUP_ID, RUNTIME }

    @JsonProperty("type")
    private String type = "range";

    @JsonProperty("plain")
    private boolean plain;

    @JsonProperty("hash")
    private boolean hash;

    @JsonProperty("gid")
    private boolean gid;

    @JsonProperty("runtime")
    private boolean runtime;

    public ColumnConfig() {
        // Jackson
    }

    public ColumnConfig(String type, boolean plain, boolean hash, boolean gid, boolean runtime) {
        this.type = type;
        this.plain = plain;
        this.hash = hash;
        this.gid = gid;
        this.runtime = runtime;
    }

    public static ColumnConfig of(MappingType type, TokenMode mode) {
        return new ColumnConfig(type.getName(),
                mode == TokenMode.PLAIN,
                mode == TokenMode.HASH,
                mode == TokenMode.GROUP_ID,
                mode == TokenMode.RUNTIME);
    }

    @JsonIgnore
    public MappingType getMappingType() {
        return MappingType.fromName(type);
    }

    @JsonIgnore
    public TokenMode getTokenMode() {
        if (plain) return TokenMode.PLAIN;
        if (hash) return TokenMode.HASH;
        if (gid) return TokenMode.GROUP_ID;
        if (runtime) return TokenMode.RUNTIME;
        return TokenMode.STATIC;
    }

    public String getType() { return type; }
    public boolean isPlain() { return plain; }
    public boolean isHash() { return hash; }
    public boolean isGid() { return gid; }
    public boolean isRuntime() { return runtime; }

    /** Whether the token mode needs the master key. */
    @JsonIgnore
    public boolean needsKey() {
        return hash || runtime;
    }

    void validate(String column) {
        getMappingType();
        int flags = (plain ? 1 : 0) + (hash ? 1 : 0) + (gid ? 1 : 0) + (runtime ? 1 : 0);
        if (flags > 1) {
            throw new ConfigurationException("Column " + column
                    + ": only one flag among gid, hash, plain and runtime can be set");
        }
    }

    @Override
    public String toString() {
        return "ColumnConfig{type=" + type + ", mode=" + getTokenMode() + "}";
    }
}
