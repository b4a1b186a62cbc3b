package com.secidx.common;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The closed set of column-mapping representations.
 *
 * Numeric kinds ({@link #RANGE}, {@link #INTERVAL_TREE}) support ordering
 * predicates; categorical kinds only support equality and membership.
 */
public enum MappingType {
    RANGE("range", false),
    INTERVAL_TREE("interval-tree", false),
    BITMAP("bitmap", true),
    ROARING("roaring", true),
    SET("set", true);

    private final String name;
    private final boolean categorical;

    MappingType(String name, boolean categorical) {
        this.name = name;
        this.categorical = categorical;
    }

    /** External name used in configuration files and the serialized mapping. */
    public String getName() {
        return name;
    }

    public boolean isCategorical() {
        return categorical;
    }

    public static MappingType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Mapping type cannot be empty");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (MappingType t : values()) {
            if (t.name.equals(normalized)) return t;
        }
        throw new ConfigurationException(name + " is not a valid type of mapping. Valid types: "
                + Arrays.stream(values()).map(MappingType::getName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return name;
    }
}
