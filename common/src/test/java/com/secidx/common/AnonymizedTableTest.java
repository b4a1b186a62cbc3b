package com.secidx.common;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnonymizedTableTest {

    private static AnonymizedTable table() {
        return new AnonymizedTable(List.of("GID", "AGE"), "GID", List.of(
                new String[]{"1", "[0-9]"},
                new String[]{" 1", "[0-9]"},
                new String[]{"2", "[10-19]"}));
    }

    @Test
    void distinctByGroupKeepsTheFirstRow() {
        AnonymizedTable groups = table().distinctByGroup();
        assertEquals(2, groups.size());
        assertEquals(List.of("[0-9]", "[10-19]"), groups.column("AGE"));
        assertEquals(2L, groups.groupId(1));
        assertSame(groups, groups.distinctByGroup());
    }

    @Test
    void invalidShapesAreRejected() {
        assertThrows(ConfigurationException.class,
                () -> new AnonymizedTable(List.of("AGE"), "GID", List.of()));
        assertThrows(ConfigurationException.class,
                () -> new AnonymizedTable(List.of("GID", "GID"), "GID", List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new AnonymizedTable(List.of("GID", "AGE"), "GID", List.<String[]>of(new String[]{"1"})));

        AnonymizedTable bad = new AnonymizedTable(List.of("GID"), "GID", List.<String[]>of(new String[]{"x"}));
        assertThrows(IllegalArgumentException.class, () -> bad.groupId(0));
        assertThrows(IllegalArgumentException.class, () -> table().value(0, "CITY"));
    }
}
