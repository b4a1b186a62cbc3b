package com.secidx.mapping.creation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Distinct generalizations of one column in first-seen order, with the number
 * of groups carrying each and those groups' ids.
 */
final class ColumnProfile {

    private final List<String> generalizations = new ArrayList<>();
    private final List<Integer> frequencies = new ArrayList<>();
    private final List<TreeSet<Long>> groups = new ArrayList<>();
    private final Map<String, Integer> positions = new HashMap<>();

    /**
     * @param values   generalization per group, already canonical
     * @param groupIds group id per value
     */
    static ColumnProfile of(List<String> values, List<Long> groupIds) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(groupIds, "groupIds");
        if (values.size() != groupIds.size()) {
            throw new IllegalArgumentException("values and groupIds differ in length");
        }
        ColumnProfile profile = new ColumnProfile();
        for (int i = 0; i < values.size(); i++) {
            profile.add(values.get(i), groupIds.get(i));
        }
        return profile;
    }

    private void add(String generalization, long groupId) {
        Integer p = positions.get(generalization);
        if (p == null) {
            p = generalizations.size();
            positions.put(generalization, p);
            generalizations.add(generalization);
            frequencies.add(0);
            groups.add(new TreeSet<>());
        }
        frequencies.set(p, frequencies.get(p) + 1);
        groups.get(p).add(groupId);
    }

    int size() {
        return generalizations.size();
    }

    String generalization(int i) {
        return generalizations.get(i);
    }

    int frequency(int i) {
        return frequencies.get(i);
    }

    TreeSet<Long> groups(int i) {
        return groups.get(i);
    }

    List<String> generalizations() {
        return List.copyOf(generalizations);
    }
}
