package com.secidx.mapping.column;

import java.util.HashSet;
import java.util.Set;

/**
 * Hash-set variant: for each category the set of generalizations listing it.
 */
public final class SetData extends CategoricalData {

    private static final long serialVersionUID = 1L;

    private final HashSet<Integer>[] sets;

    @SuppressWarnings("unchecked")
    public SetData(String[] categories, int[][] members, int[] generalizationSizes,
                   TokenSlot[] slots, boolean runtime, byte[] salt) {
        super(categories, generalizationSizes, slots, runtime, salt);
        if (members.length != categories.length) {
            throw new IllegalArgumentException("members and categories differ in length");
        }
        this.sets = new HashSet[members.length];
        for (int c = 0; c < members.length; c++) {
            HashSet<Integer> set = new HashSet<>();
            for (int g : members[c]) set.add(g);
            sets[c] = set;
        }
    }

    @Override
    public int[] members(int categoryIndex) {
        Set<Integer> set = sets[categoryIndex];
        return set.stream().mapToInt(Integer::intValue).sorted().toArray();
    }

    @Override
    public boolean contains(int categoryIndex, int generalization) {
        return sets[categoryIndex].contains(generalization);
    }
}
