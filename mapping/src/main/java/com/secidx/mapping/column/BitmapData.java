package com.secidx.mapping.column;

import java.util.BitSet;

/**
 * One {@link BitSet} per category, bit {@code g} set when generalization
 * {@code g} lists the category.
 */
public final class BitmapData extends CategoricalData {

    private static final long serialVersionUID = 1L;

    private final BitSet[] bitmaps;

    public BitmapData(String[] categories, int[][] members, int[] generalizationSizes,
                      TokenSlot[] slots, boolean runtime, byte[] salt) {
        super(categories, generalizationSizes, slots, runtime, salt);
        if (members.length != categories.length) {
            throw new IllegalArgumentException("members and categories differ in length");
        }
        this.bitmaps = new BitSet[members.length];
        for (int c = 0; c < members.length; c++) {
            BitSet bits = new BitSet(slots.length);
            for (int g : members[c]) bits.set(g);
            bitmaps[c] = bits;
        }
    }

    @Override
    public int[] members(int categoryIndex) {
        return bitmaps[categoryIndex].stream().toArray();
    }

    @Override
    public boolean contains(int categoryIndex, int generalization) {
        return bitmaps[categoryIndex].get(generalization);
    }
}
