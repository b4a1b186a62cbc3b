package com.secidx.mapping.column;

import org.roaringbitmap.RoaringBitmap;

/**
 * Compressed variant of {@link BitmapData}: one {@link RoaringBitmap} per
 * category.
 */
public final class RoaringData extends CategoricalData {

    private static final long serialVersionUID = 1L;

    private final RoaringBitmap[] bitmaps;

    public RoaringData(String[] categories, int[][] members, int[] generalizationSizes,
                       TokenSlot[] slots, boolean runtime, byte[] salt) {
        super(categories, generalizationSizes, slots, runtime, salt);
        if (members.length != categories.length) {
            throw new IllegalArgumentException("members and categories differ in length");
        }
        this.bitmaps = new RoaringBitmap[members.length];
        for (int c = 0; c < members.length; c++) {
            RoaringBitmap bitmap = RoaringBitmap.bitmapOf(members[c]);
            bitmap.runOptimize();
            bitmaps[c] = bitmap;
        }
    }

    @Override
    public int[] members(int categoryIndex) {
        return bitmaps[categoryIndex].toArray();
    }

    @Override
    public boolean contains(int categoryIndex, int generalization) {
        return bitmaps[categoryIndex].contains(generalization);
    }
}
