package com.secidx.mapping.column;

import java.util.Arrays;
import java.util.Objects;

/**
 * Categories (sorted, distinct) and, for each generalization, how many
 * categories it lists. The category to generalization index lives in the
 * variant subclasses.
 */
public abstract class CategoricalData extends ColumnData {

    private static final long serialVersionUID = 1L;

    private final String[] categories;
    private final int[] generalizationSizes;

    protected CategoricalData(String[] categories, int[] generalizationSizes,
                              TokenSlot[] slots, boolean runtime, byte[] salt) {
        super(slots, runtime, salt);
        this.categories = Objects.requireNonNull(categories, "categories").clone();
        this.generalizationSizes = Objects.requireNonNull(generalizationSizes, "generalizationSizes").clone();
        if (generalizationSizes.length != slots.length) {
            throw new IllegalArgumentException("generalizationSizes and slots differ in length");
        }
        for (int i = 1; i < categories.length; i++) {
            if (categories[i - 1].compareTo(categories[i]) >= 0) {
                throw new IllegalArgumentException("Categories must be sorted and distinct");
            }
        }
    }

    public int categoryCount() {
        return categories.length;
    }

    public String category(int i) {
        return categories[i];
    }

    /** Position of {@code category}, or a negative number when absent. */
    public int indexOf(String category) {
        return Arrays.binarySearch(categories, category);
    }

    public int generalizationSize(int generalization) {
        return generalizationSizes[generalization];
    }

    /** Generalizations listing the category at {@code categoryIndex}, ascending. */
    public abstract int[] members(int categoryIndex);

    public abstract boolean contains(int categoryIndex, int generalization);
}
