package com.secidx.mapping.column;

import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Sorted range list plus the positions of the ranges ordered by end,
 * descending, which lets ge/gt stop at the first range ending too early.
 */
public final class RangeData extends NumericData {

    private static final long serialVersionUID = 1L;

    private final int[] byEnd;

    public RangeData(double[] starts, double[] ends, boolean[] rightOpen, boolean integral,
                     TokenSlot[] slots, boolean runtime, byte[] salt) {
        super(starts, ends, rightOpen, integral, slots, runtime, salt);
        this.byEnd = IntStream.range(0, ends.length)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> ends[i]).reversed())
                .mapToInt(Integer::intValue)
                .toArray();
    }

    int byEnd(int rank) {
        return byEnd[rank];
    }
}
