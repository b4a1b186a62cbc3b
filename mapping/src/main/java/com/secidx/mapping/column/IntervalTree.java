package com.secidx.mapping.column;

import java.io.Serializable;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Immutable augmented interval tree over half-open intervals {@code [start, end)}.
 *
 * <p>The intervals are kept sorted by start; the tree is implicit over that
 * array (the root of {@code [l, r)} is its midpoint) and every node carries the
 * largest end of its subtree, so searches prune whole subtrees that finish
 * before the query begins. Queries report interval positions in the sorted
 * order, which callers use to index their own per-interval data.
 */
public final class IntervalTree implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] starts;
    private final double[] ends;
    private final double[] maxEnd;

    /**
     * @param starts interval starts, sorted ascending
     * @param ends   exclusive ends, {@code ends[i] > starts[i]}
     */
    public IntervalTree(double[] starts, double[] ends) {
        Objects.requireNonNull(starts, "starts");
        Objects.requireNonNull(ends, "ends");
        if (starts.length != ends.length) {
            throw new IllegalArgumentException("starts and ends differ in length");
        }
        for (int i = 0; i < starts.length; i++) {
            if (!(ends[i] > starts[i])) {
                throw new IllegalArgumentException("Empty interval at " + i + ": [" + starts[i] + ", " + ends[i] + ")");
            }
            if (i > 0 && starts[i - 1] > starts[i]) {
                throw new IllegalArgumentException("Intervals must be sorted by start");
            }
        }
        this.starts = starts.clone();
        this.ends = ends.clone();
        this.maxEnd = new double[starts.length];
        augment(0, starts.length);
    }

    private double augment(int l, int r) {
        if (l >= r) return Double.NEGATIVE_INFINITY;
        int mid = (l + r) >>> 1;
        double m = Math.max(ends[mid], Math.max(augment(l, mid), augment(mid + 1, r)));
        maxEnd[mid] = m;
        return m;
    }

    public int size() {
        return starts.length;
    }

    /** Intervals containing {@code point}: {@code start <= point < end}. */
    public void stab(double point, IntConsumer sink) {
        overlap(point, Math.nextUp(point), sink);
    }

    /** Intervals overlapping {@code [lo, hi)}: {@code start < hi && end > lo}. */
    public void overlap(double lo, double hi, IntConsumer sink) {
        Objects.requireNonNull(sink, "sink");
        search(0, starts.length, lo, hi, sink);
    }

    /** Intervals reaching past {@code lo}: {@code end > lo}. */
    public void from(double lo, IntConsumer sink) {
        overlap(lo, Double.POSITIVE_INFINITY, sink);
    }

    /** Intervals starting before {@code hi}: {@code start < hi}. */
    public void until(double hi, IntConsumer sink) {
        overlap(Double.NEGATIVE_INFINITY, hi, sink);
    }

    private void search(int l, int r, double lo, double hi, IntConsumer sink) {
        while (l < r) {
            int mid = (l + r) >>> 1;
            if (maxEnd[mid] <= lo) return;
            search(l, mid, lo, hi, sink);
            if (!(starts[mid] < hi)) return;     // everything to the right starts later still
            if (ends[mid] > lo) sink.accept(mid);
            l = mid + 1;
        }
    }
}
