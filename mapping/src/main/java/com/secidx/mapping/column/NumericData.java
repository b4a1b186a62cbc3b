package com.secidx.mapping.column;

import java.util.Objects;

/**
 * Closed numeric intervals, sorted by start (ties by end). {@code rightOpen}
 * only remembers the bracket written at creation time so the generalization
 * strings round-trip; matching always treats the interval as closed.
 */
public abstract class NumericData extends ColumnData {

    private static final long serialVersionUID = 1L;

    private final double[] starts;
    private final double[] ends;
    private final boolean[] rightOpen;
    private final boolean integral;

    protected NumericData(double[] starts, double[] ends, boolean[] rightOpen, boolean integral,
                          TokenSlot[] slots, boolean runtime, byte[] salt) {
        super(slots, runtime, salt);
        this.starts = Objects.requireNonNull(starts, "starts").clone();
        this.ends = Objects.requireNonNull(ends, "ends").clone();
        this.rightOpen = Objects.requireNonNull(rightOpen, "rightOpen").clone();
        this.integral = integral;
        if (starts.length != slots.length || ends.length != slots.length || rightOpen.length != slots.length) {
            throw new IllegalArgumentException("starts, ends, rightOpen and slots differ in length");
        }
        for (int i = 0; i < starts.length; i++) {
            if (starts[i] > ends[i]) {
                throw new IllegalArgumentException("Interval " + i + " has start > end");
            }
            if (i > 0 && (starts[i - 1] > starts[i]
                    || (starts[i - 1] == starts[i] && ends[i - 1] > ends[i]))) {
                throw new IllegalArgumentException("Intervals must be sorted by start");
            }
        }
    }

    public double start(int i) { return starts[i]; }

    public double end(int i) { return ends[i]; }

    public boolean isRightOpen(int i) { return rightOpen[i]; }

    /** Whether every extreme is a whole number (formatted without decimals). */
    public boolean isIntegral() { return integral; }

    double[] startsView() { return starts; }

    double[] endsView() { return ends; }
}
