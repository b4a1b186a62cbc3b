package com.secidx.mapping.column;

/**
 * Intervals stored as an augmented interval tree.
 */
public final class IntervalTreeData extends NumericData {

    private static final long serialVersionUID = 1L;

    private final IntervalTree tree;

    public IntervalTreeData(double[] starts, double[] ends, boolean[] rightOpen, boolean integral,
                            TokenSlot[] slots, boolean runtime, byte[] salt) {
        super(starts, ends, rightOpen, integral, slots, runtime, salt);
        // [start, end] becomes [start, nextUp(end)) so point stabbing is uniform
        double[] exclusive = new double[ends.length];
        for (int i = 0; i < ends.length; i++) {
            exclusive[i] = Math.nextUp(ends[i]);
        }
        this.tree = new IntervalTree(startsView(), exclusive);
    }

    IntervalTree tree() {
        return tree;
    }
}
