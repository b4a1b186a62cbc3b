package com.secidx.mapping.column;

import com.secidx.common.MappingType;

import java.util.BitSet;

/**
 * Interval tree backed variant. Stored intervals are half-open with the end
 * moved to the next representable double, so a closed bound {@code v} becomes
 * {@code nextUp(v)} on the open side.
 */
public final class IntervalTreeMapping extends NumericMapping<IntervalTreeData> {

    public IntervalTreeMapping(String column, IntervalTreeData data, byte[] tokenKey) {
        super(column, MappingType.INTERVAL_TREE, data, tokenKey);
    }

    @Override
    protected BitSet startingBelow(double v) {
        BitSet hits = new BitSet(data.size());
        data.tree().until(v, hits::set);
        return hits;
    }

    @Override
    protected BitSet startingAtOrBelow(double v) {
        BitSet hits = new BitSet(data.size());
        data.tree().until(Math.nextUp(v), hits::set);
        return hits;
    }

    @Override
    protected BitSet endingAbove(double v) {
        BitSet hits = new BitSet(data.size());
        data.tree().from(Math.nextUp(v), hits::set);
        return hits;
    }

    @Override
    protected BitSet endingAtOrAbove(double v) {
        BitSet hits = new BitSet(data.size());
        data.tree().from(v, hits::set);
        return hits;
    }

    @Override
    protected BitSet overlapping(double low, double high) {
        BitSet hits = new BitSet(data.size());
        data.tree().overlap(low, Math.nextUp(high), hits::set);
        return hits;
    }
}
