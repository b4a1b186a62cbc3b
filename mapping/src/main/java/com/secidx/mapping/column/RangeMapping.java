package com.secidx.mapping.column;

import com.secidx.common.MappingType;

import java.util.BitSet;

/**
 * Linear scans over the sorted range list. Scans in start order stop at the
 * first range starting past the bound; scans in end order stop at the first
 * range ending before it.
 */
public final class RangeMapping extends NumericMapping<RangeData> {

    public RangeMapping(String column, RangeData data, byte[] tokenKey) {
        super(column, MappingType.RANGE, data, tokenKey);
    }

    @Override
    protected BitSet startingBelow(double v) {
        BitSet hits = new BitSet(data.size());
        for (int i = 0; i < data.size() && data.start(i) < v; i++) hits.set(i);
        return hits;
    }

    @Override
    protected BitSet startingAtOrBelow(double v) {
        BitSet hits = new BitSet(data.size());
        for (int i = 0; i < data.size() && data.start(i) <= v; i++) hits.set(i);
        return hits;
    }

    @Override
    protected BitSet endingAbove(double v) {
        BitSet hits = new BitSet(data.size());
        for (int rank = 0; rank < data.size(); rank++) {
            int i = data.byEnd(rank);
            if (!(data.end(i) > v)) break;
            hits.set(i);
        }
        return hits;
    }

    @Override
    protected BitSet endingAtOrAbove(double v) {
        BitSet hits = new BitSet(data.size());
        for (int rank = 0; rank < data.size(); rank++) {
            int i = data.byEnd(rank);
            if (!(data.end(i) >= v)) break;
            hits.set(i);
        }
        return hits;
    }

    @Override
    protected BitSet overlapping(double low, double high) {
        BitSet hits = new BitSet(data.size());
        for (int i = 0; i < data.size() && data.start(i) <= high; i++) {
            if (data.end(i) >= low) hits.set(i);
        }
        return hits;
    }
}
