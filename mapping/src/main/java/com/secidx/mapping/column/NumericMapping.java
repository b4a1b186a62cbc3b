package com.secidx.mapping.column;

import com.secidx.common.MappingException;
import com.secidx.common.MappingType;
import com.secidx.common.Token;
import com.secidx.common.Values;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Set;

/**
 * Common part of the range-based variants: operand parsing, generalization
 * formatting and the operators expressible through the others.
 */
public abstract class NumericMapping<D extends NumericData> extends AbstractColumnMapping<D> {

    protected NumericMapping(String column, MappingType type, D data, byte[] tokenKey) {
        super(column, type, data, tokenKey);
    }

    protected final double numeric(Object value) {
        try {
            return Values.toDouble(value);
        } catch (NumberFormatException e) {
            throw new MappingException(MappingException.Kind.INVALID_INPUT, column,
                    "'" + value + "' is not numeric: " + type.getName()
                            + " mapping on column " + column + " does not support strings", e);
        }
    }

    @Override
    public Set<Token> eq(Object value) {
        double v = numeric(value);
        return tokensAt(overlapping(v, v));
    }

    @Override
    public Set<Token> neq(Object value) {
        double v = numeric(value);
        BitSet hits = startingBelow(v);
        hits.or(endingAbove(v));
        return tokensAt(hits);
    }

    @Override
    public Set<Token> lt(Object value) {
        return tokensAt(startingBelow(numeric(value)));
    }

    @Override
    public Set<Token> le(Object value) {
        return tokensAt(startingAtOrBelow(numeric(value)));
    }

    @Override
    public Set<Token> gt(Object value) {
        return tokensAt(endingAbove(numeric(value)));
    }

    @Override
    public Set<Token> ge(Object value) {
        return tokensAt(endingAtOrAbove(numeric(value)));
    }

    @Override
    public Set<Token> between(Object low, Object high) {
        return tokensAt(overlapping(numeric(low), numeric(high)));
    }

    /** Intervals with {@code start < v}. */
    protected abstract BitSet startingBelow(double v);

    /** Intervals with {@code start <= v}. */
    protected abstract BitSet startingAtOrBelow(double v);

    /** Intervals with {@code end > v}. */
    protected abstract BitSet endingAbove(double v);

    /** Intervals with {@code end >= v}. */
    protected abstract BitSet endingAtOrAbove(double v);

    /** Intervals with {@code start <= high && end >= low}. */
    protected abstract BitSet overlapping(double low, double high);

    @Override
    public List<String> getGeneralizations() {
        List<String> out = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            out.add(Generalizations.formatInterval(data.start(i), data.end(i), data.isRightOpen(i), data.isIntegral()));
        }
        return out;
    }

    @Override
    public String canonicalize(String generalization) {
        Generalizations.Interval iv = Generalizations.parseInterval(generalization);
        return Generalizations.formatInterval(iv.start(), iv.end(), iv.rightOpen(), data.isIntegral());
    }
}
