package com.secidx.mapping.column;

import com.secidx.common.MappingException;
import com.secidx.common.MappingType;
import com.secidx.common.Token;
import com.secidx.common.Values;

import java.util.BitSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * View shared by the bitmap, roaring and hash-set variants; they differ only
 * in how {@link CategoricalData} indexes categories. Ordering operators are
 * undefined on categories.
 */
public final class CategoricalMapping extends AbstractColumnMapping<CategoricalData> {

    public CategoricalMapping(String column, MappingType type, CategoricalData data, byte[] tokenKey) {
        super(column, type, data, tokenKey);
        if (!type.isCategorical()) {
            throw new IllegalArgumentException(type + " is not a categorical mapping type");
        }
    }

    @Override
    public Set<Token> eq(Object value) {
        int c = data.indexOf(Values.canonical(value));
        if (c < 0) return Set.of();
        return tokensAt(data.members(c));
    }

    /**
     * Everything except the generalization that names {@code value} alone;
     * generalizations also listing other categories may still match.
     */
    @Override
    public Set<Token> neq(Object value) {
        BitSet hits = new BitSet(data.size());
        hits.set(0, data.size());
        int c = data.indexOf(Values.canonical(value));
        if (c >= 0) {
            for (int g : data.members(c)) {
                if (data.generalizationSize(g) == 1) {
                    hits.clear(g);
                    break;
                }
            }
        }
        return tokensAt(hits);
    }

    @Override
    public Set<Token> lt(Object value) {
        throw MappingException.unsupported(column, type, "<");
    }

    @Override
    public Set<Token> le(Object value) {
        throw MappingException.unsupported(column, type, "<=");
    }

    @Override
    public Set<Token> gt(Object value) {
        throw MappingException.unsupported(column, type, ">");
    }

    @Override
    public Set<Token> ge(Object value) {
        throw MappingException.unsupported(column, type, ">=");
    }

    @Override
    public Set<Token> between(Object low, Object high) {
        throw MappingException.unsupported(column, type, "BETWEEN");
    }

    @Override
    public List<String> getGeneralizations() {
        return IntStream.range(0, data.size())
                .parallel()
                .mapToObj(g -> Generalizations.formatSet(IntStream.range(0, data.categoryCount())
                        .filter(c -> data.contains(c, g))
                        .mapToObj(data::category)
                        .toList()))
                .toList();
    }

    @Override
    public String canonicalize(String generalization) {
        return Generalizations.canonicalSet(generalization);
    }
}
