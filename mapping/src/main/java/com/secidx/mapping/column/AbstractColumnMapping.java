package com.secidx.mapping.column;

import com.secidx.common.ConfigurationException;
import com.secidx.common.MappingType;
import com.secidx.common.Token;
import com.secidx.crypto.TokenDerivation;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Token resolution shared by every variant. Matching positions are collected
 * into a {@link BitSet}; runtime slots of a result are expanded together.
 */
public abstract class AbstractColumnMapping<D extends ColumnData> implements ColumnMapping {

    protected final String column;
    protected final MappingType type;
    protected final D data;
    private final byte[] tokenKey;

    protected AbstractColumnMapping(String column, MappingType type, D data, byte[] tokenKey) {
        this.column = Objects.requireNonNull(column, "column");
        this.type = Objects.requireNonNull(type, "type");
        this.data = Objects.requireNonNull(data, "data");
        if (data.isRuntime() && tokenKey == null) {
            throw new ConfigurationException("Column " + column + " holds runtime tokens: a token key is required");
        }
        this.tokenKey = tokenKey == null ? null : tokenKey.clone();
    }

    @Override
    public String getColumn() {
        return column;
    }

    @Override
    public MappingType getType() {
        return type;
    }

    public D getData() {
        return data;
    }

    protected final List<Token> tokensOf(int position) {
        TokenSlot slot = data.slot(position);
        if (!slot.isRuntime()) return slot.getTokens();
        return toTokens(TokenDerivation.derive(slot.getSeed(), slot.getCount(), tokenKey, data.getSalt()));
    }

    protected final Set<Token> tokensAt(BitSet positions) {
        return tokensAt(positions.stream().toArray());
    }

    protected final Set<Token> tokensAt(int[] positions) {
        Set<Token> out = new HashSet<>();
        if (!data.isRuntime()) {
            for (int p : positions) out.addAll(data.slot(p).getTokens());
            return out;
        }
        for (List<Token> tokens : derive(positions)) out.addAll(tokens);
        return out;
    }

    protected final Set<Token> allTokens() {
        return tokensAt(IntStream.range(0, data.size()).toArray());
    }

    @Override
    public List<List<Token>> getTokens() {
        int[] all = IntStream.range(0, data.size()).toArray();
        if (!data.isRuntime()) {
            List<List<Token>> out = new ArrayList<>(all.length);
            for (int p : all) out.add(data.slot(p).getTokens());
            return out;
        }
        return derive(all);
    }

    private List<List<Token>> derive(int[] positions) {
        long[] seeds = new long[positions.length];
        int[] counts = new int[positions.length];
        for (int i = 0; i < positions.length; i++) {
            TokenSlot slot = data.slot(positions[i]);
            seeds[i] = slot.getSeed();
            counts[i] = slot.getCount();
        }
        List<long[]> derived = TokenDerivation.deriveAll(seeds, counts, tokenKey, data.getSalt());
        List<List<Token>> out = new ArrayList<>(derived.size());
        for (long[] d : derived) out.add(toTokens(d));
        return out;
    }

    private static List<Token> toTokens(long[] values) {
        List<Token> out = new ArrayList<>(values.length);
        for (long v : values) out.add(Token.of(v));
        return out;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{column=" + column + ", generalizations=" + data.size() + "}";
    }
}
