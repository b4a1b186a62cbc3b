package com.secidx.mapping.column;

import com.secidx.common.Token;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Tokens of one generalization: either an explicit token list, or a runtime
 * {@code (seed, count)} pair expanded on demand by
 * {@link com.secidx.crypto.TokenDerivation}.
 */
public final class TokenSlot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Token[] tokens;   // null for runtime slots
    private final long seed;
    private final int count;

    private TokenSlot(Token[] tokens, long seed, int count) {
        this.tokens = tokens;
        this.seed = seed;
        this.count = count;
    }

    public static TokenSlot of(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty()) throw new IllegalArgumentException("A generalization needs at least one token");
        return new TokenSlot(tokens.toArray(new Token[0]), 0L, tokens.size());
    }

    public static TokenSlot of(Token token) {
        return new TokenSlot(new Token[]{Objects.requireNonNull(token, "token")}, 0L, 1);
    }

    public static TokenSlot runtime(long seed, int count) {
        if (seed < 0) throw new IllegalArgumentException("seed must be >= 0");
        if (count < 1) throw new IllegalArgumentException("count must be >= 1");
        return new TokenSlot(null, seed, count);
    }

    public boolean isRuntime() {
        return tokens == null;
    }

    /** Stored tokens; only for non-runtime slots. */
    public List<Token> getTokens() {
        if (tokens == null) throw new IllegalStateException("Runtime slot has no stored tokens");
        return List.of(tokens);
    }

    public long getSeed() {
        return seed;
    }

    /** Number of tokens the slot stands for. */
    public int getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenSlot that)) return false;
        return seed == that.seed && count == that.count && Arrays.equals(tokens, that.tokens);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(tokens) + Long.hashCode(seed) * 17 + count;
    }

    @Override
    public String toString() {
        return isRuntime() ? "runtime(" + seed + "," + count + ")" : Arrays.toString(tokens);
    }
}
