package com.secidx.mapping.column;

import com.secidx.common.MappingType;
import com.secidx.common.Token;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Query view over one column: translates a predicate on plaintext values into
 * the set of tokens whose generalization may hold matching rows.
 *
 * <p>Results are supersets, never subsets, of the exact answer. Operators a
 * variant does not define throw
 * {@link com.secidx.common.MappingException} of kind
 * {@code UNSUPPORTED_OPERATION}.
 */
public interface ColumnMapping {

    String getColumn();

    MappingType getType();

    Set<Token> eq(Object value);

    Set<Token> neq(Object value);

    Set<Token> lt(Object value);

    Set<Token> le(Object value);

    Set<Token> gt(Object value);

    Set<Token> ge(Object value);

    Set<Token> between(Object low, Object high);

    default Set<Token> inValues(Collection<?> values) {
        Set<Token> out = new HashSet<>();
        for (Object v : values) out.addAll(eq(v));
        return out;
    }

    /** Generalization strings, in token order. */
    List<String> getGeneralizations();

    /** Tokens per generalization; runtime tokens are derived here. */
    List<List<Token>> getTokens();

    /** Canonical spelling of a generalization string as it appears in {@link #getGeneralizations()}. */
    String canonicalize(String generalization);

    default Map<String, List<Token>> getTokenDictionary() {
        List<String> generalizations = getGeneralizations();
        List<List<Token>> tokens = getTokens();
        Map<String, List<Token>> out = new LinkedHashMap<>();
        for (int i = 0; i < generalizations.size(); i++) {
            out.put(generalizations.get(i), tokens.get(i));
        }
        return out;
    }
}
