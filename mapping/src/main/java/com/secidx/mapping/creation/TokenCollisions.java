package com.secidx.mapping.creation;

import com.secidx.common.Token;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts tokens shared by several generalizations of one column. A shared
 * token makes the tagged blob match both generalizations, which costs
 * precision but never correctness.
 */
public final class TokenCollisions {

    private TokenCollisions() {}

    /** Number of token occurrences beyond the first, across all generalizations. */
    public static int count(List<List<Token>> tokens) {
        Map<Token, Integer> seen = new HashMap<>();
        int collisions = 0;
        for (List<Token> slot : tokens) {
            for (Token t : slot) {
                if (seen.merge(t, 1, Integer::sum) > 1) collisions++;
            }
        }
        return collisions;
    }

    public static int total(List<List<Token>> tokens) {
        int n = 0;
        for (List<Token> slot : tokens) n += slot.size();
        return n;
    }
}
