package com.secidx.query;

import com.secidx.common.MappingType;
import com.secidx.common.Token;
import com.secidx.mapping.ColumnEntry;
import com.secidx.mapping.HeterogeneousMapping;
import com.secidx.mapping.MappingSnapshot;
import com.secidx.mapping.column.RangeData;
import com.secidx.mapping.column.SetData;
import com.secidx.mapping.column.TokenSlot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-built mapping shared by the rewriter tests.
 *
 * <pre>
 *   AGE   range  [0-9] -> 1, [10-19] -> 2, [75-79] -> 3
 *   CITY  set    Milan -> {10}, Paris -> {11,12}, Rome -> {10,12,13}
 *   ZIP   range, group-id tokens  [100-199] -> {7,8}, [200-299] -> {9}
 *   STATE set, text tokens  CA -> h1, NY -> h'2
 * </pre>
 */
final class Fixtures {

    private Fixtures() {}

    static HeterogeneousMapping mapping() {
        byte[] salt = new byte[16];

        RangeData age = new RangeData(new double[]{0, 10, 75}, new double[]{9, 19, 79}, new boolean[3], true,
                new TokenSlot[]{TokenSlot.of(Token.of(1)), TokenSlot.of(Token.of(2)), TokenSlot.of(Token.of(3))},
                false, salt);

        SetData city = new SetData(new String[]{"Milan", "Paris", "Rome"},
                new int[][]{{0}, {1, 2}, {0, 2, 3}}, new int[]{2, 1, 2, 1},
                new TokenSlot[]{TokenSlot.of(Token.of(10)), TokenSlot.of(Token.of(11)),
                        TokenSlot.of(Token.of(12)), TokenSlot.of(Token.of(13))},
                false, salt);

        RangeData zip = new RangeData(new double[]{100, 200}, new double[]{199, 299}, new boolean[2], true,
                new TokenSlot[]{TokenSlot.of(List.of(Token.of(7), Token.of(8))), TokenSlot.of(Token.of(9))},
                false, salt);

        SetData state = new SetData(new String[]{"CA", "NY"}, new int[][]{{0}, {1}}, new int[]{1, 1},
                new TokenSlot[]{TokenSlot.of(Token.of("h1")), TokenSlot.of(Token.of("h'2"))},
                false, salt);

        Map<String, ColumnEntry> columns = new LinkedHashMap<>();
        columns.put("AGE", new ColumnEntry(MappingType.RANGE, age, false));
        columns.put("CITY", new ColumnEntry(MappingType.SET, city, false));
        columns.put("ZIP", new ColumnEntry(MappingType.RANGE, zip, true));
        columns.put("STATE", new ColumnEntry(MappingType.SET, state, false));
        return new HeterogeneousMapping(new MappingSnapshot(List.of("AGE", "CITY", "ZIP", "STATE", "NAME"), columns), null);
    }
}
