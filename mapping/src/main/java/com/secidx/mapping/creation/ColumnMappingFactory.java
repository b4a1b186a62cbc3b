package com.secidx.mapping.creation;

import com.secidx.common.MappingException;
import com.secidx.common.MappingType;
import com.secidx.config.ColumnConfig;
import com.secidx.config.ColumnConfig.TokenMode;
import com.secidx.crypto.KeyUtils;
import com.secidx.mapping.ColumnEntry;
import com.secidx.mapping.column.BitmapData;
import com.secidx.mapping.column.CategoricalData;
import com.secidx.mapping.column.ColumnData;
import com.secidx.mapping.column.Generalizations;
import com.secidx.mapping.column.Generalizations.Interval;
import com.secidx.mapping.column.IntervalTreeData;
import com.secidx.mapping.column.RangeData;
import com.secidx.mapping.column.RoaringData;
import com.secidx.mapping.column.SetData;
import com.secidx.mapping.column.TokenSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Builds the stored data of one column from its per-group generalizations.
 */
final class ColumnMappingFactory {

    private static final Logger logger = LoggerFactory.getLogger(ColumnMappingFactory.class);

    private final TokenAssigner assigner;

    ColumnMappingFactory(TokenAssigner assigner) {
        this.assigner = Objects.requireNonNull(assigner, "assigner");
    }

    /**
     * @param values   generalization of each group, one entry per group
     * @param groupIds ids of those groups
     */
    ColumnEntry create(String column, ColumnConfig config, List<String> values, List<Long> groupIds) {
        MappingType type = config.getMappingType();
        TokenMode mode = config.getTokenMode();
        byte[] salt = KeyUtils.randomSalt();

        ColumnData data = type.isCategorical()
                ? categorical(column, type, mode, values, groupIds, salt)
                : numeric(column, type, mode, values, groupIds, salt);
        logger.debug("Column {}: {} mapping, {} tokens, {} generalizations",
                column, type.getName(), mode.name().toLowerCase(), data.size());
        return new ColumnEntry(type, data, mode == TokenMode.GROUP_ID);
    }

    // ===================== Numeric (range, interval tree) =====================

    private ColumnData numeric(String column, MappingType type, TokenMode mode,
                               List<String> values, List<Long> groupIds, byte[] salt) {
        List<Interval> parsed = new ArrayList<>(values.size());
        for (String v : values) {
            try {
                parsed.add(Generalizations.parseInterval(v));
            } catch (IllegalArgumentException e) {
                throw new MappingException(MappingException.Kind.INVALID_INPUT, column,
                        "Column " + column + " cannot use a " + type.getName()
                                + " mapping: '" + v + "' is not a number or range", e);
            }
        }
        boolean integral = parsed.stream().allMatch(Interval::isIntegral);

        List<String> canonical = parsed.stream()
                .map(iv -> Generalizations.formatInterval(iv.start(), iv.end(), iv.rightOpen(), integral))
                .toList();
        ColumnProfile profile = ColumnProfile.of(canonical, groupIds);

        List<Interval> distinct = new ArrayList<>(profile.size());
        for (int i = 0; i < profile.size(); i++) {
            distinct.add(Generalizations.parseInterval(profile.generalization(i)));
        }
        int[] order = IntStream.range(0, profile.size())
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> distinct.get(i).start())
                        .thenComparingDouble(i -> distinct.get(i).end()))
                .mapToInt(Integer::intValue)
                .toArray();

        int n = order.length;
        double[] starts = new double[n];
        double[] ends = new double[n];
        boolean[] rightOpen = new boolean[n];
        for (int i = 0; i < n; i++) {
            Interval iv = distinct.get(order[i]);
            starts[i] = iv.start();
            ends[i] = iv.end();
            rightOpen[i] = iv.rightOpen();
        }
        TokenSlot[] slots = assigner.assign(column, mode, profile, order, salt);
        boolean runtime = mode == TokenMode.RUNTIME;
        return type == MappingType.RANGE
                ? new RangeData(starts, ends, rightOpen, integral, slots, runtime, salt)
                : new IntervalTreeData(starts, ends, rightOpen, integral, slots, runtime, salt);
    }

    // ===================== Categorical (bitmap, roaring, set) =====================

    private ColumnData categorical(String column, MappingType type, TokenMode mode,
                                   List<String> values, List<Long> groupIds, byte[] salt) {
        List<String> canonical = values.stream().map(Generalizations::canonicalSet).toList();
        ColumnProfile profile = ColumnProfile.of(canonical, groupIds);
        int n = profile.size();

        List<List<String>> items = new ArrayList<>(n);
        TreeSet<String> all = new TreeSet<>();
        for (int g = 0; g < n; g++) {
            List<String> it = Generalizations.items(profile.generalization(g));
            items.add(it);
            all.addAll(it);
        }
        String[] categories = all.toArray(new String[0]);

        List<List<Integer>> byCategory = new ArrayList<>(categories.length);
        for (int c = 0; c < categories.length; c++) byCategory.add(new ArrayList<>());
        int[] sizes = new int[n];
        for (int g = 0; g < n; g++) {
            sizes[g] = items.get(g).size();
            for (String item : items.get(g)) {
                byCategory.get(Arrays.binarySearch(categories, item)).add(g);
            }
        }
        int[][] members = new int[categories.length][];
        for (int c = 0; c < categories.length; c++) {
            members[c] = byCategory.get(c).stream().mapToInt(Integer::intValue).toArray();
        }

        int[] order = IntStream.range(0, n).toArray();
        TokenSlot[] slots = assigner.assign(column, mode, profile, order, salt);
        boolean runtime = mode == TokenMode.RUNTIME;
        CategoricalData data = switch (type) {
            case BITMAP -> new BitmapData(categories, members, sizes, slots, runtime, salt);
            case ROARING -> new RoaringData(categories, members, sizes, slots, runtime, salt);
            case SET -> new SetData(categories, members, sizes, slots, runtime, salt);
            default -> throw new MappingException(MappingException.Kind.UNKNOWN_MAPPING_TYPE, column,
                    type.getName() + " is not a categorical mapping");
        };
        return data;
    }
}
