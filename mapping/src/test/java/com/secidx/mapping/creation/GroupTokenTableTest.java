package com.secidx.mapping.creation;

import com.secidx.common.AnonymizedTable;
import com.secidx.common.MappingType;
import com.secidx.common.Token;
import com.secidx.config.ColumnConfig;
import com.secidx.config.ColumnConfig.TokenMode;
import com.secidx.config.IndexConfig;
import com.secidx.crypto.KeyUtils;
import com.secidx.mapping.HeterogeneousMapping;
import com.secidx.mapping.SampleTables;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GroupTokenTableTest {

    @Test
    void runtimeTokens_tagEachGroupExactlyOnce() {
        IndexConfig cfg = new IndexConfig()
                .withColumn("AGE", ColumnConfig.of(MappingType.RANGE, TokenMode.RUNTIME))
                .withColumn("CITY", ColumnConfig.of(MappingType.SET, TokenMode.RUNTIME));
        AnonymizedTable table = SampleTables.people();
        HeterogeneousMapping m = new HeterogeneousMappingBuilder(cfg, KeyUtils.generateKey(), new Random(3)).build(table);

        GroupTokenTable tagged = GroupTokenTable.build(m, table, 4);
        assertEquals(5, tagged.size());
        assertEquals(List.of("AGE", "CITY"), tagged.getColumns());

        for (String column : List.of("AGE", "CITY")) {
            List<Token> used = tagged.getRows().stream().map(r -> r.tokens().get(column)).toList();
            Set<Token> expected = m.getTokens(column).stream().flatMap(List::stream).collect(Collectors.toSet());
            assertEquals(used.size(), new HashSet<>(used).size(), column + " token reused");
            assertEquals(expected, new HashSet<>(used));
        }

        Map<String, List<Token>> age = m.getTokenDictionary("AGE");
        for (GroupTokenTable.Row row : tagged.getRows()) {
            if (row.groupId() == 2 || row.groupId() == 3) {
                assertTrue(age.get("[10-19]").contains(row.tokens().get("AGE")));
            }
        }
    }

    @Test
    void staticTokens_areSharedByGroupsWithTheSameGeneralization() throws IOException {
        IndexConfig cfg = new IndexConfig()
                .withColumn("AGE", ColumnConfig.of(MappingType.INTERVAL_TREE, TokenMode.STATIC))
                .withColumn("CITY", ColumnConfig.of(MappingType.BITMAP, TokenMode.GROUP_ID));
        AnonymizedTable table = SampleTables.people();
        HeterogeneousMapping m = new HeterogeneousMappingBuilder(cfg, null).build(table);

        GroupTokenTable tagged = GroupTokenTable.build(m, table, 2);
        assertEquals(List.of("AGE"), tagged.getColumns(), "group id columns need no tagging");

        Map<Long, Token> byGroup = tagged.getRows().stream()
                .collect(Collectors.toMap(GroupTokenTable.Row::groupId, r -> r.tokens().get("AGE")));
        assertEquals(byGroup.get(2L), byGroup.get(3L));
        assertEquals(byGroup.get(4L), byGroup.get(5L));
        assertNotEquals(byGroup.get(1L), byGroup.get(2L));

        StringWriter out = new StringWriter();
        tagged.writeCsv(out);
        String[] lines = out.toString().split("\n");
        assertEquals("GroupId,AGE", lines[0]);
        assertEquals(6, lines.length);
        assertTrue(lines[1].startsWith("1,"));
    }

    @Test
    void generalizationMissingFromTheMapping_fails() {
        IndexConfig cfg = new IndexConfig()
                .withColumn("AGE", ColumnConfig.of(MappingType.RANGE, TokenMode.STATIC))
                .withColumn("CITY", ColumnConfig.of(MappingType.SET, TokenMode.STATIC));
        HeterogeneousMapping m = new HeterogeneousMappingBuilder(cfg, null).build(SampleTables.people());

        AnonymizedTable other = new AnonymizedTable(List.of("GID", "AGE", "CITY"), "GID", List.<String[]>of(
                new String[]{"9", "[20-29]", "Paris"}));
        assertThrows(IllegalStateException.class, () -> GroupTokenTable.build(m, other, 1));
    }
}
