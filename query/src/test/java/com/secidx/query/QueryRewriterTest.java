package com.secidx.query;

import com.secidx.common.MappingException;
import com.secidx.common.SqlParseException;
import com.secidx.common.Token;
import com.secidx.config.IndexConfig;
import com.secidx.config.Representation;
import com.secidx.mapping.HeterogeneousMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class QueryRewriterTest {

    private HeterogeneousMapping mapping;
    private QueryRewriter rewriter;

    @BeforeEach
    void setUp() {
        mapping = Fixtures.mapping();
        rewriter = new QueryRewriter(mapping);
    }

    private String sql(String query) {
        RewriteResult result = rewriter.rewrite(query);
        assertFalse(result.isKeyValue());
        return result.sql();
    }

    private static SortedSet<Token> tokens(long... values) {
        SortedSet<Token> out = new TreeSet<>();
        for (long v : values) out.add(Token.of(v));
        return out;
    }

    // ===================== SQL mode =====================

    @Test
    @DisplayName("range comparison becomes a VALUES semi-join")
    void rangeComparison_isRewritten() {
        RewriteResult result = rewriter.rewrite("SELECT * FROM wrapped WHERE \"AGE\" <= 18");
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE \"AGE\" IN (VALUES (1),(2))", result.sql());
        assertEquals("wrapped", result.table());
        assertTrue(result.labels().isEmpty());
    }

    @Test
    void rewritingTwice_isByteIdentical() {
        String query = "SELECT \"AGE\", \"CITY\" FROM wrapped WHERE \"CITY\" = 'Rome' AND \"AGE\" BETWEEN 5 AND 80";
        assertEquals(sql(query), sql(query));
        assertEquals(sql(query), new QueryRewriter(Fixtures.mapping()).rewrite(query).sql());
    }

    @Test
    void columnOnTheRight_isSwappedAndTheOperatorMirrored() {
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE \"AGE\" IN (VALUES (1),(2))",
                sql("SELECT * FROM wrapped WHERE 18 >= \"AGE\""));
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE \"AGE\" IN (VALUES (3))",
                sql("SELECT * FROM wrapped WHERE 20 < \"AGE\""));
    }

    @Test
    void noMatchingGeneralization_becomesFalse() {
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE FALSE",
                sql("SELECT * FROM wrapped WHERE \"AGE\" = 50"));
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE FALSE AND \"CITY\" IN (VALUES (10))",
                sql("SELECT * FROM wrapped WHERE \"CITY\" = 'Oslo' AND \"CITY\" = 'Milan'"));
    }

    @Test
    void betweenAndIn_dispatchToTheirPredicates() {
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE \"AGE\" IN (VALUES (3))",
                sql("SELECT * FROM wrapped WHERE \"AGE\" BETWEEN 75 AND 79"));
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE \"AGE\" IN (VALUES (1),(3))",
                sql("SELECT * FROM wrapped WHERE \"AGE\" IN (5, 77)"));
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE \"CITY\" IN (VALUES (10),(11),(12))",
                sql("SELECT * FROM wrapped WHERE \"CITY\" IN ('Milan', 'Paris')"));
    }

    @Test
    void groupIdColumn_isRewrittenAgainstGroupId() {
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE \"GroupId\" IN (VALUES (7),(8))",
                sql("SELECT * FROM wrapped WHERE \"ZIP\" < 150"));
    }

    @Test
    void textTokens_areQuotedAndEscaped() {
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE \"STATE\" IN (VALUES ('h''2'))",
                sql("SELECT * FROM wrapped WHERE \"STATE\" = 'NY'"));
    }

    @Test
    void parenthesesAndDisjunctions_arePreservedInSqlMode() {
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE (\"AGE\" IN (VALUES (1),(2)) OR \"CITY\" IN (VALUES (11),(12)))",
                sql("SELECT * FROM wrapped WHERE (\"AGE\" <= 18 OR \"CITY\" = 'Paris')"));
    }

    @Test
    void distinctProjection_andQuotedTable_areHandled() {
        RewriteResult result = rewriter.rewrite("select distinct \"CITY\" from \"wrapped\" where \"AGE\" > 70;");
        assertEquals("select \"EncTuples\" from \"wrapped\" where \"AGE\" IN (VALUES (3));", result.sql());
        assertEquals("wrapped", result.table());
    }

    @Test
    void statementWithoutWhere_onlyRewritesProjection() {
        assertEquals("SELECT \"EncTuples\" FROM wrapped", sql("SELECT \"AGE\" FROM wrapped"));
    }

    @Test
    void tail_isKeptVerbatimOrDropped() {
        String query = "SELECT \"AGE\", \"CITY\" FROM wrapped WHERE \"AGE\" <= 18 ORDER BY \"AGE\" DESC";
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE \"AGE\" IN (VALUES (1),(2)) ORDER BY \"AGE\" DESC",
                sql(query));

        QueryRewriter noTail = new QueryRewriter(mapping, RewriteOptions.defaults().withKeepTail(false));
        assertEquals("SELECT \"EncTuples\" FROM wrapped WHERE \"AGE\" IN (VALUES (1),(2))",
                noTail.rewrite(query).sql());
    }

    @Test
    void customBlobColumn_isUsedInTheProjection() {
        QueryRewriter custom = new QueryRewriter(mapping, RewriteOptions.defaults().withBlobColumn("Blob"));
        assertEquals("SELECT \"Blob\" FROM wrapped", custom.rewrite("SELECT * FROM wrapped").sql());
    }

    // ===================== Representations =====================

    @Test
    void mappingRepresentation_joinsTheMappingTable() {
        QueryRewriter joined = new QueryRewriter(mapping,
                RewriteOptions.defaults().withRepresentation(Representation.MAPPING));
        assertEquals("SELECT \"EncTuples\" FROM wrapped JOIN mapping USING (\"GroupId\") WHERE \"AGE\" IN (VALUES (3))",
                joined.rewrite("SELECT * FROM wrapped WHERE \"AGE\" >= 75").sql());
    }

    @Test
    void normalizedRepresentation_joinsOneTablePerReferencedColumn() {
        QueryRewriter normalized = new QueryRewriter(mapping,
                RewriteOptions.defaults().withRepresentation(Representation.NORMALIZATION));
        String rewritten = normalized.rewrite(
                "SELECT * FROM wrapped WHERE \"AGE\" <= 18 AND \"CITY\" = 'Milan' AND \"AGE\" > 0").sql();
        assertEquals("SELECT \"EncTuples\" FROM wrapped"
                + " JOIN \"GroupIdToColumns\" USING (\"GroupId\")"
                + " JOIN \"AGE\" ON (\"AGEId\" = \"AGE\".\"Id\")"
                + " JOIN \"CITY\" ON (\"CITYId\" = \"CITY\".\"Id\")"
                + " WHERE \"AGE\" IN (VALUES (1),(2)) AND \"CITY\" IN (VALUES (10)) AND \"AGE\" IN (VALUES (1),(2),(3))",
                rewritten);
    }

    @Test
    void optionsFromConfig_followTheRewriteBlock() throws Exception {
        IndexConfig config = IndexConfig.fromJson("{\"columns\":{\"AGE\":{\"type\":\"range\"}},"
                + "\"rewrite\":{\"representation\":\"mapping\",\"keyValueMode\":true,\"blobColumn\":\"B\",\"keepTail\":false}}");
        RewriteOptions options = RewriteOptions.from(config.getRewrite());
        assertEquals(Representation.MAPPING, options.getRepresentation());
        assertTrue(options.isKeyValueMode());
        assertEquals("B", options.getBlobColumn());
        assertFalse(options.isKeepTail());
    }

    // ===================== Key-value mode =====================

    @Test
    @DisplayName("key-value mode intersects comparisons on the same column")
    void keyValueMode_intersectsPerColumn() {
        QueryRewriter kv = new QueryRewriter(mapping, RewriteOptions.defaults().withKeyValueMode(true));
        RewriteResult result = kv.rewrite("SELECT * FROM wrapped WHERE \"AGE\" >= 10 AND \"AGE\" <= 20");

        assertTrue(result.isKeyValue());
        assertNull(result.sql());
        assertEquals("wrapped", result.table());
        assertEquals(Map.of("AGE", tokens(2)), result.labels());
    }

    @Test
    void keyValueMode_keysGroupIdColumnsAndRecordsEmptyResults() {
        QueryRewriter kv = new QueryRewriter(mapping, RewriteOptions.defaults().withKeyValueMode(true));
        RewriteResult result = kv.rewrite(
                "SELECT * FROM wrapped WHERE \"ZIP\" >= 250 AND \"AGE\" = 50 AND \"AGE\" <= 5 ORDER BY \"AGE\"");

        assertEquals(List.of("GroupId", "AGE"), List.copyOf(result.labels().keySet()));
        assertEquals(tokens(9), result.labels().get("GroupId"));
        assertTrue(result.labels().get("AGE").isEmpty());
    }

    @Test
    void keyValueMode_rejectsDisjunctionsAndNegations() {
        QueryRewriter kv = new QueryRewriter(mapping, RewriteOptions.defaults().withKeyValueMode(true));
        MappingException or = assertThrows(MappingException.class,
                () -> kv.rewrite("SELECT * FROM wrapped WHERE \"AGE\" = 5 OR \"AGE\" = 77"));
        assertEquals(MappingException.Kind.NON_CONJUNCTIVE, or.getKind());
        MappingException not = assertThrows(MappingException.class,
                () -> kv.rewrite("SELECT * FROM wrapped WHERE NOT \"AGE\" = 5"));
        assertEquals(MappingException.Kind.NON_CONJUNCTIVE, not.getKind());
    }

    // ===================== Failures =====================

    @Test
    void categoricalRange_isUnsupported() {
        MappingException e = assertThrows(MappingException.class,
                () -> rewriter.rewrite("SELECT * FROM wrapped WHERE \"CITY\" BETWEEN 'A' AND 'M'"));
        assertEquals(MappingException.Kind.UNSUPPORTED_OPERATION, e.getKind());
        assertEquals("CITY", e.getColumn());
    }

    @Test
    void columnToColumnComparison_isRejected() {
        MappingException e = assertThrows(MappingException.class,
                () -> rewriter.rewrite("SELECT * FROM wrapped WHERE \"AGE\" = \"ZIP\""));
        assertEquals(MappingException.Kind.COLUMN_COMPARISON, e.getKind());

        MappingException literals = assertThrows(MappingException.class,
                () -> rewriter.rewrite("SELECT * FROM wrapped WHERE 1 = 1"));
        assertEquals(MappingException.Kind.COLUMN_COMPARISON, literals.getKind());
    }

    @Test
    void nonNumericValueAgainstRange_isInvalidInput() {
        MappingException e = assertThrows(MappingException.class,
                () -> rewriter.rewrite("SELECT * FROM wrapped WHERE \"AGE\" < 'old'"));
        assertEquals(MappingException.Kind.INVALID_INPUT, e.getKind());
    }

    @Test
    void likeAndIs_areNotComparisonOperators() {
        MappingException like = assertThrows(MappingException.class,
                () -> rewriter.rewrite("SELECT * FROM wrapped WHERE \"CITY\" LIKE 'R%'"));
        assertEquals("LIKE is not supported as a comparison operator.", like.getMessage());
        MappingException is = assertThrows(MappingException.class,
                () -> rewriter.rewrite("SELECT * FROM wrapped WHERE \"CITY\" IS NOT NULL"));
        assertEquals(MappingException.Kind.UNSUPPORTED_OPERATION, is.getKind());
    }

    @Test
    void negatedComparisons_areRejected() {
        MappingException e = assertThrows(MappingException.class,
                () -> rewriter.rewrite("SELECT * FROM wrapped WHERE \"AGE\" NOT IN (5, 6)"));
        assertEquals(MappingException.Kind.UNSUPPORTED_OPERATION, e.getKind());
        assertThrows(MappingException.class,
                () -> rewriter.rewrite("SELECT * FROM wrapped WHERE NOT (\"AGE\" <= 18 AND \"CITY\" = 'Rome')"));
    }

    @Test
    void unknownAndUnmappedColumns_areReported() {
        MappingException unmapped = assertThrows(MappingException.class,
                () -> rewriter.rewrite("SELECT * FROM wrapped WHERE \"NAME\" = 'Bob'"));
        assertEquals(MappingException.Kind.UNKNOWN_COLUMN, unmapped.getKind());
        assertEquals("NAME", unmapped.getColumn());
    }

    @Test
    void parseErrors_propagateUnchanged() {
        assertThrows(SqlParseException.class, () -> rewriter.rewrite("DELETE FROM wrapped"));
    }
}
