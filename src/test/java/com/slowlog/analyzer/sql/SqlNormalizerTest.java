package com.slowlog.analyzer.sql;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class SqlNormalizerTest {

    private static String text(String sql) {
        return SqlNormalizer.normalize(sql).getNormalizedText();
    }

    @Test
    public void testSimpleSelect() {
        SqlTemplate template = SqlNormalizer.normalize("SELECT * FROM orders WHERE id = 42");
        assertEquals("SELECT * FROM orders WHERE id = ?", template.getNormalizedText());
        assertEquals(StatementType.SELECT, template.getStatementType());
        assertEquals(Set.of("orders"), template.getTables());
    }

    @Test
    public void testStringLiterals() {
        assertEquals("SELECT * FROM t WHERE name = ? AND x = ?",
                text("SELECT * FROM t WHERE name = 'O\\'Brien' AND x = \"a\"\"b\""));
        assertEquals("SELECT * FROM t WHERE a = ? AND b = ?", text("SELECT * FROM t WHERE a = 'it''s' AND b = ''"));
    }

    @Test
    public void testUnterminatedStringRunsToEnd() {
        assertEquals("SELECT * FROM t WHERE a = ?", text("SELECT * FROM t WHERE a = 'abc"));
    }

    @Test
    public void testNumericLiterals() {
        assertEquals("SELECT ?, ?, ?, ?, ? FROM t", text("SELECT 1.5, -3, 2e10, 0xFF, .5 FROM t"));
        assertEquals("SELECT * FROM t WHERE a = ? AND b > ?", text("SELECT * FROM t WHERE a = 1 AND b > -2"));
        assertEquals("SELECT * FROM t LIMIT ?, ?", text("SELECT * FROM t LIMIT 10, 20"));
    }

    @Test
    public void testBinaryMinusIsKept() {
        assertEquals("SELECT a-? FROM t", text("SELECT a-1 FROM t"));
        assertEquals("UPDATE stock SET qty = qty - ? WHERE sku = ?",
                text("UPDATE stock SET qty = qty - 1 WHERE sku = 'A1'"));
    }

    @Test
    public void testDigitsInsideIdentifiersAreKept() {
        SqlTemplate template = SqlNormalizer.normalize("SELECT col1 FROM table2 WHERE t3.c4 = 5");
        assertEquals("SELECT col1 FROM table2 WHERE t3.c4 = ?", template.getNormalizedText());
        assertEquals(Set.of("table2"), template.getTables());
        assertEquals("SELECT `1col` FROM t", text("SELECT `1col` FROM t"));
    }

    @Test
    public void testInListCollapses() {
        assertEquals("SELECT * FROM t WHERE id IN (?)", text("SELECT * FROM t WHERE id IN (1, 2, 3)"));
        assertEquals("SELECT * FROM t WHERE id IN (?)", text("SELECT * FROM t WHERE id IN ( 'a','b' )"));
        assertEquals("SELECT * FROM t WHERE id IN (?)", text("SELECT * FROM t WHERE id IN (7)"));
    }

    @Test
    public void testMultiRowInsertCollapses() {
        SqlTemplate template = SqlNormalizer
                .normalize("INSERT INTO audit_log (user_id, action) VALUES (1, 'login'), (2, 'logout'), (3,'x')");
        assertEquals("INSERT INTO audit_log (user_id, action) VALUES (?)", template.getNormalizedText());
        assertEquals(StatementType.INSERT, template.getStatementType());
        assertEquals(Set.of("audit_log"), template.getTables());

        assertEquals(text("INSERT INTO t (a) VALUES (1)"), text("INSERT INTO t (a) VALUES (1), (2), (3)"));
    }

    @Test
    public void testCommentsAndWhitespace() {
        assertEquals("SELECT a FROM t WHERE b = ?",
                text("SELECT /* hint */ a FROM t -- trailing\nWHERE b = 1 # mysql comment"));
        assertEquals("SELECT * FROM t", text("  SELECT\n\t*  FROM   t ;  "));
        assertEquals("SELECT a FROM t", text("SELECT a/**/FROM t;;"));
    }

    @Test
    public void testCaseIsPreserved() {
        SqlTemplate template = SqlNormalizer.normalize("select * from Orders where ID = 1");
        assertEquals("select * from Orders where ID = ?", template.getNormalizedText());
        assertEquals(StatementType.SELECT, template.getStatementType());
        assertEquals(Set.of("Orders"), template.getTables());
    }

    @Test
    public void testPlaceholdersAndVariablesAreKept() {
        assertEquals("SELECT * FROM t WHERE a = ?", text("SELECT * FROM t WHERE a = ?"));
        assertEquals("SET @x = ?", text("SET @x = 1"));
        assertEquals("SELECT @@session.sql_mode", text("SELECT @@session.sql_mode"));
    }

    @Test
    public void testClassification() {
        assertEquals(StatementType.SELECT, SqlNormalizer.normalize("(SELECT 1) UNION (SELECT 2)").getStatementType());
        assertEquals(StatementType.REPLACE, SqlNormalizer.normalize("REPLACE INTO t VALUES (1)").getStatementType());
        assertEquals(StatementType.DELETE, SqlNormalizer.normalize("delete from t").getStatementType());
        assertEquals(StatementType.UPDATE, SqlNormalizer.normalize("/* c */ UPDATE t SET a=1").getStatementType());
        assertEquals(StatementType.OTHER, SqlNormalizer.normalize("SHOW TABLES").getStatementType());
        assertEquals(StatementType.OTHER, SqlNormalizer.normalize("CALL proc(1)").getStatementType());
        assertEquals(StatementType.OTHER, SqlNormalizer.normalize("WITH x AS (SELECT 1) SELECT * FROM x")
                .getStatementType());
    }

    @Test
    public void testBlankSql() {
        assertSame(SqlTemplate.EMPTY, SqlNormalizer.normalize(""));
        assertSame(SqlTemplate.EMPTY, SqlNormalizer.normalize("   \n "));
        assertSame(SqlTemplate.EMPTY, SqlNormalizer.normalize(null));
        assertSame(SqlTemplate.EMPTY, SqlNormalizer.normalize("-- only a comment"));
        assertEquals(StatementType.OTHER, SqlTemplate.EMPTY.getStatementType());
        assertTrue(SqlTemplate.EMPTY.getTables().isEmpty());
    }

    @Test
    public void testNormalizationIsIdempotent() {
        List<String> samples = Arrays.asList(
                "SELECT * FROM orders WHERE id = 42",
                "SELECT 1.5, -3, 2e10, 0xFF, .5 FROM t",
                "SELECT a-1, b - -2 FROM t WHERE c IN (1,2) AND d = 'x''y'",
                "INSERT INTO t (a, b) VALUES (1, 'a'), (2, 'b')",
                "UPDATE t SET a = a + 1 WHERE b = \"q\" -- c\n",
                "SELECT /*+ INDEX(t) */ * FROM `db`.`t` WHERE x = ? AND y = 0x1F",
                "SELECT * FROM t WHERE a IN ((1), (2))",
                "SELECT 'unterminated",
                "  select\t*\nfrom t ; ");
        for (String sample : samples) {
            String once = text(sample);
            assertEquals(once, text(once), "not idempotent for: " + sample);
        }
    }

    @Test
    public void testDoubleMinusIsNotTurnedIntoComment() {
        SqlTemplate once = SqlNormalizer.normalize("SELECT a--/*x*/ 2 FROM orders WHERE id = 1");
        assertEquals("SELECT a- - ? FROM orders WHERE id = ?", once.getNormalizedText());
        assertEquals(Set.of("orders"), once.getTables());
        assertEquals(once, SqlNormalizer.normalize(once.getNormalizedText()));

        assertEquals("a?- - -", text("a\"y\"---;"));
        assertEquals("a?- - -", text("a?- - -"));
        assertEquals("SELECT a- -", text("SELECT a--;"));
    }

    @Test
    public void testNormalizationIsIdempotentOnGeneratedInput() {
        String[] fragments = { "SELECT", "FROM", "orders", "a", "x1", "IN", "UPDATE", "(", ")", ",", "-", "+",
                "*", "/", "=", ";", ".", " ", "\n", "'s'", "\"d\"", "1", "2.5", ".5", "0x1F", "?", "@v", "`t`",
                "/*c*/", "-- c\n", "#c\n", "--" };
        Random random = new Random(20240301L);
        for (int i = 0; i < 20000; i++) {
            StringBuilder sql = new StringBuilder();
            int length = 1 + random.nextInt(12);
            for (int j = 0; j < length; j++) {
                sql.append(fragments[random.nextInt(fragments.length)]);
            }
            SqlTemplate once = SqlNormalizer.normalize(sql.toString());
            assertEquals(once, SqlNormalizer.normalize(once.getNormalizedText()), "not idempotent for: " + sql);
        }
    }

    @Test
    public void testSameShapeSameTemplate() {
        assertEquals(SqlNormalizer.normalize("SELECT * FROM t WHERE a = 1 AND b = 'x'"),
                SqlNormalizer.normalize("SELECT  *  FROM t WHERE a = 99 AND b = 'yyy';"));
        assertNotEquals(SqlNormalizer.normalize("SELECT * FROM t WHERE a = 1"),
                SqlNormalizer.normalize("SELECT * FROM u WHERE a = 1"));
    }
}
