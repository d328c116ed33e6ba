package com.slowlog.analyzer.sql;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;

import org.junit.jupiter.api.Test;

public class TableExtractorTest {

    @Test
    public void testJoinsWithAliases() {
        assertEquals(Set.of("orders", "customers", "items"), TableExtractor.extract(
                "SELECT * FROM orders o JOIN customers AS c ON o.cid = c.id LEFT JOIN items i USING (id)"));
    }

    @Test
    public void testCommaListAfterFrom() {
        assertEquals(Set.of("a", "b", "c"), TableExtractor.extract("SELECT * FROM a, b AS bb, `c` WHERE a.x = 1"));
    }

    @Test
    public void testQualifiedNamesReduceToTable() {
        assertEquals(Set.of("orders", "users"),
                TableExtractor.extract("SELECT * FROM shop.orders JOIN `db`.`users` ON 1 = 1"));
    }

    @Test
    public void testUpdateWithModifierAndList() {
        assertEquals(Set.of("a", "b"), TableExtractor.extract("UPDATE LOW_PRIORITY a, b SET a.x = b.y"));
    }

    @Test
    public void testInsertIgnoreWithDuplicateKeyUpdate() {
        assertEquals(Set.of("t"),
                TableExtractor.extract("INSERT IGNORE INTO t (a) VALUES (1) ON DUPLICATE KEY UPDATE a = 1"));
    }

    @Test
    public void testSelectForUpdate() {
        assertEquals(Set.of("t"), TableExtractor.extract("SELECT * FROM t WHERE id = 1 FOR UPDATE"));
    }

    @Test
    public void testSubqueries() {
        assertEquals(Set.of("inner_t", "outer_t"),
                TableExtractor.extract("SELECT * FROM (SELECT id FROM inner_t) x JOIN outer_t ON 1 = 1"));
        assertEquals(Set.of("t", "u"), TableExtractor.extract("SELECT * FROM t WHERE x IN (SELECT y FROM u)"));
    }

    @Test
    public void testDeleteForms() {
        assertEquals(Set.of("t"), TableExtractor.extract("DELETE FROM t WHERE a = 1"));
        assertEquals(Set.of("t1", "t2"), TableExtractor.extract("DELETE t1 FROM t1 JOIN t2 ON t1.id = t2.id"));
    }

    @Test
    public void testDualAndReservedWordsExcluded() {
        assertTrue(TableExtractor.extract("SELECT 1 FROM DUAL").isEmpty());
        assertTrue(TableExtractor.extract("SELECT NOW()").isEmpty());
        assertEquals(Set.of("order"), TableExtractor.extract("SELECT * FROM `order`"));
    }

    @Test
    public void testFromInsideFunctionsIgnored() {
        assertEquals(Set.of("events"), TableExtractor.extract("SELECT EXTRACT(YEAR FROM created) FROM events"));
        assertEquals(Set.of("people"), TableExtractor.extract("SELECT TRIM(LEADING 'x' FROM name) FROM people"));
        assertEquals(Set.of("docs"),
                TableExtractor.extract("SELECT SUBSTRING(body FROM 2 FOR 3), POSITION('a' IN body) FROM docs"));
    }

    @Test
    public void testReplaceInto() {
        assertEquals(Set.of("cache"), TableExtractor.extract("REPLACE INTO cache (k, v) VALUES ('a', 'b')"));
    }
}
