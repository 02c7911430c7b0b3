package me.golemcore.flow.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlStatementInspectorTest {

    @Test
    void shouldExtractQualifiedAndJoinedTables() {
        assertEquals(Set.of("users", "orders"),
                SqlStatementInspector.referencedTables(
                        "select * from \"public\".\"Users\" u join orders o on o.uid = u.id"));
        assertEquals(Set.of("audit"), SqlStatementInspector.referencedTables("INSERT INTO audit VALUES (1)"));
    }

    @Test
    void shouldExtractEveryItemOfCommaSeparatedFromList() {
        assertEquals(Set.of("customers", "secrets"),
                SqlStatementInspector.referencedTables("SELECT s.token FROM customers c, secrets s"));
        assertEquals(Set.of("orders", "customers", "secrets"),
                SqlStatementInspector.referencedTables(
                        "SELECT * FROM orders o JOIN customers c ON c.id = o.cid, secrets s"));
    }

    @Test
    void shouldExtractTablesFromParenthesizedJoinsAndSubqueries() {
        assertEquals(Set.of("secrets", "customers"),
                SqlStatementInspector.referencedTables("SELECT * FROM (secrets CROSS JOIN customers)"));
        assertEquals(Set.of("customers", "secrets"),
                SqlStatementInspector.referencedTables(
                        "SELECT * FROM customers WHERE id IN (SELECT id FROM secrets)"));
    }

    @Test
    void shouldExtractDeleteUsingList() {
        assertEquals(Set.of("orders", "customers", "secrets"),
                SqlStatementInspector.referencedTables(
                        "DELETE FROM orders USING customers c, secrets s WHERE c.id = orders.cid"));
    }

    @Test
    void shouldIgnoreJoinColumnsAndFunctionArguments() {
        assertEquals(Set.of("orders", "customers"),
                SqlStatementInspector.referencedTables("SELECT * FROM orders JOIN customers USING (id)"));
        assertEquals(Set.of("orders"),
                SqlStatementInspector.referencedTables("SELECT EXTRACT(YEAR FROM created_at) FROM orders"));
    }

    @Test
    void shouldSkipLiteralsAndComments() {
        assertEquals(Set.of("customers"),
                SqlStatementInspector.referencedTables("SELECT 'from secrets' FROM customers -- , secrets"));
    }

    @Test
    void shouldSeeTablesAfterEscapedAndDollarQuotedStrings() {
        assertEquals(Set.of("customers", "secrets"),
                SqlStatementInspector.referencedTables("SELECT * FROM customers WHERE name = E'it\\'s' "
                        + "OR id IN (SELECT id FROM secrets) OR name = 'x'"));
        assertEquals(Set.of("customers", "secrets"),
                SqlStatementInspector.referencedTables(
                        "SELECT $$ ' $$ AS quote, id FROM customers, secrets WHERE name <> 'x'"));
    }

    @Test
    void shouldLeaveOutCommonTableNames() {
        assertEquals(Set.of("customers"),
                SqlStatementInspector.referencedTables(
                        "WITH recent AS (SELECT * FROM customers) SELECT * FROM recent"));
        assertEquals(Set.of("nodes"),
                SqlStatementInspector.referencedTables("WITH RECURSIVE tree AS (SELECT id FROM nodes "
                        + "UNION ALL SELECT n.id FROM nodes n JOIN tree t ON n.parent = t.id) SELECT * FROM tree"));
    }

    @Test
    void shouldReportTableReadInsideCommonTableOfSameName() {
        assertEquals(Set.of("secrets"),
                SqlStatementInspector.referencedTables(
                        "WITH secrets AS (SELECT * FROM secrets) SELECT * FROM secrets"));
        assertEquals(Set.of("b", "customers"),
                SqlStatementInspector.referencedTables(
                        "WITH a AS (SELECT * FROM b), b AS (SELECT * FROM customers) SELECT * FROM a"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT * FROM customers",
            "select id from customers where name = 'delete'",
            "SELECT name AS \"update\" FROM customers",
            "WITH r AS (SELECT id FROM customers) SELECT * FROM r"
    })
    void shouldAcceptPlainQueriesAsReadOnly(String sql) {
        assertTrue(SqlStatementInspector.isReadOnly(sql));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "UPDATE customers SET name = 'x'",
            "WITH d AS (DELETE FROM customers RETURNING *) SELECT * FROM d",
            "WITH i AS (INSERT INTO audit VALUES (1) RETURNING id) SELECT * FROM i",
            "SELECT * INTO customers_copy FROM customers",
            "SELECT * FROM customers FOR UPDATE"
    })
    void shouldRejectWritingStatementsAsReadOnly(String sql) {
        assertFalse(SqlStatementInspector.isReadOnly(sql));
    }

    @Test
    void shouldReturnRowsForQueriesOnly() {
        assertTrue(SqlStatementInspector.returnsRows("  with r as (select 1) select * from r"));
        assertFalse(SqlStatementInspector.returnsRows("DELETE FROM customers"));
    }
}
