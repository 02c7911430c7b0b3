package me.golemcore.flow.tools;

import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseQueryToolTest {

    private static final String URL = "jdbc:h2:mem:database_query_tool;DB_CLOSE_DELAY=-1";

    @BeforeAll
    static void createSchema() {
        JdbcTemplate jdbc = new JdbcTemplate(new DriverManagerDataSource(URL, "sa", ""));
        jdbc.execute("CREATE TABLE IF NOT EXISTS customers (id INT PRIMARY KEY, name VARCHAR(64))");
        jdbc.execute("CREATE TABLE IF NOT EXISTS secrets (id INT PRIMARY KEY, token VARCHAR(64))");
        jdbc.execute("MERGE INTO customers KEY (id) VALUES (1, 'Ada'), (2, 'Linus'), (3, 'Grace')");
    }

    @Test
    void shouldReturnRowsForSelect() throws Exception {
        ToolResult result = tool(settings()).execute(Map.of("query", "SELECT id, name FROM customers ORDER BY id;"))
                .get();

        assertTrue(result.isSuccess());
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals(3, data.get("rowCount"));
        List<?> rows = (List<?>) data.get("rows");
        assertEquals("Ada", ((Map<?, ?>) rows.get(0)).get("name"));
    }

    @Test
    void shouldBindParametersAndCapRows() throws Exception {
        DatabaseQueryTool.Settings settings = settings();
        settings.setMaxRows(1);

        ToolResult result = tool(settings)
                .execute(Map.of("query", "SELECT name FROM customers WHERE id >= ? ORDER BY id", "params", List.of(2)))
                .get();

        assertEquals(1, ((Map<?, ?>) result.getData()).get("rowCount"));
    }

    @Test
    void shouldRejectWritesInReadOnlyMode() {
        DatabaseQueryTool tool = tool(settings());

        ToolExecutionException error = assertThrows(ToolExecutionException.class,
                () -> tool.validate("DELETE FROM customers"));

        assertTrue(error.getMessage().contains("read-only"));
    }

    @Test
    void shouldRejectChainedStatements() {
        DatabaseQueryTool tool = tool(settings());

        assertThrows(ToolExecutionException.class,
                () -> tool.validate("SELECT 1; DROP TABLE customers"));
    }

    @Test
    void shouldRejectTablesOutsideAllowedList() {
        DatabaseQueryTool.Settings settings = settings();
        settings.setAllowedTables("customers, orders");
        DatabaseQueryTool tool = tool(settings);

        ToolExecutionException error = assertThrows(ToolExecutionException.class,
                () -> tool.validate("SELECT * FROM customers c JOIN secrets s ON s.id = c.id"));

        assertTrue(error.getMessage().contains("secrets"));
        assertEquals("SELECT * FROM public.customers", tool.validate("SELECT * FROM public.customers;"));
    }

    @Test
    void shouldRejectCommaJoinedTableOutsideAllowedList() {
        DatabaseQueryTool.Settings settings = settings();
        settings.setAllowedTables("customers");
        DatabaseQueryTool tool = tool(settings);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> tool.execute(Map.of("query", "SELECT s.token FROM customers c, secrets s")).get());

        assertInstanceOf(ToolExecutionException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("secrets"));
    }

    @Test
    void shouldRejectDataModifyingCommonTableInReadOnlyMode() {
        DatabaseQueryTool tool = tool(settings());

        ToolExecutionException error = assertThrows(ToolExecutionException.class,
                () -> tool.validate("WITH d AS (DELETE FROM customers RETURNING *) SELECT * FROM d"));

        assertTrue(error.getMessage().contains("read-only"));
    }

    @Test
    void shouldAllowCommonTableNamesWhenTablesAreRestricted() throws Exception {
        DatabaseQueryTool.Settings settings = settings();
        settings.setAllowedTables("customers");

        ToolResult result = tool(settings)
                .execute(Map.of("query",
                        "WITH recent AS (SELECT id, name FROM customers WHERE id > 1) "
                                + "SELECT name FROM recent ORDER BY id"))
                .get();

        assertTrue(result.isSuccess());
        assertEquals(2, ((Map<?, ?>) result.getData()).get("rowCount"));
    }

    @Test
    void shouldExecuteWritesWhenNotReadOnly() throws Exception {
        DatabaseQueryTool.Settings settings = settings();
        settings.setReadOnly(false);

        ToolResult result = tool(settings)
                .execute(Map.of("query", "UPDATE customers SET name = 'Grace' WHERE id = 3")).get();

        assertTrue(result.isSuccess());
        assertEquals(Map.of("rowsAffected", 1), result.getData());
    }

    @Test
    void shouldReturnFailureForInvalidSql() throws Exception {
        ToolResult result = tool(settings()).execute(Map.of("query", "SELECT * FROM missing_table")).get();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Query failed: "));
    }

    @Test
    void shouldFallBackToConfiguredConnection() throws Exception {
        FlowProperties.DatabaseToolProperties defaults = new FlowProperties.DatabaseToolProperties();
        defaults.setUrl(URL);
        defaults.setUsername("sa");
        DatabaseQueryTool tool = new DatabaseQueryTool(new DatabaseQueryTool.Settings(), defaults, 5);

        ToolResult result = tool.execute(Map.of("query", "SELECT COUNT(*) AS total FROM customers")).get();

        assertTrue(result.isSuccess());
    }

    @Test
    void shouldFailWithoutConnection() {
        DatabaseQueryTool tool = new DatabaseQueryTool(new DatabaseQueryTool.Settings(),
                new FlowProperties.DatabaseToolProperties(), 5);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> tool.execute(Map.of("query", "SELECT 1")).get());

        assertInstanceOf(ToolExecutionException.class, error.getCause());
    }

    private static DatabaseQueryTool tool(DatabaseQueryTool.Settings settings) {
        return new DatabaseQueryTool(settings, null, 5);
    }

    private static DatabaseQueryTool.Settings settings() {
        DatabaseQueryTool.Settings settings = new DatabaseQueryTool.Settings();
        settings.setConnectionUrl(URL);
        settings.setUsername("sa");
        settings.setPassword("");
        return settings;
    }
}
