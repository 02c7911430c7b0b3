/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.flow.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * SQL tool ({@code database_query}) on Spring's {@link JdbcTemplate}.
 *
 * <p>
 * Every statement is checked before it reaches the database: one statement per
 * call, only plain queries in read-only mode, and every referenced table must
 * be in {@code allowedTables} when that list is set. In read-only mode the
 * statement also runs inside a read-only transaction. Results are capped at
 * {@code maxRows}.
 */
@Slf4j
public class DatabaseQueryTool implements AgentTool {

    static final String NAME = "database_query";

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_PARAMS = "params";
    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";

    private final Settings settings;
    private final FlowProperties.DatabaseToolProperties defaults;
    private final int timeoutSeconds;
    private final Set<String> allowedTables;

    public DatabaseQueryTool(Settings settings, FlowProperties.DatabaseToolProperties defaults,
            int defaultTimeoutSeconds) {
        this.settings = settings;
        this.defaults = defaults;
        this.timeoutSeconds = settings.getTimeout() != null && settings.getTimeout() > 0
                ? settings.getTimeout()
                : defaultTimeoutSeconds;
        this.allowedTables = parseTables(settings.getAllowedTables());
    }

    @Override
    public ToolDefinition getDefinition() {
        String description = settings.getDescription() != null && !settings.getDescription().isBlank()
                ? settings.getDescription()
                : "Execute SQL queries on the PostgreSQL database. Use for data retrieval and manipulation.";
        if (settings.isReadOnly()) {
            description += " Read-only: only SELECT queries are accepted.";
        }
        if (!allowedTables.isEmpty()) {
            description += " Allowed tables: " + String.join(", ", allowedTables) + ".";
        }
        return ToolDefinition.builder()
                .name(NAME)
                .description(description)
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        TYPE, "string",
                                        DESCRIPTION, "SQL query to execute"),
                                PARAM_PARAMS, Map.of(
                                        TYPE, "array",
                                        DESCRIPTION, "Query parameters for prepared statements (? placeholders)",
                                        "items", Map.of(TYPE, "string"))),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = validate(arguments.get(PARAM_QUERY));
            Object[] params = arguments.get(PARAM_PARAMS) instanceof List<?> list ? list.toArray() : new Object[0];

            DataSource dataSource = dataSource();
            JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
            jdbcTemplate.setQueryTimeout(timeoutSeconds);
            jdbcTemplate.setMaxRows(settings.getMaxRows() > 0 ? settings.getMaxRows() : 100);

            try {
                if (!settings.isReadOnly()) {
                    return run(jdbcTemplate, sql, params);
                }
                TransactionTemplate transaction = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
                transaction.setReadOnly(true);
                transaction.setTimeout(timeoutSeconds);
                return transaction.execute(status -> run(jdbcTemplate, sql, params));
            } catch (DataAccessException | TransactionException e) {
                Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
                log.warn("[Tool:{}] Query failed: {}", NAME, cause.getMessage());
                return ToolResult.failure("Query failed: " + cause.getMessage(),
                        Map.of("error", "Query failed: " + cause.getMessage()));
            }
        });
    }

    private ToolResult run(JdbcTemplate jdbcTemplate, String sql, Object[] params) {
        if (SqlStatementInspector.returnsRows(sql)) {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, params);
            log.info("[Tool:{}] Query returned {} rows", NAME, rows.size());
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("rows", rows);
            result.put("rowCount", rows.size());
            return ToolResult.success(rows.size() + " rows", result);
        }
        int affected = jdbcTemplate.update(sql, params);
        log.info("[Tool:{}] Statement affected {} rows", NAME, affected);
        return ToolResult.success(affected + " rows affected", Map.of("rowsAffected", affected));
    }

    /**
     * Applies the statement constraints and returns the SQL without a trailing
     * semicolon.
     */
    String validate(Object rawQuery) {
        if (!(rawQuery instanceof String query) || query.isBlank()) {
            throw new ToolExecutionException("Missing required parameter: query");
        }
        String sql = query.trim();
        while (sql.endsWith(";")) {
            sql = sql.substring(0, sql.length() - 1).trim();
        }
        if (sql.contains(";")) {
            throw new ToolExecutionException("Only a single SQL statement is allowed per call");
        }
        if (settings.isReadOnly() && !SqlStatementInspector.isReadOnly(sql)) {
            throw new ToolExecutionException("Database is in read-only mode. Only SELECT queries are allowed.");
        }
        if (!allowedTables.isEmpty()) {
            Set<String> referenced = SqlStatementInspector.referencedTables(sql);
            List<String> disallowed = referenced.stream()
                    .filter(table -> !allowedTables.contains(table))
                    .toList();
            if (!disallowed.isEmpty()) {
                throw new ToolExecutionException("Query references tables not in allowed list: "
                        + String.join(", ", disallowed) + " (allowed: " + String.join(", ", allowedTables) + ")");
            }
        }
        return sql;
    }

    protected DataSource dataSource() {
        String url = firstNonBlank(settings.getConnectionUrl(), defaults != null ? defaults.getUrl() : null);
        if (url == null) {
            throw new ToolExecutionException("No database connection configured for " + NAME);
        }
        String username = firstNonBlank(settings.getUsername(), defaults != null ? defaults.getUsername() : null);
        String password = firstNonBlank(settings.getPassword(), defaults != null ? defaults.getPassword() : null);
        return new DriverManagerDataSource(url, username, password);
    }

    private static Set<String> parseTables(String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Settings {
        private String description;
        private String connectionUrl;
        private String username;
        private String password;
        private boolean readOnly = true;
        private String allowedTables;
        private int maxRows = 100;
        private Integer timeout;
    }
}
