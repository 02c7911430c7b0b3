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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-level reading of a single SQL statement, used by
 * {@link DatabaseQueryTool} to decide whether a statement only reads and which
 * tables it touches.
 *
 * <p>
 * String literals (including {@code E'...'} and dollar-quoted bodies) and
 * comments are skipped, so keywords inside them are not seen. When the
 * statement cannot be read precisely, the answer errs on the strict side: an
 * unknown name is reported as a table and a doubtful statement is not treated
 * as read-only.
 */
final class SqlStatementInspector {

    private static final String NAME_PART = "\"(?:[^\"]|\"\")*\"|`[^`]*`|[A-Za-z_][\\w$]*";
    private static final Pattern TOKEN = Pattern.compile(
            "(?<skip>\\$(?<tag>(?:[A-Za-z_]\\w*)?)\\$.*?\\$\\k<tag>\\$"
                    + "|[Ee]'(?:[^'\\\\]|''|\\\\.)*'"
                    + "|'(?:[^']|'')*'"
                    + "|--[^\\n]*"
                    + "|/\\*.*?\\*/)"
                    + "|(?<name>(?:" + NAME_PART + ")(?:\\s*\\.\\s*(?:" + NAME_PART + "))*)"
                    + "|(?<symbol>[(),]|[^\\s(),])",
            Pattern.DOTALL);
    private static final Pattern PLAIN_WORD = Pattern.compile("[A-Za-z_][\\w$]*");

    private static final Set<String> READ_STARTS = Set.of("SELECT", "WITH");
    private static final Set<String> QUERY_STARTS = Set.of(
            "SELECT", "WITH", "VALUES", "TABLE", "INSERT", "UPDATE", "DELETE", "MERGE");
    private static final Set<String> WRITE_KEYWORDS = Set.of(
            "INSERT", "UPDATE", "DELETE", "MERGE", "UPSERT", "REPLACE", "TRUNCATE", "DROP", "ALTER",
            "CREATE", "GRANT", "REVOKE", "COPY", "CALL", "INTO", "LOCK", "VACUUM", "REFRESH");
    private static final Set<String> FROM = Set.of("FROM");
    private static final Set<String> USING = Set.of("USING");
    private static final Set<String> TARGET_KEYWORDS = Set.of("JOIN", "INTO", "UPDATE", "TABLE", "TRUNCATE", "COPY");
    private static final Set<String> NOT_AN_UPDATE_TARGET = Set.of("FOR", "DO", "ON", "KEY");
    private static final Set<String> FROM_LIST_END = Set.of(
            "WHERE", "GROUP", "ORDER", "HAVING", "LIMIT", "OFFSET", "UNION", "INTERSECT", "EXCEPT",
            "RETURNING", "WINDOW", "FETCH", "FOR", "SET", "QUALIFY");
    private static final Set<String> JOIN_WORDS = Set.of(
            "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS", "NATURAL", "OUTER", "ON");
    private static final Set<String> ITEM_MODIFIERS = Set.of("ONLY", "LATERAL", "TABLE", "IF", "NOT", "EXISTS");
    private static final Set<String> WITH = Set.of("WITH");
    private static final Set<String> RECURSIVE = Set.of("RECURSIVE");
    private static final Set<String> AS = Set.of("AS");
    private static final Set<String> MATERIALIZED = Set.of("NOT", "MATERIALIZED");

    private SqlStatementInspector() {
    }

    /**
     * Whether the statement is a plain query: it starts with {@code SELECT} or
     * {@code WITH} and no part of it writes, locks or selects {@code INTO}.
     */
    static boolean isReadOnly(String sql) {
        List<Token> tokens = tokenize(sql);
        if (tokens.isEmpty() || !tokens.get(0).isKeyword(READ_STARTS)) {
            return false;
        }
        return tokens.stream().noneMatch(token -> token.isKeyword(WRITE_KEYWORDS));
    }

    static boolean returnsRows(String sql) {
        List<Token> tokens = tokenize(sql);
        return !tokens.isEmpty() && tokens.get(0).isKeyword(READ_STARTS);
    }

    /**
     * Lower-cased, unqualified names of the tables the statement reads or
     * writes. Names declared by the statement's own {@code WITH} clause are
     * left out wherever they resolve to that clause.
     */
    static Set<String> referencedTables(String sql) {
        List<Token> tokens = tokenize(sql);
        Map<Integer, String> references = new TreeMap<>();
        Deque<Boolean> queryScopes = new ArrayDeque<>();
        queryScopes.push(true);

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is("(")) {
                queryScopes.push(startsQuery(tokens, i + 1));
            } else if (token.is(")")) {
                if (queryScopes.size() > 1) {
                    queryScopes.pop();
                }
            } else if (token.isKeyword(FROM)) {
                // FROM inside EXTRACT(...), SUBSTRING(...) and the like is not a table list
                if (Boolean.TRUE.equals(queryScopes.peek())) {
                    collectFromList(tokens, i + 1, references);
                }
            } else if (token.isKeyword(USING)) {
                if (i + 1 < tokens.size() && !tokens.get(i + 1).is("(")) {
                    collectTarget(tokens, i + 1, references);
                }
            } else if (token.isKeyword(TARGET_KEYWORDS) && !isUpdateClause(tokens, i)) {
                collectTarget(tokens, i + 1, references);
            }
        }

        CommonTables commonTables = commonTables(tokens);
        Set<String> tables = new LinkedHashSet<>();
        references.forEach((index, table) -> {
            if (!commonTables.resolves(table, index)) {
                tables.add(table);
            }
        });
        return tables;
    }

    private static void collectFromList(List<Token> tokens, int start, Map<Integer, String> references) {
        int depth = 0;
        boolean expectItem = true;
        for (int i = start; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is("(")) {
                if (depth == 0 && expectItem && !startsQuery(tokens, i + 1)) {
                    collectFromList(tokens, i + 1, references);
                }
                expectItem = false;
                depth++;
                continue;
            }
            if (token.is(")")) {
                if (depth == 0) {
                    return;
                }
                depth--;
                continue;
            }
            if (depth > 0) {
                continue;
            }
            if (token.is(",")) {
                expectItem = true;
            } else if (token.isKeyword(FROM_LIST_END)) {
                return;
            } else if (token.isKeyword(USING)) {
                expectItem = i + 1 < tokens.size() && !tokens.get(i + 1).is("(");
            } else if (token.isKeyword(JOIN_WORDS)) {
                expectItem = false;
            } else if (expectItem && !token.isKeyword(ITEM_MODIFIERS)) {
                if (token.name()) {
                    references.put(i, token.tableName());
                }
                expectItem = false;
            }
        }
    }

    private static void collectTarget(List<Token> tokens, int start, Map<Integer, String> references) {
        int i = start;
        while (i < tokens.size() && tokens.get(i).isKeyword(ITEM_MODIFIERS)) {
            i++;
        }
        if (i >= tokens.size()) {
            return;
        }
        Token token = tokens.get(i);
        if (token.is("(")) {
            if (!startsQuery(tokens, i + 1)) {
                collectFromList(tokens, i + 1, references);
            }
        } else if (token.name()) {
            references.put(i, token.tableName());
        }
    }

    private static boolean isUpdateClause(List<Token> tokens, int index) {
        return "UPDATE".equalsIgnoreCase(tokens.get(index).text())
                && index > 0
                && tokens.get(index - 1).isKeyword(NOT_AN_UPDATE_TARGET);
    }

    private static boolean startsQuery(List<Token> tokens, int index) {
        return index < tokens.size() && tokens.get(index).isKeyword(QUERY_STARTS);
    }

    /**
     * Reads the leading {@code WITH} clause. Parsing stops at the first element
     * it does not understand, so later names stay reported as tables.
     */
    private static CommonTables commonTables(List<Token> tokens) {
        List<CommonTable> tables = new ArrayList<>();
        if (tokens.isEmpty() || !tokens.get(0).isKeyword(WITH)) {
            return new CommonTables(tables, false);
        }
        int i = 1;
        boolean recursive = i < tokens.size() && tokens.get(i).isKeyword(RECURSIVE);
        if (recursive) {
            i++;
        }
        while (i < tokens.size() && tokens.get(i).name()) {
            String name = tokens.get(i).tableName();
            i++;
            if (i < tokens.size() && tokens.get(i).is("(")) {
                int columnsEnd = matchingClose(tokens, i);
                if (columnsEnd < 0) {
                    break;
                }
                i = columnsEnd + 1;
            }
            if (i >= tokens.size() || !tokens.get(i).isKeyword(AS)) {
                break;
            }
            i++;
            while (i < tokens.size() && tokens.get(i).isKeyword(MATERIALIZED)) {
                i++;
            }
            if (i >= tokens.size() || !tokens.get(i).is("(")) {
                break;
            }
            int bodyEnd = matchingClose(tokens, i);
            if (bodyEnd < 0) {
                break;
            }
            tables.add(new CommonTable(name, bodyEnd));
            i = bodyEnd + 1;
            if (i >= tokens.size() || !tokens.get(i).is(",")) {
                break;
            }
            i++;
        }
        return new CommonTables(tables, recursive);
    }

    private static int matchingClose(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            if (tokens.get(i).is("(")) {
                depth++;
            } else if (tokens.get(i).is(")")) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    static List<Token> tokenize(String sql) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(sql);
        while (matcher.find()) {
            if (matcher.group("name") != null) {
                tokens.add(new Token(matcher.group("name"), true));
            } else if (matcher.group("symbol") != null) {
                tokens.add(new Token(matcher.group("symbol"), false));
            }
        }
        return tokens;
    }

    record Token(String text, boolean name) {

        boolean is(String symbol) {
            return !name && text.equals(symbol);
        }

        boolean isKeyword(Set<String> keywords) {
            return name && PLAIN_WORD.matcher(text).matches() && keywords.contains(text.toUpperCase(Locale.ROOT));
        }

        String tableName() {
            String unquoted = text.replaceAll("\\s*\\.\\s*", ".").replace("\"", "").replace("`", "")
                    .toLowerCase(Locale.ROOT);
            int dot = unquoted.lastIndexOf('.');
            return dot >= 0 ? unquoted.substring(dot + 1) : unquoted;
        }
    }

    private record CommonTable(String name, int bodyEnd) {
    }

    private record CommonTables(List<CommonTable> tables, boolean recursive) {

        /**
         * A plain {@code WITH} name is visible only after its own body; under
         * {@code WITH RECURSIVE} it is visible everywhere in the statement.
         */
        boolean resolves(String table, int index) {
            return tables.stream()
                    .anyMatch(common -> common.name().equals(table) && (recursive || index > common.bodyEnd()));
        }
    }
}
