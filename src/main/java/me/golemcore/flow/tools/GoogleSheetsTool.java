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
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.infrastructure.http.FeignClientFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Google Sheets tool ({@code google_sheets}) on the Sheets REST v4 API.
 *
 * <p>
 * Operations: {@code read}, {@code append}, {@code update}. Only operations in
 * {@code allowedOperations} (default {@code read}) can run. The OAuth access
 * token comes from settings or from the node's {@code google} credential.
 */
@Slf4j
public class GoogleSheetsTool implements AgentTool {

    static final String NAME = "google_sheets";

    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_RANGE = "range";
    private static final String PARAM_VALUES = "values";
    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";
    private static final List<String> ALL_OPERATIONS = List.of("read", "append", "update");

    private final Settings settings;
    private final ToolContext context;
    private final SheetsApi api;
    private final List<String> allowedOperations;

    public GoogleSheetsTool(Settings settings, ToolContext context, FeignClientFactory feignClientFactory,
            String baseUrl, int defaultTimeoutSeconds) {
        this.settings = settings;
        this.context = context;
        this.allowedOperations = settings.getAllowedOperations() != null && !settings.getAllowedOperations().isEmpty()
                ? settings.getAllowedOperations().stream().map(op -> op.toLowerCase(Locale.ROOT)).toList()
                : List.of("read");
        int timeout = settings.getTimeout() != null && settings.getTimeout() > 0
                ? settings.getTimeout()
                : defaultTimeoutSeconds;
        this.api = feignClientFactory.create(SheetsApi.class, baseUrl, timeout);
    }

    @Override
    public ToolDefinition getDefinition() {
        String description = settings.getDescription() != null && !settings.getDescription().isBlank()
                ? settings.getDescription()
                : "Read and write data in Google Sheets. Allowed operations: "
                        + String.join(", ", allowedOperations) + ".";
        return ToolDefinition.builder()
                .name(NAME)
                .description(description)
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_OPERATION, Map.of(
                                        TYPE, "string",
                                        "enum", ALL_OPERATIONS,
                                        DESCRIPTION, "Operation to perform"),
                                PARAM_RANGE, Map.of(
                                        TYPE, "string",
                                        DESCRIPTION, "A1 notation range, e.g. Sheet1!A1:D10"),
                                PARAM_VALUES, Map.of(
                                        TYPE, "array",
                                        DESCRIPTION, "Rows to write (array of arrays) for append or update",
                                        "items", Map.of(TYPE, "array"))),
                        "required", List.of(PARAM_OPERATION, PARAM_RANGE)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        return CompletableFuture.supplyAsync(() -> {
            String operation = arguments.get(PARAM_OPERATION) instanceof String op
                    ? op.toLowerCase(Locale.ROOT)
                    : "read";
            if (!ALL_OPERATIONS.contains(operation)) {
                throw new ToolExecutionException("Unknown operation: " + operation);
            }
            if (!allowedOperations.contains(operation)) {
                throw new ToolExecutionException("Operation '" + operation + "' is not allowed. Allowed: "
                        + String.join(", ", allowedOperations));
            }
            if (!(arguments.get(PARAM_RANGE) instanceof String range) || range.isBlank()) {
                throw new ToolExecutionException("Missing required parameter: range");
            }
            String spreadsheetId = settings.getSpreadsheetId();
            if (spreadsheetId == null || spreadsheetId.isBlank()) {
                throw new ToolExecutionException("No spreadsheetId configured for " + NAME);
            }
            String token = accessToken();

            log.info("[Tool:{}] {} {}", NAME, operation, range);
            try {
                Map<String, Object> response = switch (operation) {
                case "read" -> api.read(token, spreadsheetId, range);
                case "append" -> api.append(token, spreadsheetId, range, valueRange(range, arguments));
                default -> api.update(token, spreadsheetId, range, valueRange(range, arguments));
                };
                return ToolResult.success(operation + " " + range, response != null ? response : Map.of());
            } catch (FeignException e) {
                log.warn("[Tool:{}] Sheets API error (status {})", NAME, e.status());
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("error", "Google Sheets API error: HTTP " + e.status());
                error.put("status", e.status());
                error.put("body", e.contentUTF8());
                return ToolResult.failure("Google Sheets API error: HTTP " + e.status(), error);
            }
        });
    }

    private String accessToken() {
        if (settings.getAccessToken() != null && !settings.getAccessToken().isBlank()) {
            return settings.getAccessToken();
        }
        return context.credential("google")
                .orElseThrow(() -> new ToolExecutionException("No Google access token configured for " + NAME));
    }

    private static Map<String, Object> valueRange(String range, Map<String, Object> arguments) {
        if (!(arguments.get(PARAM_VALUES) instanceof List<?> values) || values.isEmpty()) {
            throw new ToolExecutionException("Missing required parameter: values");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("range", range);
        body.put("majorDimension", "ROWS");
        body.put("values", values);
        return body;
    }

    interface SheetsApi {

        @RequestLine("GET /v4/spreadsheets/{spreadsheetId}/values/{range}")
        @Headers("Authorization: Bearer {token}")
        Map<String, Object> read(@Param("token") String token,
                @Param("spreadsheetId") String spreadsheetId,
                @Param("range") String range);

        @RequestLine("POST /v4/spreadsheets/{spreadsheetId}/values/{range}:append?valueInputOption=USER_ENTERED")
        @Headers({ "Authorization: Bearer {token}", "Content-Type: application/json" })
        Map<String, Object> append(@Param("token") String token,
                @Param("spreadsheetId") String spreadsheetId,
                @Param("range") String range,
                Map<String, Object> body);

        @RequestLine("PUT /v4/spreadsheets/{spreadsheetId}/values/{range}?valueInputOption=USER_ENTERED")
        @Headers({ "Authorization: Bearer {token}", "Content-Type: application/json" })
        Map<String, Object> update(@Param("token") String token,
                @Param("spreadsheetId") String spreadsheetId,
                @Param("range") String range,
                Map<String, Object> body);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Settings {
        private String description;
        private String spreadsheetId;
        private String accessToken;
        private List<String> allowedOperations;
        private Integer timeout;
    }
}
