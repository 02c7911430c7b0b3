package me.golemcore.flow.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CustomToolTest {

    private static final String WEBHOOK = "https://hooks.example.com/lookup";

    private OkHttpMockEngine engine;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        objectMapper = new ObjectMapper();
    }

    @Test
    void shouldBuildSchemaFromJsonParameters() {
        CustomTool.Settings settings = settings();
        settings.setParameters("{\"sku\":{\"type\":\"string\",\"description\":\"Product code\",\"required\":true},"
                + "\"limit\":{\"type\":\"integer\"}}");

        ToolDefinition definition = tool(settings).getDefinition();

        assertEquals("lookup_stock", definition.getName());
        assertEquals("Custom tool: lookup_stock", definition.getDescription());
        Map<?, ?> properties = (Map<?, ?>) definition.getInputSchema().get("properties");
        assertEquals(Map.of("type", "string", "description", "Product code"), properties.get("sku"));
        assertEquals(Map.of("type", "integer"), properties.get("limit"));
        assertEquals(List.of("sku"), definition.getInputSchema().get("required"));
    }

    @Test
    void shouldAcknowledgeWithoutWebhook() throws Exception {
        ToolResult result = tool(settings()).execute(Map.of("sku", "A-1")).get();

        assertTrue(result.isSuccess());
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals("Custom tool executed", data.get("message"));
        assertEquals(Map.of("sku", "A-1"), data.get("args"));
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldPostArgumentsToWebhook() throws Exception {
        engine.enqueueJson(200, "{\"inStock\":12}");
        CustomTool.Settings settings = settings();
        settings.setWebhookUrl(WEBHOOK);

        ToolResult result = tool(settings).execute(Map.of("sku", "A-1")).get();

        assertTrue(result.isSuccess());
        assertEquals(Map.of("inStock", 12), result.getData());
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("{\"sku\":\"A-1\"}", request.body());
    }

    @Test
    void shouldWrapNonJsonWebhookReply() throws Exception {
        engine.enqueueText(200, "done", "text/plain");
        CustomTool.Settings settings = settings();
        settings.setWebhookUrl(WEBHOOK);

        ToolResult result = tool(settings).execute(Map.of()).get();

        assertEquals(Map.of("response", "done"), result.getData());
    }

    @Test
    void shouldReportWebhookErrorStatus() throws Exception {
        engine.enqueueJson(500, "{\"error\":\"boom\"}");
        CustomTool.Settings settings = settings();
        settings.setWebhookUrl(WEBHOOK);

        ToolResult result = tool(settings).execute(Map.of()).get();

        assertFalse(result.isSuccess());
        assertEquals("Webhook returned HTTP 500", result.getError());
        assertEquals(500, ((Map<?, ?>) result.getData()).get("status"));
    }

    @Test
    void shouldRequireName() {
        CustomTool.Settings settings = new CustomTool.Settings();

        assertThrows(IllegalArgumentException.class, () -> tool(settings));
    }

    private CustomTool tool(CustomTool.Settings settings) {
        return new CustomTool(settings, engine.client(), objectMapper, 5);
    }

    private static CustomTool.Settings settings() {
        CustomTool.Settings settings = new CustomTool.Settings();
        settings.setName("lookup_stock");
        return settings;
    }
}
