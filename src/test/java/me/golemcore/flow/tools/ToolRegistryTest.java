package me.golemcore.flow.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.flow.domain.model.LlmRequest;
import me.golemcore.flow.domain.model.LlmResponse;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.infrastructure.http.FeignClientFactory;
import me.golemcore.flow.port.outbound.LlmPort;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolRegistryTest {

    private LlmPort llmPort;
    private FlowProperties properties;
    private ToolRegistry registry;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        properties = new FlowProperties();
        ObjectMapper objectMapper = new ObjectMapper();
        OkHttpClient httpClient = new OkHttpClient();
        registry = new ToolRegistry(httpClient, new FeignClientFactory(httpClient, objectMapper), objectMapper,
                llmPort, properties);
        context = ToolContext.builder().workflowId("wf").nodeId("agent-1").build();
    }

    @Test
    void shouldBuildOneToolPerRecognizedType() {
        List<AgentTool> tools = registry.build(List.of(
                config("httpRequestTool", Map.of()),
                config("postgresTool", Map.of("connectionUrl", "jdbc:h2:mem:x")),
                config("googleSheetsTool", Map.of("spreadsheetId", "s")),
                config("slackTool", Map.of()),
                config("emailTool", Map.of()),
                config("openaiTool", Map.of()),
                config("anthropicChatModel", Map.of()),
                config("customTool", Map.of("name", "lookup"))), context);

        assertEquals(List.of("http_request", "database_query", "google_sheets", "slack_message", "send_email",
                "openai_generate", "anthropic_generate", "lookup"), names(tools));
    }

    @Test
    void shouldSkipUnknownTypesAndInvalidSettings() {
        List<AgentTool> tools = registry.build(List.of(
                config("weatherTool", Map.of()),
                config("customTool", Map.of()),
                config("httpRequestTool", Map.of("defaultHeaders", "{broken")),
                config("slackTool", Map.of())), context);

        assertEquals(List.of("slack_message"), names(tools));
    }

    @Test
    void shouldKeepFirstToolWhenNamesCollide() {
        List<AgentTool> tools = registry.build(List.of(
                config("httpRequestTool", Map.of("description", "first")),
                config("httpRequestTool", Map.of("description", "second"))), context);

        assertEquals(1, tools.size());
        assertEquals("first", tools.get(0).getDefinition().getDescription());
    }

    @Test
    void shouldReturnEmptyListForMissingConfig() {
        assertTrue(registry.build(null, context).isEmpty());
        assertTrue(registry.build(List.of(), context).isEmpty());
    }

    @Test
    void shouldResolveGenerationKeyFromCredentialBeforeEnvironment() throws Exception {
        FlowProperties.ProviderProperties provider = new FlowProperties.ProviderProperties();
        provider.setApiKey("sk-env");
        properties.getLlm().getProviders().put("anthropic", provider);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("ok").build()));
        ToolContext withCredential = ToolContext.builder()
                .nodeId("agent-1")
                .credentials(Map.of("anthropic", "sk-credential"))
                .build();

        AgentTool tool = registry.build(List.of(config("anthropicTool", Map.of())), withCredential).get(0);
        tool.execute(Map.of("prompt", "hi")).get();

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertEquals("sk-credential", captor.getValue().getApiKey());
        assertEquals(ToolRegistry.DEFAULT_ANTHROPIC_MODEL, captor.getValue().getModel());
    }

    @Test
    void shouldFallBackToEnvironmentKey() throws Exception {
        FlowProperties.ProviderProperties provider = new FlowProperties.ProviderProperties();
        provider.setApiKey("sk-env");
        properties.getLlm().getProviders().put("openai", provider);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("ok").build()));

        AgentTool tool = registry.build(List.of(config("openAiChatModel", Map.of())), context).get(0);
        tool.execute(Map.of("prompt", "hi")).get();

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertEquals("sk-env", captor.getValue().getApiKey());
        assertInstanceOf(LlmGenerateTool.class, tool);
    }

    private static ToolConfig config(String type, Map<String, Object> settings) {
        return ToolConfig.builder().type(type).settings(settings).build();
    }

    private static List<String> names(List<AgentTool> tools) {
        return tools.stream().map(tool -> tool.getDefinition().getName()).toList();
    }
}
