package me.golemcore.flow.domain.agent;

import me.golemcore.flow.domain.model.NodeErrorCode;
import me.golemcore.flow.domain.model.NodeExecutionException;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionModelResolverTest {

    private FlowProperties properties;
    private DecisionModelResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new FlowProperties();
        resolver = new DecisionModelResolver(properties);
    }

    @Test
    void shouldUseExplicitProviderModelAndKey() {
        DecisionModel model = resolver.resolve(Map.of(
                "decisionMakerProvider", "OpenAI",
                "decisionMakerModel", "gpt-4o",
                "decisionMakerApiKey", " sk-node "), Map.of());

        assertEquals("openai", model.provider());
        assertEquals("gpt-4o", model.model());
        assertEquals("sk-node", model.apiKey());
        assertEquals("config", model.source());
    }

    @Test
    void shouldSwitchToAnthropicForClaudeModels() {
        DecisionModel model = resolver.resolve(Map.of(
                "decisionMakerModel", "claude-3-haiku-20240307",
                "decisionMakerApiKey", "sk-ant"), Map.of());

        assertEquals("anthropic", model.provider());
    }

    @Test
    void shouldDefaultAnthropicModel() {
        DecisionModel model = resolver.resolve(Map.of(
                "decisionMakerProvider", "anthropic",
                "decisionMakerApiKey", "sk-ant"), Map.of());

        assertEquals(DecisionModelResolver.DEFAULT_ANTHROPIC_MODEL, model.model());
    }

    @Test
    void shouldReadLegacyChatModelKey() {
        DecisionModel model = resolver.resolve(Map.of(
                "chatModelConfig", Map.of("settings", Map.of("apiKey", "sk-legacy"))), Map.of());

        assertEquals("sk-legacy", model.apiKey());
        assertEquals("legacy", model.source());
    }

    @Test
    void shouldFallBackToCredentialThenEnvironment() {
        DecisionModel fromCredential = resolver.resolve(Map.of(), Map.of("openai", "sk-cred"));
        assertEquals("sk-cred", fromCredential.apiKey());

        FlowProperties.ProviderProperties provider = new FlowProperties.ProviderProperties();
        provider.setApiKey("sk-env");
        properties.getLlm().getProviders().put("openai", provider);

        DecisionModel fromEnvironment = resolver.resolve(Map.of(), Map.of());
        assertEquals("sk-env", fromEnvironment.apiKey());
        assertEquals("gpt-4o-mini", fromEnvironment.model());
        assertEquals("environment", fromEnvironment.source());
    }

    @Test
    void shouldRejectMissingKey() {
        NodeExecutionException error = assertThrows(NodeExecutionException.class,
                () -> resolver.resolve(Map.of("decisionMakerProvider", "anthropic"), Map.of()));

        assertEquals(NodeErrorCode.VALIDATION_ERROR, error.getCode());
        assertTrue(error.getMessage().contains("ANTHROPIC_API_KEY"));
    }

    @Test
    void shouldNotExposeKeyInToString() {
        DecisionModel model = new DecisionModel("openai", "gpt-4o", "sk-secret", "config");

        assertTrue(!model.toString().contains("sk-secret"));
    }
}
