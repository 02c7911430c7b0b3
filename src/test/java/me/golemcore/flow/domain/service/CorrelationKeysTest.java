package me.golemcore.flow.domain.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CorrelationKeysTest {

    @ParameterizedTest
    @ValueSource(strings = { "a/b", "a/b/", "/a/b", "a//b", "//a///b//", " a/b " })
    void shouldNormalizeEquivalentKeys(String key) {
        assertEquals("a/b", CorrelationKeys.normalize(key));
    }

    @Test
    void shouldNormalizeSlashOnlyKeyToEmpty() {
        assertEquals("", CorrelationKeys.normalize("///"));
    }

    @Test
    void shouldRejectNullKey() {
        assertThrows(IllegalArgumentException.class, () -> CorrelationKeys.normalize(null));
    }

    @Test
    void shouldBuildKeyFromWorkflowAndNode() {
        assertEquals("wf-1/trigger", CorrelationKeys.of("wf-1/", "/trigger"));
    }

    @Test
    void shouldExtractWorkflowIdFromFirstSegment() {
        assertEquals("wf-1", CorrelationKeys.workflowIdOf("/wf-1/trigger/extra"));
        assertEquals("wf-1", CorrelationKeys.workflowIdOf("wf-1"));
    }
}
