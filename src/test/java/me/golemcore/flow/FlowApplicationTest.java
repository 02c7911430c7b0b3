package me.golemcore.flow;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class FlowApplicationTest {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(FlowApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(FlowApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(FlowApplication.class.getMethod("main", String[].class));
    }
}
