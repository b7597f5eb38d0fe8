package me.golemcore.orchestrator;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class OrchestratorApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(OrchestratorApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(OrchestratorApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(OrchestratorApplication.class.getMethod("main", String[].class));
    }
}
