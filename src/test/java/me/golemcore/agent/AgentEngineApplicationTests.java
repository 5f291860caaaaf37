package me.golemcore.agent;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class AgentEngineApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(AgentEngineApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(AgentEngineApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(AgentEngineApplication.class.getMethod("main", String[].class));
    }
}
