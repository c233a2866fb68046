package me.golemcore.graph;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class GraphRuntimeApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(GraphRuntimeApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(GraphRuntimeApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(GraphRuntimeApplication.class.getMethod("main", String[].class));
    }
}
