package me.golemcore.router;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class RouterApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(RouterApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(RouterApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(RouterApplication.class.getMethod("main", String[].class));
    }
}
