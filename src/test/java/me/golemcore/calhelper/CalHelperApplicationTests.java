package me.golemcore.calhelper;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class CalHelperApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(CalHelperApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(CalHelperApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(CalHelperApplication.class.getMethod("main", String[].class));
    }
}
