package me.golemcore.leads;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class LeadQualifierApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(LeadQualifierApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(LeadQualifierApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(LeadQualifierApplication.class.getMethod("main", String[].class));
    }
}
