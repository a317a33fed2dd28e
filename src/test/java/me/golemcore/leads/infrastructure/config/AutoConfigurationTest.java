package me.golemcore.leads.infrastructure.config;

import me.golemcore.leads.domain.model.CandidateProfile;
import me.golemcore.leads.domain.model.CatalogEntry;
import me.golemcore.leads.domain.model.PropertyType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Mock
    private ObjectProvider<BuildProperties> buildPropertiesProvider;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void shouldLogStartupWithoutBuildInfo() {
        when(buildPropertiesProvider.getIfAvailable()).thenReturn(null);
        AutoConfiguration autoConfiguration = new AutoConfiguration(new LeadsProperties(), buildPropertiesProvider);

        assertDoesNotThrow(autoConfiguration::init);
        verify(buildPropertiesProvider).getIfAvailable();
    }

    @Test
    void shouldLogStartupWithBuildInfo() {
        Properties entries = new Properties();
        entries.setProperty("version", "1.0.0");
        when(buildPropertiesProvider.getIfAvailable()).thenReturn(new BuildProperties(entries));
        AutoConfiguration autoConfiguration = new AutoConfiguration(new LeadsProperties(), buildPropertiesProvider);

        assertDoesNotThrow(autoConfiguration::init);
    }

    @Test
    void objectMapperShouldIgnoreUnknownProperties() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        CatalogEntry entry = mapper.readValue("""
                {"id": 7, "title": "Casa en Cumbres", "price": 3200000, "city": "Monterrey",
                 "propertyType": "casa", "squareMeters": 180, "active": true}
                """, CatalogEntry.class);

        assertEquals(7L, entry.getId());
        assertEquals(PropertyType.HOUSE, entry.getPropertyType());
    }

    @Test
    void objectMapperShouldWriteProfilesWithLowercaseLabelsAndNoNulls() throws Exception {
        CandidateProfile profile = CandidateProfile.builder()
                .budget(3_000_000L)
                .propertyType(PropertyType.APARTMENT)
                .build();

        String json = AutoConfiguration.objectMapper().writeValueAsString(profile);

        assertEquals("{\"budget\":3000000,\"propertyType\":\"apartment\"}", json);
        assertFalse(json.contains("null"));
    }
}
