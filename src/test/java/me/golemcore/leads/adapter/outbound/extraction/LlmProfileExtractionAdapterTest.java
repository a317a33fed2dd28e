package me.golemcore.leads.adapter.outbound.extraction;

import me.golemcore.leads.domain.model.CandidateProfile;
import me.golemcore.leads.domain.model.ConversationTurn;
import me.golemcore.leads.domain.model.ExtractionConfidence;
import me.golemcore.leads.domain.model.LlmRequest;
import me.golemcore.leads.domain.model.LlmResponse;
import me.golemcore.leads.domain.model.Message;
import me.golemcore.leads.domain.model.PropertyType;
import me.golemcore.leads.infrastructure.config.LeadsProperties;
import me.golemcore.leads.port.outbound.LlmPort;
import me.golemcore.leads.port.outbound.ProfileExtractionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmProfileExtractionAdapterTest {

    private static final List<ConversationTurn> TURNS = List.of(
            ConversationTurn.user(0, "Busco casa en Monterrey"),
            ConversationTurn.agent(1, "Cuéntame más sobre lo que buscas"),
            ConversationTurn.user(2, "presupuesto 3 millones, mi tel es 5512345678"));

    private LeadsProperties properties;
    private LlmPort mockLlmPort;
    private LlmProfileExtractionAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new LeadsProperties();
        properties.getExtraction().setTimeoutMs(5000);
        mockLlmPort = mock(LlmPort.class);
        when(mockLlmPort.isAvailable()).thenReturn(true);
        when(mockLlmPort.getProviderId()).thenReturn("langchain4j");
        adapter = new LlmProfileExtractionAdapter(mockLlmPort, properties, new ObjectMapper());
    }

    @Test
    void shouldParseValidJsonResponse() {
        respondWith("""
                {"budget": 3000000, "city": "Monterrey", "phone": "5512345678", "property_type": "casa", "confidence": "high"}
                """);

        CandidateProfile profile = adapter.extract(TURNS);

        assertEquals(3_000_000L, profile.getBudget());
        assertEquals("Monterrey", profile.getCity());
        assertEquals("5512345678", profile.getPhone());
        assertEquals(PropertyType.HOUSE, profile.getPropertyType());
        assertEquals(ExtractionConfidence.HIGH, profile.getConfidence());
        assertNull(profile.getArea());
    }

    @Test
    void shouldParseJsonInMarkdownBlock() {
        respondWith("""
                Here is the profile:
                ```json
                {"budget": 3000000, "city": "CDMX", "area": "Roma Norte", "bedrooms": 2}
                ```
                """);

        CandidateProfile profile = adapter.extract(TURNS);

        assertEquals("Roma Norte", profile.getArea());
        assertEquals(2, profile.getBedrooms());
        assertEquals(ExtractionConfidence.MEDIUM, profile.getConfidence());
    }

    @Test
    void shouldParseJsonSurroundedByProse() {
        respondWith("Sure! {\"city\": \"Guadalajara\", \"property_type\": \"departamento\"} Let me know.");

        CandidateProfile profile = adapter.extract(TURNS);

        assertEquals("Guadalajara", profile.getCity());
        assertEquals(PropertyType.APARTMENT, profile.getPropertyType());
    }

    @Test
    void shouldDropInvalidValues() {
        respondWith("""
                {"budget": -5, "city": "  ", "bedrooms": 0, "bathrooms": "two", "property_type": "castle",
                 "phone": null, "confidence": "certain"}
                """);

        CandidateProfile profile = adapter.extract(TURNS);

        assertNull(profile.getBudget());
        assertNull(profile.getCity());
        assertNull(profile.getBedrooms());
        assertNull(profile.getBathrooms());
        assertNull(profile.getPropertyType());
        assertNull(profile.getPhone());
        assertEquals(ExtractionConfidence.MEDIUM, profile.getConfidence());
    }

    @Test
    void shouldAcceptNumericStrings() {
        respondWith("{\"budget\": \"3000000\", \"bedrooms\": \"3\"}");

        CandidateProfile profile = adapter.extract(TURNS);

        assertEquals(3_000_000L, profile.getBudget());
        assertEquals(3, profile.getBedrooms());
    }

    @Test
    void shouldReturnEmptyProfileForUnparsableResponse() {
        respondWith("I could not find any information.");

        assertTrue(adapter.extract(TURNS).isEmpty());
    }

    @Test
    void shouldReturnEmptyProfileForBlankResponse() {
        respondWith("   ");

        assertTrue(adapter.extract(TURNS).isEmpty());
    }

    // ===== request =====

    @Test
    void shouldSendWholeConversationWithMappedRoles() {
        properties.getExtraction().setModel("claude-haiku-4-5");
        respondWith("{}");

        adapter.extract(TURNS);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(mockLlmPort).chat(captor.capture());
        LlmRequest request = captor.getValue();
        assertEquals("claude-haiku-4-5", request.getModel());
        assertEquals(LlmProfileExtractionAdapter.SYSTEM_PROMPT, request.getSystemPrompt());
        assertEquals(List.of("user", "assistant", "user"),
                request.getMessages().stream().map(Message::getRole).toList());
        assertEquals("presupuesto 3 millones, mi tel es 5512345678", request.getMessages().get(2).getContent());
    }

    @Test
    void shouldUseProviderDefaultModelWhenOverrideIsBlank() {
        properties.getExtraction().setModel(" ");
        respondWith("{}");

        adapter.extract(TURNS);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(mockLlmPort).chat(captor.capture());
        assertNull(captor.getValue().getModel());
    }

    // ===== failures =====

    @Test
    void shouldFailWhenProviderUnavailable() {
        when(mockLlmPort.isAvailable()).thenReturn(false);

        assertThrows(ProfileExtractionException.class, () -> adapter.extract(TURNS));
        verify(mockLlmPort, never()).chat(any(LlmRequest.class));
    }

    @Test
    void shouldFailWhenProviderErrors() {
        when(mockLlmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("LLM chat failed: 500")));

        ProfileExtractionException ex = assertThrows(ProfileExtractionException.class,
                () -> adapter.extract(TURNS));
        assertTrue(ex.getMessage().contains("500"));
    }

    @Test
    void shouldFailOnTimeout() {
        properties.getExtraction().setTimeoutMs(50);
        when(mockLlmPort.chat(any(LlmRequest.class))).thenReturn(new CompletableFuture<>());

        ProfileExtractionException ex = assertThrows(ProfileExtractionException.class,
                () -> adapter.extract(TURNS));
        assertTrue(ex.getMessage().contains("timed out"));
    }

    // ===== helpers =====

    @Test
    void extractJsonShouldPreferFencedBlock() {
        assertEquals("{\"a\": 1}", LlmProfileExtractionAdapter.extractJson("```json\n{\"a\": 1}\n```"));
        assertEquals("{\"a\": 1}", LlmProfileExtractionAdapter.extractJson("text {\"a\": 1} text"));
        assertEquals("no json", LlmProfileExtractionAdapter.extractJson("  no json "));
    }

    private void respondWith(String content) {
        when(mockLlmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(LlmResponse.builder().content(content).build()));
    }
}
