package me.golemcore.leads.adapter.outbound.llm;

import me.golemcore.leads.domain.model.LlmRequest;
import me.golemcore.leads.domain.model.LlmResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class NoOpLlmAdapterTest {

    private NoOpLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new NoOpLlmAdapter();
    }

    @Test
    void shouldReturnPlaceholderResponseFromChat() throws Exception {
        LlmRequest request = LlmRequest.builder()
                .model("test-model")
                .build();

        LlmResponse response = adapter.chat(request).get();

        assertEquals("[No LLM configured]", response.getContent());
        assertEquals("none", response.getModel());
        assertEquals("stop", response.getFinishReason());
    }

    @Test
    void shouldReportNoneAndUnavailable() {
        assertEquals("none", adapter.getProviderId());
        assertEquals("none", adapter.getCurrentModel());
        assertFalse(adapter.isAvailable());
    }
}
