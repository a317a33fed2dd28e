/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

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
import me.golemcore.leads.port.outbound.ProfileExtractionPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model extraction path: asks the configured LLM to read the whole
 * conversation and answer with a JSON profile.
 *
 * <p>
 * Transport problems (no provider, timeout, provider error) are raised as
 * {@link ProfileExtractionException}. An answer that cannot be read as JSON
 * is not an error: it yields an empty profile.
 *
 * <p>
 * Normalization of the answer:
 * <ul>
 * <li>budget, bedrooms and bathrooms are kept only when positive integers</li>
 * <li>city, area and phone are kept only when non-blank</li>
 * <li>property_type accepts Spanish or English labels</li>
 * <li>confidence defaults to medium</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmProfileExtractionAdapter implements ProfileExtractionPort {

    private static final Pattern JSON_PATTERN = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final Pattern OBJECT_PATTERN = Pattern.compile("(\\{.*})", Pattern.DOTALL);
    private static final Pattern DIGITS_ONLY = Pattern.compile("\\d{1,15}");

    static final String SYSTEM_PROMPT = """
            You are a lead qualification assistant for a real estate platform.
            Extract the following information from the conversation:
            - budget (numeric, in MXN)
            - city (string)
            - area (string, neighborhood name)
            - bedrooms (integer)
            - bathrooms (integer)
            - property_type (apartment, house, land; Spanish labels such as casa, departamento, terreno are accepted)
            - phone (string, if provided)
            - confidence (high, medium, low)

            Return ONLY a JSON object with these fields. Omit fields if not mentioned.
            Be precise with numbers and do not confuse phone numbers with budgets.

            Example output:
            {"budget": 3000000, "city": "CDMX", "area": "Roma Norte", "bedrooms": 2, "confidence": "high"}
            """;

    private final LlmPort llmPort;
    private final LeadsProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public CandidateProfile extract(List<ConversationTurn> turns) {
        if (!llmPort.isAvailable()) {
            throw new ProfileExtractionException("LLM provider '" + llmPort.getProviderId() + "' is not available");
        }

        LeadsProperties.ExtractionProperties config = properties.getExtraction();
        LlmRequest request = LlmRequest.builder()
                .model(blankToNull(config.getModel()))
                .systemPrompt(SYSTEM_PROMPT)
                .messages(toMessages(turns))
                .build();

        log.debug("[ModelExtractor] Sending {} messages to {} (timeout: {}ms)",
                request.getMessages().size(), llmPort.getCurrentModel(), config.getTimeoutMs());
        long startMs = System.currentTimeMillis();

        LlmResponse response = await(request, config.getTimeoutMs());
        log.info("[ModelExtractor] Response received in {}ms", System.currentTimeMillis() - startMs);

        if (response == null || !response.hasContent()) {
            log.warn("[ModelExtractor] Empty model response, returning empty profile");
            return CandidateProfile.empty();
        }
        return parseProfile(response.getContent());
    }

    private LlmResponse await(LlmRequest request, long timeoutMs) {
        try {
            return llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ProfileExtractionException("Model extraction timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ProfileExtractionException("Model extraction failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProfileExtractionException("Model extraction interrupted", e);
        }
    }

    static List<Message> toMessages(List<ConversationTurn> turns) {
        return turns.stream()
                .filter(turn -> turn.getText() != null && !turn.getText().isBlank())
                .map(turn -> Message.builder()
                        .role(turn.isAgentTurn() ? "assistant" : "user")
                        .content(turn.getText())
                        .build())
                .toList();
    }

    CandidateProfile parseProfile(String content) {
        JsonNode node;
        try {
            node = objectMapper.readTree(extractJson(content));
        } catch (JsonProcessingException e) {
            log.warn("[ModelExtractor] Unparsable model response, returning empty profile: {}", e.getOriginalMessage());
            return CandidateProfile.empty();
        }
        if (node == null || !node.isObject()) {
            log.warn("[ModelExtractor] Model response is not a JSON object, returning empty profile");
            return CandidateProfile.empty();
        }

        CandidateProfile profile = CandidateProfile.builder()
                .budget(positiveLong(node.get("budget")))
                .city(nonBlank(node.get("city")))
                .area(nonBlank(node.get("area")))
                .bedrooms(positiveInt(node.get("bedrooms")))
                .bathrooms(positiveInt(node.get("bathrooms")))
                .propertyType(PropertyType.fromLabel(nonBlank(node.get("property_type"))))
                .phone(nonBlank(node.get("phone")))
                .confidence(ExtractionConfidence.fromLabel(nonBlank(node.get("confidence")),
                        ExtractionConfidence.MEDIUM))
                .build();

        log.debug("[ModelExtractor] Parsed profile: {}", profile);
        return profile;
    }

    static String extractJson(String response) {
        Matcher fenced = JSON_PATTERN.matcher(response);
        if (fenced.find()) {
            return fenced.group(1);
        }

        Matcher object = OBJECT_PATTERN.matcher(response);
        if (object.find()) {
            return object.group(1);
        }

        return response.trim();
    }

    private static Long positiveLong(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        long number;
        if (value.isNumber()) {
            number = value.longValue();
        } else if (value.isTextual() && DIGITS_ONLY.matcher(value.asText().trim()).matches()) {
            number = Long.parseLong(value.asText().trim());
        } else {
            return null;
        }
        return number > 0 ? number : null;
    }

    private static Integer positiveInt(JsonNode value) {
        Long number = positiveLong(value);
        if (number == null || number > Integer.MAX_VALUE) {
            return null;
        }
        return number.intValue();
    }

    private static String nonBlank(JsonNode value) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
