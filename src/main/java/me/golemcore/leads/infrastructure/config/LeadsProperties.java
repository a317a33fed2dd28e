package me.golemcore.leads.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for lead qualification, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code leads.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - LLM provider used by the model extraction
 * path</li>
 * <li>{@link ExtractionProperties} - model extraction timeout and model
 * override</li>
 * <li>{@link HeuristicProperties} - closed vocabularies of the heuristic
 * path</li>
 * <li>{@link MatchingProperties} - catalog matching</li>
 * <li>{@link CatalogProperties} - catalog seed location</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "leads")
@Data
public class LeadsProperties {

    private LlmProperties llm = new LlmProperties();
    private ExtractionProperties extraction = new ExtractionProperties();
    private HeuristicProperties heuristic = new HeuristicProperties();
    private MatchingProperties matching = new MatchingProperties();
    private CatalogProperties catalog = new CatalogProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** Active adapter: langchain4j or none. */
        private String provider = "langchain4j";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /** Backing API: anthropic or openai (any OpenAI-compatible endpoint). */
        private String provider = "anthropic";
        private String apiKey;
        private String baseUrl;
        private String model = "claude-sonnet-4-5";
        private long timeoutMs = 30000;
        private int maxTokens = 1024;
        private double temperature = 0.0;
        private int maxRetries = 3;
    }

    // ==================== EXTRACTION ====================

    @Data
    public static class ExtractionProperties {
        /** Upper bound for one model extraction call, including transport retries. */
        private long timeoutMs = 45000;

        /** Model override for extraction; the provider default is used when blank. */
        private String model;
    }

    // ==================== HEURISTIC ====================

    @Data
    public static class HeuristicProperties {
        private List<String> cities = new ArrayList<>(List.of(
                "CDMX", "Ciudad de México", "Ciudad de Mexico", "Guadalajara", "Monterrey", "Querétaro",
                "Puebla"));

        /** Alternate city names collapsed to their canonical form. */
        private Map<String, String> citySynonyms = new LinkedHashMap<>(Map.of(
                "Ciudad de México", "CDMX",
                "Ciudad de Mexico", "CDMX"));

        private List<String> areas = new ArrayList<>(List.of(
                "Roma Norte", "Roma Sur", "Condesa", "Polanco", "Del Valle", "Coyoacán", "Santa Fe",
                "Narvarte", "Juárez", "Doctores", "San Pedro"));
    }

    // ==================== MATCHING ====================

    @Data
    public static class MatchingProperties {
        private int maxResults = 3;
    }

    // ==================== CATALOG ====================

    @Data
    public static class CatalogProperties {
        /** Classpath location of the catalog seed. */
        private String resource = "catalog/properties.json";
    }
}
