package me.golemcore.leads;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Lead Qualifier.
 *
 * <p>
 * Qualifies real estate leads from buyer conversations and ranks catalog
 * listings against the qualified profile.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Dual extraction</b> - an LLM reads the whole conversation, a
 * pattern-based extractor reads only the buyer's words</li>
 * <li><b>Cross-validation</b> - field-by-field discrepancies with severity and
 * a human review flag</li>
 * <li><b>Matching</b> - 100-point weighted scoring of listings in the lead's
 * city</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → LeadRunService, LeadQualificationService, PropertyMatchingService
 * Ports              → ProfileExtractionPort, CatalogPort, LlmPort
 * Infrastructure     → LLM (langchain4j), model extraction, in-memory catalog
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code leads.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LeadQualifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadQualifierApplication.class, args);
    }

}
