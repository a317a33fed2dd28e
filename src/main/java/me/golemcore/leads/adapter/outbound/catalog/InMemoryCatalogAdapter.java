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

package me.golemcore.leads.adapter.outbound.catalog;

import me.golemcore.leads.domain.model.CatalogEntry;
import me.golemcore.leads.infrastructure.config.LeadsProperties;
import me.golemcore.leads.port.outbound.CatalogPort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Catalog held in memory, seeded from a classpath JSON file
 * ({@code leads.catalog.resource}).
 *
 * <p>
 * The seed is read once at startup. A missing or unreadable seed stops the
 * application.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryCatalogAdapter implements CatalogPort {

    private static final TypeReference<List<CatalogEntry>> ENTRY_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final LeadsProperties properties;
    private final ObjectMapper objectMapper;

    private volatile List<CatalogEntry> entries = List.of();

    @PostConstruct
    public void load() {
        String location = properties.getCatalog().getResource();
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Catalog seed not found on classpath: " + location);
        }

        try (InputStream is = resource.getInputStream()) {
            List<CatalogEntry> loaded = objectMapper.readValue(is, ENTRY_LIST_TYPE_REF);
            entries = List.copyOf(loaded);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load catalog seed " + location + ": " + e.getMessage(), e);
        }

        log.info("[Catalog] Loaded {} listings ({} active) from {}",
                entries.size(), entries.stream().filter(CatalogEntry::isActive).count(), location);
    }

    @Override
    public List<CatalogEntry> activeInCity(String city) {
        if (city == null || city.isBlank()) {
            return List.of();
        }
        String wanted = city.trim();
        return entries.stream()
                .filter(CatalogEntry::isActive)
                .filter(entry -> entry.getCity() != null && entry.getCity().trim().equalsIgnoreCase(wanted))
                .toList();
    }

    List<CatalogEntry> getAll() {
        return entries;
    }
}
