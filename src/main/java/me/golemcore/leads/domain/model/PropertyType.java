package me.golemcore.leads.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Closed set of listing types. Each type carries the labels (Spanish and
 * English) that map onto it when read from a model answer or a catalog file.
 */
public enum PropertyType {

    APARTMENT("apartment", List.of("departamento", "depa", "apt")),
    HOUSE("house", List.of("casa")),
    LAND("land", List.of("terreno", "lote", "lot"));

    private final String value;
    private final List<String> aliases;

    PropertyType(String value, List<String> aliases) {
        this.value = value;
        this.aliases = aliases;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a label such as {@code "departamento"} or {@code "House"}.
     *
     * @return the matching type, or {@code null} for unknown or blank labels
     */
    @JsonCreator
    public static PropertyType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (PropertyType type : values()) {
            if (type.value.equals(normalized) || type.aliases.contains(normalized)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
