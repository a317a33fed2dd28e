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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Arrays;

/**
 * One extractor's best-effort structured guess at buyer attributes.
 *
 * <p>
 * Absent attributes are {@code null} and are omitted from the JSON form. Two
 * instances exist per qualification run (heuristic and model) and the merged
 * profile is a third one. Field-generic access goes through
 * {@link ProfileField}.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateProfile {

    Long budget;
    String city;
    String area;
    Integer bedrooms;
    Integer bathrooms;
    PropertyType propertyType;

    /** Only the model path extracts phone numbers. */
    String phone;

    /** Only the model path reports confidence. */
    ExtractionConfidence confidence;

    public static CandidateProfile empty() {
        return CandidateProfile.builder().build();
    }

    /**
     * Checks whether no attribute was extracted at all.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return Arrays.stream(ProfileField.values()).noneMatch(this::has);
    }

    public boolean has(ProfileField field) {
        return field.get(this) != null;
    }

    public boolean hasCity() {
        return city != null && !city.isBlank();
    }
}
