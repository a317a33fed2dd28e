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

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * The fixed field set of a {@link CandidateProfile}, with typed accessors so
 * that cross-validation and merging can walk the fields generically.
 */
public enum ProfileField {

    BUDGET("budget", Kind.NUMERIC, CandidateProfile::getBudget,
            (b, v) -> b.budget((Long) v)),
    BEDROOMS("bedrooms", Kind.NUMERIC, CandidateProfile::getBedrooms,
            (b, v) -> b.bedrooms((Integer) v)),
    BATHROOMS("bathrooms", Kind.NUMERIC, CandidateProfile::getBathrooms,
            (b, v) -> b.bathrooms((Integer) v)),
    CITY("city", Kind.CATEGORICAL, CandidateProfile::getCity,
            (b, v) -> b.city((String) v)),
    AREA("area", Kind.CATEGORICAL, CandidateProfile::getArea,
            (b, v) -> b.area((String) v)),
    PROPERTY_TYPE("property_type", Kind.CATEGORICAL, CandidateProfile::getPropertyType,
            (b, v) -> b.propertyType((PropertyType) v)),
    PHONE("phone", Kind.PASSTHROUGH, CandidateProfile::getPhone,
            (b, v) -> b.phone((String) v)),
    CONFIDENCE("confidence", Kind.PASSTHROUGH, CandidateProfile::getConfidence,
            (b, v) -> b.confidence((ExtractionConfidence) v));

    /**
     * How a field takes part in cross-validation.
     */
    public enum Kind {
        /** Compared by relative difference. */
        NUMERIC,
        /** Compared ignoring case. */
        CATEGORICAL,
        /** Never compared. */
        PASSTHROUGH
    }

    private final String key;
    private final Kind kind;
    private final Function<CandidateProfile, Object> getter;
    private final BiConsumer<CandidateProfile.CandidateProfileBuilder, Object> setter;

    ProfileField(String key, Kind kind,
            Function<CandidateProfile, Object> getter,
            BiConsumer<CandidateProfile.CandidateProfileBuilder, Object> setter) {
        this.key = key;
        this.kind = kind;
        this.getter = getter;
        this.setter = setter;
    }

    public String getKey() {
        return key;
    }

    public Kind getKind() {
        return kind;
    }

    public Object get(CandidateProfile profile) {
        return profile == null ? null : getter.apply(profile);
    }

    public void set(CandidateProfile.CandidateProfileBuilder builder, Object value) {
        setter.accept(builder, value);
    }
}
