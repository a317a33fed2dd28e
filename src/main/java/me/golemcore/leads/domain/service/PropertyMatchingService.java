package me.golemcore.leads.domain.service;

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

import me.golemcore.leads.domain.model.CandidateProfile;
import me.golemcore.leads.domain.model.CatalogEntry;
import me.golemcore.leads.domain.model.ProfileField;
import me.golemcore.leads.domain.model.PropertyMatch;
import me.golemcore.leads.domain.model.PropertyType;
import me.golemcore.leads.infrastructure.config.LeadsProperties;
import me.golemcore.leads.port.outbound.CatalogPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ranks catalog listings of the lead's city against a qualified profile.
 *
 * <p>
 * Scores are on a 100-point scale, one component per profile field that is
 * present:
 * <ul>
 * <li>Budget (40) - within 10% of the budget 40, 20% 30, 30% 20</li>
 * <li>Bedrooms (30) - exact 30, off by one 20</li>
 * <li>Area (20) - exact 20, one name containing the other 10</li>
 * <li>Property type (10) - same type 10</li>
 * </ul>
 * Absent profile fields contribute nothing and do not show up in the
 * components. Reasons are derived from the components only.
 *
 * <p>
 * A city is mandatory: without it nothing is returned, and there is no
 * fallback to an unfiltered search. Equal scores are ordered by ascending
 * listing id.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PropertyMatchingService {

    static final int BUDGET_MAX = 40;
    static final int BEDROOMS_MAX = 30;
    static final int AREA_MAX = 20;
    static final int PROPERTY_TYPE_MAX = 10;

    static final int MAX_RESULTS = 3;

    private static final Comparator<PropertyMatch> RANKING = Comparator
            .comparingInt(PropertyMatch::getScore).reversed()
            .thenComparingLong(PropertyMatch::getPropertyId);

    private final CatalogPort catalogPort;
    private final LeadsProperties properties;

    public List<PropertyMatch> match(CandidateProfile profile) {
        if (profile == null || !profile.hasCity()) {
            return noResults("missing_city");
        }

        String city = profile.getCity().trim();
        List<PropertyMatch> scored = catalogPort.activeInCity(city).stream()
                .filter(CatalogEntry::isActive)
                .filter(entry -> entry.getCity() != null && entry.getCity().trim().equalsIgnoreCase(city))
                .map(entry -> score(entry, profile))
                .sorted(RANKING)
                .limit(resultLimit())
                .toList();

        log.info("[Matcher] city={} matches={} topScore={}", city, scored.size(),
                scored.isEmpty() ? 0 : scored.get(0).getScore());
        return scored;
    }

    private int resultLimit() {
        return Math.min(Math.max(properties.getMatching().getMaxResults(), 0), MAX_RESULTS);
    }

    PropertyMatch score(CatalogEntry entry, CandidateProfile profile) {
        Map<String, Integer> components = new LinkedHashMap<>();

        if (profile.getBudget() != null) {
            components.put(ProfileField.BUDGET.getKey(), scoreBudget(entry.getPrice(), profile.getBudget()));
        }
        if (profile.getBedrooms() != null) {
            components.put(ProfileField.BEDROOMS.getKey(), scoreBedrooms(entry.getBedrooms(), profile.getBedrooms()));
        }
        if (profile.getArea() != null) {
            components.put(ProfileField.AREA.getKey(), scoreArea(entry.getArea(), profile.getArea()));
        }
        if (profile.getPropertyType() != null) {
            components.put(ProfileField.PROPERTY_TYPE.getKey(),
                    scorePropertyType(entry.getPropertyType(), profile.getPropertyType()));
        }

        int total = components.values().stream().mapToInt(Integer::intValue).sum();

        return PropertyMatch.builder()
                .propertyId(entry.getId())
                .title(entry.getTitle())
                .price(entry.getPrice())
                .city(entry.getCity())
                .area(entry.getArea())
                .bedrooms(entry.getBedrooms())
                .bathrooms(entry.getBathrooms())
                .score(total)
                .scoreComponents(components)
                .reasons(reasons(components))
                .build();
    }

    static int scoreBudget(long price, long budget) {
        if (budget <= 0) {
            return 0;
        }
        double diffPct = Math.abs(price - budget) * 100.0 / budget;
        if (diffPct <= 10) {
            return BUDGET_MAX;
        } else if (diffPct <= 20) {
            return 30;
        } else if (diffPct <= 30) {
            return 20;
        }
        return 0;
    }

    static int scoreBedrooms(Integer listed, int requested) {
        if (listed == null) {
            return 0;
        }
        if (listed == requested) {
            return BEDROOMS_MAX;
        }
        return Math.abs(listed - requested) == 1 ? 20 : 0;
    }

    static int scoreArea(String listed, String requested) {
        if (listed == null || listed.isBlank() || requested.isBlank()) {
            return 0;
        }
        String a = listed.trim().toLowerCase(Locale.ROOT);
        String b = requested.trim().toLowerCase(Locale.ROOT);
        if (a.equals(b)) {
            return AREA_MAX;
        }
        return a.contains(b) || b.contains(a) ? 10 : 0;
    }

    static int scorePropertyType(PropertyType listed, PropertyType requested) {
        return listed == requested ? PROPERTY_TYPE_MAX : 0;
    }

    static List<String> reasons(Map<String, Integer> components) {
        List<String> reasons = new ArrayList<>();

        Integer budget = components.get(ProfileField.BUDGET.getKey());
        if (budget != null && budget == BUDGET_MAX) {
            reasons.add("budget_exact_match");
        } else if (budget != null && budget >= 20) {
            reasons.add("budget_close_match");
        }

        Integer bedrooms = components.get(ProfileField.BEDROOMS.getKey());
        if (bedrooms != null && bedrooms == BEDROOMS_MAX) {
            reasons.add("bedrooms_exact_match");
        } else if (bedrooms != null && bedrooms == 20) {
            reasons.add("bedrooms_close_match");
        }

        Integer area = components.get(ProfileField.AREA.getKey());
        if (area != null && area == AREA_MAX) {
            reasons.add("area_exact_match");
        } else if (area != null && area == 10) {
            reasons.add("area_partial_match");
        }

        Integer type = components.get(ProfileField.PROPERTY_TYPE.getKey());
        if (type != null && type == PROPERTY_TYPE_MAX) {
            reasons.add("property_type_match");
        }

        return reasons;
    }

    private List<PropertyMatch> noResults(String reason) {
        log.warn("[Matcher] No property matches: {}", reason);
        return List.of();
    }
}
