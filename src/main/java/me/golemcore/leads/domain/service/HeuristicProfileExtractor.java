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
import me.golemcore.leads.domain.model.ConversationTurn;
import me.golemcore.leads.domain.model.PropertyType;
import me.golemcore.leads.infrastructure.config.LeadsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pattern-based extraction path. Scans the buyer's own words for budget,
 * location, room counts and listing type.
 *
 * <p>
 * Only user-authored turns are considered, so text put in the agent's mouth
 * cannot steer the result. For the budget, every valid mention is collected
 * and the one appearing last in the text wins: a buyer who states a higher
 * amount and then corrects it downwards ("5 millones pero realmente solo tengo
 * 3") ends up with the corrected amount, while a context-aware extractor
 * typically keeps the first one. The disagreement then surfaces as a
 * discrepancy.
 *
 * <p>
 * The component is stateless and thread-safe.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class HeuristicProfileExtractor {

    private static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String NOT_AFTER_LETTER = "(?<![\\p{L}\\p{N}])";
    private static final String NOT_BEFORE_LETTER = "(?![\\p{L}\\p{N}])";

    private static final String BEDROOM_WORDS = "(?:rec[áa]maras?|rec|habitaci(?:ones|ón|on)|cuartos?|bedrooms?|br)";
    private static final String BATHROOM_WORDS = "(?:baños?|banos?|bathrooms?|baths?)";

    private static final String BUDGET_KEYWORDS = NOT_AFTER_LETTER
            + "(?:presupuesto|budget|hasta|up to|m[áa]ximo|maximum|tengo|i have|solo|only)";
    // "es de", "is", ":" and similar filler between keyword and amount
    private static final String BUDGET_CONNECTOR = "(?:\\s*(?:de|es|of|is|:)(?!\\p{L}))*\\s*";

    // Order matters only for equal start offsets: the later family wins
    private static final List<Pattern> BUDGET_PATTERNS = List.of(
            // "presupuesto 3 millones", "up to 4 million"
            Pattern.compile(BUDGET_KEYWORDS + BUDGET_CONNECTOR
                    + "(\\d{1,12})\\s*(?:millones|mill[óo]n|millions?|m)(?!\\p{L})", PATTERN_FLAGS),
            // "hasta $3,500,000", "presupuesto 800,000"
            Pattern.compile(BUDGET_KEYWORDS + BUDGET_CONNECTOR
                    + "\\$?\\s*(\\d{1,3}(?:[,.]?\\d{3}){1,2})(?!\\d)", PATTERN_FLAGS),
            // "solo tengo 3" (bare amount read as millions), but not "tengo 2 recámaras"
            Pattern.compile(NOT_AFTER_LETTER + "(?:tengo|solo|have|only)" + BUDGET_CONNECTOR
                    + "(\\d{1,12})(?!\\d)(?![,.]\\d)(?!\\s*(?:" + BEDROOM_WORDS + "|" + BATHROOM_WORDS + "))",
                    PATTERN_FLAGS));

    static final long MIN_MILLIONS = 1;
    static final long MAX_MILLIONS = 100;
    static final long MIN_BUDGET = 500_000;
    static final long MAX_BUDGET = 50_000_000;

    private static final List<Pattern> BEDROOM_PATTERNS = roomPatterns(BEDROOM_WORDS);
    private static final List<Pattern> BATHROOM_PATTERNS = roomPatterns(BATHROOM_WORDS);

    static final int MIN_ROOMS = 1;
    static final int MAX_ROOMS = 10;

    private static final Map<PropertyType, Pattern> PROPERTY_TYPE_PATTERNS = new LinkedHashMap<>();

    static {
        PROPERTY_TYPE_PATTERNS.put(PropertyType.APARTMENT,
                wholeWord("(?:depas?|departamentos?|apartments?|apt)"));
        PROPERTY_TYPE_PATTERNS.put(PropertyType.HOUSE, wholeWord("(?:casas?|houses?)"));
        PROPERTY_TYPE_PATTERNS.put(PropertyType.LAND, wholeWord("(?:terrenos?|land|lotes?|lots?)"));
    }

    private final Map<String, Pattern> cityPatterns;
    private final Map<String, String> citySynonyms;
    private final Map<String, Pattern> areaPatterns;

    public HeuristicProfileExtractor(LeadsProperties properties) {
        LeadsProperties.HeuristicProperties config = properties.getHeuristic();
        this.cityPatterns = vocabularyPatterns(config.getCities());
        this.citySynonyms = Map.copyOf(config.getCitySynonyms());
        this.areaPatterns = vocabularyPatterns(config.getAreas());
    }

    /**
     * Extract a candidate profile from the user-authored turns of a
     * conversation.
     */
    public CandidateProfile extract(List<ConversationTurn> turns) {
        String text = turns.stream()
                .filter(ConversationTurn::isUserTurn)
                .map(ConversationTurn::getText)
                .filter(t -> t != null && !t.isBlank())
                .collect(Collectors.joining(" "));
        return extract(text);
    }

    /**
     * Extract a candidate profile from already concatenated user text.
     */
    public CandidateProfile extract(String text) {
        if (text == null || text.isBlank()) {
            log.debug("[Extractor] No user text, returning empty heuristic profile");
            return CandidateProfile.empty();
        }

        CandidateProfile profile = CandidateProfile.builder()
                .budget(extractBudget(text))
                .city(extractCity(text))
                .area(extractArea(text))
                .bedrooms(extractRoomCount(text, BEDROOM_PATTERNS))
                .bathrooms(extractRoomCount(text, BATHROOM_PATTERNS))
                .propertyType(extractPropertyType(text))
                .build();

        log.info("[Extractor] Heuristic extraction: {}", profile);
        return profile;
    }

    Long extractBudget(String text) {
        Long lastValid = null;
        int lastStart = -1;

        for (Pattern pattern : BUDGET_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                Long amount = normalizeBudget(matcher.group(1));
                if (amount == null) {
                    log.trace("[Extractor] Discarding implausible budget '{}'", matcher.group(1));
                    continue;
                }
                if (matcher.start() >= lastStart) {
                    lastStart = matcher.start();
                    lastValid = amount;
                }
            }
        }

        return lastValid;
    }

    /**
     * Small amounts are read as millions, large ones are taken as-is, anything
     * else (phone numbers included) is rejected.
     */
    static Long normalizeBudget(String raw) {
        String digits = raw.replaceAll("[,.]", "");
        long number;
        try {
            number = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return null;
        }

        if (number >= MIN_MILLIONS && number <= MAX_MILLIONS) {
            return number * 1_000_000;
        }
        if (number >= MIN_BUDGET && number <= MAX_BUDGET) {
            return number;
        }
        return null;
    }

    String extractCity(String text) {
        for (Map.Entry<String, Pattern> entry : cityPatterns.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return citySynonyms.getOrDefault(entry.getKey(), entry.getKey());
            }
        }
        return null;
    }

    String extractArea(String text) {
        for (Map.Entry<String, Pattern> entry : areaPatterns.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return entry.getKey();
            }
        }
        return null;
    }

    Integer extractRoomCount(String text, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                continue;
            }
            int count = Integer.parseInt(matcher.group(1));
            if (count >= MIN_ROOMS && count <= MAX_ROOMS) {
                return count;
            }
        }
        return null;
    }

    PropertyType extractPropertyType(String text) {
        for (Map.Entry<PropertyType, Pattern> entry : PROPERTY_TYPE_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static List<Pattern> roomPatterns(String words) {
        return List.of(
                // "2 recámaras"
                Pattern.compile("(?<!\\d)(\\d{1,2})\\s*" + words, PATTERN_FLAGS),
                // "recámaras: 2"
                Pattern.compile(NOT_AFTER_LETTER + words + "\\s*:?\\s*(\\d{1,2})(?!\\d)", PATTERN_FLAGS));
    }

    private static Pattern wholeWord(String expression) {
        return Pattern.compile(NOT_AFTER_LETTER + expression + NOT_BEFORE_LETTER, PATTERN_FLAGS);
    }

    private static Map<String, Pattern> vocabularyPatterns(List<String> vocabulary) {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (String term : vocabulary) {
            if (term != null && !term.isBlank()) {
                patterns.put(term, wholeWord(Pattern.quote(term.trim())));
            }
        }
        return patterns;
    }
}
