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
import me.golemcore.leads.domain.model.Discrepancy;
import me.golemcore.leads.domain.model.QualificationStatus;
import me.golemcore.leads.domain.model.QualifiedProfile;
import me.golemcore.leads.port.outbound.ProfileExtractionPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Qualifies a lead from its conversation using two independent extraction
 * paths.
 *
 * <p>
 * Pipeline:
 * <ol>
 * <li><b>Model extraction</b> - context-aware, sees every turn; a failure is
 * logged and replaced by an empty profile</li>
 * <li><b>Heuristic extraction</b> - pattern-based, sees user turns only</li>
 * <li><b>Cross-validation</b> - field-by-field discrepancies</li>
 * <li><b>Merge</b> - heuristic wins on conflicting fields</li>
 * <li><b>Review decision</b> - any high severity discrepancy, or any relative
 * difference above 20%, requires a human</li>
 * </ol>
 *
 * <p>
 * The service keeps no state between calls; concurrent qualifications of
 * independent conversations need no locking.
 *
 * @since 1.0
 * @see HeuristicProfileExtractor
 * @see ProfileCrossValidator
 * @see ProfileMerger
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeadQualificationService {

    /**
     * Review trigger. Deliberately lower than the high severity threshold, so a
     * medium discrepancy between 20% and 30% still asks for review.
     */
    static final double REVIEW_DIFF_PCT = 20.0;

    private final ProfileExtractionPort modelExtractor;
    private final HeuristicProfileExtractor heuristicExtractor;
    private final ProfileCrossValidator crossValidator;
    private final ProfileMerger merger;

    public QualifiedProfile qualify(List<ConversationTurn> turns) {
        long startNanos = System.nanoTime();

        List<ConversationTurn> ordered = turns.stream()
                .sorted(Comparator.comparingInt(ConversationTurn::getPosition))
                .toList();

        ModelExtraction model = extractFromModel(ordered);
        CandidateProfile heuristic = heuristicExtractor.extract(ordered);

        List<Discrepancy> discrepancies = List.copyOf(crossValidator.compare(model.profile(), heuristic));
        CandidateProfile merged = merger.merge(heuristic, model.profile(), discrepancies);
        boolean needsReview = requiresReview(discrepancies);

        long durationMs = Math.max((System.nanoTime() - startNanos) / 1_000_000, 1);

        QualifiedProfile result = QualifiedProfile.builder()
                .profile(merged)
                .discrepancies(discrepancies)
                .needsReview(needsReview)
                .durationMs(durationMs)
                .status(QualificationStatus.QUALIFIED)
                .heuristicProfile(heuristic)
                .modelProfile(model.profile())
                .modelExtractionFailed(model.failed())
                .build();

        log.info("[Qualifier] event=lead_qualified turns={} profile={} discrepancies={} needsReview={} "
                + "modelFailed={} durationMs={}",
                ordered.size(), merged, discrepancies.size(), needsReview, model.failed(), durationMs);
        return result;
    }

    private ModelExtraction extractFromModel(List<ConversationTurn> turns) {
        try {
            CandidateProfile profile = modelExtractor.extract(turns);
            log.info("[Qualifier] Model extraction: {}", profile);
            return new ModelExtraction(profile != null ? profile : CandidateProfile.empty(), false);
        } catch (RuntimeException e) {
            log.error("[Qualifier] Model extraction failed, continuing heuristic-only: {}", e.getMessage());
            return new ModelExtraction(CandidateProfile.empty(), true);
        }
    }

    static boolean requiresReview(List<Discrepancy> discrepancies) {
        return discrepancies.stream().anyMatch(d -> d.isHighSeverity()
                || (d.getDiffPct() != null && d.getDiffPct() > REVIEW_DIFF_PCT));
    }

    private record ModelExtraction(CandidateProfile profile, boolean failed) {
    }
}
