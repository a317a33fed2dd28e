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
import me.golemcore.leads.domain.model.Discrepancy;
import me.golemcore.leads.domain.model.DiscrepancySeverity;
import me.golemcore.leads.domain.model.ProfileField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compares the model and heuristic profiles field by field and records every
 * disagreement.
 *
 * <p>
 * Only fields asserted by both profiles are compared; a field known to one
 * path only is never a disagreement. Numeric fields carry the relative
 * difference, categorical fields are compared ignoring case.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ProfileCrossValidator {

    /** Numeric disagreements above this relative difference are high severity. */
    static final double HIGH_SEVERITY_DIFF_PCT = 30.0;

    public List<Discrepancy> compare(CandidateProfile model, CandidateProfile heuristic) {
        List<Discrepancy> discrepancies = new ArrayList<>();

        for (ProfileField field : ProfileField.values()) {
            if (field.getKind() == ProfileField.Kind.NUMERIC) {
                compareNumeric(field, model, heuristic, discrepancies);
            }
        }
        for (ProfileField field : ProfileField.values()) {
            if (field.getKind() == ProfileField.Kind.CATEGORICAL) {
                compareCategorical(field, model, heuristic, discrepancies);
            }
        }

        if (!discrepancies.isEmpty()) {
            log.info("[CrossValidator] {} discrepancies: {}", discrepancies.size(),
                    discrepancies.stream().map(Discrepancy::getField).toList());
        }
        return discrepancies;
    }

    private void compareNumeric(ProfileField field, CandidateProfile model, CandidateProfile heuristic,
            List<Discrepancy> discrepancies) {
        Object modelValue = field.get(model);
        Object heuristicValue = field.get(heuristic);
        if (modelValue == null || heuristicValue == null) {
            return;
        }

        double a = ((Number) modelValue).doubleValue();
        double b = ((Number) heuristicValue).doubleValue();
        if (a == b) {
            return;
        }

        double diffPct = diffPct(a, b);
        discrepancies.add(Discrepancy.builder()
                .field(field.getKey())
                .modelValue(modelValue)
                .heuristicValue(heuristicValue)
                .diffPct(diffPct)
                .severity(diffPct > HIGH_SEVERITY_DIFF_PCT ? DiscrepancySeverity.HIGH : DiscrepancySeverity.MEDIUM)
                .build());
    }

    private void compareCategorical(ProfileField field, CandidateProfile model, CandidateProfile heuristic,
            List<Discrepancy> discrepancies) {
        Object modelValue = field.get(model);
        Object heuristicValue = field.get(heuristic);
        if (modelValue == null || heuristicValue == null) {
            return;
        }

        String a = modelValue.toString().toLowerCase(Locale.ROOT);
        String b = heuristicValue.toString().toLowerCase(Locale.ROOT);
        if (a.equals(b)) {
            return;
        }

        discrepancies.add(Discrepancy.builder()
                .field(field.getKey())
                .modelValue(modelValue)
                .heuristicValue(heuristicValue)
                .severity(DiscrepancySeverity.MEDIUM)
                .build());
    }

    /**
     * Relative difference against the larger value, in percent, rounded to one
     * decimal.
     */
    static double diffPct(double a, double b) {
        double pct = Math.abs(a - b) / Math.max(Math.abs(a), Math.abs(b)) * 100.0;
        return Math.round(pct * 10.0) / 10.0;
    }
}
