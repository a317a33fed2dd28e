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
import me.golemcore.leads.domain.model.ProfileField;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines the two candidate profiles into the final one.
 *
 * <p>
 * The heuristic profile is taken in full. A model value is only added for a
 * field the heuristic left empty and the cross-validator did not flag, so on
 * conflicting fields the heuristic value always wins.
 *
 * @since 1.0
 */
@Component
public class ProfileMerger {

    public CandidateProfile merge(CandidateProfile heuristic, CandidateProfile model,
            List<Discrepancy> discrepancies) {
        Set<String> conflicting = discrepancies.stream()
                .map(Discrepancy::getField)
                .collect(Collectors.toSet());

        CandidateProfile.CandidateProfileBuilder merged = heuristic.toBuilder();
        for (ProfileField field : ProfileField.values()) {
            Object modelValue = field.get(model);
            if (modelValue == null || heuristic.has(field) || conflicting.contains(field.getKey())) {
                continue;
            }
            field.set(merged, modelValue);
        }
        return merged.build();
    }
}
