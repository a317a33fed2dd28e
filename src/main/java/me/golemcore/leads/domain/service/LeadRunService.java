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

import me.golemcore.leads.domain.model.ConversationTurn;
import me.golemcore.leads.domain.model.LeadRunResult;
import me.golemcore.leads.domain.model.PropertyMatch;
import me.golemcore.leads.domain.model.QualifiedProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs a conversation end to end: qualification, then matching when the
 * qualified profile names a city.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeadRunService {

    private final LeadQualificationService qualificationService;
    private final PropertyMatchingService matchingService;

    public LeadRunResult run(List<ConversationTurn> turns) {
        QualifiedProfile qualification = qualificationService.qualify(turns);

        List<PropertyMatch> matches = qualification.getProfile().hasCity()
                ? matchingService.match(qualification.getProfile())
                : List.of();

        log.debug("[Run] needsReview={} matches={}", qualification.isNeedsReview(), matches.size());
        return LeadRunResult.builder()
                .qualification(qualification)
                .matches(matches)
                .build();
    }
}
