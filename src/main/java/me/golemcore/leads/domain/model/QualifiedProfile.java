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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one qualification run: the merged profile together with the
 * evidence it was derived from and the review decision.
 *
 * <p>
 * {@code discrepancies} is always a list, empty when both paths agree, so
 * downstream consumers can rely on array semantics.
 */
@Value
@Builder
public class QualifiedProfile {

    CandidateProfile profile;

    @Builder.Default
    List<Discrepancy> discrepancies = List.of();

    boolean needsReview;

    /** Wall-clock time of the run in milliseconds, never below 1. */
    long durationMs;

    @Builder.Default
    QualificationStatus status = QualificationStatus.QUALIFIED;

    CandidateProfile heuristicProfile;
    CandidateProfile modelProfile;
    boolean modelExtractionFailed;
}
