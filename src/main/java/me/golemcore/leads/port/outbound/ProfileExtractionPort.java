package me.golemcore.leads.port.outbound;

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

import java.util.List;

/**
 * Port for the context-aware extraction path. Receives the whole ordered
 * conversation (both roles) and returns a candidate profile with the same
 * field set as the heuristic path, optionally including a confidence.
 *
 * <p>
 * Implementations own their timeout and retry behavior. A call either returns
 * a profile or throws; there are no partial results.
 */
public interface ProfileExtractionPort {

    /**
     * Extract a candidate profile from the conversation.
     *
     * @param turns
     *            conversation turns ordered by position
     * @return extracted profile, possibly empty
     * @throws ProfileExtractionException
     *             if the extraction could not be performed
     */
    CandidateProfile extract(List<ConversationTurn> turns);
}
