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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A recorded disagreement between the model and heuristic profiles on one
 * field. {@code diffPct} is only set for numeric fields.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Discrepancy {

    String field;
    Object modelValue;
    Object heuristicValue;
    Double diffPct;
    DiscrepancySeverity severity;

    public boolean isHighSeverity() {
        return severity == DiscrepancySeverity.HIGH;
    }
}
