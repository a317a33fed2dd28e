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
import java.util.Map;

/**
 * A scored catalog entry. Recomputed on every matching call and never stored.
 *
 * <p>
 * {@code scoreComponents} only holds the dimensions the profile specified, in
 * scoring order; {@code reasons} is derived from those components.
 */
@Value
@Builder
public class PropertyMatch {

    long propertyId;
    String title;
    long price;
    String city;
    String area;
    Integer bedrooms;
    Integer bathrooms;
    int score;
    Map<String, Integer> scoreComponents;
    List<String> reasons;
}
