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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A listing of the catalog. Owned by the catalog collaborator and read-only
 * for qualification and matching.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogEntry {

    private long id;
    private String title;
    private long price;
    private String city;
    private String area;
    private Integer bedrooms;
    private Integer bathrooms;
    private PropertyType propertyType;

    @Builder.Default
    private boolean active = true;
}
