/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.wrangler.model;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Statistical summary of a dataset, keyed by column name in column order.
 */
@Data
@Builder
@Jacksonized
public class DataProfile {

    @Builder.Default
    private final Instant timestamp = Instant.now();
    private final int rowCount;
    private final int columnCount;
    @Builder.Default
    private final Map<String, ColumnProfile> columns = new LinkedHashMap<>();
    private final double overallMissingPercentage;
    private final int duplicateRows;

    /**
     * Creates a profile describing no columns at all.
     *
     * @return an empty profile
     */
    public static DataProfile empty() {
        return DataProfile.builder().build();
    }

    public Optional<ColumnProfile> findColumn(String name) {
        return Optional.ofNullable(columns.get(name));
    }
}
