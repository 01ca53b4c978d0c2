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

import java.util.List;
import java.util.OptionalDouble;

/**
 * Snapshot of the four quality dimensions of a dataset plus their weighted composite.
 *
 * <p>Scores produced by the scorer lie in {@code [0, 1]}. Instances built by
 * {@link #minus(QualityMetrics)} hold signed differences instead.</p>
 */
@Data
@Builder
@Jacksonized
public class QualityMetrics {

    public static final String COMPLETENESS = "completeness";
    public static final String CONSISTENCY = "consistency";
    public static final String VALIDITY = "validity";
    public static final String UNIQUENESS = "uniqueness";
    public static final String OVERALL = "overall";

    /** The four component dimensions, in canonical order. */
    public static final List<String> DIMENSIONS = List.of(COMPLETENESS, CONSISTENCY, VALIDITY, UNIQUENESS);

    private final double completeness;
    private final double consistency;
    private final double validity;
    private final double uniqueness;
    private final double overall;

    /**
     * Looks up a dimension, or {@code overall}, by name.
     *
     * @param name the metric name
     * @return the value, or empty for an unknown name
     */
    public OptionalDouble metricValue(String name) {
        if (name == null) {
            return OptionalDouble.empty();
        }
        return switch (name) {
            case COMPLETENESS -> OptionalDouble.of(completeness);
            case CONSISTENCY -> OptionalDouble.of(consistency);
            case VALIDITY -> OptionalDouble.of(validity);
            case UNIQUENESS -> OptionalDouble.of(uniqueness);
            case OVERALL -> OptionalDouble.of(overall);
            default -> OptionalDouble.empty();
        };
    }

    /**
     * Component-wise {@code this - other}, including {@code overall}.
     */
    public QualityMetrics minus(QualityMetrics other) {
        return QualityMetrics.builder()
                .completeness(completeness - other.completeness)
                .consistency(consistency - other.consistency)
                .validity(validity - other.validity)
                .uniqueness(uniqueness - other.uniqueness)
                .overall(overall - other.overall)
                .build();
    }
}
