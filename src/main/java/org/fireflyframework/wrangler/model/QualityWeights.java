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

import org.fireflyframework.wrangler.exception.ScoringException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weights of the four quality dimensions in the composite score.
 *
 * <p>Components must be non-negative and sum to 1.0 within {@value #TOLERANCE}.</p>
 */
public record QualityWeights(double completeness, double consistency, double validity, double uniqueness) {

    public static final double TOLERANCE = 1e-6;

    public QualityWeights {
        if (completeness < 0 || consistency < 0 || validity < 0 || uniqueness < 0) {
            throw new ScoringException("Weights must be non-negative",
                    Map.of("completeness", completeness, "consistency", consistency,
                            "validity", validity, "uniqueness", uniqueness));
        }
        double total = completeness + consistency + validity + uniqueness;
        if (Double.isNaN(total) || Math.abs(total - 1.0) > TOLERANCE) {
            throw new ScoringException("Weights must sum to 1.0, got " + total);
        }
    }

    public static QualityWeights equal() {
        return new QualityWeights(0.25, 0.25, 0.25, 0.25);
    }

    /**
     * Builds weights from a name-keyed map; absent dimensions weigh zero.
     */
    public static QualityWeights of(Map<String, Double> weights) {
        return new QualityWeights(
                weights.getOrDefault(QualityMetrics.COMPLETENESS, 0.0),
                weights.getOrDefault(QualityMetrics.CONSISTENCY, 0.0),
                weights.getOrDefault(QualityMetrics.VALIDITY, 0.0),
                weights.getOrDefault(QualityMetrics.UNIQUENESS, 0.0));
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(QualityMetrics.COMPLETENESS, completeness);
        map.put(QualityMetrics.CONSISTENCY, consistency);
        map.put(QualityMetrics.VALIDITY, validity);
        map.put(QualityMetrics.UNIQUENESS, uniqueness);
        return map;
    }

    public double weightedSum(QualityMetrics metrics) {
        return completeness * metrics.getCompleteness()
                + consistency * metrics.getConsistency()
                + validity * metrics.getValidity()
                + uniqueness * metrics.getUniqueness();
    }
}
