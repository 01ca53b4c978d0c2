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

package org.fireflyframework.wrangler.quality;

import lombok.Getter;
import org.fireflyframework.wrangler.model.QualityMetrics;
import org.fireflyframework.wrangler.model.QualityWeights;

/**
 * Combines the four quality dimensions into a weighted, clamped composite.
 */
@Getter
public class CompositeCalculator {

    private final QualityWeights weights;

    public CompositeCalculator() {
        this(QualityWeights.equal());
    }

    public CompositeCalculator(QualityWeights weights) {
        this.weights = weights;
    }

    public QualityMetrics combine(double completeness, double consistency, double validity, double uniqueness) {
        double overall = weights.completeness() * completeness
                + weights.consistency() * consistency
                + weights.validity() * validity
                + weights.uniqueness() * uniqueness;
        return QualityMetrics.builder()
                .completeness(completeness)
                .consistency(consistency)
                .validity(validity)
                .uniqueness(uniqueness)
                .overall(QualityMetric.clamp(overall))
                .build();
    }
}
