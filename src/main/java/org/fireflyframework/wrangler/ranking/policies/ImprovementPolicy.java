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

package org.fireflyframework.wrangler.ranking.policies;

import org.fireflyframework.wrangler.model.QualityDelta;
import org.fireflyframework.wrangler.model.QualityMetrics;
import org.fireflyframework.wrangler.model.TransformationCandidate;
import org.fireflyframework.wrangler.ranking.AbstractRankingPolicy;

/**
 * Scores candidates by the change of one primary metric.
 *
 * <p>{@code overall}, and any unknown metric name, use the composite delta.</p>
 */
public class ImprovementPolicy extends AbstractRankingPolicy {

    public static final String NAME = "improvement";

    private final String primaryMetric;

    public ImprovementPolicy() {
        this(QualityMetrics.OVERALL);
    }

    public ImprovementPolicy(String primaryMetric) {
        this.primaryMetric = QualityMetrics.DIMENSIONS.contains(primaryMetric) ? primaryMetric : QualityMetrics.OVERALL;
    }

    @Override
    public double score(TransformationCandidate candidate) {
        QualityDelta delta = candidate.getQualityDelta();
        if (QualityMetrics.OVERALL.equals(primaryMetric)) {
            return delta.getCompositeDelta();
        }
        return delta.getImprovement().metricValue(primaryMetric).orElse(delta.getCompositeDelta());
    }

    @Override
    public String reasoning(TransformationCandidate candidate, double score) {
        QualityDelta delta = candidate.getQualityDelta();
        return describe(candidate.getTransformation())
                + " provides " + primaryMetric + " improvement of " + signed(score) + ". "
                + "Metric changes: " + changes(delta.getImprovement()) + ". "
                + "Composite delta: " + signed(delta.getCompositeDelta()) + ".";
    }

    public String getPrimaryMetric() {
        return primaryMetric;
    }

    @Override
    public String getPolicyName() {
        return NAME;
    }
}
