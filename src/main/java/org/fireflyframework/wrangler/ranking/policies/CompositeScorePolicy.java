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
import org.fireflyframework.wrangler.model.QualityWeights;
import org.fireflyframework.wrangler.model.TransformationCandidate;
import org.fireflyframework.wrangler.ranking.AbstractRankingPolicy;

/**
 * Balances improvement against final quality:
 * {@code 0.7 * weighted improvement + 0.3 * overall quality after}.
 */
public class CompositeScorePolicy extends AbstractRankingPolicy {

    public static final String NAME = "composite";

    static final double IMPROVEMENT_SHARE = 0.7;
    static final double FINAL_QUALITY_SHARE = 0.3;

    private final QualityWeights weights;

    public CompositeScorePolicy() {
        this(QualityWeights.equal());
    }

    public CompositeScorePolicy(QualityWeights weights) {
        this.weights = weights;
    }

    @Override
    public double score(TransformationCandidate candidate) {
        QualityDelta delta = candidate.getQualityDelta();
        return IMPROVEMENT_SHARE * weights.weightedSum(delta.getImprovement())
                + FINAL_QUALITY_SHARE * delta.getAfter().getOverall();
    }

    @Override
    public String reasoning(TransformationCandidate candidate, double score) {
        QualityDelta delta = candidate.getQualityDelta();
        return describe(candidate.getTransformation())
                + " achieved composite score " + decimal(score) + ". "
                + "Quality improvements: " + changes(delta.getImprovement()) + ". "
                + "Overall quality: " + percent(delta.getBefore().getOverall())
                + " -> " + percent(delta.getAfter().getOverall()) + ".";
    }

    @Override
    public String getPolicyName() {
        return NAME;
    }
}
