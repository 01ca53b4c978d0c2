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

import org.fireflyframework.wrangler.model.QualityWeights;
import org.fireflyframework.wrangler.model.TransformationCandidate;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.fireflyframework.wrangler.ranking.RankingFixtures.candidate;
import static org.fireflyframework.wrangler.ranking.RankingFixtures.metrics;
import static org.fireflyframework.wrangler.ranking.RankingFixtures.uniform;

/**
 * Unit tests for {@link CompositeScorePolicy}.
 */
class CompositeScorePolicyTest {

    private final TransformationCandidate filled =
            candidate("fill", uniform(0.5), metrics(0.7, 0.5, 0.5, 0.5, 0.55));

    @Test
    void score_shouldBlendWeightedImprovementWithFinalQuality() {
        // Given
        CompositeScorePolicy policy = new CompositeScorePolicy();

        // When
        double score = policy.score(filled);

        // Then
        assertThat(score).isCloseTo(0.7 * 0.05 + 0.3 * 0.55, within(1e-9));
    }

    @Test
    void score_shouldHonourCustomWeights() {
        // Given
        CompositeScorePolicy policy = new CompositeScorePolicy(new QualityWeights(1.0, 0.0, 0.0, 0.0));

        // When
        double score = policy.score(filled);

        // Then
        assertThat(score).isCloseTo(0.7 * 0.2 + 0.3 * 0.55, within(1e-9));
    }

    @Test
    void reasoning_shouldDescribeChangesAndOverallQuality() {
        // Given
        CompositeScorePolicy policy = new CompositeScorePolicy();

        // When
        String reasoning = policy.reasoning(filled, policy.score(filled));

        // Then
        assertThat(reasoning).isEqualTo("Transformation 'fill_missing' on columns [age] achieved composite score 0.200. "
                + "Quality improvements: completeness +0.200. Overall quality: 50.0% -> 55.0%.");
        assertThat(policy.getPolicyName()).isEqualTo("composite");
    }
}
