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

package org.fireflyframework.wrangler.ranking;

import org.fireflyframework.wrangler.model.TransformationCandidate;

/**
 * Port interface for candidate scoring strategies used by the {@link TransformationRanker}.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * public class CompletenessFirstPolicy implements RankingPolicy {
 *
 *     @Override
 *     public double score(TransformationCandidate candidate) {
 *         return candidate.getQualityDelta().getImprovement().getCompleteness();
 *     }
 *
 *     @Override
 *     public String reasoning(TransformationCandidate candidate, double score) {
 *         return "Completeness improved by " + score;
 *     }
 *
 *     @Override
 *     public String getPolicyName() {
 *         return "completeness-first";
 *     }
 * }
 * }</pre>
 */
public interface RankingPolicy {

    /**
     * Computes the composite score of a candidate; higher ranks first.
     *
     * @param candidate the candidate to score
     * @return the score
     */
    double score(TransformationCandidate candidate);

    /**
     * Explains a score in human-readable form.
     *
     * @param candidate the scored candidate
     * @param score     the score computed by {@link #score}
     * @return the explanation
     */
    String reasoning(TransformationCandidate candidate, double score);

    /**
     * Returns the name of this policy.
     *
     * @return the policy name
     */
    String getPolicyName();
}
