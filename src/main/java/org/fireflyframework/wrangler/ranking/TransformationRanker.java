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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wrangler.exception.RankingException;
import org.fireflyframework.wrangler.model.RankedTransformation;
import org.fireflyframework.wrangler.model.TransformationCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders candidates by the score of a pluggable {@link RankingPolicy}.
 *
 * <p>Sorting is descending and stable, so equal scores keep their input order; NaN scores
 * sort last. Ranks are 1-based and contiguous.</p>
 */
@Slf4j
public class TransformationRanker {

    private volatile RankingPolicy policy;

    public TransformationRanker() {
        this(null);
    }

    public TransformationRanker(RankingPolicy policy) {
        this.policy = policy;
    }

    public void setPolicy(RankingPolicy policy) {
        this.policy = policy;
        log.info("Ranking policy set to '{}'", policy == null ? "none" : policy.getPolicyName());
    }

    public RankingPolicy getPolicy() {
        return policy;
    }

    public List<RankedTransformation> rank(List<TransformationCandidate> candidates) {
        return rank(candidates, 0);
    }

    /**
     * Ranks candidates.
     *
     * @param candidates the candidates, in generation order
     * @param topK       how many ranked entries to keep, {@code 0} for all
     * @return the ranking, best first
     * @throws RankingException if no policy is set or a candidate lacks its quality delta
     */
    public List<RankedTransformation> rank(List<TransformationCandidate> candidates, int topK) {
        RankingPolicy active = policy;
        if (active == null) {
            throw new RankingException("No ranking policy set");
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<Scored> scored = new ArrayList<>(candidates.size());
        for (TransformationCandidate candidate : candidates) {
            if (candidate == null || candidate.getQualityDelta() == null || candidate.getTransformation() == null) {
                throw new RankingException("Candidate is missing its transformation or quality delta",
                        Map.of("position", scored.size()));
            }
            scored.add(new Scored(candidate, active.score(candidate)));
        }
        scored.sort(Comparator.comparingDouble(Scored::sortKey).reversed());

        int limit = topK > 0 ? Math.min(topK, scored.size()) : scored.size();
        List<RankedTransformation> ranked = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            Scored entry = scored.get(i);
            ranked.add(RankedTransformation.builder()
                    .rank(i + 1)
                    .candidate(entry.candidate())
                    .compositeScore(entry.score())
                    .reasoning(active.reasoning(entry.candidate(), entry.score()))
                    .build());
        }
        log.debug("Ranked {} candidates with policy '{}'", candidates.size(), active.getPolicyName());
        return List.copyOf(ranked);
    }

    private record Scored(TransformationCandidate candidate, double score) {

        double sortKey() {
            return Double.isNaN(score) ? Double.NEGATIVE_INFINITY : score;
        }
    }
}
