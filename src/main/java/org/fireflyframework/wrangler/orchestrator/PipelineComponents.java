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

package org.fireflyframework.wrangler.orchestrator;

import org.fireflyframework.wrangler.profiling.DataProfiler;
import org.fireflyframework.wrangler.profiling.DefaultDataProfiler;
import org.fireflyframework.wrangler.quality.QualityScorer;
import org.fireflyframework.wrangler.ranking.TransformationRanker;
import org.fireflyframework.wrangler.ranking.policies.CompositeScorePolicy;
import org.fireflyframework.wrangler.transform.CandidateGenerator;
import org.fireflyframework.wrangler.transform.TransformationExecutor;
import org.fireflyframework.wrangler.validation.TransformationValidator;

/**
 * The collaborators a {@link PipelineOrchestrator} drives.
 */
public record PipelineComponents(
        DataProfiler profiler,
        CandidateGenerator generator,
        TransformationExecutor executor,
        TransformationValidator validator,
        QualityScorer scorer,
        TransformationRanker ranker
) {

    /**
     * Components with default settings and the composite ranking policy.
     */
    public static PipelineComponents defaults() {
        return new PipelineComponents(
                new DefaultDataProfiler(),
                new CandidateGenerator(),
                new TransformationExecutor(),
                new TransformationValidator(),
                new QualityScorer(),
                new TransformationRanker(new CompositeScorePolicy()));
    }
}
