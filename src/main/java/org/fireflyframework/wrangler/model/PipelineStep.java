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

import java.util.Optional;

/**
 * Steps of a pipeline run.
 *
 * <p>A run moves through {@code PROFILING -> GENERATION -> VALIDATION -> RANKING -> EXECUTION}.
 * Candidate execution and scoring happen inside the {@link #VALIDATION} pass; {@link #EXECUTION}
 * is the final re-application of the best candidate.</p>
 */
public enum PipelineStep {

    PROFILING,
    GENERATION,
    VALIDATION,
    EXECUTION,
    SCORING,
    RANKING;

    /**
     * Returns the step a run moves to after this one, empty after the last step.
     */
    public Optional<PipelineStep> next() {
        return switch (this) {
            case PROFILING -> Optional.of(GENERATION);
            case GENERATION -> Optional.of(VALIDATION);
            case VALIDATION, SCORING -> Optional.of(RANKING);
            case RANKING -> Optional.of(EXECUTION);
            case EXECUTION -> Optional.empty();
        };
    }
}
