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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Run-level settings of a {@link PipelineOrchestrator}.
 *
 * <p>A {@code workerConcurrency} of {@code 0} uses the size of Reactor's parallel scheduler.</p>
 */
@Data
@Builder
public class OrchestratorSettings {

    @Builder.Default
    private final boolean enableRanking = true;
    @Builder.Default
    private final int rankingTopK = 0;
    @Builder.Default
    private final int workerConcurrency = 0;
    @Builder.Default
    private final boolean checkpointRequired = true;
    @Builder.Default
    private final boolean circuitBreakerEnabled = true;
    @Builder.Default
    private final int circuitBreakerFailureThreshold = CircuitBreakers.DEFAULT_FAILURE_THRESHOLD;
    @Builder.Default
    private final Duration circuitBreakerCooldown = CircuitBreakers.DEFAULT_COOLDOWN;

    public static OrchestratorSettings defaults() {
        return OrchestratorSettings.builder().build();
    }
}
