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
 * Exponential backoff settings for the {@link FailureStrategy#RETRY} strategy.
 *
 * <p>The delay before retry {@code n} (1-based) is
 * {@code min(initialDelay * backoffFactor^(n-1), maxDelay)}.</p>
 */
@Data
@Builder
public class RetrySettings {

    @Builder.Default
    private final int maxRetries = 3;
    @Builder.Default
    private final Duration initialDelay = Duration.ofSeconds(1);
    @Builder.Default
    private final double backoffFactor = 2.0;
    @Builder.Default
    private final Duration maxDelay = Duration.ofSeconds(60);

    public static RetrySettings defaults() {
        return RetrySettings.builder().build();
    }
}
