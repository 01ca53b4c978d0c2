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

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Builds the circuit breakers guarding repeatedly invoked pipeline operations.
 *
 * <p>The breaker opens after {@code failureThreshold} consecutive failures, rejects calls until
 * {@code cooldown} has elapsed, then lets one trial call decide whether it closes again.</p>
 */
@Slf4j
public final class CircuitBreakers {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(60);

    private CircuitBreakers() {
    }

    public static CircuitBreaker create(String name, int failureThreshold, Duration cooldown) {
        return create(name, failureThreshold, cooldown, List.of());
    }

    /**
     * Builds a breaker that neither counts nor trips on the given exception types. They still
     * propagate to the caller.
     *
     * @param name             breaker name, used in state-transition logs
     * @param failureThreshold consecutive failures that open the breaker
     * @param cooldown         time the breaker stays open before a trial call
     * @param ignored          exception types that are outcomes of the call rather than faults
     * @return the breaker
     */
    public static CircuitBreaker create(String name, int failureThreshold, Duration cooldown,
                                        List<Class<? extends Throwable>> ignored) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(cooldown)
                .permittedNumberOfCallsInHalfOpenState(1)
                .recordExceptions(Exception.class)
                .ignoreExceptions(ignored.toArray(new Class[0]))
                .build();
        CircuitBreaker circuitBreaker = CircuitBreaker.of(name, config);
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Circuit breaker '{}' changed state: {}", name, event.getStateTransition()));
        return circuitBreaker;
    }
}
