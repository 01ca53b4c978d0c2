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

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wrangler.exception.OrchestrationException;
import org.fireflyframework.wrangler.model.PipelineState;
import org.fireflyframework.wrangler.model.PipelineStep;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Applies the configured {@link FailureStrategy} to pipeline steps.
 *
 * <p>Every handled failure is appended to the recovery history. Retries are confined to the
 * single operation handed to {@link #execute}, which must be a cold publisher so that a
 * resubscription re-runs it.</p>
 */
@Slf4j
public class FailureRecovery {

    private final FailureStrategy strategy;
    private final RetrySettings retrySettings;
    private final List<RecoveryAction> history = new CopyOnWriteArrayList<>();

    public FailureRecovery() {
        this(FailureStrategy.ABORT, RetrySettings.defaults());
    }

    public FailureRecovery(FailureStrategy strategy, RetrySettings retrySettings) {
        this.strategy = strategy;
        this.retrySettings = retrySettings;
        log.info("Initialized FailureRecovery: strategy={}, maxRetries={}, initialDelay={}, backoffFactor={}, maxDelay={}",
                strategy, retrySettings.getMaxRetries(), retrySettings.getInitialDelay(),
                retrySettings.getBackoffFactor(), retrySettings.getMaxDelay());
    }

    /**
     * Runs a step operation under the configured strategy.
     *
     * <p>With {@link FailureStrategy#SKIP} a failure completes empty and the error note is
     * written to {@code state}; the caller must then leave the step uncompleted.</p>
     *
     * @param step      the step being executed
     * @param state     the run state receiving error notes
     * @param operation the step operation
     * @param fallback  supplies the degraded output used by {@link FailureStrategy#FALLBACK}
     * @param <T>       the step output type
     * @return the step output, the fallback output, or empty when skipped
     */
    public <T> Mono<T> execute(PipelineStep step, PipelineState state, Mono<T> operation, Supplier<T> fallback) {
        return switch (strategy) {
            case RETRY -> operation
                    .transformDeferred(RetryOperator.of(retryFor(step)))
                    .doOnError(e -> record(step, e));
            case ABORT -> operation.onErrorResume(e -> {
                record(step, e);
                return Mono.error(new OrchestrationException("Step " + step + " failed, aborting run",
                        Map.of("step", step), e));
            });
            case FALLBACK -> operation.onErrorResume(e -> {
                record(step, e);
                log.warn("Step {} failed, continuing with fallback output: {}", step, describe(e));
                return Mono.fromSupplier(fallback);
            });
            case SKIP -> operation.onErrorResume(e -> {
                record(step, e);
                log.warn("Step {} failed, skipping it: {}", step, describe(e));
                state.setError("Step " + step + " skipped: " + describe(e));
                return Mono.empty();
            });
        };
    }

    public FailureStrategy getStrategy() {
        return strategy;
    }

    public RetrySettings getRetrySettings() {
        return retrySettings;
    }

    public List<RecoveryAction> getHistory() {
        return List.copyOf(new ArrayList<>(history));
    }

    public void clearHistory() {
        history.clear();
    }

    private Retry retryFor(PipelineStep step) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retrySettings.getMaxRetries() + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        retrySettings.getInitialDelay().toMillis(),
                        retrySettings.getBackoffFactor(),
                        retrySettings.getMaxDelay().toMillis()))
                .retryExceptions(Exception.class)
                .build();
        Retry retry = Retry.of("wrangler-" + step.name().toLowerCase(), config);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying step {} (attempt {}): {}",
                step, event.getNumberOfRetryAttempts(), describe(event.getLastThrowable())));
        return retry;
    }

    private void record(PipelineStep step, Throwable error) {
        history.add(RecoveryAction.builder()
                .strategy(strategy)
                .step(step)
                .error(describe(error))
                .build());
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
