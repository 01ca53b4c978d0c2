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

import org.fireflyframework.wrangler.exception.OrchestrationException;
import org.fireflyframework.wrangler.model.PipelineState;
import org.fireflyframework.wrangler.model.PipelineStep;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FailureRecovery}.
 */
class FailureRecoveryTest {

    private static final RetrySettings FAST_RETRIES = RetrySettings.builder()
            .maxRetries(3)
            .initialDelay(Duration.ofMillis(10))
            .backoffFactor(2.0)
            .maxDelay(Duration.ofMillis(50))
            .build();

    private final PipelineState state = new PipelineState();

    private static Mono<String> failingTimes(AtomicInteger attempts, int failures) {
        return Mono.fromCallable(() -> {
            if (attempts.incrementAndGet() <= failures) {
                throw new IllegalStateException("attempt " + attempts.get() + " failed");
            }
            return "ok";
        });
    }

    @Test
    void retry_shouldSucceedAfterTransientFailures() {
        // Given
        FailureRecovery recovery = new FailureRecovery(FailureStrategy.RETRY, FAST_RETRIES);
        AtomicInteger attempts = new AtomicInteger();

        // When & Then
        StepVerifier.create(recovery.execute(PipelineStep.PROFILING, state, failingTimes(attempts, 2), () -> "fallback"))
                .expectNext("ok")
                .verifyComplete();
        assertThat(attempts).hasValue(3);
        assertThat(recovery.getHistory()).isEmpty();
    }

    @Test
    void retry_shouldPropagateLastErrorWhenAttemptsAreExhausted() {
        // Given
        FailureRecovery recovery = new FailureRecovery(FailureStrategy.RETRY,
                RetrySettings.builder().maxRetries(2).initialDelay(Duration.ofMillis(10))
                        .maxDelay(Duration.ofMillis(20)).build());
        AtomicInteger attempts = new AtomicInteger();

        // When & Then
        StepVerifier.create(recovery.execute(PipelineStep.RANKING, state, failingTimes(attempts, 10), () -> "fallback"))
                .expectErrorMatches(e -> e instanceof IllegalStateException && e.getMessage().equals("attempt 3 failed"))
                .verify();
        assertThat(attempts).hasValue(3);
        assertThat(recovery.getHistory()).singleElement()
                .satisfies(action -> {
                    assertThat(action.getStrategy()).isEqualTo(FailureStrategy.RETRY);
                    assertThat(action.getStep()).isEqualTo(PipelineStep.RANKING);
                });
    }

    @Test
    void abort_shouldWrapFailureInOrchestrationException() {
        // Given
        FailureRecovery recovery = new FailureRecovery();
        Mono<String> failing = Mono.error(new IllegalStateException("boom"));

        // When & Then
        StepVerifier.create(recovery.execute(PipelineStep.GENERATION, state, failing, () -> "fallback"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(OrchestrationException.class)
                            .hasMessage("Step GENERATION failed, aborting run")
                            .hasCauseInstanceOf(IllegalStateException.class);
                    assertThat(((OrchestrationException) e).getDetails()).containsEntry("step", PipelineStep.GENERATION);
                })
                .verify();
        assertThat(recovery.getStrategy()).isEqualTo(FailureStrategy.ABORT);
        assertThat(recovery.getHistory()).extracting(RecoveryAction::getError).containsExactly("boom");
    }

    @Test
    void fallback_shouldEmitFallbackOutput() {
        // Given
        FailureRecovery recovery = new FailureRecovery(FailureStrategy.FALLBACK, RetrySettings.defaults());
        Mono<String> failing = Mono.error(new IllegalStateException("boom"));

        // When & Then
        StepVerifier.create(recovery.execute(PipelineStep.EXECUTION, state, failing, () -> "fallback"))
                .expectNext("fallback")
                .verifyComplete();
        assertThat(recovery.getHistory()).hasSize(1);
        assertThat(state.getError()).isNull();
    }

    @Test
    void skip_shouldCompleteEmptyAndNoteError() {
        // Given
        FailureRecovery recovery = new FailureRecovery(FailureStrategy.SKIP, RetrySettings.defaults());
        Mono<String> failing = Mono.error(new IllegalStateException("boom"));

        // When & Then
        StepVerifier.create(recovery.execute(PipelineStep.VALIDATION, state, failing, () -> "fallback"))
                .verifyComplete();
        assertThat(state.getError()).isEqualTo("Step VALIDATION skipped: boom");
    }

    @Test
    void execute_shouldPassThroughSuccessfulOperations() {
        // Given
        FailureRecovery recovery = new FailureRecovery(FailureStrategy.SKIP, RetrySettings.defaults());

        // When & Then
        StepVerifier.create(recovery.execute(PipelineStep.PROFILING, state, Mono.just("value"), () -> "fallback"))
                .expectNext("value")
                .verifyComplete();
        assertThat(recovery.getHistory()).isEmpty();
        assertThat(state.getError()).isNull();
    }

    @Test
    void clearHistory_shouldRemoveRecordedActions() {
        // Given
        FailureRecovery recovery = new FailureRecovery(FailureStrategy.FALLBACK, RetrySettings.defaults());
        recovery.execute(PipelineStep.EXECUTION, state, Mono.<String>error(new IllegalStateException("boom")),
                () -> "fallback").block();

        // When
        recovery.clearHistory();

        // Then
        assertThat(recovery.getHistory()).isEmpty();
    }
}
