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

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.fireflyframework.wrangler.checkpoint.CheckpointStore;
import org.fireflyframework.wrangler.checkpoint.InMemoryCheckpointStore;
import org.fireflyframework.wrangler.event.PipelineStepEvent;
import org.fireflyframework.wrangler.exception.GenerationException;
import org.fireflyframework.wrangler.exception.OrchestrationException;
import org.fireflyframework.wrangler.exception.ProfilingException;
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.DataType;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.PipelineState;
import org.fireflyframework.wrangler.model.PipelineStep;
import org.fireflyframework.wrangler.model.QualityDelta;
import org.fireflyframework.wrangler.model.RankedTransformation;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.profiling.DataProfiler;
import org.fireflyframework.wrangler.profiling.DefaultDataProfiler;
import org.fireflyframework.wrangler.quality.QualityScorer;
import org.fireflyframework.wrangler.ranking.TransformationRanker;
import org.fireflyframework.wrangler.ranking.policies.CompositeScorePolicy;
import org.fireflyframework.wrangler.transform.CandidateGenerator;
import org.fireflyframework.wrangler.transform.TransformationExecutor;
import org.fireflyframework.wrangler.validation.TransformationValidator;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PipelineOrchestrator}.
 */
class PipelineOrchestratorTest {

    private static final List<PipelineStep> ALL_STEPS = List.of(PipelineStep.PROFILING, PipelineStep.GENERATION,
            PipelineStep.VALIDATION, PipelineStep.RANKING, PipelineStep.EXECUTION);

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore();

    private static Dataset customers() {
        return Dataset.builder()
                .column("age", DataType.INTEGER, 23L, 35L, null, 41L, 29L, null, 52L, 38L, 27L, 45L)
                .column("city", DataType.STRING, "NYC", "LA", "SF", "NYC", "LA", "LA", "SF", "NYC", "SF", "LA")
                .build();
    }

    private static Dataset numbersStoredAsText() {
        Dataset.Builder builder = Dataset.builder();
        for (String name : List.of("a", "b", "c")) {
            builder.column(name, DataType.STRING, "1", "2", "3", "4", "5", "6", "7", "8", "9", "abc");
        }
        return builder.build();
    }

    private static PipelineComponents components(DataProfiler profiler, CandidateGenerator generator) {
        return new PipelineComponents(profiler, generator, new TransformationExecutor(),
                new TransformationValidator(), new QualityScorer(), new TransformationRanker(new CompositeScorePolicy()));
    }

    private PipelineOrchestrator orchestrator(PipelineComponents components, FailureStrategy strategy) {
        return new PipelineOrchestrator(components, store, new FailureRecovery(strategy, RetrySettings.defaults()),
                OrchestratorSettings.defaults(), null);
    }

    private static DataProfiler failingProfiler() {
        DataProfiler profiler = mock(DataProfiler.class);
        when(profiler.profile(any())).thenThrow(new ProfilingException("profiler offline"));
        return profiler;
    }

    @Test
    void run_shouldRankCandidatesAndApplyTheBestOne() {
        // Given
        Dataset input = customers();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), store);

        // When
        PipelineResult result = orchestrator.run(input, "customers").block();

        // Then
        assertThat(result).isNotNull();
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getError()).isNull();
        assertThat(result.getProfile().getRowCount()).isEqualTo(10);
        assertThat(result.getState().getCompletedSteps()).containsExactlyElementsOf(ALL_STEPS);

        List<RankedTransformation> ranked = result.getRankedTransformations();
        assertThat(ranked).isNotEmpty();
        for (int i = 0; i < ranked.size(); i++) {
            RankedTransformation entry = ranked.get(i);
            assertThat(entry.getRank()).isEqualTo(i + 1);
            assertThat(entry.getCandidate().getValidationResult().isPassed()).isTrue();
            QualityDelta delta = entry.getCandidate().getQualityDelta();
            assertThat(delta.getCompositeDelta())
                    .isCloseTo(delta.getAfter().getOverall() - delta.getBefore().getOverall(), within(1e-12));
            if (i > 0) {
                assertThat(entry.getCompositeScore()).isLessThanOrEqualTo(ranked.get(i - 1).getCompositeScore());
            }
        }

        Transformation best = ranked.get(0).getCandidate().getTransformation();
        Dataset expected = new TransformationExecutor().execute(input, best).getData();
        assertThat(result.getData()).isEqualTo(expected);
        assertThat(store.exists("customers")).isTrue();
    }

    @Test
    void run_shouldDropCandidatesThatFailValidation() {
        // Given
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), store);

        // When
        PipelineResult result = orchestrator.run(customers(), "customers").block();

        // Then
        assertThat(result.getState().getCandidates())
                .extracting(candidate -> candidate.getTransformation().getDescription())
                .doesNotContain("One-hot encode city", "Fill missing values in age with constant 0");
    }

    @Test
    void run_shouldReturnInputWhenRankingIsDisabled() {
        // Given
        Dataset input = customers();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), store,
                new FailureRecovery(), OrchestratorSettings.builder().enableRanking(false).build(), null);

        // When
        PipelineResult result = orchestrator.run(input, "unranked").block();

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).isEqualTo(input);
        assertThat(result.getRankedTransformations()).isEmpty();
        assertThat(result.getState().getCompletedSteps()).doesNotContain(PipelineStep.RANKING);
    }

    @Test
    void run_shouldHonourTopK() {
        // Given
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), store,
                new FailureRecovery(), OrchestratorSettings.builder().rankingTopK(2).workerConcurrency(2).build(), null);

        // When
        PipelineResult result = orchestrator.run(customers(), "top-two").block();

        // Then
        assertThat(result.getRankedTransformations()).hasSize(2);
    }

    @Test
    void run_shouldReportAbortedStepAsFailedResult() {
        // Given
        PipelineOrchestrator orchestrator = orchestrator(
                components(failingProfiler(), new CandidateGenerator()), FailureStrategy.ABORT);

        // When & Then
        StepVerifier.create(orchestrator.run(customers(), "broken"))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isFalse();
                    assertThat(result.getError()).isEqualTo("Step PROFILING failed, aborting run");
                    assertThat(result.getState().getCompletedSteps()).isEmpty();
                    assertThat(result.getData()).isNull();
                })
                .verifyComplete();
        assertThat(orchestrator.getRecovery().getHistory()).hasSize(1);
        assertThat(store.load("broken")).get()
                .extracting(PipelineState::getError)
                .isEqualTo("Step PROFILING failed, aborting run");
    }

    @Test
    void run_shouldContinueWithFallbackProfile() {
        // Given
        Dataset input = customers();
        PipelineOrchestrator orchestrator = orchestrator(
                components(failingProfiler(), new CandidateGenerator()), FailureStrategy.FALLBACK);

        // When
        PipelineResult result = orchestrator.run(input, "fallback").block();

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getProfile().getColumns()).isEmpty();
        assertThat(result.getRankedTransformations()).isEmpty();
        assertThat(result.getData()).isEqualTo(input);
        assertThat(result.getState().getCompletedSteps()).containsExactlyElementsOf(ALL_STEPS);
    }

    @Test
    void run_shouldLeaveSkippedStepsUncompleted() {
        // Given
        PipelineOrchestrator orchestrator = orchestrator(
                components(failingProfiler(), new CandidateGenerator()), FailureStrategy.SKIP);

        // When
        PipelineResult result = orchestrator.run(customers(), "skipping").block();

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getError()).startsWith("Step VALIDATION skipped:");
        assertThat(result.getState().getCompletedSteps())
                .containsExactly(PipelineStep.RANKING, PipelineStep.EXECUTION);
    }

    @Test
    void run_shouldStopAndCheckpointWhenCancelled() {
        // Given
        CancellationToken token = new CancellationToken();
        DataProfiler profiler = mock(DataProfiler.class);
        when(profiler.profile(any())).thenAnswer(invocation -> {
            token.cancel();
            return new DefaultDataProfiler().profile(invocation.getArgument(0));
        });
        PipelineOrchestrator orchestrator = orchestrator(components(profiler, new CandidateGenerator()),
                FailureStrategy.ABORT);

        // When
        PipelineResult result = orchestrator.run(customers(), "cancelled", token).block();

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Run 'cancelled' was cancelled");
        assertThat(result.getState().getCompletedSteps()).isEmpty();
        assertThat(result.getProfile()).isNotNull();
        assertThat(store.exists("cancelled")).isTrue();
    }

    @Test
    void resume_shouldSkipStepsCompletedBeforeTheFailure() {
        // Given
        Dataset input = customers();
        CandidateGenerator offline = mock(CandidateGenerator.class);
        when(offline.generate(any())).thenThrow(new GenerationException("generator offline"));
        PipelineResult failed = orchestrator(components(new DefaultDataProfiler(), offline), FailureStrategy.ABORT)
                .run(input, "resumable").block();

        DataProfiler profiler = mock(DataProfiler.class);
        PipelineOrchestrator healthy = orchestrator(components(profiler, new CandidateGenerator()),
                FailureStrategy.ABORT);

        // When
        PipelineResult resumed = healthy.resume(input, "resumable").block();

        // Then
        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getState().getCompletedSteps()).containsExactly(PipelineStep.PROFILING);
        assertThat(resumed.isSuccess()).isTrue();
        assertThat(resumed.getError()).isNull();
        assertThat(resumed.getState().getCompletedSteps()).containsExactlyElementsOf(ALL_STEPS);
        assertThat(resumed.getRankedTransformations()).isNotEmpty();
        verifyNoInteractions(profiler);
    }

    @Test
    void resume_shouldReapplyTopRankedTransformationOfCompletedRun() {
        // Given
        Dataset input = customers();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), store);
        PipelineResult first = orchestrator.run(input, "finished").block();

        // When
        PipelineResult resumed = orchestrator.resume(input, "finished").block();

        // Then
        assertThat(first.getData()).isNotEqualTo(input);
        assertThat(resumed.isSuccess()).isTrue();
        assertThat(resumed.getState().getCompletedSteps()).containsExactlyElementsOf(ALL_STEPS);
        assertThat(resumed.getData()).isEqualTo(first.getData());
    }

    @Test
    void resume_shouldStartFromScratchWithoutCheckpoint() {
        // Given
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), store);

        // When
        PipelineResult result = orchestrator.resume(customers(), "fresh").block();

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getState().getCompletedSteps()).containsExactlyElementsOf(ALL_STEPS);
    }

    @Test
    void recover_shouldReportStoredOutcome() {
        // Given
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), store);
        PipelineResult original = orchestrator.run(customers(), "stored").block();

        // When & Then
        StepVerifier.create(orchestrator.recover("stored"))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isTrue();
                    assertThat(result.getRankedTransformations()).hasSameSizeAs(original.getRankedTransformations());
                    assertThat(result.getProfile().getRowCount()).isEqualTo(10);
                })
                .verifyComplete();
    }

    @Test
    void recover_shouldFailForUnknownRun() {
        // Given
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), store);

        // When & Then
        StepVerifier.create(orchestrator.recover("missing"))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isFalse();
                    assertThat(result.getError()).isEqualTo("No checkpoint found for run 'missing'");
                })
                .verifyComplete();
    }

    @Test
    void run_shouldPublishEventAfterEveryCheckpoint() {
        // Given
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), store,
                new FailureRecovery(), OrchestratorSettings.defaults(), publisher);

        // When
        orchestrator.run(customers(), "observed").block();

        // Then
        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(publisher, times(5)).publishEvent(events.capture());
        assertThat(events.getAllValues())
                .allMatch(PipelineStepEvent.class::isInstance)
                .extracting(event -> ((PipelineStepEvent) event).getStep())
                .containsExactlyElementsOf(ALL_STEPS);
        assertThat(events.getAllValues())
                .extracting(event -> ((PipelineStepEvent) event).getCheckpointLocation())
                .containsOnly("memory:observed");
    }

    @Test
    void run_shouldFailWhenRequiredCheckpointCannotBeWritten() {
        // Given
        CheckpointStore broken = mock(CheckpointStore.class);
        when(broken.save(anyString(), any())).thenThrow(new OrchestrationException("disk full"));
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), broken);

        // When
        PipelineResult result = orchestrator.run(customers(), "unsaved").block();

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("disk full");
    }

    @Test
    void run_shouldContinueWhenOptionalCheckpointCannotBeWritten() {
        // Given
        CheckpointStore broken = mock(CheckpointStore.class);
        when(broken.save(anyString(), any())).thenThrow(new OrchestrationException("disk full"));
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), broken,
                new FailureRecovery(), OrchestratorSettings.builder().checkpointRequired(false).build(), null);

        // When
        PipelineResult result = orchestrator.run(customers(), "unsaved").block();

        // Then
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void runProfileOnly_shouldOpenCircuitAfterRepeatedFailures() {
        // Given
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(components(failingProfiler(), new CandidateGenerator()),
                store, new FailureRecovery(), OrchestratorSettings.builder().circuitBreakerFailureThreshold(2).build(), null);

        // When
        for (int i = 0; i < 2; i++) {
            StepVerifier.create(orchestrator.runProfileOnly(customers())).expectError(ProfilingException.class).verify();
        }

        // Then
        StepVerifier.create(orchestrator.runProfileOnly(customers()))
                .expectError(CallNotPermittedException.class)
                .verify();
        assertThat(orchestrator.getExecutionCircuitBreaker()).isPresent();
    }

    @Test
    void run_shouldNotLetRejectedCandidatesOpenTheExecutionCircuit() {
        // Given
        int expected = new PipelineOrchestrator(PipelineComponents.defaults(), new InMemoryCheckpointStore())
                .run(customers(), "baseline").block()
                .getRankedTransformations().size();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), store);

        // When
        PipelineResult messy = orchestrator.run(numbersStoredAsText(), "messy").block();
        PipelineResult clean = orchestrator.run(customers(), "clean").block();

        // Then
        assertThat(messy.isSuccess()).isTrue();
        assertThat(orchestrator.getExecutionCircuitBreaker())
                .hasValueSatisfying(breaker -> assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED));
        assertThat(expected).isPositive();
        assertThat(clean.getRankedTransformations()).hasSize(expected);
        assertThat(clean.getData()).isNotEqualTo(customers());
    }

    @Test
    void standaloneOperations_shouldDelegateToComponents() {
        // Given
        Dataset input = customers();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineComponents.defaults(), store);

        // When
        DataProfile profile = orchestrator.runProfileOnly(input).block();
        List<Transformation> transformations = orchestrator.runGenerateOnly(profile).block();

        // Then
        assertThat(profile.getColumnCount()).isEqualTo(2);
        assertThat(transformations).isNotEmpty();
        StepVerifier.create(orchestrator.runValidateOnly(input, input.withoutColumn("city"), profile))
                .assertNext(validation -> assertThat(validation.isPassed()).isFalse())
                .verifyComplete();
        StepVerifier.create(orchestrator.runRankOnly(List.of()))
                .assertNext(ranked -> assertThat(ranked).isEmpty())
                .verifyComplete();
    }
}
