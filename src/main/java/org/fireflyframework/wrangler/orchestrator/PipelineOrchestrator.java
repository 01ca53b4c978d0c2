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
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wrangler.checkpoint.CheckpointStore;
import org.fireflyframework.wrangler.event.PipelineStepEvent;
import org.fireflyframework.wrangler.exception.OrchestrationException;
import org.fireflyframework.wrangler.exception.TransformationException;
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.PipelineState;
import org.fireflyframework.wrangler.model.PipelineStep;
import org.fireflyframework.wrangler.model.QualityMetrics;
import org.fireflyframework.wrangler.model.RankedTransformation;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationCandidate;
import org.fireflyframework.wrangler.model.TransformationResult;
import org.fireflyframework.wrangler.model.ValidationResult;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Drives a dataset through profiling, candidate generation, evaluation, ranking and the final
 * re-application of the best candidate.
 *
 * <p>The state of a run is checkpointed after every step. Step failures are handled by the
 * configured {@link FailureRecovery}; failures of a single candidate only drop that candidate.
 * Candidates are evaluated concurrently on Reactor's parallel scheduler, but the run state is
 * only mutated and checkpointed by the orchestrating chain.</p>
 *
 * <p>{@link #run} and {@link #resume} never signal an error: any failure is reported as a
 * {@link PipelineResult} with {@code success=false}.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * PipelineOrchestrator orchestrator = new PipelineOrchestrator(
 *         PipelineComponents.defaults(), new InMemoryCheckpointStore());
 *
 * PipelineResult result = orchestrator.run(dataset, "customers-2024").block();
 * result.getRankedTransformations().forEach(r -> log.info("{}", r.getReasoning()));
 * }</pre>
 */
@Slf4j
public class PipelineOrchestrator {

    private final PipelineComponents components;
    private final CheckpointStore checkpointStore;
    private final FailureRecovery recovery;
    private final OrchestratorSettings settings;
    private final ApplicationEventPublisher eventPublisher;
    private final CircuitBreaker profilerBreaker;
    private final CircuitBreaker executionBreaker;

    public PipelineOrchestrator(PipelineComponents components, CheckpointStore checkpointStore) {
        this(components, checkpointStore, new FailureRecovery(), OrchestratorSettings.defaults(), null);
    }

    public PipelineOrchestrator(PipelineComponents components,
                                CheckpointStore checkpointStore,
                                FailureRecovery recovery,
                                OrchestratorSettings settings,
                                ApplicationEventPublisher eventPublisher) {
        this.components = components;
        this.checkpointStore = checkpointStore;
        this.recovery = recovery;
        this.settings = settings;
        this.eventPublisher = eventPublisher;
        if (settings.isCircuitBreakerEnabled()) {
            this.profilerBreaker = CircuitBreakers.create("wrangler-profiler",
                    settings.getCircuitBreakerFailureThreshold(), settings.getCircuitBreakerCooldown());
            // A candidate rejected by its applier is dropped on its own and must not starve the others.
            this.executionBreaker = CircuitBreakers.create("wrangler-candidate-execution",
                    settings.getCircuitBreakerFailureThreshold(), settings.getCircuitBreakerCooldown(),
                    List.of(TransformationException.class));
        } else {
            this.profilerBreaker = null;
            this.executionBreaker = null;
        }
        log.info("Initialized PipelineOrchestrator: ranking={}, topK={}, concurrency={}, recovery={}, circuitBreaker={}",
                settings.isEnableRanking(), settings.getRankingTopK(), concurrency(),
                recovery.getStrategy(), settings.isCircuitBreakerEnabled());
    }

    public Mono<PipelineResult> run(Dataset data, String runName) {
        return run(data, runName, new CancellationToken());
    }

    /**
     * Runs the full pipeline from the first step.
     *
     * @param data    the input dataset
     * @param runName the name the run's checkpoints are stored under
     * @param token   cancellation signal, observed between steps and between candidates
     * @return the run outcome; never an error signal
     */
    public Mono<PipelineResult> run(Dataset data, String runName, CancellationToken token) {
        return Mono.defer(() -> execute(new Run(data, runName, new PipelineState(), token)));
    }

    /**
     * Continues a run from its last checkpoint, skipping the steps it already completed and
     * reusing the stored profile, candidates and ranking. The top-ranked transformation is always
     * re-applied, since checkpoints do not hold the transformed data. Without a checkpoint the run
     * starts from the beginning.
     *
     * @param data    the same input dataset the run started with
     * @param runName the run name
     * @return the run outcome; never an error signal
     */
    public Mono<PipelineResult> resume(Dataset data, String runName) {
        long start = System.nanoTime();
        return Mono.fromCallable(() -> checkpointStore.load(runName))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(stored -> {
                    PipelineState state = stored.orElseGet(PipelineState::new);
                    if (stored.isPresent()) {
                        log.info("Resuming run '{}' after steps {}", runName, state.getCompletedSteps());
                    } else {
                        log.info("No checkpoint found for run '{}', starting from the beginning", runName);
                    }
                    state.setError(null);
                    return execute(new Run(data, runName, state, new CancellationToken()));
                })
                .onErrorResume(e -> {
                    log.error("Failed to resume run '{}'", runName, e);
                    PipelineState state = new PipelineState();
                    state.setError(describe(e));
                    return Mono.just(failed(state, elapsedSince(start)));
                });
    }

    /**
     * Reports the checkpointed state of a run without executing anything.
     *
     * @param runName the run name
     * @return the stored outcome, or a failed result when no checkpoint exists
     */
    public Mono<PipelineResult> recover(String runName) {
        return Mono.fromCallable(() -> checkpointStore.load(runName))
                .subscribeOn(Schedulers.boundedElastic())
                .map(stored -> stored.map(state -> PipelineResult.builder()
                                .success(state.getError() == null)
                                .profile(state.getDataProfile())
                                .rankedTransformations(List.copyOf(state.getRankedTransformations()))
                                .error(state.getError())
                                .executionTime(Duration.ZERO)
                                .state(state)
                                .build())
                        .orElseGet(() -> {
                            PipelineState state = new PipelineState();
                            state.setError("No checkpoint found for run '" + runName + "'");
                            return failed(state, Duration.ZERO);
                        }))
                .onErrorResume(e -> {
                    log.error("Failed to recover run '{}'", runName, e);
                    PipelineState state = new PipelineState();
                    state.setError(describe(e));
                    return Mono.just(failed(state, Duration.ZERO));
                });
    }

    public Mono<DataProfile> runProfileOnly(Dataset data) {
        return guard(profilerBreaker, Mono.fromCallable(() -> components.profiler().profile(data)));
    }

    public Mono<List<Transformation>> runGenerateOnly(DataProfile profile) {
        return Mono.fromCallable(() -> components.generator().generate(profile));
    }

    public Mono<ValidationResult> runValidateOnly(Dataset original, Dataset transformed, DataProfile profile) {
        return Mono.fromCallable(() -> components.validator().validate(original, transformed, profile));
    }

    public Mono<List<RankedTransformation>> runRankOnly(List<TransformationCandidate> candidates) {
        return Mono.fromCallable(() -> components.ranker().rank(candidates, settings.getRankingTopK()));
    }

    public FailureRecovery getRecovery() {
        return recovery;
    }

    public Optional<CircuitBreaker> getProfilerCircuitBreaker() {
        return Optional.ofNullable(profilerBreaker);
    }

    public Optional<CircuitBreaker> getExecutionCircuitBreaker() {
        return Optional.ofNullable(executionBreaker);
    }

    private Mono<PipelineResult> execute(Run run) {
        long start = System.nanoTime();
        log.info("Starting run '{}' on {} rows x {} columns", run.name,
                run.data.getRowCount(), run.data.getColumnCount());
        return profilingStep(run)
                .then(Mono.defer(() -> generationStep(run)))
                .then(Mono.defer(() -> validationStep(run)))
                .then(Mono.defer(() -> rankingStep(run)))
                .then(Mono.defer(() -> executionStep(run)))
                .then(Mono.fromCallable(() -> {
                    log.info("Run '{}' completed in {} with {} candidates", run.name,
                            elapsedSince(start), run.state.getCandidates().size());
                    return PipelineResult.builder()
                            .success(true)
                            .data(run.finalData != null ? run.finalData : run.data)
                            .profile(run.state.getDataProfile())
                            .rankedTransformations(List.copyOf(run.state.getRankedTransformations()))
                            .error(run.state.getError())
                            .executionTime(elapsedSince(start))
                            .state(run.state.snapshot())
                            .build();
                }))
                .onErrorResume(e -> {
                    log.error("Run '{}' failed at step {}", run.name, run.state.getCurrentStep(), e);
                    run.state.setError(describe(e));
                    return checkpoint(run, run.state.getCurrentStep())
                            .onErrorResume(checkpointError -> {
                                log.error("Failed to checkpoint failed run '{}'", run.name, checkpointError);
                                return Mono.empty();
                            })
                            .then(Mono.fromCallable(() -> failed(run.state.snapshot(), elapsedSince(start))));
                });
    }

    private Mono<Void> profilingStep(Run run) {
        Mono<DataProfile> operation = guard(profilerBreaker,
                Mono.fromCallable(() -> components.profiler().profile(run.data)));
        return step(run, PipelineStep.PROFILING, operation, DataProfile::empty, run.state::setDataProfile);
    }

    private Mono<Void> generationStep(Run run) {
        Mono<List<Transformation>> operation = Mono.fromCallable(() ->
                components.generator().generate(requireProfile(run, PipelineStep.GENERATION)));
        return step(run, PipelineStep.GENERATION, operation, List::of, transformations -> {
            run.transformations = transformations;
            log.info("Run '{}' generated {} candidate transformations", run.name, transformations.size());
        });
    }

    private Mono<Void> validationStep(Run run) {
        Mono<List<TransformationCandidate>> operation = Mono.defer(() -> {
            DataProfile profile = requireProfile(run, PipelineStep.VALIDATION);
            List<Transformation> transformations = run.transformations != null
                    ? run.transformations
                    : components.generator().generate(profile);
            return Mono.fromCallable(() -> components.scorer().score(run.data, profile))
                    .flatMap(before -> Flux.fromIterable(transformations)
                            .takeWhile(transformation -> !run.token.isCancelled())
                            .flatMapSequential(transformation -> evaluate(run, profile, transformation, before)
                                    .subscribeOn(Schedulers.parallel()), concurrency())
                            .collectList());
        });
        return step(run, PipelineStep.VALIDATION, operation, List::of, candidates -> {
            run.state.setCandidates(new ArrayList<>(candidates));
            log.info("Run '{}' kept {} candidates after execution, validation and scoring",
                    run.name, candidates.size());
        });
    }

    private Mono<Void> rankingStep(Run run) {
        if (!settings.isEnableRanking()) {
            return Mono.empty();
        }
        Mono<List<RankedTransformation>> operation = Mono.fromCallable(() ->
                components.ranker().rank(List.copyOf(run.state.getCandidates()), settings.getRankingTopK()));
        return step(run, PipelineStep.RANKING, operation, List::of,
                ranked -> run.state.setRankedTransformations(new ArrayList<>(ranked)));
    }

    private Mono<Void> executionStep(Run run) {
        if (run.state.hasCompleted(PipelineStep.EXECUTION)) {
            // The checkpoint holds the ranking, not the transformed data, so a resumed run re-applies it.
            return Mono.defer(() -> run.token.isCancelled() ? Mono.<Dataset>error(cancelled(run))
                            : Mono.fromCallable(() -> applyBest(run)))
                    .doOnNext(data -> run.finalData = data)
                    .then();
        }
        return step(run, PipelineStep.EXECUTION, Mono.fromCallable(() -> applyBest(run)),
                () -> run.data, data -> run.finalData = data);
    }

    private Dataset applyBest(Run run) {
        Optional<Transformation> best = settings.isEnableRanking()
                ? run.state.getRankedTransformations().stream()
                        .map(RankedTransformation::getCandidate)
                        .filter(candidate -> candidate.getValidationResult() != null
                                && candidate.getValidationResult().isPassed())
                        .map(TransformationCandidate::getTransformation)
                        .findFirst()
                : Optional.empty();
        if (best.isEmpty()) {
            log.info("Run '{}' has no qualifying candidate, returning the input unchanged", run.name);
            return run.data;
        }
        Transformation transformation = best.get();
        TransformationResult result = components.executor().execute(run.data, transformation);
        components.executor().forget(transformation.getId());
        if (!result.isSuccess()) {
            throw new TransformationException("Re-applying the top-ranked transformation failed: "
                    + result.getErrorMessage(), Map.of("transformation", transformation.getId()));
        }
        log.info("Run '{}' applied top-ranked transformation {} on {}", run.name,
                transformation.getType(), transformation.getTargetColumns());
        return result.getData();
    }

    /**
     * Runs one step under the failure strategy, then checkpoints. Steps completed by an earlier
     * attempt of the run are skipped.
     */
    private <T> Mono<Void> step(Run run, PipelineStep step, Mono<T> operation, Supplier<T> fallback,
                                Consumer<T> onResult) {
        return Mono.defer(() -> {
            if (run.token.isCancelled()) {
                return Mono.error(cancelled(run));
            }
            if (run.state.hasCompleted(step)) {
                log.info("Run '{}': step {} already completed, skipping", run.name, step);
                return Mono.empty();
            }
            run.state.setCurrentStep(step);
            log.info("Run '{}': entering step {}", run.name, step);
            return recovery.execute(step, run.state, operation, fallback)
                    .doOnNext(result -> {
                        onResult.accept(result);
                        if (!run.token.isCancelled()) {
                            run.state.markCompleted(step);
                        }
                    })
                    .then(checkpoint(run, step))
                    .then(Mono.defer(() -> run.token.isCancelled() ? Mono.<Void>error(cancelled(run)) : Mono.<Void>empty()));
        });
    }

    private Mono<TransformationCandidate> evaluate(Run run, DataProfile profile, Transformation transformation,
                                                   QualityMetrics before) {
        Mono<Dataset> execution = guard(executionBreaker, Mono.fromCallable(() -> {
            TransformationResult result = components.executor().execute(run.data, transformation);
            if (!result.isSuccess()) {
                throw new TransformationException(result.getErrorMessage(),
                        Map.of("transformation", transformation.getId()));
            }
            return result.getData();
        }));
        return execution
                .flatMap(transformed -> Mono.fromCallable(() -> assemble(run, profile, transformation, before, transformed)))
                .doFinally(signal -> components.executor().forget(transformation.getId()))
                .onErrorResume(e -> {
                    log.warn("Run '{}': dropping candidate {} on {}: {}", run.name, transformation.getType(),
                            transformation.getTargetColumns(), describe(e));
                    return Mono.empty();
                });
    }

    /**
     * Validates and scores one transformed dataset, returning {@code null} when validation fails.
     */
    private TransformationCandidate assemble(Run run, DataProfile profile, Transformation transformation,
                                             QualityMetrics before, Dataset transformed) {
        ValidationResult validation = components.validator().validate(run.data, transformed, profile, transformation);
        if (!validation.isPassed()) {
            log.debug("Run '{}': candidate {} on {} failed validation with {} errors", run.name,
                    transformation.getType(), transformation.getTargetColumns(), validation.errors().size());
            return null;
        }
        QualityMetrics after = components.scorer().score(transformed, profile);
        TransformationCandidate candidate = TransformationCandidate.of(transformation, validation,
                components.scorer().compare(before, after));
        log.debug("Run '{}': candidate {} on {} scored {} -> {}", run.name, transformation.getType(),
                transformation.getTargetColumns(), before.getOverall(), after.getOverall());
        return candidate;
    }

    private Mono<Void> checkpoint(Run run, PipelineStep step) {
        return Mono.defer(() -> {
            PipelineState snapshot = run.state.snapshot();
            return Mono.fromCallable(() -> checkpointStore.save(run.name, snapshot))
                    .subscribeOn(Schedulers.boundedElastic())
                    .doOnNext(location -> {
                        log.debug("Run '{}': checkpoint after {} written to {}", run.name, step, location);
                        if (eventPublisher != null) {
                            eventPublisher.publishEvent(new PipelineStepEvent(run.name, step, snapshot, location));
                        }
                    })
                    .onErrorResume(e -> {
                        if (settings.isCheckpointRequired()) {
                            return Mono.error(e);
                        }
                        log.warn("Run '{}': checkpoint after {} failed, continuing: {}", run.name, step, describe(e));
                        return Mono.empty();
                    })
                    .then();
        });
    }

    private <T> Mono<T> guard(CircuitBreaker circuitBreaker, Mono<T> operation) {
        return circuitBreaker == null ? operation : operation.transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
    }

    private DataProfile requireProfile(Run run, PipelineStep step) {
        DataProfile profile = run.state.getDataProfile();
        if (profile == null) {
            throw new OrchestrationException("Data profile is required for " + step.name().toLowerCase());
        }
        return profile;
    }

    private int concurrency() {
        return settings.getWorkerConcurrency() > 0 ? settings.getWorkerConcurrency() : Schedulers.DEFAULT_POOL_SIZE;
    }

    private static OrchestrationException cancelled(Run run) {
        return new OrchestrationException("Run '" + run.name + "' was cancelled",
                Map.of("step", run.state.getCurrentStep()));
    }

    private static PipelineResult failed(PipelineState state, Duration executionTime) {
        return PipelineResult.builder()
                .success(false)
                .profile(state.getDataProfile())
                .rankedTransformations(List.copyOf(state.getRankedTransformations()))
                .error(state.getError())
                .executionTime(executionTime)
                .state(state)
                .build();
    }

    private static String describe(Throwable error) {
        return FailureRecovery.describe(error);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Per-run working context. Only the orchestrating chain touches it, one step at a time.
     */
    private static final class Run {

        private final Dataset data;
        private final String name;
        private final PipelineState state;
        private final CancellationToken token;
        private List<Transformation> transformations;
        private Dataset finalData;

        private Run(Dataset data, String name, PipelineState state, CancellationToken token) {
            this.data = data;
            this.name = name;
            this.state = state;
            this.token = token;
        }
    }
}
