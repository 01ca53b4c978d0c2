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

package org.fireflyframework.wrangler.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wrangler.checkpoint.CheckpointStore;
import org.fireflyframework.wrangler.checkpoint.FileCheckpointStore;
import org.fireflyframework.wrangler.checkpoint.InMemoryCheckpointStore;
import org.fireflyframework.wrangler.exception.RankingException;
import org.fireflyframework.wrangler.model.QualityWeights;
import org.fireflyframework.wrangler.orchestrator.FailureRecovery;
import org.fireflyframework.wrangler.orchestrator.OrchestratorSettings;
import org.fireflyframework.wrangler.orchestrator.PipelineComponents;
import org.fireflyframework.wrangler.orchestrator.PipelineOrchestrator;
import org.fireflyframework.wrangler.orchestrator.RetrySettings;
import org.fireflyframework.wrangler.profiling.DataProfiler;
import org.fireflyframework.wrangler.profiling.DefaultDataProfiler;
import org.fireflyframework.wrangler.quality.QualityScorer;
import org.fireflyframework.wrangler.ranking.RankingPolicy;
import org.fireflyframework.wrangler.ranking.TransformationRanker;
import org.fireflyframework.wrangler.ranking.policies.CompositeScorePolicy;
import org.fireflyframework.wrangler.ranking.policies.ImprovementPolicy;
import org.fireflyframework.wrangler.transform.CandidateGenerator;
import org.fireflyframework.wrangler.transform.ReversibilityClassifier;
import org.fireflyframework.wrangler.transform.TransformationExecutor;
import org.fireflyframework.wrangler.transform.appliers.ApplierRegistry;
import org.fireflyframework.wrangler.validation.IntegrityValidator;
import org.fireflyframework.wrangler.validation.LeakageDetector;
import org.fireflyframework.wrangler.validation.SchemaValidator;
import org.fireflyframework.wrangler.validation.TransformationValidator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Auto-configuration for the data wrangler pipeline.
 *
 * <p>Every component is created only when the application does not define its own bean of
 * the same type, so any stage can be replaced individually. The orchestrator publishes a
 * {@link org.fireflyframework.wrangler.event.PipelineStepEvent} after each checkpoint when an
 * {@link ApplicationEventPublisher} is available.</p>
 *
 * <p>The configuration is activated unless {@code firefly.data.wrangler.enabled} is
 * {@code false}.</p>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DataWranglerProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.data.wrangler",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class DataWranglerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DataProfiler dataProfiler() {
        return new DefaultDataProfiler();
    }

    @Bean
    @ConditionalOnMissingBean
    public CandidateGenerator candidateGenerator(DataWranglerProperties properties) {
        DataWranglerProperties.Generation generation = properties.getGeneration();
        return new CandidateGenerator(new ReversibilityClassifier(), generation.getAllowedTypes(),
                generation.getMaxCandidates());
    }

    @Bean
    @ConditionalOnMissingBean
    public TransformationExecutor transformationExecutor() {
        return new TransformationExecutor(ApplierRegistry.defaults());
    }

    @Bean
    @ConditionalOnMissingBean
    public TransformationValidator transformationValidator(DataWranglerProperties properties) {
        DataWranglerProperties.Validation validation = properties.getValidation();
        return new TransformationValidator(List.of(
                new IntegrityValidator(validation.getRowCountTolerance()),
                new LeakageDetector(validation.getRowOverlapRatio(), validation.getCorrelationThreshold()),
                new SchemaValidator()));
    }

    @Bean
    @ConditionalOnMissingBean
    public QualityScorer qualityScorer(DataWranglerProperties properties) {
        DataWranglerProperties.Scoring scoring = properties.getScoring();
        return new QualityScorer(QualityWeights.of(scoring.getWeights()), scoring.getSampleThreshold(),
                scoring.getSampleSize(), scoring.getSeed());
    }

    @Bean
    @ConditionalOnMissingBean
    public RankingPolicy rankingPolicy(DataWranglerProperties properties) {
        DataWranglerProperties.Ranking ranking = properties.getRanking();
        return switch (ranking.getPolicy().trim().toLowerCase(Locale.ROOT)) {
            case CompositeScorePolicy.NAME -> new CompositeScorePolicy(QualityWeights.of(ranking.getWeights()));
            case ImprovementPolicy.NAME -> new ImprovementPolicy(ranking.getPrimaryMetric());
            default -> throw new RankingException("Unknown ranking policy",
                    Map.of("policy", ranking.getPolicy()));
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public TransformationRanker transformationRanker(RankingPolicy rankingPolicy) {
        return new TransformationRanker(rankingPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckpointStore checkpointStore(DataWranglerProperties properties) {
        DataWranglerProperties.Checkpoint checkpoint = properties.getCheckpoint();
        if ("memory".equalsIgnoreCase(checkpoint.getStore())) {
            return new InMemoryCheckpointStore();
        }
        return new FileCheckpointStore(Path.of(checkpoint.getDirectory()));
    }

    @Bean
    @ConditionalOnMissingBean
    public FailureRecovery failureRecovery(DataWranglerProperties properties) {
        DataWranglerProperties.Recovery recovery = properties.getRecovery();
        return new FailureRecovery(recovery.getStrategy(), RetrySettings.builder()
                .maxRetries(recovery.getMaxRetries())
                .initialDelay(recovery.getInitialDelay())
                .backoffFactor(recovery.getBackoffFactor())
                .maxDelay(recovery.getMaxDelay())
                .build());
    }

    /**
     * Creates the pipeline orchestrator from the component beans.
     *
     * @param eventPublisher the event publisher, or {@code null} if unavailable
     */
    @Bean
    @ConditionalOnMissingBean
    public PipelineOrchestrator pipelineOrchestrator(
            DataProfiler dataProfiler,
            CandidateGenerator candidateGenerator,
            TransformationExecutor transformationExecutor,
            TransformationValidator transformationValidator,
            QualityScorer qualityScorer,
            TransformationRanker transformationRanker,
            CheckpointStore checkpointStore,
            FailureRecovery failureRecovery,
            DataWranglerProperties properties,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        DataWranglerProperties.Pipeline pipeline = properties.getPipeline();
        DataWranglerProperties.CircuitBreaker circuitBreaker = properties.getCircuitBreaker();
        OrchestratorSettings settings = OrchestratorSettings.builder()
                .enableRanking(pipeline.isEnableRanking())
                .rankingTopK(pipeline.getRankingTopK())
                .workerConcurrency(pipeline.getWorkerConcurrency())
                .checkpointRequired(properties.getCheckpoint().isRequired())
                .circuitBreakerEnabled(circuitBreaker.isEnabled())
                .circuitBreakerFailureThreshold(circuitBreaker.getFailureThreshold())
                .circuitBreakerCooldown(circuitBreaker.getCooldown())
                .build();
        log.info("Configuring PipelineOrchestrator with {} checkpoints and {} recovery",
                properties.getCheckpoint().getStore(), failureRecovery.getStrategy());
        PipelineComponents components = new PipelineComponents(dataProfiler, candidateGenerator,
                transformationExecutor, transformationValidator, qualityScorer, transformationRanker);
        return new PipelineOrchestrator(components, checkpointStore, failureRecovery, settings, eventPublisher);
    }
}
