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

import lombok.Data;
import org.fireflyframework.wrangler.model.QualityWeights;
import org.fireflyframework.wrangler.model.TransformationType;
import org.fireflyframework.wrangler.orchestrator.FailureStrategy;
import org.fireflyframework.wrangler.transform.CandidateGenerator;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of the data wrangler pipeline.
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   data:
 *     wrangler:
 *       pipeline:
 *         ranking-top-k: 10
 *       recovery:
 *         strategy: RETRY
 *         max-retries: 2
 *       checkpoint:
 *         store: file
 *         directory: /var/lib/wrangler/checkpoints
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.data.wrangler")
public class DataWranglerProperties {

    /** Master switch for the auto-configuration. */
    private boolean enabled = true;

    private Pipeline pipeline = new Pipeline();
    private Recovery recovery = new Recovery();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Validation validation = new Validation();
    private Scoring scoring = new Scoring();
    private Ranking ranking = new Ranking();
    private Generation generation = new Generation();
    private Checkpoint checkpoint = new Checkpoint();

    @Data
    public static class Pipeline {
        private boolean enableRanking = true;
        /** Ranked entries to keep, 0 for all. */
        private int rankingTopK = 0;
        /** Candidates evaluated concurrently, 0 for the parallel scheduler size. */
        private int workerConcurrency = 0;
    }

    @Data
    public static class Recovery {
        private FailureStrategy strategy = FailureStrategy.ABORT;
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private double backoffFactor = 2.0;
        private Duration maxDelay = Duration.ofSeconds(60);
    }

    @Data
    public static class CircuitBreaker {
        private boolean enabled = true;
        /** Consecutive failures that open the breaker. */
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(60);
    }

    @Data
    public static class Validation {
        private double rowCountTolerance = 0.1;
        private double rowOverlapRatio = 0.5;
        private double correlationThreshold = 0.99;
    }

    @Data
    public static class Scoring {
        private Map<String, Double> weights = new LinkedHashMap<>(QualityWeights.equal().asMap());
        /** Datasets with more rows than this are sampled before scoring. */
        private int sampleThreshold = 50_000;
        private int sampleSize = 10_000;
        private long seed = 42L;
    }

    @Data
    public static class Ranking {
        /** {@code composite} or {@code improvement}. */
        private String policy = "composite";
        /** Metric ranked on by the improvement policy. */
        private String primaryMetric = "overall";
        private Map<String, Double> weights = new LinkedHashMap<>(QualityWeights.equal().asMap());
    }

    @Data
    public static class Generation {
        private List<TransformationType> allowedTypes = new ArrayList<>(Arrays.asList(TransformationType.values()));
        /** Upper bound on generated candidates, 0 for no bound. */
        private int maxCandidates = CandidateGenerator.DEFAULT_MAX_CANDIDATES;
    }

    @Data
    public static class Checkpoint {
        /** {@code file} or {@code memory}. */
        private String store = "file";
        private String directory = "./checkpoints";
        /** Whether a failing checkpoint write fails the run. */
        private boolean required = true;
    }
}
