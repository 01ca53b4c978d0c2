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

package org.fireflyframework.wrangler.quality;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wrangler.exception.ScoringException;
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.QualityDelta;
import org.fireflyframework.wrangler.model.QualityMetrics;
import org.fireflyframework.wrangler.model.QualityWeights;
import org.fireflyframework.wrangler.quality.metrics.CompletenessMetric;
import org.fireflyframework.wrangler.quality.metrics.ConsistencyMetric;
import org.fireflyframework.wrangler.quality.metrics.UniquenessMetric;
import org.fireflyframework.wrangler.quality.metrics.ValidityMetric;

/**
 * Scores datasets on completeness, consistency, validity and uniqueness and combines the
 * scores with a {@link CompositeCalculator}.
 *
 * <p>Datasets larger than the sampling threshold are scored on a seeded row sample.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * QualityScorer scorer = new QualityScorer(new QualityWeights(0.4, 0.2, 0.2, 0.2));
 * QualityMetrics before = scorer.score(original, profile);
 * QualityMetrics after = scorer.score(transformed, profile);
 * QualityDelta delta = scorer.compare(before, after);
 * }</pre>
 */
@Slf4j
public class QualityScorer {

    public static final int DEFAULT_SAMPLE_THRESHOLD = 50_000;
    public static final int DEFAULT_SAMPLE_SIZE = 10_000;
    public static final long DEFAULT_SEED = 42L;

    private final QualityMetric completeness;
    private final QualityMetric consistency;
    private final QualityMetric validity;
    private final QualityMetric uniqueness;
    private final CompositeCalculator calculator;
    private final QualityComparator comparator;
    private final int sampleThreshold;
    private final int sampleSize;
    private final long seed;

    public QualityScorer() {
        this(QualityWeights.equal());
    }

    public QualityScorer(QualityWeights weights) {
        this(weights, DEFAULT_SAMPLE_THRESHOLD, DEFAULT_SAMPLE_SIZE, DEFAULT_SEED);
    }

    public QualityScorer(QualityWeights weights, int sampleThreshold, int sampleSize, long seed) {
        this(new CompletenessMetric(), new ConsistencyMetric(), new ValidityMetric(), new UniquenessMetric(),
                new CompositeCalculator(weights), sampleThreshold, sampleSize, seed);
    }

    public QualityScorer(QualityMetric completeness, QualityMetric consistency, QualityMetric validity,
                         QualityMetric uniqueness, CompositeCalculator calculator,
                         int sampleThreshold, int sampleSize, long seed) {
        this.completeness = completeness;
        this.consistency = consistency;
        this.validity = validity;
        this.uniqueness = uniqueness;
        this.calculator = calculator;
        this.comparator = new QualityComparator();
        this.sampleThreshold = sampleThreshold;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    /**
     * Scores a dataset.
     *
     * @param data    the dataset
     * @param profile the reference profile for bounds and unique counts, or {@code null}
     * @return the four scores and their composite
     * @throws ScoringException if a metric cannot be computed
     */
    public QualityMetrics score(Dataset data, DataProfile profile) {
        Dataset scored = data.getRowCount() > sampleThreshold
                ? DatasetSampler.sample(data, sampleSize, seed)
                : data;
        if (scored != data) {
            log.debug("Scoring a {}-row sample of {} rows (seed={})", sampleSize, data.getRowCount(), seed);
        }
        return calculator.combine(
                evaluate(completeness, scored, profile),
                evaluate(consistency, scored, profile),
                evaluate(validity, scored, profile),
                evaluate(uniqueness, scored, profile));
    }

    public QualityDelta compare(QualityMetrics before, QualityMetrics after) {
        return comparator.compare(before, after);
    }

    public QualityWeights getWeights() {
        return calculator.getWeights();
    }

    private static double evaluate(QualityMetric metric, Dataset data, DataProfile profile) {
        try {
            return QualityMetric.clamp(metric.calculate(data, profile));
        } catch (RuntimeException e) {
            throw new ScoringException("Metric '" + metric.getMetricName() + "' could not be computed", e);
        }
    }
}
