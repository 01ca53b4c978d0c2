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

import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.Dataset;

/**
 * Port interface for a single quality dimension.
 *
 * <p>Implementations return a score in {@code [0, 1]} computed independently of every
 * other metric. The profile, when given, describes the dataset the scores are judged
 * against and may be used for bounds or cached counts.</p>
 */
public interface QualityMetric {

    /**
     * Scores the dataset on this dimension.
     *
     * @param data    the dataset to score
     * @param profile the reference profile, or {@code null}
     * @return the score, clamped to {@code [0, 1]}
     */
    double calculate(Dataset data, DataProfile profile);

    /**
     * Returns the name of this metric, as used in weights and reports.
     *
     * @return the metric name
     */
    String getMetricName();

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
