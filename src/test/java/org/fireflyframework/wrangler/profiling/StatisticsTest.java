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

package org.fireflyframework.wrangler.profiling;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Statistics}.
 */
class StatisticsTest {

    @Test
    void quantile_shouldInterpolateLinearly() {
        // Given
        double[] values = {4, 1, 3, 2};

        // Then
        assertThat(Statistics.median(values)).isCloseTo(2.5, within(1e-12));
        assertThat(Statistics.quantile(values, 0.25)).isCloseTo(1.75, within(1e-12));
        assertThat(Statistics.quantile(values, 0.75)).isCloseTo(3.25, within(1e-12));
    }

    @Test
    void sampleStd_shouldBeNaNBelowTwoValues() {
        // Then
        assertThat(Statistics.sampleStd(new double[]{1.0})).isNaN();
        assertThat(Statistics.sampleStd(new double[]{1, 2, 3, 4, 5})).isCloseTo(Math.sqrt(2.5), within(1e-12));
    }

    @Test
    void pearson_shouldDetectPerfectCorrelationAndMissingVariance() {
        // Then
        assertThat(Statistics.pearson(new double[]{1, 2, 3}, new double[]{2, 4, 6})).isCloseTo(1.0, within(1e-12));
        assertThat(Statistics.pearson(new double[]{1, 1, 1}, new double[]{2, 4, 6})).isNaN();
    }
}
