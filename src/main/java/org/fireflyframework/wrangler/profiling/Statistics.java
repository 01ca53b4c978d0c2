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

import java.util.Arrays;

/**
 * Descriptive statistics over primitive arrays.
 *
 * <p>Standard deviations use the sample estimator (n - 1). Quantiles interpolate
 * linearly between order statistics.</p>
 */
public final class Statistics {

    private Statistics() {}

    public static double mean(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double min(double[] values) {
        return Arrays.stream(values).min().orElse(Double.NaN);
    }

    public static double max(double[] values) {
        return Arrays.stream(values).max().orElse(Double.NaN);
    }

    public static double sampleStd(double[] values, double mean) {
        if (values.length < 2) {
            return Double.NaN;
        }
        double squares = 0.0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    public static double sampleStd(double[] values) {
        return sampleStd(values, mean(values));
    }

    public static double median(double[] values) {
        return quantile(values, 0.5);
    }

    /**
     * @param values   the sample, in any order
     * @param fraction the quantile in {@code [0, 1]}
     */
    public static double quantile(double[] values, double fraction) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    /**
     * Pearson correlation coefficient, or NaN when either side has no variance.
     */
    public static double pearson(double[] left, double[] right) {
        double meanLeft = mean(left);
        double meanRight = mean(right);
        double covariance = 0.0;
        double varLeft = 0.0;
        double varRight = 0.0;
        for (int i = 0; i < left.length; i++) {
            double dl = left[i] - meanLeft;
            double dr = right[i] - meanRight;
            covariance += dl * dr;
            varLeft += dl * dl;
            varRight += dr * dr;
        }
        if (varLeft == 0.0 || varRight == 0.0) {
            return Double.NaN;
        }
        return covariance / Math.sqrt(varLeft * varRight);
    }
}
