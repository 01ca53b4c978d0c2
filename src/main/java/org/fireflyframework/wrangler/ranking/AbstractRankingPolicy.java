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

package org.fireflyframework.wrangler.ranking;

import org.fireflyframework.wrangler.model.QualityMetrics;
import org.fireflyframework.wrangler.model.Transformation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Formatting helpers shared by the built-in policies.
 */
public abstract class AbstractRankingPolicy implements RankingPolicy {

    private static final double CHANGE_EPSILON = 1e-9;

    protected static String describe(Transformation transformation) {
        return "Transformation '" + transformation.getType().getValue() + "' on columns "
                + transformation.getTargetColumns();
    }

    /**
     * Lists the non-zero dimension changes, e.g. {@code "completeness +0.200, validity -0.050"}.
     */
    protected static String changes(QualityMetrics improvement) {
        List<String> parts = new ArrayList<>();
        for (String dimension : QualityMetrics.DIMENSIONS) {
            double change = improvement.metricValue(dimension).orElse(0.0);
            if (Math.abs(change) > CHANGE_EPSILON) {
                parts.add(dimension + " " + signed(change));
            }
        }
        return parts.isEmpty() ? "none" : String.join(", ", parts);
    }

    protected static String signed(double value) {
        return String.format(Locale.ROOT, "%+.3f", value);
    }

    protected static String decimal(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    protected static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value * 100);
    }
}
