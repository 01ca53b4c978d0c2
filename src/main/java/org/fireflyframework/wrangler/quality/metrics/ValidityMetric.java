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

package org.fireflyframework.wrangler.quality.metrics;

import org.fireflyframework.wrangler.model.CellValues;
import org.fireflyframework.wrangler.model.Column;
import org.fireflyframework.wrangler.model.ColumnProfile;
import org.fireflyframework.wrangler.model.QualityMetrics;

import java.util.List;
import java.util.function.Predicate;

/**
 * Mean share of plausible values per column.
 *
 * <p>With a column profile, numeric values must lie within the profiled min/max bounds.
 * Without one, numeric values must be finite. In both cases datetime values must parse and
 * text must not be blank. A column without values is valid.</p>
 */
public class ValidityMetric extends AbstractColumnMetric {

    @Override
    protected double scoreColumn(Column column, ColumnProfile profile) {
        List<Object> values = column.nonMissingValues();
        if (values.isEmpty()) {
            return 1.0;
        }
        Predicate<Object> valid = switch (column.getType()) {
            case INTEGER, FLOAT -> profile != null ? withinBounds(profile) : ValidityMetric::isFinite;
            case DATETIME -> value -> CellValues.toDateTime(value) != null;
            case STRING -> value -> !(value instanceof CharSequence) || !value.toString().isBlank();
            case BOOLEAN -> value -> true;
        };
        long count = values.stream().filter(valid).count();
        return (double) count / values.size();
    }

    private static Predicate<Object> withinBounds(ColumnProfile profile) {
        Double min = profile.getMin();
        Double max = profile.getMax();
        return value -> {
            Double number = CellValues.toDouble(value);
            if (number == null) {
                return false;
            }
            return (min == null || number >= min) && (max == null || number <= max);
        };
    }

    private static boolean isFinite(Object value) {
        Double number = CellValues.toDouble(value);
        return number != null && Double.isFinite(number);
    }

    @Override
    public String getMetricName() {
        return QualityMetrics.VALIDITY;
    }
}
