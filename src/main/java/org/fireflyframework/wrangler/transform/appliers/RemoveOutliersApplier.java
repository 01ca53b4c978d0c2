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

package org.fireflyframework.wrangler.transform.appliers;

import org.fireflyframework.wrangler.exception.TransformationException;
import org.fireflyframework.wrangler.model.Column;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationType;
import org.fireflyframework.wrangler.profiling.Statistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.DoublePredicate;

/**
 * Detects outliers in a numeric column and drops their rows or masks the values.
 *
 * <p>Parameters: {@code method} ({@code iqr}, default, or {@code zscore}), {@code threshold}
 * (default 1.5 for IQR fences, 3.0 for absolute z-scores) and {@code action}
 * ({@code remove}, default, or {@code mask}). Missing values are never outliers.
 * Not reversible.</p>
 */
public class RemoveOutliersApplier extends AbstractColumnApplier {

    @Override
    public TransformationType getType() {
        return TransformationType.REMOVE_OUTLIERS;
    }

    @Override
    protected AppliedTransformation applyColumn(Dataset data, Column column, Transformation transformation) {
        Double[] numbers = numericValues(column);
        double[] present = present(numbers);
        String method = transformation.stringParam("method", "iqr");
        DoublePredicate outlier = present.length == 0 ? x -> false : detector(method, present, transformation);

        List<Integer> affected = new ArrayList<>();
        List<Integer> kept = new ArrayList<>();
        for (int row = 0; row < numbers.length; row++) {
            if (numbers[row] != null && outlier.test(numbers[row])) {
                affected.add(row);
            } else {
                kept.add(row);
            }
        }

        String action = transformation.stringParam("action", "remove");
        Dataset result = switch (action) {
            case "remove" -> data.selectRows(kept);
            case "mask" -> data.withColumn(mask(column, affected));
            default -> throw new TransformationException("Unknown outlier action", Map.of("action", action));
        };
        return new AppliedTransformation(result, new ReversalContext.RowRemoval(column.getName(), List.copyOf(affected)));
    }

    @Override
    protected Dataset reverseColumn(Dataset data, Transformation transformation, ReversalContext context) {
        throw new TransformationException("Outlier removal is not reversible");
    }

    private static DoublePredicate detector(String method, double[] present, Transformation transformation) {
        return switch (method) {
            case "iqr" -> {
                double threshold = transformation.doubleParam("threshold", 1.5);
                double q1 = Statistics.quantile(present, 0.25);
                double q3 = Statistics.quantile(present, 0.75);
                double iqr = q3 - q1;
                double lower = q1 - threshold * iqr;
                double upper = q3 + threshold * iqr;
                yield x -> x < lower || x > upper;
            }
            case "zscore" -> {
                double threshold = transformation.doubleParam("threshold", 3.0);
                double mean = Statistics.mean(present);
                double std = Statistics.sampleStd(present, mean);
                if (!(std > 0)) {
                    yield x -> false;
                }
                yield x -> Math.abs((x - mean) / std) > threshold;
            }
            default -> throw new TransformationException("Unknown outlier method", Map.of("method", method));
        };
    }

    private static Column mask(Column column, List<Integer> rows) {
        List<Object> values = new ArrayList<>(column.getValues());
        rows.forEach(row -> values.set(row, null));
        return column.withValues(column.getType(), values);
    }
}
