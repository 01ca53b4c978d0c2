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
import org.fireflyframework.wrangler.model.DataType;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationType;
import org.fireflyframework.wrangler.profiling.Statistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Rescales numeric columns.
 *
 * <ul>
 *   <li>{@code standard} - {@code (x - mean) / std}, sample standard deviation; a constant column maps to 0</li>
 *   <li>{@code minmax} - {@code (x - min) / (max - min)}; a constant column maps to 0.5</li>
 *   <li>{@code robust} - {@code (x - median) / IQR}; a zero IQR maps to 0</li>
 * </ul>
 *
 * <p>Missing cells stay missing. Reversal restores the original integer type when every
 * restored value is whole.</p>
 */
public class NormalizeApplier extends AbstractColumnApplier {

    private static final double INTEGRAL_TOLERANCE = 1e-6;

    @Override
    public TransformationType getType() {
        return TransformationType.NORMALIZE;
    }

    @Override
    protected AppliedTransformation applyColumn(Dataset data, Column column, Transformation transformation) {
        Double[] numbers = numericValues(column);
        double[] present = present(numbers);
        if (present.length == 0) {
            throw new TransformationException("Cannot normalize a column without values",
                    Map.of("column", column.getName()));
        }

        String method = transformation.stringParam("method", "standard");
        ReversalContext context;
        DoubleUnaryOperator scale;
        switch (method) {
            case "standard" -> {
                double mean = Statistics.mean(present);
                double std = present.length > 1 ? Statistics.sampleStd(present, mean) : 0.0;
                context = new ReversalContext.StandardScaling(column.getName(), column.getType(), mean, std);
                scale = std > 0 ? x -> (x - mean) / std : x -> 0.0;
            }
            case "minmax" -> {
                double min = Statistics.min(present);
                double max = Statistics.max(present);
                context = new ReversalContext.MinMaxScaling(column.getName(), column.getType(), min, max);
                scale = max > min ? x -> (x - min) / (max - min) : x -> 0.5;
            }
            case "robust" -> {
                double median = Statistics.median(present);
                double iqr = Statistics.quantile(present, 0.75) - Statistics.quantile(present, 0.25);
                context = new ReversalContext.RobustScaling(column.getName(), column.getType(), median, iqr);
                scale = iqr > 0 ? x -> (x - median) / iqr : x -> 0.0;
            }
            default -> throw new TransformationException("Unknown normalization method", Map.of("method", method));
        }

        List<Object> scaled = map(numbers, scale);
        return new AppliedTransformation(data.withColumn(column.withValues(DataType.FLOAT, scaled)), context);
    }

    @Override
    protected Dataset reverseColumn(Dataset data, Transformation transformation, ReversalContext context) {
        String name;
        DataType originalType;
        DoubleUnaryOperator unscale;
        if (context instanceof ReversalContext.StandardScaling) {
            ReversalContext.StandardScaling standard = (ReversalContext.StandardScaling) context;
            name = standard.column();
            originalType = standard.originalType();
            unscale = x -> x * standard.std() + standard.mean();
        } else if (context instanceof ReversalContext.MinMaxScaling) {
            ReversalContext.MinMaxScaling minMax = (ReversalContext.MinMaxScaling) context;
            name = minMax.column();
            originalType = minMax.originalType();
            double range = minMax.max() - minMax.min();
            unscale = range > 0 ? x -> x * range + minMax.min() : x -> minMax.min();
        } else {
            ReversalContext.RobustScaling robust = contextAs(context, ReversalContext.RobustScaling.class);
            name = robust.column();
            originalType = robust.originalType();
            unscale = x -> x * robust.iqr() + robust.median();
        }

        Column column = requireColumn(data, name);
        List<Object> restored = map(numericValues(column), unscale);
        if (originalType == DataType.INTEGER && allWhole(restored)) {
            restored = restored.stream()
                    .map(value -> value == null ? null : (Object) Math.round((Double) value))
                    .toList();
            return data.withColumn(column.withValues(DataType.INTEGER, restored));
        }
        return data.withColumn(column.withValues(DataType.FLOAT, restored));
    }

    private static List<Object> map(Double[] numbers, DoubleUnaryOperator operator) {
        List<Object> mapped = new ArrayList<>(numbers.length);
        for (Double number : numbers) {
            mapped.add(number == null ? null : operator.applyAsDouble(number));
        }
        return mapped;
    }

    private static boolean allWhole(List<Object> values) {
        return values.stream()
                .filter(value -> value != null)
                .mapToDouble(value -> (Double) value)
                .allMatch(value -> Math.abs(value - Math.rint(value)) < INTEGRAL_TOLERANCE);
    }
}
