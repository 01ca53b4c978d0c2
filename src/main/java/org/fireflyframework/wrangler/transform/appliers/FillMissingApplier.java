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
import org.fireflyframework.wrangler.model.CellValues;
import org.fireflyframework.wrangler.model.Column;
import org.fireflyframework.wrangler.model.DataType;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationType;
import org.fireflyframework.wrangler.profiling.Statistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces missing cells with a statistic of the column or a constant.
 *
 * <p>Parameters: {@code strategy} ({@code mean}, {@code median}, {@code mode} or {@code constant},
 * default {@code mean}) and {@code fill_value} for the constant strategy (default {@code 0}).
 * Only constant fills can be reversed.</p>
 */
public class FillMissingApplier extends AbstractColumnApplier {

    @Override
    public TransformationType getType() {
        return TransformationType.FILL_MISSING;
    }

    @Override
    protected AppliedTransformation applyColumn(Dataset data, Column column, Transformation transformation) {
        String strategy = transformation.stringParam("strategy", "mean");
        Object fillValue = fillValue(column, strategy, transformation);

        List<Object> values = new ArrayList<>(column.getValues());
        List<Integer> filled = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            if (CellValues.isMissing(values.get(i))) {
                values.set(i, fillValue);
                filled.add(i);
            }
        }

        Column result = harmonize(column, values, fillValue);
        ReversalContext context = new ReversalContext.FillContext(
                column.getName(), column.getType(), strategy, fillValue, List.copyOf(filled));
        return new AppliedTransformation(data.withColumn(result), context);
    }

    @Override
    protected Dataset reverseColumn(Dataset data, Transformation transformation, ReversalContext context) {
        ReversalContext.FillContext fill = contextAs(context, ReversalContext.FillContext.class);
        if (!"constant".equals(fill.strategy())) {
            throw new TransformationException("Fill with " + fill.strategy() + " is not reversible");
        }
        Column column = requireColumn(data, fill.column());
        List<Object> values = new ArrayList<>(column.getValues());
        for (int row : fill.filledRows()) {
            values.set(row, null);
        }
        return data.withColumn(column.withValues(fill.originalType(), restoreType(values, fill.originalType())));
    }

    private Object fillValue(Column column, String strategy, Transformation transformation) {
        return switch (strategy) {
            case "constant" -> transformation.param("fill_value", 0);
            case "mean" -> Statistics.mean(requireValues(column, strategy));
            case "median" -> Statistics.median(requireValues(column, strategy));
            case "mode" -> mode(column);
            default -> throw new TransformationException("Unknown fill strategy", Map.of("strategy", strategy));
        };
    }

    private double[] requireValues(Column column, String strategy) {
        double[] numbers = present(numericValues(column));
        if (numbers.length == 0) {
            throw new TransformationException("No values to compute the " + strategy + " from",
                    Map.of("column", column.getName()));
        }
        return numbers;
    }

    private static Object mode(Column column) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (Object value : column.nonMissingValues()) {
            counts.merge(value, 1, Integer::sum);
        }
        Object mode = null;
        int best = 0;
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            int count = entry.getValue();
            if (count > best || (count == best && CellValues.compare(entry.getKey(), mode) < 0)) {
                mode = entry.getKey();
                best = count;
            }
        }
        if (mode == null) {
            throw new TransformationException("No values to compute the mode from", Map.of("column", column.getName()));
        }
        return mode;
    }

    /**
     * Keeps a numeric column uniformly typed after the fill: integral fills keep an integer
     * column integral, fractional ones promote it to float.
     */
    private static Column harmonize(Column column, List<Object> values, Object fillValue) {
        if (column.getType().isNumeric() && fillValue instanceof Number) {
            double fill = ((Number) fillValue).doubleValue();
            boolean integral = column.getType() == DataType.INTEGER && fill == Math.rint(fill);
            DataType type = integral ? DataType.INTEGER : DataType.FLOAT;
            return column.withValues(type, restoreType(values, type));
        }
        return column.withValues(DataType.infer(values), values);
    }

    private static List<Object> restoreType(List<Object> values, DataType type) {
        if (!type.isNumeric()) {
            return values;
        }
        List<Object> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            Double number = CellValues.toDouble(value);
            if (number == null) {
                converted.add(value);
            } else {
                converted.add(type == DataType.INTEGER ? (Object) Math.round(number) : (Object) number);
            }
        }
        return converted;
    }
}
