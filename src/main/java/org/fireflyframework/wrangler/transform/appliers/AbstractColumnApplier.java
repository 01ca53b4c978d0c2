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
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.Transformation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Base class for appliers that work column by column on the transformation's targets.
 *
 * <p>Several target columns are processed in order, each producing its own context; those are
 * bundled in a {@link ReversalContext.MultiColumn} and undone in reverse order.</p>
 */
public abstract class AbstractColumnApplier implements TransformApplier {

    @Override
    public AppliedTransformation apply(Dataset data, Transformation transformation) {
        List<String> targets = transformation.getTargetColumns();
        if (targets.isEmpty()) {
            throw new TransformationException(getType() + " requires at least one target column");
        }

        Dataset current = data;
        List<ReversalContext> contexts = new ArrayList<>(targets.size());
        for (String name : targets) {
            AppliedTransformation applied = applyColumn(current, requireColumn(current, name), transformation);
            current = applied.data();
            contexts.add(applied.context());
        }
        ReversalContext context = contexts.size() == 1 ? contexts.get(0) : new ReversalContext.MultiColumn(contexts);
        return new AppliedTransformation(current, context);
    }

    @Override
    public Dataset reverse(Dataset data, Transformation transformation, ReversalContext context) {
        if (context instanceof ReversalContext.MultiColumn) {
            List<ReversalContext> contexts = ((ReversalContext.MultiColumn) context).contexts();
            Dataset current = data;
            for (int i = contexts.size() - 1; i >= 0; i--) {
                current = reverseColumn(current, transformation, contexts.get(i));
            }
            return current;
        }
        return reverseColumn(data, transformation, context);
    }

    protected abstract AppliedTransformation applyColumn(Dataset data, Column column, Transformation transformation);

    protected abstract Dataset reverseColumn(Dataset data, Transformation transformation, ReversalContext context);

    protected static Column requireColumn(Dataset data, String name) {
        return data.findColumn(name).orElseThrow(() ->
                new TransformationException("Column not found", Map.of("column", name)));
    }

    protected <T extends ReversalContext> T contextAs(ReversalContext context, Class<T> type) {
        if (!type.isInstance(context)) {
            throw new TransformationException("Unexpected reversal context for " + getType(),
                    Map.of("expected", type.getSimpleName(),
                            "actual", context == null ? "none" : context.getClass().getSimpleName()));
        }
        return type.cast(context);
    }

    /**
     * Reads every non-missing value of a column as a double.
     *
     * @return the values, {@code null} at missing positions
     * @throws TransformationException if a present value is not numeric
     */
    protected static Double[] numericValues(Column column) {
        Double[] numbers = new Double[column.size()];
        for (int i = 0; i < column.size(); i++) {
            Object value = column.get(i);
            if (CellValues.isMissing(value)) {
                continue;
            }
            Double number = CellValues.toDouble(value);
            if (number == null) {
                throw new TransformationException("Column contains non-numeric values",
                        Map.of("column", column.getName(), "row", i));
            }
            numbers[i] = number;
        }
        return numbers;
    }

    protected static double[] present(Double[] numbers) {
        return Arrays.stream(numbers)
                .filter(value -> value != null)
                .mapToDouble(Double::doubleValue)
                .toArray();
    }
}
