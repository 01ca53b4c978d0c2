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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Converts a column to another type.
 *
 * <p>{@code target_type} is one of {@code numeric}, {@code datetime}, {@code string},
 * {@code boolean} or {@code category}. Values that cannot be converted become missing.
 * The original value of every row that would not convert back exactly is kept in the
 * reversal context, so reversal restores the column cell for cell.</p>
 */
public class CastTypeApplier extends AbstractColumnApplier {

    private static final Set<String> FALSE_TOKENS = Set.of("false", "no", "0", "f", "n", "");

    @Override
    public TransformationType getType() {
        return TransformationType.CAST_TYPE;
    }

    @Override
    protected AppliedTransformation applyColumn(Dataset data, Column column, Transformation transformation) {
        String target = transformation.stringParam("target_type", "string");
        List<Object> converted = switch (target) {
            case "numeric" -> convert(column, CastTypeApplier::toNumber);
            case "datetime" -> convert(column, CellValues::toDateTime);
            case "string", "category" -> convert(column, String::valueOf);
            case "boolean" -> convert(column, CastTypeApplier::toBoolean);
            default -> throw new TransformationException("Unknown cast target", Map.of("target_type", target));
        };
        DataType targetType = switch (target) {
            case "numeric" -> numericType(converted);
            case "datetime" -> DataType.DATETIME;
            case "boolean" -> DataType.BOOLEAN;
            default -> DataType.STRING;
        };
        if (targetType == DataType.INTEGER) {
            converted = converted.stream()
                    .map(value -> value == null ? null : (Object) Math.round((Double) value))
                    .toList();
        }

        Map<Integer, Object> residuals = new LinkedHashMap<>();
        for (int row = 0; row < column.size(); row++) {
            Object original = column.get(row);
            if (!Objects.equals(restore(converted.get(row), column.getType()), original)) {
                residuals.put(row, original);
            }
        }

        ReversalContext context = new ReversalContext.CastContext(column.getName(), column.getType(), residuals);
        return new AppliedTransformation(data.withColumn(column.withValues(targetType, converted)), context);
    }

    @Override
    protected Dataset reverseColumn(Dataset data, Transformation transformation, ReversalContext context) {
        ReversalContext.CastContext cast = contextAs(context, ReversalContext.CastContext.class);
        Column column = requireColumn(data, cast.column());
        List<Object> restored = new ArrayList<>(column.size());
        for (int row = 0; row < column.size(); row++) {
            restored.add(cast.residuals().containsKey(row)
                    ? cast.residuals().get(row)
                    : restore(column.get(row), cast.originalType()));
        }
        return data.withColumn(column.withValues(cast.originalType(), restored));
    }

    private static List<Object> convert(Column column, Function<Object, Object> converter) {
        List<Object> converted = new ArrayList<>(column.size());
        for (Object value : column.getValues()) {
            converted.add(CellValues.isMissing(value) ? null : converter.apply(value));
        }
        return converted;
    }

    private static Object toNumber(Object value) {
        return CellValues.toDouble(value);
    }

    private static Object toBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        return !FALSE_TOKENS.contains(String.valueOf(value).trim().toLowerCase(Locale.ROOT));
    }

    private static DataType numericType(List<Object> converted) {
        boolean integral = converted.stream()
                .filter(Objects::nonNull)
                .allMatch(value -> {
                    double number = (Double) value;
                    return number == Math.rint(number) && Math.abs(number) < Long.MAX_VALUE;
                });
        return integral ? DataType.INTEGER : DataType.FLOAT;
    }

    /**
     * Converts a cast value back into the representation of the original type.
     */
    private static Object restore(Object value, DataType originalType) {
        if (CellValues.isMissing(value)) {
            return null;
        }
        return switch (originalType) {
            case STRING -> String.valueOf(value);
            case INTEGER -> {
                Double number = CellValues.toDouble(value);
                yield number == null ? null : (Object) Math.round(number);
            }
            case FLOAT -> value instanceof Boolean ? (Object) (((Boolean) value) ? 1.0 : 0.0) : CellValues.toDouble(value);
            case BOOLEAN -> toBoolean(value);
            case DATETIME -> CellValues.toDateTime(value);
        };
    }
}
