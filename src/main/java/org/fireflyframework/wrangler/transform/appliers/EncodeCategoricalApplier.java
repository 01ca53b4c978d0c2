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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes categorical columns as numbers.
 *
 * <ul>
 *   <li>{@code label} - replaces each category with its index in sorted category order</li>
 *   <li>{@code onehot} - replaces the column with one boolean indicator column per category,
 *       named {@code <column>_<category>}</li>
 * </ul>
 */
public class EncodeCategoricalApplier extends AbstractColumnApplier {

    @Override
    public TransformationType getType() {
        return TransformationType.ENCODE_CATEGORICAL;
    }

    @Override
    protected AppliedTransformation applyColumn(Dataset data, Column column, Transformation transformation) {
        String method = transformation.stringParam("method", "label");
        List<Object> categories = sortedCategories(column);
        return switch (method) {
            case "label" -> labelEncode(data, column, categories);
            case "onehot" -> oneHotEncode(data, column, categories);
            default -> throw new TransformationException("Unknown encoding method", Map.of("method", method));
        };
    }

    @Override
    protected Dataset reverseColumn(Dataset data, Transformation transformation, ReversalContext context) {
        if (context instanceof ReversalContext.OneHotEncoding) {
            return reverseOneHot(data, (ReversalContext.OneHotEncoding) context);
        }
        return reverseLabel(data, contextAs(context, ReversalContext.LabelEncoding.class));
    }

    private AppliedTransformation labelEncode(Dataset data, Column column, List<Object> categories) {
        Map<Object, Integer> mapping = new LinkedHashMap<>();
        for (int i = 0; i < categories.size(); i++) {
            mapping.put(categories.get(i), i);
        }

        List<Object> codes = new ArrayList<>(column.size());
        for (Object value : column.getValues()) {
            codes.add(CellValues.isMissing(value) ? null : (Object) (long) mapping.get(value));
        }

        ReversalContext context = new ReversalContext.LabelEncoding(
                column.getName(), column.getType(), Collections.unmodifiableMap(mapping));
        return new AppliedTransformation(data.withColumn(column.withValues(DataType.INTEGER, codes)), context);
    }

    private Dataset reverseLabel(Dataset data, ReversalContext.LabelEncoding context) {
        Map<Integer, Object> inverse = new HashMap<>();
        context.mapping().forEach((category, code) -> inverse.put(code, category));

        Column column = requireColumn(data, context.column());
        List<Object> restored = new ArrayList<>(column.size());
        for (int row = 0; row < column.size(); row++) {
            Object code = column.get(row);
            if (CellValues.isMissing(code)) {
                restored.add(null);
                continue;
            }
            Double number = CellValues.toDouble(code);
            Object category = number == null ? null : inverse.get((int) Math.round(number));
            if (category == null) {
                throw new TransformationException("Unknown label code",
                        Map.of("column", context.column(), "row", row, "code", code));
            }
            restored.add(category);
        }
        return data.withColumn(column.withValues(context.originalType(), restored));
    }

    private AppliedTransformation oneHotEncode(Dataset data, Column column, List<Object> categories) {
        Map<String, Object> indicators = new LinkedHashMap<>();
        for (Object category : categories) {
            String name = column.getName() + "_" + category;
            if (data.hasColumn(name) || indicators.containsKey(name)) {
                throw new TransformationException("Indicator column name already in use", Map.of("column", name));
            }
            indicators.put(name, category);
        }

        int position = data.indexOf(column.getName());
        Dataset result = data.withoutColumn(column.getName());
        int offset = 0;
        for (Map.Entry<String, Object> indicator : indicators.entrySet()) {
            List<Object> flags = new ArrayList<>(column.size());
            for (Object value : column.getValues()) {
                flags.add(!CellValues.isMissing(value) && value.equals(indicator.getValue()));
            }
            result = result.withColumnAt(position + offset++, new Column(indicator.getKey(), DataType.BOOLEAN, flags));
        }

        ReversalContext context = new ReversalContext.OneHotEncoding(
                column.getName(), position, column.getType(), Collections.unmodifiableMap(indicators));
        return new AppliedTransformation(result, context);
    }

    private Dataset reverseOneHot(Dataset data, ReversalContext.OneHotEncoding context) {
        int rows = data.getRowCount();
        List<Object> restored = new ArrayList<>(Collections.nCopies(rows, null));
        Dataset result = data;
        for (Map.Entry<String, Object> indicator : context.indicators().entrySet()) {
            Column flags = requireColumn(data, indicator.getKey());
            for (int row = 0; row < rows; row++) {
                if (Boolean.TRUE.equals(flags.get(row))) {
                    restored.set(row, indicator.getValue());
                }
            }
            result = result.withoutColumn(indicator.getKey());
        }
        return result.withColumnAt(context.position(), new Column(context.column(), context.originalType(), restored));
    }

    private static List<Object> sortedCategories(Column column) {
        List<Object> categories = new ArrayList<>(column.distinctValues());
        categories.sort(CellValues::compare);
        return categories;
    }
}
