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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mean share of values consistent with their column's type.
 *
 * <p>Numeric columns count values that coerce to numbers, datetime columns values that parse
 * as timestamps. Free-form columns count the values of the dominant kind among boolean,
 * numeric, string and other. A column without values is consistent.</p>
 */
public class ConsistencyMetric extends AbstractColumnMetric {

    @Override
    protected double scoreColumn(Column column, ColumnProfile profile) {
        List<Object> values = column.nonMissingValues();
        if (values.isEmpty()) {
            return 1.0;
        }
        return switch (column.getType()) {
            case INTEGER, FLOAT -> share(values.stream().filter(CellValues::isNumeric).count(), values.size());
            case DATETIME -> share(values.stream().filter(value -> CellValues.toDateTime(value) != null).count(),
                    values.size());
            case BOOLEAN -> share(values.stream().filter(value -> value instanceof Boolean).count(), values.size());
            case STRING -> dominantKindShare(values);
        };
    }

    private static double dominantKindShare(List<Object> values) {
        Map<String, Integer> kinds = new HashMap<>();
        for (Object value : values) {
            kinds.merge(kindOf(value), 1, Integer::sum);
        }
        return share(Collections.max(kinds.values()), values.size());
    }

    private static String kindOf(Object value) {
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof Number) {
            return "numeric";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        return "other";
    }

    private static double share(long count, int total) {
        return (double) count / total;
    }

    @Override
    public String getMetricName() {
        return QualityMetrics.CONSISTENCY;
    }
}
