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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wrangler.exception.ProfilingException;
import org.fireflyframework.wrangler.model.CellValues;
import org.fireflyframework.wrangler.model.Column;
import org.fireflyframework.wrangler.model.ColumnProfile;
import org.fireflyframework.wrangler.model.DataProfile;
import org.fireflyframework.wrangler.model.DataType;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.InferredType;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Single-pass profiler computing counts, numeric summaries and semantic types.
 *
 * <p>Semantic types are tried in order: boolean, datetime, numeric, categorical, text.
 * A string column counts as numeric or datetime when more than 80% of its values parse.</p>
 */
@Slf4j
public class DefaultDataProfiler implements DataProfiler {

    private static final Set<String> BOOLEAN_TOKENS =
            Set.of("true", "false", "1", "0", "yes", "no", "t", "f", "y", "n");
    private static final double PARSE_RATIO = 0.8;
    private static final double CATEGORICAL_RATIO = 0.6;

    @Override
    public DataProfile profile(Dataset data) {
        if (data == null) {
            throw new ProfilingException("Cannot profile a null dataset");
        }

        Map<String, ColumnProfile> columns = new LinkedHashMap<>();
        long missingCells = 0;
        for (Column column : data.getColumns()) {
            ColumnProfile profile = profileColumn(column, data.getRowCount());
            columns.put(column.getName(), profile);
            missingCells += profile.getNullCount();
        }

        double overallMissing = data.getCellCount() == 0 ? 0.0 : 100.0 * missingCells / data.getCellCount();
        int duplicates = countDuplicateRows(data);

        log.debug("Profiled dataset: rows={}, columns={}, duplicates={}",
                data.getRowCount(), data.getColumnCount(), duplicates);

        return DataProfile.builder()
                .timestamp(Instant.now())
                .rowCount(data.getRowCount())
                .columnCount(data.getColumnCount())
                .columns(columns)
                .overallMissingPercentage(overallMissing)
                .duplicateRows(duplicates)
                .build();
    }

    private ColumnProfile profileColumn(Column column, int rowCount) {
        List<Object> present = column.nonMissingValues();
        long nullCount = column.size() - present.size();
        int uniqueCount = column.distinctValues().size();
        InferredType inferred = inferType(column.getType(), present, uniqueCount);

        ColumnProfile.ColumnProfileBuilder builder = ColumnProfile.builder()
                .name(column.getName())
                .dtype(column.getType())
                .nullCount(nullCount)
                .nullPercentage(rowCount == 0 ? 0.0 : 100.0 * nullCount / rowCount)
                .uniqueCount(uniqueCount)
                .inferredType(inferred);

        if (inferred == InferredType.NUMERIC) {
            double[] numbers = present.stream()
                    .map(CellValues::toDouble)
                    .filter(value -> value != null && Double.isFinite(value))
                    .mapToDouble(Double::doubleValue)
                    .toArray();
            if (numbers.length > 0) {
                double mean = Statistics.mean(numbers);
                builder.min(Statistics.min(numbers))
                        .max(Statistics.max(numbers))
                        .mean(mean);
                if (numbers.length > 1) {
                    builder.std(Statistics.sampleStd(numbers, mean));
                }
            }
        }
        return builder.build();
    }

    InferredType inferType(DataType dtype, List<Object> present, int uniqueCount) {
        if (present.isEmpty()) {
            return InferredType.TEXT;
        }
        if (dtype == DataType.BOOLEAN || looksBoolean(present)) {
            return InferredType.BOOLEAN;
        }
        if (dtype == DataType.DATETIME) {
            return InferredType.DATETIME;
        }
        if (dtype.isNumeric()) {
            return InferredType.NUMERIC;
        }

        double numericRatio = parseRatio(present, CellValues::isNumeric);
        if (numericRatio <= PARSE_RATIO && parseRatio(present, value -> CellValues.toDateTime(value) != null) > PARSE_RATIO) {
            return InferredType.DATETIME;
        }
        if (numericRatio > PARSE_RATIO) {
            return InferredType.NUMERIC;
        }
        if ((double) uniqueCount / present.size() <= CATEGORICAL_RATIO) {
            return InferredType.CATEGORICAL;
        }
        return InferredType.TEXT;
    }

    private static boolean looksBoolean(List<Object> present) {
        Set<String> tokens = new HashSet<>();
        for (Object value : present) {
            String token = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
            if (!BOOLEAN_TOKENS.contains(token)) {
                return false;
            }
            tokens.add(token);
        }
        return tokens.size() <= 2;
    }

    private static double parseRatio(List<Object> present, Predicate<Object> parses) {
        long parsed = present.stream().filter(parses).count();
        return (double) parsed / present.size();
    }

    private static int countDuplicateRows(Dataset data) {
        Set<List<Object>> seen = new HashSet<>();
        int duplicates = 0;
        for (int i = 0; i < data.getRowCount(); i++) {
            if (!seen.add(data.row(i))) {
                duplicates++;
            }
        }
        return duplicates;
    }
}
