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

package org.fireflyframework.wrangler.model;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, column-ordered in-memory table.
 *
 * <p>All columns share the same length. Every mutating operation returns a new
 * {@code Dataset}; the receiver is never modified, so one instance can be shared
 * freely between concurrent candidate evaluations.</p>
 *
 * <pre>{@code
 * Dataset data = Dataset.builder()
 *         .column("age", DataType.INTEGER, 25L, null, 40L)
 *         .column("city", DataType.STRING, "Paris", "Lyon", "Paris")
 *         .build();
 * }</pre>
 */
@EqualsAndHashCode(of = "columns")
public final class Dataset {

    private static final Dataset EMPTY = new Dataset(List.of());

    private final List<Column> columns;
    private final Map<String, Integer> positions;
    private final int rowCount;

    private Dataset(List<Column> columns) {
        Map<String, Integer> index = new LinkedHashMap<>();
        int rows = columns.isEmpty() ? 0 : columns.get(0).size();
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            if (index.putIfAbsent(column.getName(), i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
            if (column.size() != rows) {
                throw new IllegalArgumentException("Column '" + column.getName() + "' has " + column.size()
                        + " values, expected " + rows);
            }
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.positions = Collections.unmodifiableMap(index);
        this.rowCount = rows;
    }

    public static Dataset of(List<Column> columns) {
        return columns.isEmpty() ? EMPTY : new Dataset(columns);
    }

    public static Dataset of(Column... columns) {
        return of(Arrays.asList(columns));
    }

    public static Dataset empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Column> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return List.copyOf(positions.keySet());
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public long getCellCount() {
        return (long) rowCount * columns.size();
    }

    public boolean hasColumn(String name) {
        return positions.containsKey(name);
    }

    public int indexOf(String name) {
        Integer position = positions.get(name);
        return position == null ? -1 : position;
    }

    public Optional<Column> findColumn(String name) {
        Integer position = positions.get(name);
        return position == null ? Optional.empty() : Optional.of(columns.get(position));
    }

    /**
     * @throws IllegalArgumentException if no column carries the given name
     */
    public Column column(String name) {
        return findColumn(name)
                .orElseThrow(() -> new IllegalArgumentException("Column not found: " + name));
    }

    public List<Object> row(int index) {
        List<Object> row = new ArrayList<>(columns.size());
        for (Column column : columns) {
            row.add(column.get(index));
        }
        return row;
    }

    public List<List<Object>> rows() {
        List<List<Object>> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            rows.add(row(i));
        }
        return rows;
    }

    /**
     * Replaces the column with the same name in place, or appends it.
     */
    public Dataset withColumn(Column column) {
        List<Column> updated = new ArrayList<>(columns);
        int position = indexOf(column.getName());
        if (position >= 0) {
            updated.set(position, column);
        } else {
            updated.add(column);
        }
        return new Dataset(updated);
    }

    public Dataset withColumnAt(int position, Column column) {
        List<Column> updated = new ArrayList<>(columns);
        updated.add(Math.min(Math.max(position, 0), updated.size()), column);
        return new Dataset(updated);
    }

    public Dataset withoutColumn(String name) {
        if (!hasColumn(name)) {
            return this;
        }
        List<Column> updated = new ArrayList<>(columns);
        updated.remove(indexOf(name));
        return of(updated);
    }

    /**
     * Keeps only the given rows, in the given order.
     */
    public Dataset selectRows(List<Integer> rowIndexes) {
        List<Column> selected = new ArrayList<>(columns.size());
        for (Column column : columns) {
            List<Object> values = new ArrayList<>(rowIndexes.size());
            for (int index : rowIndexes) {
                values.add(column.get(index));
            }
            selected.add(column.withValues(column.getType(), values));
        }
        return of(selected);
    }

    @Override
    public String toString() {
        return "Dataset[rows=" + rowCount + ", columns=" + getColumnNames() + "]";
    }

    /**
     * Fluent builder collecting columns in insertion order.
     */
    public static final class Builder {

        private final List<Column> columns = new ArrayList<>();

        private Builder() {}

        public Builder column(Column column) {
            columns.add(column);
            return this;
        }

        public Builder column(String name, DataType type, Object... values) {
            return column(Column.of(name, type, values));
        }

        public Builder column(String name, List<?> values) {
            return column(Column.inferred(name, values));
        }

        public Dataset build() {
            return Dataset.of(columns);
        }
    }
}
