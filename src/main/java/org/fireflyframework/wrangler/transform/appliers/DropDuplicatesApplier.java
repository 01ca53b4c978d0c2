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
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drops repeated rows, keeping the first occurrence.
 *
 * <p>Rows are compared on the target columns, or on all columns when there are none.
 * Not reversible.</p>
 */
public class DropDuplicatesApplier implements TransformApplier {

    @Override
    public TransformationType getType() {
        return TransformationType.DROP_DUPLICATES;
    }

    @Override
    public AppliedTransformation apply(Dataset data, Transformation transformation) {
        List<String> subset = transformation.getTargetColumns().isEmpty()
                ? data.getColumnNames()
                : transformation.getTargetColumns();
        List<Integer> positions = new ArrayList<>(subset.size());
        for (String name : subset) {
            int position = data.indexOf(name);
            if (position < 0) {
                throw new TransformationException("Column not found", Map.of("column", name));
            }
            positions.add(position);
        }

        Set<List<Object>> seen = new HashSet<>();
        List<Integer> kept = new ArrayList<>();
        List<Integer> dropped = new ArrayList<>();
        for (int row = 0; row < data.getRowCount(); row++) {
            List<Object> full = data.row(row);
            List<Object> key = new ArrayList<>(positions.size());
            positions.forEach(position -> key.add(full.get(position)));
            if (seen.add(key)) {
                kept.add(row);
            } else {
                dropped.add(row);
            }
        }
        return new AppliedTransformation(data.selectRows(kept), new ReversalContext.RowRemoval(null, List.copyOf(dropped)));
    }

    @Override
    public Dataset reverse(Dataset data, Transformation transformation, ReversalContext context) {
        throw new TransformationException("Duplicate removal is not reversible");
    }
}
