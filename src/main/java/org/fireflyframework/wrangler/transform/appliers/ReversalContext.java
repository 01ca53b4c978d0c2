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

import org.fireflyframework.wrangler.model.DataType;

import java.util.List;
import java.util.Map;

/**
 * Typed state captured while applying a transformation, sufficient to undo it.
 *
 * <p>Each applier produces and consumes its own record type. The executor keeps contexts
 * keyed by transformation id.</p>
 */
public interface ReversalContext {

    /** Positions filled by a fill_missing transformation, with the value used. */
    record FillContext(String column, DataType originalType, String strategy, Object fillValue,
                       List<Integer> filledRows) implements ReversalContext {}

    /** Fitted z-score parameters. */
    record StandardScaling(String column, DataType originalType, double mean, double std)
            implements ReversalContext {}

    /** Fitted min-max bounds. */
    record MinMaxScaling(String column, DataType originalType, double min, double max)
            implements ReversalContext {}

    /** Fitted median and interquartile range. */
    record RobustScaling(String column, DataType originalType, double median, double iqr)
            implements ReversalContext {}

    /** Category to code mapping of a label encoding. */
    record LabelEncoding(String column, DataType originalType, Map<Object, Integer> mapping)
            implements ReversalContext {}

    /** Indicator column to category mapping of a one-hot encoding. */
    record OneHotEncoding(String column, int position, DataType originalType, Map<String, Object> indicators)
            implements ReversalContext {}

    /**
     * Original type of a cast, plus the original value of every row whose converted value
     * does not convert back to it.
     */
    record CastContext(String column, DataType originalType, Map<Integer, Object> residuals)
            implements ReversalContext {}

    /** Rows dropped or masked by a destructive transformation; kept for diagnostics only. */
    record RowRemoval(String column, List<Integer> affectedRows) implements ReversalContext {}

    /** Per-column contexts of a transformation targeting several columns, in application order. */
    record MultiColumn(List<ReversalContext> contexts) implements ReversalContext {}
}
