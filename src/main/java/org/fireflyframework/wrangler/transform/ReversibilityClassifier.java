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

package org.fireflyframework.wrangler.transform;

import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationType;

import java.util.Map;

/**
 * Decides whether a transformation can be undone.
 *
 * <ul>
 *   <li>normalize, encode_categorical and cast_type are always reversible</li>
 *   <li>remove_outliers and drop_duplicates never are</li>
 *   <li>fill_missing is reversible only with the {@code constant} strategy, since the fill value
 *       identifies the positions that were missing</li>
 * </ul>
 */
public class ReversibilityClassifier {

    public Reversibility classify(Transformation transformation) {
        return classify(transformation.getType(), transformation.getParams());
    }

    public Reversibility classify(TransformationType type, Map<String, Object> params) {
        return switch (type) {
            case NORMALIZE, ENCODE_CATEGORICAL, CAST_TYPE ->
                    new Reversibility(true, type.getValue() + " transformations are reversible");
            case REMOVE_OUTLIERS -> new Reversibility(false, "Outlier removal permanently destroys the affected values");
            case DROP_DUPLICATES -> new Reversibility(false, "Duplicate removal permanently removes rows");
            case FILL_MISSING -> classifyFill(params);
        };
    }

    public boolean isReversible(TransformationType type, Map<String, Object> params) {
        return classify(type, params).reversible();
    }

    private Reversibility classifyFill(Map<String, Object> params) {
        Object strategy = params == null ? null : params.get("strategy");
        if ("constant".equals(strategy)) {
            return new Reversibility(true, "Constant fill is reversible (fill value is known)");
        }
        return new Reversibility(false, "Fill with " + strategy + " is not reversible (original values lost)");
    }
}
