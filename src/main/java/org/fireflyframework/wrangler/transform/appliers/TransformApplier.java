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

import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationType;

/**
 * Port interface for the per-type data operations behind a {@link Transformation}.
 *
 * <p>Appliers are stateless: everything needed to undo an application travels in the
 * returned {@link ReversalContext}. Both methods signal failure with a
 * {@link org.fireflyframework.wrangler.exception.TransformationException}.</p>
 */
public interface TransformApplier {

    /**
     * Returns the transformation type this applier handles.
     *
     * @return the handled type
     */
    TransformationType getType();

    /**
     * Applies the transformation.
     *
     * @param data           the input dataset, never modified
     * @param transformation the transformation to apply
     * @return the transformed dataset and its reversal context
     */
    AppliedTransformation apply(Dataset data, Transformation transformation);

    /**
     * Undoes an earlier application.
     *
     * @param data           the transformed dataset
     * @param transformation the transformation that produced it
     * @param context        the context captured by {@link #apply}
     * @return the restored dataset
     */
    Dataset reverse(Dataset data, Transformation transformation, ReversalContext context);
}
