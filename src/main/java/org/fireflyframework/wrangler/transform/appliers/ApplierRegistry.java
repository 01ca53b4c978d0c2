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

import org.fireflyframework.wrangler.model.TransformationType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Maps each {@link TransformationType} to the factory of its {@link TransformApplier}.
 *
 * <p>Factories are invoked once, when an executor is built from the registry.</p>
 */
public class ApplierRegistry {

    private final Map<TransformationType, Supplier<? extends TransformApplier>> factories =
            new EnumMap<>(TransformationType.class);

    /**
     * Creates a registry holding the built-in applier of every transformation type.
     *
     * @return the default registry
     */
    public static ApplierRegistry defaults() {
        return new ApplierRegistry()
                .register(TransformationType.FILL_MISSING, FillMissingApplier::new)
                .register(TransformationType.NORMALIZE, NormalizeApplier::new)
                .register(TransformationType.ENCODE_CATEGORICAL, EncodeCategoricalApplier::new)
                .register(TransformationType.REMOVE_OUTLIERS, RemoveOutliersApplier::new)
                .register(TransformationType.DROP_DUPLICATES, DropDuplicatesApplier::new)
                .register(TransformationType.CAST_TYPE, CastTypeApplier::new);
    }

    public ApplierRegistry register(TransformationType type, Supplier<? extends TransformApplier> factory) {
        factories.put(type, factory);
        return this;
    }

    public ApplierRegistry unregister(TransformationType type) {
        factories.remove(type);
        return this;
    }

    /**
     * Instantiates one applier per registered type.
     */
    public Map<TransformationType, TransformApplier> instantiate() {
        Map<TransformationType, TransformApplier> appliers = new EnumMap<>(TransformationType.class);
        factories.forEach((type, factory) -> appliers.put(type, factory.get()));
        return Collections.unmodifiableMap(appliers);
    }
}
