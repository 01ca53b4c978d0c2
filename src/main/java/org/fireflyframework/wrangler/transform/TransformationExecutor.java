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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wrangler.exception.WranglerException;
import org.fireflyframework.wrangler.model.Dataset;
import org.fireflyframework.wrangler.model.Transformation;
import org.fireflyframework.wrangler.model.TransformationResult;
import org.fireflyframework.wrangler.model.TransformationType;
import org.fireflyframework.wrangler.transform.appliers.AppliedTransformation;
import org.fireflyframework.wrangler.transform.appliers.ApplierRegistry;
import org.fireflyframework.wrangler.transform.appliers.ReversalContext;
import org.fireflyframework.wrangler.transform.appliers.TransformApplier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies transformations through their registered {@link TransformApplier} and keeps what is
 * needed to undo them.
 *
 * <p>{@link #execute} never throws: any failure becomes a {@link TransformationResult} with
 * {@code success=false} carrying the untouched input. Likewise {@link #reverse} reports refusals
 * and failures through a {@link ReversalResult}.</p>
 *
 * <p>The reversal context of every successful application is stored by transformation id.
 * The executor is safe for concurrent use.</p>
 */
@Slf4j
public class TransformationExecutor {

    private final Map<TransformationType, TransformApplier> appliers;
    private final Map<String, ReversalContext> reversalContexts = new ConcurrentHashMap<>();

    public TransformationExecutor() {
        this(ApplierRegistry.defaults());
    }

    public TransformationExecutor(ApplierRegistry registry) {
        this.appliers = registry.instantiate();
        log.info("Initialized TransformationExecutor with appliers for {}", appliers.keySet());
    }

    public TransformationResult execute(Dataset data, Transformation transformation) {
        long start = System.nanoTime();
        TransformApplier applier = appliers.get(transformation.getType());
        if (applier == null) {
            return TransformationResult.failure(transformation, data,
                    "Unknown transformation type: " + transformation.getType(), elapsedSince(start));
        }

        try {
            AppliedTransformation applied = applier.apply(data, transformation);
            reversalContexts.put(transformation.getId(), applied.context());
            return TransformationResult.success(transformation, applied.data(), elapsedSince(start));
        } catch (RuntimeException e) {
            log.debug("Transformation {} ({}) failed: {}", transformation.getId(), transformation.getType(), e.toString());
            return TransformationResult.failure(transformation, data, describe(e), elapsedSince(start));
        }
    }

    /**
     * Undoes a transformation previously applied by this executor, using the reversal context
     * recorded at application time.
     *
     * @param data           the transformed dataset
     * @param transformation the transformation to undo
     * @return the restored dataset, or the reason it could not be restored
     */
    public ReversalResult reverse(Dataset data, Transformation transformation) {
        if (!transformation.isReversible()) {
            return ReversalResult.failure(data, ReversalError.NOT_REVERSIBLE,
                    "Transformation " + transformation.getId() + " (" + transformation.getType() + ") is not reversible");
        }
        TransformApplier applier = appliers.get(transformation.getType());
        if (applier == null) {
            return ReversalResult.failure(data, ReversalError.UNKNOWN_TYPE,
                    "Unknown transformation type: " + transformation.getType());
        }
        ReversalContext context = reversalContexts.get(transformation.getId());
        if (context == null) {
            return ReversalResult.failure(data, ReversalError.NO_RECORDED_APPLICATION,
                    "Transformation " + transformation.getId() + " was not applied by this executor");
        }

        try {
            return ReversalResult.success(applier.reverse(data, transformation, context));
        } catch (RuntimeException e) {
            log.debug("Reversal of {} failed: {}", transformation.getId(), e.toString());
            return ReversalResult.failure(data, ReversalError.FAILED, describe(e));
        }
    }

    public boolean canReverse(Transformation transformation) {
        return transformation.isReversible()
                && appliers.containsKey(transformation.getType())
                && reversalContexts.containsKey(transformation.getId());
    }

    /**
     * Applies transformations in order, feeding each output into the next, and stops at the
     * first failure.
     *
     * @return the results produced so far, the last one being the failure if any
     */
    public List<TransformationResult> executeSequence(Dataset data, List<Transformation> transformations) {
        List<TransformationResult> results = new ArrayList<>(transformations.size());
        Dataset current = data;
        for (Transformation transformation : transformations) {
            TransformationResult result = execute(current, transformation);
            results.add(result);
            if (!result.isSuccess()) {
                log.warn("Stopping sequence at transformation {} ({}): {}",
                        transformation.getId(), transformation.getType(), result.getErrorMessage());
                break;
            }
            current = result.getData();
        }
        return results;
    }

    /**
     * Applies every transformation of a DAG in topological order, stopping at the first failure.
     */
    public List<TransformationResult> executeInOrder(Dataset data, TransformationDag dag) {
        return executeSequence(data, dag.topologicalSort());
    }

    /**
     * Undoes the successful results of a sequence, last first.
     *
     * @param data    the output of the last successful result
     * @param results the results returned by {@link #executeSequence}
     * @return the fully restored dataset, or the first failure with the dataset restored so far
     */
    public ReversalResult reverseSequence(Dataset data, List<TransformationResult> results) {
        Dataset current = data;
        for (int i = results.size() - 1; i >= 0; i--) {
            TransformationResult result = results.get(i);
            if (!result.isSuccess()) {
                continue;
            }
            ReversalResult reversal = reverse(current, result.getTransformation());
            if (!reversal.isSuccess()) {
                return reversal;
            }
            current = reversal.getData();
        }
        return ReversalResult.success(current);
    }

    public Optional<ReversalContext> reversalContext(String transformationId) {
        return Optional.ofNullable(reversalContexts.get(transformationId));
    }

    /**
     * Drops the stored reversal context of a transformation.
     */
    public void forget(String transformationId) {
        reversalContexts.remove(transformationId);
    }

    private static Duration elapsedSince(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    private static String describe(RuntimeException e) {
        if (e instanceof WranglerException) {
            return e.toString();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
