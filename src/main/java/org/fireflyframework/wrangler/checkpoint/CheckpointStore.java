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

package org.fireflyframework.wrangler.checkpoint;

import org.fireflyframework.wrangler.model.PipelineState;

import java.util.List;
import java.util.Optional;

/**
 * Named, keyed store of pipeline checkpoints.
 *
 * <p>Implementations must preserve every field of the {@link PipelineState} across a
 * save/load round trip. I/O failures are reported as
 * {@link org.fireflyframework.wrangler.exception.OrchestrationException}.</p>
 */
public interface CheckpointStore {

    /**
     * Persists a state under a name, replacing any previous checkpoint of that name.
     *
     * @param name  the checkpoint name, usually the run name
     * @param state the state to persist
     * @return the location the checkpoint was written to
     */
    String save(String name, PipelineState state);

    /**
     * Loads a checkpoint.
     *
     * @param name the checkpoint name
     * @return the stored state, or empty if no checkpoint of that name exists
     */
    Optional<PipelineState> load(String name);

    boolean exists(String name);

    /**
     * Deletes a checkpoint.
     *
     * @param name the checkpoint name
     * @return {@code true} if a checkpoint was deleted
     */
    boolean delete(String name);

    /**
     * Lists the names of all stored checkpoints, sorted.
     */
    List<String> list();
}
