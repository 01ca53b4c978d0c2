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
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps serialized checkpoints in memory.
 *
 * <p>States are stored in their JSON form, so a load returns an independent copy exactly as a
 * {@link FileCheckpointStore} would.</p>
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, String> documents = new ConcurrentHashMap<>();
    private final CheckpointCodec codec;

    public InMemoryCheckpointStore() {
        this(new CheckpointCodec());
    }

    public InMemoryCheckpointStore(CheckpointCodec codec) {
        this.codec = codec;
    }

    @Override
    public String save(String name, PipelineState state) {
        documents.put(name, codec.encode(state));
        return "memory:" + name;
    }

    @Override
    public Optional<PipelineState> load(String name) {
        return Optional.ofNullable(documents.get(name)).map(codec::decode);
    }

    @Override
    public boolean exists(String name) {
        return documents.containsKey(name);
    }

    @Override
    public boolean delete(String name) {
        return documents.remove(name) != null;
    }

    @Override
    public List<String> list() {
        return documents.keySet().stream().sorted().toList();
    }
}
