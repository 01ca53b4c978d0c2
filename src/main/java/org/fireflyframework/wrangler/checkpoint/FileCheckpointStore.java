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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.wrangler.exception.OrchestrationException;
import org.fireflyframework.wrangler.model.PipelineState;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores each checkpoint as {@code <directory>/<name>_state.json}.
 *
 * <p>Writes go to a temporary file first and are then moved into place, so a reader never
 * observes a partially written checkpoint.</p>
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    static final String SUFFIX = "_state.json";

    private final Path directory;
    private final CheckpointCodec codec;

    public FileCheckpointStore(Path directory) {
        this(directory, new CheckpointCodec());
    }

    public FileCheckpointStore(Path directory, CheckpointCodec codec) {
        this.directory = directory;
        this.codec = codec;
        log.info("Initialized FileCheckpointStore in {}", directory.toAbsolutePath());
    }

    @Override
    public String save(String name, PipelineState state) {
        Path target = pathFor(name);
        String json = codec.encode(state);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, name, ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            discard(temp, e);
            throw new OrchestrationException("Failed to write checkpoint",
                    Map.of("name", name, "path", target.toString()), e);
        }
        log.debug("Checkpoint '{}' written to {}", name, target);
        return target.toString();
    }

    @Override
    public Optional<PipelineState> load(String name) {
        Path source = pathFor(name);
        if (!Files.exists(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(Files.readString(source, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new OrchestrationException("Failed to read checkpoint",
                    Map.of("name", name, "path", source.toString()), e);
        }
    }

    @Override
    public boolean exists(String name) {
        return Files.exists(pathFor(name));
    }

    @Override
    public boolean delete(String name) {
        Path path = pathFor(name);
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new OrchestrationException("Failed to delete checkpoint",
                    Map.of("name", name, "path", path.toString()), e);
        }
    }

    @Override
    public List<String> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(fileName -> fileName.endsWith(SUFFIX))
                    .map(fileName -> fileName.substring(0, fileName.length() - SUFFIX.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new OrchestrationException("Failed to list checkpoints",
                    Map.of("directory", directory.toString()), e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private static void discard(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private Path pathFor(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new OrchestrationException("Invalid checkpoint name",
                    Map.of("name", String.valueOf(name)));
        }
        return directory.resolve(name + SUFFIX);
    }
}
