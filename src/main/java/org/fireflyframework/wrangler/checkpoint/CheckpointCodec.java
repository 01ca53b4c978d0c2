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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fireflyframework.wrangler.exception.OrchestrationException;
import org.fireflyframework.wrangler.model.PipelineState;

import java.time.Clock;

/**
 * JSON encoding of checkpoints.
 */
public class CheckpointCodec {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CheckpointCodec() {
        this(defaultObjectMapper(), Clock.systemUTC());
    }

    public CheckpointCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
        return mapper;
    }

    public String encode(PipelineState state) {
        try {
            return objectMapper.writeValueAsString(CheckpointDocument.from(state, clock.instant()));
        } catch (JsonProcessingException e) {
            throw new OrchestrationException("Failed to serialize pipeline state", e);
        }
    }

    public CheckpointDocument decodeDocument(String json) {
        try {
            return objectMapper.readValue(json, CheckpointDocument.class);
        } catch (JsonProcessingException e) {
            throw new OrchestrationException("Failed to deserialize pipeline state", e);
        }
    }

    public PipelineState decode(String json) {
        return decodeDocument(json).toState();
    }
}
