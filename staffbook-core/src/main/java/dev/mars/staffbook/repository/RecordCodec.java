/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.staffbook.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.staffbook.store.RecordStore.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between typed records and the flat JSON objects held by the store.
 * <p>
 * Field names come from the {@code @JsonProperty} annotations on the records.
 * Dates and instants are ISO-8601 strings. Unknown fields are ignored on
 * read so older rows still decode.
 */
public final class RecordCodec {

    private static final Logger LOG = LoggerFactory.getLogger(RecordCodec.class);

    private final ObjectMapper mapper;

    public RecordCodec() {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .build();
    }

    public ObjectNode encode(Object record) {
        try {
            return mapper.valueToTree(record);
        } catch (IllegalArgumentException e) {
            LOG.error("Cannot encode {}: {}", record.getClass().getSimpleName(), e.getMessage(), e);
            throw new StorageException("Cannot encode " + record.getClass().getSimpleName(), e);
        }
    }

    public <T> T decode(ObjectNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.error("Cannot decode {} with id {}: {}", type.getSimpleName(), node.path("id").asText("?"), e.getMessage(), e);
            throw new StorageException("Cannot decode " + type.getSimpleName() + " " + node.path("id").asText("?"), e);
        }
    }
}
