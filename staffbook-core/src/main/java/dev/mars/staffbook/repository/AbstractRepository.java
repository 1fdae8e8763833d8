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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.staffbook.model.Identified;
import dev.mars.staffbook.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Typed access to one collection of the {@link RecordStore}.
 * <p>
 * Reads are unlocked scans. Every mutation runs inside one exclusive section
 * for the collection covering read, validation and write, so validation
 * failures leave the collection untouched and concurrent mutators never lose
 * each other's updates. Sections are re-entrant: a subclass may open one,
 * check a constraint and then call {@link #insert(Supplier)} or
 * {@link #update(String, UnaryOperator)} inside it.
 * <p>
 * Rows that are not being changed are written back exactly as read.
 *
 * @param <T> the record type
 */
public abstract class AbstractRepository<T extends Identified> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractRepository.class);

    static final String ID = "id";
    static final String UPDATED_AT = "updated_at";

    protected final RecordStore store;
    protected final RecordCodec codec;
    protected final Clock clock;

    private final String collection;
    private final Class<T> type;

    protected AbstractRepository(RecordStore store, RecordCodec codec, Clock clock,
                                 String collection, Class<T> type) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.collection = collection;
        this.type = type;
    }

    /** Name of the backing collection. */
    public String collection() {
        return collection;
    }

    // ========================================================================
    // Reads
    // ========================================================================

    /**
     * All rows in stored order.
     */
    public List<T> findAll() {
        List<ObjectNode> nodes = store.read(collection);
        List<T> records = new ArrayList<>(nodes.size());
        for (ObjectNode node : nodes) {
            records.add(codec.decode(node, type));
        }
        return records;
    }

    public Optional<T> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        List<ObjectNode> nodes = store.read(collection);
        int index = indexOf(nodes, id);
        return index < 0 ? Optional.empty() : Optional.of(codec.decode(nodes.get(index), type));
    }

    protected List<T> findWhere(Predicate<? super T> filter) {
        List<T> matches = new ArrayList<>();
        for (T record : findAll()) {
            if (filter.test(record)) {
                matches.add(record);
            }
        }
        return matches;
    }

    // ========================================================================
    // Mutations
    // ========================================================================

    /**
     * Creates one row.
     * <p>
     * {@code factory} runs inside the exclusive section; it validates and
     * builds the new record, and may throw to abort before anything is written.
     */
    protected T insert(Supplier<T> factory) {
        try (RecordStore.ExclusiveSection section = store.exclusive(collection)) {
            List<ObjectNode> nodes = store.read(collection);
            T created = Objects.requireNonNull(factory.get(), "factory returned null");
            if (indexOf(nodes, created.id()) >= 0) {
                throw RepositoryException.conflict("Duplicate id in " + collection + ": " + created.id());
            }
            nodes.add(codec.encode(created));
            store.write(collection, nodes);
            LOG.debug("Created {} {}", collection, created.id());
            return created;
        }
    }

    /**
     * Applies {@code mutation} to the row with {@code id} and stamps
     * {@code updated_at}.
     * <p>
     * The mutation runs inside the exclusive section against the current
     * stored state. It must keep the id and may throw to abort. Fields the
     * record type does not know about are preserved.
     *
     * @return the stored new state, or empty if no row has {@code id}
     */
    public Optional<T> update(String id, UnaryOperator<T> mutation) {
        try (RecordStore.ExclusiveSection section = store.exclusive(collection)) {
            List<ObjectNode> nodes = store.read(collection);
            int index = indexOf(nodes, id);
            if (index < 0) {
                LOG.debug("Update of {} {} skipped: no such row", collection, id);
                return Optional.empty();
            }

            ObjectNode currentNode = nodes.get(index);
            T current = codec.decode(currentNode, type);
            T next = Objects.requireNonNull(mutation.apply(current), "mutation returned null");
            if (!id.equals(next.id())) {
                throw new IllegalArgumentException("Mutation changed id of " + collection + " " + id + " to " + next.id());
            }

            ObjectNode nextNode = currentNode.deepCopy();
            nextNode.setAll(codec.encode(next));
            nextNode.put(UPDATED_AT, nextStamp(currentNode).toString());
            nodes.set(index, nextNode);

            store.write(collection, nodes);
            LOG.debug("Updated {} {}", collection, id);
            return Optional.of(codec.decode(nextNode, type));
        }
    }

    /**
     * Runs {@code body} inside this collection's exclusive section.
     */
    protected <R> R exclusively(Supplier<R> body) {
        return store.withExclusive(collection, body);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    protected Instant now() {
        return clock.instant();
    }

    /**
     * The clock, but never earlier than the row's previous {@code updated_at}.
     */
    private Instant nextStamp(ObjectNode currentNode) {
        Instant now = now();
        JsonNode previous = currentNode.get(UPDATED_AT);
        if (previous == null || !previous.isTextual()) {
            return now;
        }
        try {
            Instant last = Instant.parse(previous.asText());
            return last.isAfter(now) ? last : now;
        } catch (DateTimeParseException e) {
            LOG.warn("Ignoring unparseable updated_at '{}' in {}", previous.asText(), collection);
            return now;
        }
    }

    private static int indexOf(List<ObjectNode> nodes, String id) {
        for (int i = 0; i < nodes.size(); i++) {
            JsonNode candidate = nodes.get(i).get(ID);
            if (candidate != null && candidate.isTextual() && candidate.asText().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    protected static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw RepositoryException.validation(field + " must not be blank");
        }
        return value;
    }

    protected static <V> V requirePresent(String field, V value) {
        if (value == null) {
            throw RepositoryException.validation(field + " is required");
        }
        return value;
    }
}
