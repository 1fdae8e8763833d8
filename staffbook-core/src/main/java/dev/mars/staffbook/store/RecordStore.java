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
package dev.mars.staffbook.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * Generic Record Store Interface.
 * <p>
 * Holds one ordered sequence of flat records per named collection
 * ({@code employees}, {@code work_logs}, ...). Repositories depend solely on
 * this interface, not on the file-based implementation.
 * <p>
 * <b>Critical Contract:</b> a reader never observes a partially written
 * collection. Every read-modify-write must run entirely inside one
 * {@link #exclusive(String)} section so that two mutators of the same
 * collection cannot interleave and lose an update.
 *
 * @see FileRecordStore
 */
public interface RecordStore extends Closeable {

    /**
     * Opens the store. Idempotent for the same directory.
     *
     * @param dataDir the directory holding one artifact per collection
     */
    void open(Path dataDir);

    /**
     * Returns the current committed snapshot of a collection.
     * <p>
     * This is an unlocked, best-effort read: outside an exclusive section it
     * may race with an in-flight writer and observe either the previous or the
     * new committed state, never a mix.
     * <p>
     * A missing collection is empty. An unreadable or malformed collection is
     * quarantined (renamed aside) and reported as empty. This method never
     * throws for corrupt data.
     *
     * @param collection the collection name
     * @return a mutable copy of the records, in stored order
     */
    List<ObjectNode> read(String collection);

    /**
     * Atomically replaces the whole collection.
     * <p>
     * On failure the live collection is left exactly as it was and a
     * {@link StorageException} is thrown.
     *
     * @param collection the collection name
     * @param records    the complete new contents
     */
    void write(String collection, List<ObjectNode> records);

    /**
     * Acquires exclusive access to one collection.
     * <p>
     * Blocks while another thread holds the same collection; holders of
     * different collections never block each other. Re-entrant for the
     * owning thread. Always use with try-with-resources:
     * <pre>{@code
     * try (RecordStore.ExclusiveSection section = store.exclusive("employees")) {
     *     List<ObjectNode> rows = store.read("employees");
     *     rows.add(newRow);
     *     store.write("employees", rows);
     * }
     * }</pre>
     *
     * @param collection the collection name
     * @return a handle that releases the collection on {@code close()}
     */
    ExclusiveSection exclusive(String collection);

    /**
     * Runs {@code body} inside an exclusive section for {@code collection}.
     */
    default <T> T withExclusive(String collection, Supplier<T> body) {
        try (ExclusiveSection section = exclusive(collection)) {
            return body.get();
        }
    }

    /**
     * Closes the store, releasing the data directory.
     */
    @Override
    void close();

    /**
     * Exclusive access to one collection, released exactly once on close.
     */
    interface ExclusiveSection extends AutoCloseable {

        /** The collection this section guards. */
        String collection();

        @Override
        void close();
    }

    /**
     * Exception thrown when a storage operation fails and the caller's
     * mutation did not take effect.
     */
    class StorageException extends RuntimeException {
        public StorageException(String message) {
            super(message);
        }

        public StorageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
