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
package dev.mars.staffbook;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.staffbook.store.RecordStore;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delegating store that fails reads or writes of chosen collections on demand.
 */
public final class FaultyRecordStore implements RecordStore {

    private final RecordStore delegate;
    private final Set<String> failingReads = ConcurrentHashMap.newKeySet();
    private final Set<String> failingWrites = ConcurrentHashMap.newKeySet();

    public FaultyRecordStore(RecordStore delegate) {
        this.delegate = delegate;
    }

    public void failReads(String collection) {
        failingReads.add(collection);
    }

    public void failWrites(String collection) {
        failingWrites.add(collection);
    }

    public void heal() {
        failingReads.clear();
        failingWrites.clear();
    }

    @Override
    public void open(Path dataDir) {
        delegate.open(dataDir);
    }

    @Override
    public List<ObjectNode> read(String collection) {
        if (failingReads.contains(collection)) {
            throw new StorageException("Injected read failure: " + collection);
        }
        return delegate.read(collection);
    }

    @Override
    public void write(String collection, List<ObjectNode> records) {
        if (failingWrites.contains(collection)) {
            throw new StorageException("Injected write failure: " + collection);
        }
        delegate.write(collection, records);
    }

    @Override
    public ExclusiveSection exclusive(String collection) {
        return delegate.exclusive(collection);
    }

    @Override
    public void close() {
        delegate.close();
    }
}
