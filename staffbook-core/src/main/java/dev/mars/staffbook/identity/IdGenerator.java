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
package dev.mars.staffbook.identity;

import java.util.UUID;

/**
 * Source of opaque record identifiers.
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * Returns a new identifier, unique for the lifetime of the data directory.
     */
    String newId();

    /**
     * Random (version 4) UUIDs in canonical string form.
     */
    static IdGenerator random() {
        return () -> UUID.randomUUID().toString();
    }
}
