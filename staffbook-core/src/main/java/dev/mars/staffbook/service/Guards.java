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
package dev.mars.staffbook.service;

import dev.mars.staffbook.repository.RepositoryException;

import java.util.Optional;

/**
 * Shared checks for the operation services.
 */
final class Guards {

    private Guards() {
    }

    static void allow(boolean allowed, String message) {
        if (!allowed) {
            throw AccessDeniedException.forbidden(message);
        }
    }

    static <T> T found(Optional<T> record, String resource, String id) {
        return record.orElseThrow(() -> RepositoryException.notFound(resource, id));
    }
}
