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

import java.util.List;

/**
 * Outcome of a bulk employee import.
 *
 * @param createdIds ids of the rows that were created, in input order
 * @param errors     one entry per refused row
 */
public record BulkCreateResult(List<String> createdIds, List<RowError> errors) {

    public BulkCreateResult {
        createdIds = List.copyOf(createdIds);
        errors = List.copyOf(errors);
    }

    public int successful() {
        return createdIds.size();
    }

    /**
     * @param row   1-based position in the input
     * @param email the row's email, or {@code "unknown"}
     * @param error why the row was refused
     */
    public record RowError(int row, String email, String error) {
    }
}
