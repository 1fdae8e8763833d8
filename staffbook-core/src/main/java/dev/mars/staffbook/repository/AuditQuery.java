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

import dev.mars.staffbook.model.ActionType;

/**
 * Filter for reading the audit trail. Null fields match everything.
 * <p>
 * {@code limit} is clamped to [1, {@value #MAX_LIMIT}]; null means
 * {@value #DEFAULT_LIMIT}.
 */
public record AuditQuery(String userId, ActionType action, String resourceType, Integer limit) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public AuditQuery {
        if (limit == null) {
            limit = DEFAULT_LIMIT;
        } else if (limit < 1) {
            limit = 1;
        } else if (limit > MAX_LIMIT) {
            limit = MAX_LIMIT;
        }
    }

    /** The most recent {@value #DEFAULT_LIMIT} entries. */
    public static AuditQuery latest() {
        return new AuditQuery(null, null, null, null);
    }

    public AuditQuery forUser(String id) {
        return new AuditQuery(id, action, resourceType, limit);
    }

    public AuditQuery forAction(ActionType kind) {
        return new AuditQuery(userId, kind, resourceType, limit);
    }

    public AuditQuery forResourceType(String type) {
        return new AuditQuery(userId, action, type, limit);
    }

    public AuditQuery withLimit(int max) {
        return new AuditQuery(userId, action, resourceType, max);
    }
}
