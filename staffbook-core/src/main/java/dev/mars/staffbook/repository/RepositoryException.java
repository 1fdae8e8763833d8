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

/**
 * A repository operation was refused. Nothing was written.
 */
public class RepositoryException extends RuntimeException {

    /**
     * Why the operation was refused.
     */
    public enum Kind {
        /** The addressed record does not exist. */
        NOT_FOUND,
        /** A uniqueness constraint would be violated. */
        CONFLICT,
        /** The input violates a structural rule, e.g. end date before start date. */
        VALIDATION_FAILED,
        /** The record's lifecycle does not allow the change. */
        INVALID_STATE
    }

    private final Kind kind;

    public RepositoryException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static RepositoryException notFound(String resource, String id) {
        return new RepositoryException(Kind.NOT_FOUND, resource + " not found: " + id);
    }

    public static RepositoryException conflict(String message) {
        return new RepositoryException(Kind.CONFLICT, message);
    }

    public static RepositoryException validation(String message) {
        return new RepositoryException(Kind.VALIDATION_FAILED, message);
    }

    public static RepositoryException invalidState(String message) {
        return new RepositoryException(Kind.INVALID_STATE, message);
    }
}
