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

/**
 * The acting identity may not perform the operation. Nothing was written.
 */
public class AccessDeniedException extends RuntimeException {

    public enum Reason {
        /** No valid identity: unknown credentials, unknown or deactivated subject. */
        UNAUTHENTICATED,
        /** Known identity without the required role or relationship. */
        FORBIDDEN
    }

    private final Reason reason;

    public AccessDeniedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public static AccessDeniedException forbidden(String message) {
        return new AccessDeniedException(Reason.FORBIDDEN, message);
    }

    public static AccessDeniedException unauthenticated(String message) {
        return new AccessDeniedException(Reason.UNAUTHENTICATED, message);
    }
}
