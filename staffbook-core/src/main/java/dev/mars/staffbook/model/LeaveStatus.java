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
package dev.mars.staffbook.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Leave request lifecycle.
 * <pre>
 * pending ──approve──▶ approved
 *    │
 *    └──reject / cancel──▶ rejected
 * </pre>
 * Both {@code approved} and {@code rejected} are terminal.
 */
public enum LeaveStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String value;

    LeaveStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Returns true if no further transition is allowed.
     */
    public boolean isTerminal() {
        return this != PENDING;
    }

    @JsonCreator
    public static LeaveStatus fromValue(String value) {
        for (LeaveStatus candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown leave status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
