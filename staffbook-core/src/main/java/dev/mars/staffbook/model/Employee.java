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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A person in the organization.
 * <p>
 * {@code managerId} is a weak reference into the same collection. It is
 * resolved one hop at a time and never validated for cycles.
 * Deactivation clears {@code active}; rows are never removed.
 */
public record Employee(
        @JsonProperty("id") String id,
        @JsonProperty("email") String email,
        @JsonProperty("password_hash") String passwordHash,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        @JsonProperty("role") Role role,
        @JsonProperty("manager_id") String managerId,
        @JsonProperty("department") String department,
        @JsonProperty("position") String position,
        @JsonProperty("hire_date") LocalDate hireDate,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) implements Identified {

    public Employee {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
    }

    public boolean hasRole(Role expected) {
        return role == expected;
    }

    public boolean hasAnyRole(Role... roles) {
        for (Role candidate : roles) {
            if (role == candidate) {
                return true;
            }
        }
        return false;
    }

    /** True if {@code other} names this employee as its manager. */
    public boolean manages(Employee other) {
        return other != null && id.equals(other.managerId());
    }

    public String fullName() {
        return firstName + " " + lastName;
    }

    @Override
    public String toString() {
        // no password hash
        return "Employee{id=" + id + ", email=" + email + ", role=" + role +
                ", managerId=" + managerId + ", active=" + active + '}';
    }
}
