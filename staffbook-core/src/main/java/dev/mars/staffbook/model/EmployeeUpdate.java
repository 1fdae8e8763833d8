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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of an employee. Only fields set on the builder are applied.
 * <pre>{@code
 * EmployeeUpdate update = EmployeeUpdate.builder()
 *     .department("Platform")
 *     .managerId(null)      // clears the manager
 *     .build();
 * }</pre>
 */
public final class EmployeeUpdate {

    private final Change<String> email;
    private final Change<String> firstName;
    private final Change<String> lastName;
    private final Change<Role> role;
    private final Change<String> managerId;
    private final Change<String> department;
    private final Change<String> position;
    private final Change<Boolean> active;

    private EmployeeUpdate(Builder builder) {
        this.email = builder.email;
        this.firstName = builder.firstName;
        this.lastName = builder.lastName;
        this.role = builder.role;
        this.managerId = builder.managerId;
        this.department = builder.department;
        this.position = builder.position;
        this.active = builder.active;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EmployeeUpdate empty() {
        return builder().build();
    }

    public Change<String> email() {
        return email;
    }

    public Change<String> firstName() {
        return firstName;
    }

    public Change<String> lastName() {
        return lastName;
    }

    public Change<Role> role() {
        return role;
    }

    public Change<String> managerId() {
        return managerId;
    }

    public Change<String> department() {
        return department;
    }

    public Change<String> position() {
        return position;
    }

    public Change<Boolean> active() {
        return active;
    }

    public boolean isEmpty() {
        return !email.isPresent() && !firstName.isPresent() && !lastName.isPresent()
                && !role.isPresent() && !managerId.isPresent() && !department.isPresent()
                && !position.isPresent() && !active.isPresent();
    }

    /**
     * Returns {@code current} with every present field replaced. Timestamps are untouched.
     */
    public Employee applyTo(Employee current) {
        return new Employee(
                current.id(),
                email.orElse(current.email()),
                current.passwordHash(),
                firstName.orElse(current.firstName()),
                lastName.orElse(current.lastName()),
                role.orElse(current.role()),
                managerId.orElse(current.managerId()),
                department.orElse(current.department()),
                position.orElse(current.position()),
                current.hireDate(),
                active.isPresent() ? Boolean.TRUE.equals(active.value()) : current.active(),
                current.createdAt(),
                current.updatedAt());
    }

    /**
     * Present fields keyed by stored field name, for the audit trail.
     */
    public Map<String, Object> changes() {
        Map<String, Object> changes = new LinkedHashMap<>();
        if (email.isPresent()) {
            changes.put("email", email.value());
        }
        if (firstName.isPresent()) {
            changes.put("first_name", firstName.value());
        }
        if (lastName.isPresent()) {
            changes.put("last_name", lastName.value());
        }
        if (role.isPresent()) {
            changes.put("role", role.value() == null ? null : role.value().value());
        }
        if (managerId.isPresent()) {
            changes.put("manager_id", managerId.value());
        }
        if (department.isPresent()) {
            changes.put("department", department.value());
        }
        if (position.isPresent()) {
            changes.put("position", position.value());
        }
        if (active.isPresent()) {
            changes.put("is_active", active.value());
        }
        return changes;
    }

    @Override
    public String toString() {
        return "EmployeeUpdate{email=" + email + ", firstName=" + firstName + ", lastName=" + lastName +
                ", role=" + role + ", managerId=" + managerId + ", department=" + department +
                ", position=" + position + ", active=" + active + '}';
    }

    public static final class Builder {
        private Change<String> email = Change.absent();
        private Change<String> firstName = Change.absent();
        private Change<String> lastName = Change.absent();
        private Change<Role> role = Change.absent();
        private Change<String> managerId = Change.absent();
        private Change<String> department = Change.absent();
        private Change<String> position = Change.absent();
        private Change<Boolean> active = Change.absent();

        private Builder() {
        }

        public Builder email(String email) {
            this.email = Change.to(email);
            return this;
        }

        public Builder firstName(String firstName) {
            this.firstName = Change.to(firstName);
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = Change.to(lastName);
            return this;
        }

        public Builder role(Role role) {
            this.role = Change.to(role);
            return this;
        }

        public Builder managerId(String managerId) {
            this.managerId = Change.to(managerId);
            return this;
        }

        public Builder department(String department) {
            this.department = Change.to(department);
            return this;
        }

        public Builder position(String position) {
            this.position = Change.to(position);
            return this;
        }

        public Builder active(boolean active) {
            this.active = Change.to(active);
            return this;
        }

        public EmployeeUpdate build() {
            return new EmployeeUpdate(this);
        }
    }
}
