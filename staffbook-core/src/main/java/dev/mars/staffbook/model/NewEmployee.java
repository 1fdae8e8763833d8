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

import java.time.LocalDate;

/**
 * Input for creating an employee. {@code role} defaults to {@link Role#EMPLOYEE}.
 */
public record NewEmployee(
        String email,
        String password,
        String firstName,
        String lastName,
        Role role,
        String managerId,
        String department,
        String position,
        LocalDate hireDate) {

    public NewEmployee {
        if (role == null) {
            role = Role.EMPLOYEE;
        }
    }

    public static NewEmployee of(String email, String password, String firstName, String lastName,
                                 Role role, LocalDate hireDate) {
        return new NewEmployee(email, password, firstName, lastName, role, null, null, null, hireDate);
    }

    public NewEmployee withManager(String id) {
        return new NewEmployee(email, password, firstName, lastName, role, id, department, position, hireDate);
    }

    public NewEmployee withDepartment(String name) {
        return new NewEmployee(email, password, firstName, lastName, role, managerId, name, position, hireDate);
    }

    public NewEmployee withPosition(String title) {
        return new NewEmployee(email, password, firstName, lastName, role, managerId, department, title, hireDate);
    }

    @Override
    public String toString() {
        return "NewEmployee{email=" + email + ", role=" + role + ", managerId=" + managerId + '}';
    }
}
