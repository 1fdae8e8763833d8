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

import dev.mars.staffbook.audit.AuditRecorder;
import dev.mars.staffbook.audit.ResourceTypes;
import dev.mars.staffbook.model.ActionType;
import dev.mars.staffbook.model.Employee;
import dev.mars.staffbook.repository.EmployeeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Credential checks and resolution of the acting identity.
 * <p>
 * Token issuance is not handled here: callers put the employee id into
 * whatever token they issue and hand it back to {@link #resolve(String)}.
 */
public final class AuthService {

    private static final Logger LOG = LoggerFactory.getLogger(AuthService.class);

    private final EmployeeRepository employees;
    private final AuditRecorder audit;

    public AuthService(EmployeeRepository employees, AuditRecorder audit) {
        this.employees = employees;
        this.audit = audit;
    }

    /**
     * @throws AccessDeniedException {@code UNAUTHENTICATED} for unknown email or wrong password,
     *                               {@code FORBIDDEN} for a deactivated account
     */
    public Employee login(String email, String password) {
        Employee employee = employees.authenticate(email, password).orElseThrow(() -> {
            LOG.info("Rejected login for {}", email);
            return AccessDeniedException.unauthenticated("Incorrect email or password");
        });
        if (!employee.active()) {
            LOG.info("Rejected login for deactivated account {}", employee.id());
            throw AccessDeniedException.forbidden("Account is deactivated");
        }

        audit.record(employee.id(), ActionType.LOGIN, ResourceTypes.USER, employee.id(),
                Map.of("email", employee.email()));
        return employee;
    }

    public void logout(Employee actor) {
        audit.record(actor.id(), ActionType.LOGOUT, ResourceTypes.USER, actor.id(),
                Map.of("email", actor.email()));
    }

    /**
     * Returns the active employee a token subject names.
     *
     * @throws AccessDeniedException {@code UNAUTHENTICATED} if there is no such active employee
     */
    public Employee resolve(String subjectId) {
        return employees.findById(subjectId)
                .filter(Employee::active)
                .orElseThrow(() -> AccessDeniedException.unauthenticated("Could not validate credentials"));
    }
}
