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
import dev.mars.staffbook.model.EmployeeUpdate;
import dev.mars.staffbook.model.NewEmployee;
import dev.mars.staffbook.model.Role;
import dev.mars.staffbook.policy.AccessPolicy;
import dev.mars.staffbook.repository.EmployeeRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.mars.staffbook.service.Guards.allow;
import static dev.mars.staffbook.service.Guards.found;

/**
 * Employee administration.
 */
public final class EmployeeService {

    private final EmployeeRepository employees;
    private final AccessPolicy policy;
    private final AuditRecorder audit;

    public EmployeeService(EmployeeRepository employees, AccessPolicy policy, AuditRecorder audit) {
        this.employees = employees;
        this.policy = policy;
        this.audit = audit;
    }

    /** Admin only. */
    public Employee create(Employee actor, NewEmployee input) {
        allow(policy.hasAnyRole(actor, Role.ADMIN), "Only administrators can create employees");
        Employee created = employees.create(input);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("email", created.email());
        details.put("role", created.role().value());
        audit.record(actor.id(), ActionType.CREATE, ResourceTypes.EMPLOYEE, created.id(), details);
        return created;
    }

    /** Admin only. */
    public List<Employee> list(Employee actor, boolean activeOnly) {
        allow(policy.hasAnyRole(actor, Role.ADMIN), "Only administrators can list employees");
        return activeOnly ? employees.findActive() : employees.findAll();
    }

    public Employee get(Employee actor, String id) {
        allow(policy.canAccessEmployeeData(actor, id), "Not authorized to access this employee's data");
        return found(employees.findById(id), "Employee", id);
    }

    /**
     * Self, the target's manager, or admin. Only admins may change a role.
     */
    public Employee update(Employee actor, String id, EmployeeUpdate update) {
        Employee target = found(employees.findById(id), "Employee", id);
        allow(!update.role().isPresent() || policy.hasAnyRole(actor, Role.ADMIN),
                "Only administrators can change roles");
        allow(actor.id().equals(id) || policy.hasAnyRole(actor, Role.ADMIN)
                        || (actor.hasRole(Role.MANAGER) && actor.manages(target)),
                "Not authorized to update this employee");

        Employee updated = found(employees.update(id, update), "Employee", id);
        audit.record(actor.id(), ActionType.UPDATE, ResourceTypes.EMPLOYEE, id, update.changes());
        return updated;
    }

    /** Admin only. Soft delete. */
    public Employee deactivate(Employee actor, String id) {
        allow(policy.hasAnyRole(actor, Role.ADMIN), "Only administrators can deactivate employees");
        Employee deactivated = found(employees.deactivate(id), "Employee", id);
        audit.record(actor.id(), ActionType.DELETE, ResourceTypes.EMPLOYEE, id, Map.of("action", "soft_delete"));
        return deactivated;
    }

    /**
     * Active direct reports. The manager themself or an admin.
     */
    public List<Employee> directReports(Employee actor, String managerId) {
        allow(policy.hasAnyRole(actor, Role.ADMIN) || actor.id().equals(managerId),
                "Not authorized to view these direct reports");
        return employees.findDirectReports(managerId);
    }
}
