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
import dev.mars.staffbook.model.Feedback;
import dev.mars.staffbook.model.NewFeedback;
import dev.mars.staffbook.model.Role;
import dev.mars.staffbook.model.WorkLog;
import dev.mars.staffbook.policy.AccessPolicy;
import dev.mars.staffbook.repository.EmployeeRepository;
import dev.mars.staffbook.repository.FeedbackRepository;
import dev.mars.staffbook.repository.WorkLogRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.mars.staffbook.service.Guards.allow;
import static dev.mars.staffbook.service.Guards.found;

/**
 * Structured feedback from managers on work logs.
 */
public final class FeedbackService {

    private final FeedbackRepository feedback;
    private final WorkLogRepository workLogs;
    private final EmployeeRepository employees;
    private final AccessPolicy policy;
    private final AuditRecorder audit;

    public FeedbackService(FeedbackRepository feedback, WorkLogRepository workLogs, EmployeeRepository employees,
                           AccessPolicy policy, AuditRecorder audit) {
        this.feedback = feedback;
        this.workLogs = workLogs;
        this.employees = employees;
        this.policy = policy;
        this.audit = audit;
    }

    /**
     * Managers may only give feedback on their direct reports' logs. Admins on any.
     */
    public Feedback create(Employee actor, NewFeedback input) {
        allow(policy.hasAnyRole(actor, Role.MANAGER, Role.ADMIN), "Only managers and administrators give feedback");
        WorkLog log = found(workLogs.findById(input.workLogId()), "Work log", input.workLogId());
        found(employees.findById(log.employeeId()), "Employee", log.employeeId());
        allow(policy.canAuthorFeedback(actor, log), "Can only provide feedback to direct reports");

        Feedback created = feedback.create(actor.id(), input);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("work_log_id", created.workLogId());
        details.put("employee_id", created.employeeId());
        details.put("rating", created.rating());
        audit.record(actor.id(), ActionType.CREATE, ResourceTypes.FEEDBACK, created.id(), details);
        return created;
    }

    /**
     * Feedback received by one employee. The employee, their manager, or admin.
     */
    public List<Feedback> forEmployee(Employee actor, String employeeId) {
        found(employees.findById(employeeId), "Employee", employeeId);
        allow(policy.canAccessEmployeeData(actor, employeeId), "Not authorized to view this employee's feedback");
        return feedback.findByEmployee(employeeId);
    }

    public List<Feedback> forWorkLog(Employee actor, String workLogId) {
        WorkLog log = found(workLogs.findById(workLogId), "Work log", workLogId);
        found(employees.findById(log.employeeId()), "Employee", log.employeeId());
        allow(policy.canAccessEmployeeData(actor, log.employeeId()),
                "Not authorized to view feedback for this work log");
        return feedback.findByWorkLog(workLogId);
    }

    /** Feedback the actor has received. */
    public List<Feedback> received(Employee actor) {
        return feedback.findByEmployee(actor.id());
    }

    /** Feedback the actor has given. Managers and admins. */
    public List<Feedback> given(Employee actor) {
        allow(policy.hasAnyRole(actor, Role.MANAGER, Role.ADMIN), "Only managers and administrators give feedback");
        return feedback.findByManager(actor.id());
    }
}
