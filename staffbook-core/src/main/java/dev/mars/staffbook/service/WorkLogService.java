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
import dev.mars.staffbook.model.NewWorkLog;
import dev.mars.staffbook.model.WorkLog;
import dev.mars.staffbook.model.WorkLogUpdate;
import dev.mars.staffbook.model.WorkLogView;
import dev.mars.staffbook.policy.AccessPolicy;
import dev.mars.staffbook.repository.EmployeeRepository;
import dev.mars.staffbook.repository.WorkLogRepository;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.mars.staffbook.service.Guards.allow;
import static dev.mars.staffbook.service.Guards.found;

/**
 * Work logging. Every log returned carries the caller's current edit right.
 */
public final class WorkLogService {

    private final WorkLogRepository workLogs;
    private final EmployeeRepository employees;
    private final AccessPolicy policy;
    private final AuditRecorder audit;

    public WorkLogService(WorkLogRepository workLogs, EmployeeRepository employees,
                          AccessPolicy policy, AuditRecorder audit) {
        this.workLogs = workLogs;
        this.employees = employees;
        this.policy = policy;
        this.audit = audit;
    }

    /**
     * Logs work for the actor.
     */
    public WorkLogView create(Employee actor, NewWorkLog input) {
        WorkLog created = workLogs.create(actor.id(), input);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("date", String.valueOf(created.date()));
        details.put("task_description", created.taskDescription());
        details.put("time_spent", created.timeSpent());
        audit.record(actor.id(), ActionType.CREATE, ResourceTypes.WORK_LOG, created.id(), details);
        return policy.view(created, actor);
    }

    /**
     * Logs of {@code employeeId} (the actor when null) within the inclusive date range.
     */
    public List<WorkLogView> list(Employee actor, String employeeId, LocalDate from, LocalDate to) {
        String target = employeeId != null ? employeeId : actor.id();
        allow(policy.canAccessEmployeeData(actor, target), "Not authorized to access these work logs");
        return policy.view(workLogs.findByEmployee(target, from, to), actor);
    }

    public WorkLogView get(Employee actor, String id) {
        WorkLog log = found(workLogs.findById(id), "Work log", id);
        allow(policy.canAccessEmployeeData(actor, log.employeeId()), "Not authorized to access this work log");
        return policy.view(log, actor);
    }

    /**
     * Owner within the edit window, or admin.
     */
    public WorkLogView update(Employee actor, String id, WorkLogUpdate update) {
        WorkLog log = found(workLogs.findById(id), "Work log", id);
        allow(policy.canEditWorkLog(log, actor),
                "Cannot edit this work log (time limit exceeded or insufficient permissions)");

        WorkLog updated = found(workLogs.update(id, update), "Work log", id);
        audit.record(actor.id(), ActionType.UPDATE, ResourceTypes.WORK_LOG, id, update.changes());
        return policy.view(updated, actor);
    }

    /**
     * Sets the free-text manager feedback on a log. Admin, or the owner's manager.
     */
    public WorkLogView addManagerFeedback(Employee actor, String id, String feedback) {
        WorkLog log = found(workLogs.findById(id), "Work log", id);
        found(employees.findById(log.employeeId()), "Employee", log.employeeId());
        allow(policy.canAuthorFeedback(actor, log), "Not authorized to provide feedback on this work log");

        WorkLog updated = found(workLogs.attachManagerFeedback(id, feedback), "Work log", id);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", "add_feedback");
        details.put("feedback", feedback);
        audit.record(actor.id(), ActionType.UPDATE, ResourceTypes.WORK_LOG, id, details);
        return policy.view(updated, actor);
    }
}
