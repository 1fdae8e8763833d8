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
package dev.mars.staffbook.policy;

import dev.mars.staffbook.model.Employee;
import dev.mars.staffbook.model.LeaveRequest;
import dev.mars.staffbook.model.Role;
import dev.mars.staffbook.model.WorkLog;
import dev.mars.staffbook.model.WorkLogView;
import dev.mars.staffbook.repository.EmployeeRepository;
import dev.mars.staffbook.repository.SettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Role and reporting-line checks.
 * <p>
 * Every predicate is a function of the actor, the target and at most one
 * lookup. None of them writes, and none of them throws: a failed lookup
 * denies access.
 * <p>
 * Reporting lines are followed one hop only. A manager's manager has no
 * rights over the manager's reports.
 */
public final class AccessPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(AccessPolicy.class);

    private final EmployeeRepository employees;
    private final SettingsRepository settings;
    private final Clock clock;

    public AccessPolicy(EmployeeRepository employees, SettingsRepository settings, Clock clock) {
        this.employees = employees;
        this.settings = settings;
        this.clock = clock;
    }

    public boolean hasAnyRole(Employee actor, Role... roles) {
        return actor != null && actor.hasAnyRole(roles);
    }

    /**
     * Admin, the employee themself, or the employee's direct manager.
     */
    public boolean canAccessEmployeeData(Employee actor, String targetId) {
        if (actor == null || targetId == null) {
            return false;
        }
        if (actor.hasRole(Role.ADMIN) || actor.id().equals(targetId)) {
            return true;
        }
        if (!actor.hasRole(Role.MANAGER)) {
            return false;
        }
        try {
            return employees.findById(targetId).map(actor::manages).orElse(false);
        } catch (RuntimeException e) {
            LOG.warn("Denying access to employee {} for {}: lookup failed: {}", targetId, actor.id(), e.getMessage());
            return false;
        }
    }

    /**
     * Admin, or the manager recorded on the request when it was filed.
     */
    public boolean canApproveLeave(Employee actor, LeaveRequest request) {
        if (actor == null || request == null) {
            return false;
        }
        if (actor.hasRole(Role.ADMIN)) {
            return true;
        }
        return actor.hasRole(Role.MANAGER) && actor.id().equals(request.managerId());
    }

    /**
     * Owner, the manager recorded on the request, or admin.
     */
    public boolean canViewLeaveRequest(Employee actor, LeaveRequest request) {
        if (actor == null || request == null) {
            return false;
        }
        return actor.hasRole(Role.ADMIN)
                || actor.id().equals(request.employeeId())
                || actor.id().equals(request.managerId());
    }

    /**
     * Admin at any time. The owner only while the log is younger than the
     * configured edit window, boundary included.
     */
    public boolean canEditWorkLog(WorkLog log, Employee actor) {
        if (actor == null || log == null) {
            return false;
        }
        if (actor.hasRole(Role.ADMIN)) {
            return true;
        }
        if (!actor.id().equals(log.employeeId()) || log.createdAt() == null) {
            return false;
        }
        try {
            Duration window = Duration.ofHours(settings.get().logEditTimeLimitHours());
            Duration age = Duration.between(log.createdAt(), Instant.now(clock));
            return age.compareTo(window) <= 0;
        } catch (RuntimeException e) {
            LOG.warn("Denying edit of work log {} for {}: settings unavailable: {}", log.id(), actor.id(), e.getMessage());
            return false;
        }
    }

    /**
     * Admin, or the direct manager of the log's owner.
     */
    public boolean canAuthorFeedback(Employee actor, WorkLog log) {
        if (actor == null || log == null) {
            return false;
        }
        if (actor.hasRole(Role.ADMIN)) {
            return true;
        }
        if (!actor.hasRole(Role.MANAGER)) {
            return false;
        }
        try {
            return employees.findById(log.employeeId()).map(actor::manages).orElse(false);
        } catch (RuntimeException e) {
            LOG.warn("Denying feedback on work log {} for {}: lookup failed: {}", log.id(), actor.id(), e.getMessage());
            return false;
        }
    }

    public WorkLogView view(WorkLog log, Employee actor) {
        return new WorkLogView(log, canEditWorkLog(log, actor));
    }

    public List<WorkLogView> view(List<WorkLog> logs, Employee actor) {
        List<WorkLogView> views = new ArrayList<>(logs.size());
        for (WorkLog log : logs) {
            views.add(view(log, actor));
        }
        return views;
    }
}
