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

import dev.mars.staffbook.FaultyRecordStore;
import dev.mars.staffbook.Staffbook;
import dev.mars.staffbook.StaffbookFixture;
import dev.mars.staffbook.identity.IdGenerator;
import dev.mars.staffbook.model.Employee;
import dev.mars.staffbook.model.LeaveRequest;
import dev.mars.staffbook.model.NewLeaveRequest;
import dev.mars.staffbook.model.NewWorkLog;
import dev.mars.staffbook.model.Role;
import dev.mars.staffbook.model.SettingsUpdate;
import dev.mars.staffbook.model.TaskStatus;
import dev.mars.staffbook.model.WorkLog;
import dev.mars.staffbook.model.WorkLogView;
import dev.mars.staffbook.repository.EmployeeRepository;
import dev.mars.staffbook.repository.SettingsRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AccessPolicy")
class AccessPolicyTest {

    @TempDir
    Path tempDir;

    private StaffbookFixture fixture;
    private AccessPolicy policy;

    private Employee admin;
    private Employee manager;
    private Employee otherManager;
    private Employee employee;
    private Employee peer;

    @BeforeEach
    void setUp() {
        fixture = new StaffbookFixture(tempDir);
        policy = fixture.staffbook().policy();
        admin = fixture.admin("admin@example.com");
        manager = fixture.manager("manager@example.com");
        otherManager = fixture.manager("other@example.com");
        employee = fixture.employee("employee@example.com", manager.id());
        peer = fixture.employee("peer@example.com", otherManager.id());
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private WorkLog logOf(Employee owner) {
        return fixture.staffbook().workLogs().create(owner.id(),
                NewWorkLog.of(LocalDate.of(2024, 3, 1), "Work", 1, TaskStatus.IN_PROGRESS));
    }

    private LeaveRequest leaveOf(Employee owner) {
        return fixture.staffbook().leaveRequests().create(owner.id(),
                new NewLeaveRequest(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 3), "Vacation", ""));
    }

    // ========================================================================
    // Employee Data
    // ========================================================================

    @Nested
    @DisplayName("Employee Data")
    class EmployeeDataTests {

        @Test
        @DisplayName("Admin sees everyone, everyone sees themselves")
        void adminAndSelf() {
            assertTrue(policy.canAccessEmployeeData(admin, peer.id()));
            assertTrue(policy.canAccessEmployeeData(employee, employee.id()));
            assertTrue(policy.canAccessEmployeeData(admin, "does-not-exist"));
        }

        @Test
        @DisplayName("Manager sees direct reports only")
        void managerDirectReports() {
            assertTrue(policy.canAccessEmployeeData(manager, employee.id()));
            assertFalse(policy.canAccessEmployeeData(manager, peer.id()));
            assertFalse(policy.canAccessEmployeeData(manager, admin.id()));
            assertFalse(policy.canAccessEmployeeData(manager, "does-not-exist"));
        }

        @Test
        @DisplayName("Employee cannot see peers or their manager")
        void employeeLimited() {
            assertFalse(policy.canAccessEmployeeData(employee, peer.id()));
            assertFalse(policy.canAccessEmployeeData(employee, manager.id()));
        }

        @Test
        @DisplayName("Missing actor or target is denied")
        void nulls() {
            assertFalse(policy.canAccessEmployeeData(null, employee.id()));
            assertFalse(policy.canAccessEmployeeData(admin, null));
            assertFalse(policy.hasAnyRole(null, Role.ADMIN));
            assertTrue(policy.hasAnyRole(manager, Role.MANAGER, Role.ADMIN));
            assertFalse(policy.hasAnyRole(employee, Role.MANAGER, Role.ADMIN));
        }
    }

    // ========================================================================
    // Leave
    // ========================================================================

    @Nested
    @DisplayName("Leave")
    class LeaveTests {

        @Test
        @DisplayName("Only the recorded manager or an admin may decide")
        void approvalAuthority() {
            LeaveRequest request = leaveOf(employee);

            assertTrue(policy.canApproveLeave(admin, request));
            assertTrue(policy.canApproveLeave(manager, request));
            assertFalse(policy.canApproveLeave(otherManager, request));
            assertFalse(policy.canApproveLeave(employee, request));
        }

        @Test
        @DisplayName("Request without a manager can only be decided by an admin")
        void noManager() {
            LeaveRequest request = leaveOf(admin);

            assertNull(request.managerId());
            assertTrue(policy.canApproveLeave(admin, request));
            assertFalse(policy.canApproveLeave(manager, request));
        }

        @Test
        @DisplayName("Owner, recorded manager and admin may view")
        void viewing() {
            LeaveRequest request = leaveOf(employee);

            assertTrue(policy.canViewLeaveRequest(employee, request));
            assertTrue(policy.canViewLeaveRequest(manager, request));
            assertTrue(policy.canViewLeaveRequest(admin, request));
            assertFalse(policy.canViewLeaveRequest(peer, request));
            assertFalse(policy.canViewLeaveRequest(otherManager, request));
        }
    }

    // ========================================================================
    // Work Logs
    // ========================================================================

    @Nested
    @DisplayName("Work Logs")
    class WorkLogTests {

        @Test
        @DisplayName("Owner may edit up to and including the window end")
        void editWindowBoundary() {
            WorkLog log = logOf(employee);

            fixture.clock().advance(Duration.ofHours(24));
            assertTrue(policy.canEditWorkLog(log, employee));

            fixture.clock().advance(Duration.ofNanos(1));
            assertFalse(policy.canEditWorkLog(log, employee));
        }

        @Test
        @DisplayName("Admin may edit any log at any age")
        void adminAlwaysEdits() {
            WorkLog log = logOf(employee);
            fixture.clock().advance(Duration.ofDays(365));

            assertTrue(policy.canEditWorkLog(log, admin));
        }

        @Test
        @DisplayName("Manager may not edit a report's log")
        void managerCannotEdit() {
            WorkLog log = logOf(employee);

            assertFalse(policy.canEditWorkLog(log, manager));
            assertFalse(policy.canEditWorkLog(log, peer));
        }

        @Test
        @DisplayName("Window follows the configured limit")
        void configuredWindow() {
            fixture.staffbook().settings().update(SettingsUpdate.builder().logEditTimeLimitHours(2).build());
            WorkLog log = logOf(employee);

            fixture.clock().advance(Duration.ofHours(2).plusSeconds(1));

            assertFalse(policy.canEditWorkLog(log, employee));
        }

        @Test
        @DisplayName("Views carry the derived edit flag")
        void views() {
            WorkLog own = logOf(employee);
            WorkLog other = logOf(peer);

            List<WorkLogView> views = policy.view(List.of(own, other), employee);

            assertTrue(views.get(0).canEdit());
            assertFalse(views.get(1).canEdit());
            assertSame(own, views.get(0).log());
        }

        @Test
        @DisplayName("Feedback authorship follows the management line")
        void feedbackAuthorship() {
            WorkLog log = logOf(employee);

            assertTrue(policy.canAuthorFeedback(manager, log));
            assertTrue(policy.canAuthorFeedback(admin, log));
            assertFalse(policy.canAuthorFeedback(otherManager, log));
            assertFalse(policy.canAuthorFeedback(employee, log));
        }
    }

    // ========================================================================
    // Failures
    // ========================================================================

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Failed lookups deny instead of throwing")
        void failedLookupsDeny() {
            WorkLog log = logOf(employee);
            FaultyRecordStore faulty = new FaultyRecordStore(fixture.store());
            Staffbook broken = new Staffbook(faulty, fixture.clock(), IdGenerator.random());
            faulty.failReads(EmployeeRepository.COLLECTION);
            faulty.failReads(SettingsRepository.COLLECTION);

            assertFalse(broken.policy().canAccessEmployeeData(manager, employee.id()));
            assertFalse(broken.policy().canAuthorFeedback(manager, log));
            assertFalse(broken.policy().canEditWorkLog(log, employee));
            assertTrue(broken.policy().canEditWorkLog(log, admin));
        }
    }
}
