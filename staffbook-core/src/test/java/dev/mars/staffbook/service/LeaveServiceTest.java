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

import dev.mars.staffbook.StaffbookFixture;
import dev.mars.staffbook.model.ActionType;
import dev.mars.staffbook.model.AuditEntry;
import dev.mars.staffbook.model.Employee;
import dev.mars.staffbook.model.LeaveRequest;
import dev.mars.staffbook.model.LeaveRequestUpdate;
import dev.mars.staffbook.model.LeaveStatus;
import dev.mars.staffbook.model.NewLeaveRequest;
import dev.mars.staffbook.repository.AuditQuery;
import dev.mars.staffbook.repository.RepositoryException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LeaveServiceTest {

    @TempDir
    Path tempDir;

    private StaffbookFixture fixture;
    private LeaveService service;
    private Employee admin;
    private Employee manager;
    private Employee otherManager;
    private Employee employee;

    @BeforeEach
    void setUp() {
        fixture = new StaffbookFixture(tempDir);
        service = fixture.staffbook().leaveService();
        admin = fixture.admin("admin@example.com");
        manager = fixture.manager("manager@example.com");
        otherManager = fixture.manager("other@example.com");
        employee = fixture.employee("employee@example.com", manager.id());
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private LeaveRequest request() {
        return service.create(employee, new NewLeaveRequest(
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 3), "Vacation", "Family"));
    }

    private List<AuditEntry> audit(ActionType action) {
        return fixture.staffbook().auditTrail().query(AuditQuery.latest().forAction(action));
    }

    @Test
    void testApproveFlow() {
        LeaveRequest request = request();
        assertEquals(List.of(request.id()), service.pendingApprovals(manager).stream().map(LeaveRequest::id)
                .collect(Collectors.toList()));

        LeaveRequest approved = service.decide(manager, request.id(), LeaveStatus.APPROVED, "OK");

        assertEquals(LeaveStatus.APPROVED, approved.status());
        assertTrue(service.pendingApprovals(manager).isEmpty());
        AuditEntry entry = audit(ActionType.APPROVE).get(0);
        assertEquals("approved", entry.details().get("status"));
        assertEquals("OK", entry.details().get("comments"));

        RepositoryException again = assertThrows(RepositoryException.class,
                () -> service.decide(manager, request.id(), LeaveStatus.REJECTED, "Changed my mind"));
        assertEquals(RepositoryException.Kind.INVALID_STATE, again.kind());
        assertTrue(audit(ActionType.REJECT).isEmpty());
    }

    @Test
    void testRejectAudited() {
        LeaveRequest request = request();

        service.decide(admin, request.id(), LeaveStatus.REJECTED, null);

        assertEquals(1, audit(ActionType.REJECT).size());
    }

    @Test
    void testWrongManagerForbidden() {
        LeaveRequest request = request();

        assertThrows(AccessDeniedException.class,
                () -> service.decide(otherManager, request.id(), LeaveStatus.APPROVED, null));
        assertThrows(AccessDeniedException.class,
                () -> service.decide(employee, request.id(), LeaveStatus.APPROVED, null));
        assertEquals(LeaveStatus.PENDING, service.get(employee, request.id()).status());
    }

    @Test
    void testPendingApprovalsScope() {
        request();

        assertTrue(service.pendingApprovals(otherManager).isEmpty());
        assertEquals(1, service.pendingApprovals(admin).size());
        assertThrows(AccessDeniedException.class, () -> service.pendingApprovals(employee));
    }

    @Test
    void testViewing() {
        LeaveRequest request = request();

        assertEquals(request.id(), service.get(manager, request.id()).id());
        assertThrows(AccessDeniedException.class, () -> service.get(otherManager, request.id()));
        assertEquals(1, service.listOwn(employee, null).size());
        assertTrue(service.listOwn(employee, LeaveStatus.APPROVED).isEmpty());
    }

    @Test
    void testOwnerEditsAndCancels() {
        LeaveRequest request = request();

        LeaveRequest edited = service.update(employee, request.id(),
                LeaveRequestUpdate.builder().leaveType("Personal").build());
        assertEquals("Personal", edited.leaveType());
        assertThrows(AccessDeniedException.class, () -> service.update(manager, request.id(),
                LeaveRequestUpdate.builder().leaveType("Sick Leave").build()));

        assertThrows(AccessDeniedException.class, () -> service.cancel(manager, request.id()));
        LeaveRequest cancelled = service.cancel(employee, request.id());

        assertEquals(LeaveStatus.REJECTED, cancelled.status());
        assertEquals("cancelled", audit(ActionType.DELETE).get(0).details().get("action"));
        RepositoryException ex = assertThrows(RepositoryException.class,
                () -> service.cancel(employee, request.id()));
        assertEquals(RepositoryException.Kind.INVALID_STATE, ex.kind());
    }

    @Test
    void testMissingRequestIsNotFound() {
        RepositoryException ex = assertThrows(RepositoryException.class,
                () -> service.decide(admin, "missing", LeaveStatus.APPROVED, null));

        assertEquals(RepositoryException.Kind.NOT_FOUND, ex.kind());
    }
}
