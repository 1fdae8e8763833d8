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
import dev.mars.staffbook.model.NewEmployee;
import dev.mars.staffbook.model.Role;
import dev.mars.staffbook.model.SettingsUpdate;
import dev.mars.staffbook.model.SystemSettings;
import dev.mars.staffbook.repository.AuditQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdminServiceTest {

    @TempDir
    Path tempDir;

    private StaffbookFixture fixture;
    private AdminService service;
    private Employee admin;
    private Employee manager;

    @BeforeEach
    void setUp() {
        fixture = new StaffbookFixture(tempDir);
        service = fixture.staffbook().adminService();
        admin = fixture.admin("admin@example.com");
        manager = fixture.manager("manager@example.com");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static NewEmployee row(String email) {
        return NewEmployee.of(email, "pw", "Bulk", "Row", Role.EMPLOYEE, StaffbookFixture.HIRE_DATE);
    }

    @Test
    void testSettingsAreAdminOnly() {
        assertEquals(SystemSettings.DEFAULT_LOG_EDIT_TIME_LIMIT_HOURS, service.settings(admin).logEditTimeLimitHours());
        assertThrows(AccessDeniedException.class, () -> service.settings(manager));
        assertThrows(AccessDeniedException.class,
                () -> service.updateSettings(manager, SettingsUpdate.builder().logEditTimeLimitHours(1).build()));
    }

    @Test
    void testUpdateSettingsAudited() {
        SystemSettings updated = service.updateSettings(admin,
                SettingsUpdate.builder().logEditTimeLimitHours(72).build());

        assertEquals(72, updated.logEditTimeLimitHours());
        AuditEntry entry = service.auditTrail(admin, AuditQuery.latest()).get(0);
        assertEquals(ActionType.UPDATE, entry.action());
        assertEquals("system_settings", entry.resourceType());
        assertEquals(72, entry.details().get("log_edit_time_limit_hours"));
    }

    @Test
    void testAuditTrailIsAdminOnly() {
        assertThrows(AccessDeniedException.class, () -> service.auditTrail(manager, AuditQuery.latest()));
    }

    @Test
    void testBulkCreateReportsRowErrors() {
        List<NewEmployee> rows = List.of(
                row("one@example.com"),
                row("manager@example.com"),
                row("two@example.com"),
                new NewEmployee(null, "pw", "No", "Email", null, null, null, null, StaffbookFixture.HIRE_DATE),
                row("one@example.com"));

        BulkCreateResult result = service.bulkCreateEmployees(admin, rows);

        assertEquals(2, result.successful());
        assertEquals(3, result.errors().size());
        assertEquals(2, result.errors().get(0).row());
        assertEquals("manager@example.com", result.errors().get(0).email());
        assertEquals(4, result.errors().get(1).row());
        assertEquals("unknown", result.errors().get(1).email());
        assertEquals(5, result.errors().get(2).row());
        assertTrue(fixture.staffbook().employees().findByEmail("two@example.com").isPresent());

        AuditEntry entry = service.auditTrail(admin, AuditQuery.latest().forResourceType("bulk_employees")).get(0);
        assertEquals("bulk_operation", entry.resourceId());
        assertEquals(5, entry.details().get("total_processed"));
        assertEquals(2, entry.details().get("successful"));
        assertEquals(3, entry.details().get("errors"));
    }

    @Test
    void testBulkCreateRequiresAdmin() {
        assertThrows(AccessDeniedException.class,
                () -> service.bulkCreateEmployees(manager, List.of(row("x@example.com"))));
        assertTrue(fixture.staffbook().employees().findByEmail("x@example.com").isEmpty());
    }
}
