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
package dev.mars.staffbook.demo;

import dev.mars.staffbook.Staffbook;
import dev.mars.staffbook.model.AuditEntry;
import dev.mars.staffbook.model.Employee;
import dev.mars.staffbook.model.LeaveRequest;
import dev.mars.staffbook.model.LeaveStatus;
import dev.mars.staffbook.model.NewEmployee;
import dev.mars.staffbook.model.NewFeedback;
import dev.mars.staffbook.model.NewLeaveRequest;
import dev.mars.staffbook.model.NewWorkLog;
import dev.mars.staffbook.model.Role;
import dev.mars.staffbook.model.TaskStatus;
import dev.mars.staffbook.model.WorkLogView;
import dev.mars.staffbook.repository.AuditQuery;
import dev.mars.staffbook.repository.RepositoryException;
import dev.mars.staffbook.store.RecordStoreConfig;

import java.time.LocalDate;
import java.util.List;

/**
 * Console walkthrough of the engine.
 * <p>
 * This demonstrates:
 * <ul>
 *   <li>Opening the store from configuration</li>
 *   <li>Logging in and resolving the acting employee</li>
 *   <li>Logging work and giving feedback along the reporting line</li>
 *   <li>Filing, approving and re-approving a leave request</li>
 *   <li>Reading the audit trail</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link RecordStoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Dstaffbook.dataDir=/path -Dstaffbook.syncEnabled=true ...}</li>
 *   <li>Environment variables: {@code STAFFBOOK_DATA_DIR, STAFFBOOK_SYNC_ENABLED, ...}</li>
 *   <li>Properties file: {@code staffbook.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl staffbook-demo -am
 *
 * # Run with default configuration
 * java -jar staffbook-demo/target/staffbook-demo-1.0-SNAPSHOT.jar
 *
 * # Run with CLI data directory override
 * java -jar staffbook-demo/target/staffbook-demo-1.0-SNAPSHOT.jar /path/to/data
 * </pre>
 * The demo employees are created on the first run and reused afterwards, so
 * running it repeatedly grows their history.
 *
 * @see RecordStoreConfig
 */
public class StaffbookDemo {

    private static final String PASSWORD = "demo-password";

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|           Staffbook Demo              |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        // Build configuration with CLI override if provided
        RecordStoreConfig config = args.length > 0 && !args[0].isBlank()
                ? RecordStoreConfig.builder().dataDir(args[0]).build()
                : RecordStoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (Staffbook staffbook = Staffbook.open(config)) {
            System.out.println("[OK] Store opened at: " + config.dataDir().toAbsolutePath());

            // Bootstrap: the first admin cannot be created through the admin-only service
            Employee admin = staffbook.employees().findByEmail("admin@staffbook.local")
                    .orElseGet(() -> staffbook.employees().create(NewEmployee.of(
                            "admin@staffbook.local", PASSWORD, "Ada", "Admin", Role.ADMIN, LocalDate.now())));
            admin = staffbook.authService().login(admin.email(), PASSWORD);
            System.out.println("[OK] Logged in as " + admin.fullName() + " (" + admin.role() + ")");

            Employee manager = findOrCreate(staffbook, admin,
                    NewEmployee.of("maria@staffbook.local", PASSWORD, "Maria", "Manager", Role.MANAGER, LocalDate.now())
                            .withDepartment("Engineering"));
            Employee employee = findOrCreate(staffbook, admin,
                    NewEmployee.of("eli@staffbook.local", PASSWORD, "Eli", "Employee", Role.EMPLOYEE, LocalDate.now())
                            .withDepartment("Engineering")
                            .withManager(manager.id()));
            System.out.println("[OK] " + employee.fullName() + " reports to " + manager.fullName());

            // Work log and feedback
            WorkLogView log = staffbook.workLogService().create(employee,
                    NewWorkLog.of(LocalDate.now(), "Wrote the release notes", 2.5, TaskStatus.COMPLETED)
                            .withCategory("Documentation"));
            System.out.println("\n[OK] Work log " + log.log().id() + " created, editable=" + log.canEdit());

            staffbook.feedbackService().create(manager, new NewFeedback(log.log().id(), "Clear and complete", 5));
            System.out.println("[OK] " + manager.fullName() + " rated the log 5/5");

            // Leave approval
            LeaveRequest request = staffbook.leaveService().create(employee, new NewLeaveRequest(
                    LocalDate.now().plusDays(14), LocalDate.now().plusDays(16), "Vacation", "Family trip"));
            System.out.println("\n[OK] Leave request " + request.id() + " filed: status=" + request.status() +
                    ", approver=" + request.managerId());

            LeaveRequest approved = staffbook.leaveService().decide(manager, request.id(), LeaveStatus.APPROVED, "OK");
            System.out.println("[OK] Approved by " + approved.approvedBy() + " at " + approved.approvedAt());

            try {
                staffbook.leaveService().decide(manager, request.id(), LeaveStatus.APPROVED, "again");
                System.out.println("[!!] Second approval unexpectedly succeeded");
            } catch (RepositoryException e) {
                System.out.println("[OK] Second approval refused: " + e.kind() + " - " + e.getMessage());
            }

            // Audit trail
            List<AuditEntry> recent = staffbook.adminService().auditTrail(admin, AuditQuery.latest().withLimit(6));
            System.out.println("\n  Most recent audit entries:");
            for (AuditEntry entry : recent) {
                System.out.printf("    %s %-7s %-14s %s%n",
                        entry.timestamp(), entry.action(), entry.resourceType(), entry.details());
            }

            staffbook.authService().logout(admin);

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Staffbook demo complete!             |");
            System.out.println("|  Data is kept in the data directory.  |");
            System.out.println("+---------------------------------------+");
        }
    }

    private static Employee findOrCreate(Staffbook staffbook, Employee admin, NewEmployee input) {
        return staffbook.employees().findByEmail(input.email())
                .orElseGet(() -> staffbook.employeeService().create(admin, input));
    }
}
