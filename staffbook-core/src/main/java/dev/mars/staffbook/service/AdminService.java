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
import dev.mars.staffbook.model.AuditEntry;
import dev.mars.staffbook.model.Employee;
import dev.mars.staffbook.model.NewEmployee;
import dev.mars.staffbook.model.Role;
import dev.mars.staffbook.model.SettingsUpdate;
import dev.mars.staffbook.model.SystemSettings;
import dev.mars.staffbook.policy.AccessPolicy;
import dev.mars.staffbook.repository.AuditQuery;
import dev.mars.staffbook.repository.AuditTrailRepository;
import dev.mars.staffbook.repository.EmployeeRepository;
import dev.mars.staffbook.repository.RepositoryException;
import dev.mars.staffbook.repository.SettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.mars.staffbook.service.Guards.allow;

/**
 * Administrator operations. Every method requires the admin role.
 */
public final class AdminService {

    private static final Logger LOG = LoggerFactory.getLogger(AdminService.class);

    private final SettingsRepository settings;
    private final AuditTrailRepository auditTrail;
    private final EmployeeRepository employees;
    private final AccessPolicy policy;
    private final AuditRecorder audit;

    public AdminService(SettingsRepository settings, AuditTrailRepository auditTrail, EmployeeRepository employees,
                        AccessPolicy policy, AuditRecorder audit) {
        this.settings = settings;
        this.auditTrail = auditTrail;
        this.employees = employees;
        this.policy = policy;
        this.audit = audit;
    }

    public SystemSettings settings(Employee actor) {
        requireAdmin(actor);
        return settings.get();
    }

    public SystemSettings updateSettings(Employee actor, SettingsUpdate update) {
        requireAdmin(actor);
        SystemSettings updated = settings.update(update);
        audit.record(actor.id(), ActionType.UPDATE, ResourceTypes.SYSTEM_SETTINGS, SystemSettings.SETTINGS_ID,
                update.changes());
        return updated;
    }

    public List<AuditEntry> auditTrail(Employee actor, AuditQuery query) {
        requireAdmin(actor);
        return auditTrail.query(query);
    }

    /**
     * Creates each row independently. A refused row is reported and does not
     * stop the rows after it.
     */
    public BulkCreateResult bulkCreateEmployees(Employee actor, List<NewEmployee> rows) {
        requireAdmin(actor);

        List<String> created = new ArrayList<>();
        List<BulkCreateResult.RowError> errors = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            NewEmployee row = rows.get(i);
            try {
                created.add(employees.create(row).id());
            } catch (RepositoryException e) {
                String email = row.email() != null ? row.email() : "unknown";
                LOG.debug("Bulk row {} ({}) refused: {}", i + 1, email, e.getMessage());
                errors.add(new BulkCreateResult.RowError(i + 1, email, e.getMessage()));
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("total_processed", rows.size());
        details.put("successful", created.size());
        details.put("errors", errors.size());
        audit.record(actor.id(), ActionType.CREATE, ResourceTypes.BULK_EMPLOYEES, "bulk_operation", details);

        LOG.info("Bulk employee import by {}: {} created, {} refused", actor.id(), created.size(), errors.size());
        return new BulkCreateResult(created, errors);
    }

    private void requireAdmin(Employee actor) {
        allow(policy.hasAnyRole(actor, Role.ADMIN), "Administrator role required");
    }
}
