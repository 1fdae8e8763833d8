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
package dev.mars.staffbook;

import dev.mars.staffbook.audit.AuditRecorder;
import dev.mars.staffbook.identity.IdGenerator;
import dev.mars.staffbook.identity.PasswordHasher;
import dev.mars.staffbook.policy.AccessPolicy;
import dev.mars.staffbook.repository.AuditTrailRepository;
import dev.mars.staffbook.repository.EmployeeRepository;
import dev.mars.staffbook.repository.FeedbackRepository;
import dev.mars.staffbook.repository.LeaveRequestRepository;
import dev.mars.staffbook.repository.RecordCodec;
import dev.mars.staffbook.repository.SettingsRepository;
import dev.mars.staffbook.repository.WorkLogRepository;
import dev.mars.staffbook.service.AdminService;
import dev.mars.staffbook.service.AuthService;
import dev.mars.staffbook.service.EmployeeService;
import dev.mars.staffbook.service.FeedbackService;
import dev.mars.staffbook.service.LeaveService;
import dev.mars.staffbook.service.WorkLogService;
import dev.mars.staffbook.store.FileRecordStore;
import dev.mars.staffbook.store.RecordStore;
import dev.mars.staffbook.store.RecordStoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;

/**
 * The engine, wired.
 * <p>
 * Built once at process start. Every component receives the same store,
 * clock and id source through its constructor; nothing is looked up
 * statically.
 * <pre>{@code
 * try (Staffbook staffbook = Staffbook.open(RecordStoreConfig.load())) {
 *     Employee actor = staffbook.authService().login(email, password);
 *     staffbook.leaveService().create(actor, request);
 * }
 * }</pre>
 */
public final class Staffbook implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Staffbook.class);

    private final RecordStore store;

    private final EmployeeRepository employees;
    private final WorkLogRepository workLogs;
    private final LeaveRequestRepository leaveRequests;
    private final FeedbackRepository feedback;
    private final AuditTrailRepository auditTrail;
    private final SettingsRepository settings;

    private final AccessPolicy policy;
    private final AuditRecorder audit;

    private final AuthService authService;
    private final EmployeeService employeeService;
    private final WorkLogService workLogService;
    private final LeaveService leaveService;
    private final FeedbackService feedbackService;
    private final AdminService adminService;

    /**
     * Wires the engine over an already opened store.
     */
    public Staffbook(RecordStore store, Clock clock, IdGenerator ids) {
        this.store = store;
        RecordCodec codec = new RecordCodec();

        this.employees = new EmployeeRepository(store, codec, clock, ids, new PasswordHasher());
        this.workLogs = new WorkLogRepository(store, codec, clock, ids);
        this.leaveRequests = new LeaveRequestRepository(store, codec, clock, ids, employees);
        this.feedback = new FeedbackRepository(store, codec, clock, ids, workLogs);
        this.auditTrail = new AuditTrailRepository(store, codec, clock, ids);
        this.settings = new SettingsRepository(store, codec, clock);

        this.policy = new AccessPolicy(employees, settings, clock);
        this.audit = new AuditRecorder(auditTrail);

        this.authService = new AuthService(employees, audit);
        this.employeeService = new EmployeeService(employees, policy, audit);
        this.workLogService = new WorkLogService(workLogs, employees, policy, audit);
        this.leaveService = new LeaveService(leaveRequests, policy, audit);
        this.feedbackService = new FeedbackService(feedback, workLogs, employees, policy, audit);
        this.adminService = new AdminService(settings, auditTrail, employees, policy, audit);
    }

    /**
     * Opens a {@link FileRecordStore} on the configured directory with the
     * UTC system clock and random ids.
     */
    public static Staffbook open(RecordStoreConfig config) {
        return open(config, Clock.systemUTC(), IdGenerator.random());
    }

    public static Staffbook open(RecordStoreConfig config, Clock clock, IdGenerator ids) {
        FileRecordStore store = new FileRecordStore(config);
        store.open(config.dataDir());
        LOG.info("Staffbook ready at {}", config.dataDir());
        return new Staffbook(store, clock, ids);
    }

    public RecordStore store() {
        return store;
    }

    public EmployeeRepository employees() {
        return employees;
    }

    public WorkLogRepository workLogs() {
        return workLogs;
    }

    public LeaveRequestRepository leaveRequests() {
        return leaveRequests;
    }

    public FeedbackRepository feedback() {
        return feedback;
    }

    public AuditTrailRepository auditTrail() {
        return auditTrail;
    }

    public SettingsRepository settings() {
        return settings;
    }

    public AccessPolicy policy() {
        return policy;
    }

    public AuditRecorder audit() {
        return audit;
    }

    public AuthService authService() {
        return authService;
    }

    public EmployeeService employeeService() {
        return employeeService;
    }

    public WorkLogService workLogService() {
        return workLogService;
    }

    public LeaveService leaveService() {
        return leaveService;
    }

    public FeedbackService feedbackService() {
        return feedbackService;
    }

    public AdminService adminService() {
        return adminService;
    }

    @Override
    public void close() {
        store.close();
    }
}
