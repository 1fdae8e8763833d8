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
import dev.mars.staffbook.model.LeaveRequest;
import dev.mars.staffbook.model.LeaveRequestUpdate;
import dev.mars.staffbook.model.LeaveStatus;
import dev.mars.staffbook.model.NewLeaveRequest;
import dev.mars.staffbook.model.Role;
import dev.mars.staffbook.policy.AccessPolicy;
import dev.mars.staffbook.repository.LeaveRequestRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.mars.staffbook.service.Guards.allow;
import static dev.mars.staffbook.service.Guards.found;

/**
 * Leave requests: filing, approval and withdrawal.
 */
public final class LeaveService {

    private static final String RESOURCE = "Leave request";

    private final LeaveRequestRepository leaveRequests;
    private final AccessPolicy policy;
    private final AuditRecorder audit;

    public LeaveService(LeaveRequestRepository leaveRequests, AccessPolicy policy, AuditRecorder audit) {
        this.leaveRequests = leaveRequests;
        this.policy = policy;
        this.audit = audit;
    }

    public LeaveRequest create(Employee actor, NewLeaveRequest input) {
        LeaveRequest created = leaveRequests.create(actor.id(), input);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("start_date", String.valueOf(created.startDate()));
        details.put("end_date", String.valueOf(created.endDate()));
        details.put("leave_type", created.leaveType());
        audit.record(actor.id(), ActionType.CREATE, ResourceTypes.LEAVE_REQUEST, created.id(), details);
        return created;
    }

    /**
     * The actor's own requests, newest first. {@code status} may be null.
     */
    public List<LeaveRequest> listOwn(Employee actor, LeaveStatus status) {
        return leaveRequests.findByEmployee(actor.id(), status);
    }

    /**
     * Requests waiting for the actor, oldest first. Admins see every pending request.
     */
    public List<LeaveRequest> pendingApprovals(Employee actor) {
        allow(policy.hasAnyRole(actor, Role.MANAGER, Role.ADMIN), "Only managers and administrators approve leave");
        return actor.hasRole(Role.ADMIN)
                ? leaveRequests.findPending()
                : leaveRequests.findPendingForManager(actor.id());
    }

    public LeaveRequest get(Employee actor, String id) {
        LeaveRequest request = found(leaveRequests.findById(id), RESOURCE, id);
        allow(policy.canViewLeaveRequest(actor, request), "Not authorized to view this leave request");
        return request;
    }

    /**
     * Owner only, while pending.
     */
    public LeaveRequest update(Employee actor, String id, LeaveRequestUpdate update) {
        LeaveRequest request = found(leaveRequests.findById(id), RESOURCE, id);
        allow(actor.id().equals(request.employeeId()), "Can only update your own leave requests");

        LeaveRequest updated = found(leaveRequests.update(id, update), RESOURCE, id);
        audit.record(actor.id(), ActionType.UPDATE, ResourceTypes.LEAVE_REQUEST, id, update.changes());
        return updated;
    }

    /**
     * Approves or rejects. Admin, or the manager recorded when the request was filed.
     */
    public LeaveRequest decide(Employee actor, String id, LeaveStatus decision, String comments) {
        LeaveRequest request = found(leaveRequests.findById(id), RESOURCE, id);
        allow(policy.canApproveLeave(actor, request), "Not authorized to approve this leave request");

        LeaveRequest decided = found(leaveRequests.decide(id, actor.id(), decision, comments), RESOURCE, id);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", decision.value());
        details.put("comments", comments);
        ActionType action = decision == LeaveStatus.APPROVED ? ActionType.APPROVE : ActionType.REJECT;
        audit.record(actor.id(), action, ResourceTypes.LEAVE_REQUEST, id, details);
        return decided;
    }

    /**
     * Owner only, while pending.
     */
    public LeaveRequest cancel(Employee actor, String id) {
        LeaveRequest request = found(leaveRequests.findById(id), RESOURCE, id);
        allow(actor.id().equals(request.employeeId()), "Can only cancel your own leave requests");

        LeaveRequest cancelled = found(leaveRequests.cancel(id, actor.id()), RESOURCE, id);
        audit.record(actor.id(), ActionType.DELETE, ResourceTypes.LEAVE_REQUEST, id, Map.of("action", "cancelled"));
        return cancelled;
    }
}
