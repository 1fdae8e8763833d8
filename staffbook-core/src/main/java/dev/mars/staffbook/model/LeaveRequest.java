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
package dev.mars.staffbook.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A request for time off.
 * <p>
 * {@code managerId} is copied from the employee when the request is filed and
 * is never re-resolved: approval authority stays with that manager even if the
 * employee is later reassigned.
 */
public record LeaveRequest(
        @JsonProperty("id") String id,
        @JsonProperty("employee_id") String employeeId,
        @JsonProperty("start_date") LocalDate startDate,
        @JsonProperty("end_date") LocalDate endDate,
        @JsonProperty("leave_type") String leaveType,
        @JsonProperty("reason") String reason,
        @JsonProperty("status") LeaveStatus status,
        @JsonProperty("manager_id") String managerId,
        @JsonProperty("manager_comments") String managerComments,
        @JsonProperty("approved_by") String approvedBy,
        @JsonProperty("approved_at") Instant approvedAt,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) implements Identified {

    public LeaveRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(employeeId, "employeeId");
        Objects.requireNonNull(status, "status");
    }

    /**
     * Returns the request moved to a terminal status.
     */
    public LeaveRequest decided(LeaveStatus decision, String approver, String comments, Instant at) {
        return new LeaveRequest(id, employeeId, startDate, endDate, leaveType, reason,
                decision, managerId, comments, approver, at, createdAt, updatedAt);
    }

    public LeaveRequest withDetails(LocalDate start, LocalDate end, String type, String why) {
        return new LeaveRequest(id, employeeId, start, end, type, why,
                status, managerId, managerComments, approvedBy, approvedAt, createdAt, updatedAt);
    }
}
