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
 * One unit of work an employee reports for a day.
 * <p>
 * Whether the log may still be edited is not stored; see {@link WorkLogView}.
 */
public record WorkLog(
        @JsonProperty("id") String id,
        @JsonProperty("employee_id") String employeeId,
        @JsonProperty("date") LocalDate date,
        @JsonProperty("task_description") String taskDescription,
        @JsonProperty("time_spent") double timeSpent,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("project") String project,
        @JsonProperty("category") String category,
        @JsonProperty("notes") String notes,
        @JsonProperty("manager_feedback") String managerFeedback,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) implements Identified {

    public WorkLog {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(employeeId, "employeeId");
    }

    public WorkLog withManagerFeedback(String feedback) {
        return new WorkLog(id, employeeId, date, taskDescription, timeSpent, status,
                project, category, notes, feedback, createdAt, updatedAt);
    }

    public WorkLog withTimeSpent(double hours) {
        return new WorkLog(id, employeeId, date, taskDescription, hours, status,
                project, category, notes, managerFeedback, createdAt, updatedAt);
    }
}
