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
import java.util.Objects;

/**
 * A manager's feedback on one work log.
 * <p>
 * {@code employeeId} is copied from the work log at creation.
 */
public record Feedback(
        @JsonProperty("id") String id,
        @JsonProperty("work_log_id") String workLogId,
        @JsonProperty("employee_id") String employeeId,
        @JsonProperty("manager_id") String managerId,
        @JsonProperty("feedback_text") String feedbackText,
        @JsonProperty("rating") Integer rating,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) implements Identified {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    public Feedback {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(workLogId, "workLogId");
    }
}
