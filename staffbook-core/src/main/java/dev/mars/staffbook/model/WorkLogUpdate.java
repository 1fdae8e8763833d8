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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of a work log's content. Manager feedback is attached
 * separately and cannot be changed here.
 */
public final class WorkLogUpdate {

    private final Change<String> taskDescription;
    private final Change<Double> timeSpent;
    private final Change<TaskStatus> status;
    private final Change<String> project;
    private final Change<String> category;
    private final Change<String> notes;

    private WorkLogUpdate(Builder builder) {
        this.taskDescription = builder.taskDescription;
        this.timeSpent = builder.timeSpent;
        this.status = builder.status;
        this.project = builder.project;
        this.category = builder.category;
        this.notes = builder.notes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WorkLogUpdate empty() {
        return builder().build();
    }

    public Change<String> taskDescription() {
        return taskDescription;
    }

    public Change<Double> timeSpent() {
        return timeSpent;
    }

    public Change<TaskStatus> status() {
        return status;
    }

    public Change<String> project() {
        return project;
    }

    public Change<String> category() {
        return category;
    }

    public Change<String> notes() {
        return notes;
    }

    public boolean isEmpty() {
        return !taskDescription.isPresent() && !timeSpent.isPresent() && !status.isPresent()
                && !project.isPresent() && !category.isPresent() && !notes.isPresent();
    }

    public WorkLog applyTo(WorkLog current) {
        return new WorkLog(
                current.id(),
                current.employeeId(),
                current.date(),
                taskDescription.orElse(current.taskDescription()),
                timeSpent.isPresent() ? timeSpent.value() : current.timeSpent(),
                status.orElse(current.status()),
                project.orElse(current.project()),
                category.orElse(current.category()),
                notes.orElse(current.notes()),
                current.managerFeedback(),
                current.createdAt(),
                current.updatedAt());
    }

    /**
     * Present fields keyed by stored field name, for the audit trail.
     */
    public Map<String, Object> changes() {
        Map<String, Object> changes = new LinkedHashMap<>();
        if (taskDescription.isPresent()) {
            changes.put("task_description", taskDescription.value());
        }
        if (timeSpent.isPresent()) {
            changes.put("time_spent", timeSpent.value());
        }
        if (status.isPresent()) {
            changes.put("status", status.value() == null ? null : status.value().value());
        }
        if (project.isPresent()) {
            changes.put("project", project.value());
        }
        if (category.isPresent()) {
            changes.put("category", category.value());
        }
        if (notes.isPresent()) {
            changes.put("notes", notes.value());
        }
        return changes;
    }

    @Override
    public String toString() {
        return "WorkLogUpdate{taskDescription=" + taskDescription + ", timeSpent=" + timeSpent +
                ", status=" + status + ", project=" + project + ", category=" + category +
                ", notes=" + notes + '}';
    }

    public static final class Builder {
        private Change<String> taskDescription = Change.absent();
        private Change<Double> timeSpent = Change.absent();
        private Change<TaskStatus> status = Change.absent();
        private Change<String> project = Change.absent();
        private Change<String> category = Change.absent();
        private Change<String> notes = Change.absent();

        private Builder() {
        }

        public Builder taskDescription(String taskDescription) {
            this.taskDescription = Change.to(taskDescription);
            return this;
        }

        public Builder timeSpent(double hours) {
            this.timeSpent = Change.to(hours);
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = Change.to(status);
            return this;
        }

        public Builder project(String project) {
            this.project = Change.to(project);
            return this;
        }

        public Builder category(String category) {
            this.category = Change.to(category);
            return this;
        }

        public Builder notes(String notes) {
            this.notes = Change.to(notes);
            return this;
        }

        public WorkLogUpdate build() {
            return new WorkLogUpdate(this);
        }
    }
}
