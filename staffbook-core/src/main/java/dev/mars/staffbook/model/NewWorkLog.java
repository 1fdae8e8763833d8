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

import java.time.LocalDate;

/**
 * Input for logging work.
 */
public record NewWorkLog(
        LocalDate date,
        String taskDescription,
        double timeSpent,
        TaskStatus status,
        String project,
        String category,
        String notes) {

    public static NewWorkLog of(LocalDate date, String taskDescription, double timeSpent, TaskStatus status) {
        return new NewWorkLog(date, taskDescription, timeSpent, status, null, null, null);
    }

    public NewWorkLog withProject(String name) {
        return new NewWorkLog(date, taskDescription, timeSpent, status, name, category, notes);
    }

    public NewWorkLog withCategory(String name) {
        return new NewWorkLog(date, taskDescription, timeSpent, status, project, name, notes);
    }

    public NewWorkLog withNotes(String text) {
        return new NewWorkLog(date, taskDescription, timeSpent, status, project, category, text);
    }
}
