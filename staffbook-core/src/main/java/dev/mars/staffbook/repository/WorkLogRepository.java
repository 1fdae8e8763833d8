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
package dev.mars.staffbook.repository;

import dev.mars.staffbook.identity.IdGenerator;
import dev.mars.staffbook.model.NewWorkLog;
import dev.mars.staffbook.model.WorkLog;
import dev.mars.staffbook.model.WorkLogUpdate;
import dev.mars.staffbook.store.RecordStore;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Daily work logs.
 */
public final class WorkLogRepository extends AbstractRepository<WorkLog> {

    public static final String COLLECTION = "work_logs";

    /** Newest work date first, then most recently created. */
    static final Comparator<WorkLog> NEWEST_FIRST = Comparator
            .comparing(WorkLog::date, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(WorkLog::createdAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final IdGenerator ids;

    public WorkLogRepository(RecordStore store, RecordCodec codec, Clock clock, IdGenerator ids) {
        super(store, codec, clock, COLLECTION, WorkLog.class);
        this.ids = ids;
    }

    public WorkLog create(String employeeId, NewWorkLog input) {
        requireText("employee_id", employeeId);
        requirePresent("date", input.date());
        requireText("task_description", input.taskDescription());
        requireHours(input.timeSpent());
        requirePresent("status", input.status());

        return insert(() -> {
            Instant now = now();
            return new WorkLog(ids.newId(), employeeId, input.date(), input.taskDescription(),
                    input.timeSpent(), input.status(), input.project(), input.category(), input.notes(),
                    null, now, now);
        });
    }

    /**
     * Logs of one employee with {@code from <= date <= to}; either bound may be null.
     */
    public List<WorkLog> findByEmployee(String employeeId, LocalDate from, LocalDate to) {
        List<WorkLog> logs = findWhere(log -> log.employeeId().equals(employeeId) && inRange(log.date(), from, to));
        logs.sort(NEWEST_FIRST);
        return logs;
    }

    public Optional<WorkLog> update(String id, WorkLogUpdate update) {
        if (update.taskDescription().isPresent()) {
            requireText("task_description", update.taskDescription().value());
        }
        if (update.timeSpent().isPresent()) {
            requireHours(requirePresent("time_spent", update.timeSpent().value()));
        }
        if (update.status().isPresent()) {
            requirePresent("status", update.status().value());
        }
        return update(id, update::applyTo);
    }

    public Optional<WorkLog> attachManagerFeedback(String id, String feedback) {
        requireText("manager_feedback", feedback);
        return update(id, log -> log.withManagerFeedback(feedback));
    }

    private static boolean inRange(LocalDate date, LocalDate from, LocalDate to) {
        if (date == null) {
            return from == null && to == null;
        }
        return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
    }

    private static void requireHours(double hours) {
        if (Double.isNaN(hours) || Double.isInfinite(hours) || hours < 0) {
            throw RepositoryException.validation("time_spent must be a non-negative number of hours: " + hours);
        }
    }
}
