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
import dev.mars.staffbook.model.Feedback;
import dev.mars.staffbook.model.NewFeedback;
import dev.mars.staffbook.model.WorkLog;
import dev.mars.staffbook.store.RecordStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Manager feedback on work logs.
 */
public final class FeedbackRepository extends AbstractRepository<Feedback> {

    public static final String COLLECTION = "feedback";

    private static final Comparator<Feedback> NEWEST_FIRST =
            Comparator.comparing(Feedback::createdAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final IdGenerator ids;
    private final WorkLogRepository workLogs;

    public FeedbackRepository(RecordStore store, RecordCodec codec, Clock clock,
                              IdGenerator ids, WorkLogRepository workLogs) {
        super(store, codec, clock, COLLECTION, Feedback.class);
        this.ids = ids;
        this.workLogs = workLogs;
    }

    /**
     * Records feedback from {@code managerId} on a work log. The log is read
     * first and the feedback row written last; the two collections are not
     * updated atomically together.
     *
     * @throws RepositoryException {@code NOT_FOUND} if the work log does not exist
     */
    public Feedback create(String managerId, NewFeedback input) {
        requireText("manager_id", managerId);
        requireText("work_log_id", input.workLogId());
        requireText("feedback_text", input.feedbackText());
        Integer rating = input.rating();
        if (rating != null && (rating < Feedback.MIN_RATING || rating > Feedback.MAX_RATING)) {
            throw RepositoryException.validation("rating must be between " + Feedback.MIN_RATING +
                    " and " + Feedback.MAX_RATING + ": " + rating);
        }

        WorkLog log = workLogs.findById(input.workLogId())
                .orElseThrow(() -> RepositoryException.notFound("Work log", input.workLogId()));

        return insert(() -> {
            Instant now = now();
            return new Feedback(ids.newId(), log.id(), log.employeeId(), managerId,
                    input.feedbackText(), rating, now, now);
        });
    }

    public List<Feedback> findByEmployee(String employeeId) {
        return sorted(findWhere(f -> f.employeeId().equals(employeeId)));
    }

    public List<Feedback> findByWorkLog(String workLogId) {
        return sorted(findWhere(f -> f.workLogId().equals(workLogId)));
    }

    /**
     * Feedback given by {@code managerId}, newest first.
     */
    public List<Feedback> findByManager(String managerId) {
        return sorted(findWhere(f -> f.managerId().equals(managerId)));
    }

    private static List<Feedback> sorted(List<Feedback> feedback) {
        feedback.sort(NEWEST_FIRST);
        return feedback;
    }
}
