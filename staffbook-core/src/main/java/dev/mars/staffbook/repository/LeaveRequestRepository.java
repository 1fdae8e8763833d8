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
import dev.mars.staffbook.model.Employee;
import dev.mars.staffbook.model.LeaveRequest;
import dev.mars.staffbook.model.LeaveRequestUpdate;
import dev.mars.staffbook.model.LeaveStatus;
import dev.mars.staffbook.model.NewLeaveRequest;
import dev.mars.staffbook.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Leave requests and their approval lifecycle.
 * <p>
 * Only a {@link LeaveStatus#PENDING} request can change. Every change to a
 * decided request fails with {@code INVALID_STATE} and writes nothing.
 */
public final class LeaveRequestRepository extends AbstractRepository<LeaveRequest> {

    private static final Logger LOG = LoggerFactory.getLogger(LeaveRequestRepository.class);

    public static final String COLLECTION = "leave_requests";

    /** Comment stored when the employee withdraws a request. */
    public static final String CANCELLED_COMMENT = "Cancelled by employee";

    private static final Comparator<LeaveRequest> OLDEST_FIRST =
            Comparator.comparing(LeaveRequest::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()));
    private static final Comparator<LeaveRequest> NEWEST_FIRST = OLDEST_FIRST.reversed();

    private final IdGenerator ids;
    private final EmployeeRepository employees;

    public LeaveRequestRepository(RecordStore store, RecordCodec codec, Clock clock,
                                  IdGenerator ids, EmployeeRepository employees) {
        super(store, codec, clock, COLLECTION, LeaveRequest.class);
        this.ids = ids;
        this.employees = employees;
    }

    /**
     * Files a pending request. The employee's current manager is copied onto
     * the request; an unknown employee yields no manager.
     *
     * @throws RepositoryException {@code VALIDATION_FAILED} if the start date is after the end date
     */
    public LeaveRequest create(String employeeId, NewLeaveRequest input) {
        requireText("employee_id", employeeId);
        validateDates(input.startDate(), input.endDate());
        requireText("leave_type", input.leaveType());
        requirePresent("reason", input.reason());

        String managerId = employees.findById(employeeId).map(Employee::managerId).orElse(null);
        LeaveRequest created = insert(() -> {
            Instant now = now();
            return new LeaveRequest(ids.newId(), employeeId, input.startDate(), input.endDate(),
                    input.leaveType(), input.reason(), LeaveStatus.PENDING, managerId,
                    null, null, null, now, now);
        });
        LOG.debug("Leave request {} filed by {} for manager {}", created.id(), employeeId, managerId);
        return created;
    }

    /**
     * Requests of one employee, newest first, optionally limited to one status.
     */
    public List<LeaveRequest> findByEmployee(String employeeId, LeaveStatus status) {
        List<LeaveRequest> requests = findWhere(r -> r.employeeId().equals(employeeId)
                && (status == null || r.status() == status));
        requests.sort(NEWEST_FIRST);
        return requests;
    }

    /**
     * Requests whose approval snapshot names {@code managerId}, newest first.
     */
    public List<LeaveRequest> findByManager(String managerId) {
        List<LeaveRequest> requests = findWhere(r -> managerId != null && managerId.equals(r.managerId()));
        requests.sort(NEWEST_FIRST);
        return requests;
    }

    /**
     * Every pending request, oldest first.
     */
    public List<LeaveRequest> findPending() {
        List<LeaveRequest> requests = findWhere(r -> r.status() == LeaveStatus.PENDING);
        requests.sort(OLDEST_FIRST);
        return requests;
    }

    /**
     * Pending requests awaiting {@code managerId}, oldest first.
     */
    public List<LeaveRequest> findPendingForManager(String managerId) {
        List<LeaveRequest> requests = findWhere(r -> r.status() == LeaveStatus.PENDING
                && managerId != null && managerId.equals(r.managerId()));
        requests.sort(OLDEST_FIRST);
        return requests;
    }

    /**
     * Changes a pending request. The merged date range is re-validated.
     */
    public Optional<LeaveRequest> update(String id, LeaveRequestUpdate update) {
        if (update.startDate().isPresent()) {
            requirePresent("start_date", update.startDate().value());
        }
        if (update.endDate().isPresent()) {
            requirePresent("end_date", update.endDate().value());
        }
        if (update.leaveType().isPresent()) {
            requireText("leave_type", update.leaveType().value());
        }
        if (update.reason().isPresent()) {
            requirePresent("reason", update.reason().value());
        }

        return update(id, current -> {
            requirePending(current, "update");
            LeaveRequest merged = update.applyTo(current);
            validateDates(merged.startDate(), merged.endDate());
            return merged;
        });
    }

    /**
     * Approves or rejects a pending request.
     *
     * @param decision {@link LeaveStatus#APPROVED} or {@link LeaveStatus#REJECTED}
     * @throws RepositoryException {@code INVALID_STATE} if the request is already decided
     */
    public Optional<LeaveRequest> decide(String id, String approverId, LeaveStatus decision, String comments) {
        requireText("approved_by", approverId);
        if (decision == null || decision == LeaveStatus.PENDING) {
            throw RepositoryException.validation("Decision must be approved or rejected: " + decision);
        }

        Optional<LeaveRequest> result = update(id, current -> {
            requirePending(current, "decide");
            return current.decided(decision, approverId, comments, now());
        });
        result.ifPresent(r -> LOG.info("Leave request {} {} by {}", r.id(), decision, approverId));
        return result;
    }

    /**
     * Withdraws a pending request. It ends {@code rejected} with
     * {@value #CANCELLED_COMMENT}, recording {@code actorId} as the deciding user.
     */
    public Optional<LeaveRequest> cancel(String id, String actorId) {
        requireText("approved_by", actorId);
        Optional<LeaveRequest> result = update(id, current -> {
            requirePending(current, "cancel");
            return current.decided(LeaveStatus.REJECTED, actorId, CANCELLED_COMMENT, now());
        });
        result.ifPresent(r -> LOG.info("Leave request {} cancelled by {}", r.id(), actorId));
        return result;
    }

    private static void requirePending(LeaveRequest request, String operation) {
        if (request.status() != LeaveStatus.PENDING) {
            throw RepositoryException.invalidState(
                    "Cannot " + operation + " leave request " + request.id() + ": status is " + request.status());
        }
    }

    private static void validateDates(LocalDate start, LocalDate end) {
        requirePresent("start_date", start);
        requirePresent("end_date", end);
        if (start.isAfter(end)) {
            throw RepositoryException.validation("start_date " + start + " is after end_date " + end);
        }
    }
}
