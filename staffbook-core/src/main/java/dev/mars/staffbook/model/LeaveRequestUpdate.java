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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of a pending leave request.
 */
public final class LeaveRequestUpdate {

    private final Change<LocalDate> startDate;
    private final Change<LocalDate> endDate;
    private final Change<String> leaveType;
    private final Change<String> reason;

    private LeaveRequestUpdate(Builder builder) {
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.leaveType = builder.leaveType;
        this.reason = builder.reason;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LeaveRequestUpdate empty() {
        return builder().build();
    }

    public Change<LocalDate> startDate() {
        return startDate;
    }

    public Change<LocalDate> endDate() {
        return endDate;
    }

    public Change<String> leaveType() {
        return leaveType;
    }

    public Change<String> reason() {
        return reason;
    }

    public boolean isEmpty() {
        return !startDate.isPresent() && !endDate.isPresent() && !leaveType.isPresent() && !reason.isPresent();
    }

    public LeaveRequest applyTo(LeaveRequest current) {
        return current.withDetails(
                startDate.orElse(current.startDate()),
                endDate.orElse(current.endDate()),
                leaveType.orElse(current.leaveType()),
                reason.orElse(current.reason()));
    }

    /**
     * Present fields keyed by stored field name, for the audit trail.
     */
    public Map<String, Object> changes() {
        Map<String, Object> changes = new LinkedHashMap<>();
        if (startDate.isPresent()) {
            changes.put("start_date", String.valueOf(startDate.value()));
        }
        if (endDate.isPresent()) {
            changes.put("end_date", String.valueOf(endDate.value()));
        }
        if (leaveType.isPresent()) {
            changes.put("leave_type", leaveType.value());
        }
        if (reason.isPresent()) {
            changes.put("reason", reason.value());
        }
        return changes;
    }

    @Override
    public String toString() {
        return "LeaveRequestUpdate{startDate=" + startDate + ", endDate=" + endDate +
                ", leaveType=" + leaveType + ", reason=" + reason + '}';
    }

    public static final class Builder {
        private Change<LocalDate> startDate = Change.absent();
        private Change<LocalDate> endDate = Change.absent();
        private Change<String> leaveType = Change.absent();
        private Change<String> reason = Change.absent();

        private Builder() {
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = Change.to(startDate);
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = Change.to(endDate);
            return this;
        }

        public Builder leaveType(String leaveType) {
            this.leaveType = Change.to(leaveType);
            return this;
        }

        public Builder reason(String reason) {
            this.reason = Change.to(reason);
            return this;
        }

        public LeaveRequestUpdate build() {
            return new LeaveRequestUpdate(this);
        }
    }
}
