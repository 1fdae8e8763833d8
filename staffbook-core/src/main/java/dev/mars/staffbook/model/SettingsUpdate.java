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
import java.util.List;
import java.util.Map;

/**
 * Partial update of the system settings.
 */
public final class SettingsUpdate {

    private final Change<Integer> logEditTimeLimitHours;
    private final Change<List<String>> defaultLeaveTypes;
    private final Change<List<String>> defaultTaskCategories;
    private final Change<Map<String, Object>> notificationSettings;

    private SettingsUpdate(Builder builder) {
        this.logEditTimeLimitHours = builder.logEditTimeLimitHours;
        this.defaultLeaveTypes = builder.defaultLeaveTypes;
        this.defaultTaskCategories = builder.defaultTaskCategories;
        this.notificationSettings = builder.notificationSettings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Change<Integer> logEditTimeLimitHours() {
        return logEditTimeLimitHours;
    }

    public Change<List<String>> defaultLeaveTypes() {
        return defaultLeaveTypes;
    }

    public Change<List<String>> defaultTaskCategories() {
        return defaultTaskCategories;
    }

    public Change<Map<String, Object>> notificationSettings() {
        return notificationSettings;
    }

    public SystemSettings applyTo(SystemSettings current) {
        return new SystemSettings(
                current.id(),
                logEditTimeLimitHours.isPresent() ? logEditTimeLimitHours.value() : current.logEditTimeLimitHours(),
                defaultLeaveTypes.orElse(current.defaultLeaveTypes()),
                defaultTaskCategories.orElse(current.defaultTaskCategories()),
                notificationSettings.orElse(current.notificationSettings()),
                current.createdAt(),
                current.updatedAt());
    }

    /**
     * Present fields keyed by stored field name, for the audit trail.
     */
    public Map<String, Object> changes() {
        Map<String, Object> changes = new LinkedHashMap<>();
        if (logEditTimeLimitHours.isPresent()) {
            changes.put("log_edit_time_limit_hours", logEditTimeLimitHours.value());
        }
        if (defaultLeaveTypes.isPresent()) {
            changes.put("default_leave_types", defaultLeaveTypes.value());
        }
        if (defaultTaskCategories.isPresent()) {
            changes.put("default_task_categories", defaultTaskCategories.value());
        }
        if (notificationSettings.isPresent()) {
            changes.put("notification_settings", notificationSettings.value());
        }
        return changes;
    }

    @Override
    public String toString() {
        return "SettingsUpdate{logEditTimeLimitHours=" + logEditTimeLimitHours +
                ", defaultLeaveTypes=" + defaultLeaveTypes +
                ", defaultTaskCategories=" + defaultTaskCategories +
                ", notificationSettings=" + notificationSettings + '}';
    }

    public static final class Builder {
        private Change<Integer> logEditTimeLimitHours = Change.absent();
        private Change<List<String>> defaultLeaveTypes = Change.absent();
        private Change<List<String>> defaultTaskCategories = Change.absent();
        private Change<Map<String, Object>> notificationSettings = Change.absent();

        private Builder() {
        }

        public Builder logEditTimeLimitHours(int hours) {
            this.logEditTimeLimitHours = Change.to(hours);
            return this;
        }

        public Builder defaultLeaveTypes(List<String> leaveTypes) {
            this.defaultLeaveTypes = Change.to(leaveTypes);
            return this;
        }

        public Builder defaultTaskCategories(List<String> categories) {
            this.defaultTaskCategories = Change.to(categories);
            return this;
        }

        public Builder notificationSettings(Map<String, Object> settings) {
            this.notificationSettings = Change.to(settings);
            return this;
        }

        public SettingsUpdate build() {
            return new SettingsUpdate(this);
        }
    }
}
