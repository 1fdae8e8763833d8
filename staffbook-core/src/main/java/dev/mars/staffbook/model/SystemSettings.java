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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Organization-wide settings. Exactly one row, with id {@value #SETTINGS_ID}.
 */
public record SystemSettings(
        @JsonProperty("id") String id,
        @JsonProperty("log_edit_time_limit_hours") int logEditTimeLimitHours,
        @JsonProperty("default_leave_types") List<String> defaultLeaveTypes,
        @JsonProperty("default_task_categories") List<String> defaultTaskCategories,
        @JsonProperty("notification_settings") Map<String, Object> notificationSettings,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) implements Identified {

    public static final String SETTINGS_ID = "system_settings";
    public static final int DEFAULT_LOG_EDIT_TIME_LIMIT_HOURS = 24;
    public static final List<String> DEFAULT_LEAVE_TYPES =
            List.of("Sick Leave", "Vacation", "Personal", "Maternity/Paternity");
    public static final List<String> DEFAULT_TASK_CATEGORIES =
            List.of("Development", "Testing", "Documentation", "Meetings", "Research");

    public SystemSettings {
        defaultLeaveTypes = defaultLeaveTypes == null ? List.of() : List.copyOf(defaultLeaveTypes);
        defaultTaskCategories = defaultTaskCategories == null ? List.of() : List.copyOf(defaultTaskCategories);
        notificationSettings = notificationSettings == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(notificationSettings));
    }

    /**
     * Settings used until an administrator changes them.
     */
    public static SystemSettings defaults(Instant now) {
        return new SystemSettings(SETTINGS_ID, DEFAULT_LOG_EDIT_TIME_LIMIT_HOURS,
                DEFAULT_LEAVE_TYPES, DEFAULT_TASK_CATEGORIES, Map.of(), now, now);
    }
}
