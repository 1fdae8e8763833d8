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

import dev.mars.staffbook.model.SettingsUpdate;
import dev.mars.staffbook.model.SystemSettings;
import dev.mars.staffbook.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * The singleton {@link SystemSettings} row.
 */
public final class SettingsRepository extends AbstractRepository<SystemSettings> {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsRepository.class);

    public static final String COLLECTION = "settings";

    public SettingsRepository(RecordStore store, RecordCodec codec, Clock clock) {
        super(store, codec, clock, COLLECTION, SystemSettings.class);
    }

    /**
     * Current settings. The first call on an empty collection stores the defaults.
     */
    public SystemSettings get() {
        return findById(SystemSettings.SETTINGS_ID).orElseGet(() -> exclusively(() ->
                findById(SystemSettings.SETTINGS_ID).orElseGet(() -> {
                    LOG.info("No system settings stored, writing defaults");
                    return insert(() -> SystemSettings.defaults(now()));
                })));
    }

    public SystemSettings update(SettingsUpdate update) {
        if (update.logEditTimeLimitHours().isPresent()) {
            Integer hours = requirePresent("log_edit_time_limit_hours", update.logEditTimeLimitHours().value());
            if (hours < 0) {
                throw RepositoryException.validation("log_edit_time_limit_hours must not be negative: " + hours);
            }
        }
        if (update.defaultLeaveTypes().isPresent()) {
            requireEntries("default_leave_types", update.defaultLeaveTypes().value());
        }
        if (update.defaultTaskCategories().isPresent()) {
            requireEntries("default_task_categories", update.defaultTaskCategories().value());
        }
        if (update.notificationSettings().isPresent()) {
            requirePresent("notification_settings", update.notificationSettings().value());
        }

        SystemSettings updated = exclusively(() -> {
            get();
            return update(SystemSettings.SETTINGS_ID, update::applyTo)
                    .orElseThrow(() -> new IllegalStateException("Settings row vanished under lock"));
        });
        LOG.info("System settings updated: {}", update);
        return updated;
    }

    private static void requireEntries(String field, List<String> values) {
        requirePresent(field, values);
        for (String value : values) {
            requireText(field + " entry", value);
        }
    }
}
