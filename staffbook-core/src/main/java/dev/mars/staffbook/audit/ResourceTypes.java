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
package dev.mars.staffbook.audit;

/**
 * {@code resource_type} values written to the audit trail.
 */
public final class ResourceTypes {

    public static final String USER = "user";
    public static final String EMPLOYEE = "employee";
    public static final String WORK_LOG = "work_log";
    public static final String LEAVE_REQUEST = "leave_request";
    public static final String FEEDBACK = "feedback";
    public static final String SYSTEM_SETTINGS = "system_settings";
    public static final String BULK_EMPLOYEES = "bulk_employees";

    private ResourceTypes() {
    }
}
