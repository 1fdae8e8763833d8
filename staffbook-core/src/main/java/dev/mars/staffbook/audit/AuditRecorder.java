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

import dev.mars.staffbook.model.ActionType;
import dev.mars.staffbook.model.AuditEntry;
import dev.mars.staffbook.repository.AuditTrailRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Records mutating actions in the audit trail.
 * <p>
 * Recording is best effort: the business change it documents has already
 * been written, so a failure here is logged and swallowed rather than
 * reported to the caller.
 */
public final class AuditRecorder {

    private static final Logger LOG = LoggerFactory.getLogger(AuditRecorder.class);

    private final AuditTrailRepository trail;

    public AuditRecorder(AuditTrailRepository trail) {
        this.trail = trail;
    }

    /**
     * Appends one entry.
     *
     * @return the stored entry, or empty if it could not be written
     */
    public Optional<AuditEntry> record(String actorId, ActionType action, String resourceType,
                                       String resourceId, Map<String, Object> details) {
        return record(actorId, action, resourceType, resourceId, details, null, null);
    }

    /**
     * Appends one entry with the client address and agent of the request.
     */
    public Optional<AuditEntry> record(String actorId, ActionType action, String resourceType,
                                       String resourceId, Map<String, Object> details,
                                       String ipAddress, String userAgent) {
        try {
            AuditEntry entry = trail.append(actorId, action, resourceType, resourceId, details, ipAddress, userAgent);
            LOG.debug("Audit {} {} {} by {}", action, resourceType, resourceId, actorId);
            return Optional.of(entry);
        } catch (RuntimeException e) {
            LOG.warn("Audit entry lost: {} {} {} by {}: {}", action, resourceType, resourceId, actorId,
                    e.getMessage(), e);
            return Optional.empty();
        }
    }
}
