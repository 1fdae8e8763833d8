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
import dev.mars.staffbook.model.ActionType;
import dev.mars.staffbook.model.AuditEntry;
import dev.mars.staffbook.store.RecordStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Append-only audit trail. Entries are never updated or removed.
 */
public final class AuditTrailRepository extends AbstractRepository<AuditEntry> {

    public static final String COLLECTION = "audit_trails";

    private final IdGenerator ids;

    public AuditTrailRepository(RecordStore store, RecordCodec codec, Clock clock, IdGenerator ids) {
        super(store, codec, clock, COLLECTION, AuditEntry.class);
        this.ids = ids;
    }

    public AuditEntry append(String userId, ActionType action, String resourceType, String resourceId,
                             Map<String, Object> details, String ipAddress, String userAgent) {
        requirePresent("action", action);
        return insert(() -> new AuditEntry(ids.newId(), userId, action, resourceType, resourceId,
                details, ipAddress, userAgent, now()));
    }

    /**
     * Matching entries, newest first, at most {@code query.limit()}.
     */
    public List<AuditEntry> query(AuditQuery query) {
        List<AuditEntry> matches = findWhere(e ->
                (query.userId() == null || query.userId().equals(e.userId()))
                        && (query.action() == null || query.action() == e.action())
                        && (query.resourceType() == null || query.resourceType().equals(e.resourceType())));

        // Stored order is append order; reverse first so equal timestamps stay newest first
        Collections.reverse(matches);
        matches.sort(Comparator.comparing(AuditEntry::timestamp, Comparator.nullsLast(Comparator.reverseOrder())));
        return matches.size() > query.limit() ? new ArrayList<>(matches.subList(0, query.limit())) : matches;
    }

    /**
     * Entries cannot be changed.
     *
     * @throws UnsupportedOperationException always
     */
    @Override
    public Optional<AuditEntry> update(String id, UnaryOperator<AuditEntry> mutation) {
        throw new UnsupportedOperationException("Audit entries are immutable");
    }
}
