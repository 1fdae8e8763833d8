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

import dev.mars.staffbook.StaffbookFixture;
import dev.mars.staffbook.model.ActionType;
import dev.mars.staffbook.model.AuditEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AuditTrailRepositoryTest {

    @TempDir
    Path tempDir;

    private StaffbookFixture fixture;
    private AuditTrailRepository audit;

    @BeforeEach
    void setUp() {
        fixture = new StaffbookFixture(tempDir);
        audit = fixture.staffbook().auditTrail();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private AuditEntry append(String user, ActionType action, String type) {
        AuditEntry entry = audit.append(user, action, type, "r-1", Map.of("k", "v"), "10.0.0.1", "junit");
        fixture.clock().advance(Duration.ofSeconds(1));
        return entry;
    }

    private static List<String> ids(List<AuditEntry> entries) {
        return entries.stream().map(AuditEntry::id).collect(Collectors.toList());
    }

    @Test
    void testAppendStoresEverything() {
        AuditEntry entry = audit.append("u-1", ActionType.LOGIN, "user", "u-1",
                Map.of("email", "a@example.com"), "10.0.0.1", "curl/8");

        AuditEntry stored = audit.findById(entry.id()).orElseThrow();
        assertEquals(StaffbookFixture.START, stored.timestamp());
        assertEquals("a@example.com", stored.details().get("email"));
        assertEquals("10.0.0.1", stored.ipAddress());
        assertEquals("curl/8", stored.userAgent());
    }

    @Test
    void testNullDetailsBecomeEmpty() {
        AuditEntry entry = audit.append(null, ActionType.LOGOUT, "user", null, null, null, null);

        assertTrue(audit.findById(entry.id()).orElseThrow().details().isEmpty());
    }

    @Test
    void testQueryNewestFirstWithFilters() {
        AuditEntry a = append("u-1", ActionType.CREATE, "work_log");
        AuditEntry b = append("u-2", ActionType.UPDATE, "work_log");
        AuditEntry c = append("u-1", ActionType.UPDATE, "leave_request");

        assertEquals(List.of(c.id(), b.id(), a.id()), ids(audit.query(AuditQuery.latest())));
        assertEquals(List.of(c.id(), a.id()), ids(audit.query(AuditQuery.latest().forUser("u-1"))));
        assertEquals(List.of(c.id(), b.id()), ids(audit.query(AuditQuery.latest().forAction(ActionType.UPDATE))));
        assertEquals(List.of(b.id(), a.id()), ids(audit.query(AuditQuery.latest().forResourceType("work_log"))));
        assertEquals(List.of(c.id()), ids(audit.query(AuditQuery.latest().forUser("u-1").forAction(ActionType.UPDATE))));
    }

    @Test
    void testEqualTimestampsKeepAppendOrderReversed() {
        AuditEntry first = audit.append("u", ActionType.CREATE, "x", null, null, null, null);
        AuditEntry second = audit.append("u", ActionType.CREATE, "x", null, null, null, null);

        assertEquals(List.of(second.id(), first.id()), ids(audit.query(AuditQuery.latest())));
    }

    @Test
    void testLimit() {
        for (int i = 0; i < 5; i++) {
            append("u", ActionType.CREATE, "x");
        }

        assertEquals(2, audit.query(AuditQuery.latest().withLimit(2)).size());
        assertEquals(1, audit.query(AuditQuery.latest().withLimit(0)).size());
        assertEquals(5, audit.query(AuditQuery.latest().withLimit(5000)).size());
    }

    @Test
    void testQueryLimitClamping() {
        assertEquals(AuditQuery.DEFAULT_LIMIT, AuditQuery.latest().limit());
        assertEquals(1, AuditQuery.latest().withLimit(-3).limit());
        assertEquals(AuditQuery.MAX_LIMIT, AuditQuery.latest().withLimit(1_000_000).limit());
    }

    @Test
    void testEntriesAreImmutable() {
        AuditEntry entry = append("u", ActionType.CREATE, "x");

        assertThrows(UnsupportedOperationException.class, () -> audit.update(entry.id(), e -> e));
    }
}
