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
import dev.mars.staffbook.model.Employee;
import dev.mars.staffbook.model.NewWorkLog;
import dev.mars.staffbook.model.TaskStatus;
import dev.mars.staffbook.model.WorkLog;
import dev.mars.staffbook.model.WorkLogUpdate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WorkLogRepositoryTest {

    @TempDir
    Path tempDir;

    private StaffbookFixture fixture;
    private WorkLogRepository workLogs;
    private Employee owner;

    @BeforeEach
    void setUp() {
        fixture = new StaffbookFixture(tempDir);
        workLogs = fixture.staffbook().workLogs();
        owner = fixture.employee("owner@example.com", null);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private WorkLog log(LocalDate date, double hours) {
        return workLogs.create(owner.id(), NewWorkLog.of(date, "Task on " + date, hours, TaskStatus.IN_PROGRESS));
    }

    @Test
    void testCreate() {
        WorkLog created = workLogs.create(owner.id(),
                NewWorkLog.of(LocalDate.of(2024, 3, 1), "Review PRs", 1.5, TaskStatus.COMPLETED)
                        .withProject("Payroll")
                        .withCategory("Development"));

        assertEquals(owner.id(), created.employeeId());
        assertEquals(1.5, created.timeSpent());
        assertEquals("Payroll", created.project());
        assertNull(created.managerFeedback());
        assertEquals(StaffbookFixture.START, created.createdAt());
        assertEquals(created, workLogs.findById(created.id()).orElseThrow());
    }

    @Test
    void testCreateRejectsBadHours() {
        RepositoryException negative = assertThrows(RepositoryException.class,
                () -> log(LocalDate.of(2024, 3, 1), -1));
        RepositoryException notANumber = assertThrows(RepositoryException.class,
                () -> log(LocalDate.of(2024, 3, 1), Double.NaN));

        assertEquals(RepositoryException.Kind.VALIDATION_FAILED, negative.kind());
        assertEquals(RepositoryException.Kind.VALIDATION_FAILED, notANumber.kind());
        assertTrue(workLogs.findAll().isEmpty());
    }

    @Test
    void testDateRangeIsInclusiveAndNewestFirst() {
        log(LocalDate.of(2024, 2, 29), 1);
        WorkLog first = log(LocalDate.of(2024, 3, 1), 1);
        WorkLog middle = log(LocalDate.of(2024, 3, 2), 1);
        WorkLog last = log(LocalDate.of(2024, 3, 3), 1);
        log(LocalDate.of(2024, 3, 4), 1);

        List<String> ids = workLogs.findByEmployee(owner.id(), LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 3))
                .stream().map(WorkLog::id).collect(Collectors.toList());

        assertEquals(List.of(last.id(), middle.id(), first.id()), ids);
        assertEquals(5, workLogs.findByEmployee(owner.id(), null, null).size());
        assertEquals(2, workLogs.findByEmployee(owner.id(), LocalDate.of(2024, 3, 3), null).size());
    }

    @Test
    void testSameDateOrderedByCreation() {
        WorkLog morning = log(LocalDate.of(2024, 3, 1), 1);
        fixture.clock().advance(Duration.ofHours(4));
        WorkLog afternoon = log(LocalDate.of(2024, 3, 1), 2);

        List<WorkLog> logs = workLogs.findByEmployee(owner.id(), null, null);

        assertEquals(afternoon.id(), logs.get(0).id());
        assertEquals(morning.id(), logs.get(1).id());
    }

    @Test
    void testOtherEmployeesExcluded() {
        Employee other = fixture.employee("other@example.com", null);
        log(LocalDate.of(2024, 3, 1), 1);
        workLogs.create(other.id(), NewWorkLog.of(LocalDate.of(2024, 3, 1), "Other", 2, TaskStatus.BLOCKED));

        assertEquals(1, workLogs.findByEmployee(owner.id(), null, null).size());
        assertEquals(1, workLogs.findByEmployee(other.id(), null, null).size());
    }

    @Test
    void testPartialUpdate() {
        WorkLog original = log(LocalDate.of(2024, 3, 1), 1);

        WorkLog updated = workLogs.update(original.id(), WorkLogUpdate.builder()
                .status(TaskStatus.COMPLETED)
                .notes("Done")
                .build()).orElseThrow();

        assertEquals(TaskStatus.COMPLETED, updated.status());
        assertEquals("Done", updated.notes());
        assertEquals(original.taskDescription(), updated.taskDescription());
        assertEquals(original.timeSpent(), updated.timeSpent());
    }

    @Test
    void testUpdateValidation() {
        WorkLog original = log(LocalDate.of(2024, 3, 1), 1);

        assertThrows(RepositoryException.class,
                () -> workLogs.update(original.id(), WorkLogUpdate.builder().timeSpent(-2).build()));
        assertThrows(RepositoryException.class,
                () -> workLogs.update(original.id(), WorkLogUpdate.builder().taskDescription("").build()));
        assertEquals(1.0, workLogs.findById(original.id()).orElseThrow().timeSpent());
    }

    @Test
    void testAttachManagerFeedback() {
        WorkLog original = log(LocalDate.of(2024, 3, 1), 1);

        WorkLog updated = workLogs.attachManagerFeedback(original.id(), "Nice work").orElseThrow();

        assertEquals("Nice work", updated.managerFeedback());
        assertTrue(workLogs.attachManagerFeedback("missing", "text").isEmpty());
    }

    @Test
    void testConcurrentIncrementsAllLand() throws Exception {
        WorkLog counter = log(LocalDate.of(2024, 3, 1), 0);
        int threads = 40;

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return workLogs.update(counter.id(), l -> l.withTimeSpent(l.timeSpent() + 1));
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads, workLogs.findById(counter.id()).orElseThrow().timeSpent());
    }
}
