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
import dev.mars.staffbook.identity.PasswordHasher;
import dev.mars.staffbook.model.Employee;
import dev.mars.staffbook.model.EmployeeUpdate;
import dev.mars.staffbook.model.NewEmployee;
import dev.mars.staffbook.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Employees, active and deactivated.
 * <p>
 * Email is unique across all rows, including deactivated ones.
 */
public final class EmployeeRepository extends AbstractRepository<Employee> {

    private static final Logger LOG = LoggerFactory.getLogger(EmployeeRepository.class);

    public static final String COLLECTION = "employees";

    private final IdGenerator ids;
    private final PasswordHasher hasher;

    public EmployeeRepository(RecordStore store, RecordCodec codec, Clock clock,
                              IdGenerator ids, PasswordHasher hasher) {
        super(store, codec, clock, COLLECTION, Employee.class);
        this.ids = ids;
        this.hasher = hasher;
    }

    /**
     * Creates an employee, storing only the password digest.
     *
     * @throws RepositoryException {@code CONFLICT} if the email is taken,
     *                             {@code VALIDATION_FAILED} if a required field is missing
     */
    public Employee create(NewEmployee input) {
        requireText("email", input.email());
        requireText("password", input.password());
        requireText("first_name", input.firstName());
        requireText("last_name", input.lastName());
        requirePresent("hire_date", input.hireDate());

        Employee created = exclusively(() -> {
            if (findByEmail(input.email()).isPresent()) {
                throw RepositoryException.conflict("Email already registered: " + input.email());
            }
            return insert(() -> {
                Instant now = now();
                return new Employee(ids.newId(), input.email(), hasher.hash(input.password()),
                        input.firstName(), input.lastName(), input.role(), input.managerId(),
                        input.department(), input.position(), input.hireDate(), true, now, now);
            });
        });
        LOG.info("Created employee {} ({})", created.id(), created.role());
        return created;
    }

    public Optional<Employee> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return findWhere(e -> email.equals(e.email())).stream().findFirst();
    }

    public List<Employee> findActive() {
        return findWhere(Employee::active);
    }

    /**
     * Active employees whose manager is {@code managerId}.
     */
    public List<Employee> findDirectReports(String managerId) {
        return findWhere(e -> e.active() && managerId != null && managerId.equals(e.managerId()));
    }

    /**
     * The employee's direct manager. One hop only.
     */
    public Optional<Employee> findManagerOf(Employee employee) {
        return employee.managerId() == null ? Optional.empty() : findById(employee.managerId());
    }

    /**
     * Applies the present fields of {@code update}.
     *
     * @return the new state, or empty if {@code id} does not exist
     * @throws RepositoryException {@code CONFLICT} if the new email belongs to another employee
     */
    public Optional<Employee> update(String id, EmployeeUpdate update) {
        if (update.email().isPresent()) {
            requireText("email", update.email().value());
        }
        if (update.firstName().isPresent()) {
            requireText("first_name", update.firstName().value());
        }
        if (update.lastName().isPresent()) {
            requireText("last_name", update.lastName().value());
        }
        if (update.role().isPresent()) {
            requirePresent("role", update.role().value());
        }
        if (update.active().isPresent()) {
            requirePresent("is_active", update.active().value());
        }

        return exclusively(() -> {
            if (update.email().isPresent()) {
                String email = update.email().value();
                Optional<Employee> holder = findByEmail(email);
                if (holder.isPresent() && !holder.get().id().equals(id)) {
                    throw RepositoryException.conflict("Email already registered: " + email);
                }
            }
            return update(id, update::applyTo);
        });
    }

    /**
     * Soft delete. The row stays and keeps its email.
     */
    public Optional<Employee> deactivate(String id) {
        Optional<Employee> result = update(id, EmployeeUpdate.builder().active(false).build());
        result.ifPresent(e -> LOG.info("Deactivated employee {}", e.id()));
        return result;
    }

    /**
     * Returns the employee whose email and password match, active or not.
     */
    public Optional<Employee> authenticate(String email, String password) {
        return findByEmail(email).filter(e -> hasher.verify(password, e.passwordHash()));
    }
}
