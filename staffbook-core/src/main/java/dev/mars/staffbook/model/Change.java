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

import java.util.Objects;

/**
 * One field of a partial update.
 * <p>
 * Distinguishes a field that is not part of the update ({@link #absent()})
 * from one that is explicitly set, including set to {@code null}
 * ({@link #clear()}). Only present fields are applied.
 *
 * @param <T> the field type
 */
public final class Change<T> {

    private final boolean present;
    private final T value;

    private Change(boolean present, T value) {
        this.present = present;
        this.value = value;
    }

    public static <T> Change<T> absent() {
        return new Change<>(false, null);
    }

    public static <T> Change<T> to(T value) {
        return new Change<>(true, value);
    }

    public static <T> Change<T> clear() {
        return new Change<>(true, null);
    }

    public boolean isPresent() {
        return present;
    }

    /**
     * The new value; only meaningful when {@link #isPresent()}.
     */
    public T value() {
        return value;
    }

    /**
     * Returns the new value if present, otherwise {@code current}.
     */
    public T orElse(T current) {
        return present ? value : current;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Change)) {
            return false;
        }
        Change<?> other = (Change<?>) o;
        return present == other.present && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        return present ? "Change.to(" + value + ")" : "Change.absent()";
    }
}
