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
/**
 * Typed access to the stored collections.
 * <p>
 * Every mutation runs inside the collection's exclusive section and reads the
 * current artifact under it, so read-modify-write cycles never lose updates.
 * Reads are unlocked snapshots. Refusals are reported as
 * {@link dev.mars.staffbook.repository.RepositoryException} with a
 * {@link dev.mars.staffbook.repository.RepositoryException.Kind}; storage
 * failures surface unchanged as
 * {@link dev.mars.staffbook.store.RecordStore.StorageException}.
 */
package dev.mars.staffbook.repository;
