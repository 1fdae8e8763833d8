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
 * Record Store - durable per-collection storage.
 * <p>
 * This package provides the persistence layer every repository builds on:
 * <ul>
 *   <li>{@link dev.mars.staffbook.store.RecordStore} - The storage interface</li>
 *   <li>{@link dev.mars.staffbook.store.FileRecordStore} - One JSON artifact per collection</li>
 *   <li>{@link dev.mars.staffbook.store.RecordStoreConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Atomic replace:</b> A reader sees the previous or the next collection, never a mix</li>
 *   <li><b>Serialized mutation:</b> One read-modify-write per collection at a time</li>
 *   <li><b>Quarantine:</b> A corrupt collection is moved aside, not fatal</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  ├─ staffbook.lock
 *  ├─ employees.json
 *  ├─ work_logs.json
 *  ├─ leave_requests.json
 *  ├─ feedback.json
 *  ├─ audit_trails.json
 *  └─ settings.json
 * </pre>
 *
 * @see dev.mars.staffbook.store.RecordStore
 */
package dev.mars.staffbook.store;
