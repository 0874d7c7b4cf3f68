/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.eventsourcing.uow;

/** Lifecycle of a {@link UnitOfWorkContext}. */
public enum UnitOfWorkState {
  /** Accepts enlistments and published events. */
  ACTIVE,
  /** Persisting enlisted resources, no changes are accepted. */
  FLUSHING,
  /** Abandoned after a failure, pending changes were dropped. */
  DISCARDED,
  /** Closed, must not be used anymore. */
  INACTIVE
}
