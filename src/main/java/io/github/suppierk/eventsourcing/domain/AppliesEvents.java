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

package io.github.suppierk.eventsourcing.domain;

/**
 * Something whose state is derived by applying events one at a time.
 *
 * @param <K> is the key type
 * @param <V> is the version type
 */
public interface AppliesEvents<K, V extends AggregateVersion<V>> {
  /**
   * Validates the event against the current state and mutates the state accordingly.
   *
   * @param event to apply
   * @throws InvalidKeyException if the event belongs to another key
   * @throws InvalidVersionException if the event version does not exceed the current version
   * @throws MissingEventHandlerException if the event type is unknown
   */
  void apply(DomainEvent<K, V> event);
}
