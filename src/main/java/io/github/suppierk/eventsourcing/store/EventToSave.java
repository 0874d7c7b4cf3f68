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

package io.github.suppierk.eventsourcing.store;

import io.github.suppierk.eventsourcing.domain.AggregateVersion;
import io.github.suppierk.eventsourcing.domain.DomainEvent;

/**
 * Event handed to the store together with the contract its payload is known under.
 *
 * @param contract stable name of the event type, see {@link TypeToContractMap}
 * @param value the event itself
 * @param <K> is the aggregate key type
 * @param <V> is the aggregate version type
 */
public record EventToSave<K, V extends AggregateVersion<V>>(
    String contract, DomainEvent<K, V> value) {
  public EventToSave {
    if (contract == null || contract.isBlank()) {
      throw new IllegalArgumentException("Event contract cannot be blank");
    }

    if (value == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }
  }

  public K key() {
    return value.key();
  }

  public V version() {
    return value.version();
  }
}
