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
import io.github.suppierk.eventsourcing.domain.Snapshot;

/**
 * Snapshot handed to the store together with its contract.
 *
 * @param contract stable name of the snapshot type, see {@link TypeToContractMap}
 * @param value the snapshot itself
 * @param originalVersion the aggregate had when it was loaded, {@code null} for new aggregates
 * @param <K> is the aggregate key type
 * @param <V> is the aggregate version type
 */
public record SnapshotToSave<K, V extends AggregateVersion<V>>(
    String contract, Snapshot<K, V> value, V originalVersion) {
  public SnapshotToSave {
    if (contract == null || contract.isBlank()) {
      throw new IllegalArgumentException("Snapshot contract cannot be blank");
    }

    if (value == null) {
      throw new IllegalArgumentException("Snapshot cannot be null");
    }
  }

  public K key() {
    return value.key();
  }

  public V version() {
    return value.version();
  }
}
