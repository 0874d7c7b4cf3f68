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

import io.github.suppierk.eventsourcing.store.EventStore;
import io.github.suppierk.eventsourcing.store.TypeToContractMap;

/**
 * Everything a {@link Repository} needs, built once at startup and shared by all units of work.
 *
 * @param aggregateType to load and save
 * @param eventStore holding the streams
 * @param contracts naming the event and snapshot types
 * @param snapshotInterval number of persisted events after which a snapshot is stored along, zero
 *     disables snapshots
 * @param <K> is the key type
 * @param <V> is the version type
 * @param <A> is the aggregate type
 */
public record RepositoryConfiguration<
        K, V extends AggregateVersion<V>, A extends AggregateRoot<K, V, A>>(
    AggregateType<K, V, A> aggregateType,
    EventStore<K, V> eventStore,
    TypeToContractMap contracts,
    int snapshotInterval) {
  public RepositoryConfiguration {
    if (aggregateType == null) {
      throw new IllegalArgumentException("Aggregate type cannot be null");
    }

    if (eventStore == null) {
      throw new IllegalArgumentException("Event store cannot be null");
    }

    if (contracts == null) {
      throw new IllegalArgumentException("Type to contract map cannot be null");
    }

    if (snapshotInterval < 0) {
      throw new IllegalArgumentException(
          "Snapshot interval cannot be negative, got %d".formatted(snapshotInterval));
    }

    if (snapshotInterval > 0 && !aggregateType.supportsSnapshots()) {
      throw new IllegalArgumentException(
          "%s does not support snapshots"
              .formatted(aggregateType.getAggregateClass().getSimpleName()));
    }
  }

  /**
   * @return configuration which never stores snapshots
   */
  public static <K, V extends AggregateVersion<V>, A extends AggregateRoot<K, V, A>>
      RepositoryConfiguration<K, V, A> of(
          final AggregateType<K, V, A> aggregateType,
          final EventStore<K, V> eventStore,
          final TypeToContractMap contracts) {
    return new RepositoryConfiguration<>(aggregateType, eventStore, contracts, 0);
  }

  /**
   * @param interval number of persisted events between snapshots
   * @return copy of this configuration with the given snapshot interval
   */
  public RepositoryConfiguration<K, V, A> withSnapshotInterval(final int interval) {
    return new RepositoryConfiguration<>(aggregateType, eventStore, contracts, interval);
  }
}
