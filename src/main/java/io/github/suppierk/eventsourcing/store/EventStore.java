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
import io.github.suppierk.eventsourcing.domain.Snapshot;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persistence of event streams, one stream per aggregate key.
 *
 * <p>Writes are all-or-nothing: either every event and the optional snapshot are stored, or the
 * store is left unchanged. Two writers conditioned on the same original version must never both
 * succeed.
 *
 * @param <K> is the aggregate key type
 * @param <V> is the aggregate version type
 */
public interface EventStore<K, V extends AggregateVersion<V>> {
  /**
   * @param key of the aggregate
   * @return the latest snapshot of the aggregate, if any
   */
  CompletableFuture<Optional<Snapshot<K, V>>> readSnapshot(final K key);

  /**
   * @param key of the aggregate
   * @return every event of the aggregate in version order, empty if the key is unknown
   */
  CompletableFuture<List<DomainEvent<K, V>>> readHistory(final K key);

  /**
   * @param key of the aggregate
   * @param version to read after, exclusive
   * @return events of the aggregate with a version greater than the given one, in version order
   */
  default CompletableFuture<List<DomainEvent<K, V>>> readHistoryAfter(
      final K key, final V version) {
    return readHistory(key)
        .thenApply(
            events ->
                events.stream().filter(event -> event.version().compareTo(version) > 0).toList());
  }

  /**
   * Creates a new stream.
   *
   * @param key of the aggregate
   * @param events to store, never empty
   * @param snapshot to store along, may be {@code null}
   * @return {@link WriteResult#CONFLICT} if a stream with the key already exists
   */
  CompletableFuture<WriteResult> insertEvents(
      final K key, final List<EventToSave<K, V>> events, final SnapshotToSave<K, V> snapshot);

  /**
   * Appends to an existing stream.
   *
   * @param key of the aggregate
   * @param events to store, never empty
   * @param originalVersion the stream must still be at
   * @param snapshot to store along, may be {@code null}
   * @return {@link WriteResult#CONFLICT} if the stream is missing or moved past {@code
   *     originalVersion}
   */
  CompletableFuture<WriteResult> updateEvents(
      final K key,
      final List<EventToSave<K, V>> events,
      final V originalVersion,
      final SnapshotToSave<K, V> snapshot);
}
