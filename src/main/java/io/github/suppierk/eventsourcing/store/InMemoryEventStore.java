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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe {@link EventStore} keeping streams on the heap.
 *
 * <p>Every stream is replaced atomically, so concurrent writers conditioned on the same version
 * cannot both succeed. Payloads are kept as objects, contracts are ignored.
 *
 * @param <K> is the aggregate key type
 * @param <V> is the aggregate version type
 */
public final class InMemoryEventStore<K, V extends AggregateVersion<V>>
    implements EventStore<K, V> {
  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryEventStore.class);

  private final ConcurrentMap<K, EventStream<K, V>> streams;
  private final Executor executor;

  /** Creates a store completing every operation on the calling thread. */
  public InMemoryEventStore() {
    this(Runnable::run);
  }

  /**
   * @param executor to complete operations on
   */
  public InMemoryEventStore(final Executor executor) {
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null");
    }

    this.streams = new ConcurrentHashMap<>();
    this.executor = executor;
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<Optional<Snapshot<K, V>>> readSnapshot(final K key) {
    return CompletableFuture.supplyAsync(
        () -> Optional.ofNullable(streams.get(requireKey(key))).map(EventStream::snapshot),
        executor);
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<List<DomainEvent<K, V>>> readHistory(final K key) {
    return CompletableFuture.supplyAsync(
        () ->
            Optional.ofNullable(streams.get(requireKey(key)))
                .map(EventStream::events)
                .orElse(List.of()),
        executor);
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<WriteResult> insertEvents(
      final K key, final List<EventToSave<K, V>> events, final SnapshotToSave<K, V> snapshot) {
    return CompletableFuture.supplyAsync(
        () -> {
          final EventStream<K, V> created =
              EventStream.<K, V>empty().append(requireKey(key), null, events, snapshot);

          if (streams.putIfAbsent(key, created) != null) {
            LOGGER.debug("Rejected insert of {} events for existing key {}", events.size(), key);
            return WriteResult.CONFLICT;
          }

          LOGGER.debug("Inserted {} events for key {}", events.size(), key);
          return WriteResult.SUCCESS;
        },
        executor);
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<WriteResult> updateEvents(
      final K key,
      final List<EventToSave<K, V>> events,
      final V originalVersion,
      final SnapshotToSave<K, V> snapshot) {
    return CompletableFuture.supplyAsync(
        () -> {
          if (originalVersion == null) {
            throw new IllegalArgumentException("Original version cannot be null");
          }

          final AtomicBoolean appended = new AtomicBoolean(false);
          streams.computeIfPresent(
              requireKey(key),
              (streamKey, stream) -> {
                if (!stream.lastVersion().equals(originalVersion)) {
                  return stream;
                }

                appended.set(true);
                return stream.append(streamKey, originalVersion, events, snapshot);
              });

          if (!appended.get()) {
            LOGGER.debug(
                "Rejected update of key {} conditioned on version {}", key, originalVersion);
            return WriteResult.CONFLICT;
          }

          LOGGER.debug("Appended {} events for key {}", events.size(), key);
          return WriteResult.SUCCESS;
        },
        executor);
  }

  private K requireKey(final K key) {
    if (key == null) {
      throw new IllegalArgumentException("Aggregate key cannot be null");
    }

    return key;
  }

  private record EventStream<K, V extends AggregateVersion<V>>(
      List<DomainEvent<K, V>> events, Snapshot<K, V> snapshot) {
    static <K, V extends AggregateVersion<V>> EventStream<K, V> empty() {
      return new EventStream<>(List.of(), null);
    }

    V lastVersion() {
      return events.get(events.size() - 1).version();
    }

    EventStream<K, V> append(
        final K key,
        final V originalVersion,
        final List<EventToSave<K, V>> toSave,
        final SnapshotToSave<K, V> snapshotToSave) {
      if (toSave == null || toSave.isEmpty()) {
        throw new IllegalArgumentException("Events to save cannot be empty");
      }

      final List<DomainEvent<K, V>> appended = new ArrayList<>(events);
      V previous = originalVersion;
      for (EventToSave<K, V> eventToSave : toSave) {
        if (!key.equals(eventToSave.key())) {
          throw new IllegalArgumentException(
              "Event for key %s cannot be stored under key %s".formatted(eventToSave.key(), key));
        }

        if (previous != null && eventToSave.version().compareTo(previous) <= 0) {
          throw new IllegalArgumentException(
              "Event version %s must be greater than %s"
                  .formatted(eventToSave.version(), previous));
        }

        previous = eventToSave.version();
        appended.add(eventToSave.value());
      }

      Snapshot<K, V> latestSnapshot = snapshot;
      if (snapshotToSave != null) {
        if (snapshotToSave.version().compareTo(previous) > 0) {
          throw new IllegalArgumentException(
              "Snapshot version %s is ahead of the last event version %s"
                  .formatted(snapshotToSave.version(), previous));
        }

        latestSnapshot = snapshotToSave.value();
      }

      return new EventStream<>(List.copyOf(appended), latestSnapshot);
    }
  }
}
