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

import java.util.List;
import java.util.function.Function;

/**
 * Knows how to rebuild aggregates of one type from persisted events and snapshots.
 *
 * @param <K> is the key type
 * @param <V> is the version type
 * @param <A> is the aggregate type
 */
// @formatter:off
public final class AggregateType<
  K,
  V extends AggregateVersion<V>,
  A extends AggregateRoot<K, V, A>
> {
// @formatter:on
  private final Class<A> aggregateClass;
  private final Function<K, A> blankFactory;
  private final Function<Snapshot<K, V>, A> snapshotFactory;

  private AggregateType(
      final Class<A> aggregateClass,
      final Function<K, A> blankFactory,
      final Function<Snapshot<K, V>, A> snapshotFactory) {
    this.aggregateClass = aggregateClass;
    this.blankFactory = blankFactory;
    this.snapshotFactory = snapshotFactory;
  }

  /**
   * @param aggregateClass to rebuild
   * @param blankFactory creating an aggregate at its initial version, before any event
   * @param <K> is the key type
   * @param <V> is the version type
   * @param <A> is the aggregate type
   * @return aggregate type without snapshot support
   */
  public static <K, V extends AggregateVersion<V>, A extends AggregateRoot<K, V, A>>
      AggregateType<K, V, A> of(final Class<A> aggregateClass, final Function<K, A> blankFactory) {
    if (aggregateClass == null) {
      throw new IllegalArgumentException("Aggregate class cannot be null");
    }

    if (blankFactory == null) {
      throw new IllegalArgumentException("Blank aggregate factory cannot be null");
    }

    return new AggregateType<>(aggregateClass, blankFactory, null);
  }

  /**
   * @param snapshotClass produced by the aggregate
   * @param restore creating an aggregate from a snapshot
   * @param <S> is the snapshot type
   * @return copy of this aggregate type which supports snapshots
   */
  public <S extends Snapshot<K, V>> AggregateType<K, V, A> withSnapshots(
      final Class<S> snapshotClass, final Function<S, A> restore) {
    if (snapshotClass == null) {
      throw new IllegalArgumentException("Snapshot class cannot be null");
    }

    if (restore == null) {
      throw new IllegalArgumentException("Snapshot restore function cannot be null");
    }

    return new AggregateType<>(
        aggregateClass, blankFactory, snapshot -> restore.apply(snapshotClass.cast(snapshot)));
  }

  public Class<A> getAggregateClass() {
    return aggregateClass;
  }

  public boolean supportsSnapshots() {
    return snapshotFactory != null;
  }

  /**
   * Rebuilds an aggregate from its complete stream.
   *
   * @param key of the aggregate
   * @param history every persisted event in version order, starting with the creation event
   * @return the aggregate at the version of the last event, with no pending events
   * @throws InvalidVersionException on gaps, duplicates or reordering in the history
   */
  public A replay(final K key, final List<? extends DomainEvent<K, V>> history) {
    if (key == null) {
      throw new IllegalArgumentException("Aggregate key cannot be null");
    }

    if (history == null || history.isEmpty()) {
      throw new IllegalArgumentException("History of %s cannot be empty".formatted(key));
    }

    final A aggregate = blankFactory.apply(key);
    if (aggregate == null) {
      throw new IllegalStateException("Blank aggregate cannot be null");
    }

    return applyHistory(aggregate, history);
  }

  /**
   * Rebuilds an aggregate from a snapshot and the events persisted after it.
   *
   * @param snapshot of the aggregate
   * @param history events after the snapshot version, in version order
   * @return the aggregate at the version of the last event, or at the snapshot version
   */
  public A restore(final Snapshot<K, V> snapshot, final List<? extends DomainEvent<K, V>> history) {
    if (!supportsSnapshots()) {
      throw new UnsupportedOperationException(
          "%s does not support snapshots".formatted(aggregateClass.getSimpleName()));
    }

    if (snapshot == null) {
      throw new IllegalArgumentException("Snapshot cannot be null");
    }

    if (history == null) {
      throw new IllegalArgumentException("History cannot be null");
    }

    final A aggregate = snapshotFactory.apply(snapshot);
    if (aggregate == null) {
      throw new IllegalStateException("Restored aggregate cannot be null");
    }

    if (!aggregate.key().equals(snapshot.key())
        || aggregate.version().compareTo(snapshot.version()) != 0) {
      throw new IllegalStateException(
          "Restored aggregate %s does not match snapshot of %s at version %s"
              .formatted(aggregate, snapshot.key(), snapshot.version()));
    }

    return applyHistory(aggregate, history);
  }

  private A applyHistory(final A aggregate, final List<? extends DomainEvent<K, V>> history) {
    for (DomainEvent<K, V> event : history) {
      if (!event.version().isSuccessorOf(aggregate.version())) {
        throw new InvalidVersionException(aggregate.version(), event.version());
      }

      aggregate.apply(event);
    }

    return aggregate;
  }
}
