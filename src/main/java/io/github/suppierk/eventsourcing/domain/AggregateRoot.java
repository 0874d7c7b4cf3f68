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
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Consistency boundary whose state is derived entirely from its events.
 *
 * <p>A new aggregate starts blank at an initial version and receives its creation event through
 * {@link #publish(BiFunction)} like any other event, loaded aggregates are rebuilt by {@link
 * AggregateType} from the persisted events. Published events are buffered until the owning {@link
 * Repository} persists them and are also forwarded to the {@link EventSink} the aggregate is
 * attached to.
 *
 * <p>Instances are not thread-safe, they are confined to one unit of work.
 *
 * @param <K> is the key type
 * @param <V> is the version type
 * @param <A> is the concrete aggregate type
 */
// @formatter:off
public abstract class AggregateRoot<
  K,
  V extends AggregateVersion<V>,
  A extends AggregateRoot<K, V, A>
> implements HasKey<K>, HasVersion<V>, AppliesEvents<K, V> {
// @formatter:on
  private final K key;
  private final EventBuffer<K, V> pendingEvents;
  private V version;
  private EventSink eventSink;

  /**
   * @param key of the aggregate
   * @param version the aggregate starts at, either the initial version or the one of a snapshot
   */
  protected AggregateRoot(final K key, final V version) {
    if (key == null) {
      throw new IllegalArgumentException("Aggregate key cannot be null");
    }

    if (version == null) {
      throw new IllegalArgumentException("Aggregate version cannot be null");
    }

    this.key = key;
    this.version = version;
    this.pendingEvents = new EventBuffer<>(key);
    this.eventSink = EventSink.empty();
  }

  /**
   * @return state transitions of this aggregate type, usually a {@code static final} table
   */
  protected abstract EventHandlers<A> eventHandlers();

  /**
   * Override to enable snapshots for this aggregate type.
   *
   * @return the current state captured at the current version
   */
  protected Optional<Snapshot<K, V>> takeSnapshot() {
    return Optional.empty();
  }

  @Override
  public final K key() {
    return key;
  }

  @Override
  public final V version() {
    return version;
  }

  /** {@inheritDoc} */
  @Override
  public final void apply(final DomainEvent<K, V> event) {
    if (event == null) {
      throw new IllegalArgumentException("Applied event cannot be null");
    }

    if (!key.equals(event.key())) {
      throw new InvalidKeyException(key, event.key());
    }

    final V nextVersion = AggregateVersion.requireNewer(version, event.version());
    eventHandlers().apply(self(), event);
    version = nextVersion;
  }

  /**
   * Creates an event at the next version, applies it, buffers it and forwards it to the sink.
   *
   * @param eventFactory receiving the aggregate key and the next version
   * @param <E> is the event type
   * @return the published event
   */
  protected final <E extends DomainEvent<K, V>> E publish(final BiFunction<K, V, E> eventFactory) {
    if (eventFactory == null) {
      throw new IllegalArgumentException("Event factory cannot be null");
    }

    final E event = eventFactory.apply(key, version.next());
    if (event == null) {
      throw new IllegalStateException("Published event cannot be null");
    }

    apply(event);
    pendingEvents.append(event);
    eventSink.publish(event);
    return event;
  }

  public final boolean hasPendingEvents() {
    return !pendingEvents.isEmpty();
  }

  /**
   * @return events published since the aggregate was loaded, created or last persisted
   */
  public final List<DomainEvent<K, V>> getPendingEvents() {
    return pendingEvents.events();
  }

  final List<DomainEvent<K, V>> drainPendingEvents() {
    return pendingEvents.drain();
  }

  final Optional<Snapshot<K, V>> snapshot() {
    final Optional<Snapshot<K, V>> snapshot = takeSnapshot();
    if (snapshot == null) {
      throw new IllegalStateException("Snapshot optional cannot be null");
    }

    return snapshot;
  }

  /**
   * Redirects future events to the sink and hands over events published before attachment.
   *
   * @param sink to forward events to
   */
  final void attachTo(final EventSink sink) {
    if (sink == null) {
      throw new IllegalArgumentException("Event sink cannot be null");
    }

    if (sink == eventSink) {
      return;
    }

    eventSink = sink;
    pendingEvents.events().forEach(sink::publish);
  }

  @SuppressWarnings("unchecked")
  private A self() {
    return (A) this;
  }

  @Override
  public String toString() {
    return "%s{key=%s, version=%s, pendingEvents=%d}"
        .formatted(getClass().getSimpleName(), key, version, pendingEvents.size());
  }
}
