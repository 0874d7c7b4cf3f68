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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, append-only list of events an aggregate published and which were not persisted yet.
 *
 * <p>All events share the buffer key and have strictly increasing versions.
 *
 * @param <K> is the aggregate key type
 * @param <V> is the aggregate version type
 */
public final class EventBuffer<K, V extends AggregateVersion<V>> {
  private final K key;
  private final List<DomainEvent<K, V>> events;

  public EventBuffer(final K key) {
    if (key == null) {
      throw new IllegalArgumentException("Buffer key cannot be null");
    }

    this.key = key;
    this.events = new ArrayList<>();
  }

  /**
   * @param event to add at the end of the buffer
   * @throws InvalidKeyException if the event belongs to another key
   * @throws InvalidVersionException if the event version does not exceed the last buffered one
   */
  public void append(final DomainEvent<K, V> event) {
    if (event == null) {
      throw new IllegalArgumentException("Buffered event cannot be null");
    }

    if (!key.equals(event.key())) {
      throw new InvalidKeyException(key, event.key());
    }

    final Optional<V> lastVersion = lastVersion();
    if (lastVersion.isPresent()) {
      AggregateVersion.requireNewer(lastVersion.get(), event.version());
    }

    events.add(event);
  }

  public K key() {
    return key;
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }

  public int size() {
    return events.size();
  }

  /**
   * @return version of the most recently buffered event, if any
   */
  public Optional<V> lastVersion() {
    return events.isEmpty()
        ? Optional.empty()
        : Optional.of(events.get(events.size() - 1).version());
  }

  /**
   * @return read-only view of the buffered events in publication order
   */
  public List<DomainEvent<K, V>> events() {
    return Collections.unmodifiableList(events);
  }

  /**
   * @return all buffered events in publication order, leaving the buffer empty
   */
  public List<DomainEvent<K, V>> drain() {
    final List<DomainEvent<K, V>> drained = List.copyOf(events);
    events.clear();
    return drained;
  }
}
