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

import io.github.suppierk.eventsourcing.messaging.DomainMessage;

/**
 * Immutable fact about a change of one aggregate.
 *
 * <p>Events of a single aggregate type are expected to be records grouped under a {@code sealed}
 * interface, so that the set of facts an aggregate understands is closed.
 *
 * @param <K> is the aggregate key type
 * @param <V> is the aggregate version type
 */
public interface DomainEvent<K, V extends AggregateVersion<V>> extends DomainMessage {
  /**
   * @return key of the aggregate which produced this event
   */
  K key();

  /**
   * @return version of the aggregate after this event was applied
   */
  V version();
}
