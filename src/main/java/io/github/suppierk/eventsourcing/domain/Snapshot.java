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

import java.io.Serializable;

/**
 * Captured state of an aggregate at a given version, used to shorten replays.
 *
 * @param <K> is the aggregate key type
 * @param <V> is the aggregate version type
 */
public interface Snapshot<K, V extends AggregateVersion<V>> extends Serializable {
  K key();

  V version();
}
