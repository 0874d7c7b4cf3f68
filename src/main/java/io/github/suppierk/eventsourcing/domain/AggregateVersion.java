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
 * Totally ordered, monotonically increasing version of an aggregate.
 *
 * <p>Implementations must be immutable and have value semantics.
 *
 * @param <V> is the concrete version type
 */
public interface AggregateVersion<V extends AggregateVersion<V>>
    extends Comparable<V>, Serializable {
  /**
   * @return a version which is strictly greater than the current one
   */
  V next();

  /**
   * Used during replay to detect gaps in the event stream.
   *
   * @param previous version of the preceding event
   * @return {@code true} if the current version may directly follow {@code previous}
   */
  default boolean isSuccessorOf(final V previous) {
    return previous != null && compareTo(previous) > 0;
  }

  /**
   * Accepts a candidate version only if it is strictly greater than the current one.
   *
   * @param current version of the aggregate
   * @param candidate version to advance to
   * @param <V> is the concrete version type
   * @return the candidate version
   * @throws IllegalArgumentException if any of the versions is {@code null}
   * @throws InvalidVersionException if the candidate is equal to or less than the current version
   */
  static <V extends AggregateVersion<V>> V requireNewer(final V current, final V candidate) {
    if (current == null) {
      throw new IllegalArgumentException("Current version cannot be null");
    }

    if (candidate == null) {
      throw new IllegalArgumentException("Candidate version cannot be null");
    }

    if (candidate.compareTo(current) <= 0) {
      throw new InvalidVersionException(current, candidate);
    }

    return candidate;
  }
}
