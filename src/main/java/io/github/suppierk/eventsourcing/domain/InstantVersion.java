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

import java.io.Serial;
import java.time.Clock;
import java.time.Instant;

/**
 * Timestamp based version. Gaps between versions are expected, only strict ordering is enforced.
 *
 * @param value of the timestamp
 */
public record InstantVersion(Instant value) implements AggregateVersion<InstantVersion> {
  @Serial private static final long serialVersionUID = 2984734502374581873L;

  /** Version of a blank aggregate before its creation event was applied. */
  public static final InstantVersion INITIAL = new InstantVersion(Instant.EPOCH);

  public InstantVersion {
    if (value == null) {
      throw new IllegalArgumentException("Version timestamp cannot be null");
    }
  }

  /**
   * @param value of the timestamp
   * @return a new version instance
   */
  public static InstantVersion of(final Instant value) {
    return new InstantVersion(value);
  }

  /** {@inheritDoc} */
  @Override
  public InstantVersion next() {
    return next(Clock.systemUTC());
  }

  /**
   * @param clock to read the current time from
   * @return a version at the current time or one nanosecond after the current version if the clock
   *     did not move forward
   */
  public InstantVersion next(final Clock clock) {
    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    final Instant now = clock.instant();
    return new InstantVersion(now.isAfter(value) ? now : value.plusNanos(1L));
  }

  @Override
  public int compareTo(final InstantVersion other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
