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

/**
 * Counter based version. Streams start at {@link #INITIAL} and their first event has version 1.
 *
 * @param value of the counter, never negative
 */
public record LongVersion(long value) implements AggregateVersion<LongVersion> {
  @Serial private static final long serialVersionUID = -6693547180419604045L;

  /** Version of a blank aggregate before its creation event was applied. */
  public static final LongVersion INITIAL = new LongVersion(0L);

  public LongVersion {
    if (value < 0L) {
      throw new IllegalArgumentException("Version cannot be negative, got %d".formatted(value));
    }
  }

  /**
   * @param value of the counter
   * @return a new version instance
   */
  public static LongVersion of(final long value) {
    return new LongVersion(value);
  }

  /** {@inheritDoc} */
  @Override
  public LongVersion next() {
    return new LongVersion(Math.addExact(value, 1L));
  }

  /** Counter versions must not skip values. */
  @Override
  public boolean isSuccessorOf(final LongVersion previous) {
    return previous != null && value == previous.value + 1L;
  }

  @Override
  public int compareTo(final LongVersion other) {
    return Long.compare(value, other.value);
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
