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
 * Raised when the store rejects a write because the stream moved past the version the aggregate
 * was loaded at, or because another writer created the same key first.
 *
 * <p>The only retryable error: re-running the operation reloads the aggregate at its latest
 * version.
 */
public class ConcurrencyConflictException extends DomainException {
  @Serial private static final long serialVersionUID = 3345021826641927720L;

  private final transient Object key;
  private final transient AggregateVersion<?> originalVersion;

  /**
   * @param aggregateClass whose stream was written
   * @param key of the aggregate
   * @param originalVersion the write was conditioned on, {@code null} for inserts
   */
  public ConcurrencyConflictException(
      final Class<?> aggregateClass, final Object key, final AggregateVersion<?> originalVersion) {
    super(
        originalVersion == null
            ? "%s with key %s was created concurrently"
                .formatted(aggregateClass.getSimpleName(), key)
            : "%s with key %s was modified concurrently after version %s"
                .formatted(aggregateClass.getSimpleName(), key, originalVersion));
    this.key = key;
    this.originalVersion = originalVersion;
  }

  public Object getKey() {
    return key;
  }

  public AggregateVersion<?> getOriginalVersion() {
    return originalVersion;
  }

  /**
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 409;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
