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

/** Raised when a new aggregate is added under a key the repository already tracks. */
public class DuplicateKeyException extends DomainException {
  @Serial private static final long serialVersionUID = 7712563319052839043L;

  private final transient Object key;

  public DuplicateKeyException(final Class<?> aggregateClass, final Object key) {
    super("%s with key %s is already tracked".formatted(aggregateClass.getSimpleName(), key));
    this.key = key;
  }

  public Object getKey() {
    return key;
  }

  /**
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 409;
  }
}
