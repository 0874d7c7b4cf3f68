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

/** Raised when an event addressed to one aggregate is applied to another. */
public class InvalidKeyException extends DomainException {
  @Serial private static final long serialVersionUID = 4829735046137760214L;

  private final transient Object expectedKey;
  private final transient Object actualKey;

  public InvalidKeyException(final Object expectedKey, final Object actualKey) {
    super("Event for key %s cannot be applied to aggregate %s".formatted(actualKey, expectedKey));
    this.expectedKey = expectedKey;
    this.actualKey = actualKey;
  }

  public Object getExpectedKey() {
    return expectedKey;
  }

  public Object getActualKey() {
    return actualKey;
  }
}
