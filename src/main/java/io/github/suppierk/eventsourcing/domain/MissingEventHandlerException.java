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

/** Raised when an aggregate receives an event type it never registered a handler for. */
public class MissingEventHandlerException extends DomainException {
  @Serial private static final long serialVersionUID = -1043998870937116335L;

  public MissingEventHandlerException(final Class<?> aggregateClass, final Class<?> eventClass) {
    super(
        "%s has no handler registered for %s"
            .formatted(aggregateClass.getName(), eventClass.getName()));
  }
}
