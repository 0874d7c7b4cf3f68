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

/** Raised while building {@link EventHandlers} when an event type is registered twice. */
public class DuplicateEventHandlerException extends DomainException {
  @Serial private static final long serialVersionUID = 6605191473958413872L;

  public DuplicateEventHandlerException(final Class<?> aggregateClass, final Class<?> eventClass) {
    super(
        "%s already has a handler registered for %s"
            .formatted(aggregateClass.getName(), eventClass.getName()));
  }
}
