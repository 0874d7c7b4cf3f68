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

package io.github.suppierk.eventsourcing.messaging;

import io.github.suppierk.eventsourcing.domain.DomainEvent;
import io.github.suppierk.eventsourcing.uow.UnitOfWorkContext;
import io.github.suppierk.java.Try;
import java.util.concurrent.CompletableFuture;

/**
 * Class to react to a specific {@link DomainEvent} once it was persisted.
 *
 * <p>Any number of handlers may be registered for an event type, they run one after another in
 * registration order within the unit of work which persisted the event. Events published by the
 * handler are persisted and dispatched the same way before the next handler runs.
 *
 * @param <EVENT> the type of the particular {@link DomainEvent}
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract non-sealed class DomainEventHandler<EVENT extends DomainEvent<?, ?>>
    extends DomainHandler<EVENT> {
  protected DomainEventHandler(final Class<EVENT> eventClass) {
    super(eventClass);
  }

  /**
   * Reaction to the event.
   *
   * @param event which was persisted
   * @param context to resolve repositories from
   * @return future completing once the event was handled
   * @throws Exception if any error occurs during handling
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  protected abstract CompletableFuture<Void> handle(
      final EVENT event, final UnitOfWorkContext context) throws Exception;

  /**
   * @param event to handle
   * @param context to handle the event in
   * @return future of the handler outcome
   */
  public final CompletableFuture<Void> runInContext(
      final EVENT event, final UnitOfWorkContext context) {
    verifyInvocation(event, context);
    return completeFrom(Try.of(() -> handle(event, context)), "Event handler future");
  }
}
