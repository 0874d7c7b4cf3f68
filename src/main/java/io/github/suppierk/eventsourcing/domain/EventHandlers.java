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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Table of state transitions of one aggregate type, keyed by the exact event class.
 *
 * <p>Meant to be built once per aggregate type and kept in a {@code static final} field:
 *
 * <pre>{@code
 * private static final EventHandlers<Account> EVENT_HANDLERS =
 *     EventHandlers.builder(Account.class)
 *         .on(AccountOpened.class, Account::onOpened)
 *         .on(MoneyDeposited.class, Account::onDeposited)
 *         .build();
 * }</pre>
 *
 * @param <A> is the aggregate type
 */
public final class EventHandlers<A> {
  private final Class<A> aggregateClass;
  private final Map<Class<?>, BiConsumer<A, Object>> handlers;

  private EventHandlers(
      final Class<A> aggregateClass, final Map<Class<?>, BiConsumer<A, Object>> handlers) {
    this.aggregateClass = aggregateClass;
    this.handlers = Map.copyOf(handlers);
  }

  /**
   * @param aggregateClass owning the handlers
   * @param <A> is the aggregate type
   * @return a new builder
   */
  public static <A> Builder<A> builder(final Class<A> aggregateClass) {
    if (aggregateClass == null) {
      throw new IllegalArgumentException("Aggregate class cannot be null");
    }

    return new Builder<>(aggregateClass);
  }

  public Class<A> getAggregateClass() {
    return aggregateClass;
  }

  public Set<Class<?>> getSupportedEventClasses() {
    return handlers.keySet();
  }

  public boolean handles(final Class<?> eventClass) {
    return handlers.containsKey(eventClass);
  }

  /**
   * Runs the transition registered for the event class.
   *
   * @param aggregate to mutate
   * @param event to apply
   * @throws MissingEventHandlerException if nothing was registered for the event class, in which
   *     case the aggregate is not touched
   */
  void apply(final A aggregate, final DomainEvent<?, ?> event) {
    final BiConsumer<A, Object> handler = handlers.get(event.getClass());
    if (handler == null) {
      throw new MissingEventHandlerException(aggregateClass, event.getClass());
    }

    handler.accept(aggregate, event);
  }

  /**
   * @param <A> is the aggregate type
   */
  public static final class Builder<A> {
    private final Class<A> aggregateClass;
    private final Map<Class<?>, BiConsumer<A, Object>> handlers;

    private Builder(final Class<A> aggregateClass) {
      this.aggregateClass = aggregateClass;
      this.handlers = new LinkedHashMap<>();
    }

    /**
     * @param eventClass to handle
     * @param handler mutating the aggregate
     * @param <E> is the event type
     * @return current builder
     * @throws DuplicateEventHandlerException if the event class already has a handler
     */
    public <E extends DomainEvent<?, ?>> Builder<A> on(
        final Class<E> eventClass, final BiConsumer<? super A, ? super E> handler) {
      if (eventClass == null) {
        throw new IllegalArgumentException("Event class cannot be null");
      }

      if (handler == null) {
        throw new IllegalArgumentException("Event handler cannot be null");
      }

      if (handlers.containsKey(eventClass)) {
        throw new DuplicateEventHandlerException(aggregateClass, eventClass);
      }

      handlers.put(
          eventClass, (aggregate, event) -> handler.accept(aggregate, eventClass.cast(event)));
      return this;
    }

    public EventHandlers<A> build() {
      return new EventHandlers<>(aggregateClass, handlers);
    }
  }
}
