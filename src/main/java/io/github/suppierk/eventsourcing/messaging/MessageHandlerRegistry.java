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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable routing table from exact message classes to their handlers, built once at startup.
 *
 * <p>Commands and queries resolve to exactly one handler, events to any number of handlers in
 * registration order.
 */
public final class MessageHandlerRegistry {
  private final Map<Class<?>, List<DomainCommandHandler<?>>> commandHandlers;
  private final Map<Class<?>, List<DomainEventHandler<?>>> eventHandlers;
  private final Map<Class<?>, List<DomainQueryHandler<?, ?>>> queryHandlers;

  private MessageHandlerRegistry(final Builder builder) {
    this.commandHandlers = freeze(builder.commandHandlers);
    this.eventHandlers = freeze(builder.eventHandlers);
    this.queryHandlers = freeze(builder.queryHandlers);
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return command classes which have at least one handler
   */
  public Set<Class<?>> getSupportedCommandClasses() {
    return commandHandlers.keySet();
  }

  /**
   * @return event classes which have at least one handler
   */
  public Set<Class<?>> getSupportedEventClasses() {
    return eventHandlers.keySet();
  }

  /**
   * @return query classes which have at least one handler
   */
  public Set<Class<?>> getSupportedQueryClasses() {
    return queryHandlers.keySet();
  }

  /**
   * @throws MessageHandlerConfigurationException if a command or query class has more than one
   *     handler
   */
  public void verify() {
    verifySingleHandlers(commandHandlers);
    verifySingleHandlers(queryHandlers);
  }

  @SuppressWarnings("unchecked")
  DomainCommandHandler<DomainCommand> commandHandlerFor(final Class<?> commandClass) {
    return (DomainCommandHandler<DomainCommand>) singleHandler(commandHandlers, commandClass);
  }

  @SuppressWarnings("unchecked")
  List<DomainEventHandler<DomainEvent<?, ?>>> eventHandlersFor(final Class<?> eventClass) {
    final List<?> handlers = eventHandlers.getOrDefault(eventClass, List.of());
    return (List<DomainEventHandler<DomainEvent<?, ?>>>) handlers;
  }

  @SuppressWarnings("unchecked")
  <RESULT> DomainQueryHandler<DomainQuery<RESULT>, RESULT> queryHandlerFor(
      final Class<?> queryClass) {
    return (DomainQueryHandler<DomainQuery<RESULT>, RESULT>)
        singleHandler(queryHandlers, queryClass);
  }

  private static <H> H singleHandler(
      final Map<Class<?>, List<H>> handlers, final Class<?> messageClass) {
    final List<H> candidates = handlers.getOrDefault(messageClass, List.of());
    if (candidates.isEmpty()) {
      throw MessageHandlerConfigurationException.noHandler(messageClass);
    }

    if (candidates.size() > 1) {
      throw MessageHandlerConfigurationException.multipleHandlers(messageClass, candidates.size());
    }

    return candidates.get(0);
  }

  private static <H> void verifySingleHandlers(final Map<Class<?>, List<H>> handlers) {
    handlers.forEach(
        (messageClass, candidates) -> {
          if (candidates.size() > 1) {
            throw MessageHandlerConfigurationException.multipleHandlers(
                messageClass, candidates.size());
          }
        });
  }

  private static <H> Map<Class<?>, List<H>> freeze(final Map<Class<?>, List<H>> handlers) {
    final Map<Class<?>, List<H>> frozen = new LinkedHashMap<>();
    handlers.forEach(
        (messageClass, candidates) -> frozen.put(messageClass, List.copyOf(candidates)));
    return Map.copyOf(frozen);
  }

  /** Collects handlers, the same handler instance cannot be registered twice. */
  public static final class Builder extends Suspicious {
    private final Map<Class<?>, List<DomainCommandHandler<?>>> commandHandlers;
    private final Map<Class<?>, List<DomainEventHandler<?>>> eventHandlers;
    private final Map<Class<?>, List<DomainQueryHandler<?, ?>>> queryHandlers;

    private Builder() {
      this.commandHandlers = new LinkedHashMap<>();
      this.eventHandlers = new LinkedHashMap<>();
      this.queryHandlers = new LinkedHashMap<>();
    }

    public Builder addCommandHandler(final DomainCommandHandler<?> handler) {
      register(commandHandlers, throwIllegalArgumentIfNull(handler, "Command handler"));
      return this;
    }

    public Builder addEventHandler(final DomainEventHandler<?> handler) {
      register(eventHandlers, throwIllegalArgumentIfNull(handler, "Event handler"));
      return this;
    }

    public Builder addQueryHandler(final DomainQueryHandler<?, ?> handler) {
      register(queryHandlers, throwIllegalArgumentIfNull(handler, "Query handler"));
      return this;
    }

    public MessageHandlerRegistry build() {
      return new MessageHandlerRegistry(this);
    }

    private <H extends DomainHandler<?>> void register(
        final Map<Class<?>, List<H>> handlers, final H handler) {
      final Class<?> messageClass =
          throwIllegalStateIfNull(handler.getMessageClass(), "Handler message class");
      final List<H> candidates =
          handlers.computeIfAbsent(messageClass, ignored -> new ArrayList<>());

      if (candidates.contains(handler)) {
        throw new IllegalStateException(
            "%s is already registered for %s".formatted(handler, messageClass.getName()));
      }

      candidates.add(handler);
    }
  }
}
