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
import io.github.suppierk.eventsourcing.domain.DomainException;
import io.github.suppierk.eventsourcing.uow.UnitOfWorkContext;
import io.github.suppierk.eventsourcing.uow.UnitOfWorkState;
import io.github.suppierk.java.Try;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the library: routes inbound messages to their handlers within a unit of work.
 *
 * <p>For every top-level command or event the pipeline:
 *
 * <ol>
 *   <li>Opens a fresh {@link UnitOfWorkContext}.
 *   <li>Resolves the handlers registered for the exact message class.
 *   <li>Invokes them one after another, aborting on the first failure.
 *   <li>Flushes the unit of work, persisting every event aggregates published.
 *   <li>Dispatches each persisted event to its handlers within the same unit of work, depth-first,
 *       flushing after each of them.
 * </ol>
 *
 * <p>Any failure discards the unit of work and completes the returned future exceptionally. Changes
 * already flushed at that point, including those of earlier cascade steps, stay persisted.
 *
 * <p>Retryable failures are retried only while the failed attempt persisted nothing, otherwise a
 * retry would write the effects of the message twice.
 */
public final class MessageHandlerPipeline extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(MessageHandlerPipeline.class);

  private final MessageHandlerRegistry registry;
  private final PipelineOptions options;

  /**
   * @param registry of handlers
   */
  public MessageHandlerPipeline(final MessageHandlerRegistry registry) {
    this(registry, PipelineOptions.defaults());
  }

  /**
   * @param registry of handlers
   * @param options tuning the pipeline
   * @throws MessageHandlerConfigurationException if handlers are verified on startup and a command
   *     or query has several handlers
   */
  public MessageHandlerPipeline(
      final MessageHandlerRegistry registry, final PipelineOptions options) {
    this.registry = throwIllegalArgumentIfNull(registry, "Message handler registry");
    this.options = throwIllegalArgumentIfNull(options, "Pipeline options");

    if (options.verifyHandlersOnStartup()) {
      registry.verify();
    }
  }

  public PipelineOptions getOptions() {
    return options;
  }

  /**
   * Handles a command or an externally produced event as a top-level operation with its own unit of
   * work.
   *
   * @param message to handle
   * @return future of every event persisted while handling the message, including cascaded ones,
   *     in the order they were persisted
   */
  public CompletableFuture<List<DomainEvent<?, ?>>> handleAsync(final DomainMessage message) {
    throwIllegalArgumentIfNull(message, "Message");
    return handleWithRetries(message, 0);
  }

  /**
   * Handles a message within an existing unit of work, e.g. a command sent by another handler.
   *
   * <p>Nothing is flushed: the owner of the context persists the changes.
   *
   * @param message to handle
   * @param context to reuse
   * @return future completing once the handlers completed
   */
  public CompletableFuture<Void> handleAsync(
      final DomainMessage message, final UnitOfWorkContext context) {
    throwIllegalArgumentIfNull(message, "Message");
    throwIllegalArgumentIfNull(context, "Unit of work context");
    return invokeHandlers(message, context);
  }

  /**
   * Answers a query in a private unit of work which is discarded afterwards.
   *
   * @param query to answer
   * @param <RESULT> is the result type
   * @return future of the query result
   */
  public <RESULT> CompletableFuture<RESULT> executeAsync(final DomainQuery<RESULT> query) {
    throwIllegalArgumentIfNull(query, "Query");

    final UnitOfWorkContext context = UnitOfWorkContext.open();
    LOGGER.debug(
        "{} {} in unit of work {}", MessageHandlingStage.RECEIVED, name(query), context.getId());

    return resolveQueryHandler(query)
        .thenCompose(
            handler -> invoke(query, handler, Try.of(() -> handler.runInContext(query, context))))
        .whenComplete(
            (result, error) -> {
              if (error != null) {
                LOGGER.warn("{} {}", MessageHandlingStage.FAULTED, name(query), unwrap(error));
              } else {
                LOGGER.debug("{} {}", MessageHandlingStage.COMPLETED, name(query));
              }

              if (context.getState() == UnitOfWorkState.ACTIVE && context.requiresFlush()) {
                LOGGER.warn("Dropping changes made while executing {}", name(query));
              }

              context.discard();
              context.close();
            });
  }

  private CompletableFuture<List<DomainEvent<?, ?>>> handleWithRetries(
      final DomainMessage message, final int attempt) {
    final UnitOfWorkContext context = UnitOfWorkContext.open();
    return handleOnce(message, context)
        .handle(
            (persisted, error) -> {
              if (error == null) {
                return CompletableFuture.completedFuture(persisted);
              }

              final Throwable cause = unwrap(error);
              if (!isRetryable(cause) || attempt >= options.maxConflictRetries()) {
                return CompletableFuture.<List<DomainEvent<?, ?>>>failedFuture(cause);
              }

              if (context.hasPersistedChanges()) {
                LOGGER.warn(
                    "Not retrying {}: attempt {} already persisted changes",
                    name(message),
                    attempt + 1);
                return CompletableFuture.<List<DomainEvent<?, ?>>>failedFuture(cause);
              }

              LOGGER.info(
                  "Retrying {} after attempt {} failed: {}",
                  name(message),
                  attempt + 1,
                  cause.getMessage());
              return handleWithRetries(message, attempt + 1);
            })
        .thenCompose(Function.identity());
  }

  private CompletableFuture<List<DomainEvent<?, ?>>> handleOnce(
      final DomainMessage message, final UnitOfWorkContext context) {
    LOGGER.debug(
        "{} {} in unit of work {}", MessageHandlingStage.RECEIVED, name(message), context.getId());

    final List<DomainEvent<?, ?>> persisted = new ArrayList<>();
    return invokeHandlers(message, context)
        .thenCompose(ignored -> flushAndCascade(context, 0, persisted))
        .thenApply(ignored -> List.copyOf(persisted))
        .whenComplete(
            (ignored, error) -> {
              if (error != null) {
                LOGGER.warn("{} {}", MessageHandlingStage.FAULTED, name(message), unwrap(error));
                context.discard();
              } else {
                LOGGER.debug("{} {}", MessageHandlingStage.COMPLETED, name(message));
              }

              context.close();
            });
  }

  private CompletableFuture<Void> flushAndCascade(
      final UnitOfWorkContext context, final int depth, final List<DomainEvent<?, ?>> persisted) {
    return context
        .flushAsync()
        .thenCompose(
            events -> {
              persisted.addAll(events);
              return cascade(events, context, depth, persisted);
            });
  }

  private CompletableFuture<Void> cascade(
      final List<DomainEvent<?, ?>> events,
      final UnitOfWorkContext context,
      final int depth,
      final List<DomainEvent<?, ?>> persisted) {
    if (events.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }

    final int eventDepth = depth + 1;
    if (eventDepth > options.maxCascadeDepth()) {
      return CompletableFuture.failedFuture(
          new CascadeDepthExceededException(options.maxCascadeDepth(), events.get(0).getClass()));
    }

    CompletableFuture<Void> cascade = CompletableFuture.completedFuture(null);
    for (DomainEvent<?, ?> event : events) {
      cascade =
          cascade
              .thenCompose(
                  ignored -> {
                    LOGGER.debug(
                        "{} {} at cascade depth {}",
                        MessageHandlingStage.RECEIVED,
                        name(event),
                        eventDepth);
                    return invokeHandlers(event, context);
                  })
              .thenCompose(ignored -> flushAndCascade(context, eventDepth, persisted));
    }

    return cascade;
  }

  private CompletableFuture<Void> invokeHandlers(
      final DomainMessage message, final UnitOfWorkContext context) {
    LOGGER.debug("{} {}", MessageHandlingStage.RESOLVING, name(message));

    if (message instanceof DomainCommand command) {
      return resolve(() -> registry.commandHandlerFor(command.getClass()))
          .thenCompose(
              handler ->
                  invoke(command, handler, Try.of(() -> handler.runInContext(command, context))));
    }

    if (message instanceof DomainEvent<?, ?> event) {
      final List<DomainEventHandler<DomainEvent<?, ?>>> handlers =
          registry.eventHandlersFor(event.getClass());
      if (handlers.isEmpty()) {
        LOGGER.debug("No handlers registered for {}", name(event));
      }

      CompletableFuture<Void> invocations = CompletableFuture.completedFuture(null);
      for (DomainEventHandler<DomainEvent<?, ?>> handler : handlers) {
        invocations =
            invocations.thenCompose(
                ignored ->
                    invoke(event, handler, Try.of(() -> handler.runInContext(event, context))));
      }

      return invocations;
    }

    if (message instanceof DomainQuery<?>) {
      return CompletableFuture.failedFuture(
          new IllegalArgumentException(
              "%s is a query, queries must be executed via executeAsync".formatted(name(message))));
    }

    return CompletableFuture.failedFuture(
        new IllegalArgumentException("Unsupported message type %s".formatted(name(message))));
  }

  private <RESULT> CompletableFuture<DomainQueryHandler<DomainQuery<RESULT>, RESULT>>
      resolveQueryHandler(final DomainQuery<RESULT> query) {
    LOGGER.debug("{} {}", MessageHandlingStage.RESOLVING, name(query));
    return resolve(() -> registry.<RESULT>queryHandlerFor(query.getClass()));
  }

  private <H> CompletableFuture<H> resolve(final Supplier<H> lookup) {
    try {
      return CompletableFuture.completedFuture(lookup.get());
    } catch (DomainException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private <T> CompletableFuture<T> invoke(
      final DomainMessage message,
      final DomainHandler<?> handler,
      final Try<CompletableFuture<T>> invocation) {
    LOGGER.debug("{} {} with {}", MessageHandlingStage.INVOKING, name(message), handler);

    return completeFrom(invocation, "%s future".formatted(handler))
        .handle(
            (result, error) -> {
              if (error != null) {
                throw new MessageHandlerException(
                    message.getClass(),
                    handler.getClass(),
                    MessageHandlingStage.INVOKING,
                    unwrap(error));
              }

              return result;
            });
  }

  private static boolean isRetryable(final Throwable error) {
    return error instanceof DomainException domainException && domainException.isRetryable();
  }

  private static Throwable unwrap(final Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }

    return current;
  }

  private static String name(final DomainMessage message) {
    return message.getClass().getSimpleName();
  }
}
