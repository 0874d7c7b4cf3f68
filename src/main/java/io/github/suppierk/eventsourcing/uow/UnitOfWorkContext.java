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

package io.github.suppierk.eventsourcing.uow;

import io.github.suppierk.eventsourcing.domain.DomainEvent;
import io.github.suppierk.eventsourcing.domain.EventSink;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scope of one inbound message: tracks the resources touched while handling it and the events
 * published meanwhile.
 *
 * <p>Lifecycle: {@code ACTIVE -> FLUSHING -> ACTIVE} for every flush, {@code DISCARDED} after a
 * failure and {@code INACTIVE} once closed. A context is used by one operation at a time, methods
 * are synchronized only because asynchronous continuations may run on different threads.
 *
 * <p>Resources are flushed one after another in enlistment order. There is no atomicity across
 * resources: if a later resource fails, changes persisted by earlier ones stay persisted.
 */
public final class UnitOfWorkContext implements EventSink {
  private static final Logger LOGGER = LoggerFactory.getLogger(UnitOfWorkContext.class);

  private final UUID id;
  private final Set<UnitOfWork> enlisted;
  private final Map<Object, Object> resources;
  private final List<DomainEvent<?, ?>> publishedEvents;
  private UnitOfWorkState state;
  private boolean cancellationRequested;
  private boolean changesPersisted;

  private UnitOfWorkContext() {
    this.id = UUID.randomUUID();
    this.enlisted = new LinkedHashSet<>();
    this.resources = new LinkedHashMap<>();
    this.publishedEvents = new ArrayList<>();
    this.state = UnitOfWorkState.ACTIVE;
  }

  /**
   * @return new active context
   */
  public static UnitOfWorkContext open() {
    final UnitOfWorkContext context = new UnitOfWorkContext();
    LOGGER.debug("Opened unit of work {}", context.id);
    return context;
  }

  public UUID getId() {
    return id;
  }

  public synchronized UnitOfWorkState getState() {
    return state;
  }

  /**
   * Registers a resource to be flushed with this context. Enlisting the same resource again has no
   * effect.
   *
   * @param unitOfWork to flush later
   */
  public synchronized void enlist(final UnitOfWork unitOfWork) {
    if (unitOfWork == null) {
      throw new IllegalArgumentException("Unit of work cannot be null");
    }

    requireState(UnitOfWorkState.ACTIVE);
    if (enlisted.add(unitOfWork)) {
      LOGGER.debug("Enlisted {} in unit of work {}", unitOfWork, id);
    }
  }

  public synchronized boolean isEnlisted(final UnitOfWork unitOfWork) {
    return enlisted.contains(unitOfWork);
  }

  /**
   * Returns the resource cached under the key, creating it on first use.
   *
   * @param key identifying the resource within this context
   * @param factory creating the resource for this context
   * @param <T> is the resource type
   * @return cached or newly created resource
   */
  @SuppressWarnings("unchecked")
  public synchronized <T> T resolve(
      final Object key, final Function<UnitOfWorkContext, T> factory) {
    if (key == null) {
      throw new IllegalArgumentException("Resource key cannot be null");
    }

    if (factory == null) {
      throw new IllegalArgumentException("Resource factory cannot be null");
    }

    requireState(UnitOfWorkState.ACTIVE);
    final Object cached = resources.get(key);
    if (cached != null) {
      return (T) cached;
    }

    final T created = factory.apply(this);
    if (created == null) {
      throw new IllegalStateException("Resource created for %s cannot be null".formatted(key));
    }

    resources.put(key, created);
    return created;
  }

  /** Records an event published by an aggregate tracked in this context. */
  @Override
  public synchronized void publish(final DomainEvent<?, ?> event) {
    if (event == null) {
      throw new IllegalArgumentException("Published event cannot be null");
    }

    requireState(UnitOfWorkState.ACTIVE);
    publishedEvents.add(event);
  }

  /**
   * @return events published since the last flush, in publication order
   */
  public synchronized List<DomainEvent<?, ?>> getPublishedEvents() {
    return List.copyOf(publishedEvents);
  }

  public synchronized boolean requiresFlush() {
    return enlisted.stream().anyMatch(UnitOfWork::requiresFlush);
  }

  /**
   * Marks that a resource of this context wrote to its store. Resources call it after every
   * successful write, including writes of a flush which fails later on.
   */
  public synchronized void recordPersistedChanges() {
    changesPersisted = true;
  }

  /**
   * @return {@code true} if any change of this context reached a store, even if a later write
   *     failed
   */
  public synchronized boolean hasPersistedChanges() {
    return changesPersisted;
  }

  /** Asks a running or upcoming flush to stop before the next resource or aggregate. */
  public synchronized void requestCancellation() {
    cancellationRequested = true;
  }

  public synchronized boolean isCancellationRequested() {
    return cancellationRequested;
  }

  /**
   * @throws CancellationException if cancellation was requested
   */
  public void throwIfCancellationRequested() {
    if (isCancellationRequested()) {
      throw new CancellationException("Unit of work %s was cancelled".formatted(id));
    }
  }

  /**
   * Persists every enlisted resource which requires it.
   *
   * <p>On failure the context is discarded and the returned future completes exceptionally.
   *
   * @return events published since the previous flush, all of which are persisted now
   */
  public CompletableFuture<List<DomainEvent<?, ?>>> flushAsync() {
    final List<UnitOfWork> units;
    final List<DomainEvent<?, ?>> events;
    synchronized (this) {
      requireState(UnitOfWorkState.ACTIVE);
      state = UnitOfWorkState.FLUSHING;
      units = enlisted.stream().filter(UnitOfWork::requiresFlush).toList();
      events = List.copyOf(publishedEvents);
      publishedEvents.clear();
    }

    LOGGER.debug(
        "Flushing {} resources with {} events in unit of work {}", units.size(), events.size(), id);

    CompletableFuture<Void> flush = CompletableFuture.completedFuture(null);
    for (UnitOfWork unit : units) {
      flush =
          flush
              .thenCompose(
                  ignored -> {
                    throwIfCancellationRequested();
                    return unit.flushAsync();
                  })
              .thenRun(this::recordPersistedChanges);
    }

    return flush.handle(
        (ignored, error) -> {
          if (error != null) {
            LOGGER.warn("Flush of unit of work {} failed", id, error);
            discard();
            throw error instanceof RuntimeException runtimeException
                ? runtimeException
                : new IllegalStateException(error);
          }

          synchronized (this) {
            state = UnitOfWorkState.ACTIVE;
          }

          return events;
        });
  }

  /** Drops pending events and enlisted resources, nothing is persisted afterwards. */
  public synchronized void discard() {
    if (state == UnitOfWorkState.INACTIVE || state == UnitOfWorkState.DISCARDED) {
      return;
    }

    LOGGER.debug(
        "Discarding unit of work {} with {} unflushed events", id, publishedEvents.size());
    state = UnitOfWorkState.DISCARDED;
    publishedEvents.clear();
    enlisted.clear();
    resources.clear();
  }

  /** Ends the lifecycle of this context. */
  public synchronized void close() {
    if (state == UnitOfWorkState.INACTIVE) {
      return;
    }

    if (state == UnitOfWorkState.ACTIVE && !publishedEvents.isEmpty()) {
      LOGGER.warn(
          "Closing unit of work {} with {} unflushed events", id, publishedEvents.size());
    }

    state = UnitOfWorkState.INACTIVE;
    publishedEvents.clear();
    enlisted.clear();
    resources.clear();
    LOGGER.debug("Closed unit of work {}", id);
  }

  private void requireState(final UnitOfWorkState expected) {
    if (state != expected) {
      throw new IllegalStateException(
          "Unit of work %s is %s, expected %s".formatted(id, state, expected));
    }
  }

  @Override
  public String toString() {
    return "UnitOfWorkContext{id=%s, state=%s}".formatted(id, getState());
  }
}
