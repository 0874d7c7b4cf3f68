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

import io.github.suppierk.eventsourcing.store.EventStore;
import io.github.suppierk.eventsourcing.store.EventToSave;
import io.github.suppierk.eventsourcing.store.SnapshotToSave;
import io.github.suppierk.eventsourcing.store.TypeToContractMap;
import io.github.suppierk.eventsourcing.store.WriteResult;
import io.github.suppierk.eventsourcing.uow.UnitOfWork;
import io.github.suppierk.eventsourcing.uow.UnitOfWorkContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads aggregates of one type by replaying their events and persists the events they publish.
 *
 * <p>A repository belongs to exactly one {@link UnitOfWorkContext} and acts as its identity map:
 * within that context every key resolves to the same aggregate instance. The repository enlists
 * itself into the context on first use and is flushed by it.
 *
 * <p>Updates are conditioned on the version an aggregate had when it was loaded, a concurrent
 * modification surfaces as {@link ConcurrencyConflictException} during flush.
 *
 * <p>Not thread-safe, confined to its unit of work like the aggregates it tracks.
 *
 * @param <K> is the key type
 * @param <V> is the version type
 * @param <A> is the aggregate type
 */
// @formatter:off
public final class Repository<
  K,
  V extends AggregateVersion<V>,
  A extends AggregateRoot<K, V, A>
> implements UnitOfWork {
// @formatter:on
  private static final Logger LOGGER = LoggerFactory.getLogger(Repository.class);

  private final RepositoryConfiguration<K, V, A> configuration;
  private final UnitOfWorkContext context;
  private final Map<K, Tracked<K, V, A>> tracked;

  private Repository(
      final RepositoryConfiguration<K, V, A> configuration, final UnitOfWorkContext context) {
    this.configuration = configuration;
    this.context = context;
    this.tracked = new LinkedHashMap<>();
  }

  /**
   * @param configuration of the repository
   * @param context the repository belongs to
   * @param <K> is the key type
   * @param <V> is the version type
   * @param <A> is the aggregate type
   * @return the repository of the context for the given configuration, created on first use
   */
  public static <K, V extends AggregateVersion<V>, A extends AggregateRoot<K, V, A>>
      Repository<K, V, A> of(
          final RepositoryConfiguration<K, V, A> configuration, final UnitOfWorkContext context) {
    if (configuration == null) {
      throw new IllegalArgumentException("Repository configuration cannot be null");
    }

    if (context == null) {
      throw new IllegalArgumentException("Unit of work context cannot be null");
    }

    return context.resolve(configuration, owner -> new Repository<>(configuration, owner));
  }

  /**
   * Returns the tracked aggregate for the key or loads it from the store.
   *
   * <p>Loading uses the latest snapshot and the events after it when the aggregate type supports
   * snapshots, the full stream otherwise.
   *
   * @param key of the aggregate
   * @return future of the aggregate, failing with {@link ItemNotFoundException} if the store knows
   *     nothing about the key
   */
  public CompletableFuture<A> getByIdAsync(final K key) {
    if (key == null) {
      throw new IllegalArgumentException("Aggregate key cannot be null");
    }

    final A cached = find(key).orElse(null);
    if (cached != null) {
      return CompletableFuture.completedFuture(cached);
    }

    return load(key).thenApply(this::track);
  }

  /**
   * Starts tracking a new aggregate, its events are inserted on the next flush.
   *
   * <p>Adding the same instance again has no effect.
   *
   * @param aggregate to insert
   * @throws DuplicateKeyException if another aggregate with the same key is tracked
   */
  public void add(final A aggregate) {
    if (aggregate == null) {
      throw new IllegalArgumentException("Added aggregate cannot be null");
    }

    final Tracked<K, V, A> existing = tracked.get(aggregate.key());
    if (existing != null) {
      if (existing.aggregate == aggregate) {
        return;
      }

      throw new DuplicateKeyException(aggregateClass(), aggregate.key());
    }

    tracked.put(aggregate.key(), new Tracked<>(aggregate, null, 0));
    attach(aggregate);
    LOGGER.debug("Added {}", aggregate);
  }

  /**
   * @param key of the aggregate
   * @return aggregate tracked by this repository, without touching the store
   */
  public Optional<A> find(final K key) {
    return Optional.ofNullable(tracked.get(key)).map(entry -> entry.aggregate);
  }

  public RepositoryConfiguration<K, V, A> getConfiguration() {
    return configuration;
  }

  /** {@inheritDoc} */
  @Override
  public boolean requiresFlush() {
    return tracked.values().stream().anyMatch(entry -> entry.aggregate.hasPendingEvents());
  }

  /**
   * Writes the pending events of every tracked aggregate, one aggregate at a time: inserts for new
   * aggregates, conditional updates for loaded ones.
   *
   * @return future failing with {@link ConcurrencyConflictException} if the store rejected a write
   */
  @Override
  public CompletableFuture<Void> flushAsync() {
    final List<Tracked<K, V, A>> pending =
        tracked.values().stream().filter(entry -> entry.aggregate.hasPendingEvents()).toList();

    CompletableFuture<Void> flush = CompletableFuture.completedFuture(null);
    for (Tracked<K, V, A> entry : pending) {
      flush =
          flush.thenCompose(
              ignored -> {
                context.throwIfCancellationRequested();
                return flush(entry);
              });
    }

    return flush;
  }

  private CompletableFuture<LoadedAggregate<A>> load(final K key) {
    final EventStore<K, V> store = configuration.eventStore();
    final AggregateType<K, V, A> aggregateType = configuration.aggregateType();

    if (!aggregateType.supportsSnapshots()) {
      return store.readHistory(key).thenApply(history -> replay(key, history));
    }

    return store
        .readSnapshot(key)
        .thenCompose(
            snapshot -> {
              if (snapshot.isEmpty()) {
                return store.readHistory(key).thenApply(history -> replay(key, history));
              }

              return store
                  .readHistoryAfter(key, snapshot.get().version())
                  .thenApply(
                      history ->
                          new LoadedAggregate<>(
                              aggregateType.restore(snapshot.get(), history), history.size()));
            });
  }

  private LoadedAggregate<A> replay(final K key, final List<DomainEvent<K, V>> history) {
    if (history.isEmpty()) {
      throw new ItemNotFoundException(aggregateClass(), key);
    }

    return new LoadedAggregate<>(
        configuration.aggregateType().replay(key, history), history.size());
  }

  private A track(final LoadedAggregate<A> loaded) {
    final A aggregate = loaded.aggregate();
    final Tracked<K, V, A> existing = tracked.get(aggregate.key());
    if (existing != null) {
      return existing.aggregate;
    }

    tracked.put(
        aggregate.key(),
        new Tracked<>(aggregate, aggregate.version(), loaded.eventsSinceSnapshot()));
    attach(aggregate);
    LOGGER.debug("Loaded {}", aggregate);
    return aggregate;
  }

  private void attach(final A aggregate) {
    context.enlist(this);
    aggregate.attachTo(context);
  }

  private CompletableFuture<Void> flush(final Tracked<K, V, A> entry) {
    final A aggregate = entry.aggregate;
    final TypeToContractMap contracts = configuration.contracts();
    final List<DomainEvent<K, V>> events = List.copyOf(aggregate.getPendingEvents());
    final List<EventToSave<K, V>> eventsToSave =
        events.stream()
            .map(event -> new EventToSave<K, V>(contracts.contractOf(event.getClass()), event))
            .toList();
    final SnapshotToSave<K, V> snapshotToSave = snapshotToSave(entry, events.size());

    final CompletableFuture<WriteResult> write =
        entry.isNew()
            ? configuration.eventStore().insertEvents(aggregate.key(), eventsToSave, snapshotToSave)
            : configuration
                .eventStore()
                .updateEvents(aggregate.key(), eventsToSave, entry.originalVersion, snapshotToSave);

    return write.thenAccept(
        result -> {
          if (result == WriteResult.CONFLICT) {
            LOGGER.warn(
                "Store rejected {} events of {} written after version {}",
                events.size(),
                aggregate,
                entry.originalVersion);
            throw new ConcurrencyConflictException(
                aggregateClass(), aggregate.key(), entry.originalVersion);
          }

          context.recordPersistedChanges();
          aggregate.drainPendingEvents();
          entry.originalVersion = aggregate.version();
          entry.eventsSinceSnapshot =
              snapshotToSave == null ? entry.eventsSinceSnapshot + events.size() : 0;

          LOGGER.debug("Persisted {} events of {}", events.size(), aggregate);
        });
  }

  private SnapshotToSave<K, V> snapshotToSave(final Tracked<K, V, A> entry, final int newEvents) {
    final int interval = configuration.snapshotInterval();
    if (interval <= 0 || entry.eventsSinceSnapshot + newEvents < interval) {
      return null;
    }

    final Optional<Snapshot<K, V>> snapshot = entry.aggregate.snapshot();
    if (snapshot.isEmpty()) {
      return null;
    }

    LOGGER.info("Storing snapshot of {}", entry.aggregate);
    return new SnapshotToSave<>(
        configuration.contracts().contractOf(snapshot.get().getClass()),
        snapshot.get(),
        entry.originalVersion);
  }

  private Class<A> aggregateClass() {
    return configuration.aggregateType().getAggregateClass();
  }

  @Override
  public String toString() {
    return "Repository{aggregate=%s, tracked=%d}"
        .formatted(aggregateClass().getSimpleName(), tracked.size());
  }

  private record LoadedAggregate<A>(A aggregate, int eventsSinceSnapshot) {}

  private static final class Tracked<
      K, V extends AggregateVersion<V>, A extends AggregateRoot<K, V, A>> {
    private final A aggregate;
    private V originalVersion;
    private int eventsSinceSnapshot;

    private Tracked(final A aggregate, final V originalVersion, final int eventsSinceSnapshot) {
      this.aggregate = aggregate;
      this.originalVersion = originalVersion;
      this.eventsSinceSnapshot = eventsSinceSnapshot;
    }

    private boolean isNew() {
      return originalVersion == null;
    }
  }
}
