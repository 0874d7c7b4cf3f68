package io.github.suppierk.eventsourcing.uow;

import static io.github.suppierk.eventsourcing.test.Futures.failureOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.eventsourcing.domain.LongVersion;
import io.github.suppierk.eventsourcing.test.AccountEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UnitOfWorkContextTest {
  static final UUID KEY = UUID.randomUUID();
  static final AccountEvent.Opened OPENED =
      new AccountEvent.Opened(KEY, LongVersion.of(1L), "alice");
  static final AccountEvent.Deposited DEPOSITED =
      new AccountEvent.Deposited(KEY, LongVersion.of(2L), 10L);

  static class RecordingUnit implements UnitOfWork {
    private final String name;
    private final List<String> flushes;
    private final RuntimeException failure;
    private boolean dirty;

    RecordingUnit(final String name, final List<String> flushes) {
      this(name, flushes, null);
    }

    RecordingUnit(final String name, final List<String> flushes, final RuntimeException failure) {
      this.name = name;
      this.flushes = flushes;
      this.failure = failure;
      this.dirty = true;
    }

    @Override
    public boolean requiresFlush() {
      return dirty;
    }

    @Override
    public CompletableFuture<Void> flushAsync() {
      if (failure != null) {
        return CompletableFuture.failedFuture(failure);
      }

      flushes.add(name);
      dirty = false;
      return CompletableFuture.completedFuture(null);
    }
  }

  @Test
  void new_contexts_are_active_and_unique() {
    final UnitOfWorkContext first = UnitOfWorkContext.open();
    final UnitOfWorkContext second = UnitOfWorkContext.open();

    assertEquals(UnitOfWorkState.ACTIVE, first.getState());
    assertNotEquals(first.getId(), second.getId());
    assertFalse(first.requiresFlush());
  }

  @Nested
  class Enlist {
    @Test
    void when_unit_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> UnitOfWorkContext.open().enlist(null));
    }

    @Test
    void enlisting_twice_flushes_once() {
      final List<String> flushes = new ArrayList<>();
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      final RecordingUnit unit = new RecordingUnit("accounts", flushes);

      context.enlist(unit);
      context.enlist(unit);
      context.flushAsync().join();

      assertTrue(context.isEnlisted(unit));
      assertEquals(List.of("accounts"), flushes);
    }

    @Test
    void closed_contexts_reject_new_units() {
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      context.close();

      assertThrows(
          IllegalStateException.class,
          () -> context.enlist(new RecordingUnit("accounts", new ArrayList<>())));
    }
  }

  @Nested
  class Resolve {
    @Test
    void resources_are_created_once_per_context() {
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      final AtomicInteger created = new AtomicInteger();

      final Object first = context.resolve("key", ignored -> created.incrementAndGet());
      final Object second = context.resolve("key", ignored -> created.incrementAndGet());

      assertSame(first, second);
      assertEquals(1, created.get());
    }

    @Test
    void null_resources_are_rejected() {
      final UnitOfWorkContext context = UnitOfWorkContext.open();

      assertThrows(IllegalArgumentException.class, () -> context.resolve(null, ignored -> "x"));
      assertThrows(IllegalArgumentException.class, () -> context.resolve("key", null));
      assertThrows(IllegalStateException.class, () -> context.resolve("key", ignored -> null));
    }
  }

  @Nested
  class Publish {
    @Test
    void events_are_kept_in_publication_order() {
      final UnitOfWorkContext context = UnitOfWorkContext.open();

      context.publish(OPENED);
      context.publish(DEPOSITED);

      assertEquals(List.of(OPENED, DEPOSITED), context.getPublishedEvents());
    }

    @Test
    void discarded_contexts_reject_events() {
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      context.discard();

      assertThrows(IllegalStateException.class, () -> context.publish(OPENED));
      assertThrows(IllegalArgumentException.class, () -> UnitOfWorkContext.open().publish(null));
    }
  }

  @Nested
  class Flush {
    @Test
    void units_are_flushed_in_enlistment_order() {
      final List<String> flushes = new ArrayList<>();
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      context.enlist(new RecordingUnit("first", flushes));
      context.enlist(new RecordingUnit("second", flushes));
      context.enlist(new RecordingUnit("third", flushes));

      assertTrue(context.requiresFlush());
      context.flushAsync().join();

      assertEquals(List.of("first", "second", "third"), flushes);
      assertFalse(context.requiresFlush());
      assertEquals(UnitOfWorkState.ACTIVE, context.getState());
    }

    @Test
    void enlistment_order_holds_for_every_context() {
      final List<String> names = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        names.add("unit-" + i);
      }

      for (int round = 0; round < 50; round++) {
        final List<String> flushes = new ArrayList<>();
        final UnitOfWorkContext context = UnitOfWorkContext.open();
        names.forEach(name -> context.enlist(new RecordingUnit(name, flushes)));

        context.flushAsync().join();

        assertEquals(names, flushes);
      }
    }

    @Test
    void persisted_changes_are_recorded_per_flushed_unit() {
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      context.publish(OPENED);
      context.flushAsync().join();
      assertFalse(context.hasPersistedChanges());

      context.enlist(new RecordingUnit("accounts", new ArrayList<>()));
      context.flushAsync().join();

      assertTrue(context.hasPersistedChanges());
    }

    @Test
    void persisted_changes_survive_a_later_failure() {
      final List<String> flushes = new ArrayList<>();
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      context.enlist(new RecordingUnit("first", flushes));
      context.enlist(new RecordingUnit("second", flushes, new IllegalStateException("offline")));

      failureOf(context.flushAsync(), IllegalStateException.class);

      assertEquals(List.of("first"), flushes);
      assertTrue(context.hasPersistedChanges());
    }

    @Test
    void failure_of_the_first_unit_persists_nothing() {
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      context.enlist(
          new RecordingUnit("first", new ArrayList<>(), new IllegalStateException("offline")));

      failureOf(context.flushAsync(), IllegalStateException.class);

      assertFalse(context.hasPersistedChanges());
    }

    @Test
    void flush_returns_published_events_and_clears_them() {
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      context.publish(OPENED);

      assertEquals(List.of(OPENED), context.flushAsync().join());
      assertTrue(context.getPublishedEvents().isEmpty());
      assertTrue(context.flushAsync().join().isEmpty());
    }

    @Test
    void failure_discards_the_context_but_keeps_earlier_units_flushed() {
      final List<String> flushes = new ArrayList<>();
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      final IllegalStateException failure = new IllegalStateException("disk is full");
      context.enlist(new RecordingUnit("first", flushes));
      context.enlist(new RecordingUnit("second", flushes, failure));
      context.enlist(new RecordingUnit("third", flushes));
      context.publish(OPENED);

      assertSame(failure, failureOf(context.flushAsync(), IllegalStateException.class));
      assertEquals(List.of("first"), flushes);
      assertEquals(UnitOfWorkState.DISCARDED, context.getState());
      assertTrue(context.getPublishedEvents().isEmpty());
      assertThrows(IllegalStateException.class, context::flushAsync);
    }

    @Test
    void cancellation_stops_before_the_next_unit() {
      final List<String> flushes = new ArrayList<>();
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      context.enlist(
          new RecordingUnit("first", flushes) {
            @Override
            public CompletableFuture<Void> flushAsync() {
              context.requestCancellation();
              return super.flushAsync();
            }
          });
      context.enlist(new RecordingUnit("second", flushes));

      failureOf(context.flushAsync(), CancellationException.class);

      assertTrue(context.isCancellationRequested());
      assertEquals(List.of("first"), flushes);
      assertEquals(UnitOfWorkState.DISCARDED, context.getState());
    }
  }

  @Nested
  class Lifecycle {
    @Test
    void discard_drops_everything() {
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      final RecordingUnit unit = new RecordingUnit("accounts", new ArrayList<>());
      context.enlist(unit);
      context.publish(OPENED);

      context.discard();

      assertEquals(UnitOfWorkState.DISCARDED, context.getState());
      assertFalse(context.isEnlisted(unit));
      assertTrue(context.getPublishedEvents().isEmpty());
    }

    @Test
    void close_is_final_and_idempotent() {
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      context.publish(OPENED);

      context.close();
      context.close();
      context.discard();

      assertEquals(UnitOfWorkState.INACTIVE, context.getState());
      assertTrue(context.getPublishedEvents().isEmpty());
    }

    @Test
    void cancellation_can_be_checked_explicitly() {
      final UnitOfWorkContext context = UnitOfWorkContext.open();
      context.throwIfCancellationRequested();

      context.requestCancellation();

      assertThrows(CancellationException.class, context::throwIfCancellationRequested);
    }
  }
}
