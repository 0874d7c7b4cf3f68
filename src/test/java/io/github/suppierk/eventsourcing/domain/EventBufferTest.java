package io.github.suppierk.eventsourcing.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.eventsourcing.test.AccountEvent;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class EventBufferTest {
  static final UUID KEY = UUID.randomUUID();

  @Test
  void when_key_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new EventBuffer<UUID, LongVersion>(null));
  }

  @Test
  void events_are_kept_in_append_order() {
    final EventBuffer<UUID, LongVersion> buffer = new EventBuffer<>(KEY);
    final var first = new AccountEvent.Opened(KEY, LongVersion.of(1L), "alice");
    final var second = new AccountEvent.Deposited(KEY, LongVersion.of(2L), 10L);

    buffer.append(first);
    buffer.append(second);

    assertEquals(List.of(first, second), buffer.events());
    assertEquals(Optional.of(LongVersion.of(2L)), buffer.lastVersion());
    assertEquals(2, buffer.size());
  }

  @Test
  void event_of_another_key_is_rejected() {
    final EventBuffer<UUID, LongVersion> buffer = new EventBuffer<>(KEY);

    assertThrows(
        InvalidKeyException.class,
        () -> buffer.append(new AccountEvent.Opened(UUID.randomUUID(), LongVersion.of(1L), "bob")));
    assertTrue(buffer.isEmpty());
  }

  @Test
  void event_which_does_not_advance_the_version_is_rejected() {
    final EventBuffer<UUID, LongVersion> buffer = new EventBuffer<>(KEY);
    buffer.append(new AccountEvent.Deposited(KEY, LongVersion.of(2L), 10L));

    assertThrows(
        InvalidVersionException.class,
        () -> buffer.append(new AccountEvent.Deposited(KEY, LongVersion.of(2L), 10L)));
    assertEquals(1, buffer.size());
  }

  @Test
  void drain_returns_events_and_empties_the_buffer() {
    final EventBuffer<UUID, LongVersion> buffer = new EventBuffer<>(KEY);
    final var event = new AccountEvent.Opened(KEY, LongVersion.of(1L), "alice");
    buffer.append(event);

    assertEquals(List.of(event), buffer.drain());
    assertTrue(buffer.isEmpty());
    assertEquals(Optional.empty(), buffer.lastVersion());
  }

  @Test
  void events_view_is_read_only() {
    final EventBuffer<UUID, LongVersion> buffer = new EventBuffer<>(KEY);

    assertThrows(
        UnsupportedOperationException.class,
        () -> buffer.events().add(new AccountEvent.Opened(KEY, LongVersion.of(1L), "alice")));
  }
}
