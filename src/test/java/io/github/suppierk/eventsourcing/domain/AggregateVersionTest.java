package io.github.suppierk.eventsourcing.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class AggregateVersionTest {
  @Test
  void when_current_version_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(
        IllegalArgumentException.class,
        () -> AggregateVersion.requireNewer(null, LongVersion.of(1L)));
  }

  @Test
  void when_candidate_version_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(
        IllegalArgumentException.class,
        () -> AggregateVersion.requireNewer(LongVersion.of(1L), null));
  }

  @Test
  void greater_candidate_is_accepted() {
    assertEquals(
        LongVersion.of(7L), AggregateVersion.requireNewer(LongVersion.of(3L), LongVersion.of(7L)));
  }

  @Test
  void equal_candidate_is_rejected_with_both_versions_reported() {
    final InvalidVersionException exception =
        assertThrows(
            InvalidVersionException.class,
            () -> AggregateVersion.requireNewer(LongVersion.of(3L), LongVersion.of(3L)));

    assertEquals(LongVersion.of(3L), exception.getCurrentVersion());
    assertEquals(LongVersion.of(3L), exception.getCandidateVersion());
  }

  @Test
  void smaller_candidate_is_rejected() {
    final InvalidVersionException exception =
        assertThrows(
            InvalidVersionException.class,
            () -> AggregateVersion.requireNewer(LongVersion.of(3L), LongVersion.of(2L)));

    assertEquals(LongVersion.of(3L), exception.getCurrentVersion());
    assertEquals(LongVersion.of(2L), exception.getCandidateVersion());
    assertEquals(500, exception.getStatusCode());
  }
}
