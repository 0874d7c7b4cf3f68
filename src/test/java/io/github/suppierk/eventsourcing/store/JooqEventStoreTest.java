package io.github.suppierk.eventsourcing.store;

import static io.github.suppierk.eventsourcing.test.Futures.failureOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.eventsourcing.domain.ConcurrencyConflictException;
import io.github.suppierk.eventsourcing.domain.DomainEvent;
import io.github.suppierk.eventsourcing.domain.LongVersion;
import io.github.suppierk.eventsourcing.domain.Repository;
import io.github.suppierk.eventsourcing.domain.RepositoryConfiguration;
import io.github.suppierk.eventsourcing.test.Account;
import io.github.suppierk.eventsourcing.test.AccountEvent;
import io.github.suppierk.eventsourcing.test.AccountSnapshot;
import io.github.suppierk.eventsourcing.test.Accounts;
import io.github.suppierk.eventsourcing.uow.UnitOfWorkContext;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.sql.DriverManager;
import java.util.List;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JooqEventStoreTest {
  static final DSLContext DSL_CONTEXT;

  static {
    try {
      final var connection =
          DriverManager.getConnection(
              "jdbc:h2:mem:event_store;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1");
      DSL_CONTEXT = DSL.using(connection, SQLDialect.POSTGRES);

      final var schemaSql =
          String.join(
              "\n",
              Files.readAllLines(
                  Paths.get(
                      JooqEventStoreTest.class
                          .getClassLoader()
                          .getResource("event_store.sql")
                          .toURI())));

      for (String statement : schemaSql.split(";")) {
        if (!statement.isBlank()) {
          connection.prepareStatement(statement).execute();
        }
      }
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }

  final UUID key = UUID.randomUUID();

  JooqEventStore store;
  RepositoryConfiguration<UUID, LongVersion, Account> configuration;

  @BeforeEach
  void setUp() {
    DSL_CONTEXT.truncate(JooqEventStore.EVENTS).execute();
    DSL_CONTEXT.truncate(JooqEventStore.SNAPSHOTS).execute();

    store = new JooqEventStore(DSL_CONTEXT, Accounts.CONTRACTS, Serializer.javaSerialization());
    configuration = Accounts.configuration(store);
  }

  EventToSave<UUID, LongVersion> toSave(final DomainEvent<UUID, LongVersion> event) {
    return new EventToSave<>(Accounts.CONTRACTS.contractOf(event.getClass()), event);
  }

  void openAccount() {
    final UnitOfWorkContext context = UnitOfWorkContext.open();
    final Account account = Account.open(key, "alice");
    account.deposit(100L);
    Repository.of(configuration, context).add(account);
    context.flushAsync().join();
    context.close();
  }

  @Nested
  class Insert {
    @Test
    void events_are_stored_under_their_contract() {
      final var opened = new AccountEvent.Opened(key, LongVersion.of(1L), "alice");

      assertEquals(
          WriteResult.SUCCESS, store.insertEvents(key, List.of(toSave(opened)), null).join());

      final List<String> contracts =
          DSL_CONTEXT
              .select(JooqEventStore.CONTRACT)
              .from(JooqEventStore.EVENTS)
              .where(JooqEventStore.AGGREGATE_KEY.eq(key.toString()))
              .fetch(JooqEventStore.CONTRACT);

      assertEquals(List.of("bank/Opened"), contracts);
      assertEquals(List.of(opened), store.readHistory(key).join());
    }

    @Test
    void inserting_an_existing_stream_is_a_conflict() {
      final var opened = new AccountEvent.Opened(key, LongVersion.of(1L), "alice");
      store.insertEvents(key, List.of(toSave(opened)), null).join();

      final var other = new AccountEvent.Opened(key, LongVersion.of(1L), "bob");

      assertEquals(
          WriteResult.CONFLICT, store.insertEvents(key, List.of(toSave(other)), null).join());
      assertEquals(List.of(opened), store.readHistory(key).join());
    }

    @Test
    void unknown_keys_have_no_history_and_no_snapshot() {
      assertTrue(store.readHistory(UUID.randomUUID()).join().isEmpty());
      assertTrue(store.readSnapshot(UUID.randomUUID()).join().isEmpty());
    }
  }

  @Nested
  class Update {
    @Test
    void appending_at_the_original_version_succeeds() {
      final var opened = new AccountEvent.Opened(key, LongVersion.of(1L), "alice");
      final var deposited = new AccountEvent.Deposited(key, LongVersion.of(2L), 10L);
      store.insertEvents(key, List.of(toSave(opened)), null).join();

      assertEquals(
          WriteResult.SUCCESS,
          store.updateEvents(key, List.of(toSave(deposited)), LongVersion.of(1L), null).join());
      assertEquals(List.of(opened, deposited), store.readHistory(key).join());
    }

    @Test
    void appending_at_a_stale_version_is_a_conflict() {
      final var opened = new AccountEvent.Opened(key, LongVersion.of(1L), "alice");
      final var first = new AccountEvent.Deposited(key, LongVersion.of(2L), 10L);
      final var second = new AccountEvent.Deposited(key, LongVersion.of(2L), 20L);
      store.insertEvents(key, List.of(toSave(opened)), null).join();
      store.updateEvents(key, List.of(toSave(first)), LongVersion.of(1L), null).join();

      assertEquals(
          WriteResult.CONFLICT,
          store.updateEvents(key, List.of(toSave(second)), LongVersion.of(1L), null).join());
      assertEquals(List.of(opened, first), store.readHistory(key).join());
    }

    @Test
    void appending_to_a_missing_stream_is_a_conflict() {
      final var deposited = new AccountEvent.Deposited(key, LongVersion.of(2L), 10L);

      assertEquals(
          WriteResult.CONFLICT,
          store.updateEvents(key, List.of(toSave(deposited)), LongVersion.of(1L), null).join());
    }

    @Test
    void the_latest_snapshot_is_returned() {
      final var opened = new AccountEvent.Opened(key, LongVersion.of(1L), "alice");
      final var deposited = new AccountEvent.Deposited(key, LongVersion.of(2L), 10L);
      final var first = new AccountSnapshot(key, LongVersion.of(1L), "alice", 0L);
      final var second = new AccountSnapshot(key, LongVersion.of(2L), "alice", 10L);
      final String contract = Accounts.CONTRACTS.contractOf(AccountSnapshot.class);

      store
          .insertEvents(key, List.of(toSave(opened)), new SnapshotToSave<>(contract, first, null))
          .join();
      store
          .updateEvents(
              key,
              List.of(toSave(deposited)),
              LongVersion.of(1L),
              new SnapshotToSave<>(contract, second, LongVersion.of(1L)))
          .join();

      assertEquals(second, store.readSnapshot(key).join().orElseThrow());
    }
  }

  @Nested
  class WithRepository {
    @Test
    void aggregates_survive_a_round_trip() {
      openAccount();

      final UnitOfWorkContext context = UnitOfWorkContext.open();
      final Account account = Repository.of(configuration, context).getByIdAsync(key).join();

      assertEquals("alice", account.owner());
      assertEquals(100L, account.balance());
      assertEquals(LongVersion.of(2L), account.version());
    }

    @Test
    void concurrent_units_of_work_conflict_on_the_same_aggregate() {
      openAccount();

      final UnitOfWorkContext first = UnitOfWorkContext.open();
      final UnitOfWorkContext second = UnitOfWorkContext.open();
      final Account fromFirst = Repository.of(configuration, first).getByIdAsync(key).join();
      final Account fromSecond = Repository.of(configuration, second).getByIdAsync(key).join();

      fromFirst.deposit(10L);
      fromSecond.withdraw(10L);

      first.flushAsync().join();
      final var conflict = failureOf(second.flushAsync(), ConcurrencyConflictException.class);

      assertEquals(key, conflict.getKey());
      assertInstanceOf(AccountEvent.Deposited.class, store.readHistory(key).join().get(2));
    }
  }
}
