package io.github.suppierk.eventsourcing.messaging;

import static io.github.suppierk.eventsourcing.test.Futures.failureOf;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.eventsourcing.authorization.DomainClient;
import io.github.suppierk.eventsourcing.authorization.UnauthorizedException;
import io.github.suppierk.eventsourcing.domain.LongVersion;
import io.github.suppierk.eventsourcing.test.AccountEvent;
import io.github.suppierk.eventsourcing.test.AnotherDomainClient;
import io.github.suppierk.eventsourcing.uow.UnitOfWorkContext;
import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainHandlerTest {
  record PlainCommand(DomainClient domainClient) implements DomainCommand {}

  record PlainQuery() implements DomainQuery<String> {}

  static final class PlainCommandHandler extends DomainCommandHandler<PlainCommand> {
    private final CompletableFuture<Void> outcome;

    PlainCommandHandler(final CompletableFuture<Void> outcome) {
      super(PlainCommand.class);
      this.outcome = outcome;
    }

    @Override
    protected boolean canBeUsedBy(final DomainClient domainClient) {
      return !(domainClient instanceof AnotherDomainClient);
    }

    @Override
    protected CompletableFuture<Void> handle(
        final PlainCommand command, final UnitOfWorkContext context) {
      return outcome;
    }
  }

  static final class ThrowingCommandHandler extends DomainCommandHandler<PlainCommand> {
    ThrowingCommandHandler() {
      super(PlainCommand.class);
    }

    @Override
    protected CompletableFuture<Void> handle(
        final PlainCommand command, final UnitOfWorkContext context) throws IOException {
      throw new IOException("Disk is gone");
    }
  }

  static final class OpenedHandler extends DomainEventHandler<AccountEvent.Opened> {
    OpenedHandler() {
      super(AccountEvent.Opened.class);
    }

    @Override
    protected CompletableFuture<Void> handle(
        final AccountEvent.Opened event, final UnitOfWorkContext context) {
      return CompletableFuture.completedFuture(null);
    }
  }

  static final class PlainQueryHandler extends DomainQueryHandler<PlainQuery, String> {
    PlainQueryHandler() {
      super(PlainQuery.class);
    }

    @Override
    protected CompletableFuture<String> execute(
        final PlainQuery query, final UnitOfWorkContext context) {
      return CompletableFuture.completedFuture("answer");
    }
  }

  @Nested
  class Create {
    @Test
    void when_message_class_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new DomainCommandHandler<PlainCommand>(null) {
                @Override
                protected CompletableFuture<Void> handle(
                    final PlainCommand command, final UnitOfWorkContext context) {
                  return CompletableFuture.completedFuture(null);
                }
              });
    }

    @Test
    void when_message_class_is_present_it_is_exposed() {
      assertEquals(PlainCommand.class, new ThrowingCommandHandler().getMessageClass());
      assertEquals(AccountEvent.Opened.class, new OpenedHandler().getMessageClass());
      assertEquals(PlainQuery.class, new PlainQueryHandler().getMessageClass());
    }

    @Test
    void to_string_names_the_handler_and_the_message() {
      assertEquals("OpenedHandler{message=Opened}", new OpenedHandler().toString());
    }
  }

  @Nested
  class RunInContext {
    final UnitOfWorkContext context = UnitOfWorkContext.open();
    final PlainCommand command = new PlainCommand(AnotherDomainClient.getInstance());

    @Test
    void when_arguments_are_null_illegal_argument_exception_is_thrown() {
      final PlainCommandHandler handler =
          new PlainCommandHandler(CompletableFuture.completedFuture(null));

      assertThrows(IllegalArgumentException.class, () -> handler.runInContext(null, context));
      assertThrows(
          IllegalArgumentException.class,
          () -> new OpenedHandler().runInContext(null, context));
      assertThrows(
          IllegalArgumentException.class,
          () -> new PlainQueryHandler().runInContext(new PlainQuery(), null));
    }

    @Test
    void when_domain_client_is_null_illegal_state_exception_is_thrown() {
      final PlainCommandHandler handler =
          new PlainCommandHandler(CompletableFuture.completedFuture(null));

      assertThrows(
          IllegalStateException.class, () -> handler.runInContext(new PlainCommand(null), context));
    }

    @Test
    void when_domain_client_is_refused_unauthorized_exception_is_thrown() {
      final PlainCommandHandler handler =
          new PlainCommandHandler(CompletableFuture.completedFuture(null));

      final UnauthorizedException exception =
          assertThrows(UnauthorizedException.class, () -> handler.runInContext(command, context));

      assertSame(AnotherDomainClient.getInstance(), exception.getDomainClient());
      assertEquals(403, exception.getStatusCode());
    }

    @Test
    void when_handler_throws_the_future_fails_with_the_same_exception() {
      final CompletableFuture<Void> result =
          assertDoesNotThrow(() -> new ThrowingCommandHandler().runInContext(command, context));

      assertEquals("Disk is gone", failureOf(result, IOException.class).getMessage());
    }

    @Test
    void when_handler_returns_null_future_it_fails_with_illegal_state_exception() {
      final PlainCommandHandler handler = new PlainCommandHandler(null);
      final PlainCommand allowed = new PlainCommand(() -> "TELLER");

      failureOf(handler.runInContext(allowed, context), IllegalStateException.class);
    }

    @Test
    void handler_outcome_is_forwarded() {
      final CompletableFuture<Void> outcome = new CompletableFuture<>();
      final PlainCommandHandler handler = new PlainCommandHandler(outcome);
      final PlainCommand allowed = new PlainCommand(() -> "TELLER");

      final CompletableFuture<Void> result = handler.runInContext(allowed, context);
      assertFalse(result.isDone());

      outcome.complete(null);
      assertDoesNotThrow(result::join);
    }

    @Test
    void events_and_queries_run_for_anonymous_clients() {
      final AccountEvent.Opened opened =
          new AccountEvent.Opened(UUID.randomUUID(), LongVersion.of(1L), "alice");

      assertDoesNotThrow(() -> new OpenedHandler().runInContext(opened, context).join());
      assertEquals(
          "answer", new PlainQueryHandler().runInContext(new PlainQuery(), context).join());
    }
  }
}
