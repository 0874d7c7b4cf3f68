package io.github.suppierk.eventsourcing.test;

import io.github.suppierk.eventsourcing.authorization.DomainClient;
import io.github.suppierk.eventsourcing.domain.LongVersion;
import io.github.suppierk.eventsourcing.domain.Repository;
import io.github.suppierk.eventsourcing.domain.RepositoryConfiguration;
import io.github.suppierk.eventsourcing.messaging.DomainCommandHandler;
import io.github.suppierk.eventsourcing.uow.UnitOfWorkContext;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/** Refuses {@link AnotherDomainClient}, which only audits accounts. */
public final class OpenAccountHandler extends DomainCommandHandler<OpenAccount> {
  private final RepositoryConfiguration<UUID, LongVersion, Account> accounts;

  public OpenAccountHandler(final RepositoryConfiguration<UUID, LongVersion, Account> accounts) {
    super(OpenAccount.class);
    this.accounts = accounts;
  }

  @Override
  protected boolean canBeUsedBy(final DomainClient domainClient) {
    return !(domainClient instanceof AnotherDomainClient);
  }

  @Override
  protected CompletableFuture<Void> handle(
      final OpenAccount command, final UnitOfWorkContext context) {
    Repository.of(accounts, context).add(Account.open(command.accountId(), command.owner()));
    return CompletableFuture.completedFuture(null);
  }
}
