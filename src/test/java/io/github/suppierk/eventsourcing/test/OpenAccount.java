package io.github.suppierk.eventsourcing.test;

import io.github.suppierk.eventsourcing.authorization.AnonymousDomainClient;
import io.github.suppierk.eventsourcing.authorization.DomainClient;
import io.github.suppierk.eventsourcing.messaging.DomainCommand;
import java.util.UUID;

public record OpenAccount(UUID accountId, String owner, DomainClient domainClient)
    implements DomainCommand {
  public OpenAccount(final UUID accountId, final String owner) {
    this(accountId, owner, AnonymousDomainClient.getInstance());
  }
}
