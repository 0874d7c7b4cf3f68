package io.github.suppierk.eventsourcing.test;

import io.github.suppierk.eventsourcing.messaging.DomainQuery;
import java.util.UUID;

public record GetBalance(UUID accountId) implements DomainQuery<Long> {}
