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

package io.github.suppierk.eventsourcing.messaging;

import io.github.suppierk.eventsourcing.authorization.DomainClient;
import io.github.suppierk.eventsourcing.authorization.UnauthorizedException;
import io.github.suppierk.eventsourcing.uow.UnitOfWorkContext;

/**
 * Defines some of the common functionalities defined for handlers.
 *
 * @param <MESSAGE> supported by the current handler
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
abstract sealed class DomainHandler<MESSAGE extends DomainMessage> extends Suspicious
    permits DomainCommandHandler, DomainEventHandler, DomainQueryHandler {
  private final Class<MESSAGE> messageClass;

  protected DomainHandler(final Class<MESSAGE> messageClass) {
    this.messageClass = throwIllegalArgumentIfNull(messageClass, "Message class");
  }

  /**
   * @param domainClient sending the message
   * @return {@code true} if the client can invoke current handler, {@code false} otherwise
   */
  protected boolean canBeUsedBy(final DomainClient domainClient) {
    return true;
  }

  /**
   * @return the exact message class this handler is registered for
   */
  public final Class<MESSAGE> getMessageClass() {
    return messageClass;
  }

  /**
   * Checks arguments and authorization before the handler body runs.
   *
   * @param message to handle
   * @param context to handle the message in
   * @throws UnauthorizedException if {@link #canBeUsedBy(DomainClient)} refused the client
   */
  final void verifyInvocation(final MESSAGE message, final UnitOfWorkContext context) {
    throwIllegalArgumentIfNull(message, messageClass.getSimpleName());
    throwIllegalArgumentIfNull(context, "Unit of work context");

    final DomainClient domainClient =
        throwIllegalStateIfNull(message.domainClient(), "Message domain client");
    if (!canBeUsedBy(domainClient)) {
      throw new UnauthorizedException(domainClient, getClass());
    }
  }

  @Override
  public String toString() {
    return "%s{message=%s}".formatted(getClass().getSimpleName(), messageClass.getSimpleName());
  }
}
