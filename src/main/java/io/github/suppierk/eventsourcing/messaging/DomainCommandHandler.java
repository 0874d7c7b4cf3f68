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

import io.github.suppierk.eventsourcing.uow.UnitOfWorkContext;
import io.github.suppierk.java.Try;
import java.util.concurrent.CompletableFuture;

/**
 * Class to accept and process a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li>Assert that the client of the command can invoke the handler.
 *   <li>Load or create aggregates through repositories of the given {@link UnitOfWorkContext}.
 *   <li>Invoke aggregate behaviour, which publishes events.
 * </ul>
 *
 * <p>Persisting the published events is not the handler's concern: the pipeline flushes the unit of
 * work once the handler completed.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract non-sealed class DomainCommandHandler<COMMAND extends DomainCommand>
    extends DomainHandler<COMMAND> {
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    super(commandClass);
  }

  /**
   * Business logic of the command.
   *
   * @param command to handle
   * @param context to resolve repositories from
   * @return future completing once the command was handled
   * @throws Exception if any error occurs during the execution of the command.
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  protected abstract CompletableFuture<Void> handle(
      final COMMAND command, final UnitOfWorkContext context) throws Exception;

  /**
   * @param command to handle
   * @param context to handle the command in
   * @return future of the handler outcome, failures of the handler body complete it exceptionally
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   * @throws io.github.suppierk.eventsourcing.authorization.UnauthorizedException if the command
   *     client is not allowed to use this handler
   */
  public final CompletableFuture<Void> runInContext(
      final COMMAND command, final UnitOfWorkContext context) {
    verifyInvocation(command, context);
    return completeFrom(Try.of(() -> handle(command, context)), "Command handler future");
  }
}
