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
 * Class to answer a specific {@link DomainQuery}.
 *
 * <p>The given {@link UnitOfWorkContext} is discarded afterwards: events published by aggregates
 * while answering a query are never persisted.
 *
 * @param <QUERY> the type of the particular {@link DomainQuery}
 * @param <RESULT> the type of the query result
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract non-sealed class DomainQueryHandler<QUERY extends DomainQuery<RESULT>, RESULT>
    extends DomainHandler<QUERY> {
  protected DomainQueryHandler(final Class<QUERY> queryClass) {
    super(queryClass);
  }

  /**
   * @param query to answer
   * @param context to resolve repositories from
   * @return future of the query result
   * @throws Exception if any error occurs during the execution of the query.
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  protected abstract CompletableFuture<RESULT> execute(
      final QUERY query, final UnitOfWorkContext context) throws Exception;

  /**
   * @param query to answer
   * @param context to answer the query in
   * @return future of the query result
   */
  public final CompletableFuture<RESULT> runInContext(
      final QUERY query, final UnitOfWorkContext context) {
    verifyInvocation(query, context);
    return completeFrom(Try.of(() -> execute(query, context)), "Query handler future");
  }
}
