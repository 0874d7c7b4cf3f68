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

/**
 * Defines general contract rules used by the codebase.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's assume that we keep a ledger of a bank account:
 *
 * <ul>
 *   <li>The account holder is a {@link io.github.suppierk.eventsourcing.authorization.DomainClient}
 *       - they can ask the bank to change or report the account.
 *   <li>The account itself is an {@link io.github.suppierk.eventsourcing.domain.AggregateRoot}:
 *       <ul>
 *         <li>Its balance is never stored directly, the ledger lines are. Each line is a {@link
 *             io.github.suppierk.eventsourcing.domain.DomainEvent} like {@code MoneyDeposited},
 *             and the balance is what you get by reading the ledger from the first line on.
 *         <li>The holder changes the account via {@link
 *             io.github.suppierk.eventsourcing.messaging.DomainCommand}s: a {@code Deposit}
 *             command makes the account append a {@code MoneyDeposited} line.
 *         <li>The holder inspects the account via {@link
 *             io.github.suppierk.eventsourcing.messaging.DomainQuery}s: a {@code GetBalance} query
 *             reads the ledger and reports the sum.
 *       </ul>
 *   <li>A teller working on one request at a time is a {@link
 *       io.github.suppierk.eventsourcing.uow.UnitOfWorkContext}: they fetch the ledgers they need
 *       through a {@link io.github.suppierk.eventsourcing.domain.Repository}, write new lines and
 *       file them all when the request is done. If someone else filed lines in the meantime, the
 *       teller's lines are refused with a {@link
 *       io.github.suppierk.eventsourcing.domain.ConcurrencyConflictException}.
 *   <li>Other departments react to filed lines via {@link
 *       io.github.suppierk.eventsourcing.messaging.DomainEventHandler}s: an opened account may
 *       trigger a welcome bonus deposit, which in turn is filed and dispatched before the request
 *       is reported as done.
 *   <li>The bank's routing of requests to tellers and departments is the {@link
 *       io.github.suppierk.eventsourcing.messaging.MessageHandlerPipeline}.
 * </ul>
 */
package io.github.suppierk.eventsourcing.messaging;
