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

package io.github.suppierk.eventsourcing.authorization;

import io.github.suppierk.eventsourcing.domain.DomainException;
import java.io.Serial;

/** Raised before a handler runs when its {@code canBeUsedBy} check rejects the message client. */
public class UnauthorizedException extends DomainException {
  @Serial private static final long serialVersionUID = -4431807457286364114L;

  private final DomainClient domainClient;

  /**
   * @param domainClient which was refused
   * @param handlerClass which refused the client
   */
  public UnauthorizedException(final DomainClient domainClient, final Class<?> handlerClass) {
    super(
        "Client with role %s is not allowed to use %s"
            .formatted(
                domainClient == null ? null : domainClient.domainRole(),
                handlerClass == null ? null : handlerClass.getName()));
    this.domainClient = domainClient;
  }

  /**
   * @return the client which was refused
   */
  public DomainClient getDomainClient() {
    return domainClient;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/403">403 Forbidden</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 403;
  }
}
