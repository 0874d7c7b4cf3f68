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

package io.github.suppierk.eventsourcing.domain;

import java.io.Serial;

/**
 * Base class of every error raised by the library.
 *
 * <p>Besides the message, each error tells a transport layer which status to report and whether
 * re-running the whole operation may succeed.
 */
public abstract class DomainException extends RuntimeException {
  @Serial private static final long serialVersionUID = 2263404618096931262L;

  protected DomainException(final String message) {
    super(message);
  }

  protected DomainException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience,
   *     defaults to 500 because most errors here point to programming mistakes
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 500;
  }

  /**
   * @return {@code true} if the operation that failed may succeed when started over
   */
  public boolean isRetryable() {
    return false;
  }
}
