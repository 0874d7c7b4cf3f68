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

import io.github.suppierk.java.Try;
import java.util.concurrent.CompletableFuture;

/** Common checks for the values user code hands over to the library. */
abstract sealed class Suspicious
    permits DomainHandler, MessageHandlerPipeline, MessageHandlerRegistry.Builder {
  /**
   * This method must be used whenever we deal with values produced by user code or properties of
   * arguments.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the value name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(T value, String whatMustNotBeNull)
      throws IllegalStateException {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * This method must be used whenever we deal with method arguments only.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(T value, String whatMustNotBeNull)
      throws IllegalArgumentException {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * Turns an invocation of user code into a future, so that synchronous throws and {@code null}
   * futures are reported the same way as asynchronous failures.
   *
   * @param invocation of the user code returning a future
   * @param whatMustNotBeNull is the name of the returned future
   * @param <T> is the type of the future value
   * @return future completing with the outcome of the invocation
   */
  protected final <T> CompletableFuture<T> completeFrom(
      final Try<CompletableFuture<T>> invocation, final String whatMustNotBeNull) {
    final CompletableFuture<T> result = new CompletableFuture<>();

    invocation.ifSuccess(
        future -> {
          if (future == null) {
            result.completeExceptionally(
                new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull)));
            return;
          }

          future.whenComplete(
              (value, error) -> {
                if (error != null) {
                  result.completeExceptionally(error);
                } else {
                  result.complete(value);
                }
              });
        });

    invocation.ifFailure(result::completeExceptionally);

    return result;
  }
}
