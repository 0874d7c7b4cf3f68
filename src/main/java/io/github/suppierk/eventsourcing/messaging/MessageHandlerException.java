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

import io.github.suppierk.eventsourcing.domain.DomainException;
import java.io.Serial;

/**
 * Raised when a handler fails. The original error is the cause and decides the status code and
 * whether a retry makes sense.
 */
public class MessageHandlerException extends DomainException {
  @Serial private static final long serialVersionUID = 1284016749025530361L;

  private final Class<?> messageClass;
  private final Class<?> handlerClass;
  private final MessageHandlingStage stage;

  public MessageHandlerException(
      final Class<?> messageClass,
      final Class<?> handlerClass,
      final MessageHandlingStage stage,
      final Throwable cause) {
    super(
        "%s failed to handle %s while %s: %s"
            .formatted(
                handlerClass.getSimpleName(),
                messageClass.getSimpleName(),
                stage,
                cause == null ? null : cause.getMessage()),
        cause);
    this.messageClass = messageClass;
    this.handlerClass = handlerClass;
    this.stage = stage;
  }

  public Class<?> getMessageClass() {
    return messageClass;
  }

  public Class<?> getHandlerClass() {
    return handlerClass;
  }

  public MessageHandlingStage getStage() {
    return stage;
  }

  @Override
  public int getStatusCode() {
    return getCause() instanceof DomainException cause
        ? cause.getStatusCode()
        : super.getStatusCode();
  }

  @Override
  public boolean isRetryable() {
    return getCause() instanceof DomainException cause && cause.isRetryable();
  }
}
