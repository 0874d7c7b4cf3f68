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
 * Raised when a message cannot be routed: a command or query type has no handler or more than one.
 */
public class MessageHandlerConfigurationException extends DomainException {
  @Serial private static final long serialVersionUID = -8390614275160437466L;

  private final Class<?> messageClass;

  public MessageHandlerConfigurationException(final Class<?> messageClass, final String message) {
    super(message);
    this.messageClass = messageClass;
  }

  static MessageHandlerConfigurationException noHandler(final Class<?> messageClass) {
    return new MessageHandlerConfigurationException(
        messageClass, "No handler registered for %s".formatted(messageClass.getName()));
  }

  static MessageHandlerConfigurationException multipleHandlers(
      final Class<?> messageClass, final int handlerCount) {
    return new MessageHandlerConfigurationException(
        messageClass,
        "%d handlers registered for %s, expected exactly one"
            .formatted(handlerCount, messageClass.getName()));
  }

  public Class<?> getMessageClass() {
    return messageClass;
  }
}
