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

import io.github.suppierk.eventsourcing.authorization.AnonymousDomainClient;
import io.github.suppierk.eventsourcing.authorization.DomainClient;
import java.io.Serializable;

/**
 * Anything which can be dispatched through the {@link MessageHandlerPipeline}.
 *
 * <p>Messages are expected to be immutable, which makes {@code record}s the natural choice.
 *
 * @see DomainCommand
 * @see DomainQuery
 * @see io.github.suppierk.eventsourcing.domain.DomainEvent
 */
public interface DomainMessage extends Serializable {
  /**
   * @return the client on whose behalf the message is dispatched
   */
  default DomainClient domainClient() {
    return AnonymousDomainClient.getInstance();
  }
}
