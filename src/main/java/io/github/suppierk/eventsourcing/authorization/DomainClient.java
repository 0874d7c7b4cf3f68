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

import java.io.Serializable;

/**
 * Describes who sent a message into the pipeline.
 *
 * <p>Handlers decide whether the client may invoke them via {@code canBeUsedBy}, the library itself
 * does not interpret the role.
 */
public interface DomainClient extends Serializable {
  /**
   * @return assumed client's role within the domain, used for authorization decisions and error
   *     reporting
   */
  String domainRole();
}
