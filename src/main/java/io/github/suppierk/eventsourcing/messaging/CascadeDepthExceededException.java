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
 * Raised when events keep producing events beyond {@link PipelineOptions#maxCascadeDepth()}, which
 * usually means two handlers trigger each other.
 */
public class CascadeDepthExceededException extends DomainException {
  @Serial private static final long serialVersionUID = 4501771937287320926L;

  private final int maxCascadeDepth;

  public CascadeDepthExceededException(final int maxCascadeDepth, final Class<?> eventClass) {
    super(
        "Dispatching %s would exceed the maximum cascade depth of %d"
            .formatted(eventClass.getName(), maxCascadeDepth));
    this.maxCascadeDepth = maxCascadeDepth;
  }

  public int getMaxCascadeDepth() {
    return maxCascadeDepth;
  }
}
