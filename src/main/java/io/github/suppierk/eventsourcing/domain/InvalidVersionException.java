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

/** Raised when an aggregate is asked to move to a version which does not follow its current one. */
public class InvalidVersionException extends DomainException {
  @Serial private static final long serialVersionUID = -3145236104657245530L;

  private final transient AggregateVersion<?> currentVersion;
  private final transient AggregateVersion<?> candidateVersion;

  public InvalidVersionException(
      final AggregateVersion<?> currentVersion, final AggregateVersion<?> candidateVersion) {
    super(
        "Version %s cannot follow current version %s"
            .formatted(candidateVersion, currentVersion));
    this.currentVersion = currentVersion;
    this.candidateVersion = candidateVersion;
  }

  public AggregateVersion<?> getCurrentVersion() {
    return currentVersion;
  }

  public AggregateVersion<?> getCandidateVersion() {
    return candidateVersion;
  }
}
