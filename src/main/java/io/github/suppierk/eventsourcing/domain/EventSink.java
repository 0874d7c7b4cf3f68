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

/** Receives events at the moment aggregates publish them. */
public interface EventSink {
  /**
   * @return an instance of sink which does not perform any operations
   */
  static EventSink empty() {
    return NoOp.INSTANCE;
  }

  /**
   * @param event which was just published
   */
  void publish(final DomainEvent<?, ?> event);

  /** Default sink of aggregates not attached to a unit of work yet */
  final class NoOp implements EventSink {
    private static final EventSink INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void publish(final DomainEvent<?, ?> event) {
      // Do nothing
    }
  }
}
