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

/**
 * Tuning of the {@link MessageHandlerPipeline}.
 *
 * @param maxCascadeDepth how many generations of events a single inbound message may produce
 * @param maxConflictRetries how many times an operation failing with a retryable error is started
 *     over with a fresh unit of work, as long as the failed attempt persisted nothing
 * @param verifyHandlersOnStartup whether the pipeline rejects registries with ambiguous command or
 *     query handlers upfront
 */
public record PipelineOptions(
    int maxCascadeDepth, int maxConflictRetries, boolean verifyHandlersOnStartup) {
  public static final int DEFAULT_MAX_CASCADE_DEPTH = 16;

  public PipelineOptions {
    if (maxCascadeDepth < 1) {
      throw new IllegalArgumentException(
          "Maximum cascade depth must be positive, got %d".formatted(maxCascadeDepth));
    }

    if (maxConflictRetries < 0) {
      throw new IllegalArgumentException(
          "Maximum conflict retries cannot be negative, got %d".formatted(maxConflictRetries));
    }
  }

  /**
   * @return default options: bounded cascades, no retries, handlers verified on startup
   */
  public static PipelineOptions defaults() {
    return new PipelineOptions(DEFAULT_MAX_CASCADE_DEPTH, 0, true);
  }

  public PipelineOptions withMaxCascadeDepth(final int depth) {
    return new PipelineOptions(depth, maxConflictRetries, verifyHandlersOnStartup);
  }

  public PipelineOptions withMaxConflictRetries(final int retries) {
    return new PipelineOptions(maxCascadeDepth, retries, verifyHandlersOnStartup);
  }

  public PipelineOptions withVerifyHandlersOnStartup(final boolean verify) {
    return new PipelineOptions(maxCascadeDepth, maxConflictRetries, verify);
  }
}
