/*
 * Copyright 2025 Google LLC
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

package com.google.contextbudget.archive;

import com.google.common.collect.ImmutableList;
import com.google.contextbudget.context.ContextItem;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs bounded, blocking writes to an {@link ArchivalSink}.
 *
 * <p>The write is subscribed on {@code scheduler} and abandoned after the given timeout. Sink
 * errors and timeouts are returned as {@link ArchiveWriteResult#failure(String)} and never thrown,
 * so a slow or broken archive cannot stall the caller. An interrupted wait is also returned as a
 * failure, with the thread's interrupt status restored.
 */
public final class ArchiveWriter {

  private static final Logger logger = LoggerFactory.getLogger(ArchiveWriter.class);

  private final ArchivalSink sink;
  private final Scheduler scheduler;

  public ArchiveWriter(ArchivalSink sink) {
    this(sink, Schedulers.io());
  }

  public ArchiveWriter(ArchivalSink sink, Scheduler scheduler) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  /**
   * Archives {@code items} for {@code consumerId}, waiting at most {@code timeout}.
   *
   * @return the reference of the new entry, or the reason the write did not complete
   */
  public ArchiveWriteResult write(String consumerId, List<ContextItem> items, Duration timeout) {
    ImmutableList<ContextItem> snapshot = ImmutableList.copyOf(items);
    try {
      String reference =
          sink.write(consumerId, snapshot)
              .subscribeOn(scheduler)
              .timeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
              .blockingGet();
      if (reference == null || reference.isEmpty()) {
        return ArchiveWriteResult.failure("Archival sink returned an empty reference");
      }
      return ArchiveWriteResult.success(reference);
    } catch (RuntimeException e) {
      if (e.getCause() instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      String message = describe(e, timeout);
      logger.warn(
          "Failed to archive {} items for consumer {}: {}", snapshot.size(), consumerId, message);
      logger.debug("Archive write failure", e);
      return ArchiveWriteResult.failure(message);
    }
  }

  private static String describe(RuntimeException e, Duration timeout) {
    // blockingGet wraps checked exceptions, such as the timeout, in a RuntimeException.
    if (e.getCause() instanceof TimeoutException) {
      return "Archive write timed out after " + timeout.toMillis() + " ms";
    }
    if (e.getCause() instanceof InterruptedException) {
      return "Archive write interrupted";
    }
    if (e.getMessage() != null) {
      return e.getMessage();
    }
    Throwable cause = e.getCause() == null ? e : e.getCause();
    return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
  }
}
