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

package com.google.contextbudget.context;

import com.google.auto.value.AutoValue;
import java.time.Instant;

/** Records an archive write that did not complete during compaction or clearing. */
@AutoValue
public abstract class ArchiveFailure {

  public abstract Instant timestamp();

  /** Number of items whose originals may not be durably recoverable. */
  public abstract int itemCount();

  public abstract String message();

  public static ArchiveFailure create(Instant timestamp, int itemCount, String message) {
    return new AutoValue_ArchiveFailure(timestamp, itemCount, message);
  }
}
