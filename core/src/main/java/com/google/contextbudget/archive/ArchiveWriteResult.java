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

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** Outcome of an archive write: a reference on success, an error message otherwise. */
@AutoValue
public abstract class ArchiveWriteResult {

  public abstract Optional<String> reference();

  public abstract Optional<String> errorMessage();

  public boolean succeeded() {
    return reference().isPresent();
  }

  public static ArchiveWriteResult success(String reference) {
    return new AutoValue_ArchiveWriteResult(Optional.of(reference), Optional.empty());
  }

  public static ArchiveWriteResult failure(String errorMessage) {
    return new AutoValue_ArchiveWriteResult(Optional.empty(), Optional.of(errorMessage));
  }
}
