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

import com.google.contextbudget.context.ContextItem;
import io.reactivex.rxjava3.core.Single;
import java.util.List;

/**
 * Append-only store for context items removed from a consumer's active context.
 *
 * <p>The engine never reads archived content back; it only keeps the returned reference for
 * traceability. Implementations must never overwrite or alter an entry once written.
 */
public interface ArchivalSink {

  /**
   * Writes the given items verbatim as one new archive entry.
   *
   * @param consumerId Consumer the items belong to.
   * @param items Items to archive, in the order they should be preserved.
   * @return A {@link Single} emitting the reference of the new entry, or an error if it could not
   *     be written.
   */
  Single<String> write(String consumerId, List<ContextItem> items);
}
