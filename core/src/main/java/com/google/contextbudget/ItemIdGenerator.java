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

package com.google.contextbudget;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/** Generates opaque item identifiers, unique per consumer. */
@FunctionalInterface
public interface ItemIdGenerator {

  /**
   * Returns an identifier for a new item.
   *
   * @param consumerId Consumer the item belongs to.
   * @param content Content of the item.
   * @param timestamp Creation time of the item.
   * @param sequence Insertion sequence of the item within the consumer, unique per consumer.
   */
  String generate(String consumerId, String content, Instant timestamp, long sequence);

  /** Returns a generator producing the first 16 hex characters of a SHA-256 content hash. */
  static ItemIdGenerator contentHash() {
    return (consumerId, content, timestamp, sequence) ->
        Hashing.sha256()
            .newHasher()
            .putString(consumerId, StandardCharsets.UTF_8)
            .putChar('\0')
            .putString(content, StandardCharsets.UTF_8)
            .putChar('\0')
            .putString(timestamp.toString(), StandardCharsets.UTF_8)
            .putLong(sequence)
            .hash()
            .toString()
            .substring(0, 16);
  }
}
