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

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Keys recognized in {@link ItemMetadata}.
 *
 * <p>The set is closed: each key has a fixed value type and a fixed set of item kinds that accept
 * it.
 */
public enum MetadataKey {
  /** Intent label assigned by the upstream classifier. */
  INTENT(String.class, ImmutableSet.of(ItemKind.INPUT)),
  /** BCP 47 language tag of the text. */
  LANGUAGE(String.class, ImmutableSet.of(ItemKind.INPUT, ItemKind.REPLY)),
  /** Model that produced a reply. */
  MODEL(String.class, ImmutableSet.of(ItemKind.REPLY)),
  /** Where a system note or knowledge item came from, e.g. a document path. */
  SOURCE(String.class, ImmutableSet.of(ItemKind.SYSTEM_NOTE, ItemKind.KNOWLEDGE)),
  /** Number of items a summary replaced. */
  COMPACTED_ITEM_COUNT(Integer.class, ImmutableSet.of(ItemKind.SUMMARY)),
  /** Token count of the items a summary replaced. */
  ORIGINAL_TOKENS(Integer.class, ImmutableSet.of(ItemKind.SUMMARY));

  private final Class<?> valueType;
  private final ImmutableSet<ItemKind> allowedKinds;

  MetadataKey(Class<?> valueType, ImmutableSet<ItemKind> allowedKinds) {
    this.valueType = valueType;
    this.allowedKinds = allowedKinds;
  }

  public Class<?> valueType() {
    return valueType;
  }

  public ImmutableSet<ItemKind> allowedKinds() {
    return allowedKinds;
  }

  public boolean isAllowedFor(ItemKind kind) {
    return allowedKinds.contains(kind);
  }

  /** Name of the key in serialized form, e.g. {@code compacted_item_count}. */
  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }

  static Optional<MetadataKey> fromJsonName(String jsonName) {
    return Arrays.stream(values()).filter(k -> k.jsonName().equals(jsonName)).findFirst();
  }
}
