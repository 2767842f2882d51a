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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Immutable, typed metadata attached to a {@link ContextItem}.
 *
 * <p>Only the keys of {@link MetadataKey} can be stored, each with its declared value type. Whether
 * a key is accepted by a given item kind is checked with {@link #checkAllowedFor(ItemKind)} when the
 * item is created.
 */
public final class ItemMetadata {

  private static final ItemMetadata EMPTY = new ItemMetadata(ImmutableMap.of());

  private final ImmutableMap<MetadataKey, Object> values;

  private ItemMetadata(ImmutableMap<MetadataKey, Object> values) {
    this.values = values;
  }

  public static ItemMetadata empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the value stored under {@code key}, cast to {@code type}. */
  public <T> Optional<T> get(MetadataKey key, Class<T> type) {
    if (!type.equals(key.valueType())) {
      throw new IllegalArgumentException(
          String.format("Metadata key %s holds %s, not %s", key, key.valueType(), type));
    }
    return Optional.ofNullable(values.get(key)).map(type::cast);
  }

  public Optional<String> getString(MetadataKey key) {
    return get(key, String.class);
  }

  public Optional<Integer> getInt(MetadataKey key) {
    return get(key, Integer.class);
  }

  public boolean contains(MetadataKey key) {
    return values.containsKey(key);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public ImmutableMap<MetadataKey, Object> asMap() {
    return values;
  }

  /**
   * Verifies that every key present is accepted by {@code kind}.
   *
   * @throws IllegalArgumentException if a key is not recognized for the kind
   */
  public void checkAllowedFor(ItemKind kind) {
    for (MetadataKey key : values.keySet()) {
      if (!key.isAllowedFor(kind)) {
        throw new IllegalArgumentException(
            String.format(
                "Metadata key %s is not recognized for %s items, allowed kinds: %s",
                key, kind, key.allowedKinds()));
      }
    }
  }

  @JsonValue
  Map<String, Object> toJsonMap() {
    Map<String, Object> json = new LinkedHashMap<>();
    values.forEach((key, value) -> json.put(key.jsonName(), value));
    return json;
  }

  @JsonCreator
  static ItemMetadata fromJsonMap(@Nullable Map<String, Object> json) {
    if (json == null || json.isEmpty()) {
      return EMPTY;
    }
    Builder builder = builder();
    json.forEach(
        (name, value) -> {
          MetadataKey key =
              MetadataKey.fromJsonName(name)
                  .orElseThrow(
                      () -> new IllegalArgumentException("Unknown metadata key: " + name));
          if (key.valueType().equals(Integer.class) && value instanceof Number number) {
            builder.putValue(key, number.intValue());
          } else {
            builder.putValue(key, value);
          }
        });
    return builder.build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof ItemMetadata other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "ItemMetadata" + values;
  }

  /** Builder for {@link ItemMetadata}. */
  public static final class Builder {
    private final EnumMap<MetadataKey, Object> values = new EnumMap<>(MetadataKey.class);

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder put(MetadataKey key, String value) {
      return putValue(key, value);
    }

    @CanIgnoreReturnValue
    public Builder put(MetadataKey key, int value) {
      return putValue(key, value);
    }

    @CanIgnoreReturnValue
    Builder putValue(MetadataKey key, Object value) {
      Objects.requireNonNull(key, "key cannot be null");
      Objects.requireNonNull(value, "value cannot be null");
      if (!key.valueType().isInstance(value)) {
        throw new IllegalArgumentException(
            String.format(
                "Metadata key %s expects %s, got: %s",
                key, key.valueType().getSimpleName(), value.getClass().getSimpleName()));
      }
      values.put(key, value);
      return this;
    }

    public ItemMetadata build() {
      return values.isEmpty() ? EMPTY : new ItemMetadata(ImmutableMap.copyOf(values));
    }
  }
}
