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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.auto.value.AutoValue;
import com.google.contextbudget.JsonBaseModel;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * An item in a consumer's context.
 *
 * <p>Items are created by {@code ContextBudgetService#addToContext} and by compaction, which
 * replaces low-priority items with a single {@link ItemKind#SUMMARY} item. They are immutable.
 */
@AutoValue
@JsonDeserialize(builder = ContextItem.Builder.class)
public abstract class ContextItem extends JsonBaseModel {

  /**
   * Context order: priority descending, then newest first.
   *
   * <p>Items created within the same clock tick are ordered by their sequence number, which makes
   * the order total.
   */
  public static final Comparator<ContextItem> CONTEXT_ORDER =
      Comparator.comparing(ContextItem::priority, Comparator.comparingInt(Priority::level))
          .thenComparing(ContextItem::timestamp)
          .thenComparingLong(ContextItem::sequence)
          .reversed();

  /** Opaque identifier, unique per consumer. */
  @JsonProperty("id")
  public abstract String id();

  @JsonProperty("content")
  public abstract String content();

  @JsonProperty("kind")
  public abstract ItemKind kind();

  @JsonProperty("priority")
  public abstract Priority priority();

  @JsonProperty("timestamp")
  public abstract Instant timestamp();

  /** Estimated size of {@link #content()}. */
  @JsonProperty("tokenCount")
  public abstract int tokenCount();

  /** Whether this item is itself a generated summary. */
  @JsonProperty("summarized")
  public abstract boolean summarized();

  /** Reference to the archive entry holding the originals this item replaced. */
  @JsonProperty("archiveReference")
  public abstract Optional<String> archiveReference();

  /** Insertion order within the consumer's context. */
  @JsonProperty("sequence")
  public abstract long sequence();

  @JsonProperty("metadata")
  public abstract ItemMetadata metadata();

  /** Returns the line used for this item in the rendered model context. */
  public String render() {
    String prefix = summarized() ? ItemKind.SUMMARY.renderPrefix() : kind().renderPrefix();
    return prefix + content();
  }

  public static Builder builder() {
    return new AutoValue_ContextItem.Builder()
        .summarized(false)
        .sequence(0L)
        .metadata(ItemMetadata.empty());
  }

  public abstract Builder toBuilder();

  /**
   * Deserializes a ContextItem from a JSON string.
   *
   * @param json The JSON string to deserialize
   * @return The deserialized ContextItem
   */
  public static ContextItem fromJson(String json) {
    return JsonBaseModel.fromJsonString(json, ContextItem.class);
  }

  /** Builder for {@link ContextItem}. */
  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    static Builder create() {
      return builder();
    }

    @JsonProperty("id")
    @CanIgnoreReturnValue
    public abstract Builder id(String id);

    @JsonProperty("content")
    @CanIgnoreReturnValue
    public abstract Builder content(String content);

    @JsonProperty("kind")
    @CanIgnoreReturnValue
    public abstract Builder kind(ItemKind kind);

    @JsonProperty("priority")
    @CanIgnoreReturnValue
    public abstract Builder priority(Priority priority);

    @JsonProperty("timestamp")
    @CanIgnoreReturnValue
    public abstract Builder timestamp(Instant timestamp);

    @JsonProperty("tokenCount")
    @CanIgnoreReturnValue
    public abstract Builder tokenCount(int tokenCount);

    @JsonProperty("summarized")
    @CanIgnoreReturnValue
    public abstract Builder summarized(boolean summarized);

    @JsonProperty("archiveReference")
    @CanIgnoreReturnValue
    public abstract Builder archiveReference(@Nullable String archiveReference);

    @CanIgnoreReturnValue
    public abstract Builder archiveReference(Optional<String> archiveReference);

    @JsonProperty("sequence")
    @CanIgnoreReturnValue
    public abstract Builder sequence(long sequence);

    @JsonProperty("metadata")
    @CanIgnoreReturnValue
    public abstract Builder metadata(ItemMetadata metadata);

    abstract ContextItem autoBuild();

    /**
     * Builds the item and checks that its metadata is recognized for its kind.
     *
     * @throws IllegalArgumentException if a metadata key is not accepted by the item kind
     */
    public final ContextItem build() {
      ContextItem item = autoBuild();
      item.metadata().checkAllowedFor(item.kind());
      return item;
    }
  }
}
