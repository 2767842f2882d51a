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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.contextbudget.JsonBaseModel;
import com.google.contextbudget.context.ContextItem;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Instant;
import java.util.List;

/**
 * A write-once record of context items removed from a consumer's active context.
 *
 * <p>The items are stored exactly as they were live, so an entry can be serialized and read back
 * without loss.
 */
@AutoValue
@JsonDeserialize(builder = ArchiveEntry.Builder.class)
public abstract class ArchiveEntry extends JsonBaseModel {

  /** The reference returned to the writer, unique per sink. */
  @JsonProperty("reference")
  public abstract String reference();

  @JsonProperty("consumerId")
  public abstract String consumerId();

  @JsonProperty("timestamp")
  public abstract Instant timestamp();

  @JsonProperty("items")
  public abstract ImmutableList<ContextItem> items();

  /** Sum of the token counts of {@link #items()}. */
  public int totalTokens() {
    return items().stream().mapToInt(ContextItem::tokenCount).sum();
  }

  public static Builder builder() {
    return new AutoValue_ArchiveEntry.Builder();
  }

  public static ArchiveEntry fromJson(String json) {
    return JsonBaseModel.fromJsonString(json, ArchiveEntry.class);
  }

  /** Builder for {@link ArchiveEntry}. */
  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    static Builder create() {
      return builder();
    }

    @JsonProperty("reference")
    @CanIgnoreReturnValue
    public abstract Builder reference(String reference);

    @JsonProperty("consumerId")
    @CanIgnoreReturnValue
    public abstract Builder consumerId(String consumerId);

    @JsonProperty("timestamp")
    @CanIgnoreReturnValue
    public abstract Builder timestamp(Instant timestamp);

    @JsonProperty("items")
    @CanIgnoreReturnValue
    public abstract Builder items(List<ContextItem> items);

    public abstract ArchiveEntry build();
  }
}
