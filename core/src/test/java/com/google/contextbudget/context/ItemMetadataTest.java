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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ItemMetadataTest {

  @Test
  public void builder_storesTypedValues() {
    ItemMetadata metadata =
        ItemMetadata.builder()
            .put(MetadataKey.COMPACTED_ITEM_COUNT, 10)
            .put(MetadataKey.ORIGINAL_TOKENS, 800)
            .build();

    assertThat(metadata.getInt(MetadataKey.COMPACTED_ITEM_COUNT)).hasValue(10);
    assertThat(metadata.getInt(MetadataKey.ORIGINAL_TOKENS)).hasValue(800);
    assertThat(metadata.contains(MetadataKey.INTENT)).isFalse();
    assertThat(metadata.getString(MetadataKey.INTENT)).isEmpty();
  }

  @Test
  public void builder_wrongValueType_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ItemMetadata.builder().put(MetadataKey.INTENT, 3));
    assertThrows(
        IllegalArgumentException.class,
        () -> ItemMetadata.builder().put(MetadataKey.ORIGINAL_TOKENS, "many"));
  }

  @Test
  public void get_wrongType_throws() {
    ItemMetadata metadata = ItemMetadata.builder().put(MetadataKey.INTENT, "file.open").build();

    assertThrows(
        IllegalArgumentException.class, () -> metadata.getInt(MetadataKey.INTENT));
  }

  @Test
  public void checkAllowedFor_acceptsRecognizedKeys() {
    ItemMetadata metadata =
        ItemMetadata.builder()
            .put(MetadataKey.INTENT, "file.open")
            .put(MetadataKey.LANGUAGE, "en-US")
            .build();

    metadata.checkAllowedFor(ItemKind.INPUT);
  }

  @Test
  public void checkAllowedFor_rejectsKeyOfOtherKind() {
    ItemMetadata metadata = ItemMetadata.builder().put(MetadataKey.MODEL, "local-7b").build();

    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> metadata.checkAllowedFor(ItemKind.INPUT));

    assertThat(e).hasMessageThat().contains("MODEL");
  }

  @Test
  public void empty_isSharedAndEmpty() {
    assertThat(ItemMetadata.empty().isEmpty()).isTrue();
    assertThat(ItemMetadata.builder().build()).isSameInstanceAs(ItemMetadata.empty());
  }

  @Test
  public void equality_dependsOnValues() {
    ItemMetadata first = ItemMetadata.builder().put(MetadataKey.SOURCE, "manual.md").build();
    ItemMetadata second = ItemMetadata.builder().put(MetadataKey.SOURCE, "manual.md").build();

    assertThat(first).isEqualTo(second);
    assertThat(first.hashCode()).isEqualTo(second.hashCode());
  }
}
