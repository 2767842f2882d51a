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
import java.util.Locale;

/** The kind of a {@link ContextItem}, supplied by the caller at add time. */
public enum ItemKind {
  /** Text typed or spoken by the user. */
  INPUT("User: "),
  /** A reply produced by the model. */
  REPLY("Assistant: "),
  /** Instructions or state injected by the system. */
  SYSTEM_NOTE("[System] "),
  /** Background knowledge, such as retrieved documents. */
  KNOWLEDGE(""),
  /** A synthetic item produced by compaction. */
  SUMMARY("[Summary] ");

  private final String renderPrefix;

  ItemKind(String renderPrefix) {
    this.renderPrefix = renderPrefix;
  }

  /** Returns the role-style prefix used when the item is rendered into the model context. */
  public String renderPrefix() {
    return renderPrefix;
  }

  @JsonValue
  public String jsonValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ItemKind fromJsonValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
