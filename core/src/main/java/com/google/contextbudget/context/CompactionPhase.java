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

/**
 * Phase of a consumer's context with respect to its compaction threshold.
 *
 * <p>{@code COMPACTED} is never observed from outside: a finished compaction folds back into
 * {@link #UNDER_THRESHOLD}, or stays {@link #AT_THRESHOLD} when the kept items alone exceed the
 * target.
 */
public enum CompactionPhase {
  UNDER_THRESHOLD,
  AT_THRESHOLD,
  COMPACTED
}
