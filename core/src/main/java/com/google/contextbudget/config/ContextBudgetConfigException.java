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

package com.google.contextbudget.config;

/**
 * Thrown when a {@link ContextBudgetConfig} is invalid.
 *
 * <p>This is the only failure surfaced to callers by the library: it is raised at configuration
 * time and is fatal to that consumer's setup.
 */
public class ContextBudgetConfigException extends IllegalArgumentException {

  public ContextBudgetConfigException(String message) {
    super(message);
  }

  public ContextBudgetConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
