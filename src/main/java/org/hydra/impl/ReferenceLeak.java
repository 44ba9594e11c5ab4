/*
 * Copyright 2025 The Hydra Authors
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

package org.hydra.impl;

import org.hydra.ir.Location;
import org.jspecify.annotations.Nullable;

/**
 * A reference that escapes the scope that owns it. {@code variable} is the variable or expression
 * that leaked; {@code field} is the protected field it refers to, if known.
 */
public record ReferenceLeak(
    Location location,
    ViolationType type,
    String message,
    Severity severity,
    String variable,
    @Nullable String field) {

  @Override
  public String toString() {
    return severity + " " + type + " at " + location + ": " + message;
  }
}
