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

package org.hydra.ir;

import com.google.common.base.Preconditions;

/**
 * A position in contract source: file, 1-based line and column, and a short description of the
 * enclosing construct (usually a function name).
 */
public record Location(String file, int line, int column, String context) {

  /** Used when the IR producer did not supply a position. */
  public static final Location UNKNOWN = new Location("<unknown>", 0, 0, "");

  public Location {
    Preconditions.checkNotNull(file);
    Preconditions.checkNotNull(context);
    Preconditions.checkArgument(line >= 0 && column >= 0);
  }

  /** Returns a copy of this location with a different context. */
  public Location withContext(String newContext) {
    return new Location(file, line, column, newContext);
  }

  @Override
  public String toString() {
    String pos = file + ":" + line + ":" + column;
    return context.isEmpty() ? pos : pos + " (" + context + ")";
  }
}
