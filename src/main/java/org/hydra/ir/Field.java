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

import org.jspecify.annotations.Nullable;

/**
 * A struct field. {@code invariant} is the field's declared invariant text, or null if it has
 * none.
 */
public record Field(String name, Type type, @Nullable String invariant) {

  public static Field of(String name, Type type) {
    return new Field(name, type, null);
  }

  public boolean hasInvariant() {
    return invariant != null;
  }

  /** True if this field holds an object identity ({@code UID}). */
  public boolean isUid() {
    return type.baseName().equals("UID");
  }
}
