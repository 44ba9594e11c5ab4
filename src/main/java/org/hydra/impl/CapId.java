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

import com.google.common.collect.ImmutableSet;

/** Identifies a capability type and the permissions it grants. */
public record CapId(String module, String name, ImmutableSet<String> permissions) {
  public CapId {
    permissions = ImmutableSet.copyOf(permissions);
  }

  public static CapId of(String module, String name) {
    return new CapId(module, name, ImmutableSet.of());
  }

  @Override
  public String toString() {
    return module + "::" + name;
  }
}
