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

import com.google.common.collect.ImmutableList;

/**
 * A {@code use} declaration, e.g. {@code use sui::coin::{Self, Coin}} has full path {@code
 * sui::coin}, module name {@code coin} and members {@code Self, Coin}.
 */
public record Import(String fullPath, String moduleName, ImmutableList<String> members) {
  public Import {
    members = ImmutableList.copyOf(members);
  }

  /** An import of a whole module with no member list. */
  public static Import of(String fullPath, String moduleName) {
    return new Import(fullPath, moduleName, ImmutableList.of());
  }
}
