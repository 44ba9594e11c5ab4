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

import com.google.common.collect.ImmutableList;

/**
 * A safety property checked by the {@link SafetyVerifier}. Properties are registered before
 * verification starts and do not change during it.
 */
public interface Property {

  /**
   * Calls to a function named {@code name} require a local check; {@code condition} describes it
   * and must be non-empty for the property to hold.
   */
  record LocalProperty(String name, String invariant, String scope, String condition)
      implements Property {
    public boolean holds() {
      return !condition.isEmpty();
    }
  }

  /** No call whose name contains {@code resource} may exist; the paths name how it is forbidden. */
  record UnreachableProperty(String resource, ImmutableList<String> forbiddenPaths)
      implements Property {
    public UnreachableProperty {
      forbiddenPaths = ImmutableList.copyOf(forbiddenPaths);
    }
  }

  /** Holds only if both its local property and its unreachability property hold. */
  record StrongProperty(LocalProperty local, UnreachableProperty unreachable) implements Property {}
}
