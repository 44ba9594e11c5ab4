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

/**
 * A fact known to hold on every execution reaching a program point along the current path. Sets
 * of path conditions are intersected where paths merge.
 */
public interface PathCondition {

  /** The named variable holds a valid reference. */
  record ReferenceValid(String variable) implements PathCondition {}

  /** The named object is owned by the transaction sender. */
  record ObjectOwned(String variable) implements PathCondition {}

  /** The function holds the named capability. */
  record CapabilityHeld(String capability) implements PathCondition {}

  /** An assertion mentioning the named variable has been checked. */
  record TransferGuarded(String variable) implements PathCondition {}

  /** A branch condition, as source text; {@code holds} is false on the else edge. */
  record Custom(String predicate, boolean holds) implements PathCondition {
    @Override
    public String toString() {
      return holds ? predicate : "!(" + predicate + ")";
    }
  }
}
