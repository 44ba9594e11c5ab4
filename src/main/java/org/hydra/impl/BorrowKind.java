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

/** The kinds of borrow, ordered from least to most restrictive. */
public enum BorrowKind {
  /** {@code &x}: any number of readers. */
  SHARED_READ,
  /** {@code &mut x}: a single writer. */
  MUTABLE_WRITE,
  /** A mutable borrow of an object; releasing it requires a prior guard check. */
  TRANSFER_GUARDED,
  /** A mutable borrow of a capability. */
  CAPABILITY_PROTECTED;

  /** Returns whichever of {@code this} and {@code other} is more restrictive. */
  public BorrowKind mostRestrictive(BorrowKind other) {
    return (other.ordinal() > ordinal()) ? other : this;
  }

  public boolean isMutable() {
    return this != SHARED_READ;
  }
}
