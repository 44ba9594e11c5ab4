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

/** The kinds of {@link SafetyViolation} and {@link ReferenceLeak}. */
public enum ViolationType {
  /** A reference to protected state became observable outside its owning scope. */
  REFERENCE_ESCAPE,
  /** An object was transferred without the required checks. */
  UNSAFE_TRANSFER,
  /** A capability reference escaped its holder. */
  CAPABILITY_LEAK,
  /** A shared object was touched without consensus verification and synchronization. */
  SHARED_OBJECT_VIOLATION,
  /** A local property or loop invariant does not hold. */
  INVARIANT_VIOLATION,
  /** A public function exposes mutable access to an object. */
  UNSAFE_PUBLIC_INTERFACE,
  /** Control flow that may do unbounded work, e.g. deeply nested loops. */
  DOS_VECTOR,
  /** Recursion, or a call chain deeper than the configured limit. */
  CALL_STACK_VIOLATION,
  /** A call crosses a trust boundary without authorization. */
  UNAUTHORIZED_ACCESS,
  /** A protected resource is reachable, misconstructed, or may leak. */
  RESOURCE_SAFETY_VIOLATION,
  /** A variable's reference state changed in a way the transition table does not allow. */
  INVALID_STATE_TRANSITION,
  /** Paths that disagree about whether a variable was moved join at a merge point. */
  INVALID_STATE_MERGE,
  /** The function or module could not be analyzed as given. */
  MALFORMED_IR
}
