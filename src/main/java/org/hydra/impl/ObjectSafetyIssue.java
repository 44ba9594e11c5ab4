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

/** A problem in the lifecycle of one object or capability. */
public record ObjectSafetyIssue(
    Location location, String objectId, Type type, String message, Severity severity) {

  /** The kinds of lifecycle problem. */
  public enum Type {
    /** Transferred without a guard check, or after shared access. */
    UNSAFE_TRANSFER,
    /** Written as a shared object without synchronization. */
    INVALID_SHARED_ACCESS,
    /** Created with neither an identity field nor an owner. */
    UNSAFE_OBJECT_CONSTRUCTION,
    /** A capability was required but not held. */
    CAPABILITY_EXPOSURE,
    /** An event that the lifecycle state does not allow, e.g. use after deletion. */
    INVALID_LIFECYCLE
  }

  @Override
  public String toString() {
    return severity + " " + type + " of " + objectId + " at " + location + ": " + message;
  }
}
