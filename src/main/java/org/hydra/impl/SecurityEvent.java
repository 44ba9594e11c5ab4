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

/** Something the {@link TraceAnalyzer} observed at a module boundary. */
public interface SecurityEvent {

  /** The function in which the event occurred. */
  String function();

  /** How a boundary-crossing call relates the trust levels of its two modules. */
  enum BoundaryKind {
    TRUSTED_TO_UNTRUSTED,
    UNTRUSTED_TO_TRUSTED,
    /** Both modules have the same trust level. */
    CROSS_MODULE
  }

  /** A call from one module into another. */
  record BoundaryCrossing(String from, String to, BoundaryKind kind, String function, String call)
      implements SecurityEvent {}

  /** A call from an untrusted module into a trusted one. */
  record CallToTrusted(String from, String to, String function, String call)
      implements SecurityEvent {}

  /** A return from a call that had crossed a module boundary. */
  record ReturnToUntrusted(String from, String to, String function) implements SecurityEvent {}

  /** A borrow of global state. */
  record StateAccess(String module, String resource, String function) implements SecurityEvent {}
}
