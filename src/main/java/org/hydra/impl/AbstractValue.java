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
 * The abstraction of a runtime value that the analyses track: whether it is a reference, and if
 * so what it may refer to.
 */
public interface AbstractValue {

  /** A plain value, or a copy read through a reference. */
  AbstractValue NON_REFERENCE = new NonReference();

  /** A reference to a local that cannot outlive the function. */
  AbstractValue SAFE_REFERENCE = new SafeReference();

  /** See {@link #NON_REFERENCE}. */
  record NonReference() implements AbstractValue {
    @Override
    public String toString() {
      return "NonRef";
    }
  }

  /** See {@link #SAFE_REFERENCE}. */
  record SafeReference() implements AbstractValue {
    @Override
    public String toString() {
      return "SafeRef";
    }
  }

  /** A reference to a field whose contents are protected by an invariant. */
  record InvariantReference(String field) implements AbstractValue {
    @Override
    public String toString() {
      return "InvRef(" + field + ")";
    }
  }

  /** A reference to (or the value of) an object. */
  record ObjectReference(ObjectId object) implements AbstractValue {
    @Override
    public String toString() {
      return "ObjRef(" + object + ")";
    }
  }

  /** A reference to (or the value of) a capability. */
  record CapabilityReference(CapId capability) implements AbstractValue {
    @Override
    public String toString() {
      return "CapRef(" + capability + ")";
    }
  }
}
