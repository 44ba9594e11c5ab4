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
 * Which part of the reference-state lattice a {@link FlowAnalyzer} reports on. Every run updates
 * all variables; a run only reports transitions, merges and escapes of variables whose value
 * belongs to its dimension, so the three dimensions partition the findings.
 */
public enum Dimension {
  /** Plain values and references to fields or locals. */
  REFERENCE,
  /** Objects of key-ability structs. */
  OBJECT,
  /** Capabilities. */
  CAPABILITY;

  /** Returns the dimension that {@code value} belongs to. */
  public static Dimension of(AbstractValue value) {
    if (value instanceof AbstractValue.ObjectReference) {
      return OBJECT;
    } else if (value instanceof AbstractValue.CapabilityReference) {
      return CAPABILITY;
    }
    return REFERENCE;
  }

  public boolean tracks(AbstractValue value) {
    return of(value) == this;
  }
}
