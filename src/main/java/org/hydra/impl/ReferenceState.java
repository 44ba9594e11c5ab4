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
 * The state of one tracked variable at one program point. Each state also carries the {@link
 * AbstractValue} the variable holds (or last held, for {@link Moved} and {@link Released}).
 */
public interface ReferenceState {

  /** The state tags, used as keys of the {@link TransitionTable}. */
  enum Kind {
    UNINITIALIZED,
    INITIALIZED,
    BORROWED,
    MOVED,
    RELEASED,
    INVALID
  }

  ReferenceState UNINITIALIZED = new Uninitialized();

  Kind kind();

  /** The value this variable holds; {@link AbstractValue#NON_REFERENCE} if it holds none. */
  default AbstractValue value() {
    return AbstractValue.NON_REFERENCE;
  }

  /** True if this is a borrow with the given kind. */
  default boolean isBorrowed(BorrowKind borrowKind) {
    return this instanceof Borrowed b && b.borrowKind() == borrowKind;
  }

  /** See {@link #UNINITIALIZED}. */
  record Uninitialized() implements ReferenceState {
    @Override
    public Kind kind() {
      return Kind.UNINITIALIZED;
    }

    @Override
    public String toString() {
      return "Uninit";
    }
  }

  /** The variable holds {@code value}. */
  record Initialized(AbstractValue value, boolean mutable) implements ReferenceState {
    @Override
    public Kind kind() {
      return Kind.INITIALIZED;
    }

    @Override
    public String toString() {
      return "Init(" + value + (mutable ? ", mut)" : ")");
    }
  }

  /** The variable holds a borrow of {@code source}, which has value {@code value}. */
  record Borrowed(BorrowKind borrowKind, String source, AbstractValue value)
      implements ReferenceState {
    @Override
    public Kind kind() {
      return Kind.BORROWED;
    }

    @Override
    public String toString() {
      return "Borrowed(" + borrowKind + ", " + source + ", " + value + ")";
    }
  }

  /** The variable's value was moved to {@code destination}. */
  record Moved(String destination, AbstractValue value) implements ReferenceState {
    @Override
    public Kind kind() {
      return Kind.MOVED;
    }

    @Override
    public String toString() {
      return "Moved(" + destination + ")";
    }
  }

  /** The variable's value was destroyed. */
  record Released(AbstractValue value) implements ReferenceState {
    @Override
    public Kind kind() {
      return Kind.RELEASED;
    }

    @Override
    public String toString() {
      return "Released";
    }
  }

  /** The analysis could not determine a consistent state. */
  record Invalid(String reason) implements ReferenceState {
    @Override
    public Kind kind() {
      return Kind.INVALID;
    }

    @Override
    public String toString() {
      return "Invalid(" + reason + ")";
    }
  }
}
