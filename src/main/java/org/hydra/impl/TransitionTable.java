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

import com.google.common.collect.ImmutableSetMultimap;
import java.util.Set;
import org.hydra.impl.ReferenceState.Kind;
import org.jspecify.annotations.Nullable;

/**
 * The legal reference-state transitions. {@link #check} is consulted before every state change;
 * callers report the returned error and then apply the requested state anyway.
 */
public final class TransitionTable {

  private TransitionTable() {}

  /** The result of an illegal transition. */
  public record TransitionError(ViolationType type, Severity severity, String message) {}

  /** For each state kind, the kinds it may change to. */
  static final ImmutableSetMultimap<Kind, Kind> LEGAL =
      ImmutableSetMultimap.<Kind, Kind>builder()
          .putAll(Kind.UNINITIALIZED, Kind.INITIALIZED, Kind.BORROWED, Kind.INVALID)
          .putAll(
              Kind.INITIALIZED,
              Kind.INITIALIZED,
              Kind.BORROWED,
              Kind.MOVED,
              Kind.RELEASED,
              Kind.INVALID)
          .putAll(
              Kind.BORROWED,
              Kind.INITIALIZED,
              Kind.BORROWED,
              Kind.MOVED,
              Kind.RELEASED,
              Kind.INVALID)
          .putAll(Kind.MOVED, Kind.INITIALIZED, Kind.BORROWED, Kind.INVALID)
          .putAll(Kind.RELEASED, Kind.INVALID)
          .putAll(Kind.INVALID, Kind.INITIALIZED, Kind.INVALID)
          .build();

  public static boolean isLegal(Kind from, Kind to) {
    return LEGAL.containsEntry(from, to);
  }

  /**
   * Returns null if {@code variable} may change from {@code from} to {@code to} given the path
   * conditions that hold, otherwise describes why not.
   *
   * <p>In addition to the table, a mutable borrow may not be moved, and a transfer-guarded borrow
   * may not be released unless a {@link PathCondition.TransferGuarded} for the variable holds.
   */
  public static @Nullable TransitionError check(
      String variable, ReferenceState from, ReferenceState to, Set<PathCondition> conditions) {
    if (from.isBorrowed(BorrowKind.MUTABLE_WRITE) && to.kind() == Kind.MOVED) {
      return new TransitionError(
          ViolationType.REFERENCE_ESCAPE,
          Severity.CRITICAL,
          "Mutable reference moved while borrowed: " + variable);
    }
    if (from.isBorrowed(BorrowKind.TRANSFER_GUARDED)
        && to.kind() == Kind.RELEASED
        && !conditions.contains(new PathCondition.TransferGuarded(variable))) {
      return new TransitionError(
          ViolationType.UNSAFE_TRANSFER,
          Severity.HIGH,
          "Transfer-guarded " + variable + " released without a guard check");
    }
    if (!isLegal(from.kind(), to.kind())) {
      return new TransitionError(
          ViolationType.INVALID_STATE_TRANSITION,
          Severity.HIGH,
          String.format("Illegal transition of %s from %s to %s", variable, from, to));
    }
    return null;
  }
}
