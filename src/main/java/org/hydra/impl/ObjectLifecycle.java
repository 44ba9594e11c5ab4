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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The modeled lifecycle of one object: its current state and the events that led to it. Events
 * are only ever appended; once the object is {@link Deleted} nothing more is appended.
 */
public final class ObjectLifecycle {

  /** The lifecycle states. */
  public interface State {}

  public static final State UNINITIALIZED = new Uninitialized();

  record Uninitialized() implements State {}

  /** Created (or received) and not yet transferred or deleted. */
  public record Initialized(@Nullable String owner, boolean shared, boolean frozen)
      implements State {}

  /** Ownership passed to {@code to}. */
  public record Transferred(String to, boolean guardChecked) implements State {}

  public record Deleted() implements State {}

  /** The kinds of event in an object's history. */
  public enum EventKind {
    CREATED,
    TRANSFERRED,
    SHARED_ACCESS,
    CAPABILITY_CHECK,
    DELETED
  }

  public record Event(EventKind kind, String detail) {}

  private final ObjectId id;
  private State state = UNINITIALIZED;
  private final List<Event> history = new ArrayList<>();

  ObjectLifecycle(ObjectId id) {
    this.id = id;
  }

  public ObjectId id() {
    return id;
  }

  public State state() {
    return state;
  }

  public ImmutableList<Event> history() {
    return ImmutableList.copyOf(history);
  }

  public boolean isDeleted() {
    return state instanceof Deleted;
  }

  boolean hasEvent(EventKind kind) {
    return history.stream().anyMatch(e -> e.kind() == kind);
  }

  void append(Event event, State newState) {
    assert !isDeleted();
    history.add(event);
    state = newState;
  }

  @Override
  public String toString() {
    return id + " " + state + " " + history;
  }
}
