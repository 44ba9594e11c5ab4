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
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.hydra.impl.ObjectLifecycle.Event;
import org.hydra.impl.ObjectLifecycle.EventKind;
import org.hydra.impl.ObjectSafetyIssue.Type;
import org.hydra.ir.Location;
import org.jspecify.annotations.Nullable;

/**
 * Tracks an {@link ObjectLifecycle} for each object and the capabilities held by each holder
 * (function), recording an {@link ObjectSafetyIssue} whenever an event is not allowed.
 *
 * <p>A tracker is used for a single module analysis and is not thread-safe.
 */
public final class ObjectLifecycleTracker {

  private final Map<ObjectId, ObjectLifecycle> objects = new LinkedHashMap<>();
  private final Map<String, Set<CapId>> held = new HashMap<>();
  private final List<ObjectSafetyIssue> issues = new ArrayList<>();

  public ImmutableList<ObjectSafetyIssue> issues() {
    return ImmutableList.copyOf(issues);
  }

  public @Nullable ObjectLifecycle lifecycle(ObjectId id) {
    return objects.get(id);
  }

  private void issue(Location loc, Object subject, Type type, String message, Severity severity) {
    issues.add(new ObjectSafetyIssue(loc, subject.toString(), type, message, severity));
  }

  /**
   * Returns the lifecycle for {@code id}, or null (after recording an issue) if the object has
   * already been deleted.
   */
  private @Nullable ObjectLifecycle live(ObjectId id, Location loc, String what) {
    ObjectLifecycle lifecycle = objects.computeIfAbsent(id, ObjectLifecycle::new);
    if (lifecycle.isDeleted()) {
      issue(loc, id, Type.INVALID_LIFECYCLE, what + " after deletion", Severity.HIGH);
      return null;
    }
    return lifecycle;
  }

  /**
   * Records the creation of an object. An object created with neither an identity field nor an
   * owner cannot be tracked on chain.
   */
  public void recordCreation(
      ObjectId id, boolean hasIdentity, @Nullable String owner, Location loc) {
    ObjectLifecycle lifecycle = live(id, loc, "Creation");
    if (lifecycle == null) {
      return;
    }
    if (!(lifecycle.state() instanceof ObjectLifecycle.Uninitialized)) {
      issue(loc, id, Type.INVALID_LIFECYCLE, "Object created twice", Severity.HIGH);
      return;
    }
    if (!hasIdentity && owner == null) {
      issue(
          loc,
          id,
          Type.UNSAFE_OBJECT_CONSTRUCTION,
          "Object created without an identity field or an owner",
          Severity.HIGH);
    }
    lifecycle.append(
        new Event(EventKind.CREATED, (owner == null) ? "no owner" : "owner " + owner),
        new ObjectLifecycle.Initialized(owner, false, false));
  }

  /** Records an object that already exists when analysis starts, e.g. a parameter. */
  public void recordExisting(ObjectId id, @Nullable String owner) {
    ObjectLifecycle lifecycle = objects.computeIfAbsent(id, ObjectLifecycle::new);
    if (lifecycle.state() instanceof ObjectLifecycle.Uninitialized) {
      lifecycle.append(
          new Event(EventKind.CREATED, "received"),
          new ObjectLifecycle.Initialized(owner, false, false));
    }
  }

  /**
   * Records a transfer of ownership. A transfer must be preceded by a guard check, and an object
   * that has been accessed as shared must not be transferred afterwards.
   */
  public void recordTransfer(ObjectId id, String to, boolean guardChecked, Location loc) {
    ObjectLifecycle lifecycle = live(id, loc, "Transfer");
    if (lifecycle == null) {
      return;
    }
    if (!(lifecycle.state() instanceof ObjectLifecycle.Initialized)) {
      issue(
          loc,
          id,
          Type.INVALID_LIFECYCLE,
          "Transfer of an object in state " + lifecycle.state(),
          Severity.HIGH);
    }
    if (!guardChecked) {
      issue(
          loc,
          id,
          Type.UNSAFE_TRANSFER,
          "Object transferred without a guard check",
          Severity.CRITICAL);
    }
    if (lifecycle.hasEvent(EventKind.SHARED_ACCESS)) {
      issue(loc, id, Type.UNSAFE_TRANSFER, "Transfer after shared access", Severity.CRITICAL);
    }
    lifecycle.append(
        new Event(EventKind.TRANSFERRED, to), new ObjectLifecycle.Transferred(to, guardChecked));
  }

  /** Records an access to an object as shared state. Writes must be synchronized. */
  public void recordSharedAccess(ObjectId id, boolean write, boolean isSynchronized, Location loc) {
    ObjectLifecycle lifecycle = live(id, loc, "Shared access");
    if (lifecycle == null) {
      return;
    }
    if (write && !isSynchronized) {
      issue(
          loc,
          id,
          Type.INVALID_SHARED_ACCESS,
          "Unsynchronized write to shared object",
          Severity.CRITICAL);
    }
    ObjectLifecycle.State state = lifecycle.state();
    if (state instanceof ObjectLifecycle.Initialized init) {
      state = new ObjectLifecycle.Initialized(init.owner(), true, init.frozen());
    }
    lifecycle.append(new Event(EventKind.SHARED_ACCESS, write ? "write" : "read"), state);
  }

  public void recordDeletion(ObjectId id, Location loc) {
    ObjectLifecycle lifecycle = live(id, loc, "Deletion");
    if (lifecycle != null) {
      lifecycle.append(new Event(EventKind.DELETED, ""), new ObjectLifecycle.Deleted());
    }
  }

  public void grantCapability(String holder, CapId capability) {
    held.computeIfAbsent(holder, k -> new LinkedHashSet<>()).add(capability);
  }

  public ImmutableSet<CapId> capabilities(String holder) {
    return ImmutableSet.copyOf(held.getOrDefault(holder, Set.of()));
  }

  /**
   * Returns true if {@code holder} holds a capability with the same name as {@code required} and
   * at least its permissions. Records an issue otherwise; callers may carry on either way. If
   * {@code subject} is non-null the check is added to its history.
   */
  @CanIgnoreReturnValue
  public boolean verifyCapability(
      String holder, CapId required, @Nullable ObjectId subject, Location loc) {
    boolean ok =
        held.getOrDefault(holder, Set.of()).stream()
            .anyMatch(
                c ->
                    c.name().equals(required.name())
                        && c.permissions().containsAll(required.permissions()));
    if (!ok) {
      issue(
          loc,
          required,
          Type.CAPABILITY_EXPOSURE,
          holder + " uses " + required + " without holding it",
          Severity.HIGH);
    }
    if (subject != null) {
      ObjectLifecycle lifecycle = live(subject, loc, "Capability check");
      if (lifecycle != null) {
        lifecycle.append(
            new Event(EventKind.CAPABILITY_CHECK, required + (ok ? " held" : " missing")),
            lifecycle.state());
      }
    }
    return ok;
  }
}
