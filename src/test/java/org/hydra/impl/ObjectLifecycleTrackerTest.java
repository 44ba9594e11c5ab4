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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.hydra.impl.ObjectLifecycle.EventKind;
import org.hydra.impl.ObjectSafetyIssue.Type;
import org.hydra.ir.Location;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ObjectLifecycleTrackerTest {

  private static final Location LOC = new Location("vault.move", 12, 4, "withdraw");
  private static final ObjectId VAULT = new ObjectId("bank", "Vault", "withdraw.v");

  private final ObjectLifecycleTracker tracker = new ObjectLifecycleTracker();

  private ImmutableList<Type> issueTypes() {
    return tracker.issues().stream()
        .map(ObjectSafetyIssue::type)
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void creationWithIdentityIsClean() {
    tracker.recordCreation(VAULT, true, null, LOC);
    assertThat(tracker.issues()).isEmpty();
    ObjectLifecycle lifecycle = tracker.lifecycle(VAULT);
    assertThat(lifecycle.state()).isEqualTo(new ObjectLifecycle.Initialized(null, false, false));
    assertThat(lifecycle.history()).hasSize(1);
  }

  @Test
  public void creationWithOwnerButNoIdentityIsClean() {
    tracker.recordCreation(VAULT, false, "owner", LOC);
    assertThat(tracker.issues()).isEmpty();
  }

  @Test
  public void creationWithoutIdentityOrOwner() {
    tracker.recordCreation(VAULT, false, null, LOC);
    assertThat(issueTypes()).containsExactly(Type.UNSAFE_OBJECT_CONSTRUCTION);
    assertThat(tracker.issues().get(0).severity()).isEqualTo(Severity.HIGH);
    assertThat(tracker.issues().get(0).objectId()).isEqualTo(VAULT.toString());
  }

  @Test
  public void guardedTransfer() {
    tracker.recordCreation(VAULT, true, null, LOC);
    tracker.recordTransfer(VAULT, "alice", true, LOC);
    assertThat(tracker.issues()).isEmpty();
    assertThat(tracker.lifecycle(VAULT).state())
        .isEqualTo(new ObjectLifecycle.Transferred("alice", true));
  }

  @Test
  public void unguardedTransferIsCritical() {
    tracker.recordCreation(VAULT, true, null, LOC);
    tracker.recordTransfer(VAULT, "alice", false, LOC);
    assertThat(issueTypes()).containsExactly(Type.UNSAFE_TRANSFER);
    assertThat(tracker.issues().get(0).severity()).isEqualTo(Severity.CRITICAL);
  }

  @Test
  public void transferAfterSharedAccess() {
    tracker.recordExisting(VAULT, "caller");
    tracker.recordSharedAccess(VAULT, false, false, LOC);
    tracker.recordTransfer(VAULT, "alice", true, LOC);
    assertThat(tracker.issues()).hasSize(1);
    assertThat(tracker.issues().get(0).message()).isEqualTo("Transfer after shared access");
    // History is never rewritten
    assertThat(
            tracker.lifecycle(VAULT).history().stream()
                .map(ObjectLifecycle.Event::kind)
                .collect(ImmutableList.toImmutableList()))
        .containsExactly(EventKind.CREATED, EventKind.SHARED_ACCESS, EventKind.TRANSFERRED)
        .inOrder();
  }

  @Test
  public void unsynchronizedSharedWrite() {
    tracker.recordExisting(VAULT, "caller");
    tracker.recordSharedAccess(VAULT, true, true, LOC);
    assertThat(tracker.issues()).isEmpty();
    tracker.recordSharedAccess(VAULT, true, false, LOC);
    assertThat(issueTypes()).containsExactly(Type.INVALID_SHARED_ACCESS);
    assertThat(tracker.lifecycle(VAULT).state())
        .isEqualTo(new ObjectLifecycle.Initialized("caller", true, false));
  }

  @Test
  public void useAfterDeletion() {
    tracker.recordExisting(VAULT, "caller");
    tracker.recordDeletion(VAULT, LOC);
    assertThat(tracker.lifecycle(VAULT).isDeleted()).isTrue();
    tracker.recordTransfer(VAULT, "alice", true, LOC);
    assertThat(issueTypes()).containsExactly(Type.INVALID_LIFECYCLE);
    assertThat(tracker.issues().get(0).message()).isEqualTo("Transfer after deletion");
  }

  @Test
  public void capabilityChecks() {
    CapId admin = new CapId("bank", "AdminCap", ImmutableSet.of("mint", "burn"));
    tracker.grantCapability("mint", admin);
    assertThat(tracker.capabilities("mint")).containsExactly(admin);
    assertThat(
            tracker.verifyCapability(
                "mint", new CapId("bank", "AdminCap", ImmutableSet.of("mint")), null, LOC))
        .isTrue();
    assertThat(tracker.issues()).isEmpty();

    tracker.recordExisting(VAULT, "caller");
    boolean held = tracker.verifyCapability("burn", CapId.of("bank", "AdminCap"), VAULT, LOC);
    assertThat(held).isFalse();
    assertThat(issueTypes()).containsExactly(Type.CAPABILITY_EXPOSURE);
    assertThat(tracker.issues().get(0).severity()).isEqualTo(Severity.HIGH);
    // A failed check is still recorded, and later checks still run
    assertThat(tracker.lifecycle(VAULT).history().get(1).kind())
        .isEqualTo(EventKind.CAPABILITY_CHECK);
    assertThat(tracker.verifyCapability("mint", admin, VAULT, LOC)).isTrue();
  }
}
