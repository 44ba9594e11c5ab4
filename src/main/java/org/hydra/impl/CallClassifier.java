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
import java.util.EnumSet;
import java.util.Set;

/**
 * Classifies call targets by substring matching against a fixed rule table.
 *
 * <p>These rules are heuristics: a call named {@code lock::sync_shared} matches both {@link
 * Rule#SHARED_ACCESS} and {@link Rule#SYNCHRONIZATION}. A call is a {@link Rule#CAPABILITY} call
 * when its name contains {@code _cap} or {@code capability}; a type is a capability type when its
 * name ends in {@code Cap} or contains {@code Capability} (see {@link #isCapabilityType}). Other
 * capability types are not recognized at all. A stricter classifier would resolve calls against
 * declared abilities instead.
 */
public final class CallClassifier {

  private CallClassifier() {}

  /** A named class of calls, and the substrings that identify it. */
  public enum Rule {
    /** Transfers ownership of an object. */
    TRANSFER("transfer::transfer", "transfer::public_transfer"),
    /** Touches a shared object. */
    SHARED_ACCESS("shared", "consensus", "sync"),
    /** Verifies consensus before touching a shared object. */
    CONSENSUS_VERIFY("consensus::verify"),
    /** Takes a lock or otherwise synchronizes. */
    SYNCHRONIZATION("sync", "lock"),
    /** Reads the transaction sender. */
    SENDER_CHECK("tx_context::sender"),
    /** Reads an object's owner. */
    OWNER_ACCESS("owner"),
    /** Requires or uses a capability. */
    CAPABILITY("_cap", "capability"),
    /** Destroys an object. */
    DELETION("object::delete", "::destroy", "::burn"),
    /** Mutates its argument. */
    WRITE_INTENT("_mut", "write", "set_", "update");

    private final ImmutableList<String> patterns;

    Rule(String... patterns) {
      this.patterns = ImmutableList.copyOf(patterns);
    }

    /** True if {@code callName} contains any of this rule's patterns. */
    public boolean matches(String callName) {
      return patterns.stream().anyMatch(callName::contains);
    }
  }

  /** Returns every rule that {@code callName} matches. */
  public static Set<Rule> classify(String callName) {
    EnumSet<Rule> result = EnumSet.noneOf(Rule.class);
    for (Rule rule : Rule.values()) {
      if (rule.matches(callName)) {
        result.add(rule);
      }
    }
    return result;
  }

  /** True if a value of the named type is treated as a capability. */
  public static boolean isCapabilityType(String typeName) {
    return typeName.endsWith("Cap") || typeName.contains("Capability");
  }
}
