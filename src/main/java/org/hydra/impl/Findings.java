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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Accumulates the findings of one analysis run. Equal findings are kept once, in the order they
 * were first added. Not thread-safe; each module analysis has its own Findings.
 */
final class Findings {
  private final Set<SafetyViolation> violations = new LinkedHashSet<>();
  private final Set<ReferenceLeak> leaks = new LinkedHashSet<>();
  private final Set<ObjectSafetyIssue> issues = new LinkedHashSet<>();

  @CanIgnoreReturnValue
  boolean add(SafetyViolation violation) {
    return violations.add(violation);
  }

  @CanIgnoreReturnValue
  boolean add(ReferenceLeak leak) {
    return leaks.add(leak);
  }

  @CanIgnoreReturnValue
  boolean add(ObjectSafetyIssue issue) {
    return issues.add(issue);
  }

  AnalysisResult toResult() {
    return new AnalysisResult(
        ImmutableList.copyOf(violations),
        ImmutableList.copyOf(leaks),
        ImmutableList.copyOf(issues));
  }
}
