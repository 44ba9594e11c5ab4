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
import java.util.stream.Stream;

/** Everything found by analyzing one module. */
public record AnalysisResult(
    ImmutableList<SafetyViolation> safetyViolations,
    ImmutableList<ReferenceLeak> referenceLeaks,
    ImmutableList<ObjectSafetyIssue> objectSafetyIssues) {

  public static final AnalysisResult EMPTY =
      new AnalysisResult(ImmutableList.of(), ImmutableList.of(), ImmutableList.of());

  public AnalysisResult {
    safetyViolations = ImmutableList.copyOf(safetyViolations);
    referenceLeaks = ImmutableList.copyOf(referenceLeaks);
    objectSafetyIssues = ImmutableList.copyOf(objectSafetyIssues);
  }

  /** True if nothing was found. */
  public boolean isClean() {
    return safetyViolations.isEmpty() && referenceLeaks.isEmpty() && objectSafetyIssues.isEmpty();
  }

  /** The severities of all findings, in result order. */
  public Stream<Severity> severities() {
    return Stream.of(
            safetyViolations.stream().map(SafetyViolation::severity),
            referenceLeaks.stream().map(ReferenceLeak::severity),
            objectSafetyIssues.stream().map(ObjectSafetyIssue::severity))
        .flatMap(s -> s);
  }

  /** The number of findings with exactly the given severity. */
  public long count(Severity severity) {
    return severities().filter(s -> s == severity).count();
  }
}
