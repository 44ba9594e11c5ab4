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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The results of analyzing a list of modules. {@code failures} maps the modules whose analysis
 * threw to the exception's message.
 */
public record PackageResult(
    ImmutableMap<String, AnalysisResult> results, ImmutableMap<String, String> failures) {

  public PackageResult {
    results = ImmutableMap.copyOf(results);
    failures = ImmutableMap.copyOf(failures);
  }

  /** All findings of all modules, in module order. */
  public AnalysisResult combined() {
    ImmutableList.Builder<SafetyViolation> violations = ImmutableList.builder();
    ImmutableList.Builder<ReferenceLeak> leaks = ImmutableList.builder();
    ImmutableList.Builder<ObjectSafetyIssue> issues = ImmutableList.builder();
    for (AnalysisResult r : results.values()) {
      violations.addAll(r.safetyViolations());
      leaks.addAll(r.referenceLeaks());
      issues.addAll(r.objectSafetyIssues());
    }
    return new AnalysisResult(violations.build(), leaks.build(), issues.build());
  }

  public boolean isClean() {
    return failures.isEmpty() && results.values().stream().allMatch(AnalysisResult::isClean);
  }

  /**
   * Collects per-module outcomes from any number of threads. Results are ordered by the module
   * order given at construction, regardless of completion order.
   */
  static final class Collector {
    private final ImmutableList<String> order;

    @GuardedBy("this")
    private final Map<String, AnalysisResult> results = new HashMap<>();

    @GuardedBy("this")
    private final Map<String, String> failures = new HashMap<>();

    Collector(List<String> order) {
      this.order = ImmutableList.copyOf(order);
    }

    synchronized void add(String module, AnalysisResult result) {
      results.put(module, result);
    }

    synchronized void fail(String module, Throwable cause) {
      failures.put(module, String.valueOf(cause.getMessage()));
    }

    synchronized PackageResult build() {
      ImmutableMap.Builder<String, AnalysisResult> orderedResults = ImmutableMap.builder();
      ImmutableMap.Builder<String, String> orderedFailures = ImmutableMap.builder();
      for (String module : order) {
        if (results.containsKey(module)) {
          orderedResults.put(module, results.get(module));
        } else if (failures.containsKey(module)) {
          orderedFailures.put(module, failures.get(module));
        }
      }
      return new PackageResult(
          orderedResults.buildKeepingLast(), orderedFailures.buildKeepingLast());
    }
  }
}
