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

/**
 * Structured details attached to a {@link SafetyViolation}. The suggested fixes are advisory text;
 * {@code reference} cites the design-document section the rule comes from.
 */
public record ViolationContext(
    ImmutableList<String> affectedFunctions,
    ImmutableList<String> relatedTypes,
    ImmutableList<String> suggestedFixes,
    String reference) {

  public ViolationContext {
    affectedFunctions = ImmutableList.copyOf(affectedFunctions);
    relatedTypes = ImmutableList.copyOf(relatedTypes);
    suggestedFixes = ImmutableList.copyOf(suggestedFixes);
  }

  /** A context naming one function and one suggested fix. */
  public static ViolationContext of(String function, String fix, String reference) {
    return new ViolationContext(
        ImmutableList.of(function), ImmutableList.of(), ImmutableList.of(fix), reference);
  }
}
