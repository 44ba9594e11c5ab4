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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;

/** The per-variable reference states and the path conditions at one program point. */
public record FlowState(
    ImmutableMap<String, ReferenceState> variables, ImmutableSet<PathCondition> conditions) {

  public static final FlowState EMPTY = new FlowState(ImmutableMap.of(), ImmutableSet.of());

  /** Returns the state of {@code variable}, or {@link ReferenceState#UNINITIALIZED}. */
  public ReferenceState get(String variable) {
    return variables.getOrDefault(variable, ReferenceState.UNINITIALIZED);
  }

  public FlowState with(String variable, ReferenceState state) {
    Map<String, ReferenceState> copy = new LinkedHashMap<>(variables);
    copy.put(variable, state);
    return new FlowState(ImmutableMap.copyOf(copy), conditions);
  }

  public FlowState withCondition(PathCondition condition) {
    if (conditions.contains(condition)) {
      return this;
    }
    return new FlowState(
        variables,
        ImmutableSet.<PathCondition>builder().addAll(conditions).add(condition).build());
  }

  @Override
  public String toString() {
    return variables + (conditions.isEmpty() ? "" : " given " + conditions);
  }
}
