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

package org.hydra.code;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.hydra.ir.Expression;
import org.hydra.ir.Statement;
import org.hydra.util.StringUtil;
import org.jspecify.annotations.Nullable;

/**
 * A BasicBlock is a maximal straight-line sequence of statements. Blocks are connected by
 * successor and predecessor indices into {@link ControlFlowGraph#blocks}.
 *
 * <p>A block has zero successors (it returns or falls off the end of the function), one successor,
 * or two successors. A block with two successors has a {@link #condition}; control goes to {@code
 * successors().get(0)} when the condition is true and to {@code successors().get(1)} otherwise.
 */
public final class BasicBlock {

  /** This block's position in {@link ControlFlowGraph#blocks}. */
  final int index;

  final List<Statement> statements = new ArrayList<>();
  final List<Integer> successors = new ArrayList<>(2);
  final List<Integer> predecessors = new ArrayList<>();

  /** The branch condition if this block has two successors, otherwise null. */
  private Expression condition;

  BasicBlock(int index) {
    this.index = index;
  }

  public int index() {
    return index;
  }

  public List<Statement> statements() {
    return Collections.unmodifiableList(statements);
  }

  public ImmutableList<Integer> successors() {
    return ImmutableList.copyOf(successors);
  }

  public ImmutableList<Integer> predecessors() {
    return ImmutableList.copyOf(predecessors);
  }

  public @Nullable Expression condition() {
    return condition;
  }

  void setCondition(Expression condition) {
    Preconditions.checkState(this.condition == null);
    this.condition = condition;
  }

  /** True if control can reach this block from more than one predecessor. */
  public boolean isMergePoint() {
    return predecessors.size() > 1;
  }

  /** True if this block has no successors. */
  public boolean isTerminal() {
    return successors.isEmpty();
  }

  /** True if this block ends with a two-way branch. */
  public boolean isSplit() {
    return successors.size() == 2;
  }

  @Override
  public String toString() {
    String links =
        successors.isEmpty()
            ? ""
            : StringUtil.joinElements(
                " -> ", "", successors.size(), i -> "B" + successors.get(i));
    String cond = (condition == null) ? "" : " if " + condition;
    return "B" + index + statements + cond + links;
  }
}
