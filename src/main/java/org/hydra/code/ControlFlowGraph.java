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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * The basic blocks of a single function. Block 0 is the entry block. ControlFlowGraphs are created
 * by {@link CfgBuilder} and are not modified afterwards.
 */
public final class ControlFlowGraph {

  private final String functionName;

  private final ImmutableList<BasicBlock> blocks;

  /** The blocks reachable from the entry block. */
  private final BitSet reachable;

  /**
   * Each reachable block's position in a reverse postorder of the graph; -1 for unreachable
   * blocks. Predecessors come before their successors except along back edges.
   */
  private final int[] order;

  private ImmutableList<Loop> loops;

  ControlFlowGraph(String functionName, List<BasicBlock> blocks) {
    this.functionName = functionName;
    this.blocks = ImmutableList.copyOf(blocks);
    this.reachable = new BitSet(blocks.size());
    this.order = new int[blocks.size()];
    computeOrder();
  }

  private void computeOrder() {
    Arrays.fill(order, -1);
    int[] postorder = new int[blocks.size()];
    int count = 0;
    Deque<int[]> frames = new ArrayDeque<>();
    frames.push(new int[] {0, 0});
    reachable.set(0);
    while (!frames.isEmpty()) {
      int[] frame = frames.peek();
      List<Integer> succs = blocks.get(frame[0]).successors;
      if (frame[1] < succs.size()) {
        int succ = succs.get(frame[1]++);
        if (!reachable.get(succ)) {
          reachable.set(succ);
          frames.push(new int[] {succ, 0});
        }
      } else {
        frames.pop();
        postorder[count++] = frame[0];
      }
    }
    for (int i = 0; i < count; i++) {
      order[postorder[count - 1 - i]] = i;
    }
  }

  public ImmutableList<BasicBlock> blocks() {
    return blocks;
  }

  public int numBlocks() {
    return blocks.size();
  }

  public BasicBlock block(int index) {
    return blocks.get(index);
  }

  public BasicBlock entry() {
    return blocks.get(0);
  }

  public boolean isReachable(int index) {
    return reachable.get(index);
  }

  /** Returns the position of the given block in reverse postorder, or -1 if it is unreachable. */
  public int order(int index) {
    return order[index];
  }

  /** Returns the indices of blocks that cannot be reached from the entry block. */
  public ImmutableList<Integer> unreachableBlocks() {
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    for (int i = reachable.nextClearBit(0); i < blocks.size(); i = reachable.nextClearBit(i + 1)) {
      result.add(i);
    }
    return result.build();
  }

  /**
   * Throws a {@link MalformedIrException} if any block is unreachable, since the statements in it
   * can never execute.
   */
  public void checkWellFormed() {
    ImmutableList<Integer> unreachable = unreachableBlocks();
    if (!unreachable.isEmpty()) {
      throw new MalformedIrException(
          String.format(
              "%s: unreachable blocks %s (first statement: %s)",
              functionName,
              unreachable.stream().map(i -> "B" + i).collect(Collectors.joining(", ")),
              blocks.get(unreachable.get(0)).statements.stream().findFirst().orElse(null)));
    }
  }

  /** The loops of this graph, found on first use. */
  public synchronized ImmutableList<Loop> loops() {
    if (loops == null) {
      loops = Loop.findLoops(this);
    }
    return loops;
  }

  /** Returns the innermost loop containing the given block, or null if there is none. */
  public @Nullable Loop containingLoop(int index) {
    Loop result = null;
    for (Loop loop : loops()) {
      if (loop.contains(index) && (result == null || loop.depth() > result.depth())) {
        result = loop;
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return blocks.stream().map(BasicBlock::toString).collect(Collectors.joining("\n"));
  }
}
