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
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * A natural loop found in a {@link ControlFlowGraph}: a header block, the set of blocks in its body
 * (including the header), and the blocks outside the body that the body can branch to.
 *
 * <p>Loops are found by {@link #findLoops}. Nested loops share blocks; each back edge gives a
 * distinct Loop.
 */
public final class Loop {

  /** This Loop's position in {@link ControlFlowGraph#loops()}. */
  final int index;

  private final int header;

  /** The block whose branch back to {@link #header} closes the loop. */
  private final int backEdgeSource;

  private final ImmutableSortedSet<Integer> body;

  private final ImmutableSortedSet<Integer> exits;

  /** The number of loops (including this one) whose bodies contain this loop's body. */
  private int depth = 1;

  Loop(int index, int header, int backEdgeSource, ImmutableSortedSet<Integer> body,
      ImmutableSortedSet<Integer> exits) {
    this.index = index;
    this.header = header;
    this.backEdgeSource = backEdgeSource;
    this.body = body;
    this.exits = exits;
  }

  public int index() {
    return index;
  }

  public int header() {
    return header;
  }

  public int backEdgeSource() {
    return backEdgeSource;
  }

  /** The indices of the blocks in this loop, header included, in ascending order. */
  public ImmutableSortedSet<Integer> body() {
    return body;
  }

  /** Blocks outside the body that are successors of a block in the body. */
  public ImmutableSortedSet<Integer> exits() {
    return exits;
  }

  /** 1 for a top-level loop, 2 for a loop directly nested in another, and so on. */
  public int depth() {
    return depth;
  }

  public boolean contains(int block) {
    return body.contains(block);
  }

  /**
   * Finds the loops in {@code cfg} using a depth-first traversal with an explicit stack. When a
   * successor is already on the stack it is a loop header, and the stack entries from it to the
   * current block are in the loop's body. The body is then completed with any other blocks that
   * reach the back edge without passing through the header (e.g. the other arm of a conditional
   * inside the loop).
   */
  static ImmutableList<Loop> findLoops(ControlFlowGraph cfg) {
    int numBlocks = cfg.numBlocks();
    List<Loop> loops = new ArrayList<>();
    BitSet visited = new BitSet(numBlocks);
    BitSet onStack = new BitSet(numBlocks);
    // Each frame is {block index, index of the next successor to visit}
    Deque<int[]> frames = new ArrayDeque<>();
    List<Integer> path = new ArrayList<>();
    frames.push(new int[] {0, 0});
    visited.set(0);
    onStack.set(0);
    path.add(0);
    while (!frames.isEmpty()) {
      int[] frame = frames.peek();
      BasicBlock block = cfg.block(frame[0]);
      if (frame[1] < block.successors.size()) {
        int succ = block.successors.get(frame[1]++);
        if (onStack.get(succ)) {
          List<Integer> slice = path.subList(path.indexOf(succ), path.size());
          loops.add(newLoop(cfg, loops.size(), succ, frame[0], slice));
        } else if (!visited.get(succ)) {
          visited.set(succ);
          onStack.set(succ);
          path.add(succ);
          frames.push(new int[] {succ, 0});
        }
      } else {
        frames.pop();
        onStack.clear(frame[0]);
        path.remove(path.size() - 1);
      }
    }
    for (Loop loop : loops) {
      for (Loop other : loops) {
        if (other != loop && other.body.containsAll(loop.body)
            && (other.body.size() > loop.body.size() || other.index < loop.index)) {
          loop.depth++;
        }
      }
    }
    return ImmutableList.copyOf(loops);
  }

  private static Loop newLoop(
      ControlFlowGraph cfg, int index, int header, int tail, List<Integer> stackSlice) {
    BitSet inBody = new BitSet(cfg.numBlocks());
    stackSlice.forEach(inBody::set);
    // Walk backwards from the tail; the header bounds the walk.
    Deque<Integer> pending = new ArrayDeque<>(stackSlice);
    while (!pending.isEmpty()) {
      int b = pending.pop();
      if (b == header) {
        continue;
      }
      for (int pred : cfg.block(b).predecessors) {
        if (!inBody.get(pred) && cfg.isReachable(pred)) {
          inBody.set(pred);
          pending.push(pred);
        }
      }
    }
    ImmutableSortedSet.Builder<Integer> body = ImmutableSortedSet.naturalOrder();
    ImmutableSortedSet.Builder<Integer> exits = ImmutableSortedSet.naturalOrder();
    inBody.stream()
        .forEach(
            b -> {
              body.add(b);
              cfg.block(b).successors.stream().filter(s -> !inBody.get(s)).forEach(exits::add);
            });
    return new Loop(index, header, tail, body.build(), exits.build());
  }

  @Override
  public String toString() {
    return "Loop" + index + "(header=B" + header + ", body=" + body + ", exits=" + exits + ")";
  }
}
