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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.hydra.code.BasicBlock;
import org.hydra.code.ControlFlowGraph;
import org.hydra.code.Loop;
import org.hydra.impl.AbstractValue.InvariantReference;
import org.hydra.impl.ReferenceState.Kind;
import org.hydra.ir.Function;
import org.jspecify.annotations.Nullable;

/**
 * Re-runs the statements of each loop body for a small, fixed number of iterations, starting from
 * the state on entry to the loop, and checks what changes from one iteration to the next.
 *
 * <p>A variable that starts an iteration as a mutable borrow and is moved during it, when that did
 * not happen on the previous iteration, is reported as an unsafe mutation; such bugs only show up
 * once the body has run at least twice. Loop invariants are derived from the entry state and
 * checked after every iteration; one that fails on any iteration is reported at loop exit.
 *
 * <p>Bounded iteration is a smoke check rather than a proof: a pattern that needs more iterations
 * than {@link #iterations} to appear is missed.
 */
public final class LoopAnalyzer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final int DEFAULT_ITERATIONS = 3;

  /** The invariants checked on each loop. */
  public record Invariant(Invariant.Kind kind, String variable, int bound) {
    public enum Kind {
      /** The variable is not moved, released or leaked inside the loop. */
      NO_ESCAPE,
      /** The variable has the same state at the end of every iteration as on entry. */
      STATE_PRESERVED,
      /** The variable's state changes at most {@code bound} times per iteration. */
      MUTATION_BOUNDED
    }

    @Override
    public String toString() {
      return (kind == Kind.MUTATION_BOUNDED)
          ? kind + "(" + variable + ", " + bound + ")"
          : kind + "(" + variable + ")";
    }
  }

  /**
   * What happened when a loop was analyzed. {@code brokenAt} maps each invariant that failed to the
   * (1-based) iteration on which it first failed.
   */
  public record Report(
      Loop loop,
      int iterationsRun,
      boolean stabilized,
      ImmutableList<Invariant> invariants,
      ImmutableMap<Invariant, Integer> brokenAt) {

    public boolean maintained(Invariant invariant) {
      return !brokenAt.containsKey(invariant);
    }
  }

  private final FlowAnalyzer flow;
  private final int iterations;
  private final int maxLoopDepth;

  public LoopAnalyzer(FlowAnalyzer flow, int iterations, int maxLoopDepth) {
    Preconditions.checkArgument(iterations >= 2, "at least two iterations are needed");
    this.flow = flow;
    this.iterations = iterations;
    this.maxLoopDepth = maxLoopDepth;
  }

  /** Analyzes every loop in the function, adding what it finds to {@code findings}. */
  public ImmutableList<Report> analyze(FlowAnalyzer.Result flowResult, Findings findings) {
    ImmutableList.Builder<Report> reports = ImmutableList.builder();
    for (Loop loop : flow.cfg().loops()) {
      Function fn = flow.function();
      if (loop.depth() > maxLoopDepth) {
        findings.add(
            new SafetyViolation(
                fn.location(),
                ViolationType.DOS_VECTOR,
                String.format(
                    "Loop at B%d in %s is nested %d deep (limit %d)",
                    loop.header(), fn.name(), loop.depth(), maxLoopDepth),
                Severity.MEDIUM,
                ViolationContext.of(
                    fn.name(),
                    "Flatten the nested loops or bound their iteration counts",
                    "Section 6.1: Resource Bounds")));
      }
      reports.add(analyzeLoop(loop, flowResult, findings));
    }
    return reports.build();
  }

  /** Records what one iteration did. */
  private static class IterationListener implements FlowAnalyzer.Listener {
    final Set<String> movedFromMutableBorrow = new HashSet<>();
    final Set<String> escaped = new HashSet<>();
    final Map<String, Integer> changes = new HashMap<>();
    final List<ReferenceLeak> leaks = new ArrayList<>();

    @Override
    public void violation(SafetyViolation violation) {
      // The flow analysis reports these for the loop as a whole.
    }

    @Override
    public void leak(ReferenceLeak leak) {
      leaks.add(leak);
      escaped.add(leak.variable());
    }

    @Override
    public void transition(String variable, ReferenceState from, ReferenceState to) {
      if (from.isBorrowed(BorrowKind.MUTABLE_WRITE) && to.kind() == Kind.MOVED) {
        movedFromMutableBorrow.add(variable);
      }
      if (to.kind() == Kind.MOVED || to.kind() == Kind.RELEASED) {
        escaped.add(variable);
      }
      if (!from.equals(to)) {
        changes.merge(variable, 1, Integer::sum);
      }
    }
  }

  Report analyzeLoop(Loop loop, FlowAnalyzer.Result flowResult, Findings findings) {
    Function fn = flow.function();
    ControlFlowGraph cfg = flow.cfg();
    FlowState entry = entryState(loop, flowResult);
    ImmutableList<Invariant> invariants = deriveInvariants(entry);
    Map<Invariant, Integer> brokenAt = new LinkedHashMap<>();
    List<Integer> order = new ArrayList<>(loop.body());
    order.sort((a, b) -> cfg.order(a) - cfg.order(b));

    FlowState previous = entry;
    @Nullable IterationListener previousListener = null;
    Map<Integer, FlowState> exitStates = new LinkedHashMap<>();
    int iteration = 0;
    boolean stabilized = false;
    while (iteration < iterations) {
      iteration++;
      IterationListener listener = new IterationListener();
      exitStates.clear();
      FlowState end = runIteration(loop, order, previous, listener, exitStates);
      if (previousListener != null) {
        for (String v : listener.movedFromMutableBorrow) {
          if (!previousListener.movedFromMutableBorrow.contains(v)) {
            findings.add(
                new ReferenceLeak(
                    fn.location(),
                    ViolationType.REFERENCE_ESCAPE,
                    String.format(
                        "Unsafe mutation inside loop at B%d in %s: %s is moved out of a mutable"
                            + " borrow on iteration %d",
                        loop.header(), fn.name(), v, iteration),
                    Severity.CRITICAL,
                    v,
                    null));
          }
        }
      }
      for (Invariant inv : invariants) {
        if (!brokenAt.containsKey(inv) && !holds(inv, entry, end, listener)) {
          brokenAt.put(inv, iteration);
        }
      }
      if (end == null || end.equals(previous)) {
        stabilized = true;
        break;
      }
      previous = end;
      previousListener = listener;
    }
    brokenAt.forEach(
        (inv, at) ->
            findings.add(
                new SafetyViolation(
                    fn.location(),
                    ViolationType.INVARIANT_VIOLATION,
                    String.format(
                        "Loop invariant %s not maintained by loop at B%d in %s (broken on"
                            + " iteration %d)",
                        inv, loop.header(), fn.name(), at),
                    Severity.HIGH,
                    ViolationContext.of(
                        fn.name(),
                        "Keep " + inv.variable() + " unchanged inside the loop",
                        "Section 4.4: Loop Invariants"))));
    checkExits(loop, entry, exitStates, findings);
    logger.atFine().log(
        "%s: %s ran %d iterations, stabilized=%s, broken=%s",
        fn.name(), loop, iteration, stabilized, brokenAt);
    return new Report(loop, iteration, stabilized, invariants, ImmutableMap.copyOf(brokenAt));
  }

  /** The state on the edges that enter the loop from outside it. */
  private FlowState entryState(Loop loop, FlowAnalyzer.Result flowResult) {
    ControlFlowGraph cfg = flow.cfg();
    BasicBlock header = cfg.block(loop.header());
    Map<Integer, FlowState> incoming = new LinkedHashMap<>();
    IterationListener ignored = new IterationListener();
    for (int pred : header.predecessors()) {
      if (!loop.contains(pred) && cfg.isReachable(pred)) {
        FlowState predEntry = flowResult.entryState(pred);
        incoming.put(pred, flow.analyzeBlock(cfg.block(pred), predEntry, ignored));
      }
    }
    return incoming.isEmpty() ? FlowState.EMPTY : flow.merge(header, incoming, ignored);
  }

  /**
   * Runs one pass over the loop body starting at the header with {@code start}. Returns the state
   * carried back to the header, or null if no path gets back there.
   */
  private @Nullable FlowState runIteration(
      Loop loop,
      List<Integer> order,
      FlowState start,
      IterationListener listener,
      Map<Integer, FlowState> exitStates) {
    ControlFlowGraph cfg = flow.cfg();
    Map<Integer, Map<Integer, FlowState>> delivered = new HashMap<>();
    Map<Integer, FlowState> backEdges = new LinkedHashMap<>();
    for (int b : order) {
      BasicBlock block = cfg.block(b);
      FlowState in;
      if (b == loop.header()) {
        in = start;
      } else {
        Map<Integer, FlowState> incoming = delivered.get(b);
        if (incoming == null) {
          continue;
        }
        in = flow.merge(block, incoming, listener);
      }
      FlowState out = flow.analyzeBlock(block, in, listener);
      List<Integer> succs = block.successors();
      for (int i = 0; i < succs.size(); i++) {
        int succ = succs.get(i);
        FlowState edgeState = out;
        if (block.isSplit()) {
          edgeState =
              edgeState.withCondition(
                  new PathCondition.Custom(block.condition().toString(), i == 0));
        }
        if (succ == loop.header()) {
          backEdges.put(b, edgeState);
        } else if (loop.contains(succ)) {
          delivered.computeIfAbsent(succ, k -> new LinkedHashMap<>()).put(b, edgeState);
        } else {
          exitStates.put(succ, edgeState);
        }
      }
    }
    if (backEdges.isEmpty()) {
      return null;
    }
    return (backEdges.size() == 1)
        ? backEdges.values().iterator().next()
        : flow.merge(cfg.block(loop.header()), backEdges, listener);
  }

  static ImmutableList<Invariant> deriveInvariants(FlowState entry) {
    ImmutableList.Builder<Invariant> result = ImmutableList.builder();
    entry
        .variables()
        .forEach(
            (v, state) -> {
              boolean mutableBorrow = state.isBorrowed(BorrowKind.MUTABLE_WRITE);
              if (mutableBorrow || state.value() instanceof InvariantReference) {
                result.add(new Invariant(Invariant.Kind.NO_ESCAPE, v, 0));
              }
              if (state.kind() == Kind.BORROWED) {
                result.add(new Invariant(Invariant.Kind.STATE_PRESERVED, v, 0));
              }
              if (mutableBorrow) {
                result.add(new Invariant(Invariant.Kind.MUTATION_BOUNDED, v, 1));
              }
            });
    return result.build();
  }

  private static boolean holds(
      Invariant inv, FlowState entry, @Nullable FlowState end, IterationListener listener) {
    switch (inv.kind()) {
      case NO_ESCAPE:
        return !listener.escaped.contains(inv.variable());
      case STATE_PRESERVED:
        return end == null || end.get(inv.variable()).equals(entry.get(inv.variable()));
      case MUTATION_BOUNDED:
        return listener.changes.getOrDefault(inv.variable(), 0) <= inv.bound();
    }
    throw new AssertionError();
  }

  /**
   * Variables first bound inside the loop that leave it holding a mutable borrow or a reference to
   * an invariant field escape the loop.
   */
  private void checkExits(
      Loop loop, FlowState entry, Map<Integer, FlowState> exitStates, Findings findings) {
    Function fn = flow.function();
    exitStates.forEach(
        (exit, state) ->
            state
                .variables()
                .forEach(
                    (v, s) -> {
                      if (!entry.variables().containsKey(v)
                          && (s.isBorrowed(BorrowKind.MUTABLE_WRITE)
                              || s.value() instanceof InvariantReference)) {
                        findings.add(
                            new ReferenceLeak(
                                fn.location(),
                                ViolationType.REFERENCE_ESCAPE,
                                String.format(
                                    "%s escapes loop at B%d through exit B%d in %s",
                                    v, loop.header(), exit, fn.name()),
                                Severity.HIGH,
                                v,
                                (s.value() instanceof InvariantReference inv)
                                    ? inv.field()
                                    : null));
                      }
                    }));
  }
}
