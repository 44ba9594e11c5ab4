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
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.hydra.ir.Expression;
import org.hydra.ir.Function;
import org.hydra.ir.Module;
import org.hydra.ir.Statement;
import org.hydra.util.StringUtil;

/**
 * Builds the call graph among a module's own functions and reports recursion and call chains
 * deeper than the configured limit. Traversal uses an explicit stack, so deep or cyclic graphs
 * cannot overflow the Java stack.
 */
public final class CallGraphChecker {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String REFERENCE = "Section 4.7: Call Stack Limits";

  private final Module module;
  private final ImmutableList<Function> functions;
  private final int maxCallStackDepth;

  /** Edges from caller name to callee name; only callees defined in the module are included. */
  private final ImmutableSetMultimap<String, String> edges;

  public CallGraphChecker(Module module, List<Function> functions, int maxCallStackDepth) {
    this.module = module;
    this.functions = ImmutableList.copyOf(functions);
    this.maxCallStackDepth = maxCallStackDepth;
    this.edges = buildEdges();
  }

  public ImmutableSetMultimap<String, String> edges() {
    return edges;
  }

  private ImmutableSetMultimap<String, String> buildEdges() {
    Set<String> names = new HashSet<>();
    functions.forEach(fn -> names.add(fn.name()));
    ImmutableSetMultimap.Builder<String, String> builder = ImmutableSetMultimap.builder();
    for (Function fn : functions) {
      for (Statement s : Statement.flatten(fn.body())) {
        for (Expression e : s.expressions()) {
          for (Expression sub : Expression.flatten(e)) {
            if (sub instanceof Expression.Call call) {
              addEdge(builder, names, fn, s, call.name());
            }
          }
        }
        if (s instanceof Statement.Invocation call) {
          addEdge(builder, names, fn, s, call.name());
        }
      }
    }
    return builder.build();
  }

  private void addEdge(
      ImmutableSetMultimap.Builder<String, String> builder,
      Set<String> names,
      Function caller,
      Statement s,
      String callName) {
    if (!TraceAnalyzer.calleeModule(module, s, callName).equals(module.name())) {
      return;
    }
    String callee = StringUtil.memberOf(callName);
    if (names.contains(callee)) {
      builder.put(caller.name(), callee);
    }
  }

  /** A DFS frame: a function and the index of the next callee to visit. */
  private static final class Frame {
    final String function;
    final ImmutableList<String> callees;
    int next;

    Frame(String function, ImmutableList<String> callees) {
      this.function = function;
      this.callees = callees;
    }
  }

  public void check(Findings findings) {
    // Longest chain (in functions) starting at each finished node, ignoring back edges
    Map<String, Integer> depth = new HashMap<>();
    Set<String> onStack = new HashSet<>();
    Set<List<String>> cycles = new HashSet<>();
    for (Function root : functions) {
      if (depth.containsKey(root.name())) {
        continue;
      }
      Deque<Frame> stack = new ArrayDeque<>();
      stack.push(frame(root.name()));
      onStack.add(root.name());
      while (!stack.isEmpty()) {
        Frame top = stack.peek();
        if (top.next < top.callees.size()) {
          String callee = top.callees.get(top.next++);
          if (onStack.contains(callee)) {
            List<String> cycle = cycleOf(stack, callee);
            if (cycles.add(cycle)) {
              reportCycle(cycle, findings);
            }
          } else if (!depth.containsKey(callee)) {
            stack.push(frame(callee));
            onStack.add(callee);
          }
        } else {
          stack.pop();
          onStack.remove(top.function);
          int d = 1;
          for (String callee : top.callees) {
            Integer calleeDepth = depth.get(callee);
            if (calleeDepth != null) {
              d = Math.max(d, calleeDepth + 1);
            }
          }
          depth.put(top.function, d);
        }
      }
    }
    Set<String> called = new HashSet<>(edges.values());
    for (Function fn : functions) {
      int d = depth.getOrDefault(fn.name(), 1);
      if (!called.contains(fn.name()) && d > maxCallStackDepth) {
        findings.add(
            new SafetyViolation(
                fn.location(),
                ViolationType.CALL_STACK_VIOLATION,
                String.format(
                    "Call chain from %s reaches depth %d (limit %d)",
                    fn.name(), d, maxCallStackDepth),
                Severity.HIGH,
                ViolationContext.of(fn.name(), "Flatten the call chain", REFERENCE)));
      }
    }
    logger.atFine().log("Call graph of %s: %d edges", module.name(), edges.size());
  }

  private Frame frame(String function) {
    return new Frame(function, edges.get(function).asList());
  }

  /**
   * Returns the cycle closed by an edge to {@code target}, starting at {@code target} in call
   * order. {@code stack} has the most recent frame first.
   */
  private static List<String> cycleOf(Deque<Frame> stack, String target) {
    List<String> cycle = new ArrayList<>();
    for (Frame f : stack) {
      cycle.add(0, f.function);
      if (f.function.equals(target)) {
        break;
      }
    }
    return cycle;
  }

  private void reportCycle(List<String> cycle, Findings findings) {
    String first = cycle.get(0);
    Function fn = module.findFunction(first).orElseThrow();
    findings.add(
        new SafetyViolation(
            fn.location(),
            ViolationType.CALL_STACK_VIOLATION,
            String.format(
                "Recursive call cycle: %s -> %s", String.join(" -> ", cycle), first),
            Severity.HIGH,
            new ViolationContext(
                ImmutableList.copyOf(cycle),
                ImmutableList.of(),
                ImmutableList.of("Replace the recursion with a bounded loop"),
                REFERENCE)));
  }
}
