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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import org.hydra.impl.SecurityEvent.BoundaryKind;
import org.hydra.ir.Expression;
import org.hydra.ir.Function;
import org.hydra.ir.Module;
import org.hydra.ir.Statement;
import org.hydra.util.StringUtil;

/**
 * Walks the calls of a module with a model call stack and records the {@link SecurityEvent}s that
 * occur at module boundaries.
 *
 * <p>Each call pushes a frame; each return pops one, and a popped frame that had crossed into
 * another module produces a {@link SecurityEvent.ReturnToUntrusted}. The stack is reset at the
 * start of each function.
 */
public final class TraceAnalyzer {

  /** One frame of the model call stack. */
  record CallContext(
      String callerModule, String calleeModule, boolean boundaryCrossed, int depth) {}

  private final ImmutableSet<String> trustedModules;

  private final Deque<CallContext> stack = new ArrayDeque<>();
  private final List<SecurityEvent> events = new ArrayList<>();
  private final List<String> callChain = new ArrayList<>();

  public TraceAnalyzer(Set<String> trustedModules) {
    this.trustedModules = ImmutableSet.copyOf(trustedModules);
  }

  /** The events recorded so far. */
  public ImmutableList<SecurityEvent> events() {
    return ImmutableList.copyOf(events);
  }

  /** The targets of all calls seen so far, in order. */
  public ImmutableList<String> callChain() {
    return ImmutableList.copyOf(callChain);
  }

  /** Returns the module that a call named {@code name} in {@code module} targets. */
  static String calleeModule(Module module, Statement call, String name) {
    if (call instanceof Statement.InternalCall
        || StringUtil.isSelfQualified(name)
        || !StringUtil.isQualified(name)) {
      return module.name();
    }
    return StringUtil.moduleOf(name);
  }

  public void trace(Module module) {
    for (Function fn : module.functions()) {
      stack.clear();
      for (Statement s : Statement.flatten(fn.body())) {
        for (Expression e : s.expressions()) {
          for (Expression sub : Expression.flatten(e)) {
            if (sub instanceof Expression.Call call) {
              enter(module, fn, s, call.name());
            }
          }
        }
        if (s instanceof Statement.Invocation call) {
          enter(module, fn, s, call.name());
        } else if (s instanceof Statement.Return) {
          exit(fn);
        } else if (s instanceof Statement.BorrowGlobal global) {
          events.add(new SecurityEvent.StateAccess(module.name(), global.type(), fn.name()));
        }
      }
    }
  }

  private void enter(Module module, Function fn, Statement s, String name) {
    String from = module.name();
    String to = calleeModule(module, s, name);
    boolean crossed = !from.equals(to);
    if (crossed) {
      boolean fromTrusted = trustedModules.contains(from);
      boolean toTrusted = trustedModules.contains(to);
      BoundaryKind kind;
      if (fromTrusted && !toTrusted) {
        kind = BoundaryKind.TRUSTED_TO_UNTRUSTED;
      } else if (!fromTrusted && toTrusted) {
        kind = BoundaryKind.UNTRUSTED_TO_TRUSTED;
      } else {
        kind = BoundaryKind.CROSS_MODULE;
      }
      events.add(new SecurityEvent.BoundaryCrossing(from, to, kind, fn.name(), name));
      if (kind == BoundaryKind.UNTRUSTED_TO_TRUSTED) {
        events.add(new SecurityEvent.CallToTrusted(from, to, fn.name(), name));
      }
    }
    callChain.add(name);
    stack.push(new CallContext(from, to, crossed, stack.size() + 1));
  }

  private void exit(Function fn) {
    CallContext frame = stack.poll();
    if (frame != null && frame.boundaryCrossed()) {
      events.add(
          new SecurityEvent.ReturnToUntrusted(
              frame.calleeModule(), frame.callerModule(), fn.name()));
    }
  }
}
