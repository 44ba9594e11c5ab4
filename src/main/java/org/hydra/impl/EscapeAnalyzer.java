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
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.hydra.impl.AbstractValue.InvariantReference;
import org.hydra.ir.Expression;
import org.hydra.ir.Field;
import org.hydra.ir.Function;
import org.hydra.ir.Module;
import org.hydra.ir.Statement;
import org.hydra.ir.Struct;
import org.jspecify.annotations.Nullable;

/**
 * Finds the points at which a reference to protected state becomes visible outside the function
 * that borrowed it.
 *
 * <p>The analysis interprets a function's statements in source order with an operand stack and a
 * record of the access path taken so far. Borrowing an invariant field or global state is an
 * escape; so is passing an {@link InvariantReference} to a call (High) or returning one
 * (Critical). The first escape in a statement ends the analysis of that statement; analysis
 * resumes with the next one. An assignment binds its target before that happens, so later
 * statements still see the reference.
 */
public final class EscapeAnalyzer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Where and how a reference escaped. */
  public record EscapePoint(
      String function,
      ImmutableList<String> path,
      String message,
      Severity severity,
      @Nullable String field) {}

  /** Thrown to end the analysis of a statement once an escape has been recorded. */
  private static final class EscapeDetected extends Exception {
    EscapeDetected(String message) {
      super(message, null, false, false);
    }
  }

  /** An escape found while evaluating an expression, reported once the statement is done. */
  private record Pending(String message, Severity severity, @Nullable String field) {}

  private final ImmutableSet<String> invariantFields;

  // Per-function state, reset by analyze()
  private Function fn;
  private final Deque<AbstractValue> stack = new ArrayDeque<>();
  private final List<String> path = new ArrayList<>();
  private final Map<String, AbstractValue> locals = new HashMap<>();
  private final List<Pending> pending = new ArrayList<>();
  private final List<EscapePoint> escapes = new ArrayList<>();

  public EscapeAnalyzer(Set<String> invariantFields) {
    this.invariantFields = ImmutableSet.copyOf(invariantFields);
  }

  /**
   * The fields whose contents are protected: every non-identity field of a key-ability struct, and
   * every field that declares an invariant.
   */
  public static ImmutableSet<String> invariantFields(Module module) {
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    for (Struct s : module.structs()) {
      for (Field f : s.fields()) {
        if (f.hasInvariant() || (s.isKey() && !f.isUid())) {
          result.add(f.name());
        }
      }
    }
    return result.build();
  }

  /** Returns the escapes in {@code function}, in the order they occur. */
  public ImmutableList<EscapePoint> analyze(Function function) {
    fn = function;
    stack.clear();
    path.clear();
    locals.clear();
    escapes.clear();
    for (Statement s : Statement.flatten(function.body())) {
      pending.clear();
      try {
        analyzeStatement(s);
      } catch (EscapeDetected e) {
        logger.atFine().log("%s: stopped at `%s`: %s", fn.name(), s, e.getMessage());
      }
    }
    return ImmutableList.copyOf(escapes);
  }

  /** Converts escape points into {@link ViolationType#REFERENCE_ESCAPE} violations. */
  static void report(Function function, List<EscapePoint> points, Findings findings) {
    for (EscapePoint p : points) {
      findings.add(
          new SafetyViolation(
              function.location(),
              ViolationType.REFERENCE_ESCAPE,
              p.message() + " in " + p.function() + " via " + String.join(" -> ", p.path()),
              p.severity(),
              new ViolationContext(
                  ImmutableList.of(p.function()),
                  (p.field() == null) ? ImmutableList.of() : ImmutableList.of(p.field()),
                  ImmutableList.of("Copy the value out instead of exposing a reference to it"),
                  "Section 4.5: Reference Safety")));
    }
  }

  private void analyzeStatement(Statement s) throws EscapeDetected {
    if (s instanceof Statement.BorrowField borrow) {
      path.add(borrow.field());
      if (invariantFields.contains(borrow.field())) {
        stack.push(new InvariantReference(borrow.field()));
        escape("Access to invariant field " + borrow.field(), Severity.HIGH, borrow.field());
      } else if (stack.peek() instanceof InvariantReference) {
        // A field of protected state is protected too
        stack.push(new InvariantReference(borrow.field()));
      } else {
        stack.push(AbstractValue.SAFE_REFERENCE);
      }
    } else if (s instanceof Statement.BorrowGlobal global) {
      String element = "global<" + global.type() + ">";
      path.add(element);
      stack.push(new InvariantReference(element));
      escape("Access to global state " + global.type(), Severity.HIGH, null);
    } else if (s instanceof Statement.BorrowLocal local) {
      path.add(local.variable());
      stack.push(AbstractValue.SAFE_REFERENCE);
    } else if (s instanceof Statement.Invocation call) {
      stack.push(evaluateCall(call.name(), call.args()));
      checkPending();
    } else if (s instanceof Statement.Assignment assign) {
      AbstractValue value = evaluate(assign.expression());
      locals.put(assign.variable(), value);
      checkPending();
    } else if (s instanceof Statement.Return ret) {
      if (ret.expression() != null) {
        stack.push(evaluate(ret.expression()));
      }
      checkPending();
      for (AbstractValue v : stack) {
        if (v instanceof InvariantReference inv) {
          escape(
              "InvariantReference to " + inv.field() + " leaked through return",
              Severity.CRITICAL,
              inv.field());
        }
      }
    } else {
      for (Expression e : s.expressions()) {
        var unused = evaluate(e);
      }
      checkPending();
    }
  }

  private void escape(String message, Severity severity, @Nullable String field)
      throws EscapeDetected {
    escapes.add(new EscapePoint(fn.name(), ImmutableList.copyOf(path), message, severity, field));
    throw new EscapeDetected(message);
  }

  private void checkPending() throws EscapeDetected {
    if (!pending.isEmpty()) {
      Pending first = pending.get(0);
      escape(first.message(), first.severity(), first.field());
    }
  }

  private AbstractValue evaluateCall(String name, List<Expression> args) {
    path.add("call<" + name + ">");
    for (Expression arg : args) {
      if (evaluate(arg) instanceof InvariantReference inv) {
        pending.add(
            new Pending(
                "InvariantReference to " + inv.field() + " passed to function " + name,
                Severity.HIGH,
                inv.field()));
      }
    }
    return AbstractValue.NON_REFERENCE;
  }

  private AbstractValue evaluate(Expression expr) {
    if (expr instanceof Expression.Variable var) {
      return locals.getOrDefault(var.name(), AbstractValue.NON_REFERENCE);
    } else if (expr instanceof Expression.Move move) {
      return locals.getOrDefault(move.variable(), AbstractValue.NON_REFERENCE);
    } else if (expr instanceof Expression.Borrow borrow) {
      return evaluateBorrow(borrow.target());
    } else if (expr instanceof Expression.Deref) {
      // A dereference copies the value; nothing inside it can escape.
      return AbstractValue.NON_REFERENCE;
    } else if (expr instanceof Expression.Call call) {
      return evaluateCall(call.name(), call.args());
    }
    for (Expression child : expr.children()) {
      var unused = evaluate(child);
    }
    return AbstractValue.NON_REFERENCE;
  }

  private AbstractValue evaluateBorrow(Expression target) {
    if (target instanceof Expression.FieldAccess access) {
      AbstractValue base = evaluate(access.base());
      if (invariantFields.contains(access.field()) || base instanceof InvariantReference) {
        path.add(access.field());
        pending.add(
            new Pending(
                "Access to invariant field " + access.field(), Severity.HIGH, access.field()));
        return new InvariantReference(access.field());
      }
      return AbstractValue.SAFE_REFERENCE;
    } else if (target instanceof Expression.Variable var) {
      path.add(var.name());
      AbstractValue v = locals.getOrDefault(var.name(), AbstractValue.NON_REFERENCE);
      return (v instanceof InvariantReference) ? v : AbstractValue.SAFE_REFERENCE;
    }
    var unused = evaluate(target);
    return AbstractValue.SAFE_REFERENCE;
  }
}
