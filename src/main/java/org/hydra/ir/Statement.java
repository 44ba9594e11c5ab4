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

package org.hydra.ir;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;
import org.hydra.util.StringUtil;
import org.jspecify.annotations.Nullable;

/**
 * A statement in a function body. {@link If} and {@link Loop} contain nested statement lists; all
 * other statements are straight-line.
 */
public interface Statement {

  /** The expressions evaluated directly by this statement (not those of nested statements). */
  default ImmutableList<Expression> expressions() {
    return ImmutableList.of();
  }

  /** Implemented by the three call statements. */
  interface Invocation extends Statement {
    String name();

    ImmutableList<Expression> args();

    @Override
    default ImmutableList<Expression> expressions() {
      return args();
    }
  }

  /** {@code assert!(condition, abortCode)}. */
  record Assert(Expression condition, String abortCode) implements Statement {
    @Override
    public ImmutableList<Expression> expressions() {
      return ImmutableList.of(condition);
    }

    @Override
    public String toString() {
      return "assert!(" + condition + ", " + abortCode + ")";
    }
  }

  /** {@code while (condition) { body }}; the condition is evaluated before each iteration. */
  record Loop(Expression condition, ImmutableList<Statement> body) implements Statement {
    public Loop {
      body = ImmutableList.copyOf(body);
    }

    @Override
    public ImmutableList<Expression> expressions() {
      return ImmutableList.of(condition);
    }

    @Override
    public String toString() {
      return "while (" + condition + ") " + body;
    }
  }

  /** {@code if (condition) { thenBody } else { elseBody }}; either body may be empty. */
  record If(
      Expression condition, ImmutableList<Statement> thenBody, ImmutableList<Statement> elseBody)
      implements Statement {
    public If {
      thenBody = ImmutableList.copyOf(thenBody);
      elseBody = ImmutableList.copyOf(elseBody);
    }

    @Override
    public ImmutableList<Expression> expressions() {
      return ImmutableList.of(condition);
    }

    @Override
    public String toString() {
      return "if (" + condition + ") " + thenBody + " else " + elseBody;
    }
  }

  /** {@code let variable = expression} or {@code variable = expression}. */
  record Assignment(String variable, Expression expression) implements Statement {
    @Override
    public ImmutableList<Expression> expressions() {
      return ImmutableList.of(expression);
    }

    @Override
    public String toString() {
      return variable + " = " + expression;
    }
  }

  /** Returns from the function; {@code expression} is null for functions returning unit. */
  record Return(@Nullable Expression expression) implements Statement {
    @Override
    public ImmutableList<Expression> expressions() {
      return (expression == null) ? ImmutableList.of() : ImmutableList.of(expression);
    }

    @Override
    public String toString() {
      return (expression == null) ? "return" : "return " + expression;
    }
  }

  /** A call whose target module is determined by its qualified name. */
  record Call(String name, ImmutableList<Expression> args) implements Invocation {
    public Call {
      args = ImmutableList.copyOf(args);
    }

    @Override
    public String toString() {
      return StringUtil.joinElements(name + "(", ")", args.size(), args::get);
    }
  }

  /** A call that the IR producer has resolved to another module. */
  record ExternalCall(String name, ImmutableList<Expression> args) implements Invocation {
    public ExternalCall {
      args = ImmutableList.copyOf(args);
    }

    @Override
    public String toString() {
      return StringUtil.joinElements("extern " + name + "(", ")", args.size(), args::get);
    }
  }

  /** A call that the IR producer has resolved to the current module. */
  record InternalCall(String name, ImmutableList<Expression> args) implements Invocation {
    public InternalCall {
      args = ImmutableList.copyOf(args);
    }

    @Override
    public String toString() {
      return StringUtil.joinElements("intern " + name + "(", ")", args.size(), args::get);
    }
  }

  /** Pushes a reference to the named field of the value on top of the operand stack. */
  record BorrowField(String field) implements Statement {}

  /** Pushes a reference to the global resource of the named type. */
  record BorrowGlobal(String type) implements Statement {}

  /** Pushes a reference to the named local. */
  record BorrowLocal(String variable) implements Statement {}

  /** Calls {@code action} on each statement in {@code body}, recursing into nested bodies. */
  static void forEachNested(List<Statement> body, Consumer<Statement> action) {
    for (Statement s : body) {
      action.accept(s);
      if (s instanceof If ifStmt) {
        forEachNested(ifStmt.thenBody, action);
        forEachNested(ifStmt.elseBody, action);
      } else if (s instanceof Loop loop) {
        forEachNested(loop.body, action);
      }
    }
  }

  /** Returns every statement in {@code body} in source order, nested statements included. */
  static ImmutableList<Statement> flatten(List<Statement> body) {
    ImmutableList.Builder<Statement> result = ImmutableList.builder();
    forEachNested(body, result::add);
    return result.build();
  }
}
