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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import org.hydra.util.StringUtil;

/** An expression in a function body. Expressions are immutable trees. */
public interface Expression {

  /** The direct subexpressions of this expression, in evaluation order. */
  default ImmutableList<Expression> children() {
    return ImmutableList.of();
  }

  /** A reference to a local variable or parameter. */
  record Variable(String name) implements Expression {
    @Override
    public String toString() {
      return name;
    }
  }

  /** Reads {@code base.field}. */
  record FieldAccess(Expression base, String field) implements Expression {
    @Override
    public ImmutableList<Expression> children() {
      return ImmutableList.of(base);
    }

    @Override
    public String toString() {
      return base + "." + field;
    }
  }

  /** A function call used as a value. */
  record Call(String name, ImmutableList<Expression> args) implements Expression {
    public Call {
      args = ImmutableList.copyOf(args);
    }

    @Override
    public ImmutableList<Expression> children() {
      return args;
    }

    @Override
    public String toString() {
      return StringUtil.joinElements(name + "(", ")", args.size(), args::get);
    }
  }

  /** A literal, printed as it appeared in source. */
  record Value(String literal) implements Expression {
    @Override
    public String toString() {
      return literal;
    }
  }

  /** {@code &target} or {@code &mut target}. */
  record Borrow(Expression target, boolean mutable) implements Expression {
    @Override
    public ImmutableList<Expression> children() {
      return ImmutableList.of(target);
    }

    @Override
    public String toString() {
      return (mutable ? "&mut " : "&") + target;
    }
  }

  /** {@code *target}; reads a copy of the referenced value. */
  record Deref(Expression target) implements Expression {
    @Override
    public ImmutableList<Expression> children() {
      return ImmutableList.of(target);
    }

    @Override
    public String toString() {
      return "*" + target;
    }
  }

  /** {@code move variable}. */
  record Move(String variable) implements Expression {
    @Override
    public String toString() {
      return "move " + variable;
    }
  }

  /** Struct construction, {@code S { f: e, ... }}. */
  record Pack(String structName, ImmutableMap<String, Expression> fields) implements Expression {
    public Pack {
      fields = ImmutableMap.copyOf(fields);
    }

    @Override
    public ImmutableList<Expression> children() {
      return fields.values().asList();
    }

    @Override
    public String toString() {
      return structName + " " + fields;
    }
  }

  /** A binary operator application, e.g. comparison or arithmetic. */
  record BinaryOp(String op, Expression left, Expression right) implements Expression {
    @Override
    public ImmutableList<Expression> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    public String toString() {
      return "(" + left + " " + op + " " + right + ")";
    }
  }

  /** Returns the names of all variables read anywhere inside {@code expr}. */
  static ImmutableSet<String> variablesIn(Expression expr) {
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    Deque<Expression> pending = new ArrayDeque<>();
    pending.add(expr);
    for (Expression e = pending.poll(); e != null; e = pending.poll()) {
      if (e instanceof Variable v) {
        result.add(v.name);
      } else if (e instanceof Move m) {
        result.add(m.variable);
      }
      pending.addAll(e.children());
    }
    return result.build();
  }

  /** Returns all expressions in the tree rooted at {@code expr}, root first. */
  static ImmutableList<Expression> flatten(Expression expr) {
    ImmutableList.Builder<Expression> result = ImmutableList.builder();
    Deque<Expression> pending = new ArrayDeque<>();
    pending.push(expr);
    while (!pending.isEmpty()) {
      Expression e = pending.pop();
      result.add(e);
      ImmutableList<Expression> children = e.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(children.get(i));
      }
    }
    return result.build();
  }
}
