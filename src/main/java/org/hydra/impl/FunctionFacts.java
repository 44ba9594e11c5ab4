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
import java.util.ArrayList;
import java.util.List;
import org.hydra.impl.CallClassifier.Rule;
import org.hydra.ir.Expression;
import org.hydra.ir.Function;
import org.hydra.ir.Statement;
import org.jspecify.annotations.Nullable;

/**
 * The calls and assertions of one function in source order, with queries about what precedes a
 * given call. Nested statements and calls nested in expressions are included; a call's arguments
 * come before the call itself.
 */
final class FunctionFacts {

  /**
   * A call ({@code callName} non-null) or an assertion ({@code callName} null). {@code
   * readsOwner} is true if the site's statement reads a field whose name matches {@link
   * Rule#OWNER_ACCESS}.
   */
  record Site(
      int index,
      Statement statement,
      @Nullable String callName,
      ImmutableList<Expression> args,
      boolean readsOwner) {

    boolean isCall(Rule rule) {
      return callName != null && rule.matches(callName);
    }

    boolean isAssert() {
      return callName == null;
    }
  }

  final Function function;
  final ImmutableList<Site> sites;

  private FunctionFacts(Function function, ImmutableList<Site> sites) {
    this.function = function;
    this.sites = sites;
  }

  static FunctionFacts of(Function fn) {
    List<Site> sites = new ArrayList<>();
    for (Statement s : Statement.flatten(fn.body())) {
      boolean readsOwner = false;
      List<Expression.Call> nested = new ArrayList<>();
      for (Expression e : s.expressions()) {
        ImmutableList<Expression> all = Expression.flatten(e);
        for (int i = all.size() - 1; i >= 0; i--) {
          Expression sub = all.get(i);
          if (sub instanceof Expression.Call call) {
            nested.add(call);
          } else if (sub instanceof Expression.FieldAccess access
              && Rule.OWNER_ACCESS.matches(access.field())) {
            readsOwner = true;
          }
        }
      }
      for (Expression.Call call : nested) {
        sites.add(new Site(sites.size(), s, call.name(), call.args(), readsOwner));
      }
      if (s instanceof Statement.Invocation call) {
        sites.add(new Site(sites.size(), s, call.name(), call.args(), readsOwner));
      } else if (s instanceof Statement.Assert) {
        sites.add(new Site(sites.size(), s, null, ImmutableList.of(), readsOwner));
      }
    }
    return new FunctionFacts(fn, ImmutableList.copyOf(sites));
  }

  /** The calls matching {@code rule}, in order. */
  ImmutableList<Site> calls(Rule rule) {
    return sites.stream().filter(s -> s.isCall(rule)).collect(ImmutableList.toImmutableList());
  }

  boolean anyCall(Rule rule) {
    return sites.stream().anyMatch(s -> s.isCall(rule));
  }

  /** True if some site before {@code index} is a call matching {@code rule}. */
  boolean callBefore(Rule rule, int index) {
    return sites.subList(0, index).stream().anyMatch(s -> s.isCall(rule));
  }

  /**
   * True if the sender is read, the owner is read, and an assertion is made, all before the site
   * at {@code index}.
   */
  boolean ownershipVerifiedBefore(int index) {
    List<Site> before = sites.subList(0, index);
    boolean sender = before.stream().anyMatch(s -> s.isCall(Rule.SENDER_CHECK));
    boolean owner = before.stream().anyMatch(s -> s.isCall(Rule.OWNER_ACCESS) || s.readsOwner());
    boolean asserted = before.stream().anyMatch(Site::isAssert);
    return sender && owner && asserted;
  }
}
