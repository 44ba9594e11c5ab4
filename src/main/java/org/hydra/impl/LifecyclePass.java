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

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import org.hydra.impl.CallClassifier.Rule;
import org.hydra.impl.FunctionFacts.Site;
import org.hydra.ir.Expression;
import org.hydra.ir.Function;
import org.hydra.ir.Module;
import org.hydra.ir.Parameter;
import org.hydra.ir.Statement;
import org.hydra.ir.Struct;
import org.hydra.util.StringUtil;
import org.jspecify.annotations.Nullable;

/**
 * Drives an {@link ObjectLifecycleTracker} over a module: object parameters and constructions of
 * key-ability structs create lifecycles, and transfer, shared-access, capability and deletion call
 * sites (as classified by {@link CallClassifier}) add events to them.
 */
final class LifecyclePass {
  private final Module module;
  private final AnalyzerConfig config;
  private final ObjectLifecycleTracker tracker = new ObjectLifecycleTracker();

  LifecyclePass(Module module, AnalyzerConfig config) {
    this.module = module;
    this.config = config;
  }

  ObjectLifecycleTracker tracker() {
    return tracker;
  }

  void run(Function fn) {
    Map<String, ObjectId> objects = new HashMap<>();
    Map<String, CapId> capabilities = new HashMap<>();
    for (Parameter p : fn.parameters()) {
      String type = p.type().baseName();
      if (module.isKeyStruct(type)) {
        ObjectId id = new ObjectId(module.name(), type, fn.name() + "." + p.name());
        objects.put(p.name(), id);
        tracker.recordExisting(id, "caller");
      } else if (CallClassifier.isCapabilityType(type)) {
        CapId cap = CapId.of(module.name(), type);
        capabilities.put(p.name(), cap);
        tracker.grantCapability(fn.name(), cap);
      }
    }
    FunctionFacts facts = FunctionFacts.of(fn);
    int next = 0;
    for (Statement s : Statement.flatten(fn.body())) {
      // Handle the call sites belonging to this statement, in order
      while (next < facts.sites.size() && facts.sites.get(next).statement() == s) {
        Site site = facts.sites.get(next);
        if (!site.isAssert()) {
          visitCall(fn, facts, site, objects, capabilities);
        }
        next++;
      }
      if (s instanceof Statement.Assignment assign) {
        bind(fn, assign.variable(), assign.expression(), objects, capabilities);
      }
    }
  }

  private void bind(
      Function fn,
      String variable,
      Expression expr,
      Map<String, ObjectId> objects,
      Map<String, CapId> capabilities) {
    if (expr instanceof Expression.Pack pack) {
      Struct struct = module.findStruct(pack.structName()).orElse(null);
      if (struct != null && struct.isKey()) {
        ObjectId id = new ObjectId(module.name(), struct.name(), fn.name() + "." + variable);
        objects.put(variable, id);
        tracker.recordCreation(
            id, struct.hasUidField(), struct.hasField("owner") ? "owner" : null, fn.location());
      } else if (CallClassifier.isCapabilityType(pack.structName())) {
        CapId cap = CapId.of(module.name(), pack.structName());
        capabilities.put(variable, cap);
        tracker.grantCapability(fn.name(), cap);
      }
      return;
    }
    String source = variableOf(expr);
    if (source != null && objects.containsKey(source)) {
      objects.put(variable, objects.get(source));
    } else if (source != null && capabilities.containsKey(source)) {
      capabilities.put(variable, capabilities.get(source));
    } else {
      objects.remove(variable);
      capabilities.remove(variable);
    }
  }

  /** The variable an argument refers to, through any borrow or move. */
  private static @Nullable String variableOf(Expression expr) {
    if (expr instanceof Expression.Variable var) {
      return var.name();
    } else if (expr instanceof Expression.Move move) {
      return move.variable();
    } else if (expr instanceof Expression.Borrow borrow) {
      return variableOf(borrow.target());
    }
    return null;
  }

  private void visitCall(
      Function fn,
      FunctionFacts facts,
      Site site,
      Map<String, ObjectId> objects,
      Map<String, CapId> capabilities) {
    String name = site.callName();
    if (config.checkTransferSafety() && site.isCall(Rule.TRANSFER)) {
      boolean guarded = facts.ownershipVerifiedBefore(site.index());
      String to = (site.args().size() > 1) ? site.args().get(1).toString() : "recipient";
      forEachObject(
          site, objects, id -> tracker.recordTransfer(id, to, guarded, fn.location()));
    }
    if (config.checkSharedObjects() && site.isCall(Rule.SHARED_ACCESS)) {
      boolean write = Rule.WRITE_INTENT.matches(name);
      boolean synced =
          facts.callBefore(Rule.SYNCHRONIZATION, site.index())
              || Rule.SYNCHRONIZATION.matches(StringUtil.memberOf(name));
      forEachObject(
          site, objects, id -> tracker.recordSharedAccess(id, write, synced, fn.location()));
    }
    if (config.checkCapabilitySafety() && site.isCall(Rule.CAPABILITY)) {
      ObjectId subject = null;
      CapId presented = null;
      for (Expression arg : site.args()) {
        String v = variableOf(arg);
        if (v != null && capabilities.containsKey(v)) {
          presented = capabilities.get(v);
        } else if (v != null && subject == null) {
          subject = objects.get(v);
        }
      }
      CapId required =
          (presented != null)
              ? presented
              : CapId.of(StringUtil.moduleOf(name), StringUtil.memberOf(name));
      tracker.verifyCapability(fn.name(), required, subject, fn.location());
    }
    if (site.isCall(Rule.DELETION)) {
      forEachObject(site, objects, id -> tracker.recordDeletion(id, fn.location()));
    }
  }

  private static void forEachObject(
      Site site, Map<String, ObjectId> objects, Consumer<ObjectId> action) {
    for (Expression arg : site.args()) {
      String v = variableOf(arg);
      if (v != null && objects.containsKey(v)) {
        action.accept(objects.get(v));
      }
    }
  }
}
