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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import org.hydra.code.BasicBlock;
import org.hydra.code.ControlFlowGraph;
import org.hydra.impl.AbstractValue.CapabilityReference;
import org.hydra.impl.AbstractValue.InvariantReference;
import org.hydra.impl.AbstractValue.ObjectReference;
import org.hydra.impl.ReferenceState.Borrowed;
import org.hydra.impl.ReferenceState.Initialized;
import org.hydra.impl.ReferenceState.Kind;
import org.hydra.ir.Expression;
import org.hydra.ir.Function;
import org.hydra.ir.Module;
import org.hydra.ir.Parameter;
import org.hydra.ir.Statement;
import org.hydra.ir.Type;

/**
 * A forward, path-sensitive dataflow analysis of one function's {@link ControlFlowGraph}, tracking
 * a {@link ReferenceState} for each variable.
 *
 * <p>Blocks are processed from a worklist ordered by reverse postorder, so that (except along back
 * edges) every predecessor of a block is processed before the block itself. The state on entry to
 * a block is the merge of the states delivered along its incoming edges; a block whose entry state
 * equals the one recorded on its previous visit is not processed again.
 *
 * <p>Merging follows a fixed policy for each variable: if some incoming paths have moved the
 * variable and others have not, the merge is invalid (reported, and the variable becomes {@link
 * ReferenceState.Invalid}); otherwise the most restrictive borrow wins; otherwise the state from
 * the first predecessor is used. Path conditions are intersected.
 *
 * <p>Each analyzer reports on one {@link Dimension}; see that class.
 */
public final class FlowAnalyzer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * A bound on the number of times one block is processed. The lattice is finite so the analysis
   * terminates without it; hitting it means a bug in the merge policy.
   */
  static final int MAX_VISITS_PER_BLOCK = 64;

  /** Receives what the analysis finds. */
  interface Listener {
    void violation(SafetyViolation violation);

    void leak(ReferenceLeak leak);

    /** Called for every committed state change, whether or not it was legal. */
    default void transition(String variable, ReferenceState from, ReferenceState to) {}

    /** A Listener that adds violations and leaks to {@code findings}. */
    static Listener reportingTo(Findings findings) {
      return new Listener() {
        @Override
        public void violation(SafetyViolation violation) {
          findings.add(violation);
        }

        @Override
        public void leak(ReferenceLeak leak) {
          findings.add(leak);
        }
      };
    }
  }

  /** The entry state recorded for each block reached by the analysis. */
  public record Result(ImmutableMap<Integer, FlowState> entryStates) {
    public FlowState entryState(int block) {
      return entryStates.getOrDefault(block, FlowState.EMPTY);
    }
  }

  private final Module module;
  private final Function fn;
  private final ControlFlowGraph cfg;
  private final Dimension dimension;

  public FlowAnalyzer(Module module, Function fn, ControlFlowGraph cfg, Dimension dimension) {
    this.module = module;
    this.fn = fn;
    this.cfg = cfg;
    this.dimension = dimension;
  }

  Function function() {
    return fn;
  }

  ControlFlowGraph cfg() {
    return cfg;
  }

  /** The state on entry to the function: each parameter bound according to its type. */
  FlowState initialState() {
    FlowState state = FlowState.EMPTY;
    for (Parameter p : fn.parameters()) {
      AbstractValue value = valueOfType(p.type(), fn.name() + "." + p.name());
      ReferenceState pState;
      if (p.type().isMutableReference()) {
        pState = new Borrowed(BorrowKind.MUTABLE_WRITE, "parameter", value);
      } else if (p.type().isReference()) {
        pState = new Borrowed(BorrowKind.SHARED_READ, "parameter", value);
      } else {
        pState = new Initialized(value, false);
      }
      state = state.with(p.name(), pState);
    }
    return state;
  }

  private AbstractValue valueOfType(Type type, String identity) {
    String name = type.baseName();
    if (module.isKeyStruct(name)) {
      return new ObjectReference(new ObjectId(module.name(), name, identity));
    } else if (CallClassifier.isCapabilityType(name)) {
      return new CapabilityReference(CapId.of(module.name(), name));
    }
    return AbstractValue.NON_REFERENCE;
  }

  /** Runs the analysis to a fixpoint, reporting to {@code listener}. */
  public Result run(Listener listener) {
    int numBlocks = cfg.numBlocks();
    FlowState[] recorded = new FlowState[numBlocks];
    int[] visits = new int[numBlocks];
    // The state delivered along each edge, keyed by target block and then by source block.
    List<Map<Integer, FlowState>> delivered = new ArrayList<>(numBlocks);
    for (int i = 0; i < numBlocks; i++) {
      delivered.add(new LinkedHashMap<>());
    }
    PriorityQueue<Integer> worklist =
        new PriorityQueue<>(Math.max(1, numBlocks), (a, b) -> cfg.order(a) - cfg.order(b));
    worklist.add(0);
    for (Integer b = worklist.poll(); b != null; b = worklist.poll()) {
      BasicBlock block = cfg.block(b);
      FlowState in = (b == 0) ? initialState() : merge(block, delivered.get(b), listener);
      if (in.equals(recorded[b])) {
        continue;
      }
      if (++visits[b] > MAX_VISITS_PER_BLOCK) {
        logger.atWarning().log("%s: B%d did not stabilize; giving up on it", fn.name(), b);
        continue;
      }
      recorded[b] = in;
      FlowState out = analyzeBlock(block, in, listener);
      List<Integer> succs = block.successors();
      for (int i = 0; i < succs.size(); i++) {
        FlowState edgeState = out;
        if (block.isSplit()) {
          edgeState =
              edgeState.withCondition(
                  new PathCondition.Custom(block.condition().toString(), i == 0));
        }
        int succ = succs.get(i);
        delivered.get(succ).put(b, edgeState);
        if (!worklist.contains(succ)) {
          worklist.add(succ);
        }
      }
    }
    ImmutableMap.Builder<Integer, FlowState> entryStates = ImmutableMap.builder();
    for (int i = 0; i < numBlocks; i++) {
      if (recorded[i] != null) {
        entryStates.put(i, recorded[i]);
      }
    }
    Result result = new Result(entryStates.buildOrThrow());
    logger.atFine().log(
        "%s flow states for %s: %s", dimension, fn.name(), lazy(result::entryStates));
    return result;
  }

  /** Combines the states delivered to {@code block} by its predecessors. */
  FlowState merge(BasicBlock block, Map<Integer, FlowState> incoming, Listener listener) {
    List<FlowState> states = new ArrayList<>();
    // Use predecessor order, not delivery order, so that the result doesn't depend on traversal
    for (int pred : block.predecessors()) {
      FlowState s = incoming.get(pred);
      if (s != null) {
        states.add(s);
      }
    }
    if (states.size() == 1) {
      return states.get(0);
    }
    assert !states.isEmpty();
    Set<String> names = new LinkedHashSet<>();
    states.forEach(s -> names.addAll(s.variables().keySet()));
    Map<String, ReferenceState> merged = new LinkedHashMap<>();
    for (String name : names) {
      List<ReferenceState> candidates = new ArrayList<>();
      for (FlowState s : states) {
        if (s.variables().containsKey(name)) {
          candidates.add(s.get(name));
        }
      }
      merged.put(name, mergeVariable(name, block, candidates, listener));
    }
    Set<PathCondition> conditions = new LinkedHashSet<>(states.get(0).conditions());
    for (FlowState s : states) {
      conditions = Sets.intersection(conditions, s.conditions()).immutableCopy();
    }
    return new FlowState(ImmutableMap.copyOf(merged), ImmutableSet.copyOf(conditions));
  }

  /**
   * Merges the states of one variable. If any incoming state is Moved the merge is invalid, even
   * when every path moved it; otherwise the most restrictive borrow wins, or else the first state.
   */
  private ReferenceState mergeVariable(
      String name, BasicBlock block, List<ReferenceState> candidates, Listener listener) {
    long moved = candidates.stream().filter(s -> s.kind() == Kind.MOVED).count();
    if (moved > 0) {
      AbstractValue value =
          candidates.stream().filter(s -> s.kind() == Kind.MOVED).findFirst().get().value();
      String how =
          (moved < candidates.size())
              ? "is moved on some paths but not others"
              : "is moved on every incoming path";
      if (dimension.tracks(value)) {
        listener.violation(
            new SafetyViolation(
                fn.location(),
                ViolationType.INVALID_STATE_MERGE,
                String.format(
                    "Invalid state merge in %s at B%d: %s %s", fn.name(), block.index(), name, how),
                Severity.CRITICAL));
      }
      return new ReferenceState.Invalid(name + " " + how);
    }
    Borrowed borrowed = null;
    for (ReferenceState s : candidates) {
      if (s instanceof Borrowed b) {
        if (borrowed == null) {
          borrowed = b;
        } else if (b.borrowKind().mostRestrictive(borrowed.borrowKind()) != borrowed.borrowKind()) {
          borrowed = b;
        }
      }
    }
    return (borrowed != null) ? borrowed : candidates.get(0);
  }

  /** Applies the statements of {@code block} to {@code state}, returning the state at its end. */
  FlowState analyzeBlock(BasicBlock block, FlowState state, Listener listener) {
    for (Statement s : block.statements()) {
      state = analyzeStatement(s, state, listener);
    }
    return state;
  }

  FlowState analyzeStatement(Statement s, FlowState state, Listener listener) {
    if (s instanceof Statement.Assignment assign) {
      state = applyCalls(assign.expression(), state, s, listener);
      return assign(assign.variable(), assign.expression(), state, s, listener);
    } else if (s instanceof Statement.Invocation call) {
      for (Expression arg : call.args()) {
        state = applyCalls(arg, state, s, listener);
      }
      return applyCall(call.name(), call.args(), state, s, listener);
    } else if (s instanceof Statement.Assert check) {
      state = applyCalls(check.condition(), state, s, listener);
      for (String v : Expression.variablesIn(check.condition())) {
        state = state.withCondition(new PathCondition.TransferGuarded(v));
      }
      for (Expression e : Expression.flatten(check.condition())) {
        if (e instanceof Expression.FieldAccess access
            && CallClassifier.Rule.OWNER_ACCESS.matches(access.field())) {
          for (String v : Expression.variablesIn(access.base())) {
            state = state.withCondition(new PathCondition.ObjectOwned(v));
          }
        }
      }
      return state;
    } else if (s instanceof Statement.Return ret) {
      if (ret.expression() != null) {
        state = applyCalls(ret.expression(), state, s, listener);
        checkReturn(ret.expression(), state, listener);
      }
      return state;
    }
    // BorrowField, BorrowGlobal and BorrowLocal only affect the escape analysis' operand stack.
    return state;
  }

  /** Applies the effects of any calls nested in {@code expr}, innermost first. */
  private FlowState applyCalls(Expression expr, FlowState state, Statement s, Listener listener) {
    ImmutableList<Expression> all = Expression.flatten(expr);
    for (int i = all.size() - 1; i >= 0; i--) {
      if (all.get(i) instanceof Expression.Call call) {
        state = applyCall(call.name(), call.args(), state, s, listener);
      }
    }
    return state;
  }

  /**
   * A resource passed by value to a call is moved into it, or released if the call destroys it. An
   * explicit {@code move} always moves.
   */
  private FlowState applyCall(
      String name, List<Expression> args, FlowState state, Statement s, Listener listener) {
    boolean deletes = CallClassifier.Rule.DELETION.matches(name);
    for (Expression arg : args) {
      String v;
      boolean explicitMove;
      if (arg instanceof Expression.Move move) {
        v = move.variable();
        explicitMove = true;
      } else if (arg instanceof Expression.Variable var) {
        v = var.name();
        explicitMove = false;
      } else {
        continue;
      }
      ReferenceState current = state.get(v);
      AbstractValue value = current.value();
      boolean resource =
          value instanceof ObjectReference || value instanceof CapabilityReference;
      if (deletes && (resource || explicitMove)) {
        state = transition(state, v, new ReferenceState.Released(value), s, listener);
      } else if (explicitMove || (resource && current instanceof Initialized)) {
        state = transition(state, v, new ReferenceState.Moved(name, value), s, listener);
      }
    }
    return state;
  }

  private FlowState assign(
      String variable, Expression expr, FlowState state, Statement s, Listener listener) {
    ReferenceState newState;
    if (expr instanceof Expression.Borrow borrow) {
      AbstractValue value = evaluate(expr, state, variable);
      newState =
          new Borrowed(borrowKind(value, borrow.mutable()), borrow.target().toString(), value);
    } else if (expr instanceof Expression.Move move) {
      ReferenceState source = state.get(move.variable());
      newState =
          (source instanceof Borrowed) ? source : new Initialized(source.value(), false);
      state =
          transition(
              state,
              move.variable(),
              new ReferenceState.Moved(variable, source.value()),
              s,
              listener);
    } else if (expr instanceof Expression.Variable var
        && state.get(var.name()) instanceof Borrowed source) {
      newState = source;
    } else {
      newState = new Initialized(evaluate(expr, state, variable), false);
    }
    return transition(state, variable, newState, s, listener);
  }

  private static BorrowKind borrowKind(AbstractValue value, boolean mutable) {
    if (!mutable) {
      return BorrowKind.SHARED_READ;
    } else if (value instanceof CapabilityReference) {
      return BorrowKind.CAPABILITY_PROTECTED;
    } else if (value instanceof ObjectReference) {
      return BorrowKind.TRANSFER_GUARDED;
    }
    return BorrowKind.MUTABLE_WRITE;
  }

  /**
   * Checks and commits a state change. Illegal changes are reported, and the requested state is
   * used anyway.
   */
  private FlowState transition(
      FlowState state, String variable, ReferenceState to, Statement s, Listener listener) {
    ReferenceState from = state.get(variable);
    AbstractValue owner = (from.kind() == Kind.UNINITIALIZED) ? to.value() : from.value();
    if (dimension.tracks(owner)) {
      TransitionTable.TransitionError error =
          TransitionTable.check(variable, from, to, state.conditions());
      if (error != null) {
        listener.violation(
            new SafetyViolation(
                fn.location(),
                error.type(),
                error.message() + " in " + fn.name() + " at `" + s + "`",
                error.severity()));
      }
    }
    listener.transition(variable, from, to);
    return state.with(variable, to);
  }

  /** Evaluates {@code expr}; {@code site} names where the value ends up, for object identities. */
  AbstractValue evaluate(Expression expr, FlowState state, String site) {
    if (expr instanceof Expression.Variable var) {
      return state.get(var.name()).value();
    } else if (expr instanceof Expression.Move move) {
      return state.get(move.variable()).value();
    } else if (expr instanceof Expression.Borrow borrow) {
      Expression target = borrow.target();
      if (target instanceof Expression.FieldAccess access) {
        AbstractValue base = evaluate(access.base(), state, site);
        if (base instanceof ObjectReference || base instanceof InvariantReference) {
          return new InvariantReference(access.field());
        }
        return AbstractValue.SAFE_REFERENCE;
      } else if (target instanceof Expression.Variable var) {
        AbstractValue v = state.get(var.name()).value();
        return (v instanceof ObjectReference || v instanceof CapabilityReference)
            ? v
            : AbstractValue.SAFE_REFERENCE;
      }
      return AbstractValue.SAFE_REFERENCE;
    } else if (expr instanceof Expression.Pack pack) {
      return valueOfType(Type.base(pack.structName()), fn.name() + "." + site);
    }
    // Field reads, dereferences, literals, operators and call results are plain values.
    return AbstractValue.NON_REFERENCE;
  }

  private void checkReturn(Expression expr, FlowState state, Listener listener) {
    AbstractValue value = evaluate(expr, state, "return");
    if (!dimension.tracks(value)) {
      return;
    }
    ReferenceState varState =
        (expr instanceof Expression.Variable var) ? state.get(var.name()) : null;
    boolean mutableBorrow =
        (expr instanceof Expression.Borrow borrow && borrow.mutable())
            || (varState instanceof Borrowed b && b.borrowKind().isMutable());
    boolean anyBorrow =
        mutableBorrow || expr instanceof Expression.Borrow || varState instanceof Borrowed;
    String what = expr.toString();
    switch (dimension) {
      case REFERENCE:
        if (value instanceof InvariantReference inv) {
          listener.leak(
              new ReferenceLeak(
                  fn.location(),
                  ViolationType.REFERENCE_ESCAPE,
                  String.format(
                      "Reference to invariant field %s escapes through return in %s",
                      inv.field(), fn.name()),
                  Severity.CRITICAL,
                  what,
                  inv.field()));
        } else if (varState != null && varState.isBorrowed(BorrowKind.MUTABLE_WRITE)) {
          listener.leak(
              new ReferenceLeak(
                  fn.location(),
                  ViolationType.REFERENCE_ESCAPE,
                  String.format(
                      "Mutable borrow %s escapes through return in %s", what, fn.name()),
                  Severity.CRITICAL,
                  what,
                  null));
        }
        break;
      case OBJECT:
        if (mutableBorrow) {
          listener.leak(
              new ReferenceLeak(
                  fn.location(),
                  ViolationType.REFERENCE_ESCAPE,
                  String.format(
                      "Mutable reference to object %s escapes through return in %s",
                      what, fn.name()),
                  Severity.CRITICAL,
                  what,
                  null));
        }
        break;
      case CAPABILITY:
        if (anyBorrow) {
          listener.leak(
              new ReferenceLeak(
                  fn.location(),
                  ViolationType.CAPABILITY_LEAK,
                  String.format(
                      "Reference to capability %s escapes through return in %s", what, fn.name()),
                  Severity.CRITICAL,
                  what,
                  null));
        }
        break;
    }
  }

  @Override
  public String toString() {
    return "FlowAnalyzer(" + fn.name() + ", " + dimension + ")";
  }
}
