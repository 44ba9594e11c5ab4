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

import static com.google.common.truth.Truth.assertThat;
import static org.hydra.ir.IrFixtures.assign;
import static org.hydra.ir.IrFixtures.borrow;
import static org.hydra.ir.IrFixtures.borrowMut;
import static org.hydra.ir.IrFixtures.call;
import static org.hydra.ir.IrFixtures.callStmt;
import static org.hydra.ir.IrFixtures.check;
import static org.hydra.ir.IrFixtures.eq;
import static org.hydra.ir.IrFixtures.field;
import static org.hydra.ir.IrFixtures.ifElse;
import static org.hydra.ir.IrFixtures.keyStruct;
import static org.hydra.ir.IrFixtures.lit;
import static org.hydra.ir.IrFixtures.module;
import static org.hydra.ir.IrFixtures.move;
import static org.hydra.ir.IrFixtures.ret;
import static org.hydra.ir.IrFixtures.u64;
import static org.hydra.ir.IrFixtures.uid;
import static org.hydra.ir.IrFixtures.var;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.hydra.code.CfgBuilder;
import org.hydra.impl.ReferenceState.Borrowed;
import org.hydra.impl.ReferenceState.Initialized;
import org.hydra.impl.ReferenceState.Kind;
import org.hydra.ir.Function;
import org.hydra.ir.Module;
import org.hydra.ir.Statement;
import org.hydra.ir.Struct;
import org.hydra.ir.Type;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class FlowAnalyzerTest {

  private static final ImmutableList<Struct> STRUCTS =
      ImmutableList.of(keyStruct("Data", u64("value")), keyStruct("Coin", uid(), u64("balance")));

  private final Findings findings = new Findings();

  private FlowAnalyzer analyzer(Function fn, Dimension dimension) {
    Module module = module("m", STRUCTS, fn);
    return new FlowAnalyzer(module, fn, CfgBuilder.build(fn), dimension);
  }

  private FlowAnalyzer.Result run(Function fn, Dimension dimension) {
    return analyzer(fn, dimension).run(FlowAnalyzer.Listener.reportingTo(findings));
  }

  @Test
  public void invariantFieldEscapesThroughReturn() {
    Function fn =
        Function.builder("leak")
            .setPublic(true)
            .addParameter("data", Type.mutRef(Type.base("Data")))
            .add(ret(borrowMut(field("data", "value"))))
            .build();
    run(fn, Dimension.REFERENCE);
    AnalysisResult result = findings.toResult();
    assertThat(result.safetyViolations()).isEmpty();
    assertThat(result.referenceLeaks()).hasSize(1);
    ReferenceLeak leak = result.referenceLeaks().get(0);
    assertThat(leak.severity()).isEqualTo(Severity.CRITICAL);
    assertThat(leak.field()).isEqualTo("value");
    assertThat(leak.message())
        .isEqualTo("Reference to invariant field value escapes through return in leak");
  }

  @Test
  public void sharedBorrowOfLocalIsSafe(@TestParameter Dimension dimension) {
    Function fn =
        Function.builder("safe")
            .add(assign("y", lit("1")), assign("r", borrow(var("y"))), ret(var("r")))
            .build();
    run(fn, dimension);
    assertThat(findings.toResult().isClean()).isTrue();
  }

  @Test
  public void returningMutableBorrowOfLocalLeaks() {
    Function fn =
        Function.builder("f")
            .add(assign("y", lit("1")), assign("r", borrowMut(var("y"))), ret(var("r")))
            .build();
    run(fn, Dimension.REFERENCE);
    assertThat(findings.toResult().referenceLeaks()).hasSize(1);
    assertThat(findings.toResult().referenceLeaks().get(0).variable()).isEqualTo("r");
  }

  @Test
  public void mergingMovedWithUnmovedIsInvalid(@TestParameter boolean moveInElse) {
    ImmutableList<Statement> moves =
        ImmutableList.of(callStmt("transfer::transfer", var("c"), var("to")));
    ImmutableList<Statement> other = ImmutableList.of(assign("x", lit("1")));
    Function fn =
        Function.builder("f")
            .addParameter("c", Type.base("Coin"))
            .addParameter("to", Type.base("address"))
            .add(
                ifElse(var("flag"), moveInElse ? other : moves, moveInElse ? moves : other),
                ret())
            .build();
    FlowAnalyzer.Result result = run(fn, Dimension.OBJECT);
    ImmutableList<SafetyViolation> violations = findings.toResult().safetyViolations();
    assertThat(violations).hasSize(1);
    SafetyViolation v = violations.get(0);
    assertThat(v.type()).isEqualTo(ViolationType.INVALID_STATE_MERGE);
    assertThat(v.severity()).isEqualTo(Severity.CRITICAL);
    assertThat(v.message()).contains("at B3: c is moved on some paths but not others");
    assertThat(result.entryState(3).get("c").kind()).isEqualTo(Kind.INVALID);
  }

  @Test
  public void mergingMovedOnEveryPathIsInvalid() {
    Statement transfer = callStmt("transfer::transfer", var("c"), var("to"));
    Function fn =
        Function.builder("f")
            .addParameter("c", Type.base("Coin"))
            .addParameter("to", Type.base("address"))
            .add(ifElse(var("flag"), ImmutableList.of(transfer), ImmutableList.of(transfer)), ret())
            .build();
    FlowAnalyzer.Result result = run(fn, Dimension.OBJECT);
    ImmutableList<SafetyViolation> violations = findings.toResult().safetyViolations();
    assertThat(violations).hasSize(1);
    assertThat(violations.get(0).type()).isEqualTo(ViolationType.INVALID_STATE_MERGE);
    assertThat(violations.get(0).message())
        .isEqualTo("Invalid state merge in f at B3: c is moved on every incoming path");
    assertThat(result.entryState(3).get("c").kind()).isEqualTo(Kind.INVALID);
  }

  @Test
  public void valueMovedBeforeBranchIsInvalidAtJoin() {
    Function fn =
        Function.builder("f")
            .addParameter("c", Type.base("Coin"))
            .addParameter("to", Type.base("address"))
            .add(
                callStmt("transfer::transfer", var("c"), var("to")),
                ifElse(
                    var("flag"),
                    ImmutableList.of(assign("x", lit("1"))),
                    ImmutableList.of(assign("x", lit("2")))),
                ret())
            .build();
    FlowAnalyzer.Result result = run(fn, Dimension.OBJECT);
    assertThat(findings.toResult().safetyViolations()).hasSize(1);
    assertThat(result.entryState(3).get("c").kind()).isEqualTo(Kind.INVALID);
  }

  @Test
  public void mergeKeepsMostRestrictiveBorrow() {
    Function fn =
        Function.builder("f")
            .add(
                assign("x", lit("1")),
                ifElse(
                    var("flag"),
                    ImmutableList.of(assign("r", borrowMut(var("x")))),
                    ImmutableList.of(assign("r", borrow(var("x"))))),
                ret())
            .build();
    FlowAnalyzer.Result result = run(fn, Dimension.REFERENCE);
    FlowState join = result.entryState(3);
    assertThat(join.get("r").isBorrowed(BorrowKind.MUTABLE_WRITE)).isTrue();
    // The branch conditions differ, so neither survives the merge
    assertThat(join.conditions()).isEmpty();
    assertThat(result.entryState(1).conditions())
        .containsExactly(new PathCondition.Custom("flag", true));
    assertThat(findings.toResult().isClean()).isTrue();
  }

  @Test
  public void parametersAreSeededByType() {
    Function fn =
        Function.builder("f")
            .addParameter("coin", Type.mutRef(Type.base("Coin")))
            .addParameter("n", Type.ref(Type.base("u64")))
            .addParameter("cap", Type.base("AdminCap"))
            .addParameter("amount", Type.base("u64"))
            .add(ret())
            .build();
    FlowState state = analyzer(fn, Dimension.REFERENCE).initialState();
    ReferenceState coin = state.get("coin");
    assertThat(coin.isBorrowed(BorrowKind.MUTABLE_WRITE)).isTrue();
    assertThat(coin.value()).isInstanceOf(AbstractValue.ObjectReference.class);
    assertThat(((Borrowed) coin).source()).isEqualTo("parameter");
    assertThat(state.get("n").isBorrowed(BorrowKind.SHARED_READ)).isTrue();
    AbstractValue cap = new AbstractValue.CapabilityReference(CapId.of("m", "AdminCap"));
    assertThat(state.get("cap")).isEqualTo(new Initialized(cap, false));
    assertThat(state.get("amount"))
        .isEqualTo(new Initialized(AbstractValue.NON_REFERENCE, false));
    assertThat(state.get("other")).isEqualTo(ReferenceState.UNINITIALIZED);
  }

  @Test
  public void assertionRecordsGuards() {
    Function fn = Function.builder("f").add(ret()).build();
    FlowAnalyzer flow = analyzer(fn, Dimension.OBJECT);
    FlowState after =
        flow.analyzeStatement(
            check(eq(call("tx_context::sender", var("ctx")), field("obj", "owner"))),
            FlowState.EMPTY,
            FlowAnalyzer.Listener.reportingTo(findings));
    assertThat(after.conditions())
        .containsExactly(
            new PathCondition.TransferGuarded("ctx"),
            new PathCondition.TransferGuarded("obj"),
            new PathCondition.ObjectOwned("obj"));
  }

  @Test
  public void movingMutableBorrowIsReported() {
    Function fn =
        Function.builder("f")
            .addParameter("r", Type.mutRef(Type.base("u64")))
            .add(assign("s", move("r")), ret())
            .build();
    run(fn, Dimension.REFERENCE);
    ImmutableList<SafetyViolation> violations = findings.toResult().safetyViolations();
    assertThat(violations).hasSize(1);
    assertThat(violations.get(0).type()).isEqualTo(ViolationType.REFERENCE_ESCAPE);
    assertThat(violations.get(0).severity()).isEqualTo(Severity.CRITICAL);
    assertThat(violations.get(0).message())
        .isEqualTo("Mutable reference moved while borrowed: r in f at `s = move r`");
  }

  @Test
  public void borrowedCapabilityMayNotBeReturned() {
    Function fn =
        Function.builder("f")
            .addParameter("cap", Type.ref(Type.base("AdminCap")))
            .add(ret(var("cap")))
            .build();
    run(fn, Dimension.CAPABILITY);
    ImmutableList<ReferenceLeak> leaks = findings.toResult().referenceLeaks();
    assertThat(leaks).hasSize(1);
    assertThat(leaks.get(0).type()).isEqualTo(ViolationType.CAPABILITY_LEAK);
  }

  @Test
  public void deletionReleasesTheObject() {
    Function fn =
        Function.builder("f")
            .addParameter("c", Type.base("Coin"))
            .add(callStmt("coin::burn", var("c")), ret())
            .build();
    FlowAnalyzer flow = analyzer(fn, Dimension.OBJECT);
    FlowAnalyzer.Listener listener = FlowAnalyzer.Listener.reportingTo(findings);
    FlowState after =
        flow.analyzeBlock(CfgBuilder.build(fn).entry(), flow.initialState(), listener);
    assertThat(after.get("c").kind()).isEqualTo(Kind.RELEASED);
    assertThat(findings.toResult().isClean()).isTrue();
  }

  @Test
  public void valuesInOtherDimensionsAreNotReported() {
    // The object is moved twice, but only the OBJECT dimension reports it
    Function fn =
        Function.builder("f")
            .addParameter("c", Type.base("Coin"))
            .add(
                callStmt("transfer::transfer", var("c"), var("a")),
                callStmt("transfer::transfer", move("c"), var("b")),
                ret())
            .build();
    run(fn, Dimension.REFERENCE);
    assertThat(findings.toResult().isClean()).isTrue();
    run(fn, Dimension.OBJECT);
    assertThat(findings.toResult().safetyViolations()).hasSize(1);
    assertThat(findings.toResult().safetyViolations().get(0).type())
        .isEqualTo(ViolationType.INVALID_STATE_TRANSITION);
  }
}
