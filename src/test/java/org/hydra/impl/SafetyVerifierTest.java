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
import static org.hydra.ir.IrFixtures.call;
import static org.hydra.ir.IrFixtures.callStmt;
import static org.hydra.ir.IrFixtures.check;
import static org.hydra.ir.IrFixtures.keyStruct;
import static org.hydra.ir.IrFixtures.lit;
import static org.hydra.ir.IrFixtures.module;
import static org.hydra.ir.IrFixtures.ownershipCheck;
import static org.hydra.ir.IrFixtures.pack;
import static org.hydra.ir.IrFixtures.ret;
import static org.hydra.ir.IrFixtures.u64;
import static org.hydra.ir.IrFixtures.uid;
import static org.hydra.ir.IrFixtures.var;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.hydra.impl.Property.LocalProperty;
import org.hydra.impl.Property.StrongProperty;
import org.hydra.impl.Property.UnreachableProperty;
import org.hydra.ir.Field;
import org.hydra.ir.Function;
import org.hydra.ir.Module;
import org.hydra.ir.Statement;
import org.hydra.ir.Struct;
import org.hydra.ir.Type;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SafetyVerifierTest {

  private static final ImmutableList<Struct> STRUCTS =
      ImmutableList.of(
          keyStruct("Ticket", u64("value")),
          keyStruct("Vault", uid(), Field.of("owner", Type.base("address")), u64("balance")));

  private static Function fn(String name, Statement... body) {
    return Function.builder(name).add(body).build();
  }

  private static AnalysisResult verify(
      AnalyzerConfig config, List<? extends Property> properties, Function... functions) {
    Module module = module("m", STRUCTS, functions);
    Findings findings = new Findings();
    new SafetyVerifier(config, properties).verify(module, module.functions(), findings);
    return findings.toResult();
  }

  private static AnalysisResult verify(Function... functions) {
    return verify(AnalyzerConfig.DEFAULT, ImmutableList.of(), functions);
  }

  @Test
  public void objectWithoutIdentityIsReportedOnceWhereConstructed() {
    AnalysisResult result =
        verify(
            fn("a", assign("t", pack("Ticket", "value", lit("1"))), ret()),
            fn("b", assign("t", pack("Ticket", "value", lit("2"))), ret()),
            fn("c", assign("v", pack("Vault", "balance", lit("0"))), ret()));
    assertThat(result.safetyViolations()).hasSize(1);
    SafetyViolation v = result.safetyViolations().get(0);
    assertThat(v.type()).isEqualTo(ViolationType.RESOURCE_SAFETY_VIOLATION);
    assertThat(v.severity()).isEqualTo(Severity.CRITICAL);
    assertThat(v.message()).contains("Ticket is missing a UID field");
    assertThat(v.context().affectedFunctions()).containsExactly("a");
    assertThat(v.context().suggestedFixes()).containsExactly("Add 'id: UID' as first field");
    assertThat(v.context().reference()).isEqualTo(SafetyVerifier.OBJECT_MODEL);
  }

  @Test
  public void transferNeedsOwnershipTriple() {
    AnalysisResult result =
        verify(fn("give", callStmt("transfer::transfer", var("v"), var("to")), ret()));
    assertThat(result.safetyViolations()).hasSize(1);
    SafetyViolation v = result.safetyViolations().get(0);
    assertThat(v.type()).isEqualTo(ViolationType.UNAUTHORIZED_ACCESS);
    assertThat(v.severity()).isEqualTo(Severity.HIGH);
    assertThat(v.message()).isEqualTo("Transfer without ownership verification in give");
    assertThat(v.context().suggestedFixes()).isNotEmpty();
  }

  @Test
  public void verifiedTransferIsClean() {
    assertThat(
            verify(
                    fn(
                        "give",
                        ownershipCheck("v"),
                        callStmt("transfer::public_transfer", var("v"), var("to")),
                        ret()))
                .isClean())
        .isTrue();
  }

  @Test
  public void ownershipCheckMustComeBeforeTransfer() {
    AnalysisResult result =
        verify(
            fn(
                "give",
                callStmt("transfer::transfer", var("v"), var("to")),
                ownershipCheck("v"),
                ret()));
    assertThat(result.safetyViolations()).hasSize(1);
  }

  @Test
  public void assertWithoutSenderIsNotEnough() {
    AnalysisResult result =
        verify(
            fn(
                "give",
                check(call("vault::is_owner", var("v"))),
                callStmt("transfer::transfer", var("v"), var("to")),
                ret()));
    assertThat(result.safetyViolations()).hasSize(1);
  }

  @Test
  public void sharedAccessNeedsConsensusAndLock() {
    AnalysisResult unverified = verify(fn("f", callStmt("shared::read_value", var("s")), ret()));
    assertThat(unverified.safetyViolations()).hasSize(1);
    SafetyViolation v = unverified.safetyViolations().get(0);
    assertThat(v.type()).isEqualTo(ViolationType.SHARED_OBJECT_VIOLATION);
    assertThat(v.severity()).isEqualTo(Severity.HIGH);
    assertThat(v.message()).isEqualTo("Shared object access in f without consensus verification");

    AnalysisResult unlocked =
        verify(
            fn(
                "f",
                callStmt("consensus::verify", var("s")),
                callStmt("shared::read_value", var("s")),
                ret()));
    assertThat(unlocked.safetyViolations().get(0).message()).endsWith("without synchronization");

    AnalysisResult ok =
        verify(
            fn(
                "f",
                callStmt("consensus::verify", var("s")),
                callStmt("mutex::lock", var("s")),
                callStmt("shared::read_value", var("s")),
                ret()));
    assertThat(ok.isClean()).isTrue();
  }

  @Test
  public void disabledChecksAreSkipped() {
    AnalyzerConfig config =
        AnalyzerConfig.builder().setCheckSharedObjects(false).setCheckTransferSafety(false).build();
    AnalysisResult result =
        verify(
            config,
            ImmutableList.of(),
            fn(
                "f",
                callStmt("shared::read_value", var("s")),
                callStmt("transfer::transfer", var("v"), var("to")),
                ret()));
    assertThat(result.isClean()).isTrue();
  }

  @Test
  public void localPropertyWithoutCondition() {
    Function f = fn("f", callStmt("bank::withdraw", var("amount")), ret());
    AnalysisResult unchecked =
        verify(
            AnalyzerConfig.DEFAULT,
            ImmutableList.of(new LocalProperty("withdraw", "balance >= amount", "function", "")),
            f);
    assertThat(unchecked.safetyViolations()).hasSize(1);
    assertThat(unchecked.safetyViolations().get(0).type())
        .isEqualTo(ViolationType.INVARIANT_VIOLATION);
    assertThat(unchecked.safetyViolations().get(0).context().reference())
        .isEqualTo(SafetyVerifier.LOCAL_PROPERTIES);

    AnalysisResult checked =
        verify(
            AnalyzerConfig.DEFAULT,
            ImmutableList.of(
                new LocalProperty("withdraw", "balance >= amount", "function", "assert")),
            f);
    assertThat(checked.isClean()).isTrue();
  }

  @Test
  public void unreachableResourceReached() {
    AnalysisResult result =
        verify(
            AnalyzerConfig.DEFAULT,
            ImmutableList.of(new UnreachableProperty("treasury", ImmutableList.of("public"))),
            fn("f", callStmt("treasury::drain", var("t")), ret()));
    assertThat(result.safetyViolations()).hasSize(1);
    SafetyViolation v = result.safetyViolations().get(0);
    assertThat(v.type()).isEqualTo(ViolationType.RESOURCE_SAFETY_VIOLATION);
    assertThat(v.severity()).isEqualTo(Severity.HIGH);
    assertThat(v.message()).contains("treasury is reachable through treasury::drain in f");
  }

  @Test
  public void strongPropertyNeedsBothHalves() {
    UnreachableProperty unreachable =
        new UnreachableProperty("treasury", ImmutableList.of("public"));
    StrongProperty strong =
        new StrongProperty(
            new LocalProperty("treasury", "total fixed", "field", "check"), unreachable);
    Function quiet = fn("f", callStmt("coin::value", var("c")), ret());
    assertThat(verify(AnalyzerConfig.DEFAULT, ImmutableList.of(strong), quiet).isClean()).isTrue();

    Function reaching = fn("g", callStmt("treasury::drain", var("t")), ret());
    AnalysisResult result = verify(AnalyzerConfig.DEFAULT, ImmutableList.of(strong), reaching);
    assertThat(result.safetyViolations()).hasSize(1);
    assertThat(result.safetyViolations().get(0).severity()).isEqualTo(Severity.CRITICAL);
    assertThat(result.safetyViolations().get(0).context().affectedFunctions())
        .containsExactly("g");

    StrongProperty unchecked =
        new StrongProperty(new LocalProperty("treasury", "total fixed", "field", ""), unreachable);
    AnalysisResult missing = verify(AnalyzerConfig.DEFAULT, ImmutableList.of(unchecked), quiet);
    assertThat(missing.safetyViolations().get(0).message())
        .isEqualTo(
            "Strong property on treasury violated: local condition for total fixed is missing");
  }

  @Test
  public void derivedProperties() {
    Module module =
        module(
            "m",
            ImmutableList.of(
                keyStruct("Pool", uid(), new Field("reserve", Type.base("u64"), "reserve > 0"))),
            fn("deposit", check(var("ok")), ret()),
            fn("peek", ret(var("x"))));
    UnreachableProperty unreachable =
        new UnreachableProperty("reserve", ImmutableList.of("public"));
    assertThat(SafetyVerifier.derivedProperties(module))
        .containsExactly(
            new LocalProperty("deposit", "assertion", "function", "assert"),
            unreachable,
            new StrongProperty(
                new LocalProperty("reserve", "reserve > 0", "field", "check"), unreachable))
        .inOrder();
  }

  @Test
  public void strictModeFlagsMutableObjectParameters() {
    Function open =
        Function.builder("update")
            .setPublic(true)
            .addParameter("vault", Type.mutRef(Type.base("Vault")))
            .addParameter("n", Type.mutRef(Type.base("u64")))
            .add(ret())
            .build();
    assertThat(verify(open).isClean()).isTrue();
    AnalysisResult strict =
        verify(AnalyzerConfig.builder().setStrictMode(true).build(), ImmutableList.of(), open);
    assertThat(strict.safetyViolations()).hasSize(1);
    SafetyViolation v = strict.safetyViolations().get(0);
    assertThat(v.type()).isEqualTo(ViolationType.UNSAFE_PUBLIC_INTERFACE);
    assertThat(v.severity()).isEqualTo(Severity.MEDIUM);
    assertThat(v.message())
        .isEqualTo("Public function update takes mutable reference vault: &mut Vault");
  }
}
