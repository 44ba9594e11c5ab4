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
import static org.hydra.ir.IrFixtures.internalCall;
import static org.hydra.ir.IrFixtures.module;
import static org.hydra.ir.IrFixtures.ret;
import static org.hydra.ir.IrFixtures.var;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.hydra.impl.SecurityEvent.BoundaryCrossing;
import org.hydra.impl.SecurityEvent.BoundaryKind;
import org.hydra.impl.SecurityEvent.CallToTrusted;
import org.hydra.impl.SecurityEvent.ReturnToUntrusted;
import org.hydra.impl.SecurityEvent.StateAccess;
import org.hydra.ir.Function;
import org.hydra.ir.Module;
import org.hydra.ir.Statement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TraceAnalyzerTest {

  @Test
  public void calleeModule() {
    Module dex = module("dex");
    Statement s = callStmt("x");
    assertThat(TraceAnalyzer.calleeModule(dex, s, "vault::withdraw")).isEqualTo("vault");
    assertThat(TraceAnalyzer.calleeModule(dex, s, "Self::helper")).isEqualTo("dex");
    assertThat(TraceAnalyzer.calleeModule(dex, s, "helper")).isEqualTo("dex");
    assertThat(TraceAnalyzer.calleeModule(dex, internalCall("vault::x"), "vault::x"))
        .isEqualTo("dex");
  }

  @Test
  public void untrustedCallIntoTrustedModule() {
    Function swap =
        Function.builder("swap").add(callStmt("vault::withdraw", var("amount")), ret()).build();
    TraceAnalyzer tracer = new TraceAnalyzer(ImmutableSet.of("vault"));
    tracer.trace(module("dex", swap));
    assertThat(tracer.events())
        .containsExactly(
            new BoundaryCrossing(
                "dex", "vault", BoundaryKind.UNTRUSTED_TO_TRUSTED, "swap", "vault::withdraw"),
            new CallToTrusted("dex", "vault", "swap", "vault::withdraw"),
            new ReturnToUntrusted("vault", "dex", "swap"))
        .inOrder();
    assertThat(tracer.callChain()).containsExactly("vault::withdraw");
  }

  @Test
  public void trustedCallIntoUntrustedModule() {
    Function pay =
        Function.builder("pay").add(assign("c", call("coin::mint", var("n"))), ret()).build();
    TraceAnalyzer tracer = new TraceAnalyzer(ImmutableSet.of("vault"));
    tracer.trace(module("vault", pay));
    assertThat(tracer.events().get(0))
        .isEqualTo(
            new BoundaryCrossing(
                "vault", "coin", BoundaryKind.TRUSTED_TO_UNTRUSTED, "pay", "coin::mint"));
  }

  @Test
  public void localCallsCrossNothing() {
    Function f =
        Function.builder("f")
            .add(
                callStmt("helper"),
                callStmt("Self::helper"),
                new Statement.BorrowGlobal("Pool"),
                ret())
            .build();
    TraceAnalyzer tracer = new TraceAnalyzer(ImmutableSet.of());
    tracer.trace(module("dex", f));
    assertThat(tracer.events()).containsExactly(new StateAccess("dex", "Pool", "f"));
    assertThat(tracer.callChain()).containsExactly("helper", "Self::helper").inOrder();
  }

  @Test
  public void crossModuleBetweenUntrustedModules() {
    Function f = Function.builder("f").add(callStmt("oracle::price")).build();
    TraceAnalyzer tracer = new TraceAnalyzer(ImmutableSet.of());
    tracer.trace(module("dex", f));
    ImmutableList<SecurityEvent> events = tracer.events();
    assertThat(events).hasSize(1);
    assertThat(((BoundaryCrossing) events.get(0)).kind()).isEqualTo(BoundaryKind.CROSS_MODULE);
  }
}
