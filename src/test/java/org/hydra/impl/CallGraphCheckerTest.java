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

import com.google.common.collect.ImmutableList;
import org.hydra.ir.Function;
import org.hydra.ir.Module;
import org.hydra.ir.Statement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CallGraphCheckerTest {

  private static Function fn(String name, Statement... body) {
    return Function.builder(name).add(body).add(ret()).build();
  }

  private static ImmutableList<SafetyViolation> check(int maxDepth, Function... functions) {
    Module module = module("m", functions);
    Findings findings = new Findings();
    new CallGraphChecker(module, module.functions(), maxDepth).check(findings);
    return findings.toResult().safetyViolations();
  }

  @Test
  public void edgesOnlyToModuleFunctions() {
    Module module =
        module(
            "m",
            fn("a", callStmt("b"), internalCall("c"), callStmt("other::b")),
            fn("b", assign("x", call("Self::c"))),
            fn("c"));
    CallGraphChecker checker = new CallGraphChecker(module, module.functions(), 8);
    assertThat(checker.edges().get("a")).containsExactly("b", "c");
    assertThat(checker.edges().get("b")).containsExactly("c");
    assertThat(checker.edges().get("c")).isEmpty();
  }

  @Test
  public void acyclicShallowGraphIsClean() {
    assertThat(check(8, fn("a", callStmt("b")), fn("b", callStmt("c")), fn("c"))).isEmpty();
  }

  @Test
  public void directRecursion() {
    ImmutableList<SafetyViolation> violations = check(8, fn("loop", callStmt("loop")));
    assertThat(violations).hasSize(1);
    assertThat(violations.get(0).type()).isEqualTo(ViolationType.CALL_STACK_VIOLATION);
    assertThat(violations.get(0).severity()).isEqualTo(Severity.HIGH);
    assertThat(violations.get(0).message()).isEqualTo("Recursive call cycle: loop -> loop");
  }

  @Test
  public void mutualRecursionIsReportedOnce() {
    ImmutableList<SafetyViolation> violations =
        check(8, fn("ping", callStmt("pong")), fn("pong", callStmt("ping")));
    assertThat(violations).hasSize(1);
    assertThat(violations.get(0).message()).isEqualTo("Recursive call cycle: ping -> pong -> ping");
    assertThat(violations.get(0).context().affectedFunctions())
        .containsExactly("ping", "pong")
        .inOrder();
  }

  @Test
  public void deepChain() {
    ImmutableList<SafetyViolation> violations =
        check(
            3,
            fn("f1", callStmt("f2")),
            fn("f2", callStmt("f3")),
            fn("f3", callStmt("f4")),
            fn("f4"));
    assertThat(violations).hasSize(1);
    assertThat(violations.get(0).message())
        .isEqualTo("Call chain from f1 reaches depth 4 (limit 3)");
  }

  @Test
  public void longChainDoesNotOverflow() {
    Function[] functions = new Function[5000];
    for (int i = 0; i < functions.length - 1; i++) {
      functions[i] = fn("f" + i, callStmt("f" + (i + 1)));
    }
    functions[functions.length - 1] = fn("f" + (functions.length - 1), callStmt("f0"));
    ImmutableList<SafetyViolation> violations = check(8, functions);
    assertThat(violations).hasSize(1);
    assertThat(violations.get(0).message()).startsWith("Recursive call cycle: f0 -> f1 -> ");
  }
}
