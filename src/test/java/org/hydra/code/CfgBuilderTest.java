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

package org.hydra.code;

import static com.google.common.truth.Truth.assertThat;
import static org.hydra.ir.IrFixtures.assign;
import static org.hydra.ir.IrFixtures.ifElse;
import static org.hydra.ir.IrFixtures.ifThen;
import static org.hydra.ir.IrFixtures.lit;
import static org.hydra.ir.IrFixtures.loop;
import static org.hydra.ir.IrFixtures.ret;
import static org.hydra.ir.IrFixtures.var;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.hydra.ir.Function;
import org.hydra.ir.Statement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CfgBuilderTest {

  private static ControlFlowGraph build(Statement... body) {
    return CfgBuilder.build(Function.builder("f").add(body).build());
  }

  @Test
  public void straightLine() {
    ControlFlowGraph cfg = build(assign("x", lit("1")), ret(var("x")));
    assertThat(cfg.numBlocks()).isEqualTo(1);
    assertThat(cfg.entry().statements()).hasSize(2);
    assertThat(cfg.entry().isTerminal()).isTrue();
    assertThat(cfg.unreachableBlocks()).isEmpty();
    assertThat(cfg.loops()).isEmpty();
  }

  @Test
  public void ifElseJoins() {
    ControlFlowGraph cfg =
        build(
            ifElse(
                var("c"),
                ImmutableList.of(assign("a", lit("1"))),
                ImmutableList.of(assign("a", lit("2")))),
            ret(var("a")));
    assertThat(cfg.numBlocks()).isEqualTo(4);
    BasicBlock split = cfg.entry();
    assertThat(split.isSplit()).isTrue();
    assertThat(split.condition()).isEqualTo(var("c"));
    assertThat(split.successors()).containsExactly(1, 2).inOrder();
    BasicBlock join = cfg.block(3);
    assertThat(join.isMergePoint()).isTrue();
    assertThat(join.predecessors()).containsExactly(1, 2).inOrder();
    assertThat(join.statements()).containsExactly(ret(var("a")));
  }

  @Test
  public void emptyArmsStillJoin() {
    ControlFlowGraph cfg = build(ifThen(var("c")), ret());
    assertThat(cfg.numBlocks()).isEqualTo(4);
    assertThat(cfg.block(1).statements()).isEmpty();
    assertThat(cfg.block(3).predecessors()).containsExactly(1, 2);
  }

  @Test
  public void returnInBothArmsEndsFlow() {
    ControlFlowGraph cfg =
        build(
            ifElse(
                var("c"), ImmutableList.of(ret(lit("1"))), ImmutableList.of(ret(lit("2")))));
    assertThat(cfg.numBlocks()).isEqualTo(3);
    assertThat(cfg.block(1).isTerminal()).isTrue();
    assertThat(cfg.block(2).isTerminal()).isTrue();
    cfg.checkWellFormed();
  }

  @Test
  public void loopHasBackEdge() {
    ControlFlowGraph cfg =
        build(assign("x", lit("0")), loop(var("c"), assign("x", lit("1"))), ret(var("x")));
    // B0 -> B1 (header) -> B2 (body) -> B1, and B1 -> B3 (exit)
    assertThat(cfg.numBlocks()).isEqualTo(4);
    BasicBlock header = cfg.block(1);
    assertThat(header.condition()).isEqualTo(var("c"));
    assertThat(header.successors()).containsExactly(2, 3).inOrder();
    assertThat(header.predecessors()).containsExactly(0, 2);
    assertThat(cfg.block(3).statements()).containsExactly(ret(var("x")));
    assertThat(cfg.order(0)).isLessThan(cfg.order(1));
    assertThat(cfg.order(1)).isLessThan(cfg.order(2));
  }

  @Test
  public void statementsAfterReturnAreUnreachable() {
    ControlFlowGraph cfg = build(ret(lit("1")), assign("x", lit("2")));
    assertThat(cfg.numBlocks()).isEqualTo(2);
    assertThat(cfg.isReachable(1)).isFalse();
    assertThat(cfg.unreachableBlocks()).containsExactly(1);
    MalformedIrException e = assertThrows(MalformedIrException.class, cfg::checkWellFormed);
    assertThat(e).hasMessageThat().contains("unreachable blocks B1");
  }

  @Test
  public void emptyBodyIsMalformed() {
    Function fn = Function.builder("empty").build();
    MalformedIrException e = assertThrows(MalformedIrException.class, () -> CfgBuilder.build(fn));
    assertThat(e).hasMessageThat().contains("empty: function has no body");
  }
}
