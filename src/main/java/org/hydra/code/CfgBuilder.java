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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;
import org.hydra.ir.Function;
import org.hydra.ir.Statement;

/**
 * Partitions a function body into {@link BasicBlock}s.
 *
 * <p>Straight-line statements are appended to the current block. An {@link Statement.If} ends the
 * current block with a two-way branch to its then and else arms, which rejoin at a new block (if
 * either arm falls through). A {@link Statement.Loop} gets a header block that evaluates the
 * condition and branches to the body or to the exit; the end of the body branches back to the
 * header. A {@link Statement.Return} ends the current block with no successors; any statements
 * after it start a new block with no predecessors, which {@link ControlFlowGraph#checkWellFormed}
 * will reject.
 */
public class CfgBuilder {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final List<BasicBlock> blocks = new ArrayList<>();

  /** The block that the next statement will be added to, or null if control cannot get there. */
  private BasicBlock current;

  private CfgBuilder() {}

  /**
   * Builds the graph for {@code fn}.
   *
   * @throws MalformedIrException if the function has no body
   */
  public static ControlFlowGraph build(Function fn) {
    if (fn.body().isEmpty()) {
      throw new MalformedIrException(fn.name() + ": function has no body");
    }
    CfgBuilder builder = new CfgBuilder();
    builder.current = builder.newBlock();
    builder.addAll(fn.body());
    ControlFlowGraph cfg = new ControlFlowGraph(fn.name(), builder.blocks);
    logger.atFine().log("CFG for %s:\n%s", fn.name(), lazy(cfg::toString));
    return cfg;
  }

  private BasicBlock newBlock() {
    BasicBlock block = new BasicBlock(blocks.size());
    blocks.add(block);
    return block;
  }

  private static void link(BasicBlock from, BasicBlock to) {
    assert from.successors.size() < 2;
    from.successors.add(to.index);
    to.predecessors.add(from.index);
  }

  /**
   * Returns the block that the next statement should be added to. If the previous statement did
   * not fall through, this is a new block with no predecessors.
   */
  private BasicBlock current() {
    if (current == null) {
      current = newBlock();
    }
    return current;
  }

  private void addAll(List<Statement> statements) {
    for (Statement s : statements) {
      add(s);
    }
  }

  private void add(Statement s) {
    if (s instanceof Statement.If ifStmt) {
      BasicBlock split = current();
      split.setCondition(ifStmt.condition());
      current = newBlock();
      link(split, current);
      addAll(ifStmt.thenBody());
      BasicBlock thenEnd = current;
      current = newBlock();
      link(split, current);
      addAll(ifStmt.elseBody());
      BasicBlock elseEnd = current;
      if (thenEnd == null && elseEnd == null) {
        current = null;
      } else {
        BasicBlock join = newBlock();
        if (thenEnd != null) {
          link(thenEnd, join);
        }
        if (elseEnd != null) {
          link(elseEnd, join);
        }
        current = join;
      }
    } else if (s instanceof Statement.Loop loop) {
      BasicBlock before = current();
      BasicBlock header = newBlock();
      link(before, header);
      header.setCondition(loop.condition());
      current = newBlock();
      link(header, current);
      addAll(loop.body());
      if (current != null) {
        link(current, header);
      }
      current = newBlock();
      link(header, current);
    } else {
      current().statements.add(s);
      if (s instanceof Statement.Return) {
        current = null;
      }
    }
  }
}
