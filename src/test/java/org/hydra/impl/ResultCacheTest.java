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
import static org.hydra.ir.IrFixtures.lit;
import static org.hydra.ir.IrFixtures.module;
import static org.hydra.ir.IrFixtures.ret;
import static org.hydra.ir.IrFixtures.var;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.hydra.impl.Property.UnreachableProperty;
import org.hydra.ir.Function;
import org.hydra.ir.Module;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ResultCacheTest {

  private final SafetyAnalyzer analyzer = new SafetyAnalyzer();
  private final ResultCache cache = new ResultCache(analyzer);

  private static Module withLiteral(String literal) {
    Function f =
        Function.builder("f")
            .add(assign("x", lit(literal)), callStmt("vault::deposit", var("x")), ret())
            .build();
    return module("m", f);
  }

  @Test
  public void repeatedAnalysisHits() {
    Module module = withLiteral("1");
    AnalysisResult first = cache.analyze(module, ImmutableSet.of());
    AnalysisResult second = cache.analyze(module, ImmutableSet.of());
    assertThat(second).isSameInstanceAs(first);
    assertThat(cache.hits()).isEqualTo(1);
    assertThat(cache.size()).isEqualTo(1);
  }

  @Test
  public void changedStatementMisses() {
    cache.analyze(withLiteral("1"), ImmutableSet.of());
    cache.analyze(withLiteral("2"), ImmutableSet.of());
    assertThat(cache.hits()).isEqualTo(0);
    assertThat(cache.size()).isEqualTo(2);
  }

  @Test
  public void changedTrustMisses() {
    Module module = withLiteral("1");
    cache.analyze(module, ImmutableSet.of());
    cache.analyze(module, ImmutableSet.of("vault"));
    assertThat(cache.hits()).isEqualTo(0);
  }

  @Test
  public void trustOrderDoesNotMatter() {
    assertThat(ResultCache.key(withLiteral("1"), ImmutableSet.of("a", "b"), 3))
        .isEqualTo(ResultCache.key(withLiteral("1"), ImmutableSet.of("b", "a"), 3));
    assertThat(ResultCache.key(withLiteral("1"), ImmutableSet.of("ab"), 3))
        .isNotEqualTo(ResultCache.key(withLiteral("1"), ImmutableSet.of("a", "b"), 3));
  }

  @Test
  public void registeringPropertyInvalidates() {
    Function f =
        Function.builder("f").add(assign("x", call("treasury::drain", var("t"))), ret()).build();
    Module module = module("m", f);
    assertThat(cache.analyze(module, ImmutableSet.of()).isClean()).isTrue();
    analyzer.registerProperty(new UnreachableProperty("treasury", ImmutableList.of("public")));
    assertThat(cache.analyze(module, ImmutableSet.of()).isClean()).isFalse();
    assertThat(cache.hits()).isEqualTo(0);
  }

  @Test
  public void clearForgetsResults() {
    Module module = withLiteral("1");
    cache.analyze(module, ImmutableSet.of());
    cache.clear();
    cache.analyze(module, ImmutableSet.of());
    assertThat(cache.hits()).isEqualTo(0);
    assertThat(cache.size()).isEqualTo(1);
  }
}
