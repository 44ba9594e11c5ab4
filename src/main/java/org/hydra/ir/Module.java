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

package org.hydra.ir;

import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * A parsed contract module: the unit of analysis. Modules are produced by the front end and are
 * never modified by the analyzer.
 */
public record Module(
    String name,
    ImmutableList<Import> imports,
    ImmutableList<Function> functions,
    ImmutableList<Struct> structs) {

  public Module {
    imports = ImmutableList.copyOf(imports);
    functions = ImmutableList.copyOf(functions);
    structs = ImmutableList.copyOf(structs);
  }

  public Optional<Struct> findStruct(String structName) {
    return structs.stream().filter(s -> s.name().equals(structName)).findFirst();
  }

  public Optional<Function> findFunction(String functionName) {
    return functions.stream().filter(f -> f.name().equals(functionName)).findFirst();
  }

  /** True if {@code typeName} names a struct of this module with the {@code key} ability. */
  public boolean isKeyStruct(String typeName) {
    return findStruct(typeName).map(Struct::isKey).orElse(false);
  }

  /** The number of statements in all function bodies, nested statements included. */
  public int statementCount() {
    return functions.stream().mapToInt(f -> Statement.flatten(f.body()).size()).sum();
  }
}
