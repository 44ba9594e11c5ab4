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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.hydra.ir.Function;
import org.hydra.ir.Import;
import org.hydra.ir.Module;
import org.hydra.ir.Statement;
import org.hydra.util.StringUtil;

/**
 * Facts about a module that boundary checks in other modules' analyses rely on. Built at the start
 * of each module analysis and retained by the {@link SafetyAnalyzer}.
 */
public record ModuleInfo(
    String name,
    boolean trusted,
    ImmutableSet<String> dependencies,
    ImmutableList<String> externalCalls,
    ImmutableSet<String> publicFunctions) {

  public ModuleInfo {
    dependencies = ImmutableSet.copyOf(dependencies);
    externalCalls = ImmutableList.copyOf(externalCalls);
    publicFunctions = ImmutableSet.copyOf(publicFunctions);
  }

  /**
   * Derives the ModuleInfo for {@code module}. Dependencies are the imported module names;
   * external calls are the targets of call statements that are not {@code Self::} qualified.
   */
  public static ModuleInfo of(Module module, boolean trusted) {
    ImmutableSet<String> dependencies =
        module.imports().stream().map(Import::moduleName).collect(ImmutableSet.toImmutableSet());
    ImmutableList.Builder<String> externalCalls = ImmutableList.builder();
    for (Function fn : module.functions()) {
      for (Statement s : Statement.flatten(fn.body())) {
        if ((s instanceof Statement.Call || s instanceof Statement.ExternalCall)
            && !StringUtil.isSelfQualified(((Statement.Invocation) s).name())) {
          externalCalls.add(((Statement.Invocation) s).name());
        }
      }
    }
    ImmutableSet<String> publicFunctions =
        module.functions().stream()
            .filter(Function::isPublic)
            .map(Function::name)
            .collect(ImmutableSet.toImmutableSet());
    return new ModuleInfo(
        module.name(), trusted, dependencies, externalCalls.build(), publicFunctions);
  }
}
