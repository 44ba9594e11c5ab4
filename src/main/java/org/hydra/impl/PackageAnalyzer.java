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
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.hydra.ir.Module;
import org.jspecify.annotations.Nullable;

/**
 * Analyzes the modules of a package, optionally in parallel. Each module is analyzed with its own
 * trackers; only the final collection of results is shared. A module whose analysis throws is
 * recorded as a failure and does not affect the others.
 */
public final class PackageAnalyzer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final SafetyAnalyzer analyzer;
  private final @Nullable ExecutorService executor;

  /** Creates a PackageAnalyzer that analyzes modules one at a time on the calling thread. */
  public PackageAnalyzer(SafetyAnalyzer analyzer) {
    this(analyzer, null);
  }

  public PackageAnalyzer(SafetyAnalyzer analyzer, @Nullable ExecutorService executor) {
    this.analyzer = analyzer;
    this.executor = executor;
  }

  public PackageResult analyze(List<Module> modules) throws InterruptedException {
    return analyze(modules, ImmutableSet.of());
  }

  public PackageResult analyze(List<Module> modules, Set<String> trustedModules)
      throws InterruptedException {
    PackageResult.Collector collector =
        new PackageResult.Collector(
            modules.stream().map(Module::name).collect(ImmutableList.toImmutableList()));
    if (executor == null) {
      for (Module module : modules) {
        analyzeOne(module, trustedModules, collector);
      }
    } else {
      List<Future<?>> futures = new ArrayList<>();
      for (Module module : modules) {
        futures.add(executor.submit(() -> analyzeOne(module, trustedModules, collector)));
      }
      for (Future<?> future : futures) {
        try {
          future.get();
        } catch (ExecutionException e) {
          // analyzeOne records its own failures, so only Errors get here
          throw new IllegalStateException(e.getCause());
        }
      }
    }
    PackageResult result = collector.build();
    logger.atFine().log(
        "Analyzed %d modules: %d failed", modules.size(), result.failures().size());
    return result;
  }

  private void analyzeOne(Module module, Set<String> trusted, PackageResult.Collector collector) {
    try {
      collector.add(module.name(), analyzer.analyzeModule(module, trusted));
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("Analysis of %s failed", module.name());
      collector.fail(module.name(), e);
    }
  }
}
