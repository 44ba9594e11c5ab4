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
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.hydra.code.CfgBuilder;
import org.hydra.code.ControlFlowGraph;
import org.hydra.code.MalformedIrException;
import org.hydra.impl.SecurityEvent.BoundaryCrossing;
import org.hydra.impl.SecurityEvent.BoundaryKind;
import org.hydra.impl.SecurityEvent.CallToTrusted;
import org.hydra.ir.Function;
import org.hydra.ir.Location;
import org.hydra.ir.Module;
import org.hydra.util.StringUtil;
import org.jspecify.annotations.Nullable;

/**
 * Runs all the analyses over a module and aggregates what they find.
 *
 * <p>For each module the analyzer
 *
 * <ul>
 *   <li>records the module's {@link ModuleInfo}, which later analyses of other modules consult;
 *   <li>builds a control-flow graph for each function and runs the flow, loop and escape
 *       analyses on it;
 *   <li>tracks the lifecycle of objects and capabilities across the module;
 *   <li>traces calls across module boundaries and reports the unsafe ones; and
 *   <li>checks the module's call graph and verifies the registered safety properties.
 * </ul>
 *
 * <p>A SafetyAnalyzer may be shared by threads analyzing different modules; everything it retains
 * between runs is guarded by the analyzer's lock, and each run uses its own trackers.
 */
public final class SafetyAnalyzer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String TRUST_BOUNDARIES = "Section 4.4: Trust Boundaries";
  static final String STRUCTURE = "Section 3.1: Module Structure";

  private final AnalyzerConfig config;

  @GuardedBy("this")
  private final Map<String, ModuleInfo> modules = new LinkedHashMap<>();

  @GuardedBy("this")
  private final Map<String, ImmutableList<SecurityEvent>> securityEvents = new LinkedHashMap<>();

  @GuardedBy("this")
  private final Map<String, ImmutableList<String>> callChains = new HashMap<>();

  @GuardedBy("this")
  private final List<Property> properties = new ArrayList<>();

  /** Incremented whenever the retained ModuleInfos or the registered properties change. */
  @GuardedBy("this")
  private long registryVersion;

  public SafetyAnalyzer() {
    this(AnalyzerConfig.DEFAULT);
  }

  public SafetyAnalyzer(AnalyzerConfig config) {
    this.config = config;
  }

  public AnalyzerConfig config() {
    return config;
  }

  /** Registers a property that every later analysis verifies. */
  public synchronized void registerProperty(Property property) {
    properties.add(property);
    registryVersion++;
  }

  public synchronized @Nullable ModuleInfo getModuleInfo(String name) {
    return modules.get(name);
  }

  /** The calls made by module {@code name} to other modules, or an empty list if it is unknown. */
  public synchronized ImmutableList<String> getCrossModuleCalls(String name) {
    ModuleInfo info = modules.get(name);
    if (info == null) {
      return ImmutableList.of();
    }
    return info.externalCalls().stream()
        .filter(c -> StringUtil.isQualified(c) && !StringUtil.moduleOf(c).equals(name))
        .collect(ImmutableList.toImmutableList());
  }

  /** The security events of the most recent analysis of each module. */
  public synchronized ImmutableList<SecurityEvent> getSecurityEvents() {
    return securityEvents.values().stream()
        .flatMap(List::stream)
        .collect(ImmutableList.toImmutableList());
  }

  /** The calls made by module {@code name} in its most recent analysis, in order. */
  public synchronized ImmutableList<String> getCallChain(String name) {
    return callChains.getOrDefault(name, ImmutableList.of());
  }

  synchronized long registryVersion() {
    return registryVersion;
  }

  /** Analyzes {@code module} with no trusted modules. */
  public AnalysisResult analyzeModule(Module module) {
    return analyzeModule(module, ImmutableSet.of());
  }

  /**
   * Analyzes {@code module}. {@code trustedModules} names the modules whose calls are trusted in
   * this run; it applies to ModuleInfos recorded by this run only.
   */
  public AnalysisResult analyzeModule(Module module, Set<String> trustedModules) {
    ModuleInfo info = ModuleInfo.of(module, trustedModules.contains(module.name()));
    ImmutableList<Property> registered;
    synchronized (this) {
      if (!info.equals(modules.put(module.name(), info))) {
        registryVersion++;
      }
      registered = ImmutableList.copyOf(properties);
    }
    Findings findings = new Findings();
    int size = module.statementCount();
    if (size > config.maxModuleSize()) {
      logger.atWarning().log(
          "Skipping %s: %d statements exceeds limit %d",
          module.name(), size, config.maxModuleSize());
      findings.add(
          new SafetyViolation(
              Location.UNKNOWN.withContext(module.name()),
              ViolationType.MALFORMED_IR,
              String.format(
                  "Module %s has %d statements (limit %d); only its summary was built",
                  module.name(), size, config.maxModuleSize()),
              Severity.LOW,
              new ViolationContext(
                  ImmutableList.of(),
                  ImmutableList.of(),
                  ImmutableList.of("Split the module"),
                  STRUCTURE)));
      return findings.toResult();
    }
    Module analyzed = config.ignoreTests() ? withoutTests(module) : module;
    logger.atFine().log(
        "Analyzing %s (%d functions) with %s", module.name(), analyzed.functions().size(), config);

    EscapeAnalyzer escapes = new EscapeAnalyzer(EscapeAnalyzer.invariantFields(analyzed));
    for (Function fn : analyzed.functions()) {
      analyzeFunction(analyzed, fn, escapes, findings);
    }

    LifecyclePass lifecycle = new LifecyclePass(analyzed, config);
    analyzed.functions().forEach(lifecycle::run);
    lifecycle.tracker().issues().forEach(findings::add);

    TraceAnalyzer tracer = new TraceAnalyzer(trustedModules);
    tracer.trace(analyzed);
    reportBoundaryEvents(analyzed, info, tracer.events(), findings);
    checkDependencyCycles(analyzed, findings);

    new CallGraphChecker(analyzed, analyzed.functions(), config.maxCallStackDepth())
        .check(findings);

    List<Property> all = new ArrayList<>(registered);
    all.addAll(SafetyVerifier.derivedProperties(analyzed));
    new SafetyVerifier(config, all).verify(analyzed, analyzed.functions(), findings);

    synchronized (this) {
      securityEvents.put(module.name(), tracer.events());
      callChains.put(module.name(), tracer.callChain());
    }
    AnalysisResult result = findings.toResult();
    logger.atFine().log(
        "%s: %d violations, %d leaks, %d object issues",
        module.name(),
        result.safetyViolations().size(),
        result.referenceLeaks().size(),
        result.objectSafetyIssues().size());
    return result;
  }

  private static Module withoutTests(Module module) {
    return new Module(
        module.name(),
        module.imports(),
        module.functions().stream()
            .filter(fn -> !fn.isTest())
            .collect(ImmutableList.toImmutableList()),
        module.structs());
  }

  /**
   * Runs the per-function passes. A function whose graph is malformed is reported and skipped;
   * the rest of the module is still analyzed.
   */
  private void analyzeFunction(
      Module module, Function fn, EscapeAnalyzer escapes, Findings findings) {
    ControlFlowGraph cfg;
    try {
      cfg = CfgBuilder.build(fn);
      cfg.checkWellFormed();
    } catch (MalformedIrException e) {
      logger.atWarning().log("Skipping %s: %s", fn.name(), e.getMessage());
      findings.add(
          new SafetyViolation(
              fn.location(),
              ViolationType.MALFORMED_IR,
              e.getMessage(),
              Severity.LOW,
              ViolationContext.of(fn.name(), "Remove dead code and empty functions", STRUCTURE)));
      return;
    }
    FlowAnalyzer.Listener listener = FlowAnalyzer.Listener.reportingTo(findings);
    for (Dimension dimension : Dimension.values()) {
      if ((dimension == Dimension.OBJECT && !config.checkTransferSafety())
          || (dimension == Dimension.CAPABILITY && !config.checkCapabilitySafety())) {
        continue;
      }
      FlowAnalyzer flow = new FlowAnalyzer(module, fn, cfg, dimension);
      FlowAnalyzer.Result result = flow.run(listener);
      if (fn.hasLoops()) {
        new LoopAnalyzer(flow, config.loopIterations(), config.maxLoopDepth())
            .analyze(result, findings);
      }
    }
    EscapeAnalyzer.report(fn, escapes.analyze(fn), findings);
  }

  private void reportBoundaryEvents(
      Module module, ModuleInfo from, List<SecurityEvent> events, Findings findings) {
    for (SecurityEvent event : events) {
      Location loc =
          module.findFunction(event.function()).map(Function::location).orElse(Location.UNKNOWN);
      if (event instanceof CallToTrusted call) {
        findings.add(
            new SafetyViolation(
                loc,
                ViolationType.UNAUTHORIZED_ACCESS,
                String.format(
                    "Untrusted module %s calls trusted module %s via %s in %s",
                    call.from(), call.to(), call.call(), call.function()),
                Severity.HIGH,
                ViolationContext.of(
                    call.function(), "Add proper capability verification", TRUST_BOUNDARIES)));
      } else if (event instanceof BoundaryCrossing crossing) {
        if (crossing.kind() == BoundaryKind.TRUSTED_TO_UNTRUSTED) {
          findings.add(
              new SafetyViolation(
                  loc,
                  ViolationType.RESOURCE_SAFETY_VIOLATION,
                  String.format(
                      "Potential resource leak: trusted module %s calls untrusted module %s"
                          + " via %s in %s",
                      crossing.from(), crossing.to(), crossing.call(), crossing.function()),
                  Severity.HIGH,
                  ViolationContext.of(
                      crossing.function(),
                      "Validate what is passed to untrusted modules",
                      TRUST_BOUNDARIES)));
        } else if (crossing.kind() == BoundaryKind.CROSS_MODULE
            && getModuleInfo(crossing.to()) != null
            && !from.dependencies().contains(crossing.to())) {
          findings.add(
              new SafetyViolation(
                  loc,
                  ViolationType.UNAUTHORIZED_ACCESS,
                  String.format(
                      "Call from %s to undeclared dependency %s via %s in %s",
                      crossing.from(), crossing.to(), crossing.call(), crossing.function()),
                  Severity.MEDIUM,
                  ViolationContext.of(
                      crossing.function(),
                      "Import " + crossing.to() + " before calling it",
                      TRUST_BOUNDARIES)));
        }
      }
    }
  }

  /**
   * Reports a cycle among the retained modules' dependencies that passes through {@code module}.
   * Uses a breadth-first search so that the reported cycle is a shortest one.
   */
  private void checkDependencyCycles(Module module, Findings findings) {
    Map<String, ImmutableSet<String>> graph = new HashMap<>();
    synchronized (this) {
      modules.forEach((name, info) -> graph.put(name, info.dependencies()));
    }
    String start = module.name();
    Map<String, String> parent = new HashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    queue.add(start);
    @Nullable String last = null;
    while (!queue.isEmpty() && last == null) {
      String current = queue.remove();
      for (String dep : graph.getOrDefault(current, ImmutableSet.of())) {
        if (dep.equals(start)) {
          last = current;
          break;
        } else if (graph.containsKey(dep) && !parent.containsKey(dep)) {
          parent.put(dep, current);
          queue.add(dep);
        }
      }
    }
    if (last == null) {
      return;
    }
    List<String> cycle = new ArrayList<>();
    for (String m = last; !m.equals(start); m = parent.get(m)) {
      cycle.add(0, m);
    }
    cycle.add(0, start);
    cycle.add(start);
    findings.add(
        new SafetyViolation(
            Location.UNKNOWN.withContext(start),
            ViolationType.RESOURCE_SAFETY_VIOLATION,
            "Module dependency cycle: " + String.join(" -> ", cycle),
            Severity.HIGH,
            new ViolationContext(
                ImmutableList.of(),
                ImmutableList.copyOf(cycle.subList(0, cycle.size() - 1)),
                ImmutableList.of("Break the cycle by moving shared definitions to a new module"),
                STRUCTURE)));
  }
}
