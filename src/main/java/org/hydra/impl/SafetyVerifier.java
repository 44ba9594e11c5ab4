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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.hydra.impl.CallClassifier.Rule;
import org.hydra.impl.FunctionFacts.Site;
import org.hydra.impl.Property.LocalProperty;
import org.hydra.impl.Property.StrongProperty;
import org.hydra.impl.Property.UnreachableProperty;
import org.hydra.ir.Expression;
import org.hydra.ir.Field;
import org.hydra.ir.Function;
import org.hydra.ir.Location;
import org.hydra.ir.Module;
import org.hydra.ir.Parameter;
import org.hydra.ir.Statement;
import org.hydra.ir.Struct;
import org.hydra.util.StringUtil;
import org.jspecify.annotations.Nullable;

/**
 * Checks a module against the registered {@link Property properties} and a fixed set of object
 * rules: objects must carry an identity field, transfers must be preceded by an ownership check,
 * and shared-object access must be verified and synchronized.
 *
 * <p>Every violation reported here carries a suggested fix and cites the section of the design
 * document that states the rule.
 */
public final class SafetyVerifier {

  static final String LOCAL_PROPERTIES = "Section 5.1: Local Properties";
  static final String UNREACHABILITY = "Section 5.2: Unreachability";
  static final String STRONG_PROPERTIES = "Section 5.3: Strong Properties";
  static final String OBJECT_MODEL = "Section 4.2: Object Model";
  static final String OWNERSHIP = "Section 4.3: Ownership and Transfer";
  static final String SHARED_OBJECTS = "Section 4.5: Shared Objects";
  static final String PUBLIC_INTERFACES = "Section 4.6: Public Interfaces";

  private final AnalyzerConfig config;
  private final ImmutableList<LocalProperty> localProperties;
  private final ImmutableList<UnreachableProperty> unreachableProperties;
  private final ImmutableList<StrongProperty> strongProperties;

  public SafetyVerifier(AnalyzerConfig config, List<? extends Property> properties) {
    this.config = config;
    ImmutableList.Builder<LocalProperty> local = ImmutableList.builder();
    ImmutableList.Builder<UnreachableProperty> unreachable = ImmutableList.builder();
    ImmutableList.Builder<StrongProperty> strong = ImmutableList.builder();
    for (Property p : properties) {
      if (p instanceof LocalProperty lp) {
        local.add(lp);
      } else if (p instanceof UnreachableProperty up) {
        unreachable.add(up);
      } else if (p instanceof StrongProperty sp) {
        strong.add(sp);
      }
    }
    this.localProperties = local.build();
    this.unreachableProperties = unreachable.build();
    this.strongProperties = strong.build();
  }

  /**
   * The properties implied by the module itself: a local property for each function that makes
   * assertions, and an unreachability and a strong property for each field with an invariant.
   */
  public static ImmutableList<Property> derivedProperties(Module module) {
    ImmutableList.Builder<Property> result = ImmutableList.builder();
    for (Function fn : module.functions()) {
      if (fn.hasAssertions()) {
        result.add(new LocalProperty(fn.name(), "assertion", "function", "assert"));
      }
    }
    for (Struct s : module.structs()) {
      for (Field f : s.fields()) {
        if (f.hasInvariant()) {
          UnreachableProperty unreachable =
              new UnreachableProperty(f.name(), ImmutableList.of("public"));
          result.add(unreachable);
          result.add(
              new StrongProperty(
                  new LocalProperty(f.name(), f.invariant(), "field", "check"), unreachable));
        }
      }
    }
    return result.build();
  }

  public void verify(Module module, List<Function> functions, Findings findings) {
    ImmutableList<FunctionFacts> facts =
        functions.stream().map(FunctionFacts::of).collect(ImmutableList.toImmutableList());
    checkLocalProperties(facts, findings);
    checkUnreachability(facts, findings);
    checkStrongProperties(facts, findings);
    checkIdentityFields(module, functions, findings);
    for (FunctionFacts f : facts) {
      if (config.checkTransferSafety()) {
        checkTransfers(f, findings);
      }
      if (config.checkSharedObjects()) {
        checkSharedAccess(f, findings);
      }
    }
    if (config.strictMode()) {
      checkPublicInterfaces(module, functions, findings);
    }
  }

  private static SafetyViolation violation(
      Function fn,
      ViolationType type,
      String message,
      Severity severity,
      List<String> relatedTypes,
      String fix,
      String reference) {
    return new SafetyViolation(
        fn.location(),
        type,
        message,
        severity,
        new ViolationContext(
            ImmutableList.of(fn.name()),
            ImmutableList.copyOf(relatedTypes),
            ImmutableList.of(fix),
            reference));
  }

  private void checkLocalProperties(List<FunctionFacts> facts, Findings findings) {
    for (FunctionFacts f : facts) {
      for (Site site : f.sites) {
        if (site.isAssert()) {
          continue;
        }
        String callee = StringUtil.memberOf(site.callName());
        for (LocalProperty p : localProperties) {
          if (p.name().equals(callee) && !p.holds()) {
            findings.add(
                violation(
                    f.function,
                    ViolationType.INVARIANT_VIOLATION,
                    String.format(
                        "Call to %s in %s has no local check for %s",
                        site.callName(), f.function.name(), p.invariant()),
                    Severity.HIGH,
                    ImmutableList.of(),
                    "Add an assertion establishing " + p.invariant() + " before the call",
                    LOCAL_PROPERTIES));
          }
        }
      }
    }
  }

  /** Returns the first call site in any function whose target contains {@code resource}. */
  private static @Nullable Site findReachingCall(List<FunctionFacts> facts, String resource) {
    for (FunctionFacts f : facts) {
      for (Site site : f.sites) {
        if (!site.isAssert() && site.callName().contains(resource)) {
          return site;
        }
      }
    }
    return null;
  }

  private static FunctionFacts owner(List<FunctionFacts> facts, Site site) {
    return facts.stream().filter(f -> f.sites.contains(site)).findFirst().get();
  }

  private void checkUnreachability(List<FunctionFacts> facts, Findings findings) {
    for (UnreachableProperty p : unreachableProperties) {
      for (FunctionFacts f : facts) {
        for (Site site : f.sites) {
          if (!site.isAssert() && site.callName().contains(p.resource())) {
            findings.add(
                violation(
                    f.function,
                    ViolationType.RESOURCE_SAFETY_VIOLATION,
                    String.format(
                        "Resource %s is reachable through %s in %s (forbidden: %s)",
                        p.resource(), site.callName(), f.function.name(), p.forbiddenPaths()),
                    Severity.HIGH,
                    ImmutableList.of(p.resource()),
                    "Remove the access to " + p.resource() + " or restrict it to the module",
                    UNREACHABILITY));
          }
        }
      }
    }
  }

  private void checkStrongProperties(List<FunctionFacts> facts, Findings findings) {
    for (StrongProperty p : strongProperties) {
      Site reaching = findReachingCall(facts, p.unreachable().resource());
      if (p.local().holds() && reaching == null) {
        continue;
      }
      @Nullable Function fn = (reaching != null) ? owner(facts, reaching).function : null;
      String why =
          (reaching != null)
              ? p.unreachable().resource() + " is reachable through " + reaching.callName()
              : "local condition for " + p.local().invariant() + " is missing";
      SafetyViolation v =
          new SafetyViolation(
              (fn != null) ? fn.location() : Location.UNKNOWN,
              ViolationType.INVARIANT_VIOLATION,
              "Strong property on " + p.local().name() + " violated: " + why,
              Severity.CRITICAL,
              new ViolationContext(
                  (fn != null) ? ImmutableList.of(fn.name()) : ImmutableList.of(),
                  ImmutableList.of(p.unreachable().resource()),
                  ImmutableList.of(
                      "Keep " + p.unreachable().resource() + " private and check "
                          + p.local().invariant()),
                  STRONG_PROPERTIES));
      findings.add(v);
    }
  }

  /** Each key-ability struct constructed without a UID field is reported once. */
  private static void checkIdentityFields(
      Module module, List<Function> functions, Findings findings) {
    Set<String> reported = new LinkedHashSet<>();
    for (Function fn : functions) {
      for (Statement s : Statement.flatten(fn.body())) {
        for (Expression e : s.expressions()) {
          for (Expression sub : Expression.flatten(e)) {
            if (sub instanceof Expression.Pack pack) {
              Struct struct = module.findStruct(pack.structName()).orElse(null);
              if (struct != null
                  && struct.isKey()
                  && !struct.hasUidField()
                  && reported.add(struct.name())) {
                findings.add(
                    violation(
                        fn,
                        ViolationType.RESOURCE_SAFETY_VIOLATION,
                        "Unsafe construction: object " + struct.name() + " is missing a UID field",
                        Severity.CRITICAL,
                        ImmutableList.of(struct.name()),
                        "Add 'id: UID' as first field",
                        OBJECT_MODEL));
              }
            }
          }
        }
      }
    }
  }

  private static void checkTransfers(FunctionFacts f, Findings findings) {
    for (Site site : f.calls(Rule.TRANSFER)) {
      if (!f.ownershipVerifiedBefore(site.index())) {
        findings.add(
            violation(
                f.function,
                ViolationType.UNAUTHORIZED_ACCESS,
                "Transfer without ownership verification in " + f.function.name(),
                Severity.HIGH,
                ImmutableList.of(),
                "Check tx_context::sender against the object's owner with an assertion before"
                    + " transferring",
                OWNERSHIP));
      }
    }
  }

  private static void checkSharedAccess(FunctionFacts f, Findings findings) {
    if (!f.anyCall(Rule.SHARED_ACCESS)) {
      return;
    }
    boolean verified = f.anyCall(Rule.CONSENSUS_VERIFY);
    boolean synced = f.anyCall(Rule.SYNCHRONIZATION);
    if (!(verified && synced)) {
      findings.add(
          violation(
              f.function,
              ViolationType.SHARED_OBJECT_VIOLATION,
              String.format(
                  "Shared object access in %s without %s",
                  f.function.name(),
                  verified ? "synchronization" : "consensus verification"),
              Severity.HIGH,
              ImmutableList.of(),
              "Call consensus::verify and take a lock before touching the shared object",
              SHARED_OBJECTS));
    }
  }

  private static void checkPublicInterfaces(
      Module module, List<Function> functions, Findings findings) {
    for (Function fn : functions) {
      if (!fn.isPublic()) {
        continue;
      }
      for (Parameter p : fn.parameters()) {
        if (p.type().isMutableReference() && module.isKeyStruct(p.type().baseName())) {
          findings.add(
              violation(
                  fn,
                  ViolationType.UNSAFE_PUBLIC_INTERFACE,
                  String.format(
                      "Public function %s takes mutable reference %s: %s",
                      fn.name(), p.name(), p.type()),
                  Severity.MEDIUM,
                  ImmutableList.of(p.type().baseName()),
                  "Take the object by value or restrict the function to the package",
                  PUBLIC_INTERFACES));
        }
      }
    }
  }
}
