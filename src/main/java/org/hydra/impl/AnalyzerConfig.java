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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Options that control which checks a {@link SafetyAnalyzer} runs and their limits. */
public final class AnalyzerConfig {

  public static final AnalyzerConfig DEFAULT = builder().build();

  private final boolean strictMode;
  private final boolean checkTransferSafety;
  private final boolean checkCapabilitySafety;
  private final boolean checkSharedObjects;
  private final int maxLoopDepth;
  private final int maxCallStackDepth;
  private final int maxModuleSize;
  private final int loopIterations;
  private final boolean ignoreTests;

  private AnalyzerConfig(Builder b) {
    this.strictMode = b.strictMode;
    this.checkTransferSafety = b.checkTransferSafety;
    this.checkCapabilitySafety = b.checkCapabilitySafety;
    this.checkSharedObjects = b.checkSharedObjects;
    this.maxLoopDepth = b.maxLoopDepth;
    this.maxCallStackDepth = b.maxCallStackDepth;
    this.maxModuleSize = b.maxModuleSize;
    this.loopIterations = b.loopIterations;
    this.ignoreTests = b.ignoreTests;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder initialized from this config. */
  public Builder toBuilder() {
    return builder()
        .setStrictMode(strictMode)
        .setCheckTransferSafety(checkTransferSafety)
        .setCheckCapabilitySafety(checkCapabilitySafety)
        .setCheckSharedObjects(checkSharedObjects)
        .setMaxLoopDepth(maxLoopDepth)
        .setMaxCallStackDepth(maxCallStackDepth)
        .setMaxModuleSize(maxModuleSize)
        .setLoopIterations(loopIterations)
        .setIgnoreTests(ignoreTests);
  }

  /** If true, public functions taking mutable references to objects are reported. */
  public boolean strictMode() {
    return strictMode;
  }

  public boolean checkTransferSafety() {
    return checkTransferSafety;
  }

  public boolean checkCapabilitySafety() {
    return checkCapabilitySafety;
  }

  public boolean checkSharedObjects() {
    return checkSharedObjects;
  }

  public int maxLoopDepth() {
    return maxLoopDepth;
  }

  public int maxCallStackDepth() {
    return maxCallStackDepth;
  }

  /** Modules with more statements than this get only a summary and a low-severity finding. */
  public int maxModuleSize() {
    return maxModuleSize;
  }

  /** How many times each loop body is re-analyzed. */
  public int loopIterations() {
    return loopIterations;
  }

  public boolean ignoreTests() {
    return ignoreTests;
  }

  @Override
  public String toString() {
    return String.format(
        "AnalyzerConfig(strict=%s, transfer=%s, capability=%s, shared=%s, loopDepth=%d,"
            + " callDepth=%d, moduleSize=%d, iterations=%d, ignoreTests=%s)",
        strictMode,
        checkTransferSafety,
        checkCapabilitySafety,
        checkSharedObjects,
        maxLoopDepth,
        maxCallStackDepth,
        maxModuleSize,
        loopIterations,
        ignoreTests);
  }

  /** Builds an {@link AnalyzerConfig}; every option starts at its default. */
  public static final class Builder {
    private boolean strictMode;
    private boolean checkTransferSafety = true;
    private boolean checkCapabilitySafety = true;
    private boolean checkSharedObjects = true;
    private int maxLoopDepth = 3;
    private int maxCallStackDepth = 8;
    private int maxModuleSize = 10_000;
    private int loopIterations = LoopAnalyzer.DEFAULT_ITERATIONS;
    private boolean ignoreTests;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setStrictMode(boolean strictMode) {
      this.strictMode = strictMode;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCheckTransferSafety(boolean checkTransferSafety) {
      this.checkTransferSafety = checkTransferSafety;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCheckCapabilitySafety(boolean checkCapabilitySafety) {
      this.checkCapabilitySafety = checkCapabilitySafety;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCheckSharedObjects(boolean checkSharedObjects) {
      this.checkSharedObjects = checkSharedObjects;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMaxLoopDepth(int maxLoopDepth) {
      checkArgument(maxLoopDepth >= 1, "maxLoopDepth must be positive: %s", maxLoopDepth);
      this.maxLoopDepth = maxLoopDepth;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMaxCallStackDepth(int maxCallStackDepth) {
      checkArgument(
          maxCallStackDepth >= 1, "maxCallStackDepth must be positive: %s", maxCallStackDepth);
      this.maxCallStackDepth = maxCallStackDepth;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMaxModuleSize(int maxModuleSize) {
      checkArgument(maxModuleSize >= 1, "maxModuleSize must be positive: %s", maxModuleSize);
      this.maxModuleSize = maxModuleSize;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLoopIterations(int loopIterations) {
      checkArgument(loopIterations >= 2, "loopIterations must be at least 2: %s", loopIterations);
      this.loopIterations = loopIterations;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setIgnoreTests(boolean ignoreTests) {
      this.ignoreTests = ignoreTests;
      return this;
    }

    public AnalyzerConfig build() {
      return new AnalyzerConfig(this);
    }
  }
}
