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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.hydra.ir.Module;

/**
 * Remembers the result of analyzing a module, keyed by a hash of the module's content, the trusted
 * modules and the analyzer's registry version. Changing any statement of a module, the trust set,
 * a retained ModuleInfo or the registered properties changes the key.
 */
public final class ResultCache {
  private final SafetyAnalyzer analyzer;

  @GuardedBy("this")
  private final Map<HashCode, AnalysisResult> results = new HashMap<>();

  @GuardedBy("this")
  private int hits;

  public ResultCache(SafetyAnalyzer analyzer) {
    this.analyzer = analyzer;
  }

  static HashCode key(Module module, Set<String> trustedModules, long registryVersion) {
    Hasher hasher = Hashing.sha256().newHasher();
    hasher.putString(module.toString(), UTF_8);
    for (String trusted : ImmutableSortedSet.copyOf(trustedModules)) {
      hasher.putByte((byte) 0).putString(trusted, UTF_8);
    }
    return hasher.putLong(registryVersion).hash();
  }

  public AnalysisResult analyze(Module module, Set<String> trustedModules) {
    HashCode key = key(module, trustedModules, analyzer.registryVersion());
    synchronized (this) {
      AnalysisResult cached = results.get(key);
      if (cached != null) {
        hits++;
        return cached;
      }
    }
    AnalysisResult result = analyzer.analyzeModule(module, trustedModules);
    // Analysis may have recorded a new ModuleInfo, so the key is recomputed
    HashCode after = key(module, trustedModules, analyzer.registryVersion());
    synchronized (this) {
      results.put(after, result);
    }
    return result;
  }

  public synchronized int hits() {
    return hits;
  }

  public synchronized int size() {
    return results.size();
  }

  public synchronized void clear() {
    results.clear();
  }
}
