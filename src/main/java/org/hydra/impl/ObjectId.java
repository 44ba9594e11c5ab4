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

/**
 * Identifies one modeled object: the module and struct type that define it, plus an identity that
 * is unique within the analysis run (e.g. the function and variable that created it).
 */
public record ObjectId(String module, String type, String identity) {
  @Override
  public String toString() {
    return module + "::" + type + "#" + identity;
  }
}
