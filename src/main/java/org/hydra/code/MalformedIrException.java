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

/**
 * Thrown when a function's IR cannot be turned into a well-formed {@link ControlFlowGraph}, e.g.
 * because it has no body or contains statements that can never be reached.
 */
public class MalformedIrException extends RuntimeException {
  public MalformedIrException(String message) {
    super(message);
  }
}
