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
import com.google.common.collect.ImmutableSet;

/** A struct declaration with its abilities ({@code key}, {@code store}, ...) and attributes. */
public record Struct(
    String name,
    ImmutableList<Field> fields,
    ImmutableSet<String> abilities,
    ImmutableList<String> attributes) {

  public static final String KEY = "key";

  public Struct {
    fields = ImmutableList.copyOf(fields);
    abilities = ImmutableSet.copyOf(abilities);
    attributes = ImmutableList.copyOf(attributes);
  }

  public boolean hasAbility(String ability) {
    return abilities.contains(ability);
  }

  /** Structs with the {@code key} ability are objects. */
  public boolean isKey() {
    return hasAbility(KEY);
  }

  public boolean hasUidField() {
    return fields.stream().anyMatch(Field::isUid);
  }

  public boolean hasField(String fieldName) {
    return fields.stream().anyMatch(f -> f.name().equals(fieldName));
  }
}
