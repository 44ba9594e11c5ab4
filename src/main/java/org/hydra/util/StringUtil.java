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

package org.hydra.util;

import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Static-only class with methods for building strings and splitting qualified Move names. */
public class StringUtil {

  private StringUtil() {}

  /** The separator between a module and a member in a qualified name. */
  public static final String PATH_SEPARATOR = "::";

  /** The module prefix that denotes a call into the current module. */
  public static final String SELF = "Self";

  /**
   * Constructs a string by calling the given IntFunction for each int from 0 to size-1, calling
   * {@code String.valueOf()} on each element, separating them with {@code ", "}, and adding the
   * given prefix and suffix.
   */
  public static String joinElements(
      String prefix, String suffix, int size, IntFunction<Object> elements) {
    assert size >= 0;
    return IntStream.range(0, size)
        .mapToObj(i -> String.valueOf(elements.apply(i)))
        .collect(Collectors.joining(", ", prefix, suffix));
  }

  /**
   * Returns the module part of a possibly-qualified name, i.e. everything before the first {@code
   * ::}. An unqualified name is its own module part ({@code "foo"} returns {@code "foo"}).
   */
  public static String moduleOf(String name) {
    int sep = name.indexOf(PATH_SEPARATOR);
    return (sep < 0) ? name : name.substring(0, sep);
  }

  /** Returns everything after the last {@code ::} in a qualified name, or the name itself. */
  public static String memberOf(String name) {
    int sep = name.lastIndexOf(PATH_SEPARATOR);
    return (sep < 0) ? name : name.substring(sep + PATH_SEPARATOR.length());
  }

  /** True if {@code name} has a module prefix. */
  public static boolean isQualified(String name) {
    return name.contains(PATH_SEPARATOR);
  }

  /** True if {@code name} is qualified with {@code Self::}. */
  public static boolean isSelfQualified(String name) {
    return name.startsWith(SELF + PATH_SEPARATOR);
  }
}
