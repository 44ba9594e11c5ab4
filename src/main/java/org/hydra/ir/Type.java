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
import org.hydra.util.StringUtil;

/** The type of a parameter, field, or return value. */
public interface Type {

  /** The name of the innermost named type, e.g. {@code Coin} for {@code &mut Coin}. */
  String baseName();

  /** True for {@code &T} and {@code &mut T}. */
  default boolean isReference() {
    return false;
  }

  /** True for {@code &mut T}. */
  default boolean isMutableReference() {
    return false;
  }

  /** A named type such as {@code u64}, {@code UID} or {@code Coin}. */
  record Base(String name) implements Type {
    @Override
    public String baseName() {
      return StringUtil.memberOf(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** {@code &T}. */
  record Reference(Type referent) implements Type {
    @Override
    public String baseName() {
      return referent.baseName();
    }

    @Override
    public boolean isReference() {
      return true;
    }

    @Override
    public String toString() {
      return "&" + referent;
    }
  }

  /** {@code &mut T}. */
  record MutableReference(Type referent) implements Type {
    @Override
    public String baseName() {
      return referent.baseName();
    }

    @Override
    public boolean isReference() {
      return true;
    }

    @Override
    public boolean isMutableReference() {
      return true;
    }

    @Override
    public String toString() {
      return "&mut " + referent;
    }
  }

  /** {@code vector<T>}. */
  record Vector(Type element) implements Type {
    @Override
    public String baseName() {
      return "vector";
    }

    @Override
    public String toString() {
      return "vector<" + element + ">";
    }
  }

  /** A generic instantiation such as {@code Coin<SUI>}. */
  record Generic(String name, ImmutableList<Type> arguments) implements Type {
    public Generic {
      arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public String baseName() {
      return StringUtil.memberOf(name);
    }

    @Override
    public String toString() {
      return StringUtil.joinElements(name + "<", ">", arguments.size(), arguments::get);
    }
  }

  static Type base(String name) {
    return new Base(name);
  }

  static Type ref(Type referent) {
    return new Reference(referent);
  }

  static Type mutRef(Type referent) {
    return new MutableReference(referent);
  }
}
