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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A function declaration. {@code hasLoops} and {@code hasAssertions} are summary flags supplied by
 * the IR producer; {@link Builder} computes them from the body.
 */
public record Function(
    String name,
    boolean isPublic,
    ImmutableList<Parameter> parameters,
    ImmutableList<Statement> body,
    @Nullable Type returnType,
    boolean hasLoops,
    boolean hasAssertions,
    ImmutableList<String> attributes,
    Location location) {

  public Function {
    parameters = ImmutableList.copyOf(parameters);
    body = ImmutableList.copyOf(body);
    attributes = ImmutableList.copyOf(attributes);
  }

  /** True if this function is marked {@code #[test]} or {@code #[test_only]}. */
  public boolean isTest() {
    return attributes.contains("test") || attributes.contains("test_only");
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Collects the parts of a Function. */
  public static final class Builder {
    private final String name;
    private boolean isPublic;
    private final List<Parameter> parameters = new ArrayList<>();
    private final List<Statement> body = new ArrayList<>();
    private Type returnType;
    private final List<String> attributes = new ArrayList<>();
    private Location location = Location.UNKNOWN;

    private Builder(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    @CanIgnoreReturnValue
    public Builder setPublic(boolean isPublic) {
      this.isPublic = isPublic;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addParameter(String paramName, Type type) {
      parameters.add(new Parameter(paramName, type));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder add(Statement... statements) {
      body.addAll(List.of(statements));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setReturnType(Type returnType) {
      this.returnType = returnType;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAttribute(String attribute) {
      attributes.add(attribute);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLocation(Location location) {
      this.location = location;
      return this;
    }

    public Function build() {
      ImmutableList<Statement> all = Statement.flatten(body);
      boolean hasLoops = all.stream().anyMatch(s -> s instanceof Statement.Loop);
      boolean hasAssertions = all.stream().anyMatch(s -> s instanceof Statement.Assert);
      Location loc = location.context().isEmpty() ? location.withContext(name) : location;
      return new Function(
          name,
          isPublic,
          ImmutableList.copyOf(parameters),
          ImmutableList.copyOf(body),
          returnType,
          hasLoops,
          hasAssertions,
          ImmutableList.copyOf(attributes),
          loc);
    }
  }
}
