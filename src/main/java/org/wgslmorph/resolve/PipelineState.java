/*
 * Copyright 2025 The WgslMorph Authors
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

package org.wgslmorph.resolve;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.Expression;

/**
 * The values the harness will bind to the shader's uniform buffers, indexed by group and binding.
 * Each value is a literal expression mirroring the declared type of the buffer, e.g. {@code
 * S(1i, vec2(2.0f, 3.0f))}.
 */
public final class PipelineState {

  private static final PipelineState EMPTY = new PipelineState(ImmutableSortedMap.of());

  private final ImmutableSortedMap<Integer, ImmutableSortedMap<Integer, Expression>> uniforms;

  private PipelineState(
      ImmutableSortedMap<Integer, ImmutableSortedMap<Integer, Expression>> uniforms) {
    this.uniforms = uniforms;
  }

  public static PipelineState empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean hasUniforms() {
    return !uniforms.isEmpty();
  }

  /** Returns the groups that have at least one binding, in increasing order. */
  public ImmutableSortedSet<Integer> getUniformGroups() {
    return uniforms.keySet();
  }

  /** Returns the bindings of {@code group}, in increasing order. */
  public ImmutableSortedSet<Integer> getUniformBindingsForGroup(int group) {
    @Nullable ImmutableSortedMap<Integer, Expression> bindings = uniforms.get(group);
    checkArgument(bindings != null, "No uniforms in group %s", group);
    return bindings.keySet();
  }

  public Expression getUniformValue(int group, int binding) {
    @Nullable ImmutableSortedMap<Integer, Expression> bindings = uniforms.get(group);
    @Nullable Expression value = bindings == null ? null : bindings.get(binding);
    checkState(value != null, "No uniform at group %s binding %s", group, binding);
    return value;
  }

  @Override
  public String toString() {
    return "PipelineState" + uniforms;
  }

  /** Accumulates uniform values. */
  public static final class Builder {
    private final Map<Integer, Map<Integer, Expression>> uniforms = new TreeMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setUniformValue(int group, int binding, Expression value) {
      uniforms.computeIfAbsent(group, g -> new TreeMap<>()).put(binding, value);
      return this;
    }

    public PipelineState build() {
      ImmutableSortedMap.Builder<Integer, ImmutableSortedMap<Integer, Expression>> builder =
          ImmutableSortedMap.naturalOrder();
      uniforms.forEach(
          (group, bindings) -> builder.put(group, ImmutableSortedMap.copyOf(bindings)));
      return new PipelineState(builder.buildOrThrow());
    }
  }
}
