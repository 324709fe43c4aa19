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

package org.wgslmorph.transform;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.flogger.LazyArgs;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.resolve.ShaderJob;

/**
 * An ordered list of transformations, applied left to right. Each transformation sees the output
 * of the previous one, resolved afresh.
 */
public final class TransformationPipeline implements MetamorphicTransformation {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableList<MetamorphicTransformation> passes;

  private TransformationPipeline(ImmutableList<MetamorphicTransformation> passes) {
    this.passes = passes;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the usual sequence: dead discards, breaks, continues and returns, then identity
   * operations, then control-flow wrapping with filler taken from {@code donor} if it is non-null.
   */
  public static TransformationPipeline standard(@Nullable ShaderJob donor) {
    return builder()
        .add(new DeadDiscards())
        .add(new DeadBreaks())
        .add(new DeadContinues())
        .add(new DeadReturns())
        .add(new IdentityOperations())
        .add(new ControlFlowWrapping(donor))
        .build();
  }

  public ImmutableList<MetamorphicTransformation> passes() {
    return passes;
  }

  @Override
  public ShaderJob apply(ShaderJob shaderJob, FuzzerSettings settings) {
    logger.atFine().log(
        "Running passes: %s",
        LazyArgs.lazy(
            () ->
                passes.stream()
                    .map(p -> p.getClass().getSimpleName())
                    .collect(Collectors.joining(", "))));
    ShaderJob result = shaderJob;
    for (MetamorphicTransformation pass : passes) {
      result = pass.apply(result, settings);
      logger.atFiner().log("Finished %s", pass.getClass().getSimpleName());
    }
    return result;
  }

  /** Accumulates passes in application order. */
  public static final class Builder {
    private final ImmutableList.Builder<MetamorphicTransformation> passes =
        ImmutableList.builder();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder add(MetamorphicTransformation pass) {
      passes.add(pass);
      return this;
    }

    public TransformationPipeline build() {
      return new TransformationPipeline(passes.build());
    }
  }
}
