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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.analysis.ShaderStage;
import org.wgslmorph.analysis.ShaderStageAnalysis;
import org.wgslmorph.ast.AstNode;
import org.wgslmorph.ast.AugmentedStatement.DeadCodeFragment;
import org.wgslmorph.ast.ContinuingStatement;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ShaderJob;

/**
 * Injects guarded {@code discard} statements into functions that only fragment entry points can
 * reach. No discard is placed inside a {@code continuing} block.
 */
public final class DeadDiscards extends DeadJumpInjection {

  @Override
  Predicate<GlobalDecl.Function> functionFilter(ShaderJob shaderJob) {
    ImmutableMap<String, ImmutableSet<ShaderStage>> stages =
        ShaderStageAnalysis.run(shaderJob.tu(), shaderJob.environment());
    return function -> ShaderStageAnalysis.isFragmentOnly(stages, function.name());
  }

  @Override
  boolean isEnclosingConstruct(AstNode node) {
    return node instanceof ContinuingStatement;
  }

  @Override
  boolean canInjectWithin(@Nullable AstNode nearest) {
    return nearest == null;
  }

  @Override
  boolean injectHere(FuzzerSettings settings) {
    return settings.injectDeadDiscard();
  }

  @Override
  DeadCodeFragment createDeadJump(
      ShaderJob shaderJob, FuzzerSettings settings, Scope scope, GlobalDecl.Function function) {
    return DeadCodeFragments.deadDiscardOrReturn(
        new Statement.Discard(), settings, shaderJob, scope);
  }
}
