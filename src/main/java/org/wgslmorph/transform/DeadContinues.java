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

import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.AstNode;
import org.wgslmorph.ast.AugmentedStatement.DeadCodeFragment;
import org.wgslmorph.ast.ContinuingStatement;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ShaderJob;

/**
 * Injects guarded {@code continue} statements into loop bodies. Unlike {@link DeadBreaks}, a
 * switch is transparent: a continue inside a switch clause targets the enclosing loop.
 */
public final class DeadContinues extends DeadJumpInjection {

  @Override
  boolean isEnclosingConstruct(AstNode node) {
    return node instanceof Statement.Loop
        || node instanceof Statement.For
        || node instanceof Statement.While
        || node instanceof ContinuingStatement;
  }

  @Override
  boolean canInjectWithin(@Nullable AstNode nearest) {
    return nearest != null && !(nearest instanceof ContinuingStatement);
  }

  @Override
  boolean injectHere(FuzzerSettings settings) {
    return settings.injectDeadContinue();
  }

  @Override
  DeadCodeFragment createDeadJump(
      ShaderJob shaderJob, FuzzerSettings settings, Scope scope, GlobalDecl.Function function) {
    return DeadCodeFragments.deadBreakOrContinue(
        new Statement.Continue(), settings, shaderJob, scope);
  }
}
