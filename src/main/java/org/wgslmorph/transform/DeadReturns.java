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
import org.wgslmorph.resolve.ScopeEntry;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.resolve.Type;

/**
 * Injects guarded {@code return} statements. In a function with a return type the returned value
 * is an arbitrary expression of that type; it is never evaluated.
 */
public final class DeadReturns extends DeadJumpInjection {

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
    return settings.injectDeadReturn();
  }

  @Override
  DeadCodeFragment createDeadJump(
      ShaderJob shaderJob, FuzzerSettings settings, Scope scope, GlobalDecl.Function function) {
    Type returnType = returnTypeOf(shaderJob, function);
    Statement.Return returnStatement =
        new Statement.Return(
            returnType == null
                ? null
                : ArbitraryExpressions.generateArbitraryExpression(
                    0, returnType, true, settings, shaderJob, scope));
    return DeadCodeFragments.deadDiscardOrReturn(returnStatement, settings, shaderJob, scope);
  }

  /** Returns the resolved return type of {@code function}, or null if it returns nothing. */
  static @Nullable Type returnTypeOf(ShaderJob shaderJob, GlobalDecl.Function function) {
    if (shaderJob.environment().globalScope().getEntry(function.name())
        instanceof ScopeEntry.Function entry) {
      return entry.type().returnType();
    }
    throw new IllegalStateException("No function entry for " + function.name());
  }
}
