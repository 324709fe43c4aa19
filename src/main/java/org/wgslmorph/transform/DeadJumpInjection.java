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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.AstCloner;
import org.wgslmorph.ast.AstNode;
import org.wgslmorph.ast.AstTraversal;
import org.wgslmorph.ast.AugmentedStatement.DeadCodeFragment;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.ast.TranslationUnit;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ShaderJob;

/**
 * Inserts unreachable jump statements between the statements of compounds.
 *
 * <p>A first traversal chooses injection points, keeping a stack of the enclosing constructs that
 * matter to the jump kind (loops, switches, {@code continuing} blocks). A second pass clones the
 * translation unit, inserting a {@link DeadCodeFragment} at each chosen point. Subclasses decide
 * which constructs are relevant, where a jump is legal, and how the fragment is built.
 */
public abstract class DeadJumpInjection implements MetamorphicTransformation {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** True if {@code node} should be pushed on the enclosing-construct stack. */
  abstract boolean isEnclosingConstruct(AstNode node);

  /**
   * True if a jump may be placed directly in a compound whose innermost relevant enclosing
   * construct is {@code nearest} (null if there is none).
   */
  abstract boolean canInjectWithin(@Nullable AstNode nearest);

  /** Draws the per-offset injection decision. */
  abstract boolean injectHere(FuzzerSettings settings);

  /** Builds the guarded jump to place at a point whose scope is {@code scope}. */
  abstract DeadCodeFragment createDeadJump(
      ShaderJob shaderJob, FuzzerSettings settings, Scope scope, GlobalDecl.Function function);

  /** Returns a filter on the functions that may receive jumps; by default, all of them. */
  Predicate<GlobalDecl.Function> functionFilter(ShaderJob shaderJob) {
    return function -> true;
  }

  @Override
  public ShaderJob apply(ShaderJob shaderJob, FuzzerSettings settings) {
    Injector injector = new Injector(shaderJob, settings);
    TranslationUnit result = injector.run();
    return shaderJob.withTranslationUnit(result);
  }

  private final class Injector {
    final ShaderJob shaderJob;
    final FuzzerSettings settings;
    final Predicate<GlobalDecl.Function> functionFilter;
    final Deque<AstNode> enclosingConstructs = new ArrayDeque<>();
    final Map<Statement.Compound, ImmutableSortedSet<Integer>> injectionPoints =
        new IdentityHashMap<>();
    GlobalDecl.@Nullable Function currentFunction;

    Injector(ShaderJob shaderJob, FuzzerSettings settings) {
      this.shaderJob = shaderJob;
      this.settings = settings;
      this.functionFilter = functionFilter(shaderJob);
    }

    TranslationUnit run() {
      AstTraversal.traverse(this::select, shaderJob.tu(), injectionPoints);
      logger.atFine().log(
          "%s: %d injection points in %d compounds",
          DeadJumpInjection.this.getClass().getSimpleName(),
          injectionPoints.values().stream().mapToInt(ImmutableSortedSet::size).sum(),
          injectionPoints.size());
      return AstCloner.clone(shaderJob.tu(), this::rewrite);
    }

    void select(AstNode node, Map<Statement.Compound, ImmutableSortedSet<Integer>> points) {
      if (node instanceof GlobalDecl.Function function && !functionFilter.test(function)) {
        return;
      }
      boolean relevant = isEnclosingConstruct(node);
      if (relevant) {
        enclosingConstructs.push(node);
      }
      AstTraversal.traverse(this::select, node, points);
      if (relevant) {
        enclosingConstructs.pop();
      }
      if (node instanceof Statement.Compound compound
          && canInjectWithin(enclosingConstructs.peek())) {
        ImmutableSortedSet.Builder<Integer> indices = ImmutableSortedSet.naturalOrder();
        for (int i = 0; i <= compound.size(); i++) {
          if (injectHere(settings)) {
            indices.add(i);
          }
        }
        ImmutableSortedSet<Integer> chosen = indices.build();
        if (!chosen.isEmpty()) {
          points.put(compound, chosen);
        }
      }
    }

    @Nullable AstNode rewrite(AstNode node) {
      if (node instanceof GlobalDecl.Function function) {
        checkState(currentFunction == null, "Nested function %s", function.name());
        currentFunction = function;
        GlobalDecl.Function result =
            new GlobalDecl.Function(
                AstCloner.cloneAll(function.attributes(), this::rewrite),
                function.name(),
                AstCloner.cloneAll(function.parameters(), this::rewrite),
                AstCloner.cloneAll(function.returnAttributes(), this::rewrite),
                function.returnType() == null
                    ? null
                    : AstCloner.clone(function.returnType(), this::rewrite),
                AstCloner.clone(function.body(), this::rewrite));
        currentFunction = null;
        return result;
      }
      if (!(node instanceof Statement.Compound compound)) {
        return null;
      }
      ImmutableSortedSet<Integer> indices = injectionPoints.get(compound);
      if (indices == null) {
        return null;
      }
      GlobalDecl.Function function = currentFunction;
      checkState(function != null, "Compound outside a function");
      ImmutableList.Builder<Statement> body = ImmutableList.builder();
      for (int i = 0; i <= compound.size(); i++) {
        if (indices.contains(i)) {
          body.add(
              createDeadJump(
                  shaderJob,
                  settings,
                  shaderJob.environment().scopeAtIndex(compound, i),
                  function));
        }
        if (i < compound.size()) {
          body.add(AstCloner.clone(compound.statements().get(i), this::rewrite));
        }
      }
      return new Statement.Compound(body.build(), compound.metadata());
    }
  }
}
