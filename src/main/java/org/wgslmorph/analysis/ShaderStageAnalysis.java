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

package org.wgslmorph.analysis;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.wgslmorph.ast.AstNode;
import org.wgslmorph.ast.AstTraversal;
import org.wgslmorph.ast.Attribute;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.ast.TranslationUnit;
import org.wgslmorph.resolve.ResolvedEnvironment;
import org.wgslmorph.resolve.ScopeEntry;

/**
 * Determines, for each user-defined function, the shader stages from which it may be (directly or
 * indirectly) called. Functions that are unreachable from every entry point are absent from the
 * result.
 */
public final class ShaderStageAnalysis {

  private final ResolvedEnvironment environment;
  private final Map<String, Set<ShaderStage>> result = new LinkedHashMap<>();
  private final Deque<GlobalDecl.Function> workQueue = new ArrayDeque<>();

  private ShaderStageAnalysis(ResolvedEnvironment environment) {
    this.environment = environment;
  }

  public static ImmutableMap<String, ImmutableSet<ShaderStage>> run(
      TranslationUnit tu, ResolvedEnvironment environment) {
    ShaderStageAnalysis analysis = new ShaderStageAnalysis(environment);
    for (GlobalDecl.Function function : tu.functions()) {
      Set<ShaderStage> stages = EnumSet.noneOf(ShaderStage.class);
      for (Attribute attribute : function.attributes()) {
        if (attribute instanceof Attribute.Vertex) {
          stages.add(ShaderStage.VERTEX);
        } else if (attribute instanceof Attribute.Fragment) {
          stages.add(ShaderStage.FRAGMENT);
        } else if (attribute instanceof Attribute.Compute) {
          stages.add(ShaderStage.COMPUTE);
        }
      }
      if (!stages.isEmpty()) {
        analysis.addStages(function, stages);
      }
    }
    // A function is re-queued whenever its set of stages grows, so this terminates once every set
    // has reached its fixed point.
    while (!analysis.workQueue.isEmpty()) {
      GlobalDecl.Function function = analysis.workQueue.removeFirst();
      ImmutableSet<ShaderStage> callerStages =
          ImmutableSet.copyOf(analysis.result.get(function.name()));
      AstTraversal.traverse(analysis::visit, function, callerStages);
    }
    return analysis.result.entrySet().stream()
        .collect(
            ImmutableMap.toImmutableMap(Map.Entry::getKey, e -> ImmutableSet.copyOf(e.getValue())));
  }

  /** Returns true if {@code functionName} can only be called from fragment shaders. */
  public static boolean isFragmentOnly(
      ImmutableMap<String, ImmutableSet<ShaderStage>> stages, String functionName) {
    return ImmutableSet.of(ShaderStage.FRAGMENT).equals(stages.get(functionName));
  }

  private void visit(AstNode node, ImmutableSet<ShaderStage> callerStages) {
    AstTraversal.traverse(this::visit, node, callerStages);
    String callee;
    if (node instanceof Statement.FunctionCall call) {
      callee = call.callee();
    } else if (node instanceof Expression.FunctionCall call) {
      callee = call.callee();
    } else {
      return;
    }
    // Calls to built-in functions have no scope entry.
    if (environment.globalScope().getEntry(callee) instanceof ScopeEntry.Function entry) {
      addStages(entry.astNode(), callerStages);
    }
  }

  private void addStages(GlobalDecl.Function function, Set<ShaderStage> stages) {
    Set<ShaderStage> existing =
        result.computeIfAbsent(function.name(), k -> EnumSet.noneOf(ShaderStage.class));
    if (existing.addAll(stages) && !workQueue.contains(function)) {
      workQueue.addLast(function);
    }
  }
}
