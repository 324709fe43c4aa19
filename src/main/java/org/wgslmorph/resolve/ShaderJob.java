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

import org.wgslmorph.ast.Attribute;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.TranslationUnit;

/**
 * A translation unit together with the uniform values it will be run with, and its resolved
 * environment. Transformations consume and produce shader jobs; the pipeline state passes through
 * unchanged.
 */
public record ShaderJob(
    TranslationUnit tu,
    PipelineState pipelineState,
    ResolvedEnvironment environment,
    Resolver resolver) {

  /** Resolves {@code tu} and returns the corresponding shader job. */
  public static ShaderJob create(
      TranslationUnit tu, PipelineState pipelineState, Resolver resolver) {
    return new ShaderJob(tu, pipelineState, resolver.resolve(tu), resolver);
  }

  /** Returns a job for {@code newTu} with the same uniform values, resolving it. */
  public ShaderJob withTranslationUnit(TranslationUnit newTu) {
    return create(newTu, pipelineState, resolver);
  }

  /** Returns the module-scope variable declared with {@code @group(group) @binding(binding)}. */
  public GlobalDecl.Variable uniformDeclaration(int group, int binding) {
    for (GlobalDecl decl : tu.globalDecls()) {
      if (decl instanceof GlobalDecl.Variable variable
          && variable.literalAttributeValue(Attribute.Group.class).orElse(-1) == group
          && variable.literalAttributeValue(Attribute.Binding.class).orElse(-1) == binding) {
        return variable;
      }
    }
    throw new IllegalStateException(
        "No declaration for uniform at group " + group + " binding " + binding);
  }
}
