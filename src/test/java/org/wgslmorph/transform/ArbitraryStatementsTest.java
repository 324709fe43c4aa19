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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.wgslmorph.testing.Asts.I32;
import static org.wgslmorph.testing.Asts.fn;
import static org.wgslmorph.testing.Asts.function;
import static org.wgslmorph.testing.Asts.job;
import static org.wgslmorph.testing.Asts.lit;
import static org.wgslmorph.testing.Asts.var;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.Metadata;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.ast.TranslationUnit;
import org.wgslmorph.ast.TypeDecl;
import org.wgslmorph.resolve.ResolvedEnvironment;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.resolve.Type;
import org.wgslmorph.testing.Asts;

@RunWith(JUnit4.class)
public class ArbitraryStatementsTest {

  private static final int SEEDS = 30;

  private static ShaderJob fixture() {
    return job(fn("f", null, var("arbitrary_1", I32, lit("3i"))));
  }

  private static Scope endOfBody(ShaderJob job) {
    Statement.Compound body = function(job, "f").body();
    return job.environment().scopeAtIndex(body, body.size());
  }

  private static Type scalarType(TypeDecl type) {
    if (type instanceof TypeDecl.Bool) {
      return Type.Scalar.BOOL;
    } else if (type instanceof TypeDecl.I32) {
      return Type.Scalar.I32;
    } else if (type instanceof TypeDecl.U32) {
      return Type.Scalar.U32;
    }
    throw new AssertionError(type);
  }

  @Test
  public void generatedCompoundIsTaggedAndWellTyped() {
    ShaderJob job = fixture();
    ArbitraryStatements.Site site = ArbitraryStatements.Site.of(job, endOfBody(job));
    for (int seed = 0; seed < SEEDS; seed++) {
      Statement.Compound compound =
          ArbitraryStatements.generateArbitraryCompound(
              0, true, new DefaultFuzzerSettings(seed), site);
      assertThat(compound.metadata()).contains(Metadata.ARBITRARY_COMPOUND);

      GlobalDecl.Function f = function(job, "f");
      Statement.Compound body =
          new Statement.Compound(
              ImmutableList.<Statement>builder()
                  .addAll(f.body().statements())
                  .add(compound)
                  .build());
      ShaderJob resolved =
          job.withTranslationUnit(
              new TranslationUnit(
                  List.of(
                      new GlobalDecl.Function(
                          f.attributes(),
                          f.name(),
                          f.parameters(),
                          f.returnAttributes(),
                          f.returnType(),
                          body))));
      ResolvedEnvironment environment = resolved.environment();
      Set<String> names = new HashSet<>();
      for (Statement.Variable declaration : Asts.nodesOfType(compound, Statement.Variable.class)) {
        assertThat(names.add(declaration.name())).isTrue();
        assertThat(declaration.name()).isNotEqualTo("arbitrary_1");
        assertThat(declaration.initializer()).isNotNull();
        assertThat(environment.typeOf(declaration.initializer()).asStoreTypeIfReference())
            .isEqualTo(scalarType(declaration.type()));
      }
    }
  }

  @Test
  public void sideEffectFreeCompoundsAreUnsupported() {
    ShaderJob job = fixture();
    ArbitraryStatements.Site site = ArbitraryStatements.Site.of(job, endOfBody(job));
    assertThrows(
        UnsupportedOperationException.class,
        () ->
            ArbitraryStatements.generateArbitraryCompound(
                0, false, new DefaultFuzzerSettings(0), site));
  }

  @Test
  public void freshNameSkipsNamesInScope() {
    ShaderJob job = fixture();
    FuzzerSettings settings = new DefaultFuzzerSettings(0);
    assertThat(ArbitraryStatements.freshName("arbitrary_", settings, endOfBody(job)))
        .isEqualTo("arbitrary_2");
    assertThat(ArbitraryStatements.freshName("arbitrary_", settings, endOfBody(job)))
        .isEqualTo("arbitrary_3");
  }

  @Test
  public void compoundLengthFollowsSettings() {
    ShaderJob job = fixture();
    ArbitraryStatements.Site site = ArbitraryStatements.Site.of(job, endOfBody(job));
    FuzzerSettings settings =
        new DefaultFuzzerSettings(4) {
          @Override
          public int randomArbitraryCompoundLength(int depth) {
            return 3;
          }
        };
    assertThat(ArbitraryStatements.generateArbitraryCompound(0, true, settings, site).size())
        .isEqualTo(3);
  }

  @Test
  public void elseBranchMayBeAbsent() {
    ShaderJob job = fixture();
    ArbitraryStatements.Site site = ArbitraryStatements.Site.of(job, endOfBody(job));
    FuzzerSettings settings =
        new DefaultFuzzerSettings(0) {
          @Override
          public ArbitraryElseBranchWeights arbitraryElseBranchWeights() {
            return new ArbitraryElseBranchWeights(
                FuzzerSettings.constant(1), FuzzerSettings.constant(0), FuzzerSettings.constant(0));
          }
        };
    for (int i = 0; i < 10; i++) {
      assertThat(ArbitraryStatements.generateArbitraryElseBranch(0, true, settings, site)).isNull();
    }
  }
}
