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

import static org.wgslmorph.transform.Choice.option;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.Metadata;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.resolve.Type;

/**
 * Generates filler statements for code that is never executed: the dead branch of a wrapper, for
 * instance. Compounds are either generated from scratch or spliced from a donor shader.
 */
public final class ArbitraryStatements {

  /**
   * Where generated statements will be placed.
   *
   * @param donor a shader to take compounds from, or null to only generate them
   * @param returnType the return type of the enclosing function, or null if it returns nothing
   * @param returnAllowed false inside a {@code continuing} block
   */
  public record Site(
      ShaderJob shaderJob,
      Scope scope,
      @Nullable ShaderJob donor,
      @Nullable Type returnType,
      boolean returnAllowed) {

    /** A site without a donor. */
    public static Site of(ShaderJob shaderJob, Scope scope) {
      return new Site(shaderJob, scope, null, null, true);
    }
  }

  /** Returns an else branch, or null for no else branch at all. */
  public static Statement.@Nullable ElseBranch generateArbitraryElseBranch(
      int depth, boolean sideEffectsAllowed, FuzzerSettings settings, Site site) {
    FuzzerSettings.ArbitraryElseBranchWeights weights = settings.arbitraryElseBranchWeights();
    List<Choice.Option<Statement.@Nullable ElseBranch>> options = new ArrayList<>();
    options.add(option(weights.empty().applyAsInt(depth), () -> null));
    if (settings.goDeeper(depth)) {
      options.add(
          option(
              weights.ifStatement().applyAsInt(depth),
              () -> generateArbitraryIfStatement(depth + 1, sideEffectsAllowed, settings, site)));
      options.add(
          option(
              weights.compound().applyAsInt(depth),
              () -> generateArbitraryCompound(depth + 1, sideEffectsAllowed, settings, site)));
    }
    return Choice.choose(settings, options);
  }

  /**
   * Returns a compound tagged {@link Metadata#ARBITRARY_COMPOUND}, spliced from the donor when the
   * site has one, or generated.
   *
   * @throws UnsupportedOperationException if {@code sideEffectsAllowed} is false
   */
  public static Statement.Compound generateArbitraryCompound(
      int depth, boolean sideEffectsAllowed, FuzzerSettings settings, Site site) {
    if (!sideEffectsAllowed) {
      throw new UnsupportedOperationException(
          "Side-effect-free arbitrary compounds are not supported");
    }
    FuzzerSettings.ArbitraryCompoundWeights weights = settings.arbitraryCompoundWeights();
    List<Choice.Option<Statement.Compound>> options = new ArrayList<>();
    options.add(
        option(weights.generatedStatements(), () -> generatedCompound(depth, settings, site)));
    ShaderJob donor = site.donor();
    if (donor != null) {
      options.add(
          option(
              weights.donorCompound(),
              () -> {
                Statement.Compound spliced =
                    DonorSplicer.spliceRandomCompound(
                        donor,
                        depth,
                        true,
                        settings,
                        site.shaderJob(),
                        site.scope(),
                        site.returnType(),
                        site.returnAllowed());
                return spliced != null ? spliced : generatedCompound(depth, settings, site);
              }));
    }
    return Choice.choose(settings, options);
  }

  private static Statement.Compound generatedCompound(
      int depth, FuzzerSettings settings, Site site) {
    int length = settings.randomArbitraryCompoundLength(depth);
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    for (int i = 0; i < length; i++) {
      statements.add(generateArbitraryStatement(depth + 1, true, settings, site));
    }
    return new Statement.Compound(statements.build(), ImmutableSet.of(Metadata.ARBITRARY_COMPOUND));
  }

  public static Statement.If generateArbitraryIfStatement(
      int depth, boolean sideEffectsAllowed, FuzzerSettings settings, Site site) {
    return new Statement.If(
        ArbitraryExpressions.generateArbitraryExpression(
            depth + 1,
            Type.Scalar.BOOL,
            sideEffectsAllowed,
            settings,
            site.shaderJob(),
            site.scope()),
        generateArbitraryCompound(depth + 1, sideEffectsAllowed, settings, site),
        generateArbitraryElseBranch(depth + 1, sideEffectsAllowed, settings, site));
  }

  /**
   * Returns an empty statement, an {@code if} statement, or the declaration of a fresh bool, i32
   * or u32 variable with an arbitrary initializer.
   */
  public static Statement generateArbitraryStatement(
      int depth, boolean sideEffectsAllowed, FuzzerSettings settings, Site site) {
    FuzzerSettings.ArbitraryStatementWeights weights = settings.arbitraryStatementWeights();
    List<Choice.Option<Statement>> options = new ArrayList<>();
    options.add(option(weights.empty().applyAsInt(depth), Statement.Empty::new));
    options.add(
        option(
            weights.variableDeclaration().applyAsInt(depth),
            () -> {
              Type.Scalar type =
                  settings.randomElement(Type.Scalar.BOOL, Type.Scalar.I32, Type.Scalar.U32);
              return new Statement.Variable(
                  freshName("arbitrary_", settings, site.scope()),
                  Type.scalarTypeDecl(type),
                  ArbitraryExpressions.generateArbitraryExpression(
                      depth + 1,
                      type,
                      sideEffectsAllowed,
                      settings,
                      site.shaderJob(),
                      site.scope()));
            }));
    if (settings.goDeeper(depth)) {
      options.add(
          option(
              weights.ifStatement().applyAsInt(depth),
              () -> generateArbitraryIfStatement(depth, sideEffectsAllowed, settings, site)));
    }
    return Choice.choose(settings, options);
  }

  /** Returns {@code prefix} followed by a fresh id, avoiding the names visible in {@code scope}. */
  static String freshName(String prefix, FuzzerSettings settings, Scope scope) {
    while (true) {
      String name = prefix + settings.getUniqueId();
      if (scope.getEntry(name) == null) {
        return name;
      }
    }
  }

  private ArbitraryStatements() {}
}
