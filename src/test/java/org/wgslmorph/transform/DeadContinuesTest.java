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
import static org.wgslmorph.testing.Asts.I32;
import static org.wgslmorph.testing.Asts.assign;
import static org.wgslmorph.testing.Asts.binary;
import static org.wgslmorph.testing.Asts.block;
import static org.wgslmorph.testing.Asts.fn;
import static org.wgslmorph.testing.Asts.function;
import static org.wgslmorph.testing.Asts.id;
import static org.wgslmorph.testing.Asts.job;
import static org.wgslmorph.testing.Asts.lit;
import static org.wgslmorph.testing.Asts.var;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wgslmorph.ast.AugmentedStatement.DeadCodeFragment;
import org.wgslmorph.ast.BinaryOperator;
import org.wgslmorph.ast.ContinuingStatement;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.ast.SwitchClause;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.testing.Asts;
import org.wgslmorph.testing.ScriptedFuzzerSettings;
import org.wgslmorph.testing.ScriptedFuzzerSettings.Hook;

@RunWith(JUnit4.class)
public class DeadContinuesTest {

  private static Statement.Switch switchOnX(String value) {
    return new Statement.Switch(
        id("x"),
        ImmutableList.of(
            new SwitchClause(ImmutableList.of(), true, block(assign("x", lit(value))))));
  }

  /**
   * <pre>
   * fn f() {
   *   var x: i32 = 0i;
   *   switch x { default: { x = 1i; } }
   *   while (x < 3i) { switch x { default: { x = 2i; } } }
   *   loop { continuing { x = 3i; break if true; } }
   * }
   * </pre>
   */
  private static ShaderJob fixture() {
    return job(
        fn(
            "f",
            null,
            var("x", I32, lit("0i")),
            switchOnX("1i"),
            new Statement.While(
                binary(BinaryOperator.LESS_THAN, id("x"), lit("3i")),
                block(switchOnX("2i"))),
            new Statement.Loop(
                block(),
                new ContinuingStatement(
                    block(assign("x", lit("3i"))), Expression.BoolLiteral.of(true)))));
  }

  @Test
  public void switchesInsideLoopsReceiveContinues() {
    ShaderJob result =
        new DeadContinues()
            .apply(fixture(), new ScriptedFuzzerSettings(2).always(Hook.DEAD_CONTINUE));
    Statement.Compound body = function(result, "f").body();

    Statement.Switch outside = (Statement.Switch) body.statements().get(1);
    assertThat(Asts.nodesOfType(outside, DeadCodeFragment.class)).isEmpty();

    Statement.While whileStatement = (Statement.While) body.statements().get(2);
    // Both offsets of the while body, and both offsets of the clause inside it.
    assertThat(Asts.nodesOfType(whileStatement, DeadCodeFragment.class)).hasSize(4);
    Statement.Switch inside =
        (Statement.Switch)
            whileStatement.body().statements().stream()
                .filter(Statement.Switch.class::isInstance)
                .findFirst()
                .orElseThrow();
    assertThat(Asts.nodesOfType(inside, DeadCodeFragment.class)).hasSize(2);

    Statement.Loop loop = (Statement.Loop) body.statements().get(3);
    assertThat(loop.body().size()).isEqualTo(1);
    assertThat(Asts.nodesOfType(loop.continuingStatement(), DeadCodeFragment.class)).isEmpty();

    for (DeadCodeFragment fragment : Asts.nodesOfType(body, DeadCodeFragment.class)) {
      assertThat(Asts.nodesOfType(fragment, Statement.Continue.class)).hasSize(1);
      assertThat(Asts.nodesOfType(fragment, Statement.Break.class)).isEmpty();
    }
  }

  @Test
  public void sameSeedSameResult() {
    ShaderJob first = new DeadContinues().apply(fixture(), new DefaultFuzzerSettings(11));
    ShaderJob second = new DeadContinues().apply(fixture(), new DefaultFuzzerSettings(11));
    assertThat(first.tu()).isEqualTo(second.tu());
  }
}
