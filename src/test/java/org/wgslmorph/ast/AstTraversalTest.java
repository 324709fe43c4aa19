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

package org.wgslmorph.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.wgslmorph.testing.Asts.I32;
import static org.wgslmorph.testing.Asts.binary;
import static org.wgslmorph.testing.Asts.block;
import static org.wgslmorph.testing.Asts.id;
import static org.wgslmorph.testing.Asts.lit;
import static org.wgslmorph.testing.Asts.ret;
import static org.wgslmorph.testing.Asts.var;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AstTraversalTest {

  @Test
  public void childrenInSourceOrder() {
    Expression lhs = id("a");
    Expression rhs = lit("1i");
    Expression.Binary sum = binary(BinaryOperator.PLUS, lhs, rhs);
    assertThat(AstTraversal.children(sum)).containsExactly(lhs, rhs).inOrder();
  }

  @Test
  public void ifChildrenIncludeElseBranch() {
    Expression condition = id("c");
    Statement.Compound thenBranch = block(new Statement.Break());
    Statement.Compound elseBranch = block();
    Statement.If ifStatement = new Statement.If(condition, thenBranch, elseBranch);
    assertThat(AstTraversal.children(ifStatement))
        .containsExactly(condition, thenBranch, elseBranch)
        .inOrder();
  }

  @Test
  public void loopChildrenIncludeContinuing() {
    Expression breakIf = id("done");
    ContinuingStatement continuing = new ContinuingStatement(block(), breakIf);
    Statement.Loop loop = new Statement.Loop(block(), continuing);
    assertThat(AstTraversal.children(loop)).containsExactly(loop.body(), continuing).inOrder();
    assertThat(AstTraversal.children(continuing))
        .containsExactly(continuing.statements(), breakIf)
        .inOrder();
  }

  @Test
  public void leavesHaveNoChildren() {
    assertThat(AstTraversal.children(new Statement.Break())).isEmpty();
    assertThat(AstTraversal.children(lit("3"))).isEmpty();
  }

  @Test
  public void preAndPostOrder() {
    Expression x = id("x");
    Statement.Return returnStatement = ret(x);
    Statement.Compound body = block(returnStatement);
    assertThat(AstTraversal.nodesPreOrder(body))
        .containsExactly(body, returnStatement, x)
        .inOrder();
    assertThat(AstTraversal.nodesPostOrder(body))
        .containsExactly(x, returnStatement, body)
        .inOrder();
  }

  @Test
  public void traverseVisitsDirectChildrenOnly() {
    Statement.Variable declaration = var("v", I32, lit("1i"));
    Statement.Compound inner = block(declaration);
    Statement.Compound outer = block(inner, new Statement.Discard());
    List<AstNode> visited = new ArrayList<>();
    AstTraversal.traverse((node, list) -> list.add(node), outer, visited);
    assertThat(visited).containsExactlyElementsIn(outer.statements()).inOrder();
  }

  @Test
  public void augmentedNodesExposeTheirContents() {
    Expression inner = lit("4u");
    AugmentedExpression.KnownValue known = new AugmentedExpression.KnownValue(lit("4u"), inner);
    assertThat(AstTraversal.children(known)).contains(inner);
    Statement.Discard discard = new Statement.Discard();
    AugmentedStatement.DeadCodeFragment fragment =
        new AugmentedStatement.DeadCodeFragment(
            new Statement.If(Expression.BoolLiteral.of(false), block(discard), null));
    assertThat(AstTraversal.nodesPreOrder(fragment)).contains(discard);
    assertThat(ImmutableList.copyOf(AstTraversal.children(fragment)))
        .containsExactly(fragment.statement());
  }
}
