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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import org.jspecify.annotations.Nullable;

/**
 * Read-only walks over a syntax tree.
 *
 * <p>{@link #traverse} visits only the direct children of a node; an action that wants to see the
 * whole tree calls {@code traverse} again on the node it was given. This lets the action maintain
 * a context (for example, a stack of enclosing loops) around the recursive call.
 */
public final class AstTraversal {

  /**
   * Calls {@code action} on each child of {@code node}, in source order, passing {@code state}
   * along unchanged.
   */
  public static <T> void traverse(BiConsumer<AstNode, T> action, AstNode node, T state) {
    for (AstNode child : children(node)) {
      action.accept(child, state);
    }
  }

  /** Returns every node of the tree rooted at {@code root}, parents before their children. */
  public static ImmutableList<AstNode> nodesPreOrder(AstNode root) {
    List<AstNode> result = new ArrayList<>();
    collectPreOrder(root, result);
    return ImmutableList.copyOf(result);
  }

  /** Returns every node of the tree rooted at {@code root}, children before their parents. */
  public static ImmutableList<AstNode> nodesPostOrder(AstNode root) {
    List<AstNode> result = new ArrayList<>();
    collectPostOrder(root, result);
    return ImmutableList.copyOf(result);
  }

  private static void collectPreOrder(AstNode node, List<AstNode> result) {
    result.add(node);
    traverse(AstTraversal::collectPreOrder, node, result);
  }

  private static void collectPostOrder(AstNode node, List<AstNode> result) {
    traverse(AstTraversal::collectPostOrder, node, result);
    result.add(node);
  }

  /** Returns the direct children of {@code node}, in source order. */
  public static ImmutableList<AstNode> children(AstNode node) {
    Children children = new Children();
    if (node instanceof TranslationUnit tu) {
      children.addAll(tu.directives()).addAll(tu.globalDecls());
    } else if (node instanceof Directive) {
      // no children
    } else if (node instanceof Attribute attribute) {
      addAttributeChildren(attribute, children);
    } else if (node instanceof GlobalDecl decl) {
      addGlobalDeclChildren(decl, children);
    } else if (node instanceof ParameterDecl parameter) {
      children.addAll(parameter.attributes()).add(parameter.typeDecl());
    } else if (node instanceof StructMember member) {
      children.addAll(member.attributes()).add(member.type());
    } else if (node instanceof TypeDecl type) {
      addTypeDeclChildren(type, children);
    } else if (node instanceof Expression expression) {
      addExpressionChildren(expression, children);
    } else if (node instanceof LhsExpression lhs) {
      addLhsExpressionChildren(lhs, children);
    } else if (node instanceof Statement statement) {
      addStatementChildren(statement, children);
    } else if (node instanceof ContinuingStatement continuing) {
      children
          .addAll(continuing.attributes())
          .add(continuing.statements())
          .add(continuing.breakIfExpr());
    } else if (node instanceof SwitchClause clause) {
      children.addAll(clause.caseSelectors()).add(clause.compoundStatement());
    } else {
      throw new AssertionError(node);
    }
    return children.build();
  }

  private static void addAttributeChildren(Attribute attribute, Children children) {
    if (attribute instanceof Attribute.Align a) {
      children.add(a.expression());
    } else if (attribute instanceof Attribute.Binding a) {
      children.add(a.expression());
    } else if (attribute instanceof Attribute.BlendSrc a) {
      children.add(a.expression());
    } else if (attribute instanceof Attribute.Group a) {
      children.add(a.expression());
    } else if (attribute instanceof Attribute.Id a) {
      children.add(a.expression());
    } else if (attribute instanceof Attribute.Location a) {
      children.add(a.expression());
    } else if (attribute instanceof Attribute.Size a) {
      children.add(a.expression());
    } else if (attribute instanceof Attribute.WorkgroupSize a) {
      children.add(a.sizeX()).add(a.sizeY()).add(a.sizeZ());
    }
  }

  private static void addGlobalDeclChildren(GlobalDecl decl, Children children) {
    if (decl instanceof GlobalDecl.Constant c) {
      children.add(c.type()).add(c.initializer());
    } else if (decl instanceof GlobalDecl.OverrideConstant o) {
      children.addAll(o.attributes()).add(o.type()).add(o.initializer());
    } else if (decl instanceof GlobalDecl.Variable v) {
      children.addAll(v.attributes()).add(v.type()).add(v.initializer());
    } else if (decl instanceof GlobalDecl.Function f) {
      children
          .addAll(f.attributes())
          .addAll(f.parameters())
          .addAll(f.returnAttributes())
          .add(f.returnType())
          .add(f.body());
    } else if (decl instanceof GlobalDecl.Struct s) {
      children.addAll(s.members());
    } else if (decl instanceof GlobalDecl.TypeAlias t) {
      children.add(t.type());
    } else if (decl instanceof GlobalDecl.ConstAssert c) {
      children.add(c.expression());
    }
  }

  private static void addTypeDeclChildren(TypeDecl type, Children children) {
    if (type instanceof TypeDecl.Vector v) {
      children.add(v.elementType());
    } else if (type instanceof TypeDecl.Matrix m) {
      children.add(m.elementType());
    } else if (type instanceof TypeDecl.Array a) {
      children.add(a.elementType()).add(a.elementCount());
    } else if (type instanceof TypeDecl.Pointer p) {
      children.add(p.pointeeType());
    } else if (type instanceof TypeDecl.Atomic a) {
      children.add(a.targetType());
    } else if (type instanceof TypeDecl.SampledTexture t) {
      children.add(t.sampledType());
    }
  }

  private static void addExpressionChildren(Expression expression, Children children) {
    if (expression instanceof Expression.Paren p) {
      children.add(p.target());
    } else if (expression instanceof Expression.Unary u) {
      children.add(u.target());
    } else if (expression instanceof Expression.Binary b) {
      children.add(b.lhs()).add(b.rhs());
    } else if (expression instanceof Expression.FunctionCall f) {
      children.add(f.templateParameter()).addAll(f.args());
    } else if (expression instanceof Expression.ScalarValueConstructor c) {
      children.add(c.scalarType()).addAll(c.args());
    } else if (expression instanceof Expression.VectorValueConstructor c) {
      children.add(c.elementType()).addAll(c.args());
    } else if (expression instanceof Expression.MatrixValueConstructor c) {
      children.add(c.elementType()).addAll(c.args());
    } else if (expression instanceof Expression.ArrayValueConstructor c) {
      children.add(c.elementType()).add(c.elementCount()).addAll(c.args());
    } else if (expression instanceof Expression.ValueConstructor c) {
      // struct and alias constructors name their type by a string
      children.addAll(c.args());
    } else if (expression instanceof Expression.MemberLookup m) {
      children.add(m.receiver());
    } else if (expression instanceof Expression.IndexLookup i) {
      children.add(i.target()).add(i.index());
    } else if (expression instanceof AugmentedExpression.KnownValue kv) {
      children.add(kv.knownValue()).add(kv.expression());
    } else if (expression instanceof AugmentedExpression.ArbitraryExpression a) {
      children.add(a.expression());
    }
  }

  private static void addLhsExpressionChildren(LhsExpression lhs, Children children) {
    if (lhs instanceof LhsExpression.Paren p) {
      children.add(p.target());
    } else if (lhs instanceof LhsExpression.MemberLookup m) {
      children.add(m.receiver());
    } else if (lhs instanceof LhsExpression.IndexLookup i) {
      children.add(i.target()).add(i.index());
    } else if (lhs instanceof LhsExpression.Dereference d) {
      children.add(d.target());
    } else if (lhs instanceof LhsExpression.AddressOf a) {
      children.add(a.target());
    }
  }

  private static void addStatementChildren(Statement statement, Children children) {
    if (statement instanceof Statement.Return r) {
      children.add(r.expression());
    } else if (statement instanceof Statement.Assignment a) {
      children.add(a.lhsExpression()).add(a.rhs());
    } else if (statement instanceof Statement.Increment i) {
      children.add(i.target());
    } else if (statement instanceof Statement.Decrement d) {
      children.add(d.target());
    } else if (statement instanceof Statement.ConstAssert c) {
      children.add(c.expression());
    } else if (statement instanceof Statement.Compound c) {
      children.addAll(c.statements());
    } else if (statement instanceof Statement.If i) {
      children.addAll(i.attributes()).add(i.condition()).add(i.thenBranch()).add(i.elseBranch());
    } else if (statement instanceof Statement.Switch s) {
      children
          .addAll(s.attributesAtStart())
          .add(s.expression())
          .addAll(s.attributesBeforeBody())
          .addAll(s.clauses());
    } else if (statement instanceof Statement.Loop l) {
      children
          .addAll(l.attributesAtStart())
          .addAll(l.attributesBeforeBody())
          .add(l.body())
          .add(l.continuingStatement());
    } else if (statement instanceof Statement.For f) {
      children
          .addAll(f.attributes())
          .add(f.init())
          .add(f.condition())
          .add(f.update())
          .add(f.body());
    } else if (statement instanceof Statement.While w) {
      children.addAll(w.attributes()).add(w.condition()).add(w.body());
    } else if (statement instanceof Statement.FunctionCall f) {
      children.addAll(f.args());
    } else if (statement instanceof Statement.Value v) {
      children.add(v.type()).add(v.initializer());
    } else if (statement instanceof Statement.Variable v) {
      children.add(v.type()).add(v.initializer());
    } else if (statement instanceof AugmentedStatement.DeadCodeFragment d) {
      children.add(d.statement());
    } else if (statement instanceof AugmentedStatement.ControlFlowWrapper w) {
      children.add(w.statement());
    } else if (statement instanceof AugmentedStatement.ControlFlowWrapReturn r) {
      children.add(r.returnStatement());
    }
  }

  /** Accumulates children, skipping absent optional ones. */
  private static final class Children {
    private final ImmutableList.Builder<AstNode> builder = ImmutableList.builder();

    Children add(@Nullable AstNode node) {
      if (node != null) {
        builder.add(node);
      }
      return this;
    }

    Children addAll(List<? extends AstNode> nodes) {
      builder.addAll(nodes);
      return this;
    }

    ImmutableList<AstNode> build() {
      return builder.build();
    }
  }

  private AstTraversal() {}
}
