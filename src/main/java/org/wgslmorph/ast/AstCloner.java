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
import java.util.List;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Rebuilds syntax trees, optionally replacing selected subtrees.
 *
 * <p>{@link #clone(AstNode, Function)} asks {@code replacements} about each node before cloning
 * it. A non-null answer is used as-is in place of the node: the cloner does not descend into it,
 * so a replacement that contains parts of the original tree must clone them itself if they may
 * themselves need replacing. A null answer means "clone this node", which rebuilds it from clones
 * of its children.
 *
 * <p>A replacement must be valid in its position; a replacement of the wrong kind surfaces as a
 * {@link ClassCastException}.
 */
public final class AstCloner {

  private static final Function<AstNode, @Nullable AstNode> NO_REPLACEMENTS = node -> null;

  /** Returns a deep copy of {@code node}: structurally equal, sharing no nodes with it. */
  public static <T extends AstNode> T clone(T node) {
    return clone(node, NO_REPLACEMENTS);
  }

  @SuppressWarnings("unchecked")
  public static <T extends AstNode> T clone(
      T node, Function<AstNode, @Nullable AstNode> replacements) {
    AstNode replacement = replacements.apply(node);
    return (T) (replacement != null ? replacement : new Cloner(replacements).cloneChildren(node));
  }

  public static <T extends AstNode> ImmutableList<T> cloneAll(
      List<T> nodes, Function<AstNode, @Nullable AstNode> replacements) {
    return nodes.stream()
        .map(n -> clone(n, replacements))
        .collect(ImmutableList.toImmutableList());
  }

  private static class Cloner {
    final Function<AstNode, @Nullable AstNode> replacements;

    Cloner(Function<AstNode, @Nullable AstNode> replacements) {
      this.replacements = replacements;
    }

    <T extends AstNode> T c(T node) {
      return AstCloner.clone(node, replacements);
    }

    <T extends AstNode> @Nullable T opt(@Nullable T node) {
      return node == null ? null : AstCloner.clone(node, replacements);
    }

    <T extends AstNode> ImmutableList<T> all(List<T> nodes) {
      return cloneAll(nodes, replacements);
    }

    AstNode cloneChildren(AstNode node) {
      if (node instanceof TranslationUnit tu) {
        return new TranslationUnit(all(tu.directives()), all(tu.globalDecls()));
      } else if (node instanceof Directive d) {
        return new Directive(d.text());
      } else if (node instanceof Attribute a) {
        return attribute(a);
      } else if (node instanceof GlobalDecl d) {
        return globalDecl(d);
      } else if (node instanceof ParameterDecl p) {
        return new ParameterDecl(all(p.attributes()), p.name(), c(p.typeDecl()));
      } else if (node instanceof StructMember m) {
        return new StructMember(all(m.attributes()), m.name(), c(m.type()));
      } else if (node instanceof TypeDecl t) {
        return typeDecl(t);
      } else if (node instanceof Expression e) {
        return expression(e);
      } else if (node instanceof LhsExpression e) {
        return lhsExpression(e);
      } else if (node instanceof Statement s) {
        return statement(s);
      } else if (node instanceof ContinuingStatement cs) {
        return new ContinuingStatement(
            all(cs.attributes()), c(cs.statements()), opt(cs.breakIfExpr()));
      } else if (node instanceof SwitchClause sc) {
        return new SwitchClause(
            all(sc.caseSelectors()), sc.includesDefault(), c(sc.compoundStatement()));
      }
      throw new AssertionError(node);
    }

    Attribute attribute(Attribute a) {
      if (a instanceof Attribute.Align x) {
        return new Attribute.Align(c(x.expression()));
      } else if (a instanceof Attribute.Binding x) {
        return new Attribute.Binding(c(x.expression()));
      } else if (a instanceof Attribute.BlendSrc x) {
        return new Attribute.BlendSrc(c(x.expression()));
      } else if (a instanceof Attribute.Builtin x) {
        return new Attribute.Builtin(x.name());
      } else if (a instanceof Attribute.Compute) {
        return new Attribute.Compute();
      } else if (a instanceof Attribute.Const) {
        return new Attribute.Const();
      } else if (a instanceof Attribute.Diagnostic x) {
        return new Attribute.Diagnostic(x.severity(), x.rule());
      } else if (a instanceof Attribute.Fragment) {
        return new Attribute.Fragment();
      } else if (a instanceof Attribute.Group x) {
        return new Attribute.Group(c(x.expression()));
      } else if (a instanceof Attribute.Id x) {
        return new Attribute.Id(c(x.expression()));
      } else if (a instanceof Attribute.Interpolate x) {
        return new Attribute.Interpolate(x.type(), x.sampling());
      } else if (a instanceof Attribute.Invariant) {
        return new Attribute.Invariant();
      } else if (a instanceof Attribute.Location x) {
        return new Attribute.Location(c(x.expression()));
      } else if (a instanceof Attribute.MustUse) {
        return new Attribute.MustUse();
      } else if (a instanceof Attribute.Size x) {
        return new Attribute.Size(c(x.expression()));
      } else if (a instanceof Attribute.Vertex) {
        return new Attribute.Vertex();
      } else if (a instanceof Attribute.WorkgroupSize x) {
        return new Attribute.WorkgroupSize(c(x.sizeX()), opt(x.sizeY()), opt(x.sizeZ()));
      }
      throw new AssertionError(a);
    }

    GlobalDecl globalDecl(GlobalDecl d) {
      if (d instanceof GlobalDecl.Constant x) {
        return new GlobalDecl.Constant(x.name(), opt(x.type()), c(x.initializer()));
      } else if (d instanceof GlobalDecl.OverrideConstant x) {
        return new GlobalDecl.OverrideConstant(
            all(x.attributes()), x.name(), opt(x.type()), opt(x.initializer()));
      } else if (d instanceof GlobalDecl.Variable x) {
        return new GlobalDecl.Variable(
            all(x.attributes()),
            x.name(),
            x.addressSpace(),
            x.accessMode(),
            opt(x.type()),
            opt(x.initializer()));
      } else if (d instanceof GlobalDecl.Function x) {
        return new GlobalDecl.Function(
            all(x.attributes()),
            x.name(),
            all(x.parameters()),
            all(x.returnAttributes()),
            opt(x.returnType()),
            c(x.body()));
      } else if (d instanceof GlobalDecl.Struct x) {
        return new GlobalDecl.Struct(x.name(), all(x.members()));
      } else if (d instanceof GlobalDecl.TypeAlias x) {
        return new GlobalDecl.TypeAlias(x.name(), c(x.type()));
      } else if (d instanceof GlobalDecl.ConstAssert x) {
        return new GlobalDecl.ConstAssert(c(x.expression()));
      } else if (d instanceof GlobalDecl.Empty) {
        return new GlobalDecl.Empty();
      }
      throw new AssertionError(d);
    }

    TypeDecl typeDecl(TypeDecl t) {
      if (t instanceof TypeDecl.Bool) {
        return new TypeDecl.Bool();
      } else if (t instanceof TypeDecl.I32) {
        return new TypeDecl.I32();
      } else if (t instanceof TypeDecl.U32) {
        return new TypeDecl.U32();
      } else if (t instanceof TypeDecl.F16) {
        return new TypeDecl.F16();
      } else if (t instanceof TypeDecl.F32) {
        return new TypeDecl.F32();
      } else if (t instanceof TypeDecl.Vector x) {
        return new TypeDecl.Vector(x.width(), c(x.elementType()));
      } else if (t instanceof TypeDecl.Matrix x) {
        return new TypeDecl.Matrix(x.numCols(), x.numRows(), c(x.elementType()));
      } else if (t instanceof TypeDecl.Array x) {
        return new TypeDecl.Array(c(x.elementType()), opt(x.elementCount()));
      } else if (t instanceof TypeDecl.NamedType x) {
        return new TypeDecl.NamedType(x.name());
      } else if (t instanceof TypeDecl.Pointer x) {
        return new TypeDecl.Pointer(x.addressSpace(), c(x.pointeeType()), x.accessMode());
      } else if (t instanceof TypeDecl.Atomic x) {
        return new TypeDecl.Atomic(c(x.targetType()));
      } else if (t instanceof TypeDecl.SamplerRegular) {
        return new TypeDecl.SamplerRegular();
      } else if (t instanceof TypeDecl.SamplerComparison) {
        return new TypeDecl.SamplerComparison();
      } else if (t instanceof TypeDecl.SampledTexture x) {
        return new TypeDecl.SampledTexture(x.kind(), c(x.sampledType()));
      } else if (t instanceof TypeDecl.DepthTexture x) {
        return new TypeDecl.DepthTexture(x.kind());
      } else if (t instanceof TypeDecl.StorageTexture x) {
        return new TypeDecl.StorageTexture(x.kind(), x.texelFormat(), x.accessMode());
      } else if (t instanceof TypeDecl.ExternalTexture) {
        return new TypeDecl.ExternalTexture();
      }
      throw new AssertionError(t);
    }

    Expression expression(Expression e) {
      if (e instanceof Expression.BoolLiteral x) {
        return new Expression.BoolLiteral(x.text());
      } else if (e instanceof Expression.IntLiteral x) {
        return new Expression.IntLiteral(x.text());
      } else if (e instanceof Expression.FloatLiteral x) {
        return new Expression.FloatLiteral(x.text());
      } else if (e instanceof Expression.Identifier x) {
        return new Expression.Identifier(x.name());
      } else if (e instanceof Expression.Paren x) {
        return new Expression.Paren(c(x.target()), x.metadata());
      } else if (e instanceof Expression.Unary x) {
        return new Expression.Unary(x.operator(), c(x.target()));
      } else if (e instanceof Expression.Binary x) {
        return new Expression.Binary(x.operator(), c(x.lhs()), c(x.rhs()), x.metadata());
      } else if (e instanceof Expression.FunctionCall x) {
        return new Expression.FunctionCall(x.callee(), opt(x.templateParameter()), all(x.args()));
      } else if (e instanceof Expression.ScalarValueConstructor x) {
        return new Expression.ScalarValueConstructor(c(x.scalarType()), all(x.args()));
      } else if (e instanceof Expression.VectorValueConstructor x) {
        return new Expression.VectorValueConstructor(
            x.width(), opt(x.elementType()), all(x.args()));
      } else if (e instanceof Expression.MatrixValueConstructor x) {
        return new Expression.MatrixValueConstructor(
            x.numCols(), x.numRows(), opt(x.elementType()), all(x.args()));
      } else if (e instanceof Expression.StructValueConstructor x) {
        return new Expression.StructValueConstructor(x.structName(), all(x.args()));
      } else if (e instanceof Expression.TypeAliasValueConstructor x) {
        return new Expression.TypeAliasValueConstructor(x.typeName(), all(x.args()));
      } else if (e instanceof Expression.ArrayValueConstructor x) {
        return new Expression.ArrayValueConstructor(
            opt(x.elementType()), opt(x.elementCount()), all(x.args()));
      } else if (e instanceof Expression.MemberLookup x) {
        return new Expression.MemberLookup(c(x.receiver()), x.memberName());
      } else if (e instanceof Expression.IndexLookup x) {
        return new Expression.IndexLookup(c(x.target()), c(x.index()));
      } else if (e instanceof AugmentedExpression.KnownValue x) {
        return new AugmentedExpression.KnownValue(c(x.knownValue()), c(x.expression()));
      } else if (e instanceof AugmentedExpression.ArbitraryExpression x) {
        return new AugmentedExpression.ArbitraryExpression(c(x.expression()));
      }
      throw new AssertionError(e);
    }

    LhsExpression lhsExpression(LhsExpression e) {
      if (e instanceof LhsExpression.Identifier x) {
        return new LhsExpression.Identifier(x.name());
      } else if (e instanceof LhsExpression.Paren x) {
        return new LhsExpression.Paren(c(x.target()));
      } else if (e instanceof LhsExpression.MemberLookup x) {
        return new LhsExpression.MemberLookup(c(x.receiver()), x.memberName());
      } else if (e instanceof LhsExpression.IndexLookup x) {
        return new LhsExpression.IndexLookup(c(x.target()), c(x.index()));
      } else if (e instanceof LhsExpression.Dereference x) {
        return new LhsExpression.Dereference(c(x.target()));
      } else if (e instanceof LhsExpression.AddressOf x) {
        return new LhsExpression.AddressOf(c(x.target()));
      }
      throw new AssertionError(e);
    }

    Statement statement(Statement s) {
      if (s instanceof Statement.Empty) {
        return new Statement.Empty();
      } else if (s instanceof Statement.Break) {
        return new Statement.Break();
      } else if (s instanceof Statement.Continue) {
        return new Statement.Continue();
      } else if (s instanceof Statement.Discard) {
        return new Statement.Discard();
      } else if (s instanceof Statement.Return x) {
        return new Statement.Return(opt(x.expression()));
      } else if (s instanceof Statement.Assignment x) {
        return new Statement.Assignment(
            opt(x.lhsExpression()), x.assignmentOperator(), c(x.rhs()));
      } else if (s instanceof Statement.Increment x) {
        return new Statement.Increment(c(x.target()));
      } else if (s instanceof Statement.Decrement x) {
        return new Statement.Decrement(c(x.target()));
      } else if (s instanceof Statement.ConstAssert x) {
        return new Statement.ConstAssert(c(x.expression()));
      } else if (s instanceof Statement.Compound x) {
        return new Statement.Compound(all(x.statements()), x.metadata());
      } else if (s instanceof Statement.If x) {
        return new Statement.If(
            all(x.attributes()), c(x.condition()), c(x.thenBranch()), opt(x.elseBranch()));
      } else if (s instanceof Statement.Switch x) {
        return new Statement.Switch(
            all(x.attributesAtStart()),
            c(x.expression()),
            all(x.attributesBeforeBody()),
            all(x.clauses()));
      } else if (s instanceof Statement.Loop x) {
        return new Statement.Loop(
            all(x.attributesAtStart()),
            all(x.attributesBeforeBody()),
            c(x.body()),
            opt(x.continuingStatement()));
      } else if (s instanceof Statement.For x) {
        return new Statement.For(
            all(x.attributes()), opt(x.init()), opt(x.condition()), opt(x.update()), c(x.body()));
      } else if (s instanceof Statement.While x) {
        return new Statement.While(all(x.attributes()), c(x.condition()), c(x.body()));
      } else if (s instanceof Statement.FunctionCall x) {
        return new Statement.FunctionCall(x.callee(), all(x.args()));
      } else if (s instanceof Statement.Value x) {
        return new Statement.Value(x.isConst(), x.name(), opt(x.type()), c(x.initializer()));
      } else if (s instanceof Statement.Variable x) {
        return new Statement.Variable(
            x.name(), x.addressSpace(), x.accessMode(), opt(x.type()), opt(x.initializer()));
      } else if (s instanceof AugmentedStatement.DeadCodeFragment x) {
        return new AugmentedStatement.DeadCodeFragment(c(x.statement()));
      } else if (s instanceof AugmentedStatement.ControlFlowWrapper x) {
        return new AugmentedStatement.ControlFlowWrapper(c(x.statement()), x.id());
      } else if (s instanceof AugmentedStatement.ControlFlowWrapReturn x) {
        return new AugmentedStatement.ControlFlowWrapReturn(c(x.returnStatement()), x.id());
      }
      throw new AssertionError(s);
    }
  }

  private AstCloner() {}
}
