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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.AstCloner;
import org.wgslmorph.ast.AstNode;
import org.wgslmorph.ast.AstTraversal;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.LhsExpression;
import org.wgslmorph.ast.Metadata;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.ast.TypeDecl;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.resolve.Type;

/**
 * Copies compound statements out of a donor shader into a host shader, as filler for code that is
 * never executed.
 *
 * <p>Every name the fragment declares is renamed to a fresh one. Every name it uses but does not
 * declare (a free variable) is renamed too, and declared at the top of the copy as a {@code var}
 * with an arbitrary initializer. Returns are rewritten to return an arbitrary value of the host
 * function's return type. The copy can therefore only affect its own fresh variables.
 *
 * <p>A donor compound is eligible only if it can be moved this way: it calls no user-defined
 * functions and no built-ins restricted to particular stages or resources, names no user-defined
 * types, contains no {@code discard}, {@code const} declaration or {@code const_assert}, has no
 * {@code break} or {@code continue} that leaves it, and each free variable has a concrete scalar or
 * vector type.
 */
public final class DonorSplicer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final ImmutableSet<String> FORBIDDEN_BUILTIN_PREFIXES =
      ImmutableSet.of(
          "dpdx",
          "dpdy",
          "fwidth",
          "texture",
          "atomic",
          "workgroupBarrier",
          "storageBarrier",
          "workgroupUniformLoad",
          "subgroup",
          "quad",
          "arrayLength");

  /**
   * Returns a renamed copy of a randomly chosen eligible compound of {@code donor}, tagged {@link
   * Metadata#ARBITRARY_COMPOUND}, or null if the donor has no compound that can be moved to the
   * host site.
   *
   * @param returnType the return type of the host function, or null if it returns nothing
   * @param returnAllowed whether a {@code return} is allowed at the host site
   */
  public static Statement.@Nullable Compound spliceRandomCompound(
      ShaderJob donor,
      int depth,
      boolean sideEffectsAllowed,
      FuzzerSettings settings,
      ShaderJob host,
      Scope scope,
      @Nullable Type returnType,
      boolean returnAllowed) {
    List<Fragment> candidates = new ArrayList<>();
    for (GlobalDecl decl : donor.tu().globalDecls()) {
      if (decl instanceof GlobalDecl.Function function) {
        for (AstNode node : AstTraversal.nodesPreOrder(function.body())) {
          if (node instanceof Statement.Compound compound) {
            Fragment fragment = new Fragment(donor, scope, compound);
            if (fragment.eligible && (returnAllowed || !fragment.hasReturn)) {
              candidates.add(fragment);
            }
          }
        }
      }
    }
    logger.atFinest().log("%d donor compounds eligible for splicing", candidates.size());
    if (candidates.isEmpty()) {
      return null;
    }
    Fragment chosen = settings.randomElement(candidates);

    List<Statement> statements = new ArrayList<>();
    Map<String, String> freshFreeNames = new HashMap<>();
    for (Map.Entry<String, Type> free : chosen.freeVariableTypes.entrySet()) {
      String freshName = ArbitraryStatements.freshName("donor_", settings, scope);
      freshFreeNames.put(free.getKey(), freshName);
      statements.add(
          new Statement.Variable(
              freshName,
              free.getValue().toTypeDecl(),
              ArbitraryExpressions.generateArbitraryExpression(
                  depth + 1, free.getValue(), sideEffectsAllowed, settings, host, scope)));
    }
    Map<AstNode, String> newNames = new IdentityHashMap<>();
    for (AstNode declaration : chosen.localDeclarations) {
      newNames.put(declaration, ArbitraryStatements.freshName("donor_", settings, scope));
    }
    for (Map.Entry<AstNode, String> use : chosen.identifierNames.entrySet()) {
      AstNode declaration = chosen.declarationOf.get(use.getKey());
      newNames.put(
          use.getKey(),
          declaration == null ? freshFreeNames.get(use.getValue()) : newNames.get(declaration));
    }

    Renaming renaming =
        new Renaming(newNames, depth, sideEffectsAllowed, settings, host, scope, returnType);
    for (Statement statement : chosen.compound.statements()) {
      statements.add(AstCloner.clone(statement, renaming::replace));
    }
    return new Statement.Compound(
        ImmutableList.copyOf(statements), ImmutableSet.of(Metadata.ARBITRARY_COMPOUND));
  }

  /**
   * The scoped walk over one donor compound: decides eligibility, and links each use of a name to
   * the declaration inside the compound that it refers to (or to none, for a free variable).
   */
  private static final class Fragment {
    final ShaderJob donor;
    final Scope hostScope;
    final Statement.Compound compound;
    boolean eligible = true;
    boolean hasReturn;

    /** Declarations inside the compound, in source order. */
    final List<AstNode> localDeclarations = new ArrayList<>();

    /** Every identifier node, with its donor name. */
    final Map<AstNode, String> identifierNames = new IdentityHashMap<>();

    /** For identifiers that refer to a local declaration, that declaration. */
    final Map<AstNode, AstNode> declarationOf = new IdentityHashMap<>();

    final Map<String, Type> freeVariableTypes = new LinkedHashMap<>();

    private final Deque<Map<String, AstNode>> scopes = new ArrayDeque<>();
    private int loopDepth;
    private int switchDepth;

    Fragment(ShaderJob donor, Scope hostScope, Statement.Compound compound) {
      this.donor = donor;
      this.hostScope = hostScope;
      this.compound = compound;
      visit(compound);
    }

    private void visit(AstNode node) {
      if (!eligible) {
        return;
      }
      if (node instanceof Statement.Compound c) {
        scopes.push(new HashMap<>());
        c.statements().forEach(this::visit);
        scopes.pop();
      } else if (node instanceof Statement.Variable v) {
        visitIfPresent(v.type());
        visitIfPresent(v.initializer());
        declare(v, v.name());
      } else if (node instanceof Statement.Value v) {
        if (v.isConst()) {
          eligible = false;
          return;
        }
        visitIfPresent(v.type());
        visit(v.initializer());
        declare(v, v.name());
      } else if (node instanceof Statement.For f) {
        scopes.push(new HashMap<>());
        visitIfPresent(f.init());
        loopDepth++;
        visitIfPresent(f.condition());
        visitIfPresent(f.update());
        visit(f.body());
        loopDepth--;
        scopes.pop();
      } else if (node instanceof Statement.Loop l) {
        // The continuing block sees the declarations of the loop body.
        loopDepth++;
        scopes.push(new HashMap<>());
        l.body().statements().forEach(this::visit);
        if (l.continuingStatement() != null) {
          scopes.push(new HashMap<>());
          l.continuingStatement().statements().statements().forEach(this::visit);
          visitIfPresent(l.continuingStatement().breakIfExpr());
          scopes.pop();
        }
        scopes.pop();
        loopDepth--;
      } else if (node instanceof Statement.While w) {
        visit(w.condition());
        loopDepth++;
        visit(w.body());
        loopDepth--;
      } else if (node instanceof Statement.Switch s) {
        visit(s.expression());
        switchDepth++;
        s.clauses().forEach(this::visit);
        switchDepth--;
      } else if (node instanceof Statement.Break) {
        eligible &= loopDepth > 0 || switchDepth > 0;
      } else if (node instanceof Statement.Continue) {
        eligible &= loopDepth > 0;
      } else if (node instanceof Statement.Discard || node instanceof Statement.ConstAssert) {
        eligible = false;
      } else if (node instanceof Statement.Return r) {
        hasReturn = true;
        visitIfPresent(r.expression());
      } else if (node instanceof Expression.Identifier identifier) {
        use(identifier, identifier.name(), () -> donor.environment().typeOf(identifier));
      } else if (node instanceof LhsExpression.Identifier identifier) {
        use(identifier, identifier.name(), () -> donor.environment().typeOf(identifier));
      } else if (node instanceof Expression.FunctionCall call) {
        checkCallee(call.callee());
        visitChildren(node);
      } else if (node instanceof Statement.FunctionCall call) {
        checkCallee(call.callee());
        visitChildren(node);
      } else if (node instanceof Expression.StructValueConstructor
          || node instanceof Expression.TypeAliasValueConstructor
          || node instanceof TypeDecl.NamedType
          || node instanceof TypeDecl.F16
          || node instanceof TypeDecl.Pointer
          || node instanceof TypeDecl.Atomic) {
        eligible = false;
      } else if (node instanceof TypeDecl.Array a) {
        eligible &= a.elementCount() == null || a.elementCount() instanceof Expression.IntLiteral;
        visitChildren(node);
      } else if (node instanceof Expression.ArrayValueConstructor a) {
        eligible &= a.elementCount() == null || a.elementCount() instanceof Expression.IntLiteral;
        visitChildren(node);
      } else if (node instanceof Expression.FloatLiteral literal) {
        eligible &= !literal.text().endsWith("h");
      } else if (node instanceof TypeDecl
          && !(node instanceof TypeDecl.ScalarTypeDecl)
          && !(node instanceof TypeDecl.Vector)
          && !(node instanceof TypeDecl.Matrix)) {
        // Samplers and textures.
        eligible = false;
      } else {
        visitChildren(node);
      }
    }

    private void visitIfPresent(@Nullable AstNode node) {
      if (node != null) {
        visit(node);
      }
    }

    private void visitChildren(AstNode node) {
      for (AstNode child : AstTraversal.children(node)) {
        visit(child);
      }
    }

    private void declare(AstNode declaration, String name) {
      scopes.peek().put(name, declaration);
      localDeclarations.add(declaration);
    }

    private void use(AstNode identifier, String name, Supplier<Type> type) {
      identifierNames.put(identifier, name);
      for (Map<String, AstNode> scope : scopes) {
        AstNode declaration = scope.get(name);
        if (declaration != null) {
          declarationOf.put(identifier, declaration);
          return;
        }
      }
      if (freeVariableTypes.containsKey(name)) {
        return;
      }
      Type storeType = type.get().asStoreTypeIfReference();
      if (isMovableType(storeType)) {
        freeVariableTypes.put(name, storeType);
      } else {
        eligible = false;
      }
    }

    private void checkCallee(String callee) {
      if (donor.environment().globalScope().getEntry(callee) != null
          || hostScope.getEntry(callee) != null
          || FORBIDDEN_BUILTIN_PREFIXES.stream().anyMatch(callee::startsWith)) {
        eligible = false;
      }
    }
  }

  /**
   * Free variables become function-scope {@code var}s, so their type must be constructible and not
   * abstract: replacing an abstract constant with a concrete variable can change type inference.
   */
  private static boolean isMovableType(Type type) {
    Type.Scalar scalar;
    if (type instanceof Type.Scalar s) {
      scalar = s;
    } else if (type instanceof Type.Vector vector) {
      scalar = vector.elementType();
    } else {
      return false;
    }
    return !scalar.isAbstract() && scalar != Type.Scalar.F16;
  }

  /** Clone replacements that apply the new names and rewrite returns. */
  private record Renaming(
      Map<AstNode, String> newNames,
      int depth,
      boolean sideEffectsAllowed,
      FuzzerSettings settings,
      ShaderJob host,
      Scope scope,
      @Nullable Type returnType) {

    @Nullable AstNode replace(AstNode node) {
      String newName = newNames.get(node);
      if (node instanceof Expression.Identifier && newName != null) {
        return new Expression.Identifier(newName);
      } else if (node instanceof LhsExpression.Identifier && newName != null) {
        return new LhsExpression.Identifier(newName);
      } else if (node instanceof Statement.Variable v && newName != null) {
        return new Statement.Variable(
            newName,
            v.addressSpace(),
            v.accessMode(),
            v.type() == null ? null : AstCloner.clone(v.type()),
            v.initializer() == null ? null : AstCloner.clone(v.initializer(), this::replace));
      } else if (node instanceof Statement.Value v && newName != null) {
        return new Statement.Value(
            false,
            newName,
            v.type() == null ? null : AstCloner.clone(v.type()),
            AstCloner.clone(v.initializer(), this::replace));
      } else if (node instanceof Statement.Return) {
        return new Statement.Return(
            returnType == null
                ? null
                : ArbitraryExpressions.generateArbitraryExpression(
                    depth + 1, returnType, sideEffectsAllowed, settings, host, scope));
      }
      return null;
    }
  }

  private DonorSplicer() {}
}
