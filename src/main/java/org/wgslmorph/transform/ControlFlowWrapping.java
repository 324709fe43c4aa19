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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static org.wgslmorph.transform.Choice.option;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.analysis.Behaviour;
import org.wgslmorph.analysis.StatementBehaviourAnalysis;
import org.wgslmorph.ast.AssignmentOperator;
import org.wgslmorph.ast.AstCloner;
import org.wgslmorph.ast.AstNode;
import org.wgslmorph.ast.AstTraversal;
import org.wgslmorph.ast.AugmentedStatement.ControlFlowWrapReturn;
import org.wgslmorph.ast.AugmentedStatement.ControlFlowWrapper;
import org.wgslmorph.ast.BinaryOperator;
import org.wgslmorph.ast.ContinuingStatement;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.LhsExpression;
import org.wgslmorph.ast.Metadata;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.ast.SwitchClause;
import org.wgslmorph.ast.TranslationUnit;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.resolve.Type;

/**
 * Moves runs of consecutive statements into control-flow constructs that execute them exactly
 * once: an {@code if} with an opaque condition, a single-trip {@code for}, {@code loop} or {@code
 * while}, or a {@code switch} on a known value surrounded by decoy cases.
 *
 * <p>A run {@code [start, end)} of a compound is eligible only if no name it declares is used by
 * the statements that follow it, including the {@code continuing} block of a loop whose body is
 * the compound, and the {@code break if} of a continuing block that is the compound. Filler code
 * generated after a wrapped run, up to the end of the run's scope, never refers to the run's
 * declarations. Runs that contain {@code break} or {@code continue} are only wrapped in an {@code
 * if}, since any other wrapper would capture the jump.
 *
 * <p>When a run cannot complete normally and may return, the wrapper is followed by a {@link
 * ControlFlowWrapReturn}: the wrapper itself can complete normally as far as the WGSL behaviour
 * rules are concerned, so a function with a return type would otherwise be rejected.
 */
public final class ControlFlowWrapping implements MetamorphicTransformation {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** A run of statements {@code [start, end)}. */
  record Run(int start, int end) {
    Run {
      checkArgument(start < end, "Empty run [%s, %s)", start, end);
    }

    boolean overlaps(Run other) {
      return start < other.end && other.start < end;
    }
  }

  /** The runs chosen in one compound, and whether the compound is inside a continuing block. */
  private record Plan(ImmutableList<Run> runs, boolean insideContinuing) {}

  private final @Nullable ShaderJob donor;

  /** A wrapping pass whose filler code is only generated. */
  public ControlFlowWrapping() {
    this(null);
  }

  /** A wrapping pass that may splice filler code from {@code donor}. */
  public ControlFlowWrapping(@Nullable ShaderJob donor) {
    this.donor = donor;
  }

  @Override
  public ShaderJob apply(ShaderJob shaderJob, FuzzerSettings settings) {
    return shaderJob.withTranslationUnit(new Wrapper(shaderJob, settings).run());
  }

  /**
   * Returns true if no name declared by a top-level statement of {@code declarations} is used in
   * {@code later}.
   */
  static boolean declarationsUnusedBy(
      List<Statement> declarations, List<? extends AstNode> later) {
    Set<String> names = new HashSet<>();
    for (Statement statement : declarations) {
      if (statement instanceof Statement.Variable variable) {
        names.add(variable.name());
      } else if (statement instanceof Statement.Value value) {
        names.add(value.name());
      }
    }
    if (names.isEmpty()) {
      return true;
    }
    for (AstNode root : later) {
      for (AstNode node : AstTraversal.nodesPreOrder(root)) {
        if ((node instanceof Expression.Identifier e && names.contains(e.name()))
            || (node instanceof LhsExpression.Identifier l && names.contains(l.name()))) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean containsNode(List<Statement> statements, Class<?>... kinds) {
    for (Statement statement : statements) {
      for (AstNode node : AstTraversal.nodesPreOrder(statement)) {
        for (Class<?> kind : kinds) {
          if (kind.isInstance(node)) {
            return true;
          }
        }
      }
    }
    return false;
  }

  private final class Wrapper {
    final ShaderJob shaderJob;
    final FuzzerSettings settings;
    final Map<Statement.Compound, Plan> plans = new IdentityHashMap<>();

    /** The continuing block that follows each loop body; it can see the body's declarations. */
    final Map<Statement.Compound, ContinuingStatement> continuingAfter = new IdentityHashMap<>();

    /** The {@code break if} condition that follows each continuing block. */
    final Map<Statement.Compound, Expression> breakIfAfter = new IdentityHashMap<>();

    /** Declarations of runs already wrapped whose enclosing compound is still being rewritten. */
    final List<Statement> hidden = new ArrayList<>();

    int continuingDepth;
    GlobalDecl.@Nullable Function currentFunction;
    int wrapped;

    Wrapper(ShaderJob shaderJob, FuzzerSettings settings) {
      this.shaderJob = shaderJob;
      this.settings = settings;
    }

    TranslationUnit run() {
      AstTraversal.traverse(this::select, shaderJob.tu(), plans);
      TranslationUnit result = AstCloner.clone(shaderJob.tu(), this::rewrite);
      logger.atFine().log("Wrapped %d runs in %d compounds", wrapped, plans.size());
      return result;
    }

    void select(AstNode node, Map<Statement.Compound, Plan> plans) {
      if (node instanceof Statement.Loop loop && loop.continuingStatement() != null) {
        continuingAfter.put(loop.body(), loop.continuingStatement());
      }
      if (node instanceof ContinuingStatement c && c.breakIfExpr() != null) {
        breakIfAfter.put(c.statements(), c.breakIfExpr());
      }
      boolean continuing = node instanceof ContinuingStatement;
      if (continuing) {
        continuingDepth++;
      }
      AstTraversal.traverse(this::select, node, plans);
      if (continuing) {
        continuingDepth--;
      }
      if (node instanceof Statement.Compound compound && !compound.isEmpty()) {
        ImmutableList<Run> runs = chooseRuns(compound);
        if (!runs.isEmpty()) {
          plans.put(compound, new Plan(runs, continuingDepth > 0));
        }
      }
    }

    /**
     * Chooses non-overlapping runs. Start points are visited in random order; the end of the run
     * at each start is drawn from the ends that keep the run's declarations private, and is only
     * computed when the start is reached.
     */
    ImmutableList<Run> chooseRuns(Statement.Compound compound) {
      List<Integer> starts = new ArrayList<>();
      for (int i = 0; i < compound.size(); i++) {
        starts.add(i);
      }
      settings.shuffle(starts);
      List<Run> chosen = new ArrayList<>();
      int next = 0;
      while (settings.controlFlowWrap()) {
        @Nullable Run run = null;
        while (run == null && next < starts.size()) {
          @Nullable Run candidate = runFrom(compound, starts.get(next++));
          if (candidate != null && chosen.stream().noneMatch(candidate::overlaps)) {
            run = candidate;
          }
        }
        if (run == null) {
          break;
        }
        chosen.add(run);
      }
      chosen.sort(Comparator.comparingInt(Run::start));
      return ImmutableList.copyOf(chosen);
    }

    /**
     * Returns a random run starting at {@code start}, or null if every such run hides a
     * declaration from the continuing block or {@code break if} after the compound. The smallest
     * acceptable end is found by shrinking from the end of the compound; every end from there up
     * is acceptable.
     */
    @Nullable Run runFrom(Statement.Compound compound, int start) {
      List<Statement> statements = compound.statements();
      List<AstNode> after = new ArrayList<>();
      ContinuingStatement continuing = continuingAfter.get(compound);
      if (continuing != null) {
        after.add(continuing);
      }
      Expression breakIf = breakIfAfter.get(compound);
      if (breakIf != null) {
        after.add(breakIf);
      }
      if (!declarationsUnusedBy(statements.subList(start, statements.size()), after)) {
        return null;
      }
      int end = statements.size();
      while (end - 1 > start) {
        List<AstNode> later = new ArrayList<>(statements.subList(end - 1, statements.size()));
        later.addAll(after);
        if (!declarationsUnusedBy(statements.subList(start, end - 1), later)) {
          break;
        }
        end--;
      }
      return new Run(start, end + settings.randomInt(statements.size() - end + 1));
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
      if (node instanceof Statement.Loop loop && loop.continuingStatement() != null) {
        // Declarations hidden in the body stay hidden in the continuing block.
        int mark = hidden.size();
        Statement.Loop result =
            new Statement.Loop(
                AstCloner.cloneAll(loop.attributesAtStart(), this::rewrite),
                AstCloner.cloneAll(loop.attributesBeforeBody(), this::rewrite),
                AstCloner.clone(loop.body(), this::rewrite),
                AstCloner.clone(loop.continuingStatement(), this::rewrite));
        unhide(mark);
        return result;
      }
      if (!(node instanceof Statement.Compound compound)) {
        return null;
      }
      Plan plan = plans.get(compound);
      if (plan == null) {
        return null;
      }
      ImmutableList.Builder<Statement> body = ImmutableList.builder();
      int mark = hidden.size();
      int i = 0;
      for (Run run : plan.runs()) {
        while (i < run.start()) {
          body.add(AstCloner.clone(compound.statements().get(i++), this::rewrite));
        }
        List<Statement> statements = compound.statements().subList(run.start(), run.end());
        wrap(statements, plan.insideContinuing(), body);
        hidden.addAll(statements);
        wrapped++;
        i = run.end();
      }
      while (i < compound.size()) {
        body.add(AstCloner.clone(compound.statements().get(i++), this::rewrite));
      }
      if (!continuingAfter.containsKey(compound)) {
        unhide(mark);
      }
      return new Statement.Compound(body.build(), compound.metadata());
    }

    void unhide(int mark) {
      hidden.subList(mark, hidden.size()).clear();
    }

    /** The scope before {@code statement}, without the declarations of runs wrapped earlier. */
    Scope visibleScopeBefore(Statement statement) {
      Set<AstNode> declarations = Sets.newIdentityHashSet();
      for (Statement s : hidden) {
        if (s instanceof Statement.Variable || s instanceof Statement.Value) {
          declarations.add(s);
        }
      }
      return shaderJob.environment().scopeAvailableBefore(statement).without(declarations);
    }

    /** Adds the wrapper for {@code statements}, and a fallback return if one is needed. */
    void wrap(
        List<Statement> statements,
        boolean insideContinuing,
        ImmutableList.Builder<Statement> out) {
      GlobalDecl.Function function = currentFunction;
      checkState(function != null, "Compound outside a function");
      Type returnType = DeadReturns.returnTypeOf(shaderJob, function);
      Scope scope = visibleScopeBefore(statements.get(0));
      ArbitraryStatements.Site site =
          new ArbitraryStatements.Site(shaderJob, scope, donor, returnType, !insideContinuing);
      int id = settings.getUniqueId();
      ImmutableList<Statement> cloned = AstCloner.cloneAll(statements, this::rewrite);
      out.add(wrapInControlFlow(statements, cloned, id, site));
      Set<Behaviour> behaviour = StatementBehaviourAnalysis.behaviourOf(statements);
      if (returnType != null
          && behaviour.contains(Behaviour.RETURN)
          && !behaviour.contains(Behaviour.NEXT)) {
        out.add(
            new ControlFlowWrapReturn(
                new Statement.Return(
                    ArbitraryExpressions.generateArbitraryExpression(
                        0, returnType, true, settings, shaderJob, scope)),
                id));
      }
    }

    /**
     * Returns a wrapper executing {@code cloned} once.
     *
     * @param original the statements of the run in the resolved tree, for analysis
     * @param cloned the rewritten copy of those statements that goes in the wrapper
     */
    ControlFlowWrapper wrapInControlFlow(
        List<Statement> original,
        ImmutableList<Statement> cloned,
        int id,
        ArbitraryStatements.Site site) {
      checkArgument(!original.isEmpty(), "Cannot wrap an empty list of statements");
      boolean containsJump =
          containsNode(original, Statement.Break.class, Statement.Continue.class);
      FuzzerSettings.ControlFlowWrappingWeights weights = settings.controlFlowWrappingWeights();
      List<Choice.Option<Statement>> options = new ArrayList<>();
      options.add(option(weights.ifTrue(), () -> ifTrue(tagged(cloned, id), site)));
      options.add(option(weights.ifFalse(), () -> ifFalse(tagged(cloned, id), site)));
      if (!containsJump) {
        options.add(
            option(weights.singleIterForLoop(), () -> singleIterFor(tagged(cloned, id), site)));
        options.add(
            option(
                weights.singleIterLoopWithContinuing(),
                () -> singleIterLoop(original, cloned, id, site)));
        options.add(
            option(weights.singleIterWhileLoop(), () -> singleIterWhile(tagged(cloned, id), site)));
        options.add(
            option(
                weights.switchWithDecoyCases(),
                () -> switchWithDecoys(tagged(cloned, id), site)));
      }
      return new ControlFlowWrapper(Choice.choose(settings, options), id);
    }

    Statement.Compound tagged(List<Statement> statements, int id) {
      return new Statement.Compound(
          ImmutableList.copyOf(statements),
          ImmutableSet.of(new Metadata.ControlFlowWrapperBody(id)));
    }

    /** {@code if (true-by-construction) { run } [else ...]} */
    Statement ifTrue(Statement.Compound run, ArbitraryStatements.Site site) {
      return new Statement.If(
          KnownValues.generateTrueByConstructionExpression(settings, shaderJob, site.scope()),
          run,
          ArbitraryStatements.generateArbitraryElseBranch(0, true, settings, site));
    }

    /** {@code if (false-by-construction) { arbitrary } else { run }} */
    Statement ifFalse(Statement.Compound run, ArbitraryStatements.Site site) {
      return new Statement.If(
          KnownValues.generateFalseByConstructionExpression(settings, shaderJob, site.scope()),
          ArbitraryStatements.generateArbitraryCompound(0, true, settings, site),
          run);
    }

    /** A {@code for} loop whose counter reaches its bound after one update. */
    Statement singleIterFor(Statement.Compound run, ArbitraryStatements.Site site) {
      String counter = ArbitraryStatements.freshName("counter_", settings, site.scope());
      Type.Scalar type = settings.randomElement(Type.Scalar.I32, Type.Scalar.U32);
      Statement.ForUpdate update;
      long initialValue;
      long finalValue;
      boolean increasing;
      switch (settings.randomInt(3)) {
        case 0 -> {
          long step = settings.randomInt(1000) + 1;
          initialValue = settings.randomInt(1000);
          finalValue = initialValue + step;
          increasing = true;
          update =
              new Statement.Assignment(
                  new LhsExpression.Identifier(counter),
                  AssignmentOperator.PLUS_EQUAL,
                  KnownValues.literal(step, type));
        }
        case 1 -> {
          long step = settings.randomInt(1000) + 1;
          initialValue = step + settings.randomInt(1000);
          finalValue = initialValue - step;
          increasing = false;
          update =
              new Statement.Assignment(
                  new LhsExpression.Identifier(counter),
                  AssignmentOperator.MINUS_EQUAL,
                  KnownValues.literal(step, type));
        }
        default -> {
          initialValue = settings.randomInt(1000);
          finalValue = initialValue + 1;
          increasing = true;
          update = new Statement.Increment(new LhsExpression.Identifier(counter));
        }
      }
      Statement.Variable init =
          new Statement.Variable(
              counter,
              null,
              KnownValues.generateKnownValueExpression(
                  1,
                  KnownValues.literal(initialValue, type),
                  type,
                  settings,
                  shaderJob,
                  site.scope()));
      Expression bound =
          KnownValues.generateKnownValueExpression(
              1, KnownValues.literal(finalValue, type), type, settings, shaderJob, site.scope());
      BinaryOperator operator =
          settings.randomBool()
              ? BinaryOperator.NOT_EQUAL
              : increasing ? BinaryOperator.LESS_THAN : BinaryOperator.GREATER_THAN;
      return new Statement.For(init, comparison(operator, counter, bound), update, run);
    }

    /** {@code counter op bound}, or the mirrored comparison with the operands swapped. */
    Expression comparison(BinaryOperator operator, String counter, Expression bound) {
      Expression counterExpression = new Expression.Identifier(counter);
      if (settings.randomBool()) {
        return new Expression.Binary(operator, counterExpression, bound);
      }
      BinaryOperator mirrored =
          switch (operator) {
            case LESS_THAN -> BinaryOperator.GREATER_THAN;
            case GREATER_THAN -> BinaryOperator.LESS_THAN;
            default -> operator;
          };
      return new Expression.Binary(mirrored, bound, counterExpression);
    }

    /**
     * {@code loop { prefix continuing { suffix break if true-by-construction; } }}. Returns and
     * discards are kept in the prefix, since a continuing block may contain neither.
     */
    Statement singleIterLoop(
        List<Statement> original,
        ImmutableList<Statement> cloned,
        int id,
        ArbitraryStatements.Site site) {
      int minSplit = 0;
      for (int i = 0; i < original.size(); i++) {
        ImmutableList<Statement> statement = ImmutableList.of(original.get(i));
        if (containsNode(statement, Statement.Return.class, Statement.Discard.class)) {
          minSplit = i + 1;
        }
      }
      int split = minSplit + settings.randomInt(original.size() - minSplit + 1);
      return new Statement.Loop(
          tagged(cloned.subList(0, split), id),
          new ContinuingStatement(
              tagged(cloned.subList(split, cloned.size()), id),
              KnownValues.generateTrueByConstructionExpression(settings, shaderJob, site.scope())));
    }

    /** {@code while (true-by-construction) { { run } break; }} */
    Statement singleIterWhile(Statement.Compound run, ArbitraryStatements.Site site) {
      return new Statement.While(
          KnownValues.generateTrueByConstructionExpression(settings, shaderJob, site.scope()),
          Statement.Compound.of(run, new Statement.Break()));
    }

    /**
     * {@code switch (known value) { ... case value: { run } ... }}, with decoy cases around the
     * real one. The default selector goes either with the real case or with a decoy.
     */
    Statement switchWithDecoys(Statement.Compound run, ArbitraryStatements.Site site) {
      Type.Scalar type = settings.randomElement(Type.Scalar.I32, Type.Scalar.U32);
      int value = settings.randomInt(1000);
      int decoys = settings.randomDecoyCaseCount();
      Set<Integer> used = new HashSet<>();
      used.add(value);
      List<SwitchClause> clauses = new ArrayList<>();
      for (int i = 0; i < decoys; i++) {
        int decoy;
        do {
          decoy = settings.randomInt(2000);
        } while (!used.add(decoy));
        clauses.add(
            new SwitchClause(
                ImmutableList.of(KnownValues.literal(decoy, type)),
                false,
                ArbitraryStatements.generateArbitraryCompound(0, true, settings, site)));
      }
      boolean defaultIsDecoy = settings.randomBool();
      if (defaultIsDecoy) {
        clauses.add(
            new SwitchClause(
                ImmutableList.of(),
                true,
                ArbitraryStatements.generateArbitraryCompound(0, true, settings, site)));
      }
      SwitchClause real =
          new SwitchClause(
              ImmutableList.of(KnownValues.literal(value, type)), !defaultIsDecoy, run);
      clauses.add(settings.randomInt(clauses.size() + 1), real);
      return new Statement.Switch(
          KnownValues.generateKnownValueExpression(
              0, KnownValues.literal(value, type), type, settings, shaderJob, site.scope()),
          clauses);
    }
  }
}
