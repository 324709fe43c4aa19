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

import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * The source of every random decision made by the transformations, and the weights that bias
 * them. Tests override individual methods to force a particular path.
 *
 * <p>Weights that are functions take the current generation depth, so that recursive choices can
 * be made less likely as depth grows.
 */
public interface FuzzerSettings {

  /** Returns a positive id, different from every id previously returned by this instance. */
  int getUniqueId();

  /** Returns a random int in {@code [0, limit)}. */
  int randomInt(int limit);

  /** Returns a random double in {@code [0, 1)}. */
  double randomDouble();

  boolean randomBool();

  default int maxDepth() {
    return 18;
  }

  /**
   * Returns true if a generator at {@code currentDepth} should build a compound expression rather
   * than a leaf. The probability falls as depth grows and is zero at {@link #maxDepth}.
   */
  default boolean goDeeper(int currentDepth) {
    return randomDouble() < 4.0 / (currentDepth + 2.0) && currentDepth < maxDepth();
  }

  default <T> T randomElement(List<T> list) {
    checkArgument(!list.isEmpty(), "Cannot get random element of an empty list");
    return list.get(randomInt(list.size()));
  }

  @SuppressWarnings("unchecked")
  default <T> T randomElement(T... elements) {
    return randomElement(List.of(elements));
  }

  /** Shuffles {@code list} in place. */
  default <T> void shuffle(List<T> list) {
    for (int i = list.size() - 1; i > 0; i--) {
      int j = randomInt(i + 1);
      T tmp = list.get(i);
      list.set(i, list.get(j));
      list.set(j, tmp);
    }
  }

  /** Returns a random long in {@code [low, high]}. */
  default long randomLongInRange(long low, long high) {
    checkArgument(low <= high, "Empty range [%s, %s]", low, high);
    long span = high - low + 1;
    if (span > 0 && span <= Integer.MAX_VALUE) {
      return low + randomInt((int) span);
    }
    // Spans wider than an int are only needed for 32-bit integer literals; two 16-bit draws give
    // 32 random bits, which is enough.
    long bits = ((long) randomInt(1 << 16) << 16) | randomInt(1 << 16);
    return low + Long.remainderUnsigned(bits, span);
  }

  default int randomArbitraryCompoundLength(int depth) {
    return randomInt(10);
  }

  default int randomDecoyCaseCount() {
    return randomInt(4);
  }

  default boolean injectDeadBreak() {
    return randomInt(100) < 50;
  }

  default boolean injectDeadContinue() {
    return randomInt(100) < 50;
  }

  default boolean injectDeadDiscard() {
    return randomInt(100) < 50;
  }

  default boolean injectDeadReturn() {
    return randomInt(100) < 50;
  }

  default boolean applyIdentityOperation() {
    return randomInt(100) < 50;
  }

  default boolean controlFlowWrap() {
    return randomInt(100) < 50;
  }

  default FalseByConstructionWeights falseByConstructionWeights() {
    return FalseByConstructionWeights.DEFAULT;
  }

  default TrueByConstructionWeights trueByConstructionWeights() {
    return TrueByConstructionWeights.DEFAULT;
  }

  default KnownValueWeights knownValueWeights() {
    return KnownValueWeights.DEFAULT;
  }

  default ScalarIdentityOperationWeights scalarIdentityOperationWeights() {
    return ScalarIdentityOperationWeights.DEFAULT;
  }

  default DeadBreaksAndContinuesWeights deadBreaksAndContinuesWeights() {
    return DeadBreaksAndContinuesWeights.DEFAULT;
  }

  default DeadDiscardOrReturnWeights deadDiscardOrReturnWeights() {
    return DeadDiscardOrReturnWeights.DEFAULT;
  }

  default ControlFlowWrappingWeights controlFlowWrappingWeights() {
    return ControlFlowWrappingWeights.DEFAULT;
  }

  default ArbitraryBooleanExpressionWeights arbitraryBooleanExpressionWeights() {
    return ArbitraryBooleanExpressionWeights.DEFAULT;
  }

  default ArbitraryIntExpressionWeights arbitraryIntExpressionWeights() {
    return ArbitraryIntExpressionWeights.DEFAULT;
  }

  default ArbitraryElseBranchWeights arbitraryElseBranchWeights() {
    return ArbitraryElseBranchWeights.DEFAULT;
  }

  default ArbitraryCompoundWeights arbitraryCompoundWeights() {
    return ArbitraryCompoundWeights.DEFAULT;
  }

  default ArbitraryStatementWeights arbitraryStatementWeights() {
    return ArbitraryStatementWeights.DEFAULT;
  }

  /** Returns a depth-independent weight. */
  static IntUnaryOperator constant(int weight) {
    return depth -> weight;
  }

  record FalseByConstructionWeights(
      IntUnaryOperator plainFalse,
      IntUnaryOperator falseAndArbitrary,
      IntUnaryOperator arbitraryAndFalse,
      IntUnaryOperator notTrue,
      IntUnaryOperator opaqueFalseFromUniformValues) {
    public static final FalseByConstructionWeights DEFAULT =
        new FalseByConstructionWeights(
            constant(1), constant(3), constant(3), constant(3), constant(6));
  }

  record TrueByConstructionWeights(
      IntUnaryOperator plainTrue,
      IntUnaryOperator trueOrArbitrary,
      IntUnaryOperator arbitraryOrTrue,
      IntUnaryOperator notFalse,
      IntUnaryOperator opaqueTrueFromUniformValues) {
    public static final TrueByConstructionWeights DEFAULT =
        new TrueByConstructionWeights(
            constant(1), constant(3), constant(3), constant(3), constant(6));
  }

  record KnownValueWeights(
      IntUnaryOperator plainKnownValue,
      IntUnaryOperator sumOfKnownValues,
      IntUnaryOperator differenceOfKnownValues,
      IntUnaryOperator productOfKnownValues,
      IntUnaryOperator knownValueDerivedFromUniform) {
    public static final KnownValueWeights DEFAULT =
        new KnownValueWeights(constant(1), constant(2), constant(2), constant(2), constant(6));
  }

  record ScalarIdentityOperationWeights(
      int addZeroLeft, int addZeroRight, int subZero, int mulOneLeft, int mulOneRight, int divOne) {
    public static final ScalarIdentityOperationWeights DEFAULT =
        new ScalarIdentityOperationWeights(1, 1, 2, 1, 1, 2);
  }

  record DeadBreaksAndContinuesWeights(int ifFalse, int ifFalseWithEmptyElse, int ifTrue) {
    public static final DeadBreaksAndContinuesWeights DEFAULT =
        new DeadBreaksAndContinuesWeights(1, 1, 2);
  }

  record DeadDiscardOrReturnWeights(
      int ifFalse,
      int ifTrue,
      int whileFalse,
      int forLoopWithFalseCondition,
      int loopWithUnconditionalBreak) {
    public static final DeadDiscardOrReturnWeights DEFAULT =
        new DeadDiscardOrReturnWeights(2, 2, 1, 1, 1);
  }

  record ControlFlowWrappingWeights(
      int ifTrue,
      int ifFalse,
      int singleIterForLoop,
      int singleIterLoopWithContinuing,
      int singleIterWhileLoop,
      int switchWithDecoyCases) {
    public static final ControlFlowWrappingWeights DEFAULT =
        new ControlFlowWrappingWeights(1, 1, 1, 1, 1, 1);
  }

  record ArbitraryBooleanExpressionWeights(
      IntUnaryOperator not,
      IntUnaryOperator or,
      IntUnaryOperator and,
      IntUnaryOperator lessThan,
      IntUnaryOperator greaterThan,
      IntUnaryOperator lessThanOrEqual,
      IntUnaryOperator greaterThanOrEqual,
      IntUnaryOperator equal,
      IntUnaryOperator notEqual,
      IntUnaryOperator variableFromScope,
      IntUnaryOperator literal) {
    public static final ArbitraryBooleanExpressionWeights DEFAULT =
        new ArbitraryBooleanExpressionWeights(
            constant(1),
            constant(2),
            constant(2),
            constant(1),
            constant(1),
            constant(1),
            constant(1),
            constant(1),
            constant(1),
            constant(1),
            constant(1));
  }

  record ArbitraryIntExpressionWeights(
      IntUnaryOperator swapIntType,
      IntUnaryOperator binaryOr,
      IntUnaryOperator binaryAnd,
      IntUnaryOperator binaryXor,
      IntUnaryOperator negate,
      IntUnaryOperator addition,
      IntUnaryOperator subtraction,
      IntUnaryOperator multiplication,
      IntUnaryOperator division,
      IntUnaryOperator modulo,
      IntUnaryOperator abs,
      IntUnaryOperator clamp,
      IntUnaryOperator countLeadingZeros,
      IntUnaryOperator countOneBits,
      IntUnaryOperator countTrailingZeros,
      IntUnaryOperator dot4U8Packed,
      IntUnaryOperator dot4I8Packed,
      IntUnaryOperator extractBits,
      IntUnaryOperator firstLeadingBit,
      IntUnaryOperator firstTrailingBit,
      IntUnaryOperator insertBits,
      IntUnaryOperator max,
      IntUnaryOperator min,
      IntUnaryOperator reverseBits,
      IntUnaryOperator sign,
      IntUnaryOperator variableFromScope,
      IntUnaryOperator literal) {
    public static final ArbitraryIntExpressionWeights DEFAULT = uniform(constant(1));

    /** Returns weights that give every alternative the same weight. */
    public static ArbitraryIntExpressionWeights uniform(IntUnaryOperator w) {
      return new ArbitraryIntExpressionWeights(
          w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w, w);
    }
  }

  record ArbitraryElseBranchWeights(
      IntUnaryOperator empty, IntUnaryOperator ifStatement, IntUnaryOperator compound) {
    public static final ArbitraryElseBranchWeights DEFAULT =
        new ArbitraryElseBranchWeights(constant(1), constant(1), constant(1));
  }

  /** The donor weight is ignored when no donor is available. */
  record ArbitraryCompoundWeights(int generatedStatements, int donorCompound) {
    public static final ArbitraryCompoundWeights DEFAULT = new ArbitraryCompoundWeights(1, 3);
  }

  record ArbitraryStatementWeights(
      IntUnaryOperator empty, IntUnaryOperator ifStatement, IntUnaryOperator variableDeclaration) {
    public static final ArbitraryStatementWeights DEFAULT =
        new ArbitraryStatementWeights(constant(1), constant(1), constant(2));
  }
}
