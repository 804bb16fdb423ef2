// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.BitvectorFormula;
import org.sosy_lab.java_smt.api.BitvectorFormulaManager;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.Formula;
import org.sosy_lab.java_smt.api.SolverException;
import org.symloop.exceptions.IdentificationFailureException;
import org.symloop.util.smt.SymbolicContext;

/**
 * Recovers the induction variable of a loop from its stable substitution, and its bound from the
 * condition under which the loop keeps iterating.
 *
 * <p>Both are heuristics on the shape of the formulas. Anything that does not match the expected
 * shape is reported as an {@link IdentificationFailureException}.
 */
@Options(prefix = "loopfixpoint")
public class LoopIndexBoundFinder {

  public enum BoundHeuristic {
    /**
     * The condition has exactly one free pointer-width variable that is not a widening variable;
     * that variable counts the iterations.
     */
    NON_WIDENING_VARIABLE,
    /**
     * The condition has exactly three free variables and the first one, if it has pointer width,
     * counts the iterations.
     */
    FIRST_OF_THREE
  }

  @Option(secure = true, description = "How the loop bound is read off the loop condition.")
  private BoundHeuristic boundHeuristic = BoundHeuristic.NON_WIDENING_VARIABLE;

  private final SymbolicContext context;
  private final LogManager logger;
  private final int pointerWidth;

  /** A candidate induction variable before its bound is known. */
  public static final class LoopIndex {
    private final BitvectorFormula variable;
    private final BigInteger start;
    private final BigInteger step;

    private LoopIndex(BitvectorFormula pVariable, BigInteger pStart, BigInteger pStep) {
      variable = pVariable;
      start = pStart;
      step = pStep;
    }

    public BitvectorFormula getVariable() {
      return variable;
    }

    public BigInteger getStart() {
      return start;
    }

    public BigInteger getStep() {
      return step;
    }

    @Override
    public String toString() {
      return variable + "=" + start + "+" + step + "*k";
    }
  }

  public LoopIndexBoundFinder(
      SymbolicContext pContext, Configuration pConfig, LogManager pLogger, int pPointerWidth)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    context = checkNotNull(pContext);
    logger = checkNotNull(pLogger);
    pointerWidth = pPointerWidth;
  }

  /**
   * Finds the unique pointer-width widening variable that starts at a constant and grows by a
   * non-zero constant in every iteration.
   */
  public LoopIndex findLoopIndex(Substitution pSubstitution)
      throws IdentificationFailureException, SolverException, InterruptedException {
    BitvectorFormulaManager bvmgr = context.getBitvectorFormulaManager();
    ImmutableList.Builder<LoopIndex> candidates = ImmutableList.builder();
    for (Map.Entry<Formula, WideningEntry> entry : pSubstitution.asMap().entrySet()) {
      if (!context.isBitvectorOfWidth(entry.getKey(), pointerWidth)) {
        continue;
      }
      BitvectorFormula variable = (BitvectorFormula) entry.getKey();
      WideningEntry widening = entry.getValue();
      Optional<BigInteger> start =
          context.asConstant((BitvectorFormula) widening.getHeaderValue());
      if (start.isEmpty()) {
        continue;
      }
      Optional<BigInteger> step =
          context.asConstant(bvmgr.subtract((BitvectorFormula) widening.getBodyValue(), variable));
      if (step.isEmpty() || step.orElseThrow().signum() == 0) {
        continue;
      }
      LoopIndex candidate = new LoopIndex(variable, start.orElseThrow(), step.orElseThrow());
      logger.log(Level.FINE, "Loop index candidate", candidate);
      candidates.add(candidate);
    }

    ImmutableList<LoopIndex> found = candidates.build();
    if (found.size() != 1) {
      logger.log(Level.WARNING, "Expected exactly one loop index, found", found);
      throw new IdentificationFailureException(
          "loop index identification failure: " + found.size() + " candidates " + found);
    }
    return found.get(0);
  }

  /** Derives the value of the index at which the loop is left. */
  public BitvectorFormula findLoopBound(
      Substitution pSubstitution, BooleanFormula pCondition, BigInteger pStep)
      throws IdentificationFailureException {
    ImmutableSet<Formula> variables = context.freeVariables(pCondition);
    @Nullable Formula bound = null;
    switch (boundHeuristic) {
      case FIRST_OF_THREE:
        if (variables.size() == 3) {
          Formula first = variables.asList().get(0);
          if (context.isBitvectorOfWidth(first, pointerWidth)) {
            bound = first;
          }
        }
        break;
      case NON_WIDENING_VARIABLE:
        ImmutableList<Formula> free =
            variables.stream()
                .filter(v -> !pSubstitution.contains(v))
                .filter(v -> context.isBitvectorOfWidth(v, pointerWidth))
                .collect(ImmutableList.toImmutableList());
        if (free.size() == 1) {
          bound = free.get(0);
        }
        break;
      default:
        throw new AssertionError("unhandled heuristic " + boundHeuristic);
    }

    if (bound == null) {
      logger.log(Level.WARNING, "Cannot read a loop bound off", pCondition);
      throw new IdentificationFailureException(
          "loop bound identification failure: condition "
              + pCondition
              + " has variables "
              + variables);
    }
    BitvectorFormulaManager bvmgr = context.getBitvectorFormulaManager();
    return bvmgr.multiply((BitvectorFormula) bound, context.literal(pointerWidth, pStep));
  }

  /**
   * Identifies index and bound of the loop.
   *
   * @param pCondition the condition under which the loop keeps iterating, {@code null} if no
   *     branch out of the loop was seen
   */
  public LoopIndexBound findLoopIndexBound(
      Substitution pSubstitution, @Nullable BooleanFormula pCondition)
      throws IdentificationFailureException, SolverException, InterruptedException {
    if (pCondition == null) {
      throw new IdentificationFailureException("no loop condition recorded");
    }
    LoopIndex index = findLoopIndex(pSubstitution);
    BitvectorFormula stop = findLoopBound(pSubstitution, pCondition, index.getStep());
    LoopIndexBound bound =
        new LoopIndexBound(index.getVariable(), index.getStart(), stop, index.getStep());
    logger.log(Level.INFO, "Identified loop index", bound);
    return bound;
  }

  /** The index is below the stop value, compared unsigned. */
  public BooleanFormula boundCondition(BitvectorFormula pIndex, BitvectorFormula pStop) {
    return context.getBitvectorFormulaManager().lessThan(pIndex, pStop, false);
  }

  /** The index is congruent to its start value modulo the step. */
  public BooleanFormula startStepCondition(LoopIndexBound pBound) {
    BitvectorFormulaManager bvmgr = context.getBitvectorFormulaManager();
    int width = bvmgr.getLength(pBound.getIndex());
    BitvectorFormula index = pBound.getIndex();
    BitvectorFormula step = context.literal(width, pBound.getStep());
    // index urem step
    BitvectorFormula remainder =
        bvmgr.subtract(index, bvmgr.multiply(bvmgr.divide(index, step, false), step));
    return bvmgr.equal(remainder, context.literal(width, pBound.getStart().mod(pBound.getStep())));
  }
}
