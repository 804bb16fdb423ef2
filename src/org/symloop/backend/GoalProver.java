// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.backend;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;
import org.sosy_lab.java_smt.api.Model.ValueAssignment;
import org.sosy_lab.java_smt.api.ProverEnvironment;
import org.sosy_lab.java_smt.api.SolverContext.ProverOptions;
import org.sosy_lab.java_smt.api.SolverException;
import org.symloop.util.smt.SymbolicContext;

/**
 * Discharges proof goals: a goal holds if its assumptions imply its obligation, i.e. if the
 * negation of that implication is unsatisfiable.
 */
public class GoalProver {

  /** A goal that could not be proven, with the counterexample the solver found. */
  public static final class FailedGoal {
    private final ProofGoal goal;
    private final ImmutableList<ValueAssignment> counterexample;

    private FailedGoal(ProofGoal pGoal, ImmutableList<ValueAssignment> pCounterexample) {
      goal = pGoal;
      counterexample = pCounterexample;
    }

    public ProofGoal getGoal() {
      return goal;
    }

    public ImmutableList<ValueAssignment> getCounterexample() {
      return counterexample;
    }

    @Override
    public String toString() {
      return "failed to prove " + goal.getObligation().getMessage() + ", counterexample: "
          + counterexample;
    }
  }

  private final SymbolicContext context;
  private final LogManager logger;

  public GoalProver(SymbolicContext pContext, LogManager pLogger) {
    context = checkNotNull(pContext);
    logger = checkNotNull(pLogger);
  }

  /** The formula whose validity establishes the goal. */
  public BooleanFormula goalFormula(ProofGoal pGoal) {
    BooleanFormulaManager bmgr = context.getBooleanFormulaManager();
    return bmgr.implication(
        bmgr.and(pGoal.getAssumptions()), pGoal.getObligation().getPredicate());
  }

  public Optional<FailedGoal> prove(ProofGoal pGoal) throws SolverException, InterruptedException {
    BooleanFormulaManager bmgr = context.getBooleanFormulaManager();
    try (ProverEnvironment prover =
        context.getSolverContext().newProverEnvironment(ProverOptions.GENERATE_MODELS)) {
      prover.push(bmgr.not(goalFormula(pGoal)));
      if (prover.isUnsat()) {
        logger.log(Level.FINE, "Proved", pGoal.getObligation().getMessage());
        return Optional.empty();
      }
      ImmutableList<ValueAssignment> model = prover.getModelAssignments();
      logger.log(Level.INFO, "Could not prove", pGoal.getObligation().getMessage());
      return Optional.of(new FailedGoal(pGoal, model));
    }
  }

  /** Tries every goal and returns the ones that failed, in the order of the input. */
  public ImmutableList<FailedGoal> proveAll(Iterable<ProofGoal> pGoals)
      throws SolverException, InterruptedException {
    ImmutableList.Builder<FailedGoal> failures = ImmutableList.builder();
    for (ProofGoal goal : pGoals) {
      prove(goal).ifPresent(failures::add);
    }
    return failures.build();
  }
}
