// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exec;

import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.SolverException;
import org.symloop.cfa.BlockId;
import org.symloop.exceptions.FixpointException;

/**
 * Hook into the host executor. The executor calls the feature synchronously at every block start
 * and at every symbolic branch, one notification at a time, and continues according to the
 * returned result.
 */
public interface ExecutionFeature {

  ExecutionFeatureResult onBlockEntered(BlockId pBlock, SimulationState pState)
      throws FixpointException, SolverException, InterruptedException;

  /**
   * Called when the executor reaches a branch whose condition is neither true nor false.
   *
   * @param pCondition the branch condition; the true continuation is taken if it holds
   */
  ExecutionFeatureResult onSymbolicBranch(
      BooleanFormula pCondition,
      PausedFrame pTrueFrame,
      PausedFrame pFalseFrame,
      SimulationState pState)
      throws FixpointException;
}
