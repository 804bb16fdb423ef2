// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.backend;

import com.google.common.collect.ImmutableList;
import org.sosy_lab.java_smt.api.BooleanFormula;

/**
 * The assumption and obligation store of the host executor. Frames follow a stack discipline:
 * every pushed frame has to be popped exactly once, and only while it is the topmost frame.
 */
public interface AssumptionStack {

  FrameIdentifier pushFrame();

  /**
   * Pops the topmost frame and returns its assumptions. Obligations asserted inside the frame are
   * kept.
   *
   * @throws IllegalStateException if the given frame is not the topmost one
   */
  ImmutableList<Assumption> popFrame(FrameIdentifier pFrame);

  /**
   * Pops the topmost frame and returns its assumptions. Obligations asserted inside the frame are
   * discarded.
   *
   * @throws IllegalStateException if the given frame is not the topmost one
   */
  ImmutableList<Assumption> popFrameAndObligations(FrameIdentifier pFrame);

  void addAssumption(Assumption pAssumption);

  void addProofObligation(ProofObligation pObligation);

  /** Conjunction of all assumptions currently in scope. */
  BooleanFormula currentAssumptions();

  /** All goals that are still pending, oldest first. */
  ImmutableList<ProofGoal> getProofGoals();
}
