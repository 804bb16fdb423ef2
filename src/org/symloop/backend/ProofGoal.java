// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.backend;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import org.sosy_lab.java_smt.api.BooleanFormula;

/** An obligation together with the assumptions that were in scope when it was asserted. */
public final class ProofGoal {

  private final ImmutableList<BooleanFormula> assumptions;
  private final ProofObligation obligation;

  public ProofGoal(ImmutableList<BooleanFormula> pAssumptions, ProofObligation pObligation) {
    assumptions = checkNotNull(pAssumptions);
    obligation = checkNotNull(pObligation);
  }

  public ImmutableList<BooleanFormula> getAssumptions() {
    return assumptions;
  }

  public ProofObligation getObligation() {
    return obligation;
  }

  @Override
  public String toString() {
    return assumptions + " => " + obligation;
  }
}
