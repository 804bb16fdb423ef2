// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.Formula;

/** Answer of a {@link FixpointFunction}. */
public final class FixpointResult {

  private final ImmutableMap<Formula, Formula> equalities;
  private final BooleanFormula residualCondition;

  public FixpointResult(ImmutableMap<Formula, Formula> pEqualities, BooleanFormula pResidual) {
    equalities = checkNotNull(pEqualities);
    residualCondition = checkNotNull(pResidual);
  }

  /** Values of the widening variables once the loop has been left. */
  public ImmutableMap<Formula, Formula> getEqualities() {
    return equalities;
  }

  /** Condition that has to hold for the loop summary to be correct. */
  public BooleanFormula getResidualCondition() {
    return residualCondition;
  }

  @Override
  public String toString() {
    return equalities + " if " + residualCondition;
  }
}
