// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.SolverException;

/**
 * Describes the intended effect of a loop. Given the final widening substitution and the
 * condition under which the loop keeps iterating, it returns the values of the widening variables
 * after the loop together with a condition that has to be proven for this summary to hold.
 */
@FunctionalInterface
public interface FixpointFunction {

  FixpointResult summarize(Substitution pSubstitution, BooleanFormula pLoopCondition)
      throws SolverException, InterruptedException;
}
