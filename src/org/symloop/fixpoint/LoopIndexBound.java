// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.math.BigInteger;
import org.sosy_lab.java_smt.api.BitvectorFormula;

/**
 * The induction variable of a loop: it starts at {@code start}, grows by {@code step} in every
 * iteration and the loop is left once it reaches {@code stop}.
 */
public final class LoopIndexBound {

  private final BitvectorFormula index;
  private final BigInteger start;
  private final BitvectorFormula stop;
  private final BigInteger step;

  public LoopIndexBound(
      BitvectorFormula pIndex, BigInteger pStart, BitvectorFormula pStop, BigInteger pStep) {
    checkArgument(pStep.signum() > 0, "loop index step must be positive, got %s", pStep);
    index = checkNotNull(pIndex);
    start = checkNotNull(pStart);
    stop = checkNotNull(pStop);
    step = pStep;
  }

  public BitvectorFormula getIndex() {
    return index;
  }

  public BigInteger getStart() {
    return start;
  }

  public BitvectorFormula getStop() {
    return stop;
  }

  public BigInteger getStep() {
    return step;
  }

  public LoopIndexBound withIndex(BitvectorFormula pIndex) {
    return new LoopIndexBound(pIndex, start, stop, step);
  }

  @Override
  public String toString() {
    return index + " from " + start + " by " + step + " below " + stop;
  }
}
