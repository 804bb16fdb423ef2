// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.util.smt;

import java.math.BigInteger;
import java.util.Optional;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.BitvectorFormula;

/** Helpers for tests that need formulas. */
public final class SymbolicTestUtils {

  private SymbolicTestUtils() {}

  public static SymbolicContext newContext() throws InvalidConfigurationException {
    return SymbolicContext.create(
        Configuration.defaultConfiguration(),
        LogManager.createTestLogManager(),
        ShutdownNotifier.createDummy());
  }

  /**
   * Adds two bit-vectors, folding the sum if both are literals. Loops whose state does not change
   * need syntactically equal values across iterations.
   */
  public static BitvectorFormula add(
      SymbolicContext pContext, BitvectorFormula pFirst, BitvectorFormula pSecond) {
    Optional<BigInteger> first = pContext.asLiteral(pFirst);
    Optional<BigInteger> second = pContext.asLiteral(pSecond);
    int width = pContext.getBitvectorFormulaManager().getLength(pFirst);
    if (first.isPresent() && second.isPresent()) {
      BigInteger sum = first.orElseThrow().add(second.orElseThrow());
      return pContext.literal(width, sum.mod(BigInteger.ONE.shiftLeft(width)));
    }
    return pContext.getBitvectorFormulaManager().add(pFirst, pSecond);
  }
}
