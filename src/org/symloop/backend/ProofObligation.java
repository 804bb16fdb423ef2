// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.backend;

import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.java_smt.api.BooleanFormula;

/** A predicate that has to be proven, labelled with the reason it was asserted. */
public final class ProofObligation {

  private final BooleanFormula predicate;
  private final String message;

  public ProofObligation(BooleanFormula pPredicate, String pMessage) {
    predicate = checkNotNull(pPredicate);
    message = checkNotNull(pMessage);
  }

  public BooleanFormula getPredicate() {
    return predicate;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return message + ": " + predicate;
  }
}
