// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.backend;

import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.java_smt.api.BooleanFormula;

/** A fact assumed to hold for the rest of the current assumption frame. */
public final class Assumption {

  public enum Kind {
    /** The path condition of a branch that was taken. */
    BRANCH_CONDITION,
    GENERIC
  }

  private final Kind kind;
  private final String description;
  private final BooleanFormula predicate;

  private Assumption(Kind pKind, String pDescription, BooleanFormula pPredicate) {
    kind = checkNotNull(pKind);
    description = checkNotNull(pDescription);
    predicate = checkNotNull(pPredicate);
  }

  public static Assumption branchCondition(BooleanFormula pPredicate, String pTarget) {
    return new Assumption(Kind.BRANCH_CONDITION, "branch to " + pTarget, pPredicate);
  }

  public static Assumption generic(BooleanFormula pPredicate, String pDescription) {
    return new Assumption(Kind.GENERIC, pDescription, pPredicate);
  }

  public Kind getKind() {
    return kind;
  }

  public String getDescription() {
    return description;
  }

  public BooleanFormula getPredicate() {
    return predicate;
  }

  @Override
  public String toString() {
    return description + ": " + predicate;
  }
}
