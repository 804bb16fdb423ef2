// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exceptions;

/** Thrown when the loop index or the loop bound cannot be determined uniquely. */
public class IdentificationFailureException extends FixpointException {

  private static final long serialVersionUID = 4703126696148872390L;

  public IdentificationFailureException(String pMessage) {
    super(pMessage);
  }
}
