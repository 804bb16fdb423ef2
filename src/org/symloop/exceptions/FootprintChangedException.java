// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exceptions;

/** Thrown when the set of memory locations written by the loop body changes between iterations. */
public class FootprintChangedException extends FixpointException {

  private static final long serialVersionUID = -1860420368338127745L;

  public FootprintChangedException(String pMessage) {
    super(pMessage);
  }
}
