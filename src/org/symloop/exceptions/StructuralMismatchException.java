// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exceptions;

/**
 * Thrown when the shape of the register file or the memory differs between two visits of the same
 * loop header, or when the program shape is not supported (nested loops, allocations in the loop
 * body, no fixpoint within the configured number of widening steps).
 */
public class StructuralMismatchException extends FixpointException {

  private static final long serialVersionUID = -3169412530987717703L;

  public StructuralMismatchException(String pMessage) {
    super(pMessage);
  }

  public StructuralMismatchException(String pMessage, Throwable pCause) {
    super(pMessage, pCause);
  }
}
