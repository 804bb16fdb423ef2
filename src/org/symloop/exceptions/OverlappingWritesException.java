// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exceptions;

/** Thrown when a write at a symbolic offset may overlap a write that happened before the loop. */
public class OverlappingWritesException extends FixpointException {

  private static final long serialVersionUID = 8851932265507313032L;

  public OverlappingWritesException(String pMessage) {
    super(pMessage);
  }
}
