// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exceptions;

/** Thrown when two values cannot be widened, e.g. pointers into different memory regions. */
public class UnsupportedJoinException extends FixpointException {

  private static final long serialVersionUID = 2455138520779402316L;

  public UnsupportedJoinException(String pMessage) {
    super(pMessage);
  }
}
