// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exceptions;

/** Thrown by a memory model that cannot serve a load. */
public class MemoryAccessException extends Exception {

  private static final long serialVersionUID = -5418275101683129094L;

  public MemoryAccessException(String pMessage) {
    super(pMessage);
  }
}
