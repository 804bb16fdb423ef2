// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exceptions;

/**
 * Super class for all exceptions that abort the loop-fixpoint computation. Such an exception ends
 * the verification attempt along the current symbolic path; it is never retried and never turned
 * into a proved result.
 */
public class FixpointException extends Exception {

  private static final long serialVersionUID = 6013947291208713485L;

  public FixpointException(String pMessage) {
    super(pMessage);
  }

  public FixpointException(String pMessage, Throwable pCause) {
    super(pMessage, pCause);
  }
}
