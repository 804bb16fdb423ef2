// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.backend;

/** Identifies an assumption frame pushed on an {@link AssumptionStack}. */
public final class FrameIdentifier {

  private final int id;

  FrameIdentifier(int pId) {
    id = pId;
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof FrameIdentifier && ((FrameIdentifier) pObj).id == id;
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public String toString() {
    return "frame#" + id;
  }
}
