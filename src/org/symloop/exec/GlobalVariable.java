// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exec;

import static com.google.common.base.Preconditions.checkNotNull;

/** A global variable of the host executor, e.g. the one holding the memory. */
public final class GlobalVariable {

  private final String name;

  public GlobalVariable(String pName) {
    name = checkNotNull(pName);
  }

  public String getName() {
    return name;
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof GlobalVariable && ((GlobalVariable) pObj).name.equals(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
