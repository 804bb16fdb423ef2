// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.memory;

import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.java_smt.api.BitvectorFormula;

/** Offset and size of a write inside one region. */
public final class WriteRange {

  private final BitvectorFormula offset;
  private final BitvectorFormula size;

  public WriteRange(BitvectorFormula pOffset, BitvectorFormula pSize) {
    offset = checkNotNull(pOffset);
    size = checkNotNull(pSize);
  }

  public BitvectorFormula getOffset() {
    return offset;
  }

  public BitvectorFormula getSize() {
    return size;
  }

  @Override
  public String toString() {
    return "[" + offset + ", +" + size + ")";
  }
}
