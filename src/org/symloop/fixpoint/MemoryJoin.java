// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.java_smt.api.BitvectorFormula;
import org.symloop.memory.StorageType;

/** The join variable standing in for one widened memory cell, with the type of the cell. */
public final class MemoryJoin {

  private final BitvectorFormula joinVariable;
  private final StorageType storageType;

  public MemoryJoin(BitvectorFormula pJoinVariable, StorageType pStorageType) {
    joinVariable = checkNotNull(pJoinVariable);
    storageType = checkNotNull(pStorageType);
  }

  public BitvectorFormula getJoinVariable() {
    return joinVariable;
  }

  public StorageType getStorageType() {
    return storageType;
  }

  @Override
  public String toString() {
    return joinVariable + ":" + storageType;
  }
}
