// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.memory;

import com.google.common.collect.ImmutableListMultimap;
import org.sosy_lab.java_smt.api.BitvectorFormula;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.symloop.exceptions.MemoryAccessException;

/**
 * The memory model as seen by the loop-fixpoint engine. Implementations are persistent: every
 * operation that changes memory returns a new instance and leaves the receiver untouched.
 */
public interface Memory {

  /** Opens a new allocation scope; all following writes and allocations belong to it. */
  Memory pushStackFrame(String pName);

  /**
   * Drops the topmost allocation scope.
   *
   * @throws IllegalStateException if no scope was pushed
   */
  PoppedFrame popStackFrame();

  /**
   * Loads a value of the given storage type.
   *
   * @throws MemoryAccessException if the memory model cannot determine the value
   */
  Pointer load(Pointer pPointer, StorageType pType) throws MemoryAccessException;

  Memory store(Pointer pPointer, StorageType pType, Pointer pValue);

  /** All ranges written so far, by region. */
  ImmutableListMultimap<Integer, WriteRange> writeRanges();

  /** A predicate that holds if the two ranges do not overlap. */
  BooleanFormula disjointRegions(
      Pointer pFirst, BitvectorFormula pFirstSize, Pointer pSecond, BitvectorFormula pSecondSize);
}
