// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.cfa;

import static com.google.common.base.Preconditions.checkArgument;

/** Identifier of a basic block, unique within one control-flow graph. */
public final class BlockId implements Comparable<BlockId> {

  private final int index;

  private BlockId(int pIndex) {
    checkArgument(pIndex >= 0, "negative block index %s", pIndex);
    index = pIndex;
  }

  public static BlockId of(int pIndex) {
    return new BlockId(pIndex);
  }

  public int getIndex() {
    return index;
  }

  @Override
  public int compareTo(BlockId pOther) {
    return Integer.compare(index, pOther.index);
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof BlockId && ((BlockId) pObj).index == index;
  }

  @Override
  public int hashCode() {
    return index;
  }

  @Override
  public String toString() {
    return "B" + index;
  }
}
