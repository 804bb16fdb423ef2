// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.cfa;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import org.symloop.exec.RegType;

/** A basic block: its input register types and the blocks it may jump to. */
public final class Block {

  private final BlockId id;
  private final ImmutableList<RegType> inputTypes;
  private final ImmutableList<BlockId> successors;

  public Block(
      BlockId pId, ImmutableList<RegType> pInputTypes, ImmutableList<BlockId> pSuccessors) {
    id = checkNotNull(pId);
    inputTypes = checkNotNull(pInputTypes);
    successors = checkNotNull(pSuccessors);
  }

  public BlockId getId() {
    return id;
  }

  public ImmutableList<RegType> getInputTypes() {
    return inputTypes;
  }

  public ImmutableList<BlockId> getSuccessors() {
    return successors;
  }

  @Override
  public String toString() {
    return id + " -> " + successors;
  }
}
