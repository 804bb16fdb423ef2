// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exec;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.symloop.cfa.BlockId;

/** The identity of the function a frame executes and the input types of that function's blocks. */
public final class CallFrame {

  private final String handle;
  private final ImmutableMap<BlockId, ImmutableList<RegType>> blockInputs;

  public CallFrame(String pHandle, ImmutableMap<BlockId, ImmutableList<RegType>> pBlockInputs) {
    handle = checkNotNull(pHandle);
    blockInputs = checkNotNull(pBlockInputs);
  }

  public String getHandle() {
    return handle;
  }

  public ImmutableMap<BlockId, ImmutableList<RegType>> getBlockInputs() {
    return blockInputs;
  }

  @Override
  public String toString() {
    return handle;
  }
}
