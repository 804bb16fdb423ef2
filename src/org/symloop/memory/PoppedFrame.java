// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.memory;

import static com.google.common.base.Preconditions.checkNotNull;

/** Result of dropping the topmost stack frame of a {@link Memory}. */
public final class PoppedFrame {

  private final Memory memory;
  private final int allocationCount;
  private final MemoryWrites writes;

  public PoppedFrame(Memory pMemory, int pAllocationCount, MemoryWrites pWrites) {
    memory = checkNotNull(pMemory);
    allocationCount = pAllocationCount;
    writes = checkNotNull(pWrites);
  }

  /** The memory as it was when the frame was pushed, with all writes of the frame dropped. */
  public Memory getMemory() {
    return memory;
  }

  public int getAllocationCount() {
    return allocationCount;
  }

  public MemoryWrites getWrites() {
    return writes;
  }
}
