// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.memory;

import com.google.common.collect.ImmutableList;

/**
 * A chunk of a write log. Indexed chunks only contain writes to concrete regions, so that writes
 * can be looked up by region; flat chunks may contain anything.
 */
public final class WriteChunk {

  private final boolean indexed;
  private final ImmutableList<MemoryWrite> writes;

  private WriteChunk(boolean pIndexed, ImmutableList<MemoryWrite> pWrites) {
    indexed = pIndexed;
    writes = pWrites;
  }

  public static WriteChunk indexed(Iterable<MemoryWrite> pWrites) {
    return new WriteChunk(true, ImmutableList.copyOf(pWrites));
  }

  public static WriteChunk flat(Iterable<MemoryWrite> pWrites) {
    return new WriteChunk(false, ImmutableList.copyOf(pWrites));
  }

  public boolean isIndexed() {
    return indexed;
  }

  public ImmutableList<MemoryWrite> getWrites() {
    return writes;
  }

  @Override
  public String toString() {
    return (indexed ? "indexed" : "flat") + writes;
  }
}
