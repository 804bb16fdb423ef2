// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.memory;

import com.google.common.collect.ImmutableList;

/** The writes performed since a stack frame was pushed, oldest chunk first. */
public final class MemoryWrites {

  private static final MemoryWrites EMPTY = new MemoryWrites(ImmutableList.of());

  private final ImmutableList<WriteChunk> chunks;

  private MemoryWrites(ImmutableList<WriteChunk> pChunks) {
    chunks = pChunks;
  }

  public static MemoryWrites empty() {
    return EMPTY;
  }

  public static MemoryWrites of(WriteChunk... pChunks) {
    return new MemoryWrites(ImmutableList.copyOf(pChunks));
  }

  public ImmutableList<WriteChunk> getChunks() {
    return chunks;
  }

  public boolean isEmpty() {
    return chunks.stream().allMatch(chunk -> chunk.getWrites().isEmpty());
  }

  @Override
  public String toString() {
    return chunks.toString();
  }
}
