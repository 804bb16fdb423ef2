// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.cfa;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The loops of a control-flow graph: every outermost loop header mapped to all blocks of its loop,
 * header included.
 */
public final class LoopStructure {

  private final ImmutableMap<BlockId, ImmutableList<BlockId>> loopBodies;
  private final boolean nestedLoops;

  private LoopStructure(
      ImmutableMap<BlockId, ImmutableList<BlockId>> pLoopBodies, boolean pNestedLoops) {
    loopBodies = pLoopBodies;
    nestedLoops = pNestedLoops;
  }

  public static LoopStructure of(ControlFlowGraph pCfg) {
    return of(WeakTopologicalOrdering.compute(pCfg));
  }

  public static LoopStructure of(ImmutableList<WtoComponent> pOrdering) {
    ImmutableMap.Builder<BlockId, ImmutableList<BlockId>> bodies = ImmutableMap.builder();
    boolean nested = false;
    for (WtoComponent component : pOrdering) {
      if (component instanceof WtoComponent.Scc) {
        WtoComponent.Scc scc = (WtoComponent.Scc) component;
        bodies.put(scc.getHead(), scc.flatten());
        nested |= scc.hasNestedScc();
      }
    }
    return new LoopStructure(bodies.buildOrThrow(), nested);
  }

  public boolean isLoopHeader(BlockId pBlock) {
    return loopBodies.containsKey(pBlock);
  }

  public ImmutableSet<BlockId> getLoopHeaders() {
    return loopBodies.keySet();
  }

  /** The blocks of the loop with the given header, or an empty list if it is no loop header. */
  public ImmutableList<BlockId> getLoopBody(BlockId pHeader) {
    return loopBodies.getOrDefault(pHeader, ImmutableList.of());
  }

  public boolean hasNestedLoops() {
    return nestedLoops;
  }

  @Override
  public String toString() {
    return loopBodies.toString();
  }
}
