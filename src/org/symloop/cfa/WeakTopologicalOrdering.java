// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.cfa;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.Graph;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Computes a weak topological ordering of a control-flow graph with Bourdoncle's recursive
 * strategy. Loops become {@link WtoComponent.Scc}s headed by their loop header, nested loops
 * become nested components.
 *
 * <p>Blocks not reachable from the entry are not part of the ordering.
 */
public final class WeakTopologicalOrdering {

  private static final int DONE = Integer.MAX_VALUE;

  private final Graph<BlockId> graph;
  private final Map<BlockId, Integer> depthFirstNumber = new HashMap<>();
  private final Deque<BlockId> stack = new ArrayDeque<>();
  private int counter = 0;

  private WeakTopologicalOrdering(Graph<BlockId> pGraph) {
    graph = pGraph;
  }

  public static ImmutableList<WtoComponent> compute(ControlFlowGraph pCfg) {
    return compute(pCfg.asGraph(), pCfg.getEntry());
  }

  public static ImmutableList<WtoComponent> compute(Graph<BlockId> pGraph, BlockId pEntry) {
    WeakTopologicalOrdering wto = new WeakTopologicalOrdering(pGraph);
    Deque<WtoComponent> partition = new ArrayDeque<>();
    wto.visit(pEntry, partition);
    return ImmutableList.copyOf(partition);
  }

  private int number(BlockId pBlock) {
    return depthFirstNumber.getOrDefault(pBlock, 0);
  }

  private int visit(BlockId pVertex, Deque<WtoComponent> pPartition) {
    stack.push(pVertex);
    counter++;
    depthFirstNumber.put(pVertex, counter);
    int head = counter;
    boolean loop = false;

    for (BlockId successor : graph.successors(pVertex)) {
      int min = number(successor) == 0 ? visit(successor, pPartition) : number(successor);
      if (min <= head) {
        head = min;
        loop = true;
      }
    }

    if (head == number(pVertex)) {
      depthFirstNumber.put(pVertex, DONE);
      BlockId element = stack.pop();
      if (loop) {
        while (!element.equals(pVertex)) {
          depthFirstNumber.put(element, 0);
          element = stack.pop();
        }
        pPartition.addFirst(component(pVertex));
      } else {
        pPartition.addFirst(WtoComponent.vertex(pVertex));
      }
    }
    return head;
  }

  private WtoComponent component(BlockId pHead) {
    Deque<WtoComponent> partition = new ArrayDeque<>();
    for (BlockId successor : graph.successors(pHead)) {
      if (number(successor) == 0) {
        visit(successor, partition);
      }
    }
    return WtoComponent.scc(pHead, ImmutableList.copyOf(partition));
  }
}
