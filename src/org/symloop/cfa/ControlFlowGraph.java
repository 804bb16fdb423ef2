// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.cfa;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.ImmutableGraph;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.symloop.exec.CallFrame;
import org.symloop.exec.RegType;

/** The control-flow graph of one function, as handed to the loop-fixpoint engine. */
public final class ControlFlowGraph {

  private final String handle;
  private final BlockId entry;
  private final ImmutableMap<BlockId, Block> blocks;
  private final ImmutableGraph<BlockId> graph;
  private final ImmutableMap<BlockId, ImmutableList<RegType>> blockInputs;

  private ControlFlowGraph(String pHandle, BlockId pEntry, ImmutableMap<BlockId, Block> pBlocks) {
    handle = pHandle;
    entry = pEntry;
    blocks = pBlocks;

    ImmutableGraph.Builder<BlockId> builder =
        GraphBuilder.directed()
            .allowsSelfLoops(true)
            .nodeOrder(ElementOrder.<BlockId>insertion())
            .incidentEdgeOrder(ElementOrder.<BlockId>stable())
            .immutable();
    for (Block block : blocks.values()) {
      builder.addNode(block.getId());
      for (BlockId successor : block.getSuccessors()) {
        checkArgument(
            blocks.containsKey(successor),
            "%s jumps to unknown block %s",
            block.getId(),
            successor);
        builder.putEdge(block.getId(), successor);
      }
    }
    graph = builder.build();
    blockInputs = ImmutableMap.copyOf(Maps.transformValues(blocks, Block::getInputTypes));
  }

  public static Builder builder(String pHandle) {
    return new Builder(pHandle);
  }

  /** Identity of the function, compared against the handle of the executing call frame. */
  public String getHandle() {
    return handle;
  }

  public BlockId getEntry() {
    return entry;
  }

  public ImmutableMap<BlockId, Block> getBlocks() {
    return blocks;
  }

  public Block getBlock(BlockId pId) {
    Block block = blocks.get(pId);
    checkArgument(block != null, "unknown block %s", pId);
    return block;
  }

  public ImmutableGraph<BlockId> asGraph() {
    return graph;
  }

  public ImmutableMap<BlockId, ImmutableList<RegType>> getBlockInputs() {
    return blockInputs;
  }

  /** Whether the frame executes this function with the block signatures recorded here. */
  public boolean isExecutedBy(CallFrame pFrame) {
    return handle.equals(pFrame.getHandle()) && blockInputs.equals(pFrame.getBlockInputs());
  }

  /** A call frame for this function, as the host executor would create it. */
  public CallFrame newCallFrame() {
    return new CallFrame(handle, blockInputs);
  }

  @Override
  public String toString() {
    return handle + blocks.values();
  }

  public static final class Builder {
    private final String handle;
    private final Map<BlockId, Block> blocks = new LinkedHashMap<>();
    private @Nullable BlockId entry;

    private Builder(String pHandle) {
      handle = checkNotNull(pHandle);
    }

    /** Adds a block. The first block added is the entry block. */
    public Builder addBlock(
        BlockId pId, ImmutableList<RegType> pInputTypes, BlockId... pSuccessors) {
      checkArgument(!blocks.containsKey(pId), "duplicate block %s", pId);
      blocks.put(pId, new Block(pId, pInputTypes, ImmutableList.copyOf(pSuccessors)));
      if (entry == null) {
        entry = pId;
      }
      return this;
    }

    public ControlFlowGraph build() {
      checkState(entry != null, "control-flow graph without blocks");
      return new ControlFlowGraph(handle, entry, ImmutableMap.copyOf(blocks));
    }
  }
}
