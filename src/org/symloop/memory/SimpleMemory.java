// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.memory;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import org.sosy_lab.java_smt.api.BitvectorFormula;
import org.sosy_lab.java_smt.api.BitvectorFormulaManager;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;
import org.symloop.exceptions.MemoryAccessException;
import org.symloop.util.smt.SymbolicContext;

/**
 * A small persistent memory model: a stack of frames, each holding an indexed log of the stores
 * performed while it was on top.
 *
 * <p>Cells are identified by region, offset and size. A load returns the most recent store to a
 * cell whose offset is syntactically equal to the loaded one; partially overlapping accesses are
 * not modelled.
 */
public final class SimpleMemory implements Memory {

  private static final String BASE_FRAME = "base";

  private static final class Cell {
    private final MemoryWrite write;
    private final Pointer value;

    private Cell(MemoryWrite pWrite, Pointer pValue) {
      write = pWrite;
      value = pValue;
    }
  }

  private static final class Frame {
    private final String name;
    private final ImmutableList<Cell> cells;
    private final int allocations;

    private Frame(String pName, ImmutableList<Cell> pCells, int pAllocations) {
      name = pName;
      cells = pCells;
      allocations = pAllocations;
    }

    private Frame withCell(Cell pCell) {
      return new Frame(
          name, ImmutableList.<Cell>builder().addAll(cells).add(pCell).build(), allocations);
    }

    private Frame withAllocation() {
      return new Frame(name, cells, allocations + 1);
    }
  }

  private final SymbolicContext context;
  private final int pointerWidth;
  // bottom frame first
  private final ImmutableList<Frame> frames;

  private SimpleMemory(SymbolicContext pContext, int pPointerWidth, ImmutableList<Frame> pFrames) {
    context = checkNotNull(pContext);
    pointerWidth = pPointerWidth;
    frames = pFrames;
  }

  public static SimpleMemory empty(SymbolicContext pContext, int pPointerWidth) {
    return new SimpleMemory(
        pContext, pPointerWidth, ImmutableList.of(new Frame(BASE_FRAME, ImmutableList.of(), 0)));
  }

  private SimpleMemory withTopFrame(Frame pFrame) {
    return new SimpleMemory(
        context,
        pointerWidth,
        ImmutableList.<Frame>builder()
            .addAll(frames.subList(0, frames.size() - 1))
            .add(pFrame)
            .build());
  }

  private Frame topFrame() {
    return frames.get(frames.size() - 1);
  }

  public int getStackDepth() {
    return frames.size() - 1;
  }

  /** Records an allocation in the current frame. */
  public SimpleMemory withAllocation() {
    return withTopFrame(topFrame().withAllocation());
  }

  @Override
  public SimpleMemory pushStackFrame(String pName) {
    return new SimpleMemory(
        context,
        pointerWidth,
        ImmutableList.<Frame>builder()
            .addAll(frames)
            .add(new Frame(pName, ImmutableList.of(), 0))
            .build());
  }

  @Override
  public PoppedFrame popStackFrame() {
    checkState(frames.size() > 1, "not a stack frame: only the base frame is left");
    Frame top = topFrame();
    SimpleMemory rest =
        new SimpleMemory(context, pointerWidth, frames.subList(0, frames.size() - 1));
    MemoryWrites writes =
        top.cells.isEmpty()
            ? MemoryWrites.empty()
            : MemoryWrites.of(
                WriteChunk.indexed(
                    top.cells.stream()
                        .map(cell -> cell.write)
                        .collect(ImmutableList.toImmutableList())));
    return new PoppedFrame(rest, top.allocations, writes);
  }

  @Override
  public Pointer load(Pointer pPointer, StorageType pType) throws MemoryAccessException {
    for (Frame frame : frames.reverse()) {
      for (Cell cell : frame.cells.reverse()) {
        if (cell.write.getPointer().equals(pPointer)
            && cell.write.getStorageType().equals(pType)) {
          return cell.value;
        }
      }
    }
    throw new MemoryAccessException("load of " + pType + " from uninitialized cell " + pPointer);
  }

  @Override
  public SimpleMemory store(Pointer pPointer, StorageType pType, Pointer pValue) {
    return withTopFrame(topFrame().withCell(new Cell(MemoryWrite.store(pPointer, pType), pValue)));
  }

  @Override
  public ImmutableListMultimap<Integer, WriteRange> writeRanges() {
    ImmutableListMultimap.Builder<Integer, WriteRange> ranges = ImmutableListMultimap.builder();
    for (Frame frame : frames) {
      for (Cell cell : frame.cells) {
        Pointer pointer = cell.write.getPointer();
        ranges.put(
            pointer.getRegion(),
            new WriteRange(
                pointer.getOffset(),
                context.literal(pointerWidth, cell.write.getStorageType().getSize())));
      }
    }
    return ranges.build();
  }

  @Override
  public BooleanFormula disjointRegions(
      Pointer pFirst, BitvectorFormula pFirstSize, Pointer pSecond, BitvectorFormula pSecondSize) {
    BooleanFormulaManager bmgr = context.getBooleanFormulaManager();
    if (pFirst.getRegion() != pSecond.getRegion()) {
      return bmgr.makeTrue();
    }
    BitvectorFormulaManager bvmgr = context.getBitvectorFormulaManager();
    BitvectorFormula firstEnd = bvmgr.add(pFirst.getOffset(), pFirstSize);
    BitvectorFormula secondEnd = bvmgr.add(pSecond.getOffset(), pSecondSize);
    return bmgr.or(
        bvmgr.lessOrEquals(firstEnd, pSecond.getOffset(), false),
        bvmgr.lessOrEquals(secondEnd, pFirst.getOffset(), false));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Frame frame : frames) {
      sb.append(frame.name).append(':');
      for (Cell cell : frame.cells) {
        sb.append(' ').append(cell.write.getPointer()).append(" := ").append(cell.value);
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
