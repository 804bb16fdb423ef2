// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.BitvectorFormula;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.Formula;
import org.sosy_lab.java_smt.api.SolverException;
import org.symloop.exceptions.FootprintChangedException;
import org.symloop.exceptions.MemoryAccessException;
import org.symloop.exceptions.OverlappingWritesException;
import org.symloop.exceptions.StructuralMismatchException;
import org.symloop.exceptions.UnsupportedJoinException;
import org.symloop.memory.Memory;
import org.symloop.memory.MemoryWrite;
import org.symloop.memory.MemoryWrites;
import org.symloop.memory.Pointer;
import org.symloop.memory.PoppedFrame;
import org.symloop.memory.StorageType;
import org.symloop.memory.WriteChunk;
import org.symloop.memory.WriteRange;
import org.symloop.util.smt.SymbolicContext;

/**
 * Widens the memory written by a loop body.
 *
 * <p>Every store at an offset that denotes a single value gets a join variable of the width of
 * the stored value. Stores at symbolic offsets are not widened; they must be disjoint from every
 * range that was written before the loop. The set of widened cells has to be the same in every
 * iteration.
 */
public class MemoryJoiner {

  static final String MEMORY_JOIN_PREFIX = "mem_join_var";

  private final SymbolicContext context;
  private final LogManager logger;
  private final int pointerWidth;

  public MemoryJoiner(SymbolicContext pContext, LogManager pLogger, int pPointerWidth) {
    context = checkNotNull(pContext);
    logger = checkNotNull(pLogger);
    pointerWidth = pPointerWidth;
  }

  /**
   * Computes the widening for the writes of one execution of the loop body.
   *
   * @param pBodyFrame the memory frame of the loop body, already popped; its remaining memory is
   *     the memory at the loop header
   * @param pPrevious the widening of the previous iteration, empty if there was none
   * @return the previous widening if one exists and covers the same cells, otherwise the new one
   */
  public MemoryWidening widen(PoppedFrame pBodyFrame, MemoryWidening pPrevious)
      throws StructuralMismatchException, UnsupportedJoinException, OverlappingWritesException,
          FootprintChangedException, SolverException, InterruptedException {
    if (pBodyFrame.getAllocationCount() != 0) {
      throw new StructuralMismatchException(
          "unsupported memory allocation in loop body ("
              + pBodyFrame.getAllocationCount()
              + " allocations)");
    }

    Memory headerMemory = pBodyFrame.getMemory();
    SortedMap<MemoryLocation, MemoryJoin> candidate = new TreeMap<>();
    for (MemoryWrite write : writesOf(pBodyFrame.getWrites())) {
      if (write.getKind() != MemoryWrite.Kind.STORE) {
        throw new UnsupportedJoinException("cannot widen memory write " + write);
      }
      Pointer pointer = write.getPointer();
      StorageType type = write.getStorageType();
      Optional<BigInteger> offset = context.asConstant(pointer.getOffset());
      if (offset.isPresent()) {
        MemoryLocation location =
            new MemoryLocation(pointer.getRegion(), offset.orElseThrow(), type.getSize());
        if (!candidate.containsKey(location)) {
          BitvectorFormula joinVariable =
              context.freshBitvector(MEMORY_JOIN_PREFIX, type.getBitWidth());
          logger.log(Level.FINEST, "Introducing", joinVariable, "for memory cell", location);
          candidate.put(location, new MemoryJoin(joinVariable, type));
        }
      } else {
        checkDisjointFromHeader(headerMemory, pointer, type);
      }
    }

    if (pPrevious.isEmpty()) {
      return MemoryWidening.of(candidate);
    }
    if (!pPrevious.getLocations().equals(candidate.keySet())) {
      logger.log(
          Level.WARNING,
          "Loop body wrote to",
          candidate.keySet(),
          "after writing to",
          pPrevious.getLocations());
      throw new FootprintChangedException(
          "memory cells written by the loop body changed from "
              + pPrevious.getLocations()
              + " to "
              + candidate.keySet());
    }
    return pPrevious;
  }

  private static Iterable<MemoryWrite> writesOf(MemoryWrites pWrites)
      throws StructuralMismatchException {
    if (pWrites.isEmpty()) {
      return ImmutableList.of();
    }
    if (pWrites.getChunks().size() != 1 || !pWrites.getChunks().get(0).isIndexed()) {
      throw new StructuralMismatchException(
          "memory writes of the loop body are not a single indexed chunk: " + pWrites);
    }
    WriteChunk chunk = pWrites.getChunks().get(0);
    return chunk.getWrites();
  }

  private void checkDisjointFromHeader(Memory pHeaderMemory, Pointer pPointer, StorageType pType)
      throws OverlappingWritesException, SolverException, InterruptedException {
    BitvectorFormula size = context.literal(pointerWidth, pType.getSize());
    for (WriteRange range : pHeaderMemory.writeRanges().get(pPointer.getRegion())) {
      BooleanFormula disjoint =
          pHeaderMemory.disjointRegions(
              pPointer, size, Pointer.of(pPointer.getRegion(), range.getOffset()), range.getSize());
      if (!context.isValid(disjoint)) {
        logger.log(Level.WARNING, "Symbolic write", pPointer, "may overlap", range);
        throw new OverlappingWritesException(
            "non-disjoint ranges: off1="
                + pPointer.getOffset()
                + ", sz1="
                + size
                + ", off2="
                + range.getOffset()
                + ", sz2="
                + range.getSize());
      }
    }
  }

  /**
   * Reads the current value of every widened cell.
   *
   * @return a map from join variable to the value stored in its cell
   */
  public ImmutableMap<Formula, Formula> loadJoinVariables(Memory pMemory, MemoryWidening pWidening)
      throws StructuralMismatchException, UnsupportedJoinException {
    ImmutableMap.Builder<Formula, Formula> values = ImmutableMap.builder();
    for (Map.Entry<MemoryLocation, MemoryJoin> entry : pWidening.asMap().entrySet()) {
      MemoryJoin join = entry.getValue();
      Pointer value;
      try {
        value = pMemory.load(pointerTo(entry.getKey()), join.getStorageType());
      } catch (MemoryAccessException e) {
        throw new StructuralMismatchException(
            "widened memory cell " + entry.getKey() + " cannot be read", e);
      }
      if (!value.isBitvector()) {
        throw new UnsupportedJoinException(
            "widened memory cell " + entry.getKey() + " holds a pointer " + value);
      }
      values.put(join.getJoinVariable(), value.getOffset());
    }
    return values.buildOrThrow();
  }

  /**
   * Stores into every widened cell its join variable, or the value the equality substitution
   * assigns to it.
   */
  public Memory storeJoinVariables(
      Memory pMemory,
      MemoryWidening pWidening,
      Map<? extends Formula, ? extends Formula> pEqualities)
      throws StructuralMismatchException {
    Memory result = pMemory;
    for (Map.Entry<MemoryLocation, MemoryJoin> entry : pWidening.asMap().entrySet()) {
      MemoryJoin join = entry.getValue();
      Formula value = pEqualities.get(join.getJoinVariable());
      if (value == null) {
        value = join.getJoinVariable();
      } else if (!(value instanceof BitvectorFormula)) {
        throw new StructuralMismatchException(
            "join variable " + join.getJoinVariable() + " replaced by non-bit-vector " + value);
      }
      result =
          result.store(
              pointerTo(entry.getKey()),
              join.getStorageType(),
              Pointer.bitvector((BitvectorFormula) value));
    }
    return result;
  }

  private Pointer pointerTo(MemoryLocation pLocation) {
    return Pointer.of(pLocation.getRegion(), context.literal(pointerWidth, pLocation.getOffset()));
  }
}
