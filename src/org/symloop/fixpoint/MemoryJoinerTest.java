// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.math.BigInteger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.BitvectorFormula;
import org.sosy_lab.java_smt.api.BitvectorFormulaManager;
import org.sosy_lab.java_smt.api.Formula;
import org.symloop.exceptions.FootprintChangedException;
import org.symloop.exceptions.OverlappingWritesException;
import org.symloop.exceptions.StructuralMismatchException;
import org.symloop.exceptions.UnsupportedJoinException;
import org.symloop.memory.Memory;
import org.symloop.memory.MemoryWrite;
import org.symloop.memory.MemoryWrites;
import org.symloop.memory.Pointer;
import org.symloop.memory.PoppedFrame;
import org.symloop.memory.SimpleMemory;
import org.symloop.memory.StorageType;
import org.symloop.memory.WriteChunk;
import org.symloop.util.smt.SymbolicContext;
import org.symloop.util.smt.SymbolicTestUtils;

public class MemoryJoinerTest {

  private static final StorageType INT = StorageType.bitvector(4);

  private SymbolicContext context;
  private BitvectorFormulaManager bvmgr;
  private MemoryJoiner joiner;
  private SimpleMemory header;

  @Before
  public void setUp() throws Exception {
    context = SymbolicTestUtils.newContext();
    bvmgr = context.getBitvectorFormulaManager();
    joiner = new MemoryJoiner(context, LogManager.createTestLogManager(), 64);
    header = SimpleMemory.empty(context, 64).store(cell(1, 0), INT, value(0));
  }

  @After
  public void tearDown() {
    context.close();
  }

  private Pointer cell(int pRegion, long pOffset) {
    return Pointer.of(pRegion, context.literal(64, pOffset));
  }

  private Pointer value(long pValue) {
    return Pointer.bitvector(context.literal(32, pValue));
  }

  private PoppedFrame bodyStoring(Pointer pPointer) {
    return header.pushStackFrame("fix").store(pPointer, INT, value(1)).popStackFrame();
  }

  @Test
  public void concreteStoreIsWidened() throws Exception {
    MemoryWidening widening = joiner.widen(bodyStoring(cell(1, 0)), MemoryWidening.empty());

    MemoryLocation location = new MemoryLocation(1, BigInteger.ZERO, 4);
    assertThat(widening.getLocations()).containsExactly(location);
    MemoryJoin join = widening.asMap().get(location);
    assertThat(join.getStorageType()).isEqualTo(INT);
    assertThat(bvmgr.getLength(join.getJoinVariable())).isEqualTo(32);
    assertThat(
            context.isVariableWithPrefix(join.getJoinVariable(), MemoryJoiner.MEMORY_JOIN_PREFIX))
        .isTrue();
  }

  @Test
  public void offsetsDenotingOneValueAreConcrete() throws Exception {
    BitvectorFormula four = bvmgr.add(context.literal(64, 2), context.literal(64, 2));
    MemoryWidening widening =
        joiner.widen(bodyStoring(Pointer.of(1, four)), MemoryWidening.empty());

    assertThat(widening.getLocations())
        .containsExactly(new MemoryLocation(1, BigInteger.valueOf(4), 4));
  }

  @Test
  public void repeatedStoresShareOneVariable() throws Exception {
    PoppedFrame body =
        header
            .pushStackFrame("fix")
            .store(cell(1, 0), INT, value(1))
            .store(cell(1, 0), INT, value(2))
            .popStackFrame();

    assertThat(joiner.widen(body, MemoryWidening.empty()).asMap()).hasSize(1);
  }

  @Test
  public void sameFootprintKeepsPreviousWidening() throws Exception {
    MemoryWidening first = joiner.widen(bodyStoring(cell(1, 0)), MemoryWidening.empty());
    MemoryWidening second = joiner.widen(bodyStoring(cell(1, 0)), first);

    assertThat(second).isSameInstanceAs(first);
  }

  @Test
  public void changedFootprintIsRejected() throws Exception {
    MemoryWidening first = joiner.widen(bodyStoring(cell(1, 0)), MemoryWidening.empty());
    assertThrows(
        FootprintChangedException.class, () -> joiner.widen(bodyStoring(cell(1, 4)), first));
  }

  @Test
  public void allocationInBodyIsRejected() {
    PoppedFrame body = header.pushStackFrame("fix").withAllocation().popStackFrame();
    assertThrows(
        StructuralMismatchException.class, () -> joiner.widen(body, MemoryWidening.empty()));
  }

  @Test
  public void bulkWriteIsRejected() {
    PoppedFrame body =
        new PoppedFrame(
            header,
            0,
            MemoryWrites.of(
                WriteChunk.indexed(ImmutableList.of(MemoryWrite.bulk(cell(1, 0), INT)))));
    assertThrows(
        UnsupportedJoinException.class, () -> joiner.widen(body, MemoryWidening.empty()));
  }

  @Test
  public void flatWriteChunkIsRejected() {
    PoppedFrame body =
        new PoppedFrame(
            header,
            0,
            MemoryWrites.of(WriteChunk.flat(ImmutableList.of(MemoryWrite.store(cell(1, 0), INT)))));
    assertThrows(
        StructuralMismatchException.class, () -> joiner.widen(body, MemoryWidening.empty()));
  }

  @Test
  public void symbolicWriteOverlappingHeaderIsRejected() {
    BitvectorFormula x = bvmgr.makeVariable(64, "x");
    assertThrows(
        OverlappingWritesException.class,
        () -> joiner.widen(bodyStoring(Pointer.of(1, x)), MemoryWidening.empty()));
  }

  @Test
  public void symbolicWriteIntoOtherRegionIsIgnored() throws Exception {
    BitvectorFormula x = bvmgr.makeVariable(64, "x");
    MemoryWidening widening =
        joiner.widen(bodyStoring(Pointer.of(2, x)), MemoryWidening.empty());

    assertThat(widening.isEmpty()).isTrue();
  }

  @Test
  public void storedJoinVariablesCanBeLoaded() throws Exception {
    MemoryWidening widening = joiner.widen(bodyStoring(cell(1, 0)), MemoryWidening.empty());
    Formula variable = Iterables.getOnlyElement(widening.asMap().values()).getJoinVariable();

    Memory widened = joiner.storeJoinVariables(header, widening, ImmutableMap.of());
    assertThat(joiner.loadJoinVariables(widened, widening)).containsExactly(variable, variable);
    assertThat(joiner.loadJoinVariables(header, widening))
        .containsExactly(variable, context.literal(32, 0));

    BitvectorFormula replacement = bvmgr.makeVariable(32, "final");
    Memory replaced =
        joiner.storeJoinVariables(header, widening, ImmutableMap.of(variable, replacement));
    assertThat(joiner.loadJoinVariables(replaced, widening))
        .containsExactly(variable, replacement);
  }

  @Test
  public void widenedCellHoldingPointerIsRejected() throws Exception {
    MemoryWidening widening = joiner.widen(bodyStoring(cell(1, 0)), MemoryWidening.empty());
    Memory memory = header.store(cell(1, 0), INT, cell(2, 0));

    assertThrows(
        UnsupportedJoinException.class, () -> joiner.loadJoinVariables(memory, widening));
  }

  @Test
  public void unreadableWidenedCellIsRejected() throws Exception {
    MemoryWidening widening = joiner.widen(bodyStoring(cell(1, 0)), MemoryWidening.empty());
    Memory empty = SimpleMemory.empty(context, 64);

    assertThrows(
        StructuralMismatchException.class, () -> joiner.loadJoinVariables(empty, widening));
  }
}
