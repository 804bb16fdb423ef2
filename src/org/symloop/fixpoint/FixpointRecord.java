// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.symloop.backend.FrameIdentifier;
import org.symloop.cfa.BlockId;
import org.symloop.exec.RegisterFile;

/** What is known about the loop under analysis at one point of the fixpoint computation. */
public final class FixpointRecord {

  private final BlockId header;
  private final FrameIdentifier assumptionFrame;
  private final Substitution substitution;
  private final RegisterFile registers;
  private final MemoryWidening memoryWidening;
  private final @Nullable BooleanFormula loopCondition;

  public FixpointRecord(
      BlockId pHeader,
      FrameIdentifier pAssumptionFrame,
      Substitution pSubstitution,
      RegisterFile pRegisters,
      MemoryWidening pMemoryWidening,
      @Nullable BooleanFormula pLoopCondition) {
    header = checkNotNull(pHeader);
    assumptionFrame = checkNotNull(pAssumptionFrame);
    substitution = checkNotNull(pSubstitution);
    registers = checkNotNull(pRegisters);
    memoryWidening = checkNotNull(pMemoryWidening);
    loopCondition = pLoopCondition;
  }

  public BlockId getHeader() {
    return header;
  }

  /** The assumption frame opened by the last transition at the loop header. */
  public FrameIdentifier getAssumptionFrame() {
    return assumptionFrame;
  }

  public Substitution getSubstitution() {
    return substitution;
  }

  /** The registers the loop body was last started with. */
  public RegisterFile getRegisters() {
    return registers;
  }

  public MemoryWidening getMemoryWidening() {
    return memoryWidening;
  }

  /** The condition that keeps execution in the loop, if the loop branch was seen already. */
  public @Nullable BooleanFormula getLoopCondition() {
    return loopCondition;
  }

  public FixpointRecord withSubstitution(Substitution pSubstitution) {
    return new FixpointRecord(
        header, assumptionFrame, pSubstitution, registers, memoryWidening, loopCondition);
  }

  public FixpointRecord withLoopCondition(BooleanFormula pLoopCondition) {
    return new FixpointRecord(
        header, assumptionFrame, substitution, registers, memoryWidening, pLoopCondition);
  }

  @Override
  public String toString() {
    return "loop at "
        + header
        + " with "
        + substitution.size()
        + " widening variables and "
        + memoryWidening.getLocations().size()
        + " widened cells";
  }
}
