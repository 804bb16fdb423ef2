// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exec;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.symloop.backend.AssumptionStack;
import org.symloop.memory.Memory;

/**
 * The state of the host executor at a notification: the active call frame with its registers, the
 * global variables holding memory, and the assumption store of the current path.
 *
 * <p>Registers and globals are replaced wholesale with the {@code with...} methods; the assumption
 * store is shared and mutated in place.
 */
public final class SimulationState {

  private final CallFrame frame;
  private final RegisterFile registers;
  private final ImmutableMap<GlobalVariable, Memory> globals;
  private final AssumptionStack assumptions;

  public SimulationState(
      CallFrame pFrame,
      RegisterFile pRegisters,
      ImmutableMap<GlobalVariable, Memory> pGlobals,
      AssumptionStack pAssumptions) {
    frame = checkNotNull(pFrame);
    registers = checkNotNull(pRegisters);
    globals = checkNotNull(pGlobals);
    assumptions = checkNotNull(pAssumptions);
  }

  public CallFrame getFrame() {
    return frame;
  }

  public RegisterFile getRegisters() {
    return registers;
  }

  public AssumptionStack getAssumptions() {
    return assumptions;
  }

  public Memory getGlobal(GlobalVariable pVariable) {
    Memory memory = globals.get(pVariable);
    checkState(memory != null, "global variable %s is not bound", pVariable);
    return memory;
  }

  public SimulationState withRegisters(RegisterFile pRegisters) {
    return new SimulationState(frame, pRegisters, globals, assumptions);
  }

  public SimulationState withGlobal(GlobalVariable pVariable, Memory pMemory) {
    Map<GlobalVariable, Memory> newGlobals = new LinkedHashMap<>(globals);
    newGlobals.put(pVariable, checkNotNull(pMemory));
    return new SimulationState(frame, registers, ImmutableMap.copyOf(newGlobals), assumptions);
  }

  @Override
  public String toString() {
    return frame + " " + registers;
  }
}
