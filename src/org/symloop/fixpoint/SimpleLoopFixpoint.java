// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.common.log.LogManagerWithoutDuplicates;
import org.sosy_lab.java_smt.api.BitvectorFormula;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.Formula;
import org.sosy_lab.java_smt.api.SolverException;
import org.symloop.backend.Assumption;
import org.symloop.backend.AssumptionStack;
import org.symloop.backend.FrameIdentifier;
import org.symloop.backend.ProofObligation;
import org.symloop.cfa.BlockId;
import org.symloop.cfa.ControlFlowGraph;
import org.symloop.cfa.LoopStructure;
import org.symloop.exceptions.FixpointException;
import org.symloop.exceptions.IdentificationFailureException;
import org.symloop.exceptions.StructuralMismatchException;
import org.symloop.exec.ExecutionFeature;
import org.symloop.exec.ExecutionFeatureResult;
import org.symloop.exec.GlobalVariable;
import org.symloop.exec.PausedFrame;
import org.symloop.exec.RegisterFile;
import org.symloop.exec.SimulationState;
import org.symloop.fixpoint.FixpointState.AfterFixpoint;
import org.symloop.fixpoint.FixpointState.BeforeFixpoint;
import org.symloop.fixpoint.FixpointState.CheckFixpoint;
import org.symloop.fixpoint.FixpointState.ComputeFixpoint;
import org.symloop.fixpoint.RegisterJoiner.JoinResult;
import org.symloop.fixpoint.SubstitutionRefiner.Unification;
import org.symloop.memory.Memory;
import org.symloop.memory.PoppedFrame;
import org.symloop.util.smt.SymbolicContext;

/**
 * Verifies a function with a single simple loop without unrolling the loop.
 *
 * <p>The loop body is executed repeatedly. At every visit of the loop header the live registers
 * and the memory written by the body are joined with the values at loop entry, until no new
 * widening variables are needed. The loop index and its bound are then read off the result, the
 * body is executed once more to check that the invariant is inductive, and the loop is finally
 * replaced by the summary the {@link FixpointFunction} provides.
 *
 * <p>Only loops with a single exit and a single induction variable with constant start and step
 * are supported; nested loops are rejected. Every failure aborts the path with a {@link
 * FixpointException}.
 */
@Options(prefix = "loopfixpoint")
public class SimpleLoopFixpoint implements ExecutionFeature {

  private static final String FIX_FRAME = "fix";

  @Option(secure = true, description = "Bit width of pointer offsets and of the loop index.")
  private int pointerWidth = 64;

  @Option(
      secure = true,
      description =
          "Abort when the loop state has not stabilized after this many joins. -1 for no limit.")
  private int maxWideningIterations = -1;

  private final SymbolicContext context;
  private final ControlFlowGraph cfg;
  private final LoopStructure loops;
  private final GlobalVariable memoryVariable;
  private final FixpointFunction fixpointFunction;
  private final LogManagerWithoutDuplicates logger;

  private final RegisterJoiner registerJoiner;
  private final MemoryJoiner memoryJoiner;
  private final SubstitutionRefiner refiner;
  private final LoopIndexBoundFinder boundFinder;

  private FixpointState state = BeforeFixpoint.INSTANCE;
  private int wideningIterations = 0;

  private SimpleLoopFixpoint(
      SymbolicContext pContext,
      ControlFlowGraph pCfg,
      LoopStructure pLoops,
      GlobalVariable pMemoryVariable,
      FixpointFunction pFixpointFunction,
      Configuration pConfig,
      LogManager pLogger)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    context = checkNotNull(pContext);
    cfg = checkNotNull(pCfg);
    loops = checkNotNull(pLoops);
    memoryVariable = checkNotNull(pMemoryVariable);
    fixpointFunction = checkNotNull(pFixpointFunction);
    logger = new LogManagerWithoutDuplicates(pLogger);

    registerJoiner = new RegisterJoiner(pContext, pConfig, pLogger);
    memoryJoiner = new MemoryJoiner(pContext, pLogger, pointerWidth);
    refiner = new SubstitutionRefiner(pContext);
    boundFinder = new LoopIndexBoundFinder(pContext, pConfig, pLogger, pointerWidth);
  }

  /**
   * Creates the feature for one function.
   *
   * @param pMemoryVariable the global variable holding the memory of the program
   * @param pFixpointFunction describes what the loop computes
   * @throws StructuralMismatchException if the function contains nested loops
   */
  public static SimpleLoopFixpoint create(
      SymbolicContext pContext,
      ControlFlowGraph pCfg,
      GlobalVariable pMemoryVariable,
      FixpointFunction pFixpointFunction,
      Configuration pConfig,
      LogManager pLogger)
      throws InvalidConfigurationException, StructuralMismatchException {
    LoopStructure loops = LoopStructure.of(pCfg);
    if (loops.hasNestedLoops()) {
      throw new StructuralMismatchException(
          "nested loops are not supported in " + pCfg.getHandle() + ": " + loops);
    }
    pLogger.log(Level.FINE, "Loops of", pCfg.getHandle() + ":", loops);
    return new SimpleLoopFixpoint(
        pContext, pCfg, loops, pMemoryVariable, pFixpointFunction, pConfig, pLogger);
  }

  public FixpointState getState() {
    return state;
  }

  @Override
  public ExecutionFeatureResult onBlockEntered(BlockId pBlock, SimulationState pState)
      throws FixpointException, SolverException, InterruptedException {
    if (!cfg.isExecutedBy(pState.getFrame())) {
      logger.logOnce(Level.FINEST, "Ignoring blocks of frame", pState.getFrame());
      return ExecutionFeatureResult.noChange();
    }
    if (!loops.isLoopHeader(pBlock)) {
      return ExecutionFeatureResult.noChange();
    }

    FixpointRecord record = state.getRecord();
    if (record != null && !record.getHeader().equals(pBlock)) {
      logger.log(Level.WARNING, "Entered loop header", pBlock, "while analyzing", record);
      throw new StructuralMismatchException(
          "only a single loop is supported, entered "
              + pBlock
              + " while analyzing the loop at "
              + record.getHeader());
    }

    if (state instanceof BeforeFixpoint) {
      return enterLoop((BeforeFixpoint) state, pBlock, pState);
    } else if (state instanceof ComputeFixpoint) {
      return computeFixpoint((ComputeFixpoint) state, pBlock, pState);
    } else if (state instanceof CheckFixpoint) {
      return checkFixpoint((CheckFixpoint) state, pBlock, pState);
    } else {
      checkState(
          !(state instanceof AfterFixpoint), "loop header %s entered after fixpoint", pBlock);
      throw new AssertionError("unknown fixpoint state " + state);
    }
  }

  private ExecutionFeatureResult enterLoop(
      BeforeFixpoint pCurrent, BlockId pHeader, SimulationState pState) {
    logger.log(Level.FINE, "BeforeFixpoint -> ComputeFixpoint at", pHeader);
    FrameIdentifier frame = pState.getAssumptions().pushFrame();
    Memory memory = pState.getGlobal(memoryVariable);
    state =
        pCurrent.enter(
            new FixpointRecord(
                pHeader,
                frame,
                Substitution.empty(),
                pState.getRegisters(),
                MemoryWidening.empty(),
                null));
    return ExecutionFeatureResult.modifiedState(
        pState.withGlobal(memoryVariable, memory.pushStackFrame(FIX_FRAME)));
  }

  private ExecutionFeatureResult computeFixpoint(
      ComputeFixpoint pCurrent, BlockId pHeader, SimulationState pState)
      throws FixpointException, SolverException, InterruptedException {
    FixpointRecord record = pCurrent.getRecord();
    logger.log(Level.FINE, "ComputeFixpoint at", pHeader);
    checkRegisterTypes(record, pState.getRegisters());
    AssumptionStack assumptions = pState.getAssumptions();
    assumptions.popFrameAndObligations(record.getAssumptionFrame());

    JoinResult join =
        registerJoiner.join(record.getRegisters(), pState.getRegisters(), record.getSubstitution());

    Memory bodyMemory = pState.getGlobal(memoryVariable);
    PoppedFrame bodyFrame = bodyMemory.popStackFrame();
    Memory headerMemory = bodyFrame.getMemory();
    MemoryWidening memoryWidening = memoryJoiner.widen(bodyFrame, record.getMemoryWidening());

    FrameIdentifier frame = assumptions.pushFrame();
    wideningIterations++;

    if (SubstitutionRefiner.sameVariables(join.getSubstitution(), record.getSubstitution())) {
      return reachFixpoint(
          pCurrent, pHeader, pState, join, bodyMemory, headerMemory, memoryWidening, frame);
    }

    if (maxWideningIterations >= 0 && wideningIterations >= maxWideningIterations) {
      logger.log(
          Level.WARNING, "Loop state did not stabilize after", wideningIterations, "joins");
      throw new StructuralMismatchException(
          "loop at " + pHeader + " did not stabilize after " + wideningIterations + " joins");
    }

    logger.log(
        Level.FINE,
        "ComputeFixpoint -> ComputeFixpoint with",
        join.getSubstitution().size(),
        "widening variables");
    Memory resultMemory =
        memoryJoiner.storeJoinVariables(
            headerMemory.pushStackFrame(FIX_FRAME), memoryWidening, ImmutableMap.of());
    state =
        pCurrent.widen(
            new FixpointRecord(
                pHeader,
                frame,
                join.getSubstitution(),
                join.getRegisters(),
                memoryWidening,
                null));
    return ExecutionFeatureResult.modifiedState(
        pState
            .withRegisters(join.getRegisters())
            .withGlobal(memoryVariable, resultMemory));
  }

  private ExecutionFeatureResult reachFixpoint(
      ComputeFixpoint pCurrent,
      BlockId pHeader,
      SimulationState pState,
      JoinResult pJoin,
      Memory pBodyMemory,
      Memory pHeaderMemory,
      MemoryWidening pMemoryWidening,
      FrameIdentifier pFrame)
      throws FixpointException, SolverException, InterruptedException {
    FixpointRecord record = pCurrent.getRecord();
    logger.log(
        Level.FINE,
        "ComputeFixpoint -> CheckFixpoint, loop condition",
        record.getLoopCondition());

    // memory cells enter the substitution only now
    ImmutableMap<Formula, Formula> headerValues =
        memoryJoiner.loadJoinVariables(pHeaderMemory, pMemoryWidening);
    ImmutableMap<Formula, Formula> bodyValues =
        memoryJoiner.loadJoinVariables(pBodyMemory, pMemoryWidening);
    Map<Formula, WideningEntry> memoryEntries = new LinkedHashMap<>();
    for (Map.Entry<Formula, Formula> header : headerValues.entrySet()) {
      memoryEntries.put(
          header.getKey(), new WideningEntry(header.getValue(), bodyValues.get(header.getKey())));
    }

    Unification unification =
        refiner.unifyEqual(
            refiner.filterLive(pJoin.getSubstitution().union(Substitution.of(memoryEntries))));
    ImmutableMap<Formula, Formula> equalities = unification.getEqualities();

    RegisterFile registers = registerJoiner.applySubstitution(equalities, pJoin.getRegisters());
    Memory memory =
        memoryJoiner.storeJoinVariables(
            pHeaderMemory.pushStackFrame(FIX_FRAME), pMemoryWidening, equalities);

    BooleanFormula condition = record.getLoopCondition();
    if (condition != null && unification.hasMergedVariables()) {
      condition = context.getFormulaManager().substitute(condition, equalities);
    }

    LoopIndexBound bound = boundFinder.findLoopIndexBound(unification.getSubstitution(), condition);
    assumeBound(pState.getAssumptions(), bound);

    state =
        pCurrent.stabilize(
            new FixpointRecord(
                pHeader,
                pFrame,
                unification.getSubstitution(),
                registers,
                pMemoryWidening,
                condition),
            bound);
    return ExecutionFeatureResult.modifiedState(
        pState.withRegisters(registers).withGlobal(memoryVariable, memory));
  }

  private ExecutionFeatureResult checkFixpoint(
      CheckFixpoint pCurrent, BlockId pHeader, SimulationState pState)
      throws FixpointException, SolverException, InterruptedException {
    FixpointRecord record = pCurrent.getRecord();
    LoopIndexBound bound = pCurrent.getBound();
    logger.log(Level.FINE, "CheckFixpoint -> AfterFixpoint at", pHeader);
    checkRegisterTypes(record, pState.getRegisters());
    AssumptionStack assumptions = pState.getAssumptions();

    WideningEntry indexEntry = record.getSubstitution().get(bound.getIndex());
    checkState(indexEntry != null, "loop index %s is not a widening variable", bound.getIndex());
    BitvectorFormula nextIndex = (BitvectorFormula) indexEntry.getBodyValue();
    assumptions.addProofObligation(
        new ProofObligation(
            boundFinder.boundCondition(nextIndex, bound.getStop()),
            "loop index stays below its bound"));
    assumptions.popFrame(record.getAssumptionFrame());

    Memory bodyMemory = pState.getGlobal(memoryVariable);
    Memory headerMemory = bodyMemory.popStackFrame().getMemory();
    ImmutableMap<Formula, Formula> bodyValues =
        memoryJoiner.loadJoinVariables(bodyMemory, record.getMemoryWidening());
    Substitution substitution =
        record
            .getSubstitution()
            .mapEntries(
                entry -> {
                  Formula body = bodyValues.get(entry.getKey());
                  return body == null ? entry.getValue() : entry.getValue().withBodyValue(body);
                });

    BooleanFormula condition = record.getLoopCondition();
    if (condition == null) {
      throw new IdentificationFailureException(
          "no loop condition recorded when checking the fixpoint");
    }
    FixpointResult result = fixpointFunction.summarize(substitution, condition);
    logger.log(Level.FINE, "Loop summary", result);
    assumptions.addProofObligation(
        new ProofObligation(result.getResidualCondition(), "loop summary holds"));

    ImmutableMap<Formula, Formula> equalities = result.getEqualities();
    RegisterFile registers = registerJoiner.applySubstitution(equalities, record.getRegisters());
    Memory memory =
        memoryJoiner.storeJoinVariables(headerMemory, record.getMemoryWidening(), equalities);

    Formula newIndex = equalities.getOrDefault(bound.getIndex(), bound.getIndex());
    if (!(newIndex instanceof BitvectorFormula)) {
      throw new StructuralMismatchException(
          "loop index " + bound.getIndex() + " replaced by non-bit-vector " + newIndex);
    }
    LoopIndexBound newBound = bound.withIndex((BitvectorFormula) newIndex);
    assumeBound(assumptions, newBound);

    state = pCurrent.conclude(record.withSubstitution(substitution), newBound);
    return ExecutionFeatureResult.modifiedState(
        pState.withRegisters(registers).withGlobal(memoryVariable, memory));
  }

  private void assumeBound(AssumptionStack pAssumptions, LoopIndexBound pBound) {
    pAssumptions.addAssumption(
        Assumption.generic(
            boundFinder.boundCondition(pBound.getIndex(), pBound.getStop()), "loop index bound"));
    pAssumptions.addAssumption(
        Assumption.generic(boundFinder.startStepCondition(pBound), "loop index stride"));
  }

  private static void checkRegisterTypes(FixpointRecord pRecord, RegisterFile pRegisters)
      throws StructuralMismatchException {
    if (!pRecord.getRegisters().getTypes().equals(pRegisters.getTypes())) {
      throw new StructuralMismatchException(
          "register types at " + pRecord.getHeader() + " changed to " + pRegisters.getTypes());
    }
  }

  @Override
  public ExecutionFeatureResult onSymbolicBranch(
      BooleanFormula pCondition,
      PausedFrame pTrueFrame,
      PausedFrame pFalseFrame,
      SimulationState pState) {
    FixpointRecord record = state.getRecord();
    if (record == null || !cfg.isExecutedBy(pState.getFrame())) {
      return ExecutionFeatureResult.noChange();
    }
    Optional<BlockId> trueTarget = pTrueFrame.getTarget();
    Optional<BlockId> falseTarget = pFalseFrame.getTarget();
    if (trueTarget.isEmpty() || falseTarget.isEmpty()) {
      return ExecutionFeatureResult.noChange();
    }
    ImmutableList<BlockId> body = loops.getLoopBody(record.getHeader());
    boolean trueStays = body.contains(trueTarget.orElseThrow());
    if (trueStays == body.contains(falseTarget.orElseThrow())) {
      return ExecutionFeatureResult.noChange();
    }

    BooleanFormula loopCondition =
        trueStays ? pCondition : context.getBooleanFormulaManager().not(pCondition);
    PausedFrame inside = trueStays ? pTrueFrame : pFalseFrame;
    PausedFrame outside = trueStays ? pFalseFrame : pTrueFrame;

    BooleanFormula assumed;
    PausedFrame resumed;
    if (state instanceof ComputeFixpoint) {
      logger.log(Level.FINE, "Loop branch in ComputeFixpoint, staying in the loop");
      if (record.getLoopCondition() == null) {
        state = ((ComputeFixpoint) state).withLoopCondition(loopCondition);
      }
      assumed = loopCondition;
      resumed = inside;
    } else if (state instanceof CheckFixpoint) {
      logger.log(Level.FINE, "Loop branch in CheckFixpoint, staying in the loop");
      assumed = loopCondition;
      resumed = inside;
    } else {
      logger.log(Level.FINE, "Loop branch in AfterFixpoint, leaving the loop");
      assumed = context.getBooleanFormulaManager().not(loopCondition);
      resumed = outside;
    }

    pState.getAssumptions().addAssumption(Assumption.branchCondition(assumed, resumed.getLabel()));
    return ExecutionFeatureResult.resumeFrame(resumed, pState);
  }
}
