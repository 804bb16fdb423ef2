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
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.BitvectorFormula;
import org.sosy_lab.java_smt.api.BitvectorFormulaManager;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;
import org.sosy_lab.java_smt.api.Formula;
import org.sosy_lab.java_smt.api.FormulaManager;
import org.symloop.backend.Assumption;
import org.symloop.backend.DefaultAssumptionStack;
import org.symloop.backend.ProofGoal;
import org.symloop.cfa.BlockId;
import org.symloop.cfa.ControlFlowGraph;
import org.symloop.exceptions.FootprintChangedException;
import org.symloop.exceptions.OverlappingWritesException;
import org.symloop.exceptions.StructuralMismatchException;
import org.symloop.exec.CallFrame;
import org.symloop.exec.ExecutionFeatureResult;
import org.symloop.exec.ExecutionFeatureResult.Kind;
import org.symloop.exec.GlobalVariable;
import org.symloop.exec.PausedFrame;
import org.symloop.exec.RegEntry;
import org.symloop.exec.RegType;
import org.symloop.exec.RegValue;
import org.symloop.exec.RegValue.PointerValue;
import org.symloop.exec.RegisterFile;
import org.symloop.exec.SimulationState;
import org.symloop.fixpoint.FixpointState.AfterFixpoint;
import org.symloop.fixpoint.FixpointState.BeforeFixpoint;
import org.symloop.fixpoint.FixpointState.CheckFixpoint;
import org.symloop.fixpoint.FixpointState.ComputeFixpoint;
import org.symloop.memory.Memory;
import org.symloop.memory.Pointer;
import org.symloop.memory.SimpleMemory;
import org.symloop.memory.StorageType;
import org.symloop.util.smt.SymbolicContext;
import org.symloop.util.smt.SymbolicTestUtils;

/**
 * Runs the feature the way a symbolic executor would on
 *
 * <pre>
 *   B0: goto B1
 *   B1: if (i &lt; n) goto B2 else goto B3
 *   B2: ...; goto B1
 *   B3: return
 * </pre>
 */
public class SimpleLoopFixpointTest {

  private static final BlockId ENTRY = BlockId.of(0);
  private static final BlockId HEADER = BlockId.of(1);
  private static final BlockId BODY = BlockId.of(2);
  private static final BlockId EXIT = BlockId.of(3);

  private static final GlobalVariable MEMORY = new GlobalVariable("memory");
  private static final RegType WORD = RegType.pointer(64);
  private static final StorageType INT = StorageType.bitvector(4);

  /** One execution of the loop body. */
  private interface LoopBody {
    SimulationState execute(SimulationState pState) throws Exception;
  }

  private SymbolicContext context;
  private BitvectorFormulaManager bvmgr;
  private BooleanFormulaManager bmgr;
  private DefaultAssumptionStack assumptions;
  private BitvectorFormula n;
  private BooleanFormula summaryHolds;

  private @Nullable FixpointResult summary;

  @Before
  public void setUp() throws Exception {
    context = SymbolicTestUtils.newContext();
    bvmgr = context.getBitvectorFormulaManager();
    bmgr = context.getBooleanFormulaManager();
    assumptions = new DefaultAssumptionStack(bmgr);
    n = bvmgr.makeVariable(64, "n");
    summaryHolds = bmgr.makeVariable("summary_holds");
  }

  @After
  public void tearDown() {
    context.close();
  }

  private static ControlFlowGraph loop(ImmutableList<RegType> pHeaderInputs) {
    return ControlFlowGraph.builder("f")
        .addBlock(ENTRY, ImmutableList.of(), HEADER)
        .addBlock(HEADER, pHeaderInputs, BODY, EXIT)
        .addBlock(BODY, ImmutableList.of(), HEADER)
        .addBlock(EXIT, ImmutableList.of())
        .build();
  }

  /** Replaces every widening variable by a fresh variable, under a side condition. */
  private FixpointResult summarize(Substitution pSubstitution, BooleanFormula pCondition) {
    ImmutableMap.Builder<Formula, Formula> equalities = ImmutableMap.builder();
    for (Formula variable : pSubstitution.variables()) {
      int width = bvmgr.getLength((BitvectorFormula) variable);
      equalities.put(variable, context.freshBitvector("final", width));
    }
    summary = new FixpointResult(equalities.buildOrThrow(), summaryHolds);
    return summary;
  }

  private SimpleLoopFixpoint newFeature(ControlFlowGraph pCfg, Configuration pConfig)
      throws Exception {
    return SimpleLoopFixpoint.create(
        context, pCfg, MEMORY, this::summarize, pConfig, LogManager.createTestLogManager());
  }

  private SimulationState initialState(CallFrame pFrame, RegisterFile pRegisters, Memory pMemory) {
    return new SimulationState(pFrame, pRegisters, ImmutableMap.of(MEMORY, pMemory), assumptions);
  }

  private static RegEntry word(BitvectorFormula pValue) {
    return new RegEntry(WORD, RegValue.pointer(Pointer.bitvector(pValue)));
  }

  private static BitvectorFormula wordAt(SimulationState pState, int pIndex) {
    return ((PointerValue) pState.getRegisters().get(pIndex).getValue()).getPointer().getOffset();
  }

  /** Registers i, sum, n. The body executes {@code sum += i; i += step}. */
  private LoopBody sumLoopBody(long pStep) {
    return state -> {
      BitvectorFormula i = wordAt(state, 0);
      BitvectorFormula sum = wordAt(state, 1);
      return state.withRegisters(
          RegisterFile.of(
              word(SymbolicTestUtils.add(context, i, context.literal(64, pStep))),
              word(SymbolicTestUtils.add(context, sum, i)),
              word(wordAt(state, 2))));
    };
  }

  private boolean equivalent(BooleanFormula pFirst, BooleanFormula pSecond) throws Exception {
    return context.isValid(bmgr.equivalence(pFirst, pSecond));
  }

  private SimulationState sumLoopStart(ControlFlowGraph pCfg) {
    return initialState(
        pCfg.newCallFrame(),
        RegisterFile.of(word(context.literal(64, 0)), word(context.literal(64, 0)), word(n)),
        SimpleMemory.empty(context, 64));
  }

  private static ControlFlowGraph sumLoop() {
    return loop(ImmutableList.of(WORD, WORD, WORD));
  }

  /** Drives the loop until it is left, returning the state of the feature after each header. */
  private final class Executor {
    private final SimpleLoopFixpoint feature;
    private final int indexRegister;
    private final int boundRegister;
    private final LoopBody body;
    private SimulationState state;
    private final List<FixpointState> states = new ArrayList<>();

    private Executor(
        SimpleLoopFixpoint pFeature,
        SimulationState pState,
        int pIndexRegister,
        int pBoundRegister,
        LoopBody pBody) {
      feature = pFeature;
      state = pState;
      indexRegister = pIndexRegister;
      boundRegister = pBoundRegister;
      body = pBody;
    }

    private void enterHeader() throws Exception {
      ExecutionFeatureResult result = feature.onBlockEntered(HEADER, state);
      if (result.getKind() == Kind.MODIFIED_STATE) {
        state = result.getState();
      }
      states.add(feature.getState());
    }

    /** Evaluates the header branch, returns whether execution continues in the body. */
    private boolean branch() throws Exception {
      BooleanFormula condition =
          bvmgr.lessThan(wordAt(state, indexRegister), wordAt(state, boundRegister), false);
      ExecutionFeatureResult result =
          feature.onSymbolicBranch(
              condition, PausedFrame.jumpTo(BODY), PausedFrame.jumpTo(EXIT), state);
      assertThat(result.getKind()).isEqualTo(Kind.RESUME_FRAME);
      state = result.getState();
      return result.getFrame().getTarget().orElseThrow().equals(BODY);
    }

    private void run() throws Exception {
      assertThat(feature.onBlockEntered(ENTRY, state).getKind()).isEqualTo(Kind.NO_CHANGE);
      for (int visit = 0; visit < 10; visit++) {
        enterHeader();
        if (!branch()) {
          return;
        }
        state = body.execute(state);
      }
      throw new AssertionError("loop was not left after 10 iterations: " + states);
    }
  }

  @Test
  public void sumLoopIsSummarized() throws Exception {
    ControlFlowGraph cfg = sumLoop();
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    Executor executor = new Executor(feature, sumLoopStart(cfg), 0, 2, sumLoopBody(1));

    executor.run();

    assertThat(executor.states).hasSize(5);
    assertThat(executor.states.get(0)).isInstanceOf(ComputeFixpoint.class);
    assertThat(executor.states.get(1)).isInstanceOf(ComputeFixpoint.class);
    assertThat(executor.states.get(2)).isInstanceOf(ComputeFixpoint.class);
    assertThat(executor.states.get(3)).isInstanceOf(CheckFixpoint.class);
    assertThat(executor.states.get(4)).isInstanceOf(AfterFixpoint.class);

    CheckFixpoint check = (CheckFixpoint) executor.states.get(3);
    LoopIndexBound bound = check.getBound();
    assertThat(bound.getStart()).isEqualTo(BigInteger.ZERO);
    assertThat(bound.getStep()).isEqualTo(BigInteger.ONE);
    assertThat(context.isValid(bvmgr.equal(bound.getStop(), n))).isTrue();
    assertThat(check.getRecord().getSubstitution().size()).isEqualTo(2);

    Map<Formula, Formula> equalities = summary.getEqualities();
    SimulationState last = executor.state;
    assertThat(wordAt(last, 0)).isEqualTo(equalities.get(bound.getIndex()));
    assertThat(equalities.values()).contains(wordAt(last, 1));
    assertThat(wordAt(last, 2)).isEqualTo(n);

    AfterFixpoint after = (AfterFixpoint) feature.getState();
    assertThat(after.getBound().getIndex()).isEqualTo(equalities.get(bound.getIndex()));

    assertThat(assumptions.getDepth()).isEqualTo(0);
    assertThat(((SimpleMemory) last.getGlobal(MEMORY)).getStackDepth()).isEqualTo(0);
  }

  @Test
  public void checkEmitsInductivenessAndSummaryGoals() throws Exception {
    ControlFlowGraph cfg = sumLoop();
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    Executor executor = new Executor(feature, sumLoopStart(cfg), 0, 2, sumLoopBody(1));

    executor.run();

    BitvectorFormula index = ((CheckFixpoint) executor.states.get(3)).getBound().getIndex();
    ImmutableList<ProofGoal> goals = assumptions.getProofGoals();
    assertThat(goals).hasSize(2);

    ProofGoal inductive = goals.get(0);
    BooleanFormula nextIndexBelowBound =
        bvmgr.lessThan(bvmgr.add(index, context.literal(64, 1)), n, false);
    assertThat(equivalent(inductive.getObligation().getPredicate(), nextIndexBelowBound))
        .isTrue();
    assertThat(
            context.isValid(
                bmgr.implication(
                    bmgr.and(inductive.getAssumptions()), bvmgr.lessThan(index, n, false))))
        .isTrue();

    ProofGoal summaryGoal = goals.get(1);
    assertThat(summaryGoal.getObligation().getPredicate()).isEqualTo(summaryHolds);
  }

  @Test
  public void afterFixpointAssumesBoundAndLeavesLoop() throws Exception {
    ControlFlowGraph cfg = sumLoop();
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    Executor executor = new Executor(feature, sumLoopStart(cfg), 0, 2, sumLoopBody(1));

    executor.run();

    BitvectorFormula finalIndex = ((AfterFixpoint) feature.getState()).getBound().getIndex();
    BooleanFormula finalIndexBelowBound = bvmgr.lessThan(finalIndex, n, false);
    ImmutableList<Assumption> remaining = assumptions.getAssumptions();
    assertThat(remaining).hasSize(3);

    assertThat(remaining.get(0).getDescription()).isEqualTo("loop index bound");
    assertThat(equivalent(remaining.get(0).getPredicate(), finalIndexBelowBound)).isTrue();
    assertThat(remaining.get(1).getDescription()).isEqualTo("loop index stride");

    Assumption exit = remaining.get(2);
    assertThat(exit.getKind()).isEqualTo(Assumption.Kind.BRANCH_CONDITION);
    assertThat(exit.getDescription()).isEqualTo("branch to " + PausedFrame.jumpTo(EXIT).getLabel());
    assertThat(equivalent(exit.getPredicate(), bmgr.not(finalIndexBelowBound))).isTrue();
  }

  @Test
  public void strideIsAssumedForFinalIndex() throws Exception {
    ControlFlowGraph cfg = sumLoop();
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    Executor executor = new Executor(feature, sumLoopStart(cfg), 0, 2, sumLoopBody(2));

    executor.run();

    LoopIndexBound bound = ((AfterFixpoint) feature.getState()).getBound();
    assertThat(bound.getStep()).isEqualTo(BigInteger.valueOf(2));
    Assumption stride = assumptions.getAssumptions().get(1);
    assertThat(stride.getDescription()).isEqualTo("loop index stride");

    FormulaManager fmgr = context.getFormulaManager();
    BooleanFormula even =
        fmgr.substitute(
            stride.getPredicate(), ImmutableMap.of(bound.getIndex(), context.literal(64, 6)));
    BooleanFormula odd =
        fmgr.substitute(
            stride.getPredicate(), ImmutableMap.of(bound.getIndex(), context.literal(64, 7)));
    assertThat(context.isValid(even)).isTrue();
    assertThat(context.isValid(bmgr.not(odd))).isTrue();
  }

  @Test
  public void memoryAccumulatorIsSummarized() throws Exception {
    Pointer cell = Pointer.of(1, context.literal(64, 0));
    ControlFlowGraph cfg = loop(ImmutableList.of(WORD, WORD));
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    SimulationState start =
        initialState(
            cfg.newCallFrame(),
            RegisterFile.of(word(context.literal(64, 0)), word(n)),
            SimpleMemory.empty(context, 64)
                .store(cell, INT, Pointer.bitvector(context.literal(32, 0))));
    LoopBody body =
        state -> {
          Memory memory = state.getGlobal(MEMORY);
          BitvectorFormula old = memory.load(cell, INT).getOffset();
          Memory updated =
              memory.store(
                  cell,
                  INT,
                  Pointer.bitvector(SymbolicTestUtils.add(context, old, context.literal(32, 1))));
          BitvectorFormula next =
              SymbolicTestUtils.add(context, wordAt(state, 0), context.literal(64, 1));
          return state
              .withRegisters(RegisterFile.of(word(next), word(wordAt(state, 1))))
              .withGlobal(MEMORY, updated);
        };
    Executor executor = new Executor(feature, start, 0, 1, body);

    executor.run();

    assertThat(executor.states).hasSize(4);
    assertThat(executor.states.get(2)).isInstanceOf(CheckFixpoint.class);
    assertThat(executor.states.get(3)).isInstanceOf(AfterFixpoint.class);

    CheckFixpoint check = (CheckFixpoint) executor.states.get(2);
    MemoryWidening widening = check.getRecord().getMemoryWidening();
    assertThat(widening.getLocations()).containsExactly(new MemoryLocation(1, BigInteger.ZERO, 4));
    Formula memoryVariable = widening.asMap().values().iterator().next().getJoinVariable();
    assertThat(check.getRecord().getSubstitution().contains(memoryVariable)).isTrue();

    Memory finalMemory = executor.state.getGlobal(MEMORY);
    assertThat(finalMemory.load(cell, INT).getOffset())
        .isEqualTo(summary.getEqualities().get(memoryVariable));
  }

  @Test
  public void changingMemoryFootprintIsRejected() throws Exception {
    ControlFlowGraph cfg = loop(ImmutableList.of(WORD, WORD));
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    SimulationState start =
        initialState(
            cfg.newCallFrame(),
            RegisterFile.of(word(context.literal(64, 0)), word(n)),
            SimpleMemory.empty(context, 64));
    // the first iteration writes a[0], all later ones a[1]
    LoopBody body =
        state -> {
          BitvectorFormula i = wordAt(state, 0);
          long offset = context.asLiteral(i).isPresent() ? 0 : 4;
          Memory updated =
              state
                  .getGlobal(MEMORY)
                  .store(
                      Pointer.of(1, context.literal(64, offset)),
                      INT,
                      Pointer.bitvector(context.literal(32, 1)));
          BitvectorFormula next = SymbolicTestUtils.add(context, i, context.literal(64, 1));
          return state
              .withRegisters(RegisterFile.of(word(next), word(wordAt(state, 1))))
              .withGlobal(MEMORY, updated);
        };
    Executor executor = new Executor(feature, start, 0, 1, body);

    assertThrows(FootprintChangedException.class, () -> executor.run());
  }

  @Test
  public void symbolicStoreIntoInitializedArrayIsRejected() throws Exception {
    ControlFlowGraph cfg = loop(ImmutableList.of(WORD, WORD));
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    Pointer zero = Pointer.bitvector(context.literal(32, 0));
    SimulationState start =
        initialState(
            cfg.newCallFrame(),
            RegisterFile.of(word(context.literal(64, 0)), word(n)),
            SimpleMemory.empty(context, 64)
                .store(Pointer.of(1, context.literal(64, 0)), INT, zero)
                .store(Pointer.of(1, context.literal(64, 4)), INT, zero));
    // a[i] = 1
    LoopBody body =
        state -> {
          BitvectorFormula i = wordAt(state, 0);
          BitvectorFormula offset = bvmgr.multiply(i, context.literal(64, 4));
          Memory updated =
              state
                  .getGlobal(MEMORY)
                  .store(Pointer.of(1, offset), INT, Pointer.bitvector(context.literal(32, 1)));
          BitvectorFormula next = SymbolicTestUtils.add(context, i, context.literal(64, 1));
          return state
              .withRegisters(RegisterFile.of(word(next), word(wordAt(state, 1))))
              .withGlobal(MEMORY, updated);
        };
    Executor executor = new Executor(feature, start, 0, 1, body);

    assertThrows(OverlappingWritesException.class, () -> executor.run());
  }

  @Test
  public void nestedLoopsAreRejected() {
    ControlFlowGraph cfg =
        ControlFlowGraph.builder("f")
            .addBlock(ENTRY, ImmutableList.of(), HEADER)
            .addBlock(HEADER, ImmutableList.of(), BODY, EXIT)
            .addBlock(BODY, ImmutableList.of(), BODY, HEADER)
            .addBlock(EXIT, ImmutableList.of())
            .build();
    assertThrows(
        StructuralMismatchException.class,
        () -> newFeature(cfg, Configuration.defaultConfiguration()));
  }

  @Test
  public void blocksOfOtherFunctionsAreIgnored() throws Exception {
    ControlFlowGraph cfg = sumLoop();
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    SimulationState foreign =
        initialState(
            new CallFrame("g", cfg.getBlockInputs()),
            sumLoopStart(cfg).getRegisters(),
            SimpleMemory.empty(context, 64));

    assertThat(feature.onBlockEntered(HEADER, foreign).getKind()).isEqualTo(Kind.NO_CHANGE);
    assertThat(feature.getState()).isInstanceOf(BeforeFixpoint.class);
  }

  @Test
  public void otherBlocksAndEarlyBranchesAreIgnored() throws Exception {
    ControlFlowGraph cfg = sumLoop();
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    SimulationState state = sumLoopStart(cfg);

    assertThat(feature.onBlockEntered(BODY, state).getKind()).isEqualTo(Kind.NO_CHANGE);
    BooleanFormula condition = bvmgr.lessThan(wordAt(state, 0), n, false);
    ExecutionFeatureResult branch =
        feature.onSymbolicBranch(
            condition, PausedFrame.jumpTo(BODY), PausedFrame.jumpTo(EXIT), state);

    assertThat(branch.getKind()).isEqualTo(Kind.NO_CHANGE);
    assertThat(feature.getState()).isInstanceOf(BeforeFixpoint.class);
    assertThat(assumptions.getAssumptions()).isEmpty();
  }

  @Test
  public void unresolvedBranchTargetsAreIgnored() throws Exception {
    ControlFlowGraph cfg = sumLoop();
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    Executor executor = new Executor(feature, sumLoopStart(cfg), 0, 2, sumLoopBody(1));
    executor.enterHeader();

    ExecutionFeatureResult branch =
        feature.onSymbolicBranch(
            bvmgr.lessThan(n, n, false),
            PausedFrame.jumpTo(BODY),
            PausedFrame.unresolved("return"),
            executor.state);

    assertThat(branch.getKind()).isEqualTo(Kind.NO_CHANGE);
  }

  @Test
  public void headerAfterFixpointIsAnError() throws Exception {
    ControlFlowGraph cfg = sumLoop();
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    Executor executor = new Executor(feature, sumLoopStart(cfg), 0, 2, sumLoopBody(1));
    executor.run();

    assertThrows(IllegalStateException.class, () -> executor.enterHeader());
  }

  @Test
  public void changedRegisterTypesAreRejected() throws Exception {
    ControlFlowGraph cfg = sumLoop();
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    Executor executor = new Executor(feature, sumLoopStart(cfg), 0, 2, sumLoopBody(1));
    executor.enterHeader();
    executor.branch();
    SimulationState shrunk = executor.state.withRegisters(RegisterFile.of(word(n)));

    assertThrows(StructuralMismatchException.class, () -> feature.onBlockEntered(HEADER, shrunk));
  }

  @Test
  public void wideningLimitIsEnforced() throws Exception {
    ControlFlowGraph cfg = sumLoop();
    Configuration config =
        Configuration.builder().setOption("loopfixpoint.maxWideningIterations", "1").build();
    SimpleLoopFixpoint feature = newFeature(cfg, config);
    Executor executor = new Executor(feature, sumLoopStart(cfg), 0, 2, sumLoopBody(1));

    assertThrows(StructuralMismatchException.class, () -> executor.run());
  }

  @Test
  public void secondLoopIsRejected() throws Exception {
    BlockId secondHeader = BlockId.of(4);
    BlockId secondBody = BlockId.of(5);
    ImmutableList<RegType> words = ImmutableList.of(WORD, WORD, WORD);
    ControlFlowGraph cfg =
        ControlFlowGraph.builder("f")
            .addBlock(ENTRY, ImmutableList.of(), HEADER)
            .addBlock(HEADER, words, BODY, EXIT)
            .addBlock(BODY, ImmutableList.of(), HEADER)
            .addBlock(EXIT, ImmutableList.of(), secondHeader)
            .addBlock(secondHeader, words, secondBody, BlockId.of(6))
            .addBlock(secondBody, ImmutableList.of(), secondHeader)
            .addBlock(BlockId.of(6), ImmutableList.of())
            .build();
    SimpleLoopFixpoint feature = newFeature(cfg, Configuration.defaultConfiguration());
    Executor executor = new Executor(feature, sumLoopStart(cfg), 0, 2, sumLoopBody(1));
    executor.run();

    assertThrows(
        StructuralMismatchException.class,
        () -> feature.onBlockEntered(secondHeader, executor.state));
  }
}
