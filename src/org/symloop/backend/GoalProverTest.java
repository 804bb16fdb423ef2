// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.backend;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.BitvectorFormula;
import org.sosy_lab.java_smt.api.BitvectorFormulaManager;
import org.symloop.backend.GoalProver.FailedGoal;
import org.symloop.util.smt.SymbolicContext;
import org.symloop.util.smt.SymbolicTestUtils;

public class GoalProverTest {

  private SymbolicContext context;
  private BitvectorFormulaManager bvmgr;
  private GoalProver prover;
  private BitvectorFormula x;

  @Before
  public void setUp() throws Exception {
    context = SymbolicTestUtils.newContext();
    bvmgr = context.getBitvectorFormulaManager();
    prover = new GoalProver(context, LogManager.createTestLogManager());
    x = bvmgr.makeVariable(8, "x");
  }

  @After
  public void tearDown() {
    context.close();
  }

  private ProofGoal goal(long pAssumedBound, long pProvenBound) {
    return new ProofGoal(
        ImmutableList.of(bvmgr.lessThan(x, context.literal(8, pAssumedBound), false)),
        new ProofObligation(
            bvmgr.lessThan(x, context.literal(8, pProvenBound), false),
            "x below " + pProvenBound));
  }

  @Test
  public void implicationHolds() throws Exception {
    assertThat(prover.prove(goal(5, 10))).isEmpty();
  }

  @Test
  public void counterexampleForFailedGoal() throws Exception {
    Optional<FailedGoal> failure = prover.prove(goal(10, 5));
    assertThat(failure).isPresent();
    assertThat(failure.orElseThrow().getGoal().getObligation().getMessage()).isEqualTo("x below 5");
    assertThat(failure.orElseThrow().getCounterexample()).isNotEmpty();
  }

  @Test
  public void proveAllReportsOnlyFailures() throws Exception {
    ImmutableList<FailedGoal> failures =
        prover.proveAll(ImmutableList.of(goal(5, 10), goal(10, 5), goal(3, 3)));
    assertThat(failures).hasSize(1);
    assertThat(failures.get(0).getGoal().getObligation().getMessage()).isEqualTo("x below 5");
  }
}
