// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.backend;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;

/** An {@link AssumptionStack} that keeps everything in memory. */
public class DefaultAssumptionStack implements AssumptionStack {

  private static final class Frame {
    private final FrameIdentifier id;
    private final List<Assumption> assumptions = new ArrayList<>();
    private final List<ProofGoal> goals = new ArrayList<>();

    private Frame(FrameIdentifier pId) {
      id = pId;
    }
  }

  private final BooleanFormulaManager bmgr;
  // topmost frame first
  private final Deque<Frame> frames = new ArrayDeque<>();
  private int nextFrameId = 0;

  public DefaultAssumptionStack(BooleanFormulaManager pBmgr) {
    bmgr = checkNotNull(pBmgr);
    frames.push(new Frame(new FrameIdentifier(nextFrameId++)));
  }

  @Override
  public FrameIdentifier pushFrame() {
    FrameIdentifier id = new FrameIdentifier(nextFrameId++);
    frames.push(new Frame(id));
    return id;
  }

  private Frame popTopFrame(FrameIdentifier pFrame) {
    checkState(frames.size() > 1, "cannot pop %s: no assumption frame was pushed", pFrame);
    checkState(
        frames.peek().id.equals(pFrame),
        "unbalanced assumption frames: %s is not the topmost frame %s",
        pFrame,
        frames.peek().id);
    return frames.pop();
  }

  @Override
  public ImmutableList<Assumption> popFrame(FrameIdentifier pFrame) {
    Frame frame = popTopFrame(pFrame);
    frames.peek().goals.addAll(frame.goals);
    return ImmutableList.copyOf(frame.assumptions);
  }

  @Override
  public ImmutableList<Assumption> popFrameAndObligations(FrameIdentifier pFrame) {
    return ImmutableList.copyOf(popTopFrame(pFrame).assumptions);
  }

  @Override
  public void addAssumption(Assumption pAssumption) {
    frames.peek().assumptions.add(checkNotNull(pAssumption));
  }

  @Override
  public void addProofObligation(ProofObligation pObligation) {
    frames.peek().goals.add(new ProofGoal(assumptionPredicates(), checkNotNull(pObligation)));
  }

  private ImmutableList<BooleanFormula> assumptionPredicates() {
    ImmutableList.Builder<BooleanFormula> predicates = ImmutableList.builder();
    Iterator<Frame> bottomUp = frames.descendingIterator();
    while (bottomUp.hasNext()) {
      for (Assumption assumption : bottomUp.next().assumptions) {
        predicates.add(assumption.getPredicate());
      }
    }
    return predicates.build();
  }

  @Override
  public BooleanFormula currentAssumptions() {
    return bmgr.and(assumptionPredicates());
  }

  /** All assumptions currently in scope, oldest first. */
  public ImmutableList<Assumption> getAssumptions() {
    ImmutableList.Builder<Assumption> result = ImmutableList.builder();
    Iterator<Frame> bottomUp = frames.descendingIterator();
    while (bottomUp.hasNext()) {
      result.addAll(bottomUp.next().assumptions);
    }
    return result.build();
  }

  @Override
  public ImmutableList<ProofGoal> getProofGoals() {
    ImmutableList.Builder<ProofGoal> result = ImmutableList.builder();
    Iterator<Frame> bottomUp = frames.descendingIterator();
    while (bottomUp.hasNext()) {
      result.addAll(bottomUp.next().goals);
    }
    return result.build();
  }

  /** Number of frames pushed and not yet popped. */
  public int getDepth() {
    return frames.size() - 1;
  }
}
