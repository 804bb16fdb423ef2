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

/**
 * The phases of the fixpoint computation for one loop. The phases are passed strictly in the order
 * {@link BeforeFixpoint}, {@link ComputeFixpoint}, {@link CheckFixpoint}, {@link AfterFixpoint}.
 */
public abstract class FixpointState {

  private FixpointState() {}

  /** The record of the loop, absent before the loop header was reached. */
  public abstract @Nullable FixpointRecord getRecord();

  /** The loop header has not been reached yet. */
  public static final class BeforeFixpoint extends FixpointState {

    static final BeforeFixpoint INSTANCE = new BeforeFixpoint();

    private BeforeFixpoint() {}

    @Override
    public @Nullable FixpointRecord getRecord() {
      return null;
    }

    ComputeFixpoint enter(FixpointRecord pRecord) {
      return new ComputeFixpoint(pRecord);
    }

    @Override
    public String toString() {
      return "BeforeFixpoint";
    }
  }

  /** The loop body is executed repeatedly until the set of widening variables is stable. */
  public static final class ComputeFixpoint extends FixpointState {

    private final FixpointRecord record;

    private ComputeFixpoint(FixpointRecord pRecord) {
      record = checkNotNull(pRecord);
    }

    @Override
    public FixpointRecord getRecord() {
      return record;
    }

    ComputeFixpoint widen(FixpointRecord pRecord) {
      return new ComputeFixpoint(pRecord);
    }

    ComputeFixpoint withLoopCondition(BooleanFormula pLoopCondition) {
      return new ComputeFixpoint(record.withLoopCondition(pLoopCondition));
    }

    CheckFixpoint stabilize(FixpointRecord pRecord, LoopIndexBound pBound) {
      return new CheckFixpoint(pRecord, pBound);
    }

    @Override
    public String toString() {
      return "ComputeFixpoint(" + record + ")";
    }
  }

  /** The loop body is executed one last time to establish that the invariant is inductive. */
  public static final class CheckFixpoint extends FixpointState {

    private final FixpointRecord record;
    private final LoopIndexBound bound;

    private CheckFixpoint(FixpointRecord pRecord, LoopIndexBound pBound) {
      record = checkNotNull(pRecord);
      bound = checkNotNull(pBound);
    }

    @Override
    public FixpointRecord getRecord() {
      return record;
    }

    public LoopIndexBound getBound() {
      return bound;
    }

    AfterFixpoint conclude(FixpointRecord pRecord, LoopIndexBound pBound) {
      return new AfterFixpoint(pRecord, pBound);
    }

    @Override
    public String toString() {
      return "CheckFixpoint(" + record + ", " + bound + ")";
    }
  }

  /** The invariant is established, execution is forced out of the loop. */
  public static final class AfterFixpoint extends FixpointState {

    private final FixpointRecord record;
    private final LoopIndexBound bound;

    private AfterFixpoint(FixpointRecord pRecord, LoopIndexBound pBound) {
      record = checkNotNull(pRecord);
      bound = checkNotNull(pBound);
    }

    @Override
    public FixpointRecord getRecord() {
      return record;
    }

    public LoopIndexBound getBound() {
      return bound;
    }

    @Override
    public String toString() {
      return "AfterFixpoint(" + record + ", " + bound + ")";
    }
  }
}
