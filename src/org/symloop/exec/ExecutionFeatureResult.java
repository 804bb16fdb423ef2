// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exec;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import org.checkerframework.checker.nullness.qual.Nullable;

/** What an {@link ExecutionFeature} wants the host executor to do after a notification. */
public final class ExecutionFeatureResult {

  public enum Kind {
    /** Continue as if the feature did not exist. */
    NO_CHANGE,
    /** Continue the current step with a replaced state. */
    MODIFIED_STATE,
    /** Abandon the branch and resume the given continuation with the given state. */
    RESUME_FRAME
  }

  private static final ExecutionFeatureResult NO_CHANGE =
      new ExecutionFeatureResult(Kind.NO_CHANGE, null, null);

  private final Kind kind;
  private final @Nullable SimulationState state;
  private final @Nullable PausedFrame frame;

  private ExecutionFeatureResult(
      Kind pKind, @Nullable SimulationState pState, @Nullable PausedFrame pFrame) {
    kind = pKind;
    state = pState;
    frame = pFrame;
  }

  public static ExecutionFeatureResult noChange() {
    return NO_CHANGE;
  }

  public static ExecutionFeatureResult modifiedState(SimulationState pState) {
    return new ExecutionFeatureResult(Kind.MODIFIED_STATE, checkNotNull(pState), null);
  }

  public static ExecutionFeatureResult resumeFrame(PausedFrame pFrame, SimulationState pState) {
    return new ExecutionFeatureResult(
        Kind.RESUME_FRAME, checkNotNull(pState), checkNotNull(pFrame));
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * The state to continue with.
   *
   * @throws IllegalStateException for {@link Kind#NO_CHANGE}
   */
  public SimulationState getState() {
    checkState(state != null, "no state for %s", kind);
    return state;
  }

  /**
   * The continuation to resume.
   *
   * @throws IllegalStateException unless this is {@link Kind#RESUME_FRAME}
   */
  public PausedFrame getFrame() {
    checkState(frame != null, "no frame for %s", kind);
    return frame;
  }

  @Override
  public String toString() {
    return kind + (frame == null ? "" : " " + frame);
  }
}
