// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exec;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.symloop.cfa.BlockId;

/** A continuation of a symbolic branch that has not been resumed yet. */
public final class PausedFrame {

  private final @Nullable BlockId target;
  private final String label;

  private PausedFrame(@Nullable BlockId pTarget, String pLabel) {
    target = pTarget;
    label = pLabel;
  }

  /** A continuation that jumps to the given block. */
  public static PausedFrame jumpTo(BlockId pTarget) {
    return new PausedFrame(pTarget, pTarget.toString());
  }

  /** A continuation whose target block is not known, e.g. a return. */
  public static PausedFrame unresolved(String pLabel) {
    return new PausedFrame(null, pLabel);
  }

  public Optional<BlockId> getTarget() {
    return Optional.ofNullable(target);
  }

  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
