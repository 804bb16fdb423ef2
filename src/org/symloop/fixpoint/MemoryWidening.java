// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;

/** The widened memory cells of a loop, ordered by location. */
public final class MemoryWidening {

  private static final MemoryWidening EMPTY = new MemoryWidening(ImmutableSortedMap.of());

  private final ImmutableSortedMap<MemoryLocation, MemoryJoin> joins;

  private MemoryWidening(ImmutableSortedMap<MemoryLocation, MemoryJoin> pJoins) {
    joins = pJoins;
  }

  public static MemoryWidening empty() {
    return EMPTY;
  }

  public static MemoryWidening of(Map<MemoryLocation, MemoryJoin> pJoins) {
    return new MemoryWidening(ImmutableSortedMap.copyOf(pJoins));
  }

  public boolean isEmpty() {
    return joins.isEmpty();
  }

  /** The write footprint. */
  public ImmutableSortedSet<MemoryLocation> getLocations() {
    return joins.keySet();
  }

  public ImmutableSortedMap<MemoryLocation, MemoryJoin> asMap() {
    return joins;
  }

  @Override
  public String toString() {
    return joins.toString();
  }
}
