// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ComparisonChain;
import java.math.BigInteger;
import java.util.Objects;

/** A memory cell written in the loop body: concrete region, concrete offset and size in bytes. */
public final class MemoryLocation implements Comparable<MemoryLocation> {

  private final int region;
  private final BigInteger offset;
  private final int size;

  public MemoryLocation(int pRegion, BigInteger pOffset, int pSize) {
    checkArgument(pOffset.signum() >= 0, "negative offset %s", pOffset);
    region = pRegion;
    offset = checkNotNull(pOffset);
    size = pSize;
  }

  public int getRegion() {
    return region;
  }

  public BigInteger getOffset() {
    return offset;
  }

  public int getSize() {
    return size;
  }

  @Override
  public int compareTo(MemoryLocation pOther) {
    return ComparisonChain.start()
        .compare(region, pOther.region)
        .compare(offset, pOther.offset)
        .compare(size, pOther.size)
        .result();
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof MemoryLocation)) {
      return false;
    }
    MemoryLocation other = (MemoryLocation) pObj;
    return region == other.region && offset.equals(other.offset) && size == other.size;
  }

  @Override
  public int hashCode() {
    return Objects.hash(region, offset, size);
  }

  @Override
  public String toString() {
    return "(" + region + ", " + offset + ", " + size + ")";
  }
}
