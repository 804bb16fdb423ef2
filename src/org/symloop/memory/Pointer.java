// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.memory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.sosy_lab.java_smt.api.BitvectorFormula;

/**
 * A pointer of the memory model: a concrete allocation region and a bit-vector offset into it.
 * Region {@link #BITVECTOR_REGION} marks a plain bit-vector value that does not point anywhere.
 */
public final class Pointer {

  public static final int BITVECTOR_REGION = 0;

  private final int region;
  private final BitvectorFormula offset;

  private Pointer(int pRegion, BitvectorFormula pOffset) {
    checkArgument(pRegion >= 0, "negative region %s", pRegion);
    region = pRegion;
    offset = checkNotNull(pOffset);
  }

  public static Pointer of(int pRegion, BitvectorFormula pOffset) {
    return new Pointer(pRegion, pOffset);
  }

  public static Pointer bitvector(BitvectorFormula pValue) {
    return new Pointer(BITVECTOR_REGION, pValue);
  }

  public int getRegion() {
    return region;
  }

  public BitvectorFormula getOffset() {
    return offset;
  }

  public boolean isBitvector() {
    return region == BITVECTOR_REGION;
  }

  public Pointer withOffset(BitvectorFormula pOffset) {
    return new Pointer(region, pOffset);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Pointer)) {
      return false;
    }
    Pointer other = (Pointer) pObj;
    return region == other.region && offset.equals(other.offset);
  }

  @Override
  public int hashCode() {
    return Objects.hash(region, offset);
  }

  @Override
  public String toString() {
    return "(" + region + ", " + offset + ")";
  }
}
