// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exec;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/** A register: its type and its current value. */
public final class RegEntry {

  private final RegType type;
  private final RegValue value;

  public RegEntry(RegType pType, RegValue pValue) {
    type = checkNotNull(pType);
    value = checkNotNull(pValue);
  }

  public RegType getType() {
    return type;
  }

  public RegValue getValue() {
    return value;
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof RegEntry)) {
      return false;
    }
    RegEntry other = (RegEntry) pObj;
    return type.equals(other.type) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    return value + ": " + type;
  }
}
