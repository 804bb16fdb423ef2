// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exec;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** The registers of one call frame, in the order the control-flow graph declares them. */
public final class RegisterFile {

  private final ImmutableList<RegEntry> entries;

  private RegisterFile(ImmutableList<RegEntry> pEntries) {
    entries = pEntries;
  }

  public static RegisterFile of(List<RegEntry> pEntries) {
    return new RegisterFile(ImmutableList.copyOf(pEntries));
  }

  public static RegisterFile of(RegEntry... pEntries) {
    return new RegisterFile(ImmutableList.copyOf(pEntries));
  }

  public ImmutableList<RegEntry> getEntries() {
    return entries;
  }

  public RegEntry get(int pIndex) {
    return entries.get(pIndex);
  }

  public int size() {
    return entries.size();
  }

  /** The type shape of this register file; two files can only be joined if their shapes match. */
  public ImmutableList<RegType> getTypes() {
    return entries.stream().map(RegEntry::getType).collect(ImmutableList.toImmutableList());
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof RegisterFile && ((RegisterFile) pObj).entries.equals(entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
