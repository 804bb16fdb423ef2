// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.memory;

import static com.google.common.base.Preconditions.checkArgument;

/** The in-memory representation of a bit-vector cell, described by its size in bytes. */
public final class StorageType {

  private final int bytes;

  private StorageType(int pBytes) {
    checkArgument(pBytes > 0, "storage type of size %s", pBytes);
    bytes = pBytes;
  }

  public static StorageType bitvector(int pBytes) {
    return new StorageType(pBytes);
  }

  /** Offset of the first byte after a value of this type that starts at offset 0. */
  public int getSize() {
    return bytes;
  }

  public int getBitWidth() {
    return bytes * Byte.SIZE;
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof StorageType && ((StorageType) pObj).bytes == bytes;
  }

  @Override
  public int hashCode() {
    return bytes;
  }

  @Override
  public String toString() {
    return "bv" + getBitWidth();
  }
}
