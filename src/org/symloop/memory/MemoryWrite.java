// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.memory;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/** One entry of a write log: where something was written, and how. */
public final class MemoryWrite {

  public enum Kind {
    /** A typed store of a single value. */
    STORE,
    /** Anything else that changes memory, e.g. memset or memcpy. */
    BULK
  }

  private final Pointer pointer;
  private final StorageType storageType;
  private final Kind kind;

  private MemoryWrite(Pointer pPointer, StorageType pStorageType, Kind pKind) {
    pointer = checkNotNull(pPointer);
    storageType = checkNotNull(pStorageType);
    kind = checkNotNull(pKind);
  }

  public static MemoryWrite store(Pointer pPointer, StorageType pStorageType) {
    return new MemoryWrite(pPointer, pStorageType, Kind.STORE);
  }

  public static MemoryWrite bulk(Pointer pPointer, StorageType pStorageType) {
    return new MemoryWrite(pPointer, pStorageType, Kind.BULK);
  }

  public Pointer getPointer() {
    return pointer;
  }

  public StorageType getStorageType() {
    return storageType;
  }

  public Kind getKind() {
    return kind;
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof MemoryWrite)) {
      return false;
    }
    MemoryWrite other = (MemoryWrite) pObj;
    return kind == other.kind
        && pointer.equals(other.pointer)
        && storageType.equals(other.storageType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pointer, storageType, kind);
  }

  @Override
  public String toString() {
    return kind + " " + storageType + " at " + pointer;
  }
}
