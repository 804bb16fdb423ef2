// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exec;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Objects;

/** Type of a register of the host executor. Types are compared structurally. */
public abstract class RegType {

  private RegType() {}

  public static PointerType pointer(int pWidth) {
    return new PointerType(pWidth);
  }

  public static BoolType bool() {
    return BoolType.INSTANCE;
  }

  public static StructType struct(RegType... pFields) {
    return new StructType(ImmutableList.copyOf(pFields));
  }

  public static UnitType unit() {
    return UnitType.INSTANCE;
  }

  /** A pointer (or plain bit-vector) whose offset has the given width. */
  public static final class PointerType extends RegType {
    private final int width;

    private PointerType(int pWidth) {
      checkArgument(pWidth > 0);
      width = pWidth;
    }

    public int getWidth() {
      return width;
    }

    @Override
    public boolean equals(Object pObj) {
      return pObj instanceof PointerType && ((PointerType) pObj).width == width;
    }

    @Override
    public int hashCode() {
      return width;
    }

    @Override
    public String toString() {
      return "ptr" + width;
    }
  }

  public static final class BoolType extends RegType {
    private static final BoolType INSTANCE = new BoolType();

    private BoolType() {}

    @Override
    public String toString() {
      return "bool";
    }
  }

  public static final class StructType extends RegType {
    private final ImmutableList<RegType> fields;

    private StructType(ImmutableList<RegType> pFields) {
      fields = pFields;
    }

    public ImmutableList<RegType> getFields() {
      return fields;
    }

    @Override
    public boolean equals(Object pObj) {
      return pObj instanceof StructType && ((StructType) pObj).fields.equals(fields);
    }

    @Override
    public int hashCode() {
      return Objects.hash(StructType.class, fields);
    }

    @Override
    public String toString() {
      return "struct" + fields;
    }
  }

  /** The type of registers without content. */
  public static final class UnitType extends RegType {
    private static final UnitType INSTANCE = new UnitType();

    private UnitType() {}

    @Override
    public String toString() {
      return "unit";
    }
  }
}
