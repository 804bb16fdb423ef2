// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.exec;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.symloop.memory.Pointer;

/** Value held by a register. Values are compared syntactically. */
public abstract class RegValue {

  private RegValue() {}

  public static PointerValue pointer(Pointer pPointer) {
    return new PointerValue(pPointer);
  }

  public static BoolValue bool(BooleanFormula pValue) {
    return new BoolValue(pValue);
  }

  public static StructValue struct(RegValue... pFields) {
    return new StructValue(ImmutableList.copyOf(pFields));
  }

  public static StructValue struct(ImmutableList<RegValue> pFields) {
    return new StructValue(pFields);
  }

  public static UnitValue unit() {
    return UnitValue.INSTANCE;
  }

  public static final class PointerValue extends RegValue {
    private final Pointer pointer;

    private PointerValue(Pointer pPointer) {
      pointer = checkNotNull(pPointer);
    }

    public Pointer getPointer() {
      return pointer;
    }

    @Override
    public boolean equals(Object pObj) {
      return pObj instanceof PointerValue && ((PointerValue) pObj).pointer.equals(pointer);
    }

    @Override
    public int hashCode() {
      return pointer.hashCode();
    }

    @Override
    public String toString() {
      return pointer.toString();
    }
  }

  public static final class BoolValue extends RegValue {
    private final BooleanFormula value;

    private BoolValue(BooleanFormula pValue) {
      value = checkNotNull(pValue);
    }

    public BooleanFormula getValue() {
      return value;
    }

    @Override
    public boolean equals(Object pObj) {
      return pObj instanceof BoolValue && ((BoolValue) pObj).value.equals(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  public static final class StructValue extends RegValue {
    private final ImmutableList<RegValue> fields;

    private StructValue(ImmutableList<RegValue> pFields) {
      fields = pFields;
    }

    public ImmutableList<RegValue> getFields() {
      return fields;
    }

    @Override
    public boolean equals(Object pObj) {
      return pObj instanceof StructValue && ((StructValue) pObj).fields.equals(fields);
    }

    @Override
    public int hashCode() {
      return Objects.hash(StructValue.class, fields);
    }

    @Override
    public String toString() {
      return fields.toString();
    }
  }

  public static final class UnitValue extends RegValue {
    private static final UnitValue INSTANCE = new UnitValue();

    private UnitValue() {}

    @Override
    public String toString() {
      return "()";
    }
  }
}
