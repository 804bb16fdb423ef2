// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.sosy_lab.java_smt.api.Formula;

/**
 * The two values recorded for a widening variable: its value when the loop is entered and its
 * value after one more trip through the loop body, expressed over the current widening variables.
 */
public final class WideningEntry {

  private final Formula headerValue;
  private final Formula bodyValue;

  public WideningEntry(Formula pHeaderValue, Formula pBodyValue) {
    headerValue = checkNotNull(pHeaderValue);
    bodyValue = checkNotNull(pBodyValue);
  }

  public Formula getHeaderValue() {
    return headerValue;
  }

  public Formula getBodyValue() {
    return bodyValue;
  }

  public WideningEntry withBodyValue(Formula pBodyValue) {
    return new WideningEntry(headerValue, pBodyValue);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof WideningEntry)) {
      return false;
    }
    WideningEntry other = (WideningEntry) pObj;
    return headerValue.equals(other.headerValue) && bodyValue.equals(other.bodyValue);
  }

  @Override
  public int hashCode() {
    return Objects.hash(headerValue, bodyValue);
  }

  @Override
  public String toString() {
    return "[" + headerValue + " | " + bodyValue + "]";
  }
}
