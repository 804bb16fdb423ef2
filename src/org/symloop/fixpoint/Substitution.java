// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.java_smt.api.Formula;

/**
 * Maps widening variables to their {@link WideningEntry}, in the order the variables were
 * introduced. Instances are immutable; every modification returns a new substitution.
 */
public final class Substitution {

  private static final Substitution EMPTY = new Substitution(ImmutableMap.of());

  private final ImmutableMap<Formula, WideningEntry> entries;

  private Substitution(ImmutableMap<Formula, WideningEntry> pEntries) {
    entries = pEntries;
  }

  public static Substitution empty() {
    return EMPTY;
  }

  public static Substitution of(Map<? extends Formula, WideningEntry> pEntries) {
    return new Substitution(ImmutableMap.copyOf(pEntries));
  }

  public ImmutableSet<Formula> variables() {
    return entries.keySet();
  }

  public @Nullable WideningEntry get(Formula pVariable) {
    return entries.get(pVariable);
  }

  public boolean contains(Formula pVariable) {
    return entries.containsKey(pVariable);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  /** Maps the variable to the entry, keeping the position of the variable if it is present. */
  public Substitution with(Formula pVariable, WideningEntry pEntry) {
    Map<Formula, WideningEntry> result = new LinkedHashMap<>(entries);
    result.put(checkNotNull(pVariable), checkNotNull(pEntry));
    return new Substitution(ImmutableMap.copyOf(result));
  }

  /** Union of both substitutions; entries of this substitution win on common variables. */
  public Substitution union(Substitution pOther) {
    Map<Formula, WideningEntry> result = new LinkedHashMap<>(entries);
    for (Map.Entry<Formula, WideningEntry> entry : pOther.entries.entrySet()) {
      result.putIfAbsent(entry.getKey(), entry.getValue());
    }
    return new Substitution(ImmutableMap.copyOf(result));
  }

  public Substitution filter(BiPredicate<Formula, WideningEntry> pPredicate) {
    return new Substitution(
        ImmutableMap.copyOf(
            Maps.filterEntries(entries, e -> pPredicate.test(e.getKey(), e.getValue()))));
  }

  public Substitution mapEntries(
      Function<Map.Entry<Formula, WideningEntry>, WideningEntry> pFunction) {
    ImmutableMap.Builder<Formula, WideningEntry> result = ImmutableMap.builder();
    for (Map.Entry<Formula, WideningEntry> entry : entries.entrySet()) {
      result.put(entry.getKey(), pFunction.apply(entry));
    }
    return new Substitution(result.buildOrThrow());
  }

  /** Whether both substitutions use the same set of widening variables, regardless of values. */
  public boolean hasSameVariables(Substitution pOther) {
    return entries.keySet().equals(pOther.entries.keySet());
  }

  public ImmutableMap<Formula, WideningEntry> asMap() {
    return entries;
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof Substitution && entries.equals(((Substitution) pObj).entries);
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
