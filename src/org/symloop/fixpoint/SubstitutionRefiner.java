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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.sosy_lab.java_smt.api.Formula;
import org.symloop.util.smt.SymbolicContext;

/** Simplifications of a widening substitution once its set of variables is stable. */
public class SubstitutionRefiner {

  /** A substitution without duplicate entries and the renaming that removed them. */
  public static final class Unification {
    private final Substitution substitution;
    private final ImmutableMap<Formula, Formula> equalities;

    private Unification(Substitution pSubstitution, ImmutableMap<Formula, Formula> pEqualities) {
      substitution = pSubstitution;
      equalities = pEqualities;
    }

    public Substitution getSubstitution() {
      return substitution;
    }

    /**
     * Maps every variable of the original substitution to its representative; representatives
     * map to themselves.
     */
    public ImmutableMap<Formula, Formula> getEqualities() {
      return equalities;
    }

    /** Whether some variable was merged into another one. */
    public boolean hasMergedVariables() {
      return equalities.entrySet().stream().anyMatch(e -> !e.getKey().equals(e.getValue()));
    }
  }

  private final SymbolicContext context;

  public SubstitutionRefiner(SymbolicContext pContext) {
    context = checkNotNull(pContext);
  }

  /**
   * Drops every variable that does not occur in any body value. This is a single pass: a variable
   * that only occurs in the body value of a dropped variable is kept.
   */
  public Substitution filterLive(Substitution pSubstitution) {
    ImmutableSet.Builder<Formula> used = ImmutableSet.builder();
    for (WideningEntry entry : pSubstitution.asMap().values()) {
      used.addAll(context.freeVariables(entry.getBodyValue()));
    }
    ImmutableSet<Formula> live = used.build();
    return pSubstitution.filter((variable, entry) -> live.contains(variable));
  }

  /**
   * Merges variables with syntactically identical entries. The first variable with a given entry
   * becomes the representative of all later ones.
   */
  public Unification unifyEqual(Substitution pSubstitution) {
    Map<WideningEntry, Formula> representatives = new HashMap<>();
    Map<Formula, Formula> equalities = new LinkedHashMap<>();
    for (Map.Entry<Formula, WideningEntry> entry : pSubstitution.asMap().entrySet()) {
      Formula representative = representatives.putIfAbsent(entry.getValue(), entry.getKey());
      equalities.put(entry.getKey(), representative == null ? entry.getKey() : representative);
    }
    Substitution normal =
        pSubstitution.filter((variable, entry) -> equalities.get(variable).equals(variable));
    return new Unification(normal, ImmutableMap.copyOf(equalities));
  }

  /** Termination test of the widening: values may differ, the variables must not. */
  public static boolean sameVariables(Substitution pFirst, Substitution pSecond) {
    return pFirst.hasSameVariables(pSecond);
  }
}
