// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.util.smt;

import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.math.BigInteger;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.SolverContextFactory;
import org.sosy_lab.java_smt.SolverContextFactory.Solvers;
import org.sosy_lab.java_smt.api.BitvectorFormula;
import org.sosy_lab.java_smt.api.BitvectorFormulaManager;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;
import org.sosy_lab.java_smt.api.Formula;
import org.sosy_lab.java_smt.api.FormulaManager;
import org.sosy_lab.java_smt.api.FormulaType;
import org.sosy_lab.java_smt.api.Model;
import org.sosy_lab.java_smt.api.ProverEnvironment;
import org.sosy_lab.java_smt.api.SolverContext;
import org.sosy_lab.java_smt.api.SolverContext.ProverOptions;
import org.sosy_lab.java_smt.api.SolverException;
import org.sosy_lab.java_smt.api.visitors.DefaultFormulaVisitor;
import org.sosy_lab.java_smt.api.visitors.FormulaVisitor;

/**
 * The expression layer used by the loop-fixpoint engine: a java-smt {@link SolverContext} plus
 * the handful of queries the engine needs on top of it (fresh variables, constant detection,
 * validity, free variables).
 *
 * <p>Instances are not thread-safe, the host executor drives them from a single thread.
 */
@Options(prefix = "symloop")
public class SymbolicContext implements AutoCloseable {

  @Option(
      secure = true,
      description = "SMT solver used for building formulas and for constant and validity queries")
  private Solvers solver = Solvers.PRINCESS;

  private static final String PROBE_PREFIX = "constant_probe";

  private static final FormulaVisitor<Optional<BigInteger>> LITERAL_VISITOR =
      new DefaultFormulaVisitor<>() {
        @Override
        protected Optional<BigInteger> visitDefault(Formula pFormula) {
          return Optional.empty();
        }

        @Override
        public Optional<BigInteger> visitConstant(Formula pFormula, Object pValue) {
          if (pValue instanceof BigInteger) {
            return Optional.of((BigInteger) pValue);
          }
          return Optional.empty();
        }
      };

  private final SolverContext solverContext;
  private final FormulaManager fmgr;
  private final BitvectorFormulaManager bvmgr;
  private final BooleanFormulaManager bmgr;

  private int freshCounter = 0;

  private SymbolicContext(
      Configuration pConfig, LogManager pLogger, ShutdownNotifier pShutdownNotifier)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    solverContext =
        SolverContextFactory.createSolverContext(pConfig, pLogger, pShutdownNotifier, solver);
    fmgr = solverContext.getFormulaManager();
    bvmgr = fmgr.getBitvectorFormulaManager();
    bmgr = fmgr.getBooleanFormulaManager();
  }

  public static SymbolicContext create(
      Configuration pConfig, LogManager pLogger, ShutdownNotifier pShutdownNotifier)
      throws InvalidConfigurationException {
    return new SymbolicContext(pConfig, pLogger, pShutdownNotifier);
  }

  public FormulaManager getFormulaManager() {
    return fmgr;
  }

  public BitvectorFormulaManager getBitvectorFormulaManager() {
    return bvmgr;
  }

  public BooleanFormulaManager getBooleanFormulaManager() {
    return bmgr;
  }

  /** Creates a bit-vector variable whose name has not been handed out by this context before. */
  public BitvectorFormula freshBitvector(String pPrefix, int pWidth) {
    return bvmgr.makeVariable(pWidth, nextName(pPrefix));
  }

  public BooleanFormula freshBoolean(String pPrefix) {
    return bmgr.makeVariable(nextName(pPrefix));
  }

  private String nextName(String pPrefix) {
    return pPrefix + "_" + freshCounter++;
  }

  public BitvectorFormula literal(int pWidth, BigInteger pValue) {
    return bvmgr.makeBitvector(pWidth, pValue);
  }

  public BitvectorFormula literal(int pWidth, long pValue) {
    return bvmgr.makeBitvector(pWidth, pValue);
  }

  /** Returns the free (uninterpreted) variables of the formula, in the order the solver reports. */
  public ImmutableSet<Formula> freeVariables(Formula pFormula) {
    return ImmutableSet.copyOf(fmgr.extractVariables(pFormula).values());
  }

  /** Whether the formula is a single variable whose name starts with the given prefix. */
  public boolean isVariableWithPrefix(Formula pFormula, String pPrefix) {
    Map<String, Formula> variables = fmgr.extractVariables(pFormula);
    if (variables.size() != 1) {
      return false;
    }
    Entry<String, Formula> variable = Iterables.getOnlyElement(variables.entrySet());
    return variable.getValue().equals(pFormula) && variable.getKey().startsWith(pPrefix);
  }

  public boolean isBitvectorOfWidth(Formula pFormula, int pWidth) {
    FormulaType<?> type = fmgr.getFormulaType(pFormula);
    return type.isBitvectorType() && ((FormulaType.BitvectorType) type).getSize() == pWidth;
  }

  /** Returns the unsigned value of the term if it is a bit-vector literal. */
  public Optional<BigInteger> asLiteral(BitvectorFormula pTerm) {
    return fmgr.visit(pTerm, LITERAL_VISITOR)
        .map(value -> toUnsigned(value, bvmgr.getLength(pTerm)));
  }

  /**
   * Returns the unsigned value of a bit-vector term if the term denotes exactly one value.
   *
   * <p>Literals are recognized syntactically. For any other term a model value is taken and the
   * solver is asked whether the term can differ from it.
   */
  public Optional<BigInteger> asConstant(BitvectorFormula pTerm)
      throws SolverException, InterruptedException {
    Optional<BigInteger> literal = asLiteral(pTerm);
    if (literal.isPresent()) {
      return literal;
    }
    int width = bvmgr.getLength(pTerm);

    try (ProverEnvironment prover =
        solverContext.newProverEnvironment(ProverOptions.GENERATE_MODELS)) {
      BitvectorFormula probe = freshBitvector(PROBE_PREFIX, width);
      prover.push(bvmgr.equal(probe, pTerm));
      verify(!prover.isUnsat(), "a definition of a fresh variable cannot be unsatisfiable");

      BigInteger candidate;
      try (Model model = prover.getModel()) {
        candidate = model.evaluate(probe);
      }
      if (candidate == null) {
        return Optional.empty();
      }
      candidate = toUnsigned(candidate, width);

      prover.push(bmgr.not(bvmgr.equal(pTerm, bvmgr.makeBitvector(width, candidate))));
      if (prover.isUnsat()) {
        return Optional.of(candidate);
      }
      return Optional.empty();
    }
  }

  /** Whether the predicate holds under every assignment. */
  public boolean isValid(BooleanFormula pPredicate) throws SolverException, InterruptedException {
    if (bmgr.isTrue(pPredicate)) {
      return true;
    }
    if (bmgr.isFalse(pPredicate)) {
      return false;
    }
    try (ProverEnvironment prover = solverContext.newProverEnvironment()) {
      prover.push(bmgr.not(pPredicate));
      return prover.isUnsat();
    }
  }

  private static BigInteger toUnsigned(BigInteger pValue, int pWidth) {
    if (pValue.signum() < 0) {
      return pValue.add(BigInteger.ONE.shiftLeft(pWidth));
    }
    return pValue;
  }

  public SolverContext getSolverContext() {
    return solverContext;
  }

  @Override
  public void close() {
    solverContext.close();
  }
}
