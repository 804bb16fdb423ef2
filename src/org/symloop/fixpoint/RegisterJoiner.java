// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.fixpoint;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Map;
import java.util.logging.Level;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.BitvectorFormula;
import org.sosy_lab.java_smt.api.Formula;
import org.symloop.exceptions.StructuralMismatchException;
import org.symloop.exceptions.UnsupportedJoinException;
import org.symloop.exec.RegEntry;
import org.symloop.exec.RegType;
import org.symloop.exec.RegType.BoolType;
import org.symloop.exec.RegType.PointerType;
import org.symloop.exec.RegType.StructType;
import org.symloop.exec.RegValue;
import org.symloop.exec.RegValue.BoolValue;
import org.symloop.exec.RegValue.PointerValue;
import org.symloop.exec.RegValue.StructValue;
import org.symloop.exec.RegisterFile;
import org.symloop.memory.Pointer;
import org.symloop.util.smt.SymbolicContext;

/**
 * Joins the registers seen at two visits of a loop header.
 *
 * <p>Pointer offsets that differ between the visits are replaced by widening variables, which are
 * recorded in the substitution together with their header and body value. A widening variable
 * that already exists is never re-created: only its body value is updated. Booleans are always
 * replaced by fresh unconstrained variables.
 */
@Options(prefix = "loopfixpoint")
public class RegisterJoiner {

  static final String REGISTER_JOIN_PREFIX = "reg_join_var";
  static final String BOOL_JOIN_PREFIX = "bool_join_var";

  static final String POINTER_PASS_THROUGH_SUFFIX = "_reg";

  @Option(
      secure = true,
      description =
          "Name prefix of symbolic variables that mark registers as irrelevant. Such registers are"
              + " kept unchanged by the join. A boolean register is kept if its variable starts"
              + " with this prefix, a pointer register only if its offset variable starts with"
              + " the prefix followed by \"_reg\". Pointer regions are concrete and not checked.")
  private String passThroughPrefix = "cmacaw";

  private final SymbolicContext context;
  private final LogManager logger;

  /** Result of a join: the joined registers and the extended substitution. */
  public static final class JoinResult {
    private final RegisterFile registers;
    private final Substitution substitution;

    private JoinResult(RegisterFile pRegisters, Substitution pSubstitution) {
      registers = pRegisters;
      substitution = pSubstitution;
    }

    public RegisterFile getRegisters() {
      return registers;
    }

    public Substitution getSubstitution() {
      return substitution;
    }
  }

  public RegisterJoiner(SymbolicContext pContext, Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    context = checkNotNull(pContext);
    logger = checkNotNull(pLogger);
  }

  /**
   * Joins two register files of the same shape.
   *
   * @param pLeft the registers the loop body was started with
   * @param pRight the registers at the end of the loop body
   * @param pSubstitution the widening variables introduced so far
   * @throws StructuralMismatchException if the shapes of the register files differ
   * @throws UnsupportedJoinException if two values cannot be widened into one
   */
  public JoinResult join(RegisterFile pLeft, RegisterFile pRight, Substitution pSubstitution)
      throws StructuralMismatchException, UnsupportedJoinException {
    if (!pLeft.getTypes().equals(pRight.getTypes())) {
      throw new StructuralMismatchException(
          "register types differ between loop iterations: "
              + pLeft.getTypes()
              + " vs. "
              + pRight.getTypes());
    }

    SubstitutionBuilder builder = new SubstitutionBuilder(pSubstitution);
    ImmutableList.Builder<RegEntry> joined = ImmutableList.builder();
    for (int i = 0; i < pLeft.size(); i++) {
      RegEntry left = pLeft.get(i);
      RegType type = left.getType();
      RegValue value = joinValue(type, left.getValue(), pRight.get(i).getValue(), builder);
      joined.add(new RegEntry(type, value));
    }
    return new JoinResult(RegisterFile.of(joined.build()), builder.substitution);
  }

  private RegValue joinValue(
      RegType pType, RegValue pLeft, RegValue pRight, SubstitutionBuilder pSubst)
      throws StructuralMismatchException, UnsupportedJoinException {
    if (pType instanceof PointerType) {
      return joinPointer(asPointer(pLeft), asPointer(pRight), pSubst);

    } else if (pType instanceof BoolType) {
      BoolValue left = asBool(pLeft);
      if (context.isVariableWithPrefix(left.getValue(), passThroughPrefix)) {
        logger.log(Level.FINEST, "Keeping pass-through register", left);
        return left;
      }
      logger.log(Level.FINEST, "Joining booleans", left, "and", pRight, "to a fresh variable");
      return RegValue.bool(context.freshBoolean(BOOL_JOIN_PREFIX));

    } else if (pType instanceof StructType) {
      ImmutableList<RegType> fieldTypes = ((StructType) pType).getFields();
      ImmutableList<RegValue> leftFields = asStruct(pLeft, fieldTypes.size()).getFields();
      ImmutableList<RegValue> rightFields = asStruct(pRight, fieldTypes.size()).getFields();
      ImmutableList.Builder<RegValue> fields = ImmutableList.builder();
      for (int i = 0; i < fieldTypes.size(); i++) {
        fields.add(joinValue(fieldTypes.get(i), leftFields.get(i), rightFields.get(i), pSubst));
      }
      return RegValue.struct(fields.build());

    } else {
      throw new UnsupportedJoinException("cannot join registers of type " + pType);
    }
  }

  private RegValue joinPointer(Pointer pLeft, Pointer pRight, SubstitutionBuilder pSubst)
      throws UnsupportedJoinException {
    BitvectorFormula leftOffset = pLeft.getOffset();
    if (context.isVariableWithPrefix(
        leftOffset, passThroughPrefix + POINTER_PASS_THROUGH_SUFFIX)) {
      logger.log(Level.FINEST, "Keeping pass-through register", pLeft);
      return RegValue.pointer(pLeft);
    }
    if (pLeft.getRegion() != pRight.getRegion()) {
      throw new UnsupportedJoinException(
          "cannot join pointers into different regions: " + pLeft + " and " + pRight);
    }

    BitvectorFormula rightOffset = pRight.getOffset();
    if (leftOffset.equals(rightOffset)) {
      return RegValue.pointer(pLeft);
    }

    WideningEntry existing = pSubst.substitution.get(leftOffset);
    if (existing != null) {
      logger.log(
          Level.FINEST, "Updating", leftOffset, "from", existing.getBodyValue(), "to", rightOffset);
      pSubst.substitution =
          pSubst.substitution.with(leftOffset, existing.withBodyValue(rightOffset));
      return RegValue.pointer(pLeft);
    }

    BitvectorFormula joinVariable =
        context.freshBitvector(
            REGISTER_JOIN_PREFIX, context.getBitvectorFormulaManager().getLength(leftOffset));
    logger.log(Level.FINEST, "Introducing", joinVariable, "for", leftOffset, "and", rightOffset);
    pSubst.substitution =
        pSubst.substitution.with(joinVariable, new WideningEntry(leftOffset, rightOffset));
    return RegValue.pointer(pLeft.withOffset(joinVariable));
  }

  /**
   * Replaces every pointer offset that is a key of the equality substitution by its value.
   *
   * @throws StructuralMismatchException if a replacement is not a bit-vector
   */
  public RegisterFile applySubstitution(
      Map<? extends Formula, ? extends Formula> pEqualities, RegisterFile pRegisters)
      throws StructuralMismatchException {
    ImmutableList.Builder<RegEntry> result = ImmutableList.builder();
    for (RegEntry entry : pRegisters.getEntries()) {
      result.add(new RegEntry(entry.getType(), substitute(pEqualities, entry.getValue())));
    }
    return RegisterFile.of(result.build());
  }

  private static RegValue substitute(
      Map<? extends Formula, ? extends Formula> pEqualities, RegValue pValue)
      throws StructuralMismatchException {
    if (pValue instanceof PointerValue) {
      Pointer pointer = ((PointerValue) pValue).getPointer();
      Formula replacement = pEqualities.get(pointer.getOffset());
      if (replacement == null) {
        return pValue;
      }
      if (!(replacement instanceof BitvectorFormula)) {
        throw new StructuralMismatchException(
            "pointer offset " + pointer.getOffset() + " replaced by non-bit-vector " + replacement);
      }
      return RegValue.pointer(pointer.withOffset((BitvectorFormula) replacement));

    } else if (pValue instanceof StructValue) {
      ImmutableList.Builder<RegValue> fields = ImmutableList.builder();
      for (RegValue field : ((StructValue) pValue).getFields()) {
        fields.add(substitute(pEqualities, field));
      }
      return RegValue.struct(fields.build());
    }
    return pValue;
  }

  private static Pointer asPointer(RegValue pValue) throws StructuralMismatchException {
    if (!(pValue instanceof PointerValue)) {
      throw new StructuralMismatchException("expected a pointer register, got " + pValue);
    }
    return ((PointerValue) pValue).getPointer();
  }

  private static BoolValue asBool(RegValue pValue) throws StructuralMismatchException {
    if (!(pValue instanceof BoolValue)) {
      throw new StructuralMismatchException("expected a boolean register, got " + pValue);
    }
    return (BoolValue) pValue;
  }

  private static StructValue asStruct(RegValue pValue, int pFieldCount)
      throws StructuralMismatchException {
    if (!(pValue instanceof StructValue)
        || ((StructValue) pValue).getFields().size() != pFieldCount) {
      throw new StructuralMismatchException(
          "expected a struct register with " + pFieldCount + " fields, got " + pValue);
    }
    return (StructValue) pValue;
  }

  /** The substitution threaded through one join. */
  private static final class SubstitutionBuilder {
    private Substitution substitution;

    private SubstitutionBuilder(Substitution pInitial) {
      substitution = pInitial;
    }
  }
}
