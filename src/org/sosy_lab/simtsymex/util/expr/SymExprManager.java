// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.util.expr;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.util.concurrent.atomic.AtomicLong;
import org.sosy_lab.simtsymex.util.expr.SymExpr.Kind;
import org.sosy_lab.simtsymex.util.expr.VariableExpr.Role;

/**
 * Creates canonical, hash-consed expressions.
 *
 * <p>Canonical form: no operator has only constant operands (they are folded), a constant operand
 * of a commutative operator is always on the left and other operands of commutative operators are
 * sorted structurally, and only the comparisons {@code Eq, Ult, Ule, Slt, Sle} occur. Every
 * combination returns a new or an already existing instance; expressions are never mutated.
 */
public final class SymExprManager {

  /** Default width of block and thread index variables. */
  public static final int ID_WIDTH = 32;

  private final Interner<SymExpr> interner = Interners.newStrongInterner();
  private final AtomicLong instances = new AtomicLong();

  private final SymExpr trueExpr;
  private final SymExpr falseExpr;

  public SymExprManager() {
    trueExpr = intern(new ConstantExpr(1, SymExpr.BOOL));
    falseExpr = intern(new ConstantExpr(0, SymExpr.BOOL));
  }

  /** Number of distinct expressions created by this manager so far. */
  public long getNumberOfInstances() {
    return instances.get();
  }

  private SymExpr intern(SymExpr pCandidate) {
    SymExpr canonical = interner.intern(pCandidate);
    if (canonical == pCandidate) {
      instances.incrementAndGet();
    }
    return canonical;
  }

  // constants and variables

  public SymExpr makeTrue() {
    return trueExpr;
  }

  public SymExpr makeFalse() {
    return falseExpr;
  }

  public SymExpr makeBool(boolean pValue) {
    return pValue ? trueExpr : falseExpr;
  }

  public SymExpr makeConstant(long pValue, int pWidth) {
    checkArgument(pWidth > 0 && pWidth <= Long.SIZE, "unsupported width %s", pWidth);
    if (pWidth == SymExpr.BOOL) {
      return makeBool((pValue & 1) == 1);
    }
    return intern(new ConstantExpr(pValue, pWidth));
  }

  public SymExpr makeVariable(String pName, int pWidth, Role pRole) {
    checkNotNull(pName);
    checkNotNull(pRole);
    checkArgument(pWidth > 0 && pWidth <= Long.SIZE, "unsupported width %s", pWidth);
    return intern(new VariableExpr(pName, pWidth, pRole));
  }

  public SymExpr makeThreadId(String pName) {
    return makeVariable(pName, ID_WIDTH, Role.THREAD_ID);
  }

  public SymExpr makeBlockId(String pName) {
    return makeVariable(pName, ID_WIDTH, Role.BLOCK_ID);
  }

  // operators

  public SymExpr makeNot(SymExpr pOperand) {
    if (pOperand instanceof ConstantExpr) {
      return makeConstant(~((ConstantExpr) pOperand).getZExtValue(), pOperand.getWidth());
    }
    if (pOperand instanceof NotExpr) {
      return ((NotExpr) pOperand).getOperand();
    }
    return intern(new NotExpr(pOperand));
  }

  public SymExpr makeAnd(SymExpr pLeft, SymExpr pRight) {
    return makeBinary(Kind.AND, pLeft, pRight);
  }

  public SymExpr makeAnd(Iterable<SymExpr> pOperands) {
    SymExpr result = trueExpr;
    for (SymExpr operand : pOperands) {
      result = makeAnd(result, operand);
    }
    return result;
  }

  public SymExpr makeOr(SymExpr pLeft, SymExpr pRight) {
    return makeBinary(Kind.OR, pLeft, pRight);
  }

  public SymExpr makeXor(SymExpr pLeft, SymExpr pRight) {
    return makeBinary(Kind.XOR, pLeft, pRight);
  }

  public SymExpr makeAdd(SymExpr pLeft, SymExpr pRight) {
    return makeBinary(Kind.ADD, pLeft, pRight);
  }

  public SymExpr makeSub(SymExpr pLeft, SymExpr pRight) {
    return makeBinary(Kind.SUB, pLeft, pRight);
  }

  public SymExpr makeMul(SymExpr pLeft, SymExpr pRight) {
    return makeBinary(Kind.MUL, pLeft, pRight);
  }

  public SymExpr makeEq(SymExpr pLeft, SymExpr pRight) {
    return makeBinary(Kind.EQ, pLeft, pRight);
  }

  public SymExpr makeNe(SymExpr pLeft, SymExpr pRight) {
    return makeNot(makeEq(pLeft, pRight));
  }

  public SymExpr makeUlt(SymExpr pLeft, SymExpr pRight) {
    return makeBinary(Kind.ULT, pLeft, pRight);
  }

  public SymExpr makeUle(SymExpr pLeft, SymExpr pRight) {
    return makeBinary(Kind.ULE, pLeft, pRight);
  }

  public SymExpr makeUgt(SymExpr pLeft, SymExpr pRight) {
    return makeUlt(pRight, pLeft);
  }

  public SymExpr makeUge(SymExpr pLeft, SymExpr pRight) {
    return makeUle(pRight, pLeft);
  }

  public SymExpr makeSlt(SymExpr pLeft, SymExpr pRight) {
    return makeBinary(Kind.SLT, pLeft, pRight);
  }

  public SymExpr makeSle(SymExpr pLeft, SymExpr pRight) {
    return makeBinary(Kind.SLE, pLeft, pRight);
  }

  public SymExpr makeSgt(SymExpr pLeft, SymExpr pRight) {
    return makeSlt(pRight, pLeft);
  }

  public SymExpr makeSge(SymExpr pLeft, SymExpr pRight) {
    return makeSle(pRight, pLeft);
  }

  public SymExpr makeSelect(SymExpr pCond, SymExpr pTrue, SymExpr pFalse) {
    checkArgument(pCond.isBoolean(), "select condition must be boolean: %s", pCond);
    checkArgument(
        pTrue.getWidth() == pFalse.getWidth(), "width mismatch in select: %s, %s", pTrue, pFalse);
    if (pCond.isTrue()) {
      return pTrue;
    }
    if (pCond.isFalse()) {
      return pFalse;
    }
    if (pTrue.equals(pFalse)) {
      return pTrue;
    }
    if (pTrue.isBoolean()) {
      if (pTrue.isTrue() && pFalse.isFalse()) {
        return pCond;
      }
      if (pTrue.isFalse() && pFalse.isTrue()) {
        return makeNot(pCond);
      }
    }
    return intern(new SelectExpr(pCond, pTrue, pFalse));
  }

  /** Creates the binary operator {@code pKind}, folding and ordering operands canonically. */
  public SymExpr makeBinary(Kind pKind, SymExpr pLeft, SymExpr pRight) {
    checkArgument(pKind.isBinary(), "not a binary operator: %s", pKind);
    checkArgument(
        pLeft.getWidth() == pRight.getWidth(),
        "width mismatch in %s: %s, %s",
        pKind,
        pLeft,
        pRight);

    if (pLeft instanceof ConstantExpr && pRight instanceof ConstantExpr) {
      return fold(pKind, (ConstantExpr) pLeft, (ConstantExpr) pRight);
    }

    SymExpr left = pLeft;
    SymExpr right = pRight;
    if (pKind.isCommutative()
        && (right instanceof ConstantExpr
            || (!(left instanceof ConstantExpr) && left.compareTo(right) > 0))) {
      left = pRight;
      right = pLeft;
    }

    SymExpr simplified = simplify(pKind, left, right);
    if (simplified != null) {
      return simplified;
    }
    return intern(new BinaryExpr(pKind, left, right));
  }

  /** Algebraic identities; the constant operand of a commutative operator is {@code pLeft}. */
  private SymExpr simplify(Kind pKind, SymExpr pLeft, SymExpr pRight) {
    int width = pLeft.getWidth();
    ConstantExpr constant = pLeft instanceof ConstantExpr ? (ConstantExpr) pLeft : null;
    switch (pKind) {
      case AND:
        if (constant != null) {
          return constant.isZero() ? constant : (constant.isAllOnes() ? pRight : null);
        }
        return pLeft.equals(pRight) ? pLeft : null;
      case OR:
        if (constant != null) {
          return constant.isZero() ? pRight : (constant.isAllOnes() ? constant : null);
        }
        return pLeft.equals(pRight) ? pLeft : null;
      case XOR:
        if (constant != null) {
          if (constant.isZero()) {
            return pRight;
          }
          return constant.isAllOnes() ? makeNot(pRight) : null;
        }
        return pLeft.equals(pRight) ? makeConstant(0, width) : null;
      case ADD:
        return constant != null && constant.isZero() ? pRight : null;
      case MUL:
        if (constant != null) {
          if (constant.isZero()) {
            return constant;
          }
          return constant.getZExtValue() == 1 ? pRight : null;
        }
        return null;
      case SUB:
        if (pRight.isZero()) {
          return pLeft;
        }
        return pLeft.equals(pRight) ? makeConstant(0, width) : null;
      case EQ:
        if (pLeft.equals(pRight)) {
          return trueExpr;
        }
        if (constant != null && width == SymExpr.BOOL) {
          return constant.isTrue() ? pRight : makeNot(pRight);
        }
        return null;
      case ULE:
      case SLE:
        return pLeft.equals(pRight) ? trueExpr : null;
      case ULT:
        if (pLeft.equals(pRight) || pRight.isZero()) {
          return falseExpr;
        }
        return null;
      case SLT:
        return pLeft.equals(pRight) ? falseExpr : null;
      default:
        throw new AssertionError("unexpected binary operator " + pKind);
    }
  }

  private SymExpr fold(Kind pKind, ConstantExpr pLeft, ConstantExpr pRight) {
    int width = pLeft.getWidth();
    long l = pLeft.getZExtValue();
    long r = pRight.getZExtValue();
    switch (pKind) {
      case AND:
        return makeConstant(l & r, width);
      case OR:
        return makeConstant(l | r, width);
      case XOR:
        return makeConstant(l ^ r, width);
      case ADD:
        return makeConstant(l + r, width);
      case SUB:
        return makeConstant(l - r, width);
      case MUL:
        return makeConstant(l * r, width);
      case EQ:
        return makeBool(l == r);
      case ULT:
        return makeBool(Long.compareUnsigned(l, r) < 0);
      case ULE:
        return makeBool(Long.compareUnsigned(l, r) <= 0);
      case SLT:
        return makeBool(pLeft.getSExtValue() < pRight.getSExtValue());
      case SLE:
        return makeBool(pLeft.getSExtValue() <= pRight.getSExtValue());
      default:
        throw new AssertionError("unexpected binary operator " + pKind);
    }
  }
}
