// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.util.expr;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A bit-vector constant; booleans are constants of width {@link SymExpr#BOOL}. */
public final class ConstantExpr extends SymExpr {

  private final long value;

  ConstantExpr(long pValue, int pWidth) {
    super(Kind.CONSTANT, pWidth);
    value = pValue & mask(pWidth);
  }

  static long mask(int pWidth) {
    return pWidth >= Long.SIZE ? -1L : (1L << pWidth) - 1;
  }

  /** The value interpreted as unsigned number of this width. */
  public long getZExtValue() {
    return value;
  }

  /** The value interpreted as two's complement number of this width. */
  public long getSExtValue() {
    int width = getWidth();
    if (width >= Long.SIZE) {
      return value;
    }
    int shift = Long.SIZE - width;
    return (value << shift) >> shift;
  }

  public boolean isAllOnes() {
    return value == mask(getWidth());
  }

  @Override
  public List<SymExpr> getChildren() {
    return ImmutableList.of();
  }

  @Override
  public boolean isZero() {
    return value == 0;
  }

  @Override
  public boolean isTrue() {
    return isBoolean() && value == 1;
  }

  @Override
  public boolean isFalse() {
    return isBoolean() && value == 0;
  }

  @Override
  int compareContents(SymExpr pOther) {
    return Long.compareUnsigned(value, ((ConstantExpr) pOther).value);
  }

  @Override
  int contentsHash() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    if (isBoolean()) {
      return value == 1 ? "true" : "false";
    }
    return Long.toUnsignedString(value);
  }
}
