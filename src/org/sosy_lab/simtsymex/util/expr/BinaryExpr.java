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

/** Arithmetic, bitwise and comparison operators. Comparisons are always boolean. */
public final class BinaryExpr extends SymExpr {

  private final ImmutableList<SymExpr> children;

  BinaryExpr(Kind pKind, SymExpr pLeft, SymExpr pRight) {
    super(pKind, pKind.isComparison() ? BOOL : pLeft.getWidth());
    children = ImmutableList.of(pLeft, pRight);
  }

  public SymExpr getLeft() {
    return children.get(0);
  }

  public SymExpr getRight() {
    return children.get(1);
  }

  @Override
  public List<SymExpr> getChildren() {
    return children;
  }

  @Override
  int compareContents(SymExpr pOther) {
    return 0;
  }

  @Override
  int contentsHash() {
    return 0;
  }
}
