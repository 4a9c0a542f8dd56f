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

/** If-then-else over a boolean condition. */
public final class SelectExpr extends SymExpr {

  private final ImmutableList<SymExpr> children;

  SelectExpr(SymExpr pCond, SymExpr pTrue, SymExpr pFalse) {
    super(Kind.SELECT, pTrue.getWidth());
    children = ImmutableList.of(pCond, pTrue, pFalse);
  }

  public SymExpr getCondition() {
    return children.get(0);
  }

  public SymExpr getTrueExpr() {
    return children.get(1);
  }

  public SymExpr getFalseExpr() {
    return children.get(2);
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
