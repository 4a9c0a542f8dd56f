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

/** Bitwise negation; logical negation on booleans. */
public final class NotExpr extends SymExpr {

  private final ImmutableList<SymExpr> children;

  NotExpr(SymExpr pOperand) {
    super(Kind.NOT, pOperand.getWidth());
    children = ImmutableList.of(pOperand);
  }

  public SymExpr getOperand() {
    return children.get(0);
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
