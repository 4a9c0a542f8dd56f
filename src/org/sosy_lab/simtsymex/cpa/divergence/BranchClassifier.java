// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cpa.divergence;

import com.google.common.collect.ImmutableList;
import java.util.Set;
import org.sosy_lab.simtsymex.util.expr.NotExpr;
import org.sosy_lab.simtsymex.util.expr.SymExpr;
import org.sosy_lab.simtsymex.util.expr.SymExprs;

/** Decides the {@link BranchKind} of a branch condition. */
public final class BranchClassifier {

  private BranchClassifier() {}

  /**
   * @param pCond the branch condition, with block and thread indices still symbolic
   * @param pResolvedTdcConds thread dependent conditions already decided on the current path
   */
  public static BranchKind classify(SymExpr pCond, Set<SymExpr> pResolvedTdcConds) {
    if (pCond.isConstant()) {
      return BranchKind.OTHER;
    }
    if (!SymExprs.dependsOnlyOnThreadIds(pCond)) {
      return BranchKind.SYM;
    }
    if (isAccumulated(SymExprs.flattenConjuncts(pCond), pResolvedTdcConds)
        || isAccumulated(SymExprs.flattenDisjuncts(pCond), pResolvedTdcConds)) {
      return BranchKind.ACCUM;
    }
    return BranchKind.TDC;
  }

  private static boolean isAccumulated(ImmutableList<SymExpr> pParts, Set<SymExpr> pResolved) {
    if (pParts.size() < 2) {
      return false;
    }
    for (SymExpr part : pParts) {
      SymExpr positive = part instanceof NotExpr ? ((NotExpr) part).getOperand() : part;
      if (!pResolved.contains(part) && !pResolved.contains(positive)) {
        return false;
      }
    }
    return true;
  }
}
