// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cpa.divergence;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.sosy_lab.simtsymex.util.expr.SymExpr;
import org.sosy_lab.simtsymex.util.expr.SymExprManager;
import org.sosy_lab.simtsymex.util.expr.VariableExpr.Role;

public class BranchClassifierTest {

  private final SymExprManager mgr = new SymExprManager();
  private final SymExpr tid = mgr.makeThreadId("tid.x");
  private final SymExpr data = mgr.makeVariable("n", SymExprManager.ID_WIDTH, Role.DATA);

  private SymExpr c(long pValue) {
    return mgr.makeConstant(pValue, SymExprManager.ID_WIDTH);
  }

  @Test
  public void classifiesByVariables() {
    assertEquals(
        BranchKind.TDC, BranchClassifier.classify(mgr.makeUlt(tid, c(2)), ImmutableSet.of()));
    assertEquals(
        BranchKind.SYM, BranchClassifier.classify(mgr.makeUlt(tid, data), ImmutableSet.of()));
    assertEquals(BranchKind.OTHER, BranchClassifier.classify(mgr.makeTrue(), ImmutableSet.of()));
  }

  @Test
  public void compositionOfDecidedConditionsIsAccumulated() {
    SymExpr low = mgr.makeUlt(tid, c(2));
    SymExpr even = mgr.makeEq(mgr.makeAnd(tid, c(1)), c(0));
    SymExpr both = mgr.makeAnd(low, mgr.makeNot(even));

    assertEquals(BranchKind.TDC, BranchClassifier.classify(both, ImmutableSet.of(low)));
    assertEquals(BranchKind.ACCUM, BranchClassifier.classify(both, ImmutableSet.of(low, even)));
    assertEquals(
        BranchKind.ACCUM,
        BranchClassifier.classify(mgr.makeOr(low, even), ImmutableSet.of(low, even)));
  }

  @Test
  public void kindsMerge() {
    assertEquals(BranchKind.TDC, BranchKind.TDC.mergeWith(BranchKind.OTHER));
    assertEquals(BranchKind.SYM, BranchKind.OTHER.mergeWith(BranchKind.SYM));
    assertEquals(BranchKind.TDC, BranchKind.TDC.mergeWith(BranchKind.ACCUM));
    assertNull(BranchKind.TDC.mergeWith(BranchKind.SYM));
    assertNull(BranchKind.SYM.mergeWith(BranchKind.ACCUM));
    assertTrue(BranchKind.ACCUM.isThreadIdDerived());
    assertFalse(BranchKind.SYM.isThreadIdDerived());
  }
}
