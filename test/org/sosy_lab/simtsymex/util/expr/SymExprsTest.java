// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.util.expr;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.simtsymex.util.expr.VariableExpr.Role;

public class SymExprsTest {

  private SymExprManager mgr;
  private SymExpr tid;
  private SymExpr bid;
  private SymExpr data;

  @Before
  public void setUp() {
    mgr = new SymExprManager();
    tid = mgr.makeThreadId("tid.x");
    bid = mgr.makeBlockId("bid.x");
    data = mgr.makeVariable("input[0]", SymExprManager.ID_WIDTH, Role.DATA);
  }

  private SymExpr c(long pValue) {
    return mgr.makeConstant(pValue, SymExprManager.ID_WIDTH);
  }

  @Test
  public void collectVariablesFindsEveryVariableOnce() {
    SymExpr expr = mgr.makeAnd(mgr.makeUlt(tid, data), mgr.makeEq(tid, bid));
    assertEquals(ImmutableSet.of(tid, bid, data), SymExprs.collectVariables(expr));
    assertTrue(SymExprs.collectVariables(c(5)).isEmpty());
  }

  @Test
  public void threadDependence() {
    assertTrue(SymExprs.dependsOnlyOnThreadIds(mgr.makeUlt(tid, c(16))));
    assertTrue(SymExprs.dependsOnlyOnThreadIds(mgr.makeEq(mgr.makeAdd(bid, tid), c(3))));
    assertTrue(SymExprs.dependsOnlyOnThreadIds(mgr.makeTrue()));
    assertFalse(SymExprs.dependsOnlyOnThreadIds(mgr.makeUlt(tid, data)));
  }

  @Test
  public void flattenNestedConjunctions() {
    SymExpr a = mgr.makeUlt(tid, c(4));
    SymExpr b = mgr.makeEq(bid, c(0));
    SymExpr d = mgr.makeUlt(data, c(9));
    SymExpr conj = mgr.makeAnd(mgr.makeAnd(a, b), d);
    assertEquals(ImmutableSet.of(a, b, d), ImmutableSet.copyOf(SymExprs.flattenConjuncts(conj)));
    assertEquals(ImmutableList.of(a), SymExprs.flattenConjuncts(a));
    assertEquals(ImmutableList.of(conj), SymExprs.flattenDisjuncts(conj));
  }

  @Test
  public void bindingThreadIdentityDecidesThreadDependentConditions() {
    SymExpr cond = mgr.makeUlt(mgr.makeAdd(mgr.makeMul(bid, c(32)), tid), c(40));
    assertTrue(SymExprs.bindThreadIdentity(mgr, cond, 1, 7).isTrue());
    assertTrue(SymExprs.bindThreadIdentity(mgr, cond, 1, 8).isFalse());
    assertTrue(SymExprs.bindThreadIdentity(mgr, cond, 0, 31).isTrue());
  }

  @Test
  public void bindingKeepsDataVariables() {
    SymExpr cond = mgr.makeUlt(tid, data);
    SymExpr bound = SymExprs.bindThreadIdentity(mgr, cond, 0, 2);
    assertSame(mgr.makeUlt(c(2), data), bound);
  }

  @Test
  public void substituteRecanonicalizes() {
    SymExpr expr = mgr.makeAdd(data, tid);
    SymExpr result =
        SymExprs.substitute(mgr, expr, ImmutableMap.of((VariableExpr) tid, c(0)));
    assertSame(data, result);
    assertSame(expr, SymExprs.substitute(mgr, expr, ImmutableMap.of()));
  }

  @Test
  public void sharedSubexpressionsAreVisitedOnce() {
    SymExpr expr = mgr.makeAdd(tid, data);
    // 2^64 paths, but only 66 distinct nodes
    for (int i = 0; i < 64; i++) {
      expr = mgr.makeMul(expr, expr);
    }
    assertEquals(ImmutableSet.of(tid, data), SymExprs.collectVariables(expr));
    assertFalse(SymExprs.dependsOnlyOnThreadIds(expr));
  }
}
