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
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.util.Locale;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.simtsymex.util.expr.SymExpr.Kind;
import org.sosy_lab.simtsymex.util.expr.VariableExpr.Role;

public class SymExprManagerTest {

  private SymExprManager mgr;
  private SymExpr tid;
  private SymExpr x;

  @Before
  public void setUp() {
    mgr = new SymExprManager();
    tid = mgr.makeThreadId("tid.x");
    x = mgr.makeVariable("x", SymExprManager.ID_WIDTH, Role.DATA);
  }

  private SymExpr c(long pValue) {
    return mgr.makeConstant(pValue, SymExprManager.ID_WIDTH);
  }

  @Test
  public void structurallyEqualExpressionsAreShared() {
    SymExpr first = mgr.makeUlt(tid, c(4));
    SymExpr second = mgr.makeUlt(mgr.makeThreadId("tid.x"), c(4));
    assertSame(first, second);
    assertSame(mgr.makeAdd(x, tid), mgr.makeAdd(tid, x));
  }

  @Test
  public void instanceCounterIgnoresSharedExpressions() {
    long before = mgr.getNumberOfInstances();
    SymExpr sum = mgr.makeAdd(x, c(3));
    long afterFirst = mgr.getNumberOfInstances();
    assertSame(sum, mgr.makeAdd(c(3), x));
    assertEquals(afterFirst, mgr.getNumberOfInstances());
    // constant 3 and the sum
    assertEquals(before + 2, afterFirst);
  }

  @Test
  public void constantGoesLeftInCommutativeOperators() {
    SymExpr sum = mgr.makeAdd(x, c(3));
    assertEquals(Kind.ADD, sum.getKind());
    assertTrue(sum.getChild(0).isConstant());
    assertSame(x, sum.getChild(1));

    SymExpr diff = mgr.makeSub(x, c(3));
    assertSame(x, diff.getChild(0));
  }

  @Test
  public void constantOperandsAreFolded() {
    assertSame(c(7), mgr.makeAdd(c(3), c(4)));
    assertSame(c(0xFFFFFFFFL), mgr.makeSub(c(0), c(1)));
    assertTrue(mgr.makeUlt(c(1), c(2)).isTrue());
    assertTrue(mgr.makeSlt(c(0xFFFFFFFFL), c(0)).isTrue());
    assertTrue(mgr.makeUlt(c(0xFFFFFFFFL), c(0)).isFalse());
    assertSame(mgr.makeFalse(), mgr.makeNot(mgr.makeTrue()));
  }

  @Test
  public void greaterComparisonsAreRewritten() {
    SymExpr ugt = mgr.makeUgt(tid, c(2));
    assertEquals(Kind.ULT, ugt.getKind());
    assertSame(mgr.makeUlt(c(2), tid), ugt);
    assertSame(mgr.makeSle(x, tid), mgr.makeSge(tid, x));
    SymExpr ne = mgr.makeNe(tid, c(0));
    assertEquals(Kind.NOT, ne.getKind());
    assertEquals(Kind.EQ, ne.getChild(0).getKind());
  }

  @Test
  public void booleanIdentities() {
    SymExpr cond = mgr.makeUlt(tid, c(4));
    assertSame(cond, mgr.makeAnd(mgr.makeTrue(), cond));
    assertSame(mgr.makeFalse(), mgr.makeAnd(cond, mgr.makeFalse()));
    assertSame(cond, mgr.makeOr(cond, mgr.makeFalse()));
    assertSame(cond, mgr.makeNot(mgr.makeNot(cond)));
    assertSame(cond, mgr.makeAnd(cond, cond));
    assertSame(mgr.makeNot(cond), mgr.makeEq(mgr.makeFalse(), cond));
    assertTrue(mgr.makeEq(x, x).isTrue());
    assertTrue(mgr.makeUlt(x, c(0)).isFalse());
    assertSame(mgr.makeTrue(), mgr.makeAnd(ImmutableList.of()));
  }

  @Test
  public void selectSimplifies() {
    SymExpr cond = mgr.makeEq(tid, c(0));
    assertSame(x, mgr.makeSelect(mgr.makeTrue(), x, tid));
    assertSame(cond, mgr.makeSelect(cond, mgr.makeTrue(), mgr.makeFalse()));
    assertSame(x, mgr.makeSelect(cond, x, x));
    assertEquals(Kind.SELECT, mgr.makeSelect(cond, x, tid).getKind());
  }

  @Test
  public void expressionsOfDifferentManagersAreEqualButNotShared() {
    SymExprManager other = new SymExprManager();
    SymExpr mine = mgr.makeUlt(tid, c(4));
    SymExpr theirs =
        other.makeUlt(other.makeThreadId("tid.x"), other.makeConstant(4, SymExprManager.ID_WIDTH));
    assertNotSame(mine, theirs);
    assertEquals(mine, theirs);
    assertEquals(mine.hashCode(), theirs.hashCode());
    assertEquals(0, mine.compareTo(theirs));
  }

  @Test(expected = IllegalArgumentException.class)
  public void widthMismatchIsRejected() {
    mgr.makeAdd(x, mgr.makeTrue());
  }

  @Test
  public void printsReadably() {
    assertEquals("(Ult tid.x 4)", mgr.makeUlt(tid, c(4)).toString());
    assertEquals("true", mgr.makeTrue().toString());
    assertFalse(mgr.makeUlt(tid, c(4)).isConstant());
  }

  @Test
  public void printingIgnoresDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      SymExpr select = mgr.makeSelect(mgr.makeEq(tid, c(0)), x, tid);
      assertEquals("(Select (Eq 0 tid.x) x tid.x)", select.toString());
      assertEquals("(Slt x tid.x)", mgr.makeSlt(x, tid).toString());
    } finally {
      Locale.setDefault(previous);
    }
  }
}
