// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.util.expr;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.sosy_lab.simtsymex.util.expr.SymExpr.Kind;
import org.sosy_lab.simtsymex.util.expr.VariableExpr.Role;

/** Static helpers for traversing and rewriting {@link SymExpr}s. */
public final class SymExprs {

  private SymExprs() {}

  /** Collects all variables occurring in {@code pExpr}. */
  public static ImmutableSet<VariableExpr> collectVariables(SymExpr pExpr) {
    ImmutableSet.Builder<VariableExpr> result = ImmutableSet.builder();
    // shared subexpressions are visited once
    Set<SymExpr> visited = Sets.newIdentityHashSet();
    Deque<SymExpr> waitlist = new ArrayDeque<>();
    waitlist.push(pExpr);
    while (!waitlist.isEmpty()) {
      SymExpr current = waitlist.pop();
      if (!visited.add(current)) {
        continue;
      }
      if (current instanceof VariableExpr) {
        result.add((VariableExpr) current);
      }
      for (SymExpr child : current.getChildren()) {
        waitlist.push(child);
      }
    }
    return result.build();
  }

  /**
   * Returns true if the value of {@code pExpr} is determined by the block and thread index of the
   * executing thread alone. Constants trivially are.
   */
  public static boolean dependsOnlyOnThreadIds(SymExpr pExpr) {
    for (VariableExpr var : collectVariables(pExpr)) {
      if (!var.getRole().isThreadIdentity()) {
        return false;
      }
    }
    return true;
  }

  /** Splits nested boolean conjunctions into their operands. */
  public static ImmutableList<SymExpr> flattenConjuncts(SymExpr pExpr) {
    return flatten(pExpr, Kind.AND);
  }

  /** Splits nested boolean disjunctions into their operands. */
  public static ImmutableList<SymExpr> flattenDisjuncts(SymExpr pExpr) {
    return flatten(pExpr, Kind.OR);
  }

  private static ImmutableList<SymExpr> flatten(SymExpr pExpr, Kind pKind) {
    ImmutableList.Builder<SymExpr> result = ImmutableList.builder();
    Deque<SymExpr> waitlist = new ArrayDeque<>();
    waitlist.push(pExpr);
    while (!waitlist.isEmpty()) {
      SymExpr current = waitlist.pop();
      if (current.getKind() == pKind && current.isBoolean()) {
        // right child first so that operands come out left to right
        waitlist.push(current.getChild(1));
        waitlist.push(current.getChild(0));
      } else {
        result.add(current);
      }
    }
    return result.build();
  }

  /** Replaces variables by the given expressions and re-canonicalizes the result. */
  public static SymExpr substitute(
      SymExprManager pMgr, SymExpr pExpr, Map<VariableExpr, SymExpr> pBindings) {
    checkNotNull(pBindings);
    if (pBindings.isEmpty()) {
      return pExpr;
    }
    return substitute(pMgr, pExpr, pBindings, new HashMap<>());
  }

  private static SymExpr substitute(
      SymExprManager pMgr,
      SymExpr pExpr,
      Map<VariableExpr, SymExpr> pBindings,
      Map<SymExpr, SymExpr> pCache) {
    SymExpr cached = pCache.get(pExpr);
    if (cached != null) {
      return cached;
    }
    SymExpr result;
    switch (pExpr.getKind()) {
      case CONSTANT:
        result = pExpr;
        break;
      case VARIABLE:
        result = pBindings.getOrDefault((VariableExpr) pExpr, pExpr);
        break;
      case NOT:
        result = pMgr.makeNot(substitute(pMgr, pExpr.getChild(0), pBindings, pCache));
        break;
      case SELECT:
        result =
            pMgr.makeSelect(
                substitute(pMgr, pExpr.getChild(0), pBindings, pCache),
                substitute(pMgr, pExpr.getChild(1), pBindings, pCache),
                substitute(pMgr, pExpr.getChild(2), pBindings, pCache));
        break;
      default:
        List<SymExpr> children = pExpr.getChildren();
        result =
            pMgr.makeBinary(
                pExpr.getKind(),
                substitute(pMgr, children.get(0), pBindings, pCache),
                substitute(pMgr, children.get(1), pBindings, pCache));
        break;
    }
    pCache.put(pExpr, result);
    return result;
  }

  /**
   * Instantiates all block and thread index variables of {@code pExpr} with the identity of one
   * concrete thread. For a thread-id derived condition the result is a boolean constant.
   */
  public static SymExpr bindThreadIdentity(
      SymExprManager pMgr, SymExpr pExpr, int pBlockId, int pThreadId) {
    ImmutableMap.Builder<VariableExpr, SymExpr> bindings = ImmutableMap.builder();
    for (VariableExpr var : collectVariables(pExpr)) {
      if (var.getRole() == Role.BLOCK_ID) {
        bindings.put(var, pMgr.makeConstant(pBlockId, var.getWidth()));
      } else if (var.getRole() == Role.THREAD_ID) {
        bindings.put(var, pMgr.makeConstant(pThreadId, var.getWidth()));
      }
    }
    return substitute(pMgr, pExpr, bindings.buildOrThrow());
  }
}
