// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cpa.divergence;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.simtsymex.util.expr.SymExpr;
import org.sosy_lab.simtsymex.util.expr.SymExprManager;

/**
 * One successor of a branch: the contiguous range {@code [start, end)} of ordered thread slots
 * that took it, its condition, and whether that range has reached a barrier or the merge point of
 * the branch.
 */
public final class BranchConfig {

  private final int symBid;
  private final int symTid;
  private SymExpr cond;
  // condition before negateNonTDCNodeCond, null while not negated
  private SymExpr originalCond = null;
  private int start;
  private int end;
  private boolean syncEncounter = false;
  private boolean postDomEncounter = false;
  private boolean keep = true;

  /**
   * @param pSymBid block index of the representative thread
   * @param pSymTid thread index of the representative thread
   * @param pCond condition under which the range takes this successor
   * @param pStart first slot index of the range
   * @param pEnd slot index after the range
   */
  public BranchConfig(int pSymBid, int pSymTid, SymExpr pCond, int pStart, int pEnd) {
    checkArgument(0 <= pStart && pStart <= pEnd, "invalid range [%s, %s)", pStart, pEnd);
    symBid = pSymBid;
    symTid = pSymTid;
    cond = checkNotNull(pCond);
    start = pStart;
    end = pEnd;
  }

  public BranchConfig(BranchConfig pConfig) {
    symBid = pConfig.symBid;
    symTid = pConfig.symTid;
    cond = pConfig.cond;
    originalCond = pConfig.originalCond;
    start = pConfig.start;
    end = pConfig.end;
    syncEncounter = pConfig.syncEncounter;
    postDomEncounter = pConfig.postDomEncounter;
    keep = pConfig.keep;
  }

  public int getBlockId() {
    return symBid;
  }

  public int getThreadId() {
    return symTid;
  }

  public SymExpr getCondition() {
    return cond;
  }

  void setCondition(SymExpr pCond) {
    cond = checkNotNull(pCond);
    originalCond = null;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public int size() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  public boolean contains(int pIndex) {
    return start <= pIndex && pIndex < end;
  }

  public boolean hasSameRange(BranchConfig pOther) {
    return start == pOther.start && end == pOther.end;
  }

  void setRange(int pStart, int pEnd) {
    checkArgument(0 <= pStart && pStart <= pEnd, "invalid range [%s, %s)", pStart, pEnd);
    start = pStart;
    end = pEnd;
  }

  public boolean isSyncEncounter() {
    return syncEncounter;
  }

  void setSyncEncounter(boolean pSyncEncounter) {
    syncEncounter = pSyncEncounter;
  }

  public boolean isPostDomEncounter() {
    return postDomEncounter;
  }

  void setPostDomEncounter(boolean pPostDomEncounter) {
    postDomEncounter = pPostDomEncounter;
  }

  public boolean isKept() {
    return keep;
  }

  void setKeep(boolean pKeep) {
    keep = pKeep;
  }

  /** A range is done if it was pruned or all its threads reached a synchronization point. */
  public boolean isDone() {
    return !keep || syncEncounter || postDomEncounter;
  }

  public boolean isNegated() {
    return originalCond != null;
  }

  void negate(SymExprManager pMgr) {
    if (originalCond == null) {
      originalCond = cond;
      cond = pMgr.makeNot(cond);
    } else {
      cond = originalCond;
      originalCond = null;
    }
  }

  void resetNegation() {
    if (originalCond != null) {
      cond = originalCond;
      originalCond = null;
    }
  }

  @Override
  public String toString() {
    return String.format(
        "[%d, %d) b%d.t%d %s%s%s%s",
        start,
        end,
        symBid,
        symTid,
        cond,
        syncEncounter ? " sync" : "",
        postDomEncounter ? " postdom" : "",
        keep ? "" : " pruned");
  }
}
