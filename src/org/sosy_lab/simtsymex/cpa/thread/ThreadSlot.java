// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cpa.thread;

import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.simtsymex.util.expr.SymExpr;

/**
 * Runtime record of one simulated GPU thread: its identity, warp membership, synchronization
 * flags and the path condition it inherited. Slots of pruned threads are retired, never reused.
 */
public final class ThreadSlot {

  private final int blockId;
  private final int threadId;
  private final int warpNum;

  // explicit or implicit barrier
  private boolean syncEncounter;
  // only explicit barrier
  private boolean barrierEncounter;
  private boolean inBranch;
  private SymExpr inheritedCond;
  private boolean slotUsed;
  private boolean keep;

  public ThreadSlot(
      int pBlockId,
      int pThreadId,
      int pWarpNum,
      boolean pSyncEncounter,
      boolean pBarrierEncounter,
      boolean pInBranch,
      SymExpr pInheritedCond,
      boolean pSlotUsed,
      boolean pKeep) {
    blockId = pBlockId;
    threadId = pThreadId;
    warpNum = pWarpNum;
    syncEncounter = pSyncEncounter;
    barrierEncounter = pBarrierEncounter;
    inBranch = pInBranch;
    inheritedCond = checkNotNull(pInheritedCond);
    slotUsed = pSlotUsed;
    keep = pKeep;
  }

  public ThreadSlot(ThreadSlot pOther) {
    this(
        pOther.blockId,
        pOther.threadId,
        pOther.warpNum,
        pOther.syncEncounter,
        pOther.barrierEncounter,
        pOther.inBranch,
        pOther.inheritedCond,
        pOther.slotUsed,
        pOther.keep);
  }

  /** A slot for a thread that is tracked from now on. */
  public static ThreadSlot create(int pBlockId, int pThreadId, int pWarpNum, SymExpr pCond) {
    return new ThreadSlot(pBlockId, pThreadId, pWarpNum, false, false, false, pCond, true, true);
  }

  public int getBlockId() {
    return blockId;
  }

  public int getThreadId() {
    return threadId;
  }

  public int getWarpNum() {
    return warpNum;
  }

  public boolean isSyncEncounter() {
    return syncEncounter;
  }

  public boolean isBarrierEncounter() {
    return barrierEncounter;
  }

  public boolean isInBranch() {
    return inBranch;
  }

  public SymExpr getInheritedCond() {
    return inheritedCond;
  }

  public boolean isSlotUsed() {
    return slotUsed;
  }

  public boolean isKept() {
    return keep;
  }

  /** Whether this slot belongs to the currently tracked thread set. */
  public boolean isLive() {
    return slotUsed && keep;
  }

  /** The thread reached an explicit barrier. */
  public void markBarrierEncounter() {
    barrierEncounter = true;
    syncEncounter = true;
  }

  /** The thread passed a satisfied barrier and runs on. */
  public void releaseBarrier() {
    barrierEncounter = false;
  }

  /** The thread reached a reconvergence point. */
  public void markSynchronized() {
    syncEncounter = true;
    inBranch = false;
  }

  /** The thread left a synchronization point by taking a branch. */
  public void enterBranch(SymExpr pCond) {
    inBranch = true;
    syncEncounter = false;
    inheritedCond = checkNotNull(pCond);
  }

  /** The thread is no longer tracked, e.g. because its path was proven infeasible. */
  public void retire() {
    keep = false;
  }

  @Override
  public String toString() {
    return String.format(
        "b%d.t%d (warp %d)%s%s%s",
        blockId,
        threadId,
        warpNum,
        barrierEncounter ? " at barrier" : "",
        inBranch ? " in branch" : "",
        isLive() ? "" : " retired");
  }
}
