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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Objects;

/**
 * Arrival state of the threads of one block at an explicit barrier. A pending barrier is an
 * analysis result, not an error of the engine: if the region holding the arrived threads
 * reconverges before the others arrive, the barrier can never be satisfied and is reported as
 * barrier divergence.
 */
public final class BarrierStatus {

  private final int blockId;
  private final ImmutableSortedSet<Integer> arrivedThreads;
  private final int expectedThreads;
  private final boolean divergent;

  BarrierStatus(
      int pBlockId,
      ImmutableSortedSet<Integer> pArrivedThreads,
      int pExpectedThreads,
      boolean pDivergent) {
    checkArgument(
        pArrivedThreads.size() <= pExpectedThreads,
        "%s threads arrived, but only %s expected",
        pArrivedThreads.size(),
        pExpectedThreads);
    blockId = pBlockId;
    arrivedThreads = checkNotNull(pArrivedThreads);
    expectedThreads = pExpectedThreads;
    divergent = pDivergent;
  }

  BarrierStatus asDivergent() {
    return divergent ? this : new BarrierStatus(blockId, arrivedThreads, expectedThreads, true);
  }

  public int getBlockId() {
    return blockId;
  }

  /** Slot indices of the threads waiting at the barrier. */
  public ImmutableSortedSet<Integer> getArrivedThreads() {
    return arrivedThreads;
  }

  public int getNumberOfArrivedThreads() {
    return arrivedThreads.size();
  }

  public int getNumberOfExpectedThreads() {
    return expectedThreads;
  }

  public boolean isSatisfied() {
    return arrivedThreads.size() == expectedThreads;
  }

  public boolean isPending() {
    return !isSatisfied();
  }

  /**
   * Whether the divergent region of the arrived threads was closed before all threads of the block
   * arrived, i.e., the remaining threads passed the merge point without calling the barrier.
   */
  public boolean isDivergent() {
    return divergent;
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof BarrierStatus)) {
      return false;
    }
    BarrierStatus other = (BarrierStatus) pObj;
    return blockId == other.blockId
        && expectedThreads == other.expectedThreads
        && divergent == other.divergent
        && arrivedThreads.equals(other.arrivedThreads);
  }

  @Override
  public int hashCode() {
    return Objects.hash(blockId, arrivedThreads, expectedThreads, divergent);
  }

  @Override
  public String toString() {
    return String.format(
        "barrier in block %d %s, %d/%d threads arrived%s",
        blockId,
        isSatisfied() ? "satisfied" : "pending",
        arrivedThreads.size(),
        expectedThreads,
        divergent ? " (barrier divergence)" : "");
  }
}
