// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cpa.thread;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkPositionIndexes;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.IntegerOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.simtsymex.util.expr.SymExpr;

/**
 * Creates the thread slots of a kernel launch and offers queries over ranges of slots.
 *
 * <p>Slots are ordered block-major, i.e., the slot index of thread {@code t} in block {@code b}
 * is {@code b * blockDim + t}. This order is the order in which the divergence tree visits
 * threads.
 */
@Options(prefix = "simt.grid")
public class ThreadSlots {

  @Option(secure = true, description = "number of thread blocks of the kernel launch")
  @IntegerOption(min = 1)
  private int gridDim = 1;

  @Option(secure = true, description = "number of threads per block")
  @IntegerOption(min = 1)
  private int blockDim = 32;

  @Option(secure = true, description = "number of threads executing in lockstep as one warp")
  @IntegerOption(min = 1)
  private int warpSize = 32;

  private final LogManager logger;

  public ThreadSlots(Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    logger = pLogger;
  }

  public int getGridDim() {
    return gridDim;
  }

  public int getBlockDim() {
    return blockDim;
  }

  public int getWarpSize() {
    return warpSize;
  }

  public int getNumberOfThreads() {
    return gridDim * blockDim;
  }

  /** Creates one live slot per thread of the grid, all starting with {@code pInitialCond}. */
  public List<ThreadSlot> createSlots(SymExpr pInitialCond) {
    int warpsPerBlock = (blockDim + warpSize - 1) / warpSize;
    List<ThreadSlot> slots = new ArrayList<>(getNumberOfThreads());
    for (int bid = 0; bid < gridDim; bid++) {
      for (int tid = 0; tid < blockDim; tid++) {
        slots.add(ThreadSlot.create(bid, tid, bid * warpsPerBlock + tid / warpSize, pInitialCond));
      }
    }
    logger.logf(
        Level.FINE,
        "Created %d thread slots (%d blocks of %d threads, %d warps per block)",
        slots.size(),
        gridDim,
        blockDim,
        warpsPerBlock);
    return slots;
  }

  /** Copies every slot, so that a forked state does not share mutable slots with its origin. */
  public static List<ThreadSlot> copyOf(List<ThreadSlot> pSlots) {
    List<ThreadSlot> copy = new ArrayList<>(pSlots.size());
    for (ThreadSlot slot : pSlots) {
      copy.add(new ThreadSlot(slot));
    }
    return copy;
  }

  /** Indices of the live slots in {@code [pStart, pEnd)}, ascending. */
  public static ImmutableList<Integer> liveIndices(List<ThreadSlot> pSlots, int pStart, int pEnd) {
    checkPositionIndexes(pStart, pEnd, pSlots.size());
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    for (int i = pStart; i < pEnd; i++) {
      if (pSlots.get(i).isLive()) {
        result.add(i);
      }
    }
    return result.build();
  }

  /** Indices of the live slots belonging to block {@code pBlockId}. */
  public static ImmutableSortedSet<Integer> blockMembers(List<ThreadSlot> pSlots, int pBlockId) {
    ImmutableSortedSet.Builder<Integer> result = ImmutableSortedSet.naturalOrder();
    for (int i = 0; i < pSlots.size(); i++) {
      ThreadSlot slot = pSlots.get(i);
      if (slot.isLive() && slot.getBlockId() == pBlockId) {
        result.add(i);
      }
    }
    return result.build();
  }

  /** Whether every live slot in {@code [pStart, pEnd)} waits at an explicit barrier. */
  public static boolean allAtBarrier(List<ThreadSlot> pSlots, int pStart, int pEnd) {
    for (int i : liveIndices(pSlots, pStart, pEnd)) {
      if (!pSlots.get(i).isBarrierEncounter()) {
        return false;
      }
    }
    return true;
  }

  /** Marks all live slots in {@code [pStart, pEnd)} as reconverged. */
  public static void markSynchronized(List<ThreadSlot> pSlots, int pStart, int pEnd) {
    for (int i : liveIndices(pSlots, pStart, pEnd)) {
      pSlots.get(i).markSynchronized();
    }
  }

  /** Retires all slots in {@code [pStart, pEnd)}. */
  public static int retire(List<ThreadSlot> pSlots, int pStart, int pEnd) {
    checkArgument(pStart <= pEnd, "invalid range [%s, %s)", pStart, pEnd);
    int retired = 0;
    for (int i : liveIndices(pSlots, pStart, pEnd)) {
      pSlots.get(i).retire();
      retired++;
    }
    return retired;
  }
}
