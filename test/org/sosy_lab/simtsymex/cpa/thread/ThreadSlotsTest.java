// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cpa.thread;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.simtsymex.util.expr.SymExprManager;

public class ThreadSlotsTest {

  private final LogManager logger = LogManager.createTestLogManager();
  private SymExprManager mgr;

  @Before
  public void setUp() {
    mgr = new SymExprManager();
  }

  private ThreadSlots grid(int pGridDim, int pBlockDim, int pWarpSize)
      throws InvalidConfigurationException {
    Configuration config =
        Configuration.builder()
            .setOption("simt.grid.gridDim", Integer.toString(pGridDim))
            .setOption("simt.grid.blockDim", Integer.toString(pBlockDim))
            .setOption("simt.grid.warpSize", Integer.toString(pWarpSize))
            .build();
    return new ThreadSlots(config, logger);
  }

  @Test
  public void defaultLaunchIsOneWarp() throws InvalidConfigurationException {
    ThreadSlots slots = new ThreadSlots(Configuration.defaultConfiguration(), logger);
    assertEquals(1, slots.getGridDim());
    assertEquals(32, slots.getBlockDim());
    assertEquals(32, slots.getWarpSize());
    assertEquals(32, slots.createSlots(mgr.makeTrue()).size());
  }

  @Test
  public void slotsAreOrderedBlockMajor() throws InvalidConfigurationException {
    List<ThreadSlot> slots = grid(2, 6, 4).createSlots(mgr.makeTrue());
    assertEquals(12, slots.size());

    ThreadSlot slot = slots.get(7);
    assertEquals(1, slot.getBlockId());
    assertEquals(1, slot.getThreadId());
    // two warps per block, the second one only half full
    assertEquals(2, slot.getWarpNum());
    assertEquals(1, slots.get(5).getWarpNum());
    assertEquals(3, slots.get(11).getWarpNum());

    assertTrue(slot.isLive());
    assertFalse(slot.isInBranch());
    assertSame(mgr.makeTrue(), slot.getInheritedCond());
  }

  @Test(expected = InvalidConfigurationException.class)
  public void emptyBlockIsRejected() throws InvalidConfigurationException {
    grid(1, 0, 32);
  }

  @Test
  public void retiredSlotsAreNotLive() throws InvalidConfigurationException {
    List<ThreadSlot> slots = grid(1, 6, 32).createSlots(mgr.makeTrue());
    assertEquals(2, ThreadSlots.retire(slots, 2, 4));
    assertEquals(0, ThreadSlots.retire(slots, 2, 4));
    assertEquals(ImmutableList.of(0, 1, 4, 5), ThreadSlots.liveIndices(slots, 0, 6));
    assertEquals(ImmutableSortedSet.of(0, 1, 4, 5), ThreadSlots.blockMembers(slots, 0));
    assertTrue(ThreadSlots.blockMembers(slots, 1).isEmpty());
  }

  @Test
  public void barrierFlags() throws InvalidConfigurationException {
    List<ThreadSlot> slots = grid(1, 4, 32).createSlots(mgr.makeTrue());
    slots.get(0).markBarrierEncounter();
    assertTrue(slots.get(0).isSyncEncounter());
    assertFalse(ThreadSlots.allAtBarrier(slots, 0, 2));
    slots.get(1).markBarrierEncounter();
    assertTrue(ThreadSlots.allAtBarrier(slots, 0, 2));

    slots.get(0).releaseBarrier();
    assertFalse(slots.get(0).isBarrierEncounter());
    assertTrue(slots.get(0).isSyncEncounter());

    slots.get(2).enterBranch(mgr.makeFalse());
    assertTrue(slots.get(2).isInBranch());
    ThreadSlots.markSynchronized(slots, 2, 4);
    assertFalse(slots.get(2).isInBranch());
    assertTrue(slots.get(3).isSyncEncounter());
  }

  @Test
  public void copiesAreIndependent() throws InvalidConfigurationException {
    List<ThreadSlot> slots = grid(1, 2, 32).createSlots(mgr.makeTrue());
    List<ThreadSlot> copy = ThreadSlots.copyOf(slots);
    copy.get(0).retire();
    assertTrue(slots.get(0).isLive());
    assertFalse(copy.get(0).isLive());
  }
}
