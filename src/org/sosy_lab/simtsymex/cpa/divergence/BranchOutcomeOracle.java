// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cpa.divergence;

import org.sosy_lab.simtsymex.cpa.thread.ThreadSlot;
import org.sosy_lab.simtsymex.util.expr.SymExpr;

/**
 * Decides the outcome of a data dependent branch for one thread. Implemented by the state
 * scheduler, which consults its solver and forks the symbolic state as needed.
 */
@FunctionalInterface
public interface BranchOutcomeOracle {

  /**
   * @param pThreadIndex slot index of the thread
   * @param pSlot the slot of the thread
   * @param pCond the branch condition instantiated with the identity of the thread
   * @return whether the thread takes the successor guarded by {@code pCond}
   */
  boolean takesBranch(int pThreadIndex, ThreadSlot pSlot, SymExpr pCond);
}
