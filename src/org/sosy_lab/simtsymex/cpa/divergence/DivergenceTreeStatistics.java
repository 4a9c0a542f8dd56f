// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cpa.divergence;

import java.io.PrintStream;
import org.sosy_lab.common.time.Timer;

/** Counters of one divergence tree; a forked tree counts on its own. */
public class DivergenceTreeStatistics {

  final Timer cloneTimer = new Timer();
  final Timer barrierTimer = new Timer();

  int insertedNodes = 0;
  int destroyedNodes = 0;
  int clonedNodes = 0;
  int maxNodes = 0;
  int closedRegions = 0;
  int prunedSuccessors = 0;
  int explicitBarriers = 0;
  int satisfiedBarriers = 0;
  int divergentBarriers = 0;

  void nodeInserted(int pNodeNum) {
    insertedNodes++;
    maxNodes = Math.max(maxNodes, pNodeNum);
  }

  public int getInsertedNodes() {
    return insertedNodes;
  }

  public int getDestroyedNodes() {
    return destroyedNodes;
  }

  public int getClosedRegions() {
    return closedRegions;
  }

  public int getDivergentBarriers() {
    return divergentBarriers;
  }

  public String getName() {
    return "Divergence tree";
  }

  public void printStatistics(PrintStream out) {
    out.println("Number of inserted tree nodes:    " + insertedNodes);
    out.println("Number of destroyed tree nodes:   " + destroyedNodes);
    out.println("Max. number of live tree nodes:   " + maxNodes);
    out.println("Number of cloned tree nodes:      " + clonedNodes);
    out.println("Number of closed divergent regions: " + closedRegions);
    out.println("Number of pruned successors:      " + prunedSuccessors);
    out.println(
        "Number of explicit barrier calls: "
            + explicitBarriers
            + " (satisfied: "
            + satisfiedBarriers
            + ", divergent: "
            + divergentBarriers
            + ")");
    out.println("Time for forking trees:           " + cloneTimer);
    out.println("Time for barrier reconciliation:  " + barrierTimer);
  }
}
