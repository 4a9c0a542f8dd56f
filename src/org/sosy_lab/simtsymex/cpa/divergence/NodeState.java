// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cpa.divergence;

/** Life cycle of a {@link DivergenceNode}. */
public enum NodeState {
  /** No successor has been recorded yet. */
  UNEXPANDED,
  /** Successor ranges are being populated or explored. */
  DIVERGING,
  /** Every successor range reached a barrier or the postdominator. */
  ALL_SYNCED,
  /** The successor ranges were merged back into a single range. */
  CLOSED
}
