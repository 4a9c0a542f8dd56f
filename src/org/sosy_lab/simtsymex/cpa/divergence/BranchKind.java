// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cpa.divergence;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Classification of a branch, fixed when the branch is first recorded. */
public enum BranchKind {
  /** Block or thread dependent condition, decided by concrete evaluation per thread. */
  TDC,
  /** Symbolic, data dependent condition; needs a feasibility check and path forking. */
  SYM,
  /** Composition of thread dependent decisions that were already taken on the path. */
  ACCUM,
  /** Conditions other than the ones above, e.g., an unconditional successor. */
  OTHER;

  public boolean isThreadIdDerived() {
    return this == TDC || this == ACCUM;
  }

  /**
   * The kind a node of this kind has after a successor of kind {@code pOther} was added, or null
   * if a successor of that kind belongs to a different branch.
   */
  public @Nullable BranchKind mergeWith(BranchKind pOther) {
    if (this == pOther || pOther == OTHER) {
      return this;
    }
    if (this == OTHER) {
      return pOther;
    }
    if (isThreadIdDerived() && pOther.isThreadIdDerived()) {
      return this;
    }
    return null;
  }
}
