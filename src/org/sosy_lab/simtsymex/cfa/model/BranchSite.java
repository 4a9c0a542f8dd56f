// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cfa.model;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ComparisonChain;
import java.util.Objects;

/**
 * Opaque identity of a program point of a kernel: a conditional branch instruction or the basic
 * block that postdominates it. Only used as a key.
 */
public final class BranchSite implements Comparable<BranchSite> {

  private final String function;
  private final String label;

  private BranchSite(String pFunction, String pLabel) {
    function = checkNotNull(pFunction);
    label = checkNotNull(pLabel);
  }

  public static BranchSite of(String pFunction, String pLabel) {
    return new BranchSite(pFunction, pLabel);
  }

  public String getFunction() {
    return function;
  }

  public String getLabel() {
    return label;
  }

  @Override
  public int compareTo(BranchSite pOther) {
    return ComparisonChain.start()
        .compare(function, pOther.function)
        .compare(label, pOther.label)
        .result();
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof BranchSite)) {
      return false;
    }
    BranchSite other = (BranchSite) pObj;
    return function.equals(other.function) && label.equals(other.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(function, label);
  }

  @Override
  public String toString() {
    return function + ":" + label;
  }
}
