// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.util.expr;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A free symbolic variable. Variables holding the block or thread index of the executing thread
 * are tagged with their role, which is what makes a branch condition thread-id derived.
 */
public final class VariableExpr extends SymExpr {

  public enum Role {
    BLOCK_ID,
    THREAD_ID,
    DATA;

    public boolean isThreadIdentity() {
      return this != DATA;
    }
  }

  private final String name;
  private final Role role;

  VariableExpr(String pName, int pWidth, Role pRole) {
    super(Kind.VARIABLE, pWidth);
    name = pName;
    role = pRole;
  }

  public String getName() {
    return name;
  }

  public Role getRole() {
    return role;
  }

  @Override
  public List<SymExpr> getChildren() {
    return ImmutableList.of();
  }

  @Override
  int compareContents(SymExpr pOther) {
    VariableExpr other = (VariableExpr) pOther;
    int result = role.compareTo(other.role);
    return result != 0 ? result : name.compareTo(other.name);
  }

  @Override
  int contentsHash() {
    return 31 * role.ordinal() + name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
