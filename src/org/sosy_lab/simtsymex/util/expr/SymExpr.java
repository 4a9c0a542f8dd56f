// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.util.expr;

import java.util.List;
import java.util.Locale;

/**
 * An immutable symbolic expression.
 *
 * <p>Instances are only created by a {@link SymExprManager}, which hash-conses them: two
 * structurally identical expressions of the same manager are the same object. Equality and
 * ordering are nevertheless defined structurally, so expressions of different managers still
 * compare correctly.
 */
public abstract class SymExpr implements Comparable<SymExpr> {

  /** Width of boolean expressions. */
  public static final int BOOL = 1;

  public enum Kind {
    CONSTANT,
    VARIABLE,
    SELECT,
    NOT,
    AND,
    OR,
    XOR,
    ADD,
    SUB,
    MUL,
    EQ,
    ULT,
    ULE,
    SLT,
    SLE;

    public boolean isCommutative() {
      switch (this) {
        case AND:
        case OR:
        case XOR:
        case ADD:
        case MUL:
        case EQ:
          return true;
        default:
          return false;
      }
    }

    public boolean isComparison() {
      switch (this) {
        case EQ:
        case ULT:
        case ULE:
        case SLT:
        case SLE:
          return true;
        default:
          return false;
      }
    }

    public boolean isBinary() {
      return compareTo(AND) >= 0;
    }
  }

  private final Kind kind;
  private final int width;
  private int hashCache = 0;

  SymExpr(Kind pKind, int pWidth) {
    kind = pKind;
    width = pWidth;
  }

  public Kind getKind() {
    return kind;
  }

  public int getWidth() {
    return width;
  }

  public boolean isBoolean() {
    return width == BOOL;
  }

  public abstract List<SymExpr> getChildren();

  public SymExpr getChild(int i) {
    return getChildren().get(i);
  }

  public boolean isConstant() {
    return kind == Kind.CONSTANT;
  }

  /** Is this a constant zero. */
  public boolean isZero() {
    return false;
  }

  /** Is this the boolean constant true. */
  public boolean isTrue() {
    return false;
  }

  /** Is this the boolean constant false. */
  public boolean isFalse() {
    return false;
  }

  /** Compares the kind-specific payload (constant value, variable name) of two same-kind nodes. */
  abstract int compareContents(SymExpr pOther);

  abstract int contentsHash();

  @Override
  public final int compareTo(SymExpr pOther) {
    if (this == pOther) {
      return 0;
    }
    if (kind != pOther.kind) {
      return kind.compareTo(pOther.kind);
    }
    if (width != pOther.width) {
      return Integer.compare(width, pOther.width);
    }
    int result = compareContents(pOther);
    if (result != 0) {
      return result;
    }
    List<SymExpr> children = getChildren();
    List<SymExpr> otherChildren = pOther.getChildren();
    if (children.size() != otherChildren.size()) {
      return Integer.compare(children.size(), otherChildren.size());
    }
    for (int i = 0; i < children.size(); i++) {
      result = children.get(i).compareTo(otherChildren.get(i));
      if (result != 0) {
        return result;
      }
    }
    return 0;
  }

  @Override
  public final boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof SymExpr)) {
      return false;
    }
    SymExpr other = (SymExpr) pObj;
    return hashCode() == other.hashCode() && compareTo(other) == 0;
  }

  @Override
  public final int hashCode() {
    if (hashCache == 0) {
      int result = 31 * kind.ordinal() + width;
      result = 31 * result + contentsHash();
      for (SymExpr child : getChildren()) {
        result = 31 * result + child.hashCode();
      }
      hashCache = result == 0 ? 1 : result;
    }
    return hashCache;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append('(').append(kindName());
    for (SymExpr child : getChildren()) {
      sb.append(' ').append(child);
    }
    return sb.append(')').toString();
  }

  private String kindName() {
    String name = kind.name();
    return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
  }
}
