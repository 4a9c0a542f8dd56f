// This file is part of SIMT-SymEx,
// a parametric divergence tracker for symbolic execution of GPU kernels:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.simtsymex.cpa.divergence;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.simtsymex.cfa.model.BranchSite;
import org.sosy_lab.simtsymex.util.expr.SymExpr;

/**
 * A node of the divergence tree, i.e., one branch site reached by a range of threads.
 *
 * <p>The node owns its successor configurations and the child nodes of the successors that have
 * been explored. The parent reference is only used for navigation. Successor configurations
 * partition the thread range of the node: they are sorted, contiguous and do not overlap.
 */
public final class DivergenceNode {

  private final BranchSite brInst;
  private final BranchSite postDom;
  private BranchKind symBrType;
  private final boolean isCondBr;
  private boolean allSync;
  // which successor is being explored right now
  private int whichSuccessor = 0;
  // condition inherited from the ancestors of this node
  private final SymExpr inheritCond;
  // condition only related to thread and block indices
  private final SymExpr tdcCond;
  private NodeState state = NodeState.UNEXPANDED;
  private boolean destroyed = false;

  private @Nullable DivergenceNode parent = null;
  private int parentSuccessor = -1;

  private final List<BranchConfig> successorConfigVec = new ArrayList<>();
  // one entry per configuration, null while the successor is unexplored
  private final List<@Nullable DivergenceNode> successorTreeNodes = new ArrayList<>();
  private final List<TreeSet<Integer>> repThreadSet = new ArrayList<>();
  // used for checking races between threads of different successors
  private List<ImmutableSortedSet<Integer>> divergeThreadSet = ImmutableList.of();

  public DivergenceNode(
      BranchSite pBrInst,
      BranchSite pPostDom,
      BranchKind pSymBrType,
      boolean pIsCondBr,
      boolean pAllSync,
      SymExpr pInheritCond,
      SymExpr pTdcCond) {
    brInst = checkNotNull(pBrInst);
    postDom = checkNotNull(pPostDom);
    symBrType = checkNotNull(pSymBrType);
    isCondBr = pIsCondBr;
    allSync = pAllSync;
    inheritCond = checkNotNull(pInheritCond);
    tdcCond = checkNotNull(pTdcCond);
  }

  /** Copies the node and its configurations, but neither its parent nor its children. */
  DivergenceNode(DivergenceNode pNode) {
    this(
        pNode.brInst,
        pNode.postDom,
        pNode.symBrType,
        pNode.isCondBr,
        pNode.allSync,
        pNode.inheritCond,
        pNode.tdcCond);
    whichSuccessor = pNode.whichSuccessor;
    state = pNode.state;
    for (int i = 0; i < pNode.successorConfigVec.size(); i++) {
      successorConfigVec.add(new BranchConfig(pNode.successorConfigVec.get(i)));
      successorTreeNodes.add(null);
      repThreadSet.add(new TreeSet<>(pNode.repThreadSet.get(i)));
    }
    divergeThreadSet = pNode.divergeThreadSet;
  }

  public BranchSite getBranchInstruction() {
    return brInst;
  }

  public BranchSite getPostDominator() {
    return postDom;
  }

  public BranchKind getKind() {
    return symBrType;
  }

  void setKind(BranchKind pKind) {
    symBrType = checkNotNull(pKind);
  }

  public boolean isCondBr() {
    return isCondBr;
  }

  public boolean isAllSync() {
    return allSync;
  }

  void setAllSync(boolean pAllSync) {
    allSync = pAllSync;
  }

  public int getWhichSuccessor() {
    return whichSuccessor;
  }

  void setWhichSuccessor(int pWhich) {
    checkElementIndex(pWhich, successorConfigVec.size(), "successor");
    whichSuccessor = pWhich;
  }

  public SymExpr getInheritCond() {
    return inheritCond;
  }

  public SymExpr getTdcCond() {
    return tdcCond;
  }

  public NodeState getState() {
    return state;
  }

  void setState(NodeState pState) {
    state = checkNotNull(pState);
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  void markDestroyed() {
    checkState(!destroyed, "node %s destroyed twice", this);
    destroyed = true;
  }

  public @Nullable DivergenceNode getParent() {
    return parent;
  }

  /** Index of the successor of the parent that leads to this node, -1 for a detached node. */
  public int getParentSuccessor() {
    return parentSuccessor;
  }

  void attachTo(DivergenceNode pParent, int pSuccessor) {
    checkState(parent == null, "node %s already has a parent", this);
    checkElementIndex(pSuccessor, pParent.successorConfigVec.size(), "successor");
    checkState(
        pParent.successorTreeNodes.get(pSuccessor) == null,
        "successor %s of %s already explored",
        pSuccessor,
        pParent);
    pParent.successorTreeNodes.set(pSuccessor, this);
    parent = pParent;
    parentSuccessor = pSuccessor;
  }

  void detachChild(DivergenceNode pChild) {
    checkArgument(pChild.parent == this, "%s is not a child of %s", pChild, this);
    successorTreeNodes.set(pChild.parentSuccessor, null);
    pChild.parent = null;
    pChild.parentSuccessor = -1;
  }

  public List<BranchConfig> getSuccessorConfigs() {
    return Collections.unmodifiableList(successorConfigVec);
  }

  public BranchConfig getSuccessorConfig(int pIndex) {
    checkElementIndex(pIndex, successorConfigVec.size(), "successor");
    return successorConfigVec.get(pIndex);
  }

  /** The configuration of the successor that is being explored. */
  public BranchConfig getActiveConfig() {
    checkState(!successorConfigVec.isEmpty(), "no successor recorded at %s", this);
    return successorConfigVec.get(whichSuccessor);
  }

  /** Child slots, one per configuration; unexplored successors are null. */
  public List<@Nullable DivergenceNode> getSuccessorTreeNodes() {
    return Collections.unmodifiableList(successorTreeNodes);
  }

  public @Nullable DivergenceNode getChild(int pIndex) {
    checkElementIndex(pIndex, successorTreeNodes.size(), "successor");
    return successorTreeNodes.get(pIndex);
  }

  public int getNumberOfChildren() {
    int count = 0;
    for (DivergenceNode child : successorTreeNodes) {
      if (child != null) {
        count++;
      }
    }
    return count;
  }

  /** Index of the configuration whose range contains the slot, or -1. */
  public int findSuccessorContaining(int pThreadIndex) {
    for (int i = 0; i < successorConfigVec.size(); i++) {
      if (successorConfigVec.get(i).contains(pThreadIndex)) {
        return i;
      }
    }
    return -1;
  }

  /** Index of the configuration with the same range, or -1. */
  int findSuccessorWithRange(BranchConfig pConfig) {
    for (int i = 0; i < successorConfigVec.size(); i++) {
      if (successorConfigVec.get(i).hasSameRange(pConfig)) {
        return i;
      }
    }
    return -1;
  }

  /** Index of the first kept configuration that has not reached a synchronization point, or -1. */
  public int firstPendingSuccessor() {
    for (int i = 0; i < successorConfigVec.size(); i++) {
      if (!successorConfigVec.get(i).isDone()) {
        return i;
      }
    }
    return -1;
  }

  public boolean allSuccessorsDone() {
    return !successorConfigVec.isEmpty() && firstPendingSuccessor() < 0;
  }

  public boolean hasKeptSuccessor() {
    for (BranchConfig config : successorConfigVec) {
      if (config.isKept()) {
        return true;
      }
    }
    return false;
  }

  int addConfig(BranchConfig pConfig) {
    successorConfigVec.add(pConfig);
    successorTreeNodes.add(null);
    repThreadSet.add(new TreeSet<>());
    if (state == NodeState.UNEXPANDED) {
      state = NodeState.DIVERGING;
    }
    return successorConfigVec.size() - 1;
  }

  void addRepThread(int pSuccessor, int pThreadIndex) {
    repThreadSet.get(pSuccessor).add(pThreadIndex);
    if (successorConfigVec.size() > 1) {
      ImmutableList.Builder<ImmutableSortedSet<Integer>> diverged = ImmutableList.builder();
      for (TreeSet<Integer> threads : repThreadSet) {
        diverged.add(ImmutableSortedSet.copyOf(threads));
      }
      divergeThreadSet = diverged.build();
    }
  }

  /**
   * Replaces all configurations by the single merged one. The children must have been removed
   * before; the divergence record is kept.
   */
  void collapseInto(BranchConfig pMerged) {
    checkState(getNumberOfChildren() == 0, "collapsing %s with live children", this);
    TreeSet<Integer> allThreads = new TreeSet<>();
    for (TreeSet<Integer> threads : repThreadSet) {
      allThreads.addAll(threads);
    }
    successorConfigVec.clear();
    successorTreeNodes.clear();
    repThreadSet.clear();
    successorConfigVec.add(pMerged);
    successorTreeNodes.add(null);
    repThreadSet.add(allThreads);
    whichSuccessor = 0;
    allSync = true;
    state = NodeState.CLOSED;
  }

  /** Slot indices that committed to each successor, as recorded while visiting the threads. */
  public ImmutableList<ImmutableSortedSet<Integer>> getRepThreadSets() {
    ImmutableList.Builder<ImmutableSortedSet<Integer>> result = ImmutableList.builder();
    for (TreeSet<Integer> threads : repThreadSet) {
      result.add(ImmutableSortedSet.copyOf(threads));
    }
    return result.build();
  }

  /**
   * Slot indices per successor if the threads at this node took different successors, otherwise
   * empty. Survives the merge of the successors.
   */
  public List<ImmutableSortedSet<Integer>> getDivergeThreadSets() {
    return divergeThreadSet;
  }

  public boolean hasDiverged() {
    return !divergeThreadSet.isEmpty();
  }

  /** Start of the range covered by the configurations. */
  public int getRangeStart() {
    checkState(!successorConfigVec.isEmpty(), "no successor recorded at %s", this);
    return successorConfigVec.get(0).getStart();
  }

  /** End of the range covered by the configurations. */
  public int getRangeEnd() {
    checkState(!successorConfigVec.isEmpty(), "no successor recorded at %s", this);
    return successorConfigVec.get(successorConfigVec.size() - 1).getEnd();
  }

  /** Whether the configurations are sorted, non-overlapping and without gaps between them. */
  public boolean isContiguous() {
    for (int i = 1; i < successorConfigVec.size(); i++) {
      if (successorConfigVec.get(i - 1).getEnd() != successorConfigVec.get(i).getStart()) {
        return false;
      }
    }
    return true;
  }

  /** Whether the configurations partition exactly the range {@code [pStart, pEnd)}. */
  public boolean isPartitionOf(int pStart, int pEnd) {
    if (successorConfigVec.isEmpty()) {
      return pStart == pEnd;
    }
    return isContiguous() && getRangeStart() == pStart && getRangeEnd() == pEnd;
  }

  public void dumpParaTreeNode(PrintStream pOut) {
    dumpParaTreeNode(pOut, 0);
  }

  void dumpParaTreeNode(PrintStream pOut, int pDepth) {
    String indent = Strings.repeat("  ", pDepth);
    pOut.println(indent + this);
    for (int i = 0; i < successorConfigVec.size(); i++) {
      pOut.println(
          indent
              + (i == whichSuccessor ? "  * " : "    ")
              + i
              + ": "
              + successorConfigVec.get(i)
              + (successorTreeNodes.get(i) == null ? "" : " ->"));
    }
    if (hasDiverged()) {
      pOut.println(indent + "    diverged: " + divergeThreadSet);
    }
  }

  @Override
  public String toString() {
    return String.format(
        "%s branch at %s (postdom %s) %s%s",
        symBrType,
        brInst,
        postDom,
        state,
        allSync ? " all-sync" : "");
  }
}
