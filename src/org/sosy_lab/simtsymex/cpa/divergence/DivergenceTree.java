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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.simtsymex.cfa.model.BranchSite;
import org.sosy_lab.simtsymex.cpa.thread.ThreadSlot;
import org.sosy_lab.simtsymex.cpa.thread.ThreadSlots;
import org.sosy_lab.simtsymex.util.expr.SymExpr;
import org.sosy_lab.simtsymex.util.expr.SymExprManager;
import org.sosy_lab.simtsymex.util.expr.SymExprs;

/**
 * The parametric execution tree of one symbolic state.
 *
 * <p>Every node is a branch reached by a contiguous range of thread slots; its successor
 * configurations partition that range by the outcome each thread took. The cursor {@link
 * #getCurrentNode()} marks where the simulated execution currently is, and the successor {@link
 * DivergenceNode#getWhichSuccessor()} of the cursor is the range of threads that runs right now.
 * Divergent ranges are merged back when all of them reach the postdominator of their branch
 * (implicit barrier) or an explicit barrier.
 *
 * <p>Violations of the calling contract (inserting or navigating with an invalid cursor,
 * requesting a non-existing successor) are fatal and reported by unchecked exceptions. Barriers
 * that are not reached by all threads of their block are analysis results and reported as {@link
 * BarrierStatus}.
 *
 * <p>The tree is not thread-safe. A forked state gets an independent copy by {@link
 * #DivergenceTree(DivergenceTree)}; the copy shares only immutable expressions with its origin.
 */
@Options(prefix = "simt.divergence")
public class DivergenceTree {

  @Option(
      secure = true,
      description =
          "check after every update that the successor ranges of a node partition its threads")
  private boolean checkPartition = true;

  @Option(secure = true, description = "log the whole tree whenever a divergent region is closed")
  private boolean dumpOnClose = false;

  private final LogManager logger;
  private final SymExprManager exprMgr;
  private final DivergenceTreeStatistics stats;

  private int nodeNum = 0;
  private @Nullable DivergenceNode root = null;
  private @Nullable DivergenceNode current = null;
  private final Map<Integer, BarrierStatus> pendingBarriers = new TreeMap<>();

  public DivergenceTree(Configuration pConfig, LogManager pLogger, SymExprManager pExprMgr)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    logger = checkNotNull(pLogger);
    exprMgr = checkNotNull(pExprMgr);
    stats = new DivergenceTreeStatistics();
  }

  /**
   * Forks the tree: the copy shares expressions, but no node, configuration or statistics. The
   * statistics of the copy start with the nodes cloned for it.
   */
  public DivergenceTree(DivergenceTree pParaTree) {
    checkPartition = pParaTree.checkPartition;
    dumpOnClose = pParaTree.dumpOnClose;
    logger = pParaTree.logger;
    exprMgr = pParaTree.exprMgr;
    stats = new DivergenceTreeStatistics();
    pendingBarriers.putAll(pParaTree.pendingBarriers);

    stats.cloneTimer.start();
    try {
      Map<DivergenceNode, DivergenceNode> copies = new IdentityHashMap<>();
      root = pParaTree.root == null ? null : copyParaTree(pParaTree.root, null, copies);
      current = pParaTree.current == null ? null : copies.get(pParaTree.current);
      nodeNum = copies.size();
    } finally {
      stats.cloneTimer.stop();
    }
    checkState(nodeNum == pParaTree.nodeNum, "copied %s of %s nodes", nodeNum, pParaTree.nodeNum);
    stats.maxNodes = nodeNum;
  }

  public DivergenceTreeStatistics getStatistics() {
    return stats;
  }

  public SymExprManager getExpressionManager() {
    return exprMgr;
  }

  /**
   * Deep-copies the subtree below {@code pNode} and attaches it to {@code pParent} (which may be
   * null). The copy does not count as node of this tree.
   */
  public DivergenceNode copyParaTree(DivergenceNode pNode, @Nullable DivergenceNode pParent) {
    return copyParaTree(pNode, pParent, new IdentityHashMap<>());
  }

  private DivergenceNode copyParaTree(
      DivergenceNode pNode,
      @Nullable DivergenceNode pParent,
      Map<DivergenceNode, DivergenceNode> pCopies) {
    checkArgument(!pNode.isDestroyed(), "copying destroyed node %s", pNode);
    DivergenceNode copy = new DivergenceNode(pNode);
    pCopies.put(pNode, copy);
    stats.clonedNodes++;
    if (pParent != null) {
      copy.attachTo(pParent, pNode.getParentSuccessor());
    }
    List<@Nullable DivergenceNode> children = pNode.getSuccessorTreeNodes();
    for (int i = 0; i < children.size(); i++) {
      DivergenceNode child = children.get(i);
      if (child != null) {
        copyParaTree(child, copy, pCopies);
      }
    }
    return copy;
  }

  public @Nullable DivergenceNode getRootNode() {
    return root;
  }

  public @Nullable DivergenceNode getCurrentNode() {
    return current;
  }

  public boolean isRootNull() {
    return root == null;
  }

  /** Number of live nodes of the tree. */
  public int getNodeNum() {
    return nodeNum;
  }

  private DivergenceNode checkCurrent() {
    checkState(current != null, "divergence tree has no current node");
    return current;
  }

  /** The representative thread of successor {@code i} of the current node. */
  public int getSymbolicTidFromCurrentNode(int i) {
    return checkCurrent().getSuccessorConfig(i).getThreadId();
  }

  /**
   * Attaches {@code pNode} as child of the successor of the current node that is being explored
   * and moves the cursor to it. The first inserted node becomes the root. A closed node in the
   * same successor (an earlier, already reconverged branch of the same threads) is replaced.
   */
  public void insertNodeIntoParaTree(DivergenceNode pNode) {
    checkNotNull(pNode);
    checkArgument(
        pNode.getParent() == null && !pNode.isDestroyed() && pNode != root,
        "node %s is already part of a tree",
        pNode);
    if (root == null) {
      checkState(current == null, "cursor without root");
      root = pNode;
    } else {
      DivergenceNode cur = checkCurrent();
      int which = cur.getWhichSuccessor();
      checkElementIndex(which, cur.getSuccessorConfigs().size(), "successor of current node");
      checkState(
          cur.getSuccessorConfig(which).isKept(),
          "inserting below pruned successor %s of %s",
          which,
          cur);
      DivergenceNode existing = cur.getChild(which);
      if (existing != null) {
        checkState(
            existing.getState() == NodeState.CLOSED,
            "stale cursor: successor %s of %s is still being explored by %s",
            which,
            cur,
            existing);
        logger.log(Level.FINEST, "Replacing closed node", existing);
        destroyParaTree(existing);
      }
      pNode.attachTo(cur, which);
    }
    current = pNode;
    nodeNum++;
    stats.nodeInserted(nodeNum);
  }

  /**
   * Records a successor configuration at the current node. A configuration with the same range
   * as an existing one replaces the condition of that one, any other is appended and has to start
   * where the last one ends.
   *
   * @return false if {@code pKind} does not fit the classification of the current node; such a
   *     configuration belongs to a different branch and is not recorded
   */
  public boolean updateCurrentNodeOnNewConfig(BranchConfig pConfig, BranchKind pKind) {
    checkNotNull(pConfig);
    DivergenceNode cur = checkCurrent();
    BranchKind merged = cur.getKind().mergeWith(pKind);
    if (merged == null) {
      logger.logf(Level.FINE, "Not merging %s successor %s into %s", pKind, pConfig, cur);
      return false;
    }
    checkState(cur.getState() != NodeState.CLOSED, "adding successor to closed node %s", cur);

    int existing = pConfig.isEmpty() ? -1 : cur.findSuccessorWithRange(pConfig);
    if (existing >= 0) {
      cur.getSuccessorConfig(existing).setCondition(pConfig.getCondition());
    } else {
      List<BranchConfig> configs = cur.getSuccessorConfigs();
      if (!configs.isEmpty() && !pConfig.isEmpty()) {
        int lastEnd = configs.get(configs.size() - 1).getEnd();
        checkArgument(
            pConfig.getStart() == lastEnd,
            "successor %s does not continue the ranges of %s, which end at %s",
            pConfig,
            cur,
            lastEnd);
      }
      cur.addConfig(pConfig);
    }
    cur.setKind(merged);
    return true;
  }

  /** Starts the range of successor {@code pPos} of the current node with the given thread. */
  public void initializeCurrentNodeRange(int pThreadIndex, int pPos) {
    DivergenceNode cur = checkCurrent();
    BranchConfig config = cur.getSuccessorConfig(pPos);
    if (pPos > 0) {
      int previousEnd = cur.getSuccessorConfig(pPos - 1).getEnd();
      checkArgument(
          pThreadIndex == previousEnd,
          "thread %s does not follow the range of successor %s ending at %s",
          pThreadIndex,
          pPos - 1,
          previousEnd);
    }
    config.setRange(pThreadIndex, pThreadIndex + 1);
    cur.addRepThread(pPos, pThreadIndex);
    checkRanges(cur);
  }

  /** Extends the range of successor {@code pPos} of the current node by the given thread. */
  public void incrementCurrentNodeRange(int pThreadIndex, int pPos) {
    DivergenceNode cur = checkCurrent();
    extendRange(cur, pThreadIndex, pPos);
    cur.addRepThread(pPos, pThreadIndex);
  }

  private void extendRange(DivergenceNode pNode, int pThreadIndex, int pPos) {
    BranchConfig config = pNode.getSuccessorConfig(pPos);
    checkArgument(
        pPos == pNode.getSuccessorConfigs().size() - 1,
        "only the last successor of %s can grow, not %s",
        pNode,
        pPos);
    checkArgument(
        pThreadIndex == config.getEnd(),
        "thread %s is not adjacent to range %s",
        pThreadIndex,
        config);
    config.setRange(config.getStart(), pThreadIndex + 1);
    checkRanges(pNode);
  }

  private void checkRanges(DivergenceNode pNode) {
    if (checkPartition) {
      checkState(pNode.isContiguous(), "successor ranges of %s overlap or have gaps", pNode);
    }
  }

  /** Explores successor {@code pIndex} of the current node next. */
  public void selectSuccessor(int pIndex) {
    DivergenceNode cur = checkCurrent();
    checkArgument(
        cur.getSuccessorConfig(pIndex).isKept(), "successor %s of %s was pruned", pIndex, cur);
    cur.setWhichSuccessor(pIndex);
  }

  /** Moves the cursor into the already explored successor of the current node. */
  public DivergenceNode advanceCurrentToSuccessor() {
    DivergenceNode cur = checkCurrent();
    DivergenceNode child = cur.getChild(cur.getWhichSuccessor());
    checkState(child != null, "successor %s of %s is unexplored", cur.getWhichSuccessor(), cur);
    current = child;
    return child;
  }

  public boolean currentSuccessorNull() {
    DivergenceNode cur = checkCurrent();
    if (cur.getSuccessorConfigs().isEmpty()) {
      return true;
    }
    return cur.getChild(cur.getWhichSuccessor()) == null;
  }

  /** The successor the current node is exploring. */
  public int getCurrentNodePath() {
    return checkCurrent().getWhichSuccessor();
  }

  /** Rewinds the cursor; the tree itself is not changed. */
  public void resetCurrentNodeToRoot() {
    current = root;
  }

  /** Nodes from the root to the current node. */
  public ImmutableList<DivergenceNode> getCurrentNodePathNodes() {
    List<DivergenceNode> path = new ArrayList<>();
    for (DivergenceNode node = current; node != null; node = node.getParent()) {
      path.add(node);
    }
    return ImmutableList.copyOf(Lists.reverse(path));
  }

  /**
   * Merges the successor ranges of {@code pNode} into one once every kept range reached a barrier
   * or the postdominator, so that the threads continue as a single range. The children are
   * destroyed, the record of diverged threads is kept.
   *
   * @return false, without any change, if a range is still pending or no successor was recorded
   */
  public boolean updateConfigVecAfterBarriers(DivergenceNode pNode) {
    checkNotNull(pNode);
    checkArgument(!pNode.isDestroyed(), "node %s was destroyed", pNode);
    List<BranchConfig> configs = pNode.getSuccessorConfigs();
    if (configs.isEmpty() || !pNode.allSuccessorsDone()) {
      return false;
    }

    for (DivergenceNode child : new ArrayList<>(pNode.getSuccessorTreeNodes())) {
      if (child != null) {
        destroyParaTree(child);
      }
    }

    BranchConfig first = configs.get(0);
    BranchConfig merged =
        new BranchConfig(
            first.getBlockId(),
            first.getThreadId(),
            exprMgr.makeTrue(),
            pNode.getRangeStart(),
            pNode.getRangeEnd());
    merged.setKeep(pNode.hasKeptSuccessor());
    pNode.collapseInto(merged);
    stats.closedRegions++;

    logger.logf(
        Level.FINER,
        "Merged successors of %s into range [%d, %d)",
        pNode,
        merged.getStart(),
        merged.getEnd());
    if (dumpOnClose) {
      logger.log(Level.FINEST, "Divergence tree after merge:\n" + dumpToString());
    }
    return true;
  }

  /**
   * The threads of the explored successor of {@code pNode} reached its postdominator. If other
   * successors are still pending, the next one is explored. Otherwise the divergence is closed
   * and the cursor returns to {@code pParentNode}, or stays at {@code pNode} if it is the root.
   *
   * <p>The live threads of the range that reached the postdominator are marked as synchronized in
   * {@code pSlots}, and so are all threads of {@code pNode} once the divergence is closed.
   *
   * @return whether the divergence at {@code pNode} was closed; false for a node that has no
   *     successor yet or was already closed
   */
  public boolean encounterImplicitBarrier(
      DivergenceNode pNode, @Nullable DivergenceNode pParentNode, List<ThreadSlot> pSlots) {
    checkNotNull(pNode);
    checkNotNull(pSlots);
    checkArgument(
        pNode.getParent() == pParentNode, "%s is not the parent of %s", pParentNode, pNode);
    checkState(current == pNode, "stale cursor: %s is not the current node %s", pNode, current);
    if (pNode.getSuccessorConfigs().isEmpty() || pNode.getState() == NodeState.CLOSED) {
      return false;
    }

    BranchConfig active = pNode.getActiveConfig();
    active.setPostDomEncounter(true);
    ThreadSlots.markSynchronized(pSlots, active.getStart(), active.getEnd());
    int next = pNode.firstPendingSuccessor();
    if (next >= 0) {
      pNode.setWhichSuccessor(next);
      logger.logf(
          Level.FINEST,
          "Range %s reached %s, continuing with successor %d",
          active,
          pNode.getPostDominator(),
          next);
      return false;
    }

    pNode.setAllSync(true);
    pNode.setState(NodeState.ALL_SYNCED);
    reportDivergentBarriers(pNode.getRangeStart(), pNode.getRangeEnd());
    ThreadSlots.markSynchronized(pSlots, pNode.getRangeStart(), pNode.getRangeEnd());
    updateConfigVecAfterBarriers(pNode);
    current = pParentNode == null ? pNode : pParentNode;
    logger.logf(
        Level.FINE,
        "Threads [%d, %d) reconverged at %s",
        pNode.getRangeStart(),
        pNode.getRangeEnd(),
        pNode.getPostDominator());
    return true;
  }

  /**
   * The threads of the current successor reached basic block {@code pBlock}. Closes every
   * divergent region whose postdominator is {@code pBlock}, innermost first, until a region still
   * has other successors to explore.
   *
   * @return number of closed regions
   */
  public int reconvergeAt(BranchSite pBlock, List<ThreadSlot> pSlots) {
    checkNotNull(pBlock);
    checkNotNull(pSlots);
    int closed = 0;
    while (current != null
        && current.getState() != NodeState.CLOSED
        && pBlock.equals(current.getPostDominator())) {
      DivergenceNode node = current;
      if (!encounterImplicitBarrier(node, node.getParent(), pSlots)) {
        break;
      }
      closed++;
      if (current == node) {
        break;
      }
    }
    return closed;
  }

  /** Marks pending barriers whose arrived threads lie in a region that just closed. */
  private void reportDivergentBarriers(int pStart, int pEnd) {
    for (Map.Entry<Integer, BarrierStatus> entry : pendingBarriers.entrySet()) {
      BarrierStatus status = entry.getValue();
      if (status.isDivergent()) {
        continue;
      }
      for (int thread : status.getArrivedThreads()) {
        if (pStart <= thread && thread < pEnd) {
          BarrierStatus divergent = status.asDivergent();
          entry.setValue(divergent);
          stats.divergentBarriers++;
          logger.log(Level.WARNING, "Barrier divergence:", divergent);
          break;
        }
      }
    }
  }

  /**
   * Thread {@code pThreadIndex} reached an explicit barrier. Marks its slot, marks every range on
   * the path from the current node to the root whose threads have all arrived, and moves the
   * cursor to the next range that still has to run to the barrier.
   *
   * @return the arrival state of the block of the thread; a pending status stays queryable by
   *     {@link #getPendingBarriers()} until the remaining threads arrive
   */
  public BarrierStatus encounterExplicitBarrier(List<ThreadSlot> pSlots, int pThreadIndex) {
    checkNotNull(pSlots);
    checkElementIndex(pThreadIndex, pSlots.size(), "thread slot");
    ThreadSlot slot = pSlots.get(pThreadIndex);
    checkArgument(slot.isLive(), "retired thread %s reached a barrier", slot);
    stats.explicitBarriers++;
    stats.barrierTimer.start();
    try {
      slot.markBarrierEncounter();
      DivergenceNode highestSynced = markRangesAtBarrier(pSlots);
      moveCursorToPendingRange();
      return reconcileBarrier(pSlots, slot.getBlockId(), highestSynced);
    } finally {
      stats.barrierTimer.stop();
    }
  }

  /**
   * Marks every kept range on the path from the current node to the root whose live threads all
   * wait at a barrier.
   *
   * @return the highest node on the path whose ranges are all done, or null
   */
  private @Nullable DivergenceNode markRangesAtBarrier(List<ThreadSlot> pSlots) {
    DivergenceNode highestSynced = null;
    for (DivergenceNode node = current; node != null; node = node.getParent()) {
      for (BranchConfig config : node.getSuccessorConfigs()) {
        if (config.isKept()
            && !config.isSyncEncounter()
            && !ThreadSlots.liveIndices(pSlots, config.getStart(), config.getEnd()).isEmpty()
            && ThreadSlots.allAtBarrier(pSlots, config.getStart(), config.getEnd())) {
          config.setSyncEncounter(true);
        }
      }
      if (node.allSuccessorsDone()) {
        node.setAllSync(true);
        if (node.getState() == NodeState.DIVERGING) {
          node.setState(NodeState.ALL_SYNCED);
        }
        highestSynced = node;
      }
    }
    return highestSynced;
  }

  /**
   * Recomputes the barrier status of block {@code pBlockId} from the live members of the block.
   * A satisfied barrier releases the waiting threads and merges {@code pHighestSynced}.
   */
  private BarrierStatus reconcileBarrier(
      List<ThreadSlot> pSlots, int pBlockId, @Nullable DivergenceNode pHighestSynced) {
    ImmutableSortedSet<Integer> members = ThreadSlots.blockMembers(pSlots, pBlockId);
    ImmutableSortedSet.Builder<Integer> arrived = ImmutableSortedSet.naturalOrder();
    for (int member : members) {
      if (pSlots.get(member).isBarrierEncounter()) {
        arrived.add(member);
      }
    }
    BarrierStatus previous = pendingBarriers.get(pBlockId);
    BarrierStatus status =
        new BarrierStatus(
            pBlockId, arrived.build(), members.size(), previous != null && previous.isDivergent());

    if (!status.isSatisfied()) {
      pendingBarriers.put(pBlockId, status);
      logger.log(Level.FINER, status);
      return status;
    }

    pendingBarriers.remove(pBlockId);
    stats.satisfiedBarriers++;
    for (int member : members) {
      pSlots.get(member).releaseBarrier();
    }
    if (pHighestSynced != null
        && !pHighestSynced.isDestroyed()
        && (pHighestSynced.getState() != NodeState.CLOSED
            || pHighestSynced.getNumberOfChildren() > 0)) {
      updateConfigVecAfterBarriers(pHighestSynced);
      if (current == null || isInSubtree(current, pHighestSynced)) {
        current = pHighestSynced;
      }
    }
    logger.log(Level.FINE, status);
    return status;
  }

  /**
   * Leaves ranges that wait at a barrier: moves to the first pending sibling range, or up to the
   * parent if all ranges of a node are done.
   */
  private void moveCursorToPendingRange() {
    DivergenceNode node = current;
    while (node != null && !node.getSuccessorConfigs().isEmpty()) {
      if (!node.getActiveConfig().isDone()) {
        break;
      }
      int next = node.firstPendingSuccessor();
      if (next >= 0) {
        node.setWhichSuccessor(next);
        break;
      }
      if (node.getParent() == null) {
        break;
      }
      node = node.getParent();
    }
    current = node;
  }

  private static boolean isInSubtree(DivergenceNode pNode, DivergenceNode pSubtreeRoot) {
    for (DivergenceNode node = pNode; node != null; node = node.getParent()) {
      if (node == pSubtreeRoot) {
        return true;
      }
    }
    return false;
  }

  /** Barriers that some, but not all, threads of their block have reached. */
  public ImmutableList<BarrierStatus> getPendingBarriers() {
    return ImmutableList.copyOf(pendingBarriers.values());
  }

  public Optional<BarrierStatus> getBarrierStatus(int pBlockId) {
    return Optional.ofNullable(pendingBarriers.get(pBlockId));
  }

  /**
   * Marks successor {@code pIndex} of the current node as infeasible and retires its threads. The
   * subtree is kept for diagnostics. A node without any feasible successor prunes the successor
   * of its parent that leads to it. Pending barriers are re-evaluated without the retired threads.
   */
  public void pruneSuccessor(int pIndex, List<ThreadSlot> pSlots) {
    checkNotNull(pSlots);
    DivergenceNode node = checkCurrent();
    BranchConfig config = node.getSuccessorConfig(pIndex);
    while (config.isKept()) {
      config.setKeep(false);
      stats.prunedSuccessors++;
      int retired = ThreadSlots.retire(pSlots, config.getStart(), config.getEnd());
      logger.logf(
          Level.FINE, "Pruned successor %s of %s, retired %d threads", config, node, retired);
      DivergenceNode parent = node.getParent();
      if (node.hasKeptSuccessor() || parent == null) {
        break;
      }
      config = parent.getSuccessorConfig(node.getParentSuccessor());
      node = parent;
    }

    // retired threads no longer hold back barriers of their block
    if (!pendingBarriers.isEmpty()) {
      DivergenceNode highestSynced = markRangesAtBarrier(pSlots);
      moveCursorToPendingRange();
      for (int blockId : ImmutableList.copyOf(pendingBarriers.keySet())) {
        reconcileBarrier(pSlots, blockId, highestSynced);
      }
    }
  }

  /**
   * Records a branch reached by the threads of the current range (all slots if the tree is empty):
   * classifies the condition, inserts a node and visits the live threads in index order. Thread
   * dependent conditions are evaluated per thread, the outcome of data dependent ones is asked
   * from {@code pOracle}. Consecutive threads with the same outcome share a successor range.
   *
   * @return the new node, which is the current node afterwards
   */
  public DivergenceNode recordBranch(
      BranchSite pBrInst,
      BranchSite pPostDom,
      SymExpr pCond,
      List<ThreadSlot> pSlots,
      @Nullable BranchOutcomeOracle pOracle) {
    checkNotNull(pCond);
    checkArgument(pCond.isBoolean(), "branch condition must be boolean: %s", pCond);
    checkNotNull(pSlots);

    final int start;
    final int end;
    if (current == null) {
      checkState(root == null, "tree without cursor");
      start = 0;
      end = pSlots.size();
    } else {
      BranchConfig active = current.getActiveConfig();
      start = active.getStart();
      end = active.getEnd();
    }
    ImmutableList<Integer> threads = ThreadSlots.liveIndices(pSlots, start, end);
    checkState(!threads.isEmpty(), "no live thread in [%s, %s) reaches %s", start, end, pBrInst);

    BranchKind kind = BranchClassifier.classify(pCond, getResolvedTdcConds());
    checkArgument(
        kind != BranchKind.SYM || pOracle != null,
        "data dependent branch %s needs an oracle",
        pCond);
    boolean allSync = true;
    for (int thread : threads) {
      allSync &= pSlots.get(thread).isSyncEncounter();
    }
    DivergenceNode node =
        new DivergenceNode(
            pBrInst,
            pPostDom,
            kind,
            !pCond.isConstant(),
            allSync,
            getCurrentPathCondition(),
            kind.isThreadIdDerived() ? pCond : exprMgr.makeTrue());
    insertNodeIntoParaTree(node);

    SymExpr negated = exprMgr.makeNot(pCond);
    int pos = -1;
    boolean lastOutcome = false;
    for (int i = threads.get(0); i < end; i++) {
      ThreadSlot slot = pSlots.get(i);
      if (!slot.isLive()) {
        // retired slots belong to the range of the preceding thread
        if (pos >= 0) {
          extendRange(node, i, pos);
        }
        continue;
      }
      SymExpr instantiated =
          SymExprs.bindThreadIdentity(exprMgr, pCond, slot.getBlockId(), slot.getThreadId());
      final boolean outcome;
      final SymExpr taken;
      if (instantiated.isConstant()) {
        outcome = instantiated.isTrue();
        taken = outcome ? pCond : negated;
      } else {
        checkState(pOracle != null, "condition %s is not decided by thread %s", pCond, slot);
        outcome = pOracle.takesBranch(i, slot, instantiated);
        taken = outcome ? instantiated : exprMgr.makeNot(instantiated);
      }

      if (pos < 0 || outcome != lastOutcome) {
        BranchConfig config =
            new BranchConfig(slot.getBlockId(), slot.getThreadId(), taken, i, i);
        boolean added = updateCurrentNodeOnNewConfig(config, kind);
        checkState(added, "new node rejects %s", config);
        pos = node.getSuccessorConfigs().size() - 1;
        initializeCurrentNodeRange(i, pos);
        lastOutcome = outcome;
      } else {
        incrementCurrentNodeRange(i, pos);
      }
      slot.enterBranch(exprMgr.makeAnd(slot.getInheritedCond(), taken));
    }
    // leading retired slots belong to the first range
    BranchConfig first = node.getSuccessorConfig(0);
    first.setRange(start, first.getEnd());
    if (checkPartition) {
      checkState(
          node.isPartitionOf(start, end),
          "successors of %s do not partition [%s, %s)",
          node,
          start,
          end);
    }

    logger.logf(
        Level.FINE,
        "Recorded %s with %d successor(s) for threads [%d, %d)",
        node,
        node.getSuccessorConfigs().size(),
        start,
        end);
    return node;
  }

  /** Thread dependent conditions decided on the path to the current node. */
  private ImmutableSet<SymExpr> getResolvedTdcConds() {
    ImmutableSet.Builder<SymExpr> result = ImmutableSet.builder();
    for (DivergenceNode node : getCurrentNodePathNodes()) {
      if (!node.getTdcCond().isTrue()) {
        result.add(node.getTdcCond());
        result.addAll(SymExprs.flattenConjuncts(node.getTdcCond()));
      }
    }
    return result.build();
  }

  /** Conjunction of the thread dependent conditions from the root to the current node. */
  public SymExpr getCurrentNodeTDCExpr() {
    SymExpr result = exprMgr.makeTrue();
    for (DivergenceNode node : getCurrentNodePathNodes()) {
      result = exprMgr.makeAnd(result, node.getTdcCond());
    }
    return result;
  }

  /**
   * Conjunction of the conditions of the explored successors from the root to the current node.
   */
  public SymExpr getCurrentPathCondition() {
    SymExpr result = exprMgr.makeTrue();
    for (DivergenceNode node : getCurrentNodePathNodes()) {
      if (!node.getSuccessorConfigs().isEmpty()) {
        result = exprMgr.makeAnd(result, node.getActiveConfig().getCondition());
      }
    }
    return result;
  }

  /**
   * Negates the conditions of the explored successors of data dependent branches on the current
   * path, which yields the complementary path. Calling it again restores them.
   */
  public void negateNonTDCNodeCond() {
    for (DivergenceNode node : getCurrentNodePathNodes()) {
      if (node.getKind() == BranchKind.SYM && !node.getSuccessorConfigs().isEmpty()) {
        node.getActiveConfig().negate(exprMgr);
      }
    }
  }

  /** Undoes {@link #negateNonTDCNodeCond()} on the current path. */
  public void resetNonTDCNodeCond() {
    for (DivergenceNode node : getCurrentNodePathNodes()) {
      if (node.getKind() == BranchKind.SYM && !node.getSuccessorConfigs().isEmpty()) {
        node.getActiveConfig().resetNegation();
      }
    }
  }

  /**
   * Destroys the subtree below {@code pNode}, visiting every node exactly once. A cursor inside the
   * subtree moves to the parent of {@code pNode}.
   *
   * @return number of destroyed nodes
   */
  public int destroyParaTree(DivergenceNode pNode) {
    checkNotNull(pNode);
    checkArgument(!pNode.isDestroyed(), "node %s destroyed twice", pNode);
    DivergenceNode top = pNode;
    while (top.getParent() != null) {
      top = top.getParent();
    }
    checkArgument(top == root, "node %s does not belong to this tree", pNode);

    DivergenceNode parent = pNode.getParent();
    if (current != null && isInSubtree(current, pNode)) {
      current = parent;
    }
    if (parent != null) {
      parent.detachChild(pNode);
    } else {
      root = null;
    }
    return destroyRecursively(pNode);
  }

  private int destroyRecursively(DivergenceNode pNode) {
    int destroyed = 0;
    for (DivergenceNode child : new ArrayList<>(pNode.getSuccessorTreeNodes())) {
      if (child != null) {
        pNode.detachChild(child);
        destroyed += destroyRecursively(child);
      }
    }
    pNode.markDestroyed();
    nodeNum--;
    stats.destroyedNodes++;
    return destroyed + 1;
  }

  /** Destroys the whole tree. */
  public void destroyParaTree() {
    if (root != null) {
      destroyParaTree(root);
    }
    current = null;
    pendingBarriers.clear();
    checkState(nodeNum == 0, "%s nodes left after destroying the tree", nodeNum);
  }

  public void dumpParaTree(PrintStream pOut) {
    if (root == null) {
      pOut.println("<empty divergence tree>");
    } else {
      dumpAllNodes(root, pOut, 0);
    }
  }

  private void dumpAllNodes(DivergenceNode pNode, PrintStream pOut, int pDepth) {
    if (pNode == current) {
      pOut.println("--> current");
    }
    pNode.dumpParaTreeNode(pOut, pDepth);
    for (DivergenceNode child : pNode.getSuccessorTreeNodes()) {
      if (child != null) {
        dumpAllNodes(child, pOut, pDepth + 1);
      }
    }
  }

  private String dumpToString() {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
      dumpParaTree(out);
    }
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return dumpToString();
  }
}
