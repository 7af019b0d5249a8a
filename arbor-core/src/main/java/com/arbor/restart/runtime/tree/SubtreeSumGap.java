/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.tree;

import com.arbor.restart.api.ISearchEngine;
import com.arbor.restart.api.model.OpenNodes;
import com.arbor.restart.api.model.SearchNode;
import com.arbor.restart.util.Tolerances;
import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subtree-sum-gap: a scaled sum, over the subtrees that were open when the incumbent last
 * changed, of the gap at each subtree's best open node.
 *
 * <p>Whenever the primal bound changes, every open node becomes the root of its own subtree
 * and the scaling factor is chosen so the value is continuous across the split. Between
 * splits only the lower-bound minimum of every subtree matters, kept in one
 * {@link NodeInfoQueue} per subtree, and the value changes by exactly
 * {@code scalingFactor * (newGap - oldGap)} whenever a subtree head is replaced.
 *
 * <p>With a single subtree the value degenerates to the global gap and no queues are kept.
 * The value is 1 while there is no incumbent and 0 once the problem is solved.
 */
public final class SubtreeSumGap {

    private static final Logger logger = Logger.getLogger(SubtreeSumGap.class.getName());

    private static final double MIN_GAP_SUM = 1e-6;

    private final ISearchEngine engine;
    private final Tolerances tolerances;
    private final Reference2ObjectOpenHashMap<SearchNode, NodeInfo> nodeMap = new Reference2ObjectOpenHashMap<>();
    private final List<NodeInfoQueue> queues = new ArrayList<>();

    private double value;
    private double scalingFactor;
    private int nsubtrees;
    private double pbLastSplit;

    public SubtreeSumGap(ISearchEngine engine, Tolerances tolerances) {
        this.engine = engine;
        this.tolerances = tolerances;
        reset();
    }

    public void reset() {
        clearSubtrees();
        value = 1.0;
        scalingFactor = 1.0;
        nsubtrees = 1;
        pbLastSplit = Double.NaN;
    }

    /**
     * Processes a node event after the engine has updated its tree.
     *
     * @param node      node of the event
     * @param nchildren number of children the node received, {@code 0} for leaves
     */
    public void update(SearchNode node, int nchildren) {
        if (engine.isSolved()) {
            value = 0.0;
            return;
        }

        double primalBound = engine.primalBound();
        if (!tolerances.isInfinity(engine.upperBound())
                && (Double.isNaN(pbLastSplit) || !tolerances.isEqual(primalBound, pbLastSplit))) {
            SearchNode focus = engine.focusNode();
            boolean includeFocus = focus != null && nchildren == 0 && !engine.wasFocusNodeBranched();
            split(includeFocus);
            pbLastSplit = primalBound;
            recompute(true);
        } else if (nsubtrees > 1 && nchildren > 0) {
            insertChildren();
        }

        if (nchildren == 0) {
            removeNode(node);
        }
    }

    /**
     * Makes every open node (and optionally the focus node) the root of its own subtree.
     */
    void split(boolean includeFocusNode) {
        clearSubtrees();

        OpenNodes open = engine.openNodes();
        nsubtrees = open.size() + (includeFocusNode ? 1 : 0);

        if (logger.isLoggable(Level.FINER)) {
            logger.finer("Splitting tree into " + nsubtrees + " subtrees");
        }

        if (nsubtrees <= 1) {
            return;
        }

        for (int k = 0; k < nsubtrees; k++) {
            queues.add(null);
        }

        int label = 0;
        for (SearchNode child : open.children()) {
            storeNode(child, label++);
        }
        for (SearchNode sibling : open.siblings()) {
            storeNode(sibling, label++);
        }
        for (SearchNode leaf : open.leaves()) {
            storeNode(leaf, label++);
        }
        if (includeFocusNode) {
            storeNode(engine.focusNode(), label);
        }
    }

    void storeNode(SearchNode node, int label) {
        if (label < 0 || label >= nsubtrees) {
            throw new IllegalArgumentException("Subtree label " + label + " out of range [0, " + nsubtrees + ")");
        }
        if (nodeMap.containsKey(node)) {
            throw new IllegalStateException("Node " + node.number() + " is already tracked");
        }
        NodeInfo info = new NodeInfo(node, node.lowerBound(), label);

        NodeInfoQueue queue = queues.get(label);
        if (queue == null) {
            queue = new NodeInfoQueue();
            queues.set(label, queue);
        }
        queue.insert(info);
        nodeMap.put(node, info);

        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("Inserting label " + label + " for node number " + node.number());
        }
    }

    /**
     * Stops tracking a node that was branched or pruned. Unknown nodes are ignored.
     */
    void removeNode(SearchNode node) {
        if (nsubtrees <= 1) {
            return;
        }
        NodeInfo info = nodeMap.remove(node);
        if (info == null) {
            return;
        }

        NodeInfoQueue queue = queues.get(info.getSubtreeIdx());
        boolean wasHead = info.getPos() == 0;
        queue.deleteAt(info.getPos());

        if (wasHead) {
            double oldGap = gap(info.getLowerBound());
            NodeInfo head = queue.peek();
            double newGap = gap(head != null ? head.getLowerBound() : tolerances.infinity());
            assert newGap <= oldGap + tolerances.epsilon()
                    : "subtree gap increased from " + oldGap + " to " + newGap;
            value += scalingFactor * (newGap - oldGap);
        }
    }

    /**
     * Assigns the focus node's children to the focus node's subtree and removes the focus node.
     */
    void insertChildren() {
        SearchNode focus = engine.focusNode();
        if (focus == null) {
            return;
        }
        NodeInfo focusInfo = nodeMap.get(focus);
        if (focusInfo == null) {
            return;
        }
        int label = focusInfo.getSubtreeIdx();
        for (SearchNode child : engine.children()) {
            storeNode(child, label);
        }
        removeNode(focus);
    }

    /**
     * Recomputes the value from the subtree heads.
     *
     * @param updateScaling rescale so the value stays what it was before the recomputation
     */
    public void recompute(boolean updateScaling) {
        if (tolerances.isInfinity(engine.upperBound())) {
            value = 1.0;
            return;
        }
        if (nsubtrees == 1) {
            value = gap(engine.lowerBound());
            return;
        }
        double gapSum = gapSum();
        if (updateScaling) {
            scalingFactor = value / Math.max(gapSum, MIN_GAP_SUM);
        }
        value = scalingFactor * gapSum;
    }

    /**
     * Unscaled sum of the subtree head gaps; empty subtrees contribute 0.
     */
    public double gapSum() {
        double gapSum = 0.0;
        for (NodeInfoQueue queue : queues) {
            NodeInfo head = queue != null ? queue.peek() : null;
            if (head == null || tolerances.isInfinity(head.getLowerBound())) {
                continue;
            }
            gapSum += gap(head.getLowerBound());
        }
        return gapSum;
    }

    /**
     * Relative gap between the incumbent and a transformed-space lower bound, in [0, 1].
     */
    public double gap(double lowerBound) {
        if (tolerances.isInfinity(lowerBound)) {
            return 0.0;
        }
        if (tolerances.isInfinity(engine.upperBound())) {
            return 1.0;
        }
        double dualBound = engine.retransform(lowerBound);
        double primalBound = engine.primalBound();
        if (tolerances.isEqual(dualBound, primalBound)) {
            return 0.0;
        }
        double gap = Math.abs(primalBound - dualBound) / Math.max(Math.abs(primalBound), Math.abs(dualBound));
        return Math.min(gap, 1.0);
    }

    private void clearSubtrees() {
        nodeMap.clear();
        for (NodeInfoQueue queue : queues) {
            if (queue != null) {
                queue.clear();
            }
        }
        queues.clear();
    }

    public double getValue() {
        return value;
    }

    public double getScalingFactor() {
        return scalingFactor;
    }

    public int getNsubtrees() {
        return nsubtrees;
    }

    /**
     * Primal bound at the last split, {@link Double#NaN} before the first split.
     */
    public double getPbLastSplit() {
        return pbLastSplit;
    }

    public int getNumTrackedNodes() {
        return nodeMap.size();
    }

    public NodeInfo getNodeInfo(SearchNode node) {
        return nodeMap.get(node);
    }

    /**
     * Nodes of subtree {@code k} in queue order, head first.
     */
    public List<NodeInfo> getSubtree(int k) {
        if (k < 0 || k >= queues.size() || queues.get(k) == null) {
            return Collections.emptyList();
        }
        return queues.get(k).elements();
    }

    public int getNumQueues() {
        return queues.size();
    }
}
