/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.tree;

import com.arbor.restart.api.model.SearchNode;

/**
 * Bookkeeping for an open node tracked by {@link SubtreeSumGap}.
 *
 * <p>The node handle is not owned; it stays valid until the engine reports the node's removal.
 */
public final class NodeInfo {

    private final SearchNode node;
    private final double lowerBound;
    private final int subtreeIdx;
    private int pos = -1;

    NodeInfo(SearchNode node, double lowerBound, int subtreeIdx) {
        this.node = node;
        this.lowerBound = lowerBound;
        this.subtreeIdx = subtreeIdx;
    }

    public SearchNode getNode() {
        return node;
    }

    /**
     * Lower bound of the node when it was inserted.
     */
    public double getLowerBound() {
        return lowerBound;
    }

    public int getSubtreeIdx() {
        return subtreeIdx;
    }

    /**
     * Current index in the subtree's queue, {@code 0} for the head, {@code -1} if not queued.
     */
    public int getPos() {
        return pos;
    }

    void setPos(int pos) {
        this.pos = pos;
    }

    @Override
    public String toString() {
        return "NodeInfo{node=" + node.number() + ", lb=" + lowerBound + ", subtree=" + subtreeIdx + ", pos=" + pos + '}';
    }
}
