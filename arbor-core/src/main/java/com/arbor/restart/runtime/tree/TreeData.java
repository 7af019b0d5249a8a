/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.tree;

import com.arbor.restart.api.ISearchEngine;
import com.arbor.restart.api.model.SearchNode;
import com.arbor.restart.util.Tolerances;

/**
 * Aggregate counters of the search tree plus the embedded {@link SubtreeSumGap}.
 *
 * <p>After every update {@code nnodes == ninner + nleaves + nopen} and
 * {@code nvisited == ninner + nleaves}. Progress is the sum of {@code 2^-depth} over the
 * visited leaves, which reaches 1 exactly when a binary tree has been fully explored.
 */
public final class TreeData {

    private final ISearchEngine engine;
    private final SubtreeSumGap ssg;

    private long nnodes;
    private long nopen;
    private long ninner;
    private long nleaves;
    private long nvisited;
    private double progress;

    public TreeData(ISearchEngine engine, Tolerances tolerances) {
        this.engine = engine;
        this.ssg = new SubtreeSumGap(engine, tolerances);
        reset();
    }

    /**
     * Starts over with a tree consisting of the open root.
     */
    public void reset() {
        ninner = 0L;
        nleaves = 0L;
        nvisited = 0L;
        progress = 0.0;
        nnodes = 1L;
        nopen = 1L;
        ssg.reset();
    }

    public void update(SearchNode node, int nchildren) {
        if (nchildren < 0) {
            throw new IllegalArgumentException("Negative number of children " + nchildren + " for node " + node.number());
        }
        nvisited++;
        nopen--;

        if (nchildren == 0) {
            nleaves++;
            progress += Math.pow(0.5, node.depth());
        } else {
            nnodes += nchildren;
            nopen += nchildren;
            ninner++;
        }

        if (!engine.isInRestart()) {
            ssg.update(node, nchildren);
        }
    }

    public long getNnodes() {
        return nnodes;
    }

    public long getNopen() {
        return nopen;
    }

    public long getNinner() {
        return ninner;
    }

    public long getNleaves() {
        return nleaves;
    }

    public long getNvisited() {
        return nvisited;
    }

    public double getProgress() {
        return progress;
    }

    public SubtreeSumGap getSsg() {
        return ssg;
    }

    @Override
    public String toString() {
        return String.format("nodes=%d, open=%d, inner=%d, leaves=%d, visited=%d, progress=%.4f, ssg=%.4f",
                nnodes, nopen, ninner, nleaves, nvisited, progress, ssg.getValue());
    }
}
