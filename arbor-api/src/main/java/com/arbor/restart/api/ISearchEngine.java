/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.api;

import com.arbor.restart.api.model.OpenNodes;
import com.arbor.restart.api.model.SearchNode;

import java.util.List;

/**
 * Read-only view of a branch-and-bound engine, as seen by the restart controller.
 *
 * <p>All queries are pure: the controller calls them from inside its event callbacks and
 * expects them to describe the state <em>after</em> the event that triggered the callback.
 * The only side-effecting method is {@link #requestRestart()}.
 *
 * <h2>Bounds</h2>
 * <p>{@link #primalBound()} and {@link #dualBound()} are in the original objective space.
 * {@link #upperBound()}, {@link #lowerBound()} and {@link SearchNode#lowerBound()} are in the
 * transformed space and are mapped back with {@link #retransform(double)}. Infinite values are
 * represented by {@code +/-infinity()}.
 *
 * <h2>Thread Safety</h2>
 * <p>Called only from the engine's own thread.
 */
public interface ISearchEngine {

    // ==================== Bounds ====================

    /**
     * Objective value of the incumbent, {@code infinity()} if none exists.
     */
    double primalBound();

    /**
     * Global dual bound.
     */
    double dualBound();

    /**
     * Incumbent value in the transformed space, {@code infinity()} if none exists.
     */
    double upperBound();

    /**
     * Global lower bound in the transformed space.
     */
    double lowerBound();

    /**
     * Maps a transformed-space objective value to the original space.
     */
    double retransform(double value);

    /**
     * Current relative primal-dual gap, possibly infinite.
     */
    double gap();

    // ==================== Tree ====================

    /**
     * Number of nodes processed in the current run.
     */
    long nNodes();

    long nFeasibleLeaves();

    long nInfeasibleLeaves();

    long nObjLimLeaves();

    /**
     * Node currently being processed, or {@code null} outside node processing.
     */
    SearchNode focusNode();

    /**
     * Children created for the focus node.
     */
    List<SearchNode> children();

    /**
     * Whether the focus node has been branched.
     */
    boolean wasFocusNodeBranched();

    /**
     * All open nodes, grouped as children, siblings and remaining leaves.
     */
    OpenNodes openNodes();

    /**
     * Probability of the node under the engine's branching-ratio model.
     */
    double nodeProbability(SearchNode node);

    // ==================== Estimates ====================

    /**
     * Total tree-size estimate from path probabilities, negative if unavailable.
     */
    double treeSizeEstimate();

    /**
     * Total tree-size estimate from the tree profile, negative if unavailable.
     */
    double treeProfileEstimate();

    // ==================== Status ====================

    /**
     * Whether the problem has been solved to optimality or proven infeasible.
     */
    boolean isSolved();

    /**
     * Whether a restart is already in progress.
     */
    boolean isInRestart();

    /**
     * Wall-clock solving time in seconds.
     */
    double solvingTime();

    /**
     * Asks the engine to abandon the current tree and restart from the root.
     */
    void requestRestart();

    // ==================== Numerics ====================

    /**
     * Value the engine treats as infinite.
     */
    default double infinity() {
        return 1e20;
    }

    /**
     * Absolute tolerance for floating-point comparisons.
     */
    default double epsilon() {
        return 1e-9;
    }
}
