/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.api.model;

/**
 * Handle to a node of the engine's branch-and-bound tree.
 *
 * <p>Nodes are owned by the engine. The restart controller never creates or frees them and
 * uses them only as identity keys; implementations must not override {@code equals}/{@code hashCode}
 * in a way that makes two distinct live nodes compare equal.
 */
public interface SearchNode {

    /**
     * Unique node number assigned by the engine, used in diagnostics only.
     */
    long number();

    /**
     * Depth of the node, {@code 0} for the root.
     */
    int depth();

    /**
     * Dual bound of the node in the engine's transformed objective space.
     * Nondecreasing along every root-to-leaf path.
     */
    double lowerBound();

    /**
     * Parent node, or {@code null} for the root.
     */
    SearchNode parent();

    /**
     * Probability of reaching this node under the engine's fixed branching distribution.
     *
     * <p>Defaults to the uniform binary probability {@code 2^-depth}.
     */
    default double fixedProbability() {
        return Math.pow(0.5, depth());
    }
}
