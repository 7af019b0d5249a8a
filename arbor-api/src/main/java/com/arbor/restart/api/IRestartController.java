/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.api;

import com.arbor.restart.api.model.NodeEventKind;
import com.arbor.restart.api.model.RestartDecision;
import com.arbor.restart.api.model.SearchNode;
import com.arbor.restart.api.model.TreeStatistics;

/**
 * Observer of a branch-and-bound search that estimates the final tree size and decides
 * whether the search should be restarted.
 *
 * <p>The controller only observes events and requests restarts. It never modifies the
 * search tree.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #init()} once after construction</li>
 *   <li>{@link #onSolveBegin()} at the start of every run</li>
 *   <li>{@link #onNodeEvent(SearchNode, NodeEventKind, int)} for every branched or pruned node</li>
 *   <li>{@link #onSolveEnd()} at the end of every run</li>
 *   <li>{@link #close()} once when the engine shuts down</li>
 * </ol>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (IRestartController controller = new RestartController(engine, RestartConfig.loadDefault())) {
 *     controller.init();
 *     controller.onSolveBegin();
 *     // engine loop
 *     if (controller.onNodeEvent(node, NodeEventKind.BRANCHED, 2) == RestartDecision.RESTART) {
 *         // the engine has already been asked to restart
 *     }
 *     controller.onSolveEnd();
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. All callbacks must come from the engine thread and must not be reentrant.
 */
public interface IRestartController extends AutoCloseable {

    /**
     * Loads optional collaborators such as the regression forest.
     */
    void init();

    /**
     * Resets all per-run state and starts accepting node events.
     */
    void onSolveBegin();

    /**
     * Processes a single node event.
     *
     * @param node      the node the event refers to
     * @param kind      event kind
     * @param nchildren number of children created, {@code 0} for leaves
     * @return {@link RestartDecision#RESTART} if a restart was requested from the engine
     * @throws IllegalArgumentException if {@code nchildren} is negative
     */
    RestartDecision onNodeEvent(SearchNode node, NodeEventKind kind, int nchildren);

    /**
     * Stops accepting node events.
     */
    void onSolveEnd();

    /**
     * Combined estimate of the final tree size, never below the number of nodes created.
     */
    double treeSizeEstimate();

    /**
     * Snapshot of the tree statistics maintained by the controller.
     */
    TreeStatistics snapshot();

    /**
     * Releases resources acquired in {@link #init()}.
     */
    @Override
    void close();
}
