/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.api.model;

import java.io.Serializable;

/**
 * Immutable snapshot of the controller's view of the search tree.
 */
public record TreeStatistics(
        long nodes,
        long openNodes,
        long innerNodes,
        long leaves,
        long visitedNodes,
        double progress,
        double subtreeSumGap,
        double treeSizeEstimate,
        int restartsPerformed,
        int reportsEmitted
) implements Serializable {
}
