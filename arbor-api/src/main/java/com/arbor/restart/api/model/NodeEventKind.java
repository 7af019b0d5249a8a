/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.api.model;

/**
 * Kind of node event reported to the restart controller.
 */
public enum NodeEventKind {
    /** The focus node was branched and produced zero or more children. */
    BRANCHED,

    /** A leaf surfaced from the engine's node priority queue and was pruned. */
    PQ_PRUNED;

    public boolean isLeafEvent() {
        return this == PQ_PRUNED;
    }
}
