/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.api.model;

import java.util.List;

/**
 * Snapshot of the engine's open nodes, split the way the engine stores them.
 *
 * @param children children of the current focus node
 * @param siblings siblings of the current focus node
 * @param leaves   all other open nodes
 */
public record OpenNodes(
        List<SearchNode> children,
        List<SearchNode> siblings,
        List<SearchNode> leaves
) {
    public OpenNodes {
        children = List.copyOf(children);
        siblings = List.copyOf(siblings);
        leaves = List.copyOf(leaves);
    }

    public static OpenNodes empty() {
        return new OpenNodes(List.of(), List.of(), List.of());
    }

    public int size() {
        return children.size() + siblings.size() + leaves.size();
    }
}
