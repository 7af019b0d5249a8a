/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binary min-heap of {@link NodeInfo} keyed by lower bound.
 *
 * <p>Every move writes the element's new index back into {@link NodeInfo#getPos()}, which
 * makes removal of arbitrary elements O(log n).
 */
final class NodeInfoQueue {

    private final List<NodeInfo> heap = new ArrayList<>();

    boolean isEmpty() {
        return heap.isEmpty();
    }

    int size() {
        return heap.size();
    }

    NodeInfo peek() {
        return heap.isEmpty() ? null : heap.get(0);
    }

    List<NodeInfo> elements() {
        return Collections.unmodifiableList(heap);
    }

    void insert(NodeInfo info) {
        heap.add(info);
        info.setPos(heap.size() - 1);
        siftUp(heap.size() - 1);
    }

    /**
     * Removes the element at {@code pos} and returns it.
     */
    NodeInfo deleteAt(int pos) {
        if (pos < 0 || pos >= heap.size()) {
            throw new IndexOutOfBoundsException("No queue element at " + pos + ", size " + heap.size());
        }
        NodeInfo removed = heap.get(pos);
        NodeInfo last = heap.remove(heap.size() - 1);
        if (pos < heap.size()) {
            heap.set(pos, last);
            last.setPos(pos);
            // the moved element may violate the heap order in either direction
            siftDown(siftUp(pos));
        }
        removed.setPos(-1);
        return removed;
    }

    void clear() {
        for (NodeInfo info : heap) {
            info.setPos(-1);
        }
        heap.clear();
    }

    private int siftUp(int i) {
        while (i > 0) {
            int p = (i - 1) >>> 1;
            if (heap.get(p).getLowerBound() <= heap.get(i).getLowerBound()) break;
            swap(p, i);
            i = p;
        }
        return i;
    }

    private void siftDown(int i) {
        int n = heap.size();
        while (true) {
            int l = (i << 1) + 1, r = l + 1, m = i;
            if (l < n && heap.get(l).getLowerBound() < heap.get(m).getLowerBound()) m = l;
            if (r < n && heap.get(r).getLowerBound() < heap.get(m).getLowerBound()) m = r;
            if (m == i) break;
            swap(i, m);
            i = m;
        }
    }

    private void swap(int a, int b) {
        NodeInfo t = heap.get(a);
        heap.set(a, heap.get(b));
        heap.set(b, t);
        heap.get(a).setPos(a);
        heap.get(b).setPos(b);
    }
}
