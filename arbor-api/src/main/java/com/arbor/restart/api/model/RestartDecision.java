/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.api.model;

/**
 * Outcome of a node event as seen by the engine.
 */
public enum RestartDecision {
    /** Keep searching the current tree. */
    CONTINUE,

    /** Discard the tree and restart from the root. */
    RESTART
}
