/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.api.model;

/**
 * Decides when the restart controller votes for a restart.
 */
public enum RestartPolicy {
    /**
     * Never restart.
     */
    NEVER('n'),

    /**
     * Restart as soon as the gating conditions allow it.
     */
    ALWAYS('a'),

    /**
     * Restart when the engine's total tree-size estimate exceeds the current node count
     * by the configured factor.
     */
    ESTIMATION('e'),

    /**
     * Restart when the forecast of the remaining work exceeds the configured factor.
     */
    PROGRESS('p');

    private final char code;

    RestartPolicy(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static RestartPolicy fromCode(char code) {
        for (RestartPolicy policy : values()) {
            if (policy.code == code) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown restart policy '" + code + "', expected one of n, a, e, p");
    }
}
