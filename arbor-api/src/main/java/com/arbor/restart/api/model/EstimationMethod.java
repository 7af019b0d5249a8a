/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.api.model;

/**
 * Source of the total tree-size estimate used by {@link RestartPolicy#ESTIMATION}.
 */
public enum EstimationMethod {
    /** Tree-size estimate from the engine's path probabilities. */
    TREE_SIZE('t'),

    /** Tree-profile estimate from the engine's depth histogram. */
    TREE_PROFILE('p');

    private final char code;

    EstimationMethod(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static EstimationMethod fromCode(char code) {
        for (EstimationMethod method : values()) {
            if (method.code == code) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown estimation method '" + code + "', expected one of t, p");
    }
}
