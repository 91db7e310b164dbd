package com.nationrank.engine.model;

/**
 * Result of a single player in a single match.
 */
public enum Outcome {
    WIN,
    LOSS,
    DRAW;

    public boolean isDecided() {
        return this != DRAW;
    }
}
