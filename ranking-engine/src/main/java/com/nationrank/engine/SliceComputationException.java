package com.nationrank.engine;

/**
 * Aborts the computation of one (game mode, window) slice. Other slices of the same
 * run are unaffected.
 */
public class SliceComputationException extends RuntimeException {

    private final String gameMode;
    private final String reason;

    public SliceComputationException(String gameMode, String reason, String message) {
        super(message);
        this.gameMode = gameMode;
        this.reason = reason;
    }

    public String getGameMode() {
        return gameMode;
    }

    /**
     * Stable machine-readable failure name.
     */
    public String getReason() {
        return reason;
    }
}
