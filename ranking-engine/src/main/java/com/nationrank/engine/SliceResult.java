package com.nationrank.engine;

import com.nationrank.engine.leaderboard.NationLeaderboard;
import com.nationrank.engine.leaderboard.PlayerLeaderboard;

/**
 * Outcome of one game mode within a ranking run: either complete, or failed with a
 * named reason. A stale slice is a complete slice carried over from an earlier run
 * because the current run could not recompute it.
 */
public record SliceResult(
        String gameMode,
        Status status,
        NationLeaderboard nationLeaderboard,
        PlayerLeaderboard playerLeaderboard,
        String failureReason,
        String failureMessage,
        boolean stale
) {

    public enum Status {
        COMPLETE,
        FAILED
    }

    public static SliceResult complete(String gameMode, NationLeaderboard nations, PlayerLeaderboard players) {
        return new SliceResult(gameMode, Status.COMPLETE, nations, players, null, null, false);
    }

    public static SliceResult failed(String gameMode, String reason, String message) {
        return new SliceResult(gameMode, Status.FAILED, null, null, reason, message, false);
    }

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }

    public SliceResult asStale() {
        return new SliceResult(gameMode, status, nationLeaderboard, playerLeaderboard,
                failureReason, failureMessage, true);
    }
}
