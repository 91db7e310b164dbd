package com.nationrank.engine.confidence;

import com.nationrank.engine.model.TimeWindow;

/**
 * Damping constant of one (game mode, window) slice.
 *
 * @param nationCount           nations with at least one decided game
 * @param averageGamesPerNation mean total games over those nations
 * @param k                     half the average
 * @param cf                    confidence factor, {@code 2k}
 */
public record ConfidenceFactor(
        String gameMode,
        TimeWindow window,
        int nationCount,
        double averageGamesPerNation,
        double k,
        double cf
) {

    /**
     * Activity gate of the leaderboard: nations below {@code k / 4} games are not ranked.
     */
    public double minimumGames() {
        return k / 4.0;
    }

    public boolean admits(int totalGames) {
        return totalGames >= minimumGames();
    }
}
