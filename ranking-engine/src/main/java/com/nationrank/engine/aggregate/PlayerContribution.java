package com.nationrank.engine.aggregate;

import java.time.Instant;

/**
 * One player's tallies for one game mode.
 *
 * @param countryCode      resolved nation code, or null when the player's code did not resolve
 * @param latestSkill      skill reported by the player's most recent match carrying one (nullable)
 * @param latestUncertainty uncertainty reported alongside {@code latestSkill} (nullable)
 */
public record PlayerContribution(
        String playerId,
        String playerName,
        String countryCode,
        String gameMode,
        int wins,
        int losses,
        int draws,
        Instant lastPlayed,
        Double latestSkill,
        Double latestUncertainty
) {

    public int decidedGames() {
        return wins + losses;
    }

    public int netWins() {
        return wins - losses;
    }

    public double winRate() {
        int decided = decidedGames();
        return decided > 0 ? (double) wins / decided : 0.0;
    }

    public boolean hasNation() {
        return countryCode != null;
    }

    public boolean hasSkill() {
        return latestSkill != null && latestUncertainty != null;
    }
}
