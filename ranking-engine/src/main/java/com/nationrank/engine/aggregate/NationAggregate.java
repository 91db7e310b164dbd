package com.nationrank.engine.aggregate;

/**
 * Decided games of one nation in one game mode. Draws are not part of any tally.
 */
public record NationAggregate(
        String countryCode,
        String gameMode,
        int wins,
        int losses,
        int playerCount
) {

    public int totalGames() {
        return wins + losses;
    }

    public int netWins() {
        return wins - losses;
    }

    public double winRate() {
        int total = totalGames();
        return total > 0 ? (double) wins / total : 0.0;
    }
}
