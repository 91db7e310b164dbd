package com.nationrank.engine.leaderboard;

/**
 * Ranked row of a player leaderboard.
 */
public record PlayerStanding(
        int rank,
        String playerId,
        String name,
        String countryCode,
        int wins,
        int losses,
        int totalGames,
        double winRate,
        double rating
) {
}
