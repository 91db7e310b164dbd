package com.nationrank.engine.leaderboard;

import java.util.List;

/**
 * Player leaderboard of one game mode, optionally scoped to one nation.
 *
 * @param countryCode  nation scope, or null for the global board
 * @param totalPlayers qualified players before truncation
 */
public record PlayerLeaderboard(
        String gameMode,
        String countryCode,
        List<PlayerStanding> players,
        int totalPlayers
) {

    public PlayerLeaderboard {
        players = List.copyOf(players);
    }

    public boolean isGlobal() {
        return countryCode == null;
    }
}
