package com.nationrank.engine.team;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Finds teams containing a player, by exact id or case-insensitive name fragment.
 */
public final class TeamSearch {

    private TeamSearch() {
    }

    public static List<DetectedTeam> search(List<DetectedTeam> teams, String player) {
        if (player == null || player.isBlank()) {
            throw new IllegalArgumentException("Player search term is required");
        }
        return teams.stream()
                .filter(team -> team.hasMemberMatching(player))
                .collect(Collectors.toList());
    }
}
