package com.nationrank.engine.team;

import com.nationrank.engine.model.Outcome;

import java.util.List;

/**
 * One match a team took part in, with the sorted lineup that fielded it.
 */
record TeamAppearance(String matchId, String gameMode, List<String> lineup, Outcome outcome) {

    TeamAppearance {
        lineup = List.copyOf(lineup);
    }

    String lineupKey() {
        return String.join(",", lineup);
    }
}
