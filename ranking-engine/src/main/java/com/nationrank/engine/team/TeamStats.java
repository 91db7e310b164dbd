package com.nationrank.engine.team;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nationrank.engine.model.Outcome;

import java.util.Collection;

/**
 * Match record of a team. Drawn matches count towards {@code matches} only.
 */
public record TeamStats(int matches, int wins, int losses) {

    public static final TeamStats EMPTY = new TeamStats(0, 0, 0);

    static TeamStats of(Collection<TeamAppearance> appearances) {
        int wins = 0;
        int losses = 0;
        for (TeamAppearance appearance : appearances) {
            if (appearance.outcome() == Outcome.WIN) wins++;
            if (appearance.outcome() == Outcome.LOSS) losses++;
        }
        return new TeamStats(appearances.size(), wins, losses);
    }

    @JsonProperty("winRate")
    public double winRate() {
        int decided = wins + losses;
        return decided > 0 ? (double) wins / decided : 0.0;
    }
}
