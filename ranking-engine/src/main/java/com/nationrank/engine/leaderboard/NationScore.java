package com.nationrank.engine.leaderboard;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ranked row of the nation leaderboard.
 *
 * @param rawScore         wins minus losses
 * @param adjustedScore    confidence-corrected score, unrounded
 * @param uncorrectedScore {@code rawScore / totalGames * 10000}, for comparison
 */
public record NationScore(
        int rank,
        String countryCode,
        String gameMode,
        int wins,
        int losses,
        int totalGames,
        int playerCount,
        int rawScore,
        double adjustedScore,
        double uncorrectedScore,
        List<Contributor> topContributors
) {

    public NationScore {
        topContributors = topContributors == null ? List.of() : List.copyOf(topContributors);
    }

    /**
     * Adjusted score rounded half-up to an integer, the way it is shown to users.
     */
    @JsonProperty("displayScore")
    public long displayScore() {
        return Math.round(adjustedScore);
    }

    @JsonProperty("winRate")
    public double winRate() {
        return totalGames > 0 ? (double) wins / totalGames : 0.0;
    }
}
