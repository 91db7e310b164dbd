package com.nationrank.engine.leaderboard;

import java.util.List;

/**
 * Full breakdown of how a nation's score came about.
 *
 * @param qualified          whether the nation passed the {@code k / 4} activity gate
 * @param rank               leaderboard rank, or null when not qualified
 * @param playerDistribution every contributing player, best net wins first
 */
public record NationScoreExplanation(
        String countryCode,
        String gameMode,
        int wins,
        int losses,
        int totalGames,
        int rawScore,
        double adjustedScore,
        double uncorrectedScore,
        double k,
        double cf,
        double minimumGames,
        boolean qualified,
        Integer rank,
        List<Contributor> playerDistribution
) {

    public NationScoreExplanation {
        playerDistribution = List.copyOf(playerDistribution);
    }
}
