package com.nationrank.engine.leaderboard;

import com.nationrank.engine.aggregate.PlayerContribution;

/**
 * A player's share of a nation's record.
 */
public record Contributor(
        String playerId,
        String playerName,
        int wins,
        int losses,
        int netWins
) {

    public static Contributor from(PlayerContribution contribution) {
        return new Contributor(contribution.playerId(), contribution.playerName(),
                contribution.wins(), contribution.losses(), contribution.netWins());
    }
}
