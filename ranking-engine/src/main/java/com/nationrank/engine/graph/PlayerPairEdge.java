package com.nationrank.engine.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A frequent pair with its joint record and synergy.
 *
 * <p>{@code synergy = jointWinRate / mean(winRateA, winRateB)}, 1.0 when that mean is 0.
 * Values above 1 mean the pair wins more together than apart.
 */
public record PlayerPairEdge(
        String playerA,
        String playerAName,
        String playerB,
        String playerBName,
        int weight,
        int jointWins,
        int jointLosses,
        double jointWinRate,
        double winRateA,
        double winRateB,
        double synergy
) {

    public static double synergyOf(double jointWinRate, double winRateA, double winRateB) {
        double baseline = (winRateA + winRateB) / 2.0;
        return baseline > 0.0 ? jointWinRate / baseline : 1.0;
    }

    @JsonProperty("pairKey")
    public String pairKey() {
        return playerA + "|" + playerB;
    }

    public boolean involves(String playerId) {
        return playerA.equals(playerId) || playerB.equals(playerId);
    }
}
