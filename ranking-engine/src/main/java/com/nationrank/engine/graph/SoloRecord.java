package com.nationrank.engine.graph;

/**
 * A player's decided games over the whole window, teammates or not.
 */
public record SoloRecord(String playerId, String playerName, int wins, int losses) {

    public int decided() {
        return wins + losses;
    }

    public double winRate() {
        return decided() > 0 ? (double) wins / decided() : 0.0;
    }
}
