package com.nationrank.engine.graph;

/**
 * Same-side history of one pair.
 *
 * @param weight      matches played together on the same side
 * @param jointWins   of those, matches the side won
 * @param jointLosses of those, matches the side lost
 */
public record PairStats(int weight, int jointWins, int jointLosses) {

    public static final PairStats NONE = new PairStats(0, 0, 0);

    public PairStats plus(PairStats other) {
        return new PairStats(weight + other.weight, jointWins + other.jointWins, jointLosses + other.jointLosses);
    }

    public int decided() {
        return jointWins + jointLosses;
    }

    public double jointWinRate() {
        return decided() > 0 ? (double) jointWins / decided() : 0.0;
    }
}
