package com.nationrank.engine.confidence;

import com.nationrank.engine.aggregate.ModeAggregate;
import com.nationrank.engine.aggregate.NationAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Derives k and CF per slice and applies the confidence-corrected score:
 * {@code (wins - losses) / (totalGames + CF) * 10000}.
 */
public class ConfidenceCorrector {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceCorrector.class);

    public static final double SCORE_SCALE = 10_000.0;

    /**
     * Derives the factor from every nation with a decided game. The activity gate is
     * applied later and must not feed back into k.
     *
     * @throws UndefinedConfidenceFactorException if no nation has a decided game
     */
    public ConfidenceFactor derive(ModeAggregate aggregate) {
        Collection<NationAggregate> active = aggregate.activeNations();
        if (active.isEmpty()) {
            throw new UndefinedConfidenceFactorException(aggregate.getGameMode(), aggregate.getWindow());
        }
        long totalGames = active.stream().mapToLong(NationAggregate::totalGames).sum();
        double average = (double) totalGames / active.size();
        double k = average / 2.0;
        ConfidenceFactor factor = new ConfidenceFactor(
                aggregate.getGameMode(), aggregate.getWindow(), active.size(), average, k, 2.0 * k);

        log.info("Game mode {}: nations={}, avg_games={}, k={}, CF={}, min_games={}",
                aggregate.getGameMode(), active.size(),
                String.format("%.1f", average), String.format("%.1f", k),
                String.format("%.1f", factor.cf()), String.format("%.1f", factor.minimumGames()));
        return factor;
    }

    public static double adjustedScore(int wins, int losses, int totalGames, double cf) {
        return (wins - losses) / (totalGames + cf) * SCORE_SCALE;
    }

    /**
     * Score without damping, {@code (wins - losses) / totalGames * 10000}; 0 for no games.
     */
    public static double uncorrectedScore(int wins, int losses, int totalGames) {
        return totalGames > 0 ? (double) (wins - losses) / totalGames * SCORE_SCALE : 0.0;
    }

    public double adjustedScore(NationAggregate nation, ConfidenceFactor factor) {
        return adjustedScore(nation.wins(), nation.losses(), nation.totalGames(), factor.cf());
    }
}
