package com.nationrank.engine.leaderboard;

import com.nationrank.engine.confidence.ConfidenceFactor;
import com.nationrank.engine.model.TimeWindow;

import java.util.List;
import java.util.Optional;

/**
 * Nation leaderboard of one (game mode, window) slice together with its k and CF.
 *
 * @param belowActivityGate nations that had games but fell under {@code k / 4}
 */
public record NationLeaderboard(
        String gameMode,
        TimeWindow window,
        ConfidenceFactor confidence,
        List<NationScore> nations,
        int belowActivityGate
) {

    public NationLeaderboard {
        nations = List.copyOf(nations);
    }

    public double k() {
        return confidence.k();
    }

    public double cf() {
        return confidence.cf();
    }

    public Optional<NationScore> nation(String countryCode) {
        return nations.stream().filter(n -> n.countryCode().equals(countryCode)).findFirst();
    }
}
