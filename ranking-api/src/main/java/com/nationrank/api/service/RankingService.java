package com.nationrank.api.service;

import com.nationrank.api.config.RankingProperties;
import com.nationrank.api.exception.ResourceNotFoundException;
import com.nationrank.engine.RankingEngine;
import com.nationrank.engine.RankingRun;
import com.nationrank.engine.leaderboard.NationLeaderboard;
import com.nationrank.engine.leaderboard.NationScoreExplanation;
import com.nationrank.engine.leaderboard.PlayerLeaderboard;
import com.nationrank.engine.model.MatchSnapshot;
import com.nationrank.engine.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Nation and player leaderboards over a rolling window, plus the published batch run.
 *
 * <p>Leaderboard requests recompute from a fresh snapshot. A batch run computes every
 * game mode and replaces the published run in one swap; game modes that fail keep
 * their previously published results.
 */
@Service
public class RankingService {

    private static final Logger log = LoggerFactory.getLogger(RankingService.class);

    private final MatchStoreAdapter matchStore;
    private final RankingEngine engine;
    private final RankingProperties properties;
    private final Clock clock;

    private final AtomicReference<RankingRun> published = new AtomicReference<>();

    public RankingService(
            MatchStoreAdapter matchStore,
            RankingEngine engine,
            RankingProperties properties,
            Clock clock
    ) {
        this.matchStore = matchStore;
        this.engine = engine;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Rolling window ending now; {@code days} null means the configured default.
     */
    public TimeWindow window(Integer days) {
        int length = days != null ? days : properties.getWindowDays();
        return TimeWindow.lastDays(clock.instant(), length);
    }

    public MatchSnapshot snapshot(Integer days) {
        return matchStore.loadSnapshot(window(days));
    }

    // ============ LEADERBOARDS ============

    public NationLeaderboard getNationLeaderboard(String gameMode, Integer days) {
        return engine.buildNationLeaderboard(snapshot(days), gameMode);
    }

    public PlayerLeaderboard getPlayerLeaderboard(String gameMode, String countryCode, Integer days) {
        return engine.buildPlayerLeaderboard(snapshot(days), gameMode, countryCode);
    }

    public NationScoreExplanation explainNationScore(String gameMode, String countryCode, Integer days) {
        return engine.explainNationScore(snapshot(days), gameMode, countryCode)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Nation", countryCode + " has no decided " + gameMode + " games in this window"));
    }

    // ============ BATCH RUNS ============

    public RankingRun runAndPublish(Integer days) {
        MatchSnapshot snapshot = snapshot(days);
        RankingRun run = engine.run(snapshot);
        RankingRun next = published.updateAndGet(run::publishOver);
        log.info("Published ranking run over {}: {} game modes ({} recomputed, {} failed)",
                next.getWindow(), next.getSlices().size(), run.getSlices().size() - run.failedSlices(),
                run.failedSlices());
        return next;
    }

    public Optional<RankingRun> getPublishedRun() {
        return Optional.ofNullable(published.get());
    }
}
