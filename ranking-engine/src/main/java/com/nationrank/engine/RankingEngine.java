package com.nationrank.engine;

import com.nationrank.engine.aggregate.ModeAggregate;
import com.nationrank.engine.aggregate.NationCodePolicy;
import com.nationrank.engine.aggregate.ScoreAggregator;
import com.nationrank.engine.confidence.ConfidenceCorrector;
import com.nationrank.engine.confidence.ConfidenceFactor;
import com.nationrank.engine.graph.PlayerPairEdge;
import com.nationrank.engine.leaderboard.LeaderboardBuilder;
import com.nationrank.engine.leaderboard.NationLeaderboard;
import com.nationrank.engine.leaderboard.NationScoreExplanation;
import com.nationrank.engine.leaderboard.PlayerLeaderboard;
import com.nationrank.engine.model.MatchSnapshot;
import com.nationrank.engine.team.DetectedTeam;
import com.nationrank.engine.team.TeamDetectionResult;
import com.nationrank.engine.team.TeamDetector;
import com.nationrank.engine.team.TeamSearch;
import com.nationrank.engine.team.TeamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Entry point of the engine. Every operation is a pure function of the snapshot it is
 * given and the settings the engine was built with.
 */
public class RankingEngine {

    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);

    public static final String UNEXPECTED_FAILURE = "UNEXPECTED_FAILURE";

    private final EngineSettings settings;
    private final NationCodePolicy nationCodes;
    private final ScoreAggregator aggregator;
    private final ConfidenceCorrector corrector;
    private final LeaderboardBuilder leaderboards;
    private final TeamDetector teams;
    private final Clock clock;

    public RankingEngine(EngineSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public RankingEngine(EngineSettings settings, Clock clock) {
        this.settings = settings;
        this.nationCodes = new NationCodePolicy(settings.getKnownNationCodes(), settings.getFactionCodes());
        this.aggregator = new ScoreAggregator(nationCodes);
        this.corrector = new ConfidenceCorrector();
        this.leaderboards = new LeaderboardBuilder(settings, corrector);
        this.teams = new TeamDetector(settings);
        this.clock = clock;
    }

    public EngineSettings getSettings() {
        return settings;
    }

    // ============ RANKINGS ============

    /**
     * @throws SliceComputationException if no nation recorded a decided game in the slice
     */
    public NationLeaderboard buildNationLeaderboard(MatchSnapshot snapshot, String gameMode) {
        ModeAggregate aggregate = aggregator.aggregate(snapshot, gameMode);
        return leaderboards.buildNationLeaderboard(aggregate, corrector.derive(aggregate));
    }

    /**
     * @param countryCode nation to restrict the board to, or null for the global board
     * @throws IllegalArgumentException if {@code countryCode} is not a resolvable nation code
     */
    public PlayerLeaderboard buildPlayerLeaderboard(MatchSnapshot snapshot, String gameMode, String countryCode) {
        String nation = countryCode == null ? null : resolveNation(countryCode);
        return leaderboards.buildPlayerLeaderboard(aggregator.aggregate(snapshot, gameMode), nation);
    }

    /**
     * Empty when the nation has no decided game in the slice.
     */
    public Optional<NationScoreExplanation> explainNationScore(MatchSnapshot snapshot, String gameMode,
                                                               String countryCode) {
        String nation = resolveNation(countryCode);
        ModeAggregate aggregate = aggregator.aggregate(snapshot, gameMode);
        return leaderboards.explain(aggregate, corrector.derive(aggregate), nation);
    }

    private String resolveNation(String countryCode) {
        return nationCodes.resolve(countryCode)
                .orElseThrow(() -> new IllegalArgumentException("Not a recognised nation code: " + countryCode));
    }

    // ============ TEAMS ============

    public TeamDetectionResult buildTeams(MatchSnapshot snapshot, TeamType type) {
        return teams.detect(type, snapshot);
    }

    /**
     * Teams of the given type with a member whose id equals, or whose name contains,
     * {@code player}. Searched over all detected teams, not only the shown ones.
     */
    public List<DetectedTeam> searchTeams(MatchSnapshot snapshot, TeamType type, String player) {
        TeamDetectionResult result = teams.detect(type, snapshot, teams.graph(snapshot), Integer.MAX_VALUE);
        return TeamSearch.search(result.teams(), player);
    }

    public List<PlayerPairEdge> frequentPairs(MatchSnapshot snapshot) {
        return teams.frequentPairs(snapshot);
    }

    // ============ BATCH ============

    /**
     * Computes every game mode of the snapshot in parallel. A mode that cannot be
     * computed yields a failed slice; the other modes are unaffected.
     */
    public RankingRun run(MatchSnapshot snapshot) {
        Set<String> modes = snapshot.gameModes();
        Map<String, SliceResult> slices = new TreeMap<>();

        if (!modes.isEmpty()) {
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(settings.getWorkerThreads(), modes.size()));
            CompletionService<SliceResult> cs = new ExecutorCompletionService<>(pool);
            try {
                for (String mode : modes) {
                    cs.submit(() -> computeSlice(snapshot, mode));
                }
                for (int i = 0; i < modes.size(); i++) {
                    Future<SliceResult> f = cs.take();
                    SliceResult slice = f.get();
                    slices.put(slice.gameMode(), slice);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Ranking run interrupted", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Ranking run failed", e.getCause());
            } finally {
                pool.shutdownNow();
            }
        }

        RankingRun run = new RankingRun(snapshot.getWindow(), Instant.now(clock), snapshot.getMatches().size(),
                snapshot.getSkippedByReason(), slices);
        log.info("Ranking run over {}: {} game modes, {} failed, {} matches",
                snapshot.getWindow(), slices.size(), run.failedSlices(), run.getMatchCount());
        return run;
    }

    SliceResult computeSlice(MatchSnapshot snapshot, String gameMode) {
        try {
            ModeAggregate aggregate = aggregator.aggregate(snapshot, gameMode);
            ConfidenceFactor factor = corrector.derive(aggregate);
            return SliceResult.complete(gameMode,
                    leaderboards.buildNationLeaderboard(aggregate, factor),
                    leaderboards.buildPlayerLeaderboard(aggregate, null));
        } catch (SliceComputationException e) {
            log.warn("Game mode {} failed: {} ({})", gameMode, e.getReason(), e.getMessage());
            return SliceResult.failed(gameMode, e.getReason(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Game mode {} failed unexpectedly", gameMode, e);
            return SliceResult.failed(gameMode, UNEXPECTED_FAILURE, e.getMessage());
        }
    }
}
