package com.nationrank.api.dto;

import com.nationrank.engine.RankingRun;
import com.nationrank.engine.SliceResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compact view of a published ranking run.
 */
public record RunSummary(
        Instant windowStart,
        Instant windowEnd,
        Instant completedAt,
        int matchCount,
        Map<String, Integer> skippedByReason,
        List<Slice> slices
) {

    public record Slice(
            String gameMode,
            String status,
            boolean stale,
            String failureReason,
            Integer rankedNations,
            Double k,
            Double cf,
            Integer rankedPlayers
    ) {

        static Slice from(SliceResult result) {
            if (!result.isComplete()) {
                return new Slice(result.gameMode(), result.status().name(), result.stale(),
                        result.failureReason(), null, null, null, null);
            }
            return new Slice(result.gameMode(), result.status().name(), result.stale(), null,
                    result.nationLeaderboard().nations().size(),
                    result.nationLeaderboard().k(),
                    result.nationLeaderboard().cf(),
                    result.playerLeaderboard().totalPlayers());
        }
    }

    public static RunSummary from(RankingRun run) {
        return new RunSummary(
                run.getWindow().start(),
                run.getWindow().end(),
                run.getCompletedAt(),
                run.getMatchCount(),
                run.getSkippedByReason(),
                run.getSlices().values().stream().map(Slice::from).collect(Collectors.toList())
        );
    }
}
