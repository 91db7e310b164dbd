package com.nationrank.engine;

import com.nationrank.engine.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Every game-mode slice of one batch run over one window.
 */
public final class RankingRun {

    private static final Logger log = LoggerFactory.getLogger(RankingRun.class);

    private final TimeWindow window;
    private final Instant completedAt;
    private final int matchCount;
    private final Map<String, Integer> skippedByReason;
    private final Map<String, SliceResult> slices;

    public RankingRun(TimeWindow window, Instant completedAt, int matchCount,
                      Map<String, Integer> skippedByReason, Map<String, SliceResult> slices) {
        this.window = window;
        this.completedAt = completedAt;
        this.matchCount = matchCount;
        this.skippedByReason = Collections.unmodifiableMap(new TreeMap<>(skippedByReason));
        this.slices = Collections.unmodifiableMap(new TreeMap<>(slices));
    }

    public TimeWindow getWindow() { return window; }
    public Instant getCompletedAt() { return completedAt; }
    public int getMatchCount() { return matchCount; }
    public Map<String, Integer> getSkippedByReason() { return skippedByReason; }
    public Map<String, SliceResult> getSlices() { return slices; }

    public Optional<SliceResult> slice(String gameMode) {
        return Optional.ofNullable(slices.get(gameMode));
    }

    public long failedSlices() {
        return slices.values().stream().filter(s -> !s.isComplete()).count();
    }

    /**
     * The run to publish in place of {@code previous}. Complete slices of this run win;
     * where this run failed or no longer has a game mode, the previous complete slice is
     * kept and marked stale.
     */
    public RankingRun publishOver(RankingRun previous) {
        if (previous == null) {
            return this;
        }
        Map<String, SliceResult> merged = new TreeMap<>(slices);
        previous.slices.forEach((mode, old) -> {
            SliceResult current = merged.get(mode);
            if ((current == null || !current.isComplete()) && old.isComplete()) {
                merged.put(mode, old.stale() ? old : old.asStale());
                log.warn("Game mode {}: keeping previously published results ({})", mode,
                        current != null ? current.failureReason() : "no matches in this run");
            }
        });
        return new RankingRun(window, completedAt, matchCount, skippedByReason, merged);
    }
}
