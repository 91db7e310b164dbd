package com.nationrank.engine.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable view of every accepted match inside one time window.
 *
 * <p>The snapshot is built once at the start of a run and passed explicitly to each
 * stage. Matches are held sorted by start time then match id, so the order in which
 * the store returned them never leaks into results.
 */
public final class MatchSnapshot {

    private static final Comparator<MatchRecord> CHRONOLOGICAL =
            Comparator.comparing(MatchRecord::startTime).thenComparing(MatchRecord::matchId);

    private final TimeWindow window;
    private final List<MatchRecord> matches;
    private final int outsideWindow;
    private final Map<String, Integer> skippedByReason;

    private MatchSnapshot(TimeWindow window, List<MatchRecord> matches,
                          int outsideWindow, Map<String, Integer> skippedByReason) {
        this.window = window;
        this.matches = matches;
        this.outsideWindow = outsideWindow;
        this.skippedByReason = skippedByReason;
    }

    public static Builder builder(TimeWindow window) {
        return new Builder(window);
    }

    public static MatchSnapshot of(TimeWindow window, Collection<MatchRecord> records) {
        Builder builder = builder(window);
        records.forEach(builder::add);
        return builder.build();
    }

    public TimeWindow getWindow() { return window; }

    public List<MatchRecord> getMatches() { return matches; }

    public int getOutsideWindow() { return outsideWindow; }

    public Map<String, Integer> getSkippedByReason() { return skippedByReason; }

    public int getSkippedRecords() {
        return skippedByReason.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    /**
     * Distinct game modes present in the snapshot, in natural order.
     */
    public Set<String> gameModes() {
        return matches.stream()
                .map(MatchRecord::gameMode)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public List<MatchRecord> forGameMode(String gameMode) {
        return matches.stream()
                .filter(m -> m.gameMode().equals(gameMode))
                .collect(Collectors.toList());
    }

    public static class Builder {

        private static final Logger log = LoggerFactory.getLogger(MatchSnapshot.class);

        private final TimeWindow window;
        private final List<MatchRecord> accepted = new ArrayList<>();
        private final Set<String> seenMatchIds = new HashSet<>();
        private final Map<String, Integer> skipped = new TreeMap<>();
        private int outsideWindow;

        private Builder(TimeWindow window) {
            if (window == null) {
                throw new IllegalArgumentException("Snapshot window is required");
            }
            this.window = window;
        }

        /**
         * Validates and adds one record.
         *
         * @return true if the record was accepted
         */
        public boolean add(MatchRecord record) {
            String problem = validate(record);
            if (problem != null) {
                reject(problem, record);
                return false;
            }
            if (!window.contains(record.startTime())) {
                outsideWindow++;
                return false;
            }
            if (!seenMatchIds.add(record.matchId())) {
                reject("duplicate match id", record);
                return false;
            }
            accepted.add(record);
            return true;
        }

        /**
         * Counts a record the caller could not even map into a {@link MatchRecord}.
         */
        public void reject(String reason) {
            skipped.merge(reason, 1, Integer::sum);
        }

        public MatchSnapshot build() {
            List<MatchRecord> sorted = new ArrayList<>(accepted);
            sorted.sort(CHRONOLOGICAL);
            int skippedTotal = skipped.values().stream().mapToInt(Integer::intValue).sum();
            if (skippedTotal > 0) {
                log.warn("Skipped {} malformed match records in window {}: {}", skippedTotal, window, skipped);
            }
            log.info("Snapshot for {} holds {} matches ({} outside window)", window, sorted.size(), outsideWindow);
            return new MatchSnapshot(window, Collections.unmodifiableList(sorted), outsideWindow,
                    Collections.unmodifiableMap(new TreeMap<>(skipped)));
        }

        private void reject(String reason, MatchRecord record) {
            skipped.merge(reason, 1, Integer::sum);
            log.debug("Rejected match {}: {}", record != null ? record.matchId() : null, reason);
        }

        private static String validate(MatchRecord record) {
            if (record == null) return "null record";
            if (isBlank(record.matchId())) return "missing match id";
            if (isBlank(record.gameMode())) return "missing game mode";
            if (record.startTime() == null) return "missing start time";
            if (record.players().isEmpty()) return "empty roster";
            for (PlayerResult player : record.players()) {
                if (player == null || isBlank(player.playerId())) return "player without id";
                if (player.outcome() == null) return "player without outcome";
            }
            return null;
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}
