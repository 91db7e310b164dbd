package com.nationrank.engine.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable record of one finished match. Roster order is preserved.
 */
public record MatchRecord(
        String matchId,
        String gameMode,
        Instant startTime,
        List<PlayerResult> players
) {

    public MatchRecord {
        players = players == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(players));
    }

    /**
     * Roster grouped by team side, sides in ascending order.
     */
    public Map<Integer, List<PlayerResult>> playersBySide() {
        Map<Integer, List<PlayerResult>> sides = new LinkedHashMap<>();
        players.stream()
                .sorted((a, b) -> Integer.compare(a.teamSide(), b.teamSide()))
                .forEach(p -> sides.computeIfAbsent(p.teamSide(), s -> new ArrayList<>()).add(p));
        return sides;
    }

    public boolean involves(String playerId) {
        return players.stream().anyMatch(p -> p.playerId().equals(playerId));
    }
}
