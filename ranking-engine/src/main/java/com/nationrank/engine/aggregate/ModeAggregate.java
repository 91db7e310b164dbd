package com.nationrank.engine.aggregate;

import com.nationrank.engine.model.TimeWindow;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Score Aggregator output for one (game mode, window) slice.
 * Maps are keyed and iterated in natural key order.
 */
public class ModeAggregate {

    private final String gameMode;
    private final TimeWindow window;
    private final int matchCount;
    private final Map<String, NationAggregate> nations;
    private final Map<String, PlayerContribution> players;

    public ModeAggregate(String gameMode, TimeWindow window, int matchCount,
                         Map<String, NationAggregate> nations,
                         Map<String, PlayerContribution> players) {
        this.gameMode = gameMode;
        this.window = window;
        this.matchCount = matchCount;
        this.nations = nations;
        this.players = players;
    }

    public String getGameMode() { return gameMode; }
    public TimeWindow getWindow() { return window; }
    public int getMatchCount() { return matchCount; }
    public Map<String, NationAggregate> getNations() { return nations; }
    public Map<String, PlayerContribution> getPlayers() { return players; }

    public Optional<NationAggregate> nation(String countryCode) {
        return Optional.ofNullable(nations.get(countryCode));
    }

    /**
     * Nations with at least one decided game. This is the population the
     * confidence factor is derived from.
     */
    public Collection<NationAggregate> activeNations() {
        return nations.values().stream()
                .filter(n -> n.totalGames() > 0)
                .collect(Collectors.toList());
    }

    /**
     * Players of a nation, best net wins first.
     */
    public List<PlayerContribution> playersOf(String countryCode) {
        return players.values().stream()
                .filter(p -> countryCode.equals(p.countryCode()))
                .sorted(BY_NET_WINS)
                .collect(Collectors.toList());
    }

    /**
     * Net wins desc, then wins desc, then name and id asc.
     */
    public static final Comparator<PlayerContribution> BY_NET_WINS = Comparator
            .comparingInt(PlayerContribution::netWins).reversed()
            .thenComparing(Comparator.comparingInt(PlayerContribution::wins).reversed())
            .thenComparing(PlayerContribution::playerName, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(PlayerContribution::playerId);
}
