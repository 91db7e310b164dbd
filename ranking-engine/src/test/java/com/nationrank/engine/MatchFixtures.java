package com.nationrank.engine;

import com.nationrank.engine.model.MatchRecord;
import com.nationrank.engine.model.Outcome;
import com.nationrank.engine.model.PlayerResult;
import com.nationrank.engine.model.TimeWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for synthetic match history used across the engine tests.
 */
public final class MatchFixtures {

    public static final Instant BASE = Instant.parse("2026-01-05T00:00:00Z");
    public static final TimeWindow WINDOW = new TimeWindow(BASE, BASE.plus(Duration.ofDays(7)));

    private MatchFixtures() {
    }

    public static Instant at(int minute) {
        return BASE.plus(Duration.ofMinutes(minute));
    }

    public static MatchRecord match(String id, String mode, int minute, PlayerResult... players) {
        return new MatchRecord(id, mode, at(minute), Arrays.asList(players));
    }

    public static PlayerResult player(String id, String country, String party, int side, Outcome outcome) {
        return new PlayerResult(id, "Name " + id, country, party, side, outcome);
    }

    public static PlayerResult winner(String id, String country) {
        return player(id, country, null, 1, Outcome.WIN);
    }

    public static PlayerResult loser(String id, String country) {
        return player(id, country, null, 2, Outcome.LOSS);
    }

    /**
     * Duels of one nation against opponents without a resolvable nation, so only that
     * nation's tallies move. Players {@code <country>-0..2} take turns.
     */
    public static List<MatchRecord> nationRecord(String mode, String country, int wins, int losses) {
        List<MatchRecord> matches = new ArrayList<>();
        int n = 0;
        for (int i = 0; i < wins; i++, n++) {
            matches.add(match(country + "-" + mode + "-" + n, mode, n,
                    winner(country + "-" + (n % 3), country),
                    loser("anon-" + country + "-" + n, null)));
        }
        for (int i = 0; i < losses; i++, n++) {
            matches.add(match(country + "-" + mode + "-" + n, mode, n,
                    winner("anon-" + country + "-" + n, "??"),
                    loser(country + "-" + (n % 3), country)));
        }
        return matches;
    }

    /**
     * One match where {@code team} plays together on side 1 under {@code party} (may be null)
     * against a single fresh opponent.
     */
    public static MatchRecord teamMatch(String id, int minute, String party, Outcome outcome, String... team) {
        List<PlayerResult> players = new ArrayList<>();
        for (String member : team) {
            players.add(player(member, "DE", party, 1, outcome));
        }
        Outcome opposite = outcome == Outcome.WIN ? Outcome.LOSS : outcome == Outcome.LOSS ? Outcome.WIN : Outcome.DRAW;
        players.add(player("opp-" + id, "FR", null, 2, opposite));
        return new MatchRecord(id, "team", at(minute), players);
    }
}
