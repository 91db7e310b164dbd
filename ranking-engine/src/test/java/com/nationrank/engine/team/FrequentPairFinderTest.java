package com.nationrank.engine.team;

import com.nationrank.engine.graph.CoOccurrenceGraph;
import com.nationrank.engine.graph.PlayerPairEdge;
import com.nationrank.engine.graph.TeamGraphBuilder;
import com.nationrank.engine.model.MatchRecord;
import com.nationrank.engine.model.Outcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.nationrank.engine.MatchFixtures.loser;
import static com.nationrank.engine.MatchFixtures.match;
import static com.nationrank.engine.MatchFixtures.teamMatch;
import static com.nationrank.engine.MatchFixtures.winner;
import static org.junit.jupiter.api.Assertions.*;

class FrequentPairFinderTest {

    private final FrequentPairFinder finder = new FrequentPairFinder(3);

    /**
     * a and b win 3 of 4 together. Alone, a loses twice more: a is 3-3 (0.5), b is 3-1 (0.75).
     * Synergy = 0.75 / 0.625 = 1.2.
     */
    @Test
    void synergyIsLiftOverMeanSoloWinRate() {
        List<MatchRecord> matches = new ArrayList<>();
        matches.add(teamMatch("t1", 1, null, Outcome.WIN, "a", "b"));
        matches.add(teamMatch("t2", 2, null, Outcome.WIN, "a", "b"));
        matches.add(teamMatch("t3", 3, null, Outcome.WIN, "a", "b"));
        matches.add(teamMatch("t4", 4, null, Outcome.LOSS, "a", "b"));
        matches.add(match("s1", "1v1", 5, winner("z1", "FR"), loser("a", "DE")));
        matches.add(match("s2", "1v1", 6, winner("z2", "FR"), loser("a", "DE")));

        List<PlayerPairEdge> pairs = finder.find(graph(matches));

        assertEquals(1, pairs.size());
        PlayerPairEdge ab = pairs.get(0);
        assertEquals(4, ab.weight());
        assertEquals(0.75, ab.jointWinRate(), 1e-9);
        assertEquals(0.5, ab.winRateA(), 1e-9);
        assertEquals(0.75, ab.winRateB(), 1e-9);
        assertEquals(1.2, ab.synergy(), 1e-9);
    }

    @Test
    void synergyIsNeutralWhenNeitherPlayerEverWins() {
        assertEquals(1.0, PlayerPairEdge.synergyOf(0.0, 0.0, 0.0));
    }

    @Test
    void pairsBelowTheWeightThresholdAreNotReported() {
        List<MatchRecord> matches = List.of(
                teamMatch("t1", 1, null, Outcome.WIN, "a", "b"),
                teamMatch("t2", 2, null, Outcome.WIN, "a", "b"));

        assertTrue(finder.find(graph(matches)).isEmpty());
    }

    @Test
    void pairsAreOrderedByWeightThenSynergy() {
        List<MatchRecord> matches = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            matches.add(teamMatch("w" + i, i, null, Outcome.WIN, "c", "d"));
            matches.add(teamMatch("l" + i, 10 + i, null, Outcome.LOSS, "e", "f"));
        }
        for (int i = 0; i < 4; i++) {
            matches.add(teamMatch("x" + i, 20 + i, null, Outcome.LOSS, "g", "h"));
        }

        List<String> keys = finder.find(graph(matches)).stream().map(PlayerPairEdge::pairKey).toList();

        assertEquals(List.of("g|h", "c|d", "e|f"), keys);
    }

    @Test
    void equalWeightPairsAreOrderedBySynergyBeforePairKey() {
        List<MatchRecord> matches = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            matches.add(teamMatch("pq" + i, i, null, Outcome.LOSS, "p", "q"));
            matches.add(teamMatch("yz" + i, 10 + i, null, Outcome.WIN, "y", "z"));
        }
        matches.add(match("s1", "1v1", 20, winner("p", "DE"), loser("o1", "FR")));
        matches.add(match("s2", "1v1", 21, winner("q", "DE"), loser("o2", "FR")));

        List<PlayerPairEdge> pairs = finder.find(graph(matches));

        assertEquals(List.of("y|z", "p|q"), pairs.stream().map(PlayerPairEdge::pairKey).toList());
        assertEquals(1.0, pairs.get(0).synergy(), 1e-9);
        assertEquals(0.0, pairs.get(1).synergy(), 1e-9);
    }

    private static CoOccurrenceGraph graph(List<MatchRecord> matches) {
        return new TeamGraphBuilder(false).build(matches);
    }
}
