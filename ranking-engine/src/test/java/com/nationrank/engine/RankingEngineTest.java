package com.nationrank.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nationrank.engine.leaderboard.NationLeaderboard;
import com.nationrank.engine.leaderboard.NationScoreExplanation;
import com.nationrank.engine.model.MatchRecord;
import com.nationrank.engine.model.MatchSnapshot;
import com.nationrank.engine.model.Outcome;
import com.nationrank.engine.team.DetectedTeam;
import com.nationrank.engine.team.TeamDetectionResult;
import com.nationrank.engine.team.TeamType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static com.nationrank.engine.MatchFixtures.BASE;
import static com.nationrank.engine.MatchFixtures.WINDOW;
import static com.nationrank.engine.MatchFixtures.match;
import static com.nationrank.engine.MatchFixtures.nationRecord;
import static com.nationrank.engine.MatchFixtures.player;
import static com.nationrank.engine.MatchFixtures.teamMatch;
import static org.junit.jupiter.api.Assertions.*;

class RankingEngineTest {

    private static final ObjectMapper JSON = new ObjectMapper().registerModule(new JavaTimeModule());

    private final RankingEngine engine = new RankingEngine(EngineSettings.defaults(), Clock.fixed(BASE, ZoneOffset.UTC));

    private static List<MatchRecord> history() {
        List<MatchRecord> matches = new ArrayList<>();
        matches.addAll(nationRecord("1v1", "MC", 4, 2));
        matches.addAll(nationRecord("1v1", "US", 200, 100));
        matches.addAll(nationRecord("1v1", "DE", 30, 20));
        matches.addAll(nationRecord("ffa", "FR", 5, 5));
        for (int i = 0; i < 6; i++) {
            matches.add(teamMatch("party" + i, 400 + i, "p" + i, i % 2 == 0 ? Outcome.WIN : Outcome.LOSS,
                    "alice", "bob", "carol"));
        }
        return matches;
    }

    @Test
    void monacoIsDampedAndGatedAgainstTheUnitedStates() {
        MatchSnapshot snapshot = MatchSnapshot.of(WINDOW, List.of(
                nationRecord("1v1", "MC", 4, 2), nationRecord("1v1", "US", 200, 100))
                .stream().flatMap(List::stream).toList());

        NationLeaderboard board = engine.buildNationLeaderboard(snapshot, "1v1");
        NationScoreExplanation monaco = engine.explainNationScore(snapshot, "1v1", "mc").orElseThrow();

        assertEquals(76.5, board.k(), 1e-9);
        assertEquals(153.0, board.cf(), 1e-9);
        assertEquals(1, board.nations().size());
        assertEquals("US", board.nations().get(0).countryCode());
        assertEquals(1, board.belowActivityGate());
        assertFalse(monaco.qualified());
        assertEquals(2.0 / 159.0 * 10000.0, monaco.adjustedScore(), 1e-6);
    }

    @Test
    void runComputesEveryGameModeAndFailsOnlyTheUndefinedOne() {
        List<MatchRecord> matches = new ArrayList<>(history());
        matches.add(match("draw", "coop", 500,
                player("x", "DE", null, 1, Outcome.DRAW), player("y", "FR", null, 2, Outcome.DRAW)));

        RankingRun run = engine.run(MatchSnapshot.of(WINDOW, matches));

        assertEquals(List.of("1v1", "coop", "ffa", "team"), List.copyOf(run.getSlices().keySet()));
        assertTrue(run.slice("1v1").orElseThrow().isComplete());
        assertTrue(run.slice("ffa").orElseThrow().isComplete());
        SliceResult coop = run.slice("coop").orElseThrow();
        assertFalse(coop.isComplete());
        assertEquals("CONFIDENCE_FACTOR_UNDEFINED", coop.failureReason());
        assertEquals(1, run.failedSlices());
    }

    @Test
    void failedSliceKeepsThePreviouslyPublishedResult() {
        RankingRun previous = engine.run(MatchSnapshot.of(WINDOW, history()));
        List<MatchRecord> drawsInFfa = new ArrayList<>(nationRecord("1v1", "DE", 3, 1));
        drawsInFfa.add(match("d1", "ffa", 1,
                player("x", "DE", null, 1, Outcome.DRAW), player("y", "FR", null, 2, Outcome.DRAW)));
        RankingRun current = engine.run(MatchSnapshot.of(WINDOW, drawsInFfa));

        RankingRun published = current.publishOver(previous);

        SliceResult ffa = published.slice("ffa").orElseThrow();
        assertTrue(ffa.isComplete());
        assertTrue(ffa.stale());
        assertEquals(previous.slice("ffa").orElseThrow().nationLeaderboard(), ffa.nationLeaderboard());
        SliceResult oneVsOne = published.slice("1v1").orElseThrow();
        assertFalse(oneVsOne.stale());
        assertEquals(current.slice("1v1").orElseThrow(), oneVsOne);
        assertTrue(published.slice("team").orElseThrow().stale());
    }

    @Test
    void runsOverTheSameMatchesSerializeIdenticallyWhateverTheInputOrder() throws Exception {
        List<MatchRecord> shuffled = new ArrayList<>(history());
        Collections.shuffle(shuffled, new Random(42));
        MatchSnapshot ordered = MatchSnapshot.of(WINDOW, history());
        MatchSnapshot reordered = MatchSnapshot.of(WINDOW, shuffled);

        String firstRun = JSON.writeValueAsString(engine.run(ordered));
        String secondRun = JSON.writeValueAsString(engine.run(reordered));

        assertEquals(firstRun, secondRun);
        assertTrue(firstRun.contains("\"displayScore\""));
        assertEquals(JSON.writeValueAsString(engine.buildTeams(ordered, TeamType.PARTY)),
                JSON.writeValueAsString(engine.buildTeams(reordered, TeamType.PARTY)));
        assertEquals(JSON.writeValueAsString(engine.buildTeams(ordered, TeamType.COMMUNITY)),
                JSON.writeValueAsString(engine.buildTeams(reordered, TeamType.COMMUNITY)));
        assertEquals(JSON.writeValueAsString(engine.frequentPairs(ordered)),
                JSON.writeValueAsString(engine.frequentPairs(reordered)));
    }

    @Test
    void teamsCanBeSearchedByPlayerName() {
        MatchSnapshot snapshot = MatchSnapshot.of(WINDOW, history());

        TeamDetectionResult parties = engine.buildTeams(snapshot, TeamType.PARTY);
        List<DetectedTeam> found = engine.searchTeams(snapshot, TeamType.COMMUNITY, "name ALICE");

        assertEquals(1, parties.totalTeams());
        assertEquals("Name alice's Squad", parties.teams().get(0).name());
        assertEquals(1, found.size());
        assertEquals(TeamType.COMMUNITY, found.get(0).type());
        assertTrue(engine.searchTeams(snapshot, TeamType.PARTY, "nobody").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> engine.searchTeams(snapshot, TeamType.PARTY, " "));
    }

    @Test
    void countryPlayerBoardRejectsUnknownCodes() {
        MatchSnapshot snapshot = MatchSnapshot.of(WINDOW, history());

        assertEquals("DE", engine.buildPlayerLeaderboard(snapshot, "1v1", "de").countryCode());
        assertThrows(IllegalArgumentException.class, () -> engine.buildPlayerLeaderboard(snapshot, "1v1", "??"));
    }

    @Test
    void settingsRejectInconsistentThresholds() {
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.builder().minRosterSize(1).build());
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.builder().cohesionMinFraction(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.builder().workerThreads(0).build());
        assertEquals(Set.of("ARM"), EngineSettings.builder().factionCodes(Set.of(" arm ")).build().getFactionCodes());
    }
}
