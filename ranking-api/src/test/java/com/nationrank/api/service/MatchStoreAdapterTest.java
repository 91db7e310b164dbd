package com.nationrank.api.service;

import com.nationrank.api.config.RankingProperties;
import com.nationrank.api.model.readonly.MatchDocument;
import com.nationrank.api.model.readonly.MatchPlayerEntry;
import com.nationrank.api.model.readonly.PlayerDocument;
import com.nationrank.api.repository.readonly.MatchReadRepository;
import com.nationrank.api.repository.readonly.PlayerReadRepository;
import com.nationrank.engine.model.MatchRecord;
import com.nationrank.engine.model.MatchSnapshot;
import com.nationrank.engine.model.Outcome;
import com.nationrank.engine.model.PlayerResult;
import com.nationrank.engine.model.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MatchStoreAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-09T12:00:00Z");
    private static final TimeWindow WINDOW = TimeWindow.lastDays(NOW, 7);

    @Mock
    private MatchReadRepository matchRepository;

    @Mock
    private PlayerReadRepository playerRepository;

    private RankingProperties properties;
    private MatchStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new RankingProperties();
        adapter = new MatchStoreAdapter(matchRepository, playerRepository, properties);
        lenient().when(playerRepository.findByUserIdIn(anyCollection())).thenReturn(List.of(
                new PlayerDocument("u1", "Anna", "de"),
                new PlayerDocument("u2", "Bruno", "FR")
        ));
    }

    private static MatchDocument duel(String id, Boolean ranked, Integer winningTeam, Boolean draw) {
        return new MatchDocument(id, "1v1", NOW.minusSeconds(3600), ranked, winningTeam, draw, List.of(
                new MatchPlayerEntry("u1", 1, null, 1500.0, 80.0),
                new MatchPlayerEntry("u2", 2, null, 1400.0, 90.0)
        ));
    }

    private void storeHolds(MatchDocument... documents) {
        when(matchRepository.findByStartTimeWindow(WINDOW.start(), WINDOW.end())).thenReturn(List.of(documents));
    }

    @Test
    void mapsSidesOutcomesAndProfiles() {
        storeHolds(duel("m1", true, 1, false));

        MatchSnapshot snapshot = adapter.loadSnapshot(WINDOW);

        assertEquals(1, snapshot.getMatches().size());
        MatchRecord record = snapshot.getMatches().get(0);
        assertEquals("1v1", record.gameMode());
        PlayerResult anna = record.players().get(0);
        assertEquals("Anna", anna.playerName());
        assertEquals("de", anna.countryCode());
        assertEquals(1, anna.teamSide());
        assertEquals(Outcome.WIN, anna.outcome());
        assertEquals(1500.0, anna.skill());
        assertEquals(Outcome.LOSS, record.players().get(1).outcome());
    }

    @Test
    void unrankedMatchesAreIgnoredButMissingFlagCountsAsRanked() {
        storeHolds(duel("m1", false, 1, false), duel("m2", null, 2, false));

        MatchSnapshot snapshot = adapter.loadSnapshot(WINDOW);

        assertEquals(1, snapshot.getMatches().size());
        assertEquals("m2", snapshot.getMatches().get(0).matchId());
        assertEquals(0, snapshot.getSkippedRecords());
    }

    @Test
    void unrankedMatchesAreKeptWhenRankedOnlyIsOff() {
        properties.setRankedOnly(false);
        storeHolds(duel("m1", false, 1, false));

        assertEquals(1, adapter.loadSnapshot(WINDOW).getMatches().size());
    }

    @Test
    void matchWithoutWinnerIsRejected() {
        storeHolds(duel("m1", true, null, false), duel("m2", true, 1, false));

        MatchSnapshot snapshot = adapter.loadSnapshot(WINDOW);

        assertEquals(1, snapshot.getMatches().size());
        assertEquals(1, snapshot.getSkippedByReason().get(MatchStoreAdapter.NO_WINNER));
    }

    @Test
    void drawGivesEveryPlayerADraw() {
        storeHolds(duel("m1", true, null, true));

        MatchRecord record = adapter.loadSnapshot(WINDOW).getMatches().get(0);

        assertTrue(record.players().stream().allMatch(p -> p.outcome() == Outcome.DRAW));
    }

    @Test
    void playerWithoutTeamRejectsTheMatch() {
        MatchDocument broken = new MatchDocument("m1", "1v1", NOW.minusSeconds(60), true, 1, false, List.of(
                new MatchPlayerEntry("u1", 1, null, null, null),
                new MatchPlayerEntry("u2", null, null, null, null)
        ));
        storeHolds(broken);

        MatchSnapshot snapshot = adapter.loadSnapshot(WINDOW);

        assertTrue(snapshot.getMatches().isEmpty());
        assertEquals(1, snapshot.getSkippedByReason().get(MatchStoreAdapter.PLAYER_WITHOUT_TEAM));
    }

    @Test
    void unknownProfileFallsBackToGeneratedName() {
        MatchDocument document = new MatchDocument("m1", "1v1", NOW.minusSeconds(60), true, 2, false, List.of(
                new MatchPlayerEntry("u9", 1, null, null, null),
                new MatchPlayerEntry("u2", 2, null, null, null)
        ));
        storeHolds(document);

        PlayerResult unknown = adapter.loadSnapshot(WINDOW).getMatches().get(0).players().get(0);

        assertEquals("Player_u9", unknown.playerName());
        assertNull(unknown.countryCode());
    }
}
