package com.nationrank.api.service;

import com.nationrank.api.config.RankingProperties;
import com.nationrank.api.exception.ResourceNotFoundException;
import com.nationrank.engine.EngineSettings;
import com.nationrank.engine.RankingEngine;
import com.nationrank.engine.RankingRun;
import com.nationrank.engine.SliceResult;
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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RankingServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-09T12:00:00Z");

    @Mock
    private MatchStoreAdapter matchStore;

    private RankingService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new RankingService(matchStore, new RankingEngine(EngineSettings.defaults(), clock),
                new RankingProperties(), clock);
    }

    private static MatchRecord duel(String id, String mode, int minute, String winnerCountry,
                                    String loserCountry, Outcome outcome) {
        Outcome other = outcome == Outcome.DRAW ? Outcome.DRAW : Outcome.LOSS;
        return new MatchRecord(id, mode, NOW.minus(Duration.ofHours(2)).plusSeconds(minute * 60L), List.of(
                new PlayerResult(winnerCountry + "-p", null, winnerCountry, null, 1, outcome),
                new PlayerResult(loserCountry + "-p", null, loserCountry, null, 2, other)
        ));
    }

    private static MatchSnapshot snapshot(boolean teamModeDecided) {
        List<MatchRecord> records = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            records.add(duel("d" + i, "1v1", i, "DE", "FR", Outcome.WIN));
        }
        records.add(duel("t1", "2v2", 10, "PL", "IT", teamModeDecided ? Outcome.WIN : Outcome.DRAW));
        return MatchSnapshot.of(TimeWindow.lastDays(NOW, 7), records);
    }

    @Test
    void defaultWindowIsTheConfiguredRollingWeek() {
        TimeWindow window = service.window(null);

        assertEquals(NOW, window.end());
        assertEquals(NOW.minus(Duration.ofDays(7)), window.start());
        assertEquals(NOW.minus(Duration.ofDays(30)), service.window(30).start());
    }

    @Test
    void failedModeKeepsThePreviouslyPublishedSlice() {
        when(matchStore.loadSnapshot(any())).thenReturn(snapshot(true), snapshot(false));

        RankingRun first = service.runAndPublish(null);
        assertTrue(first.slice("2v2").orElseThrow().isComplete());

        RankingRun second = service.runAndPublish(null);
        SliceResult team = second.slice("2v2").orElseThrow();
        assertTrue(team.isComplete());
        assertTrue(team.stale());
        assertEquals("PL", team.nationLeaderboard().nations().get(0).countryCode());
        assertFalse(second.slice("1v1").orElseThrow().stale());
        assertSame(second, service.getPublishedRun().orElseThrow());
    }

    @Test
    void nothingPublishedBeforeTheFirstRun() {
        assertTrue(service.getPublishedRun().isEmpty());
    }

    @Test
    void explainingAnAbsentNationIsNotFound() {
        when(matchStore.loadSnapshot(any())).thenReturn(snapshot(true));

        assertThrows(ResourceNotFoundException.class, () -> service.explainNationScore("1v1", "JP", null));
        verify(matchStore).loadSnapshot(service.window(null));
    }

    @Test
    void explainingAPresentNationReturnsItsTerms() {
        when(matchStore.loadSnapshot(any())).thenReturn(snapshot(true));

        var explanation = service.explainNationScore("1v1", "de", null);

        assertEquals("DE", explanation.countryCode());
        assertEquals(6, explanation.wins());
        assertEquals(0, explanation.losses());
    }
}
