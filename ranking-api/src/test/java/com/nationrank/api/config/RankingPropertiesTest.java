package com.nationrank.api.config;

import com.nationrank.engine.EngineSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RankingPropertiesTest {

    @Test
    void defaultsMatchTheEngineDefaults() {
        EngineSettings settings = new RankingProperties().toEngineSettings();
        EngineSettings defaults = EngineSettings.defaults();

        assertEquals(defaults.getPlayerMinGames(), settings.getPlayerMinGames());
        assertEquals(defaults.getPlayerLeaderboardSize(), settings.getPlayerLeaderboardSize());
        assertEquals(defaults.getMinRosterSize(), settings.getMinRosterSize());
        assertEquals(defaults.getMaxRosterSize(), settings.getMaxRosterSize());
        assertEquals(defaults.getCommunityMinEdgeWeight(), settings.getCommunityMinEdgeWeight());
        assertEquals(defaults.getCohesionMinFraction(), settings.getCohesionMinFraction());
    }

    @Test
    void codeListsAreCarriedOver() {
        RankingProperties properties = new RankingProperties();
        properties.setFactionCodes(List.of("EU"));
        properties.setKnownNationCodes(List.of("DE", "FR"));

        EngineSettings settings = properties.toEngineSettings();

        assertEquals(Set.of("EU"), settings.getFactionCodes());
        assertEquals(Set.of("DE", "FR"), settings.getKnownNationCodes());
    }

    @Test
    void inconsistentRosterBoundsAreRejected() {
        RankingProperties properties = new RankingProperties();
        properties.getTeams().setMinRosterSize(6);
        properties.getTeams().setMaxRosterSize(4);

        assertThrows(IllegalArgumentException.class, properties::toEngineSettings);
    }
}
