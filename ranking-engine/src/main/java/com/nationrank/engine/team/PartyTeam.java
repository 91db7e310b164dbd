package com.nationrank.engine.team;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A roster that queued together under one party id.
 *
 * @param roster         sorted member ids
 * @param matches        matches played with exactly this roster
 * @param stabilityScore {@code matches} over every party instance containing any member
 * @param statsOverall   record of the exact-roster matches
 * @param members        members with their attendance across all party games of the group
 * @param commonLineups  most frequent lineups across those games
 */
public record PartyTeam(
        String teamId,
        String name,
        List<String> roster,
        int matches,
        double stabilityScore,
        TeamStats statsOverall,
        Map<String, TeamStats> statsByMode,
        List<TeamMember> members,
        List<Lineup> commonLineups
) implements DetectedTeam {

    @Override
    @JsonProperty("type")
    public TeamType type() {
        return TeamType.PARTY;
    }
}
