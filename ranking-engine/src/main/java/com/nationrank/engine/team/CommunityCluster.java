package com.nationrank.engine.team;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Cluster of the co-occurrence graph.
 *
 * @param density               edges among members over possible edges, within [0, 1]
 * @param avgConnectionStrength mean weight of the edges among members
 */
public record CommunityCluster(
        String teamId,
        String name,
        List<TeamMember> members,
        int edgeCount,
        double density,
        double avgConnectionStrength,
        TeamStats statsOverall,
        Map<String, TeamStats> statsByMode,
        List<Lineup> commonLineups
) implements DetectedTeam {

    @Override
    @JsonProperty("type")
    public TeamType type() {
        return TeamType.COMMUNITY;
    }

    @JsonProperty("size")
    public int size() {
        return members.size();
    }
}
