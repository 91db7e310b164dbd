package com.nationrank.engine.team;

import java.util.List;
import java.util.Locale;

/**
 * Common view of party teams and community clusters.
 */
public interface DetectedTeam {

    String teamId();

    String name();

    TeamType type();

    List<TeamMember> members();

    TeamStats statsOverall();

    /**
     * True when a member id equals the query or a member name contains it, ignoring case.
     */
    default boolean hasMemberMatching(String query) {
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return members().stream().anyMatch(m ->
                m.playerId().equalsIgnoreCase(needle)
                        || (m.playerName() != null && m.playerName().toLowerCase(Locale.ROOT).contains(needle)));
    }
}
